/**
 * Jakarta Servlet host adapter: async exchanges, response writing and a single-action servlet.
 */
package io.reactiveactions.servlet;
