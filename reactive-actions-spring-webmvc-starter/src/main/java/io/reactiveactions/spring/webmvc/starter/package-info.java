/**
 * Spring Boot auto-configuration for Reactive Actions on servlet-based Spring WebMVC applications.
 */
package io.reactiveactions.spring.webmvc.starter;
