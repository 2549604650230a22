package io.reactiveactions.spring.webmvc.starter;

import io.reactiveactions.dispatch.ControllerDispatcher;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the Reactive Actions dispatcher.
 *
 * <p>Configure via application properties:
 * <pre>
 * reactive-actions.timeout=10s
 * reactive-actions.worker-threads=16
 * reactive-actions.thread-name-prefix=actions
 * reactive-actions.empty-status=204
 * </pre>
 */
@ConfigurationProperties("reactive-actions")
public class ReactiveActionsProperties {

    /**
     * Dispatch timeout; 0 disables it.
     */
    private Duration timeout = ControllerDispatcher.DEFAULT_TIMEOUT;

    /**
     * Worker pool size; 0 or less means twice the available processors.
     */
    private int workerThreads;

    private String threadNamePrefix = ControllerDispatcher.DEFAULT_THREAD_NAME_PREFIX;

    /**
     * Status answered when an action's producer completes empty.
     */
    private int emptyStatus = 404;

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public int getEmptyStatus() {
        return emptyStatus;
    }

    public void setEmptyStatus(int emptyStatus) {
        this.emptyStatus = emptyStatus;
    }
}
