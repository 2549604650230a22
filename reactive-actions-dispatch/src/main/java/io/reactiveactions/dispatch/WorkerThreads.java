package io.reactiveactions.dispatch;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class WorkerThreads {
    private WorkerThreads() {
    }

    static ExecutorService newExecutor(String namePrefix, int threads) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (threads <= 0) throw new IllegalArgumentException("threads must be positive");
        return Executors.newFixedThreadPool(threads, new NamedThreadFactory(namePrefix));
    }

    static Scheduler schedulerFor(ExecutorService executor, String namePrefix) {
        return Schedulers.fromExecutorService(executor, namePrefix);
    }

    static int defaultThreadCount() {
        return Math.max(2, Runtime.getRuntime().availableProcessors() * 2);
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
