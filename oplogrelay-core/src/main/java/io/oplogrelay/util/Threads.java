/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.util;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities related to threads and threading.
 */
public class Threads {

    private static final String THREAD_NAME_PREFIX = "oplogrelay-";
    private static final Logger LOGGER = LoggerFactory.getLogger(Threads.class);

    /**
     * Returns a thread factory that creates threads conforming to the thread naming
     * pattern {@code oplogrelay-<component class>-<component-id>-<thread-name>}.
     *
     * @param component - the class of the component owning the threads
     * @param componentId - the identifier to differentiate between component instances
     * @param name - the name of the thread
     * @param indexed - true if the thread name should be appended with an index
     * @param daemon - true if the thread should be a daemon thread
     * @return the thread factory setting the correct name
     */
    public static ThreadFactory threadFactory(Class<?> component, String componentId, String name, boolean indexed, boolean daemon) {
        LOGGER.debug("Requested thread factory for component {}, id = {} named = {}", component.getSimpleName(), componentId, name);

        return new ThreadFactory() {
            private final AtomicInteger index = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                StringBuilder threadName = new StringBuilder(THREAD_NAME_PREFIX)
                        .append(component.getSimpleName().toLowerCase())
                        .append('-')
                        .append(componentId)
                        .append('-')
                        .append(name);
                if (indexed) {
                    threadName.append('-').append(index.getAndIncrement());
                }
                LOGGER.info("Creating thread {}", threadName);
                final Thread t = new Thread(r, threadName.toString());
                t.setDaemon(daemon);
                return t;
            }
        };
    }

    public static ScheduledExecutorService newSingleThreadScheduledExecutor(Class<?> component, String componentId, String name, boolean daemon) {
        return Executors.newSingleThreadScheduledExecutor(threadFactory(component, componentId, name, false, daemon));
    }

    private Threads() {
    }
}
