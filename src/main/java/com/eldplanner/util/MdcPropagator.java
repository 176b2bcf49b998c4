package com.eldplanner.util;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries SLF4J MDC context across thread hand-offs.
 *
 * MDC is thread-local, so work submitted to an executor would otherwise log
 * without the submitting request's trip id.
 */
public final class MdcPropagator {

    public static final String TRIP_ID_KEY = "tripId";

    private MdcPropagator() {
        // Utility class - prevent instantiation
    }

    /**
     * Wraps a Callable so that it runs with the MDC context captured now and
     * restores the worker's previous context afterwards.
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(context);
            try {
                return task.call();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        } else {
            MDC.clear();
        }
    }
}
