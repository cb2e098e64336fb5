package com.phillippitts.council.service.events;

/**
 * Observer of one pipeline run. Called synchronously on the thread that reaches the
 * checkpoint; implementations should hand off slow work.
 */
@FunctionalInterface
public interface LifecycleListener {

    LifecycleListener NOOP = event -> { };

    void onEvent(LifecycleEvent event);
}
