package com.phillippitts.council.testutil;

import com.phillippitts.council.service.events.LifecycleEvent;
import com.phillippitts.council.service.events.LifecycleEventType;
import com.phillippitts.council.service.events.LifecycleListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every lifecycle event of a run in delivery order.
 */
public class RecordingLifecycleListener implements LifecycleListener {

    private final List<LifecycleEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(LifecycleEvent event) {
        events.add(event);
    }

    public List<LifecycleEvent> events() {
        return List.copyOf(events);
    }

    public List<LifecycleEventType> types() {
        return events.stream().map(LifecycleEvent::type).toList();
    }

    public List<LifecycleEvent> ofType(LifecycleEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public LifecycleEvent last() {
        return events.get(events.size() - 1);
    }
}
