package com.agentmesh.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to registered listeners on the publishing thread.
 * A failing listener is logged and skipped.
 */
public class WorkflowEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventPublisher.class);

    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(WorkflowEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WorkflowEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(WorkflowEvent event) {
        for (WorkflowEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {} for workflow {}", event.type(), event.workflowId(), e);
            }
        }
    }
}
