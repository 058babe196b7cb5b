package com.agentmesh.engine.event;

@FunctionalInterface
public interface WorkflowEventListener {

    void onEvent(WorkflowEvent event);
}
