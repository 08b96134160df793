package com.infomedia.abacox.callorchestrator.component.durable;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbox entry of a workflow actor.
 */
record WorkflowMessage(Kind kind, String channel, JsonNode payload) {

    enum Kind {SIGNAL, STOP}

    static WorkflowMessage signal(String channel, JsonNode payload) {
        return new WorkflowMessage(Kind.SIGNAL, channel, payload);
    }

    static WorkflowMessage stop() {
        return new WorkflowMessage(Kind.STOP, null, null);
    }

    boolean isStop() {
        return kind == Kind.STOP;
    }
}
