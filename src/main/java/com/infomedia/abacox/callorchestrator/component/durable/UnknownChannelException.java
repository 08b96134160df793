package com.infomedia.abacox.callorchestrator.component.durable;

public class UnknownChannelException extends RuntimeException {
    public UnknownChannelException(String workflowType, String channel) {
        super(String.format("Workflow type '%s' declares no channel named '%s'", workflowType, channel));
    }
}
