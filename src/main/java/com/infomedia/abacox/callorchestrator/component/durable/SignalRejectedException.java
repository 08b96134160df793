package com.infomedia.abacox.callorchestrator.component.durable;

/**
 * The workflow exists but no longer consumes signals.
 */
public class SignalRejectedException extends RuntimeException {
    public SignalRejectedException(String workflowId, String channel, String reason) {
        super(String.format("Signal '%s' rejected by workflow %s: %s", channel, workflowId, reason));
    }
}
