package com.infomedia.abacox.callorchestrator.component.postcall;

/**
 * Entry point of the post-call recovery loop.
 */
public interface PostCallJobScheduler {

    /**
     * Persists a PENDING job for the call unless one already exists.
     *
     * @return id of the new or existing job
     */
    Long enqueue(String callId, String leadId, String tenantId);
}
