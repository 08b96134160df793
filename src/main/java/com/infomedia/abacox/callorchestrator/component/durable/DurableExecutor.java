package com.infomedia.abacox.callorchestrator.component.durable;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs workflows whose state survives process restarts.
 */
public interface DurableExecutor {

    void register(WorkflowRegistration<?, ?> registration);

    /**
     * Persists a new execution and starts running it.
     *
     * @throws WorkflowAlreadyStartedException if the id is taken
     * @throws UnknownWorkflowTypeException    if no registration exists for the type
     * @throws WorkerNotAcceptingWorkException while the worker is stopped or stopping
     */
    WorkflowDescription start(String workflowType, String workflowId, Object input);

    /**
     * Journals a signal and hands it to the workflow.
     *
     * @throws WorkflowNotFoundException  if no execution exists
     * @throws UnknownChannelException    if the workflow type declares no such channel
     * @throws SignalRejectedException    if the execution is closed
     * @throws IllegalArgumentException   if the payload does not fit the channel type
     */
    void signal(String workflowId, String channel, Object payload);

    Object query(String workflowId, String channel);

    default <T> T query(String workflowId, QueryChannel<T> channel) {
        return channel.getResultType().cast(query(workflowId, channel.getName()));
    }

    /**
     * Waits for the execution to close.
     *
     * @return the result, or empty if the execution is still running when the timeout elapses
     * @throws WorkflowFailedException if the execution closed as failed
     */
    <R> Optional<R> awaitResult(String workflowId, Class<R> resultType, Duration timeout);

    WorkflowDescription describe(String workflowId);
}
