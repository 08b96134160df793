package com.infomedia.abacox.callorchestrator.component.durable;

import com.infomedia.abacox.callorchestrator.component.activity.ActivityCall;

import java.time.Instant;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The durable runtime as seen from a running workflow.
 */
public interface WorkflowContext {

    String getWorkflowId();

    /**
     * Persisted start time of the execution. Stable across replays.
     */
    Instant getStartedAt();

    /**
     * True while the workflow is re-executing from its journal.
     */
    boolean isReplaying();

    /**
     * Registers the handler for a signal channel declared by the workflow's registration.
     * Handlers run on the workflow thread, one at a time, while the workflow waits in
     * {@link #awaitUntil(Instant, BooleanSupplier)}.
     */
    <P> void onSignal(SignalChannel<P> channel, Consumer<P> handler);

    /**
     * Registers the handler for a query channel. Handlers are called from request threads
     * and must only read state the workflow publishes atomically.
     */
    <T> void onQuery(QueryChannel<T> channel, Supplier<T> handler);

    /**
     * Runs an activity, or returns its journaled outcome when replaying.
     *
     * @throws com.infomedia.abacox.callorchestrator.component.activity.ActivityFailureException
     *         when the activity failed for good
     */
    <T> T execute(ActivityCall<T> call);

    /**
     * Handles incoming signals until the condition holds or the deadline passes.
     *
     * @param deadline absolute deadline, or {@code null} to wait without limit
     * @return {@code true} if the condition was satisfied, {@code false} on timeout
     */
    boolean awaitUntil(Instant deadline, BooleanSupplier condition);
}
