package com.infomedia.abacox.callorchestrator.component.durable;

/**
 * Deterministic workflow body. It may only interact with the outside world through the
 * {@link WorkflowContext}: activities, signal and query handlers, and timed waits.
 *
 * @param <I> input type
 * @param <R> result type
 */
@FunctionalInterface
public interface WorkflowDefinition<I, R> {

    R run(WorkflowContext context, I input);
}
