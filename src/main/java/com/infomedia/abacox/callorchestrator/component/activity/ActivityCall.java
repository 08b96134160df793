package com.infomedia.abacox.callorchestrator.component.activity;

import lombok.Getter;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named, not yet executed activity invocation. Workflows hand it to their context so the
 * outcome can be journaled or answered from the journal; everything else calls
 * {@link #invoke()} directly.
 *
 * @param <T> result type, {@link Void} for activities without a result
 */
@Getter
public class ActivityCall<T> {

    private final String name;
    private final Class<T> resultType;
    private final Supplier<T> invocation;

    public ActivityCall(String name, Class<T> resultType, Supplier<T> invocation) {
        this.name = Objects.requireNonNull(name, "name");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.invocation = Objects.requireNonNull(invocation, "invocation");
    }

    public T invoke() {
        return invocation.get();
    }

    @Override
    public String toString() {
        return "ActivityCall[" + name + "]";
    }
}
