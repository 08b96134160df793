package com.infomedia.abacox.callorchestrator.component.durable;

import java.util.Objects;

/**
 * Typed name of a synchronous, side-effect-free read of a workflow.
 *
 * @param <T> result type
 */
public final class QueryChannel<T> {

    private final String name;
    private final Class<T> resultType;

    private QueryChannel(String name, Class<T> resultType) {
        this.name = Objects.requireNonNull(name, "name");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
    }

    public static <T> QueryChannel<T> of(String name, Class<T> resultType) {
        return new QueryChannel<>(name, resultType);
    }

    public String getName() {
        return name;
    }

    public Class<T> getResultType() {
        return resultType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryChannel<?> other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "query:" + name;
    }
}
