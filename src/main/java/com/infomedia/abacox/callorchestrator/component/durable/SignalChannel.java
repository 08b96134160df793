package com.infomedia.abacox.callorchestrator.component.durable;

import java.util.Objects;

/**
 * Typed name of an asynchronous input of a workflow.
 *
 * @param <P> payload type delivered to the handler
 */
public final class SignalChannel<P> {

    private final String name;
    private final Class<P> payloadType;

    private SignalChannel(String name, Class<P> payloadType) {
        this.name = Objects.requireNonNull(name, "name");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    public static <P> SignalChannel<P> of(String name, Class<P> payloadType) {
        return new SignalChannel<>(name, payloadType);
    }

    public String getName() {
        return name;
    }

    public Class<P> getPayloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalChannel<?> other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "signal:" + name;
    }
}
