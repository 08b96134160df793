package com.infomedia.abacox.callorchestrator.component.durable;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Binds a workflow type name to its body and the channels it declares.
 */
@Getter
@Builder
public class WorkflowRegistration<I, R> {

    private final String type;
    private final Class<I> inputType;
    private final Class<R> resultType;
    @Singular
    private final List<SignalChannel<?>> signalChannels;
    @Singular
    private final List<QueryChannel<?>> queryChannels;
    private final Supplier<WorkflowDefinition<I, R>> factory;

    public Optional<SignalChannel<?>> findSignalChannel(String name) {
        return signalChannels.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public Optional<QueryChannel<?>> findQueryChannel(String name) {
        return queryChannels.stream().filter(c -> c.getName().equals(name)).findFirst();
    }
}
