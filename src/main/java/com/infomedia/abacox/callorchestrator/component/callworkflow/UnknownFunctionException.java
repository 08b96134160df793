package com.infomedia.abacox.callorchestrator.component.callworkflow;

import lombok.Getter;

/**
 * Thrown for a function call the dispatcher has no command for. Fails that event only.
 */
@Getter
public class UnknownFunctionException extends RuntimeException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
        this.functionName = functionName;
    }
}
