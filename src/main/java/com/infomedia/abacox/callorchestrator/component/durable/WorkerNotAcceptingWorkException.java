package com.infomedia.abacox.callorchestrator.component.durable;

public class WorkerNotAcceptingWorkException extends RuntimeException {
    public WorkerNotAcceptingWorkException() {
        super("Worker is not accepting new work");
    }
}
