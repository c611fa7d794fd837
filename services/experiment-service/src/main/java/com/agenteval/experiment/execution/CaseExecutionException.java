package com.agenteval.experiment.execution;

public class CaseExecutionException extends Exception {

    public CaseExecutionException(String message) {
        super(message);
    }

    public CaseExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
