package com.agenteval.experiment.exception;

import org.springframework.http.HttpStatus;

public enum ExperimentErrorCode {
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    ALREADY_RUNNING("already_running", HttpStatus.CONFLICT),
    NO_EVALUATORS("no_evaluators", HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_RUNNING("not_running", HttpStatus.CONFLICT);

    private final String error;
    private final HttpStatus httpStatus;

    ExperimentErrorCode(String error, HttpStatus httpStatus) {
        this.error = error;
        this.httpStatus = httpStatus;
    }

    public String error() {
        return error;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
