package com.agenteval.experiment.exception;

/**
 * Precondition failure of an orchestration call. Thrown before any write, so the caller
 * can surface it verbatim.
 */
public class ExperimentException extends RuntimeException {

    private final ExperimentErrorCode code;

    public ExperimentException(ExperimentErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static ExperimentException notFound(long experimentId) {
        return new ExperimentException(ExperimentErrorCode.NOT_FOUND, "Experiment not found: " + experimentId);
    }

    public static ExperimentException alreadyRunning(long experimentId) {
        return new ExperimentException(
            ExperimentErrorCode.ALREADY_RUNNING,
            "Experiment " + experimentId + " already started; use retry failed."
        );
    }

    public static ExperimentException noEvaluators(long experimentId) {
        return new ExperimentException(
            ExperimentErrorCode.NO_EVALUATORS,
            "Experiment " + experimentId + " has no evaluators"
        );
    }

    public static ExperimentException notRunning(long experimentId) {
        return new ExperimentException(
            ExperimentErrorCode.NOT_RUNNING,
            "Experiment " + experimentId + " is not running"
        );
    }

    public ExperimentErrorCode getCode() {
        return code;
    }
}
