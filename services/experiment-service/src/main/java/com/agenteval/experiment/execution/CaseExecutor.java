package com.agenteval.experiment.execution;

import com.agenteval.experiment.domain.DataItemInput;
import com.agenteval.experiment.domain.ExperimentContext;

/**
 * Runs one data item against the experiment's agent. Implementations are isolated per data item
 * and must not touch the experiment's persistence; they may be called from a worker thread.
 */
public interface CaseExecutor {

    /**
     * @throws CaseExecutionException when the agent run itself fails; recorded on the run case
     */
    CaseExecution execute(ExperimentContext context, DataItemInput item) throws CaseExecutionException;
}
