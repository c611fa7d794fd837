package com.agenteval.experiment.support;

import com.agenteval.experiment.domain.AgentEntity;
import com.agenteval.experiment.domain.DataItemEntity;
import com.agenteval.experiment.domain.DatasetEntity;
import com.agenteval.experiment.domain.EvaluatorEntity;
import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentEvaluatorEntity;
import com.agenteval.experiment.repository.AgentRepository;
import com.agenteval.experiment.repository.DataItemRepository;
import com.agenteval.experiment.repository.DatasetRepository;
import com.agenteval.experiment.repository.EvaluateResultRepository;
import com.agenteval.experiment.repository.EvaluatorRepository;
import com.agenteval.experiment.repository.ExperimentEvaluatorRepository;
import com.agenteval.experiment.repository.ExperimentRepository;
import com.agenteval.experiment.repository.RunCaseRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

/**
 * Full application context on in-memory H2 with fake executor and scorer. Tests are not
 * transactional: each orchestration call commits, as it does in production.
 */
@SpringBootTest
@Import(FakeCapabilitiesConfig.class)
public abstract class ExperimentTestBase {

    @Autowired
    protected ExperimentRepository experimentRepository;
    @Autowired
    protected DatasetRepository datasetRepository;
    @Autowired
    protected AgentRepository agentRepository;
    @Autowired
    protected DataItemRepository dataItemRepository;
    @Autowired
    protected EvaluatorRepository evaluatorRepository;
    @Autowired
    protected ExperimentEvaluatorRepository experimentEvaluatorRepository;
    @Autowired
    protected RunCaseRepository runCaseRepository;
    @Autowired
    protected EvaluateResultRepository evaluateResultRepository;
    @Autowired
    protected FakeCaseExecutor fakeExecutor;
    @Autowired
    protected FakeScoringClient fakeScoring;

    @BeforeEach
    void cleanDatabase() {
        evaluateResultRepository.deleteAll();
        runCaseRepository.deleteAll();
        experimentEvaluatorRepository.deleteAll();
        experimentRepository.deleteAll();
        dataItemRepository.deleteAll();
        evaluatorRepository.deleteAll();
        agentRepository.deleteAll();
        datasetRepository.deleteAll();
        fakeExecutor.reset();
        fakeScoring.reset();
    }

    /**
     * Experiment over a dataset with one item per user input, bound to the given evaluator keys.
     */
    protected ExperimentEntity givenExperiment(List<String> userInputs, List<String> evaluatorKeys) {
        DatasetEntity dataset = datasetRepository.save(DatasetEntity.of("regression-set", "nightly regression"));
        AgentEntity agent = agentRepository.save(AgentEntity.of("Web agent", "web-agent", "1.0.0", "registry/web-agent:1.0.0"));
        for (String input : userInputs) {
            dataItemRepository.save(DataItemEntity.of(
                    dataset.getId(),
                    input,
                    "[{\"tool\":\"search\"}]",
                    "{\"answer\":\"" + input + "\"}"
            ));
        }
        ExperimentEntity experiment = experimentRepository.save(
                ExperimentEntity.create("exp-" + System.nanoTime(), dataset.getId(), agent.getId())
        );
        for (String key : evaluatorKeys) {
            EvaluatorEntity evaluator = evaluatorRepository.save(EvaluatorEntity.of(key, key, "Score {{agent_output}}"));
            experimentEvaluatorRepository.save(ExperimentEvaluatorEntity.of(experiment.getId(), evaluator.getId()));
        }
        return experiment;
    }

    protected ExperimentEntity reload(ExperimentEntity experiment) {
        return experimentRepository.findById(experiment.getId()).orElseThrow();
    }
}
