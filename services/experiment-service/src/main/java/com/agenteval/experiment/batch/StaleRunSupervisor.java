package com.agenteval.experiment.batch;

import com.agenteval.experiment.config.ExperimentProperties;
import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentStatus;
import com.agenteval.experiment.exception.ExperimentException;
import com.agenteval.experiment.repository.ExperimentRepository;
import com.agenteval.experiment.service.ExperimentOrchestratorService;
import com.agenteval.experiment.service.RunCancellationRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails experiments left in {@code RUNNING} by an orchestrating process that died.
 * Runs still executing in this process are skipped.
 */
@Component
public class StaleRunSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaleRunSupervisor.class);

    private final ExperimentProperties properties;
    private final ExperimentRepository experimentRepository;
    private final ExperimentOrchestratorService orchestratorService;
    private final RunCancellationRegistry cancellationRegistry;
    private final Clock clock;

    public StaleRunSupervisor(
        ExperimentProperties properties,
        ExperimentRepository experimentRepository,
        ExperimentOrchestratorService orchestratorService,
        RunCancellationRegistry cancellationRegistry,
        Clock clock
    ) {
        this.properties = properties;
        this.experimentRepository = experimentRepository;
        this.orchestratorService = orchestratorService;
        this.cancellationRegistry = cancellationRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${experiment.supervisor.fixed-delay-ms:300000}")
    public void failStaleRuns() {
        if (!properties.getSupervisor().isEnabled()) {
            return;
        }
        sweep();
    }

    /**
     * @return number of experiments marked failed
     */
    public int sweep() {
        long staleAfterMinutes = properties.getSupervisor().getStaleAfterMinutes();
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(staleAfterMinutes));
        List<ExperimentEntity> stale = experimentRepository.findByStatusAndStartedAtBeforeAndDeletedAtIsNull(
            ExperimentStatus.RUNNING,
            cutoff
        );

        int marked = 0;
        for (ExperimentEntity experiment : stale) {
            if (cancellationRegistry.isInFlight(experiment.getId())) {
                continue;
            }
            try {
                orchestratorService.markExperimentFailed(
                    experiment.getId(),
                    "Run exceeded " + staleAfterMinutes + " minutes without completing"
                );
                marked++;
            } catch (ExperimentException ex) {
                LOGGER.warn("Skipping stale experiment {}: {}", experiment.getId(), ex.getMessage());
            }
        }
        if (marked > 0) {
            LOGGER.info("Marked {} stale experiments as failed", marked);
        }
        return marked;
    }
}
