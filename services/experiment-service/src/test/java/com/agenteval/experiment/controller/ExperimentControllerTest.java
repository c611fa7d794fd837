package com.agenteval.experiment.controller;

import com.agenteval.experiment.domain.EvaluateResultEntity;
import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentStatus;
import com.agenteval.experiment.domain.RunCaseEntity;
import com.agenteval.experiment.domain.RunCaseStatus;
import com.agenteval.experiment.domain.RunSummary;
import com.agenteval.experiment.domain.StatusCounts;
import com.agenteval.experiment.exception.ExperimentException;
import com.agenteval.experiment.service.ExperimentOrchestratorService;
import com.agenteval.experiment.service.ExperimentQueryService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ExperimentControllerTest {

    private ExperimentOrchestratorService orchestrator;
    private ExperimentQueryService queries;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = Mockito.mock(ExperimentOrchestratorService.class);
        queries = Mockito.mock(ExperimentQueryService.class);

        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mvc = MockMvcBuilders
                .standaloneSetup(new ExperimentController(orchestrator, queries))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    @Test
    void run_returnsSummary_andPassesActorHeader() throws Exception {
        when(orchestrator.startExperiment(5L, "carol"))
                .thenReturn(new RunSummary(5L, 3, ExperimentStatus.PARTIAL_FAILED));

        mvc.perform(post("/v1/experiments/5/run").header("X-Actor", "carol"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.experimentId", is(5)))
                .andExpect(jsonPath("$.caseCount", is(3)))
                .andExpect(jsonPath("$.status", is("PARTIAL_FAILED")));

        verify(orchestrator).startExperiment(5L, "carol");
    }

    @Test
    void run_alreadyStarted_mapsToConflict() throws Exception {
        when(orchestrator.startExperiment(anyLong(), anyString()))
                .thenThrow(ExperimentException.alreadyRunning(5L));

        mvc.perform(post("/v1/experiments/5/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("already_running")))
                .andExpect(jsonPath("$.message", containsString("retry failed")));
    }

    @Test
    void retryFailed_withoutEvaluators_mapsToUnprocessable() throws Exception {
        when(orchestrator.retryFailed(7L, "api")).thenThrow(ExperimentException.noEvaluators(7L));

        mvc.perform(post("/v1/experiments/7/retry-failed"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", is("no_evaluators")));
    }

    @Test
    void terminate_notRunning_mapsToConflict() throws Exception {
        doThrow(ExperimentException.notRunning(9L)).when(orchestrator).terminate(9L, "api");

        mvc.perform(post("/v1/experiments/9/terminate"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("not_running")));
    }

    @Test
    void terminate_accepted() throws Exception {
        mvc.perform(post("/v1/experiments/9/terminate"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.experimentId", is(9)));

        verify(orchestrator).terminate(9L, "api");
    }

    @Test
    void markFailed_blankReason_isValidationError() throws Exception {
        mvc.perform(post("/v1/experiments/4/mark-failed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("validation_error")));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void markFailed_returnsFailedCaseCount() throws Exception {
        when(orchestrator.markExperimentFailed(4L, "worker lost")).thenReturn(2);

        mvc.perform(post("/v1/experiments/4/mark-failed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"worker lost\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failedCases", is(2)));
    }

    @Test
    void get_unknownExperiment_isNotFound() throws Exception {
        when(queries.getExperiment(1L)).thenReturn(Optional.empty());

        mvc.perform(get("/v1/experiments/1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("not_found")));
    }

    @Test
    void get_returnsStatusAndLatestCounts() throws Exception {
        ExperimentEntity experiment = mock(ExperimentEntity.class);
        when(experiment.getId()).thenReturn(2L);
        when(experiment.getName()).thenReturn("nightly");
        when(experiment.getStatus()).thenReturn(ExperimentStatus.FINISHED);
        when(experiment.isRunLocked()).thenReturn(true);
        when(experiment.getFinishedAt()).thenReturn(Instant.parse("2026-01-02T03:04:05Z"));
        when(queries.getExperiment(2L)).thenReturn(Optional.of(experiment));
        when(queries.getLatestCounts(2L)).thenReturn(new StatusCounts(3, 0, 0, 3, 0));

        mvc.perform(get("/v1/experiments/2").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("FINISHED")))
                .andExpect(jsonPath("$.runLocked", is(true)))
                .andExpect(jsonPath("$.finishedAt", is("2026-01-02T03:04:05Z")))
                .andExpect(jsonPath("$.latestCases.total", is(3)))
                .andExpect(jsonPath("$.latestCases.success", is(3)));
    }

    @Test
    void runCases_includeScoresPerCase() throws Exception {
        ExperimentEntity experiment = mock(ExperimentEntity.class);
        RunCaseEntity runCase = mock(RunCaseEntity.class);
        when(runCase.getId()).thenReturn(30L);
        when(runCase.getDataItemId()).thenReturn(300L);
        when(runCase.getAttemptNo()).thenReturn(2);
        when(runCase.isLatest()).thenReturn(true);
        when(runCase.getStatus()).thenReturn(RunCaseStatus.SUCCESS);
        when(runCase.getFinalScore()).thenReturn(0.75);
        EvaluateResultEntity result = EvaluateResultEntity.of(30L, 8L, "task_success", 1.0, "looks complete", "{}");

        when(queries.getExperiment(2L)).thenReturn(Optional.of(experiment));
        when(queries.getRunCases(2L, false)).thenReturn(List.of(runCase));
        when(queries.getResultsByRunCase(List.of(runCase))).thenReturn(Map.of(30L, List.of(result)));

        mvc.perform(get("/v1/experiments/2/run-cases").param("latestOnly", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].attemptNo", is(2)))
                .andExpect(jsonPath("$[0].latest", is(true)))
                .andExpect(jsonPath("$[0].finalScore", is(0.75)))
                .andExpect(jsonPath("$[0].scores[0].evaluatorKey", is("task_success")))
                .andExpect(jsonPath("$[0].scores[0].score", is(1.0)));
    }
}
