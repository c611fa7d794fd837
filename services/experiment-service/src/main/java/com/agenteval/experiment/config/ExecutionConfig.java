package com.agenteval.experiment.config;

import com.agenteval.experiment.execution.CaseExecutor;
import com.agenteval.experiment.execution.RemoteAgentCaseExecutor;
import com.agenteval.experiment.execution.ReplayCaseExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ExecutionConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    CaseExecutor caseExecutor(
        ExperimentProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("agentRuntimeRestClient") RestClient agentRuntimeRestClient
    ) {
        if (properties.getExecutorMode() == ExperimentProperties.ExecutorMode.REMOTE) {
            return new RemoteAgentCaseExecutor(agentRuntimeRestClient, objectMapper);
        }
        return new ReplayCaseExecutor(objectMapper);
    }

    /**
     * Hands every case its own thread immediately; the configured thread count is only kept warm.
     * Cases never queue, so the per-case timeout covers execution time alone.
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("caseExecutionPool")
    ExecutorService caseExecutionPool(ExperimentProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "case-exec-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
            Math.max(1, properties.getCaseExecutionThreads()),
            Integer.MAX_VALUE,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            threadFactory
        );
    }
}
