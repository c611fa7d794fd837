package com.agenteval.experiment.support;

import com.agenteval.experiment.domain.DataItemInput;
import com.agenteval.experiment.domain.ExperimentContext;
import com.agenteval.experiment.execution.CaseExecution;
import com.agenteval.experiment.execution.CaseExecutionException;
import com.agenteval.experiment.execution.CaseExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Deterministic executor: inputs listed in {@link #failing} fail, inputs in {@link #hanging}
 * block until interrupted, everything else succeeds after the optional {@link #delayMillis}.
 */
public class FakeCaseExecutor implements CaseExecutor {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Set<String> hanging = ConcurrentHashMap.newKeySet();
    private final AtomicInteger executions = new AtomicInteger();
    private volatile Consumer<ExperimentContext> onExecute = ctx -> { };
    private volatile long delayMillis;

    @Override
    public CaseExecution execute(ExperimentContext context, DataItemInput item) throws CaseExecutionException {
        executions.incrementAndGet();
        onExecute.accept(context);
        if (failing.contains(item.userInput())) {
            throw new CaseExecutionException("agent crashed on " + item.userInput());
        }
        if (hanging.contains(item.userInput())) {
            pause(30_000);
        }
        if (delayMillis > 0) {
            pause(delayMillis);
        }
        ArrayNode trajectory = mapper.createArrayNode();
        trajectory.addObject().put("tool", "search").put("query", item.userInput());
        trajectory.addObject().put("tool", "answer");
        return new CaseExecution(
                trajectory,
                mapper.createObjectNode().put("answer", "done: " + item.userInput()),
                12,
                34,
                "agent=" + context.agentKey() + "; mode=fake"
        );
    }

    private static void pause(long millis) throws CaseExecutionException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaseExecutionException("interrupted", e);
        }
    }

    public void failOn(String userInput) {
        failing.add(userInput);
    }

    public void hangOn(String userInput) {
        hanging.add(userInput);
    }

    public void delayAll(long millis) {
        this.delayMillis = millis;
    }

    public void onExecute(Consumer<ExperimentContext> hook) {
        this.onExecute = hook;
    }

    public int executions() {
        return executions.get();
    }

    public void reset() {
        failing.clear();
        hanging.clear();
        executions.set(0);
        onExecute = ctx -> { };
        delayMillis = 0;
    }
}
