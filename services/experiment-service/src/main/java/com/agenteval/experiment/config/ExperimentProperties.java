package com.agenteval.experiment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "experiment")
public class ExperimentProperties {

    private int caseTimeoutSeconds = 120;
    private int caseExecutionThreads = 4;
    private ExecutorMode executorMode = ExecutorMode.REPLAY;
    private String agentRuntimeBaseUrl = "http://localhost:8090";
    private int errorMessageMaxLength = 400;
    private Judge judge = new Judge();
    private Supervisor supervisor = new Supervisor();

    public enum ExecutorMode {
        REPLAY,
        REMOTE
    }

    public int getCaseTimeoutSeconds() {
        return caseTimeoutSeconds;
    }

    public void setCaseTimeoutSeconds(int caseTimeoutSeconds) {
        this.caseTimeoutSeconds = caseTimeoutSeconds;
    }

    public int getCaseExecutionThreads() {
        return caseExecutionThreads;
    }

    public void setCaseExecutionThreads(int caseExecutionThreads) {
        this.caseExecutionThreads = caseExecutionThreads;
    }

    public ExecutorMode getExecutorMode() {
        return executorMode;
    }

    public void setExecutorMode(ExecutorMode executorMode) {
        this.executorMode = executorMode;
    }

    public String getAgentRuntimeBaseUrl() {
        return agentRuntimeBaseUrl;
    }

    public void setAgentRuntimeBaseUrl(String agentRuntimeBaseUrl) {
        this.agentRuntimeBaseUrl = agentRuntimeBaseUrl;
    }

    public int getErrorMessageMaxLength() {
        return errorMessageMaxLength;
    }

    public void setErrorMessageMaxLength(int errorMessageMaxLength) {
        this.errorMessageMaxLength = errorMessageMaxLength;
    }

    public Judge getJudge() {
        return judge;
    }

    public void setJudge(Judge judge) {
        this.judge = judge;
    }

    public Supervisor getSupervisor() {
        return supervisor;
    }

    public void setSupervisor(Supervisor supervisor) {
        this.supervisor = supervisor;
    }

    public static class Judge {

        private boolean enabled = true;
        private String defaultBaseUrl = "https://api.openai.com/v1";
        private String defaultModel = "gpt-4.1-mini";
        private String apiKey = "";
        private int connectTimeoutMs = 15_000;
        private int readTimeoutMs = 90_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDefaultBaseUrl() {
            return defaultBaseUrl;
        }

        public void setDefaultBaseUrl(String defaultBaseUrl) {
            this.defaultBaseUrl = defaultBaseUrl;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    public static class Supervisor {

        private boolean enabled = false;
        private long fixedDelayMs = 300_000;
        private long staleAfterMinutes = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFixedDelayMs() {
            return fixedDelayMs;
        }

        public void setFixedDelayMs(long fixedDelayMs) {
            this.fixedDelayMs = fixedDelayMs;
        }

        public long getStaleAfterMinutes() {
            return staleAfterMinutes;
        }

        public void setStaleAfterMinutes(long staleAfterMinutes) {
            this.staleAfterMinutes = staleAfterMinutes;
        }
    }
}
