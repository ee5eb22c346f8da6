package com.apisite.checker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "checker")
public class CheckerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    private static final String DEFAULT_CONFIG_PATH = "config.json";

    private String configPath = DEFAULT_CONFIG_PATH;
    private String userAgent;
    private int requestTimeoutSeconds = 10;
    private int maxAttempts = 3;
    private int retryDelayMs = 1000;
    private int workerConcurrency = 20;
    private TrustPolicy trustPolicy = TrustPolicy.TRUST_ALL;
    private String reportPath = "";
    private Cli cli = new Cli();

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = (configPath == null || configPath.isBlank()) ? DEFAULT_CONFIG_PATH : configPath.trim();
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public int getRetryDelayMs() {
        return Math.max(0, retryDelayMs);
    }

    public void setRetryDelayMs(int retryDelayMs) {
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    public int getWorkerConcurrency() {
        return Math.max(1, workerConcurrency);
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = Math.max(1, workerConcurrency);
    }

    public TrustPolicy getTrustPolicy() {
        return trustPolicy == null ? TrustPolicy.TRUST_ALL : trustPolicy;
    }

    public void setTrustPolicy(TrustPolicy trustPolicy) {
        this.trustPolicy = trustPolicy;
    }

    public String getReportPath() {
        return reportPath == null ? "" : reportPath.trim();
    }

    public void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Cli {
        private boolean run = true;
        private boolean assumeYes;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isAssumeYes() {
            return assumeYes;
        }

        public void setAssumeYes(boolean assumeYes) {
            this.assumeYes = assumeYes;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
