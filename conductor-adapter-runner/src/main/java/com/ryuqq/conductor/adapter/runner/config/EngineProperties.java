package com.ryuqq.conductor.adapter.runner.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * conductor.yaml 루트 설정 객체 (SnakeYAML JavaBean).
 *
 * <p>값 검증은 {@link StartupValidator}가 담당하며, 의존성 보호 파라미터는 기본값 없이 명시해야 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * engine:
 *   maxDepth: 3
 *   defaultBudget: 10
 *   defaultHandler: general
 *   budgetExceededPolicy: BLOCK_NEW
 * routing:
 *   kinds:
 *     SCHEDULED_JOB: scheduler
 * dependencies:
 *   - name: state-store
 *     failureThreshold: 5
 *     openDurationMs: 30000
 *     bulkheadCapacity: 10
 *     bulkheadMaxWaitMs: 1000
 *     attemptTimeoutMs: 2000
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EngineProperties {

    private EngineSection engine = new EngineSection();
    private RoutingSection routing = new RoutingSection();
    private List<DependencySection> dependencies = new ArrayList<>();
    private SafetySection safety = new SafetySection();
    private LifecycleSection lifecycle = new LifecycleSection();
    private WorkersSection workers = new WorkersSection();
    private QueueSection queue = new QueueSection();

    public EngineSection getEngine() { return engine; }
    public void setEngine(EngineSection engine) { this.engine = engine; }

    public RoutingSection getRouting() { return routing; }
    public void setRouting(RoutingSection routing) { this.routing = routing; }

    public List<DependencySection> getDependencies() { return dependencies; }
    public void setDependencies(List<DependencySection> dependencies) { this.dependencies = dependencies; }

    public SafetySection getSafety() { return safety; }
    public void setSafety(SafetySection safety) { this.safety = safety; }

    public LifecycleSection getLifecycle() { return lifecycle; }
    public void setLifecycle(LifecycleSection lifecycle) { this.lifecycle = lifecycle; }

    public WorkersSection getWorkers() { return workers; }
    public void setWorkers(WorkersSection workers) { this.workers = workers; }

    public QueueSection getQueue() { return queue; }
    public void setQueue(QueueSection queue) { this.queue = queue; }

    /**
     * Coordinator 설정.
     */
    public static class EngineSection {
        private int maxDepth = 5;
        private Double defaultBudget;
        private long defaultDeadlineMs = 0;
        private String defaultHandler = "general";
        private String budgetExceededPolicy = "BLOCK_NEW";
        private int maxConversationTurns = 20;
        private boolean classifierEnabled = false;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public Double getDefaultBudget() { return defaultBudget; }
        public void setDefaultBudget(Double defaultBudget) { this.defaultBudget = defaultBudget; }

        public long getDefaultDeadlineMs() { return defaultDeadlineMs; }
        public void setDefaultDeadlineMs(long defaultDeadlineMs) { this.defaultDeadlineMs = defaultDeadlineMs; }

        public String getDefaultHandler() { return defaultHandler; }
        public void setDefaultHandler(String defaultHandler) { this.defaultHandler = defaultHandler; }

        public String getBudgetExceededPolicy() { return budgetExceededPolicy; }
        public void setBudgetExceededPolicy(String budgetExceededPolicy) { this.budgetExceededPolicy = budgetExceededPolicy; }

        public int getMaxConversationTurns() { return maxConversationTurns; }
        public void setMaxConversationTurns(int maxConversationTurns) { this.maxConversationTurns = maxConversationTurns; }

        public boolean isClassifierEnabled() { return classifierEnabled; }
        public void setClassifierEnabled(boolean classifierEnabled) { this.classifierEnabled = classifierEnabled; }
    }

    /**
     * WorkKind별 고정 핸들러 (키: WorkKind 이름, 값: 핸들러 이름).
     */
    public static class RoutingSection {
        private Map<String, String> kinds = new LinkedHashMap<>();

        public Map<String, String> getKinds() { return kinds; }
        public void setKinds(Map<String, String> kinds) { this.kinds = kinds; }
    }

    /**
     * 외부 의존성 하나의 보호 파라미터. null은 "설정되지 않음"을 뜻합니다.
     */
    public static class DependencySection {
        private String name;
        private Integer failureThreshold;
        private Long openDurationMs;
        private Integer maxAttempts;
        private Long baseDelayMs;
        private Long maxDelayMs;
        private Double jitterFactor;
        private List<String> transientErrors;
        private Integer bulkheadCapacity;
        private Long bulkheadMaxWaitMs;
        private Long attemptTimeoutMs;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }

        public Long getOpenDurationMs() { return openDurationMs; }
        public void setOpenDurationMs(Long openDurationMs) { this.openDurationMs = openDurationMs; }

        public Integer getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }

        public Long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(Long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public Long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(Long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public Double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(Double jitterFactor) { this.jitterFactor = jitterFactor; }

        public List<String> getTransientErrors() { return transientErrors; }
        public void setTransientErrors(List<String> transientErrors) { this.transientErrors = transientErrors; }

        public Integer getBulkheadCapacity() { return bulkheadCapacity; }
        public void setBulkheadCapacity(Integer bulkheadCapacity) { this.bulkheadCapacity = bulkheadCapacity; }

        public Long getBulkheadMaxWaitMs() { return bulkheadMaxWaitMs; }
        public void setBulkheadMaxWaitMs(Long bulkheadMaxWaitMs) { this.bulkheadMaxWaitMs = bulkheadMaxWaitMs; }

        public Long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(Long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }
    }

    /**
     * safety-check 단계 규칙 목록.
     */
    public static class SafetySection {
        private List<SafetyRuleSection> rules = new ArrayList<>();

        public List<SafetyRuleSection> getRules() { return rules; }
        public void setRules(List<SafetyRuleSection> rules) { this.rules = rules; }
    }

    public static class SafetyRuleSection {
        private String name;
        private String pattern;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }

    /**
     * 종료 시퀀스 설정.
     */
    public static class LifecycleSection {
        private long propagationDelayMs = 5_000;
        private long drainTimeoutMs = 30_000;

        public long getPropagationDelayMs() { return propagationDelayMs; }
        public void setPropagationDelayMs(long propagationDelayMs) { this.propagationDelayMs = propagationDelayMs; }

        public long getDrainTimeoutMs() { return drainTimeoutMs; }
        public void setDrainTimeoutMs(long drainTimeoutMs) { this.drainTimeoutMs = drainTimeoutMs; }
    }

    /**
     * 핸들러용 워커 풀 크기.
     */
    public static class WorkersSection {
        private int ioThreads = 16;
        private int cpuThreads = Math.max(1, java.lang.Runtime.getRuntime().availableProcessors());
        private int cpuQueueCapacity = 256;

        public int getIoThreads() { return ioThreads; }
        public void setIoThreads(int ioThreads) { this.ioThreads = ioThreads; }

        public int getCpuThreads() { return cpuThreads; }
        public void setCpuThreads(int cpuThreads) { this.cpuThreads = cpuThreads; }

        public int getCpuQueueCapacity() { return cpuQueueCapacity; }
        public void setCpuQueueCapacity(int cpuQueueCapacity) { this.cpuQueueCapacity = cpuQueueCapacity; }
    }

    /**
     * 큐 intake 설정.
     */
    public static class QueueSection {
        private int batchSize = 10;
        private long pollingIntervalMs = 100;
        private long retryDelayMs = 1_000;

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public long getPollingIntervalMs() { return pollingIntervalMs; }
        public void setPollingIntervalMs(long pollingIntervalMs) { this.pollingIntervalMs = pollingIntervalMs; }

        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
    }
}
