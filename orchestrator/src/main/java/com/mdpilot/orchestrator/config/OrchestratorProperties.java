package com.mdpilot.orchestrator.config;

import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.ExecutionMode;
import com.mdpilot.orchestrator.capability.ParameterSpec;
import com.mdpilot.orchestrator.capability.ParameterType;
import com.mdpilot.orchestrator.job.JobPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Orchestrator settings bound from {@code mdpilot.*} in application.yml,
 * including the static capability catalog.
 */
@Component
@ConfigurationProperties(prefix = "mdpilot")
public class OrchestratorProperties {

    /** Proposals allowed per pipeline run before it fails. */
    private int maxInvocations = 800;

    /** Pipeline runs executed concurrently. */
    private int workers = 4;

    private Jobs jobs = new Jobs();
    private Memory memory = new Memory();
    private Runs runs = new Runs();
    private List<CapabilityEntry> capabilities = new ArrayList<>();

    public int getMaxInvocations() { return maxInvocations; }
    public void setMaxInvocations(int maxInvocations) { this.maxInvocations = maxInvocations; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public Jobs getJobs() { return jobs; }
    public void setJobs(Jobs jobs) { this.jobs = jobs; }

    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }

    public Runs getRuns() { return runs; }
    public void setRuns(Runs runs) { this.runs = runs; }

    public List<CapabilityEntry> getCapabilities() { return capabilities; }
    public void setCapabilities(List<CapabilityEntry> capabilities) { this.capabilities = capabilities; }

    /** The catalog as registry-ready capabilities, in declaration order. */
    public List<Capability> catalog() {
        return capabilities.stream().map(CapabilityEntry::toCapability).toList();
    }

    // ------------------------------------------------------------------
    // Nested groups
    // ------------------------------------------------------------------

    public static class Jobs {
        private Duration minPollInterval = Duration.ofSeconds(15);
        private Duration maxPollInterval = Duration.ofMinutes(5);
        private Duration maxDuration = Duration.ofHours(48);
        private int maxAttempts = 5;
        private Duration retryBackoff = Duration.ofSeconds(2);
        private Set<String> resubmittableTypes = new LinkedHashSet<>();
        private int maxResubmissions = 0;
        private int pollThreads = 2;
        private int completionThreads = 4;

        public JobPolicy toPolicy() {
            return new JobPolicy(minPollInterval, maxPollInterval, maxDuration,
                    maxAttempts, retryBackoff, resubmittableTypes, maxResubmissions);
        }

        public Duration getMinPollInterval() { return minPollInterval; }
        public void setMinPollInterval(Duration minPollInterval) { this.minPollInterval = minPollInterval; }

        public Duration getMaxPollInterval() { return maxPollInterval; }
        public void setMaxPollInterval(Duration maxPollInterval) { this.maxPollInterval = maxPollInterval; }

        public Duration getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Duration maxDuration) { this.maxDuration = maxDuration; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

        public Set<String> getResubmittableTypes() { return resubmittableTypes; }
        public void setResubmittableTypes(Set<String> resubmittableTypes) { this.resubmittableTypes = resubmittableTypes; }

        public int getMaxResubmissions() { return maxResubmissions; }
        public void setMaxResubmissions(int maxResubmissions) { this.maxResubmissions = maxResubmissions; }

        public int getPollThreads() { return pollThreads; }
        public void setPollThreads(int pollThreads) { this.pollThreads = pollThreads; }

        public int getCompletionThreads() { return completionThreads; }
        public void setCompletionThreads(int completionThreads) { this.completionThreads = completionThreads; }
    }

    public static class Memory {
        private int recallLimit = 5;
        /** Corrections kept in memory; the oldest are evicted beyond this. */
        private int capacity = 10_000;

        public int getRecallLimit() { return recallLimit; }
        public void setRecallLimit(int recallLimit) { this.recallLimit = recallLimit; }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    public static class Runs {
        /** How long a finished run stays queryable. */
        private Duration retention = Duration.ofHours(24);

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    /** One catalog entry. */
    public static class CapabilityEntry {
        private String name;
        private String executor;
        private ExecutionMode mode = ExecutionMode.SYNCHRONOUS;
        private String description = "";
        private boolean correctionSensitive;
        private List<ParameterEntry> parameters = new ArrayList<>();
        private List<String> requires = new ArrayList<>();
        private List<String> affects = new ArrayList<>();

        public Capability toCapability() {
            return new Capability(name, executor,
                    parameters.stream().map(ParameterEntry::toSpec).toList(),
                    requires, affects, mode, correctionSensitive, description);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getExecutor() { return executor; }
        public void setExecutor(String executor) { this.executor = executor; }

        public ExecutionMode getMode() { return mode; }
        public void setMode(ExecutionMode mode) { this.mode = mode; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public boolean isCorrectionSensitive() { return correctionSensitive; }
        public void setCorrectionSensitive(boolean correctionSensitive) { this.correctionSensitive = correctionSensitive; }

        public List<ParameterEntry> getParameters() { return parameters; }
        public void setParameters(List<ParameterEntry> parameters) { this.parameters = parameters; }

        public List<String> getRequires() { return requires; }
        public void setRequires(List<String> requires) { this.requires = requires; }

        public List<String> getAffects() { return affects; }
        public void setAffects(List<String> affects) { this.affects = affects; }
    }

    public static class ParameterEntry {
        private String name;
        private ParameterType type = ParameterType.STRING;
        private boolean required = true;

        ParameterSpec toSpec() {
            return new ParameterSpec(name, type, required);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public ParameterType getType() { return type; }
        public void setType(ParameterType type) { this.type = type; }

        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }
    }
}
