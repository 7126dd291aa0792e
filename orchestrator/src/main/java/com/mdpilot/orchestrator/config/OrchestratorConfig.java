package com.mdpilot.orchestrator.config;

import com.mdpilot.orchestrator.capability.CapabilityExecutor;
import com.mdpilot.orchestrator.capability.CapabilityRegistry;
import com.mdpilot.orchestrator.job.JobPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Registers the static catalog once at startup; a bad entry fails the boot. */
    @Bean
    public CapabilityRegistry capabilityRegistry(List<CapabilityExecutor> executors,
                                                 OrchestratorProperties properties) {
        CapabilityRegistry registry = new CapabilityRegistry(executors);
        registry.registerAll(properties.catalog());
        log.info("Capability catalog ready: {} capabilities over gates {}",
                registry.capabilityNames().size(), registry.gateNames());
        return registry;
    }

    @Bean
    public JobPolicy jobPolicy(OrchestratorProperties properties) {
        return properties.getJobs().toPolicy();
    }

    /** Shared by the job managers of all runs. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService jobPollExecutor(OrchestratorProperties properties) {
        return Executors.newScheduledThreadPool(properties.getJobs().getPollThreads());
    }

    /** Runs job-completion callbacks (result fetch, resubmission) off the poll threads. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService jobCompletionExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(properties.getJobs().getCompletionThreads());
    }
}
