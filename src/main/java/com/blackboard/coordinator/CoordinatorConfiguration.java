package com.blackboard.coordinator;

import com.blackboard.contract.FactContractValidator;
import com.blackboard.verdict.ForensicProperties;
import com.blackboard.verdict.ForensicVerdictAggregator;
import com.blackboard.verdict.SynthesisVerdictAggregator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({CoordinatorProperties.class, ForensicProperties.class})
public class CoordinatorConfiguration {

    @Bean
    public FactContractValidator factContractValidator() {
        return new FactContractValidator();
    }

    /**
     * Shared pool for agent work. Every run dispatches onto it, so a saturated pool
     * delays agents and counts against their per-agent timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentWorkerPool(CoordinatorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "agent-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.workerThreadsOrDefault(), threads);
    }

    @Bean
    public Coordinator coordinator(ExecutorService agentWorkerPool) {
        return new Coordinator(new MdcAwareExecutor(agentWorkerPool));
    }

    @Bean
    public RunSettings runSettings(CoordinatorProperties properties) {
        return properties.toRunSettings();
    }

    @Bean
    public ForensicVerdictAggregator forensicVerdictAggregator(ForensicProperties properties) {
        return properties.toAggregator();
    }

    @Bean
    public SynthesisVerdictAggregator synthesisVerdictAggregator() {
        return new SynthesisVerdictAggregator();
    }
}
