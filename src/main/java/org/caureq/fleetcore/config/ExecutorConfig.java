package org.caureq.fleetcore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools. Deployment tasks, discovery probes and monitor probes each get their own
 * bounded pool so a large scan never starves running deployments.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "deploymentExecutor")
    public ThreadPoolTaskExecutor deploymentExecutor(FleetProps props) {
        return pool("deploy-", props.deploy().workers(), 500);
    }

    @Bean(name = "discoveryExecutor")
    public ThreadPoolTaskExecutor discoveryExecutor(FleetProps props) {
        return pool("scan-", props.discovery().parallelism(), 10_000);
    }

    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor(FleetProps props) {
        return pool("probe-", props.monitor().parallelism(), 1_000);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int width, int queue) {
        var ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(Math.max(1, width));
        ex.setMaxPoolSize(Math.max(1, width));
        ex.setQueueCapacity(queue);
        ex.setThreadNamePrefix(prefix);
        ex.setWaitForTasksToCompleteOnShutdown(false);
        return ex;
    }
}
