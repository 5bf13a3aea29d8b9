package org.caureq.fleetcore;

import org.caureq.fleetcore.service.deploy.DeploymentScheduler;
import org.caureq.fleetcore.service.discovery.NetworkDiscoveryService;
import org.caureq.fleetcore.service.monitor.HealthMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "fleet.monitor.enabled=false")
class FleetCoreApplicationTests {

    @Autowired private DeploymentScheduler scheduler;
    @Autowired private NetworkDiscoveryService discovery;
    @Autowired private HealthMonitor monitor;

    @Autowired @Qualifier("deploymentExecutor") private Executor deploymentExecutor;
    @Autowired @Qualifier("discoveryExecutor") private Executor discoveryExecutor;
    @Autowired @Qualifier("probeExecutor") private Executor probeExecutor;

    @Test
    void contextLoads() {
        assertThat(scheduler).isNotNull();
        assertThat(discovery).isNotNull();
        assertThat(monitor).isNotNull();
        assertThat(scheduler.list(10)).isEmpty();
        assertThat(monitor.isRunning()).isFalse();
    }

    @Test
    void eachServiceGetsItsOwnPool() {
        assertThat(ReflectionTestUtils.getField(scheduler, "workers")).isSameAs(deploymentExecutor);
        assertThat(ReflectionTestUtils.getField(discovery, "pool")).isSameAs(discoveryExecutor);
        assertThat(ReflectionTestUtils.getField(monitor, "pool")).isSameAs(probeExecutor);
    }
}
