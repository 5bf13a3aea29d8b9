package org.caureq.fleetcore.service.deploy;

/**
 * One named unit of a task plan. {@code maxRetries} applies to connectivity failures only.
 */
public record DeploymentStep(String name, int maxRetries, Action action) {

    @FunctionalInterface
    public interface Action {
        void run(StepContext ctx);
    }
}
