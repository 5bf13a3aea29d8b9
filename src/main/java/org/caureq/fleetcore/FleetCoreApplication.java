package org.caureq.fleetcore;

import org.caureq.fleetcore.config.FleetProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(FleetProps.class)
public class FleetCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetCoreApplication.class, args);
    }

}
