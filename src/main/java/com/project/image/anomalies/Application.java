package com.project.image.anomalies;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Bootstraps the anomaly detection service. No pipeline logic lives here.
 *
 * @ConfigurationPropertiesScan picks up the {@code app.anomaly.*} settings bound in the config package.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
