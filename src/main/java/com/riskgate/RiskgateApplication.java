package com.riskgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Metrics store connections are opened per operation against a configured file path, so the
 * auto-configured pooled DataSource is disabled.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class RiskgateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskgateApplication.class, args);
    }
}
