package com.riskgate.config;

import com.riskgate.risk.RiskConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Provides the {@link RiskConfiguration} bean from the Spring environment.
 *
 * <p>All guardrails default to null (disabled) so the gate runs permissively until configured.
 * Properties prefix: {@code risk.*}; environment variables {@code RISK_*} override.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskConfiguration riskConfiguration(Environment environment) {
        return new RiskConfigurationLoader(environment).load();
    }
}
