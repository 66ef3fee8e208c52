package org.caureq.opsanomaly.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Turns the sampler schedule on unless app.sampler.enabled=false. */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "app.sampler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
