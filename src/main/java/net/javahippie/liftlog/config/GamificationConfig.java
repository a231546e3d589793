package net.javahippie.liftlog.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the gamification policy and the engine's time source.
 */
@Configuration
@EnableConfigurationProperties(GamificationProperties.class)
public class GamificationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
