package uk.gegc.tunetrivia.features.estimation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.tunetrivia.features.estimation.application.TimeEstimationManager;

import java.time.Clock;

@Configuration
public class EstimationConfig {

    @Bean
    public TimeEstimationManager timeEstimationManager(Clock clock, EstimationProperties properties) {
        return new TimeEstimationManager(clock, properties);
    }
}
