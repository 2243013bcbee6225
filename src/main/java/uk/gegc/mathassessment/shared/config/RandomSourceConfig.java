package uk.gegc.mathassessment.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.mathassessment.shared.util.DefaultRandomSource;
import uk.gegc.mathassessment.shared.util.RandomSource;

import java.util.Random;

/**
 * Configuration for the process-wide randomness stream.
 * Topic sampling and every deterministic generator draw from this single bean,
 * so setting {@code app.random.seed} makes a whole run reproducible.
 */
@Configuration
@Slf4j
public class RandomSourceConfig {

    @Value("${app.random.seed:#{null}}")
    private Long seed;

    @Bean
    public RandomSource randomSource() {
        if (seed == null) {
            return new DefaultRandomSource(new Random());
        }
        log.info("Using seeded random source (seed={})", seed);
        return DefaultRandomSource.seeded(seed);
    }
}
