package app.majid.aquifer.synchronizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SynchronizerConfig {

    /**
     * Clock stamping sync log entries.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
