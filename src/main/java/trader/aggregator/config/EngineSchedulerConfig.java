package trader.aggregator.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class EngineSchedulerConfig {

    /**
     * Timer source for fetch timeouts, retry backoff, feed reconnects and cache expiry.
     */
    @Bean(name = "engineScheduler", destroyMethod = "dispose")
    public Scheduler engineScheduler() {
        return Schedulers.newParallel("engine");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Dotenv dotenv() {
        return Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }
}
