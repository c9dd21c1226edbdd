package trader.aggregator.config.metrics;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.DefaultClientRequestObservationConvention;

@Configuration
public class ObservabilityConfig {

    /** Enables {@code @Observed} on route optimization and pool refresh. */
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    @Bean
    public WebClientCustomizer priceSourceObservationCustomizer(ObservationRegistry observationRegistry) {
        return webClientBuilder -> webClientBuilder
                .observationRegistry(observationRegistry)
                .observationConvention(new DefaultClientRequestObservationConvention("price.source.requests"));
    }
}
