package trader.aggregator.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.Set;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class PriceSourceWebClientConfiguration {

    private static final Set<String> SECRET_HEADERS = Set.of("x-api-key", "authorization");

    private final AggregatorProperties aggregatorProperties;

    @Bean
    public WebClient priceSourceWebClient(
            WebClient.Builder builder,
            @Value("${price-source.api.connection.timeout:3000}") int connectionTimeoutMillis,
            @Value("${price-source.api.max.memory.size:16777216}") int maxInMemorySize
    ) {
        ConnectionProvider provider = ConnectionProvider.builder("price-source-pool")
                .maxConnections(Math.max(aggregatorProperties.getMaxConcurrentRequests() * 5, 10))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .pendingAcquireTimeout(Duration.ofSeconds(45))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        // the fetcher enforces its own per-attempt timeout, this one only guards stuck sockets
        HttpClient httpClient = HttpClient.create(provider)
                .responseTimeout(Duration.ofMillis(aggregatorProperties.getTimeout() * 2))
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, connectionTimeoutMillis);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();

        return builder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    @Bean
    public ReactorNettyWebSocketClient feedWebSocketClient() {
        return new ReactorNettyWebSocketClient();
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                log.debug("Price source request: {} {}", clientRequest.method(), clientRequest.url());
                clientRequest.headers().forEach((name, values) -> {
                    if (SECRET_HEADERS.contains(name.toLowerCase())) {
                        log.debug("{}=****", name);
                    } else {
                        values.forEach(value -> log.debug("{}={}", name, value));
                    }
                });
            }
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (log.isDebugEnabled()) {
                log.debug("Price source response status: {}", clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
