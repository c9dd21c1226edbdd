package trader.aggregator.service.aggregation;

import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;
import trader.aggregator.client.PriceSourceClient;
import trader.aggregator.client.adapter.QuoteContext;
import trader.aggregator.client.adapter.SourceAdapterRegistry;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.exception.InvalidPriceDataException;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.SourceErrorEvent;
import trader.aggregator.model.SourceErrorType;
import trader.aggregator.model.Token;
import trader.aggregator.service.event.EngineEvents;
import trader.aggregator.service.source.SourceRegistry;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * One quote from one source: rate-limit admission, bounded timeout, linear backoff retries, parsing and validation.
 * Every failure is reported on the error channel and resolves to an empty Mono.
 */
@Slf4j
@Component
public class QuoteFetcher {

    private final PriceSourceClient priceSourceClient;
    private final SourceAdapterRegistry adapterRegistry;
    private final PriceDataValidator validator;
    private final SourceRegistry sourceRegistry;
    private final EngineEvents events;
    private final AggregatorProperties properties;
    private final Scheduler engineScheduler;
    private final Clock clock;
    private final Counter sourceFailuresCounter;

    public QuoteFetcher(PriceSourceClient priceSourceClient,
                        SourceAdapterRegistry adapterRegistry,
                        PriceDataValidator validator,
                        SourceRegistry sourceRegistry,
                        EngineEvents events,
                        AggregatorProperties properties,
                        @Qualifier("engineScheduler") Scheduler engineScheduler,
                        Clock clock,
                        Counter sourceFailuresCounter) {
        this.priceSourceClient = priceSourceClient;
        this.adapterRegistry = adapterRegistry;
        this.validator = validator;
        this.sourceRegistry = sourceRegistry;
        this.events = events;
        this.properties = properties;
        this.engineScheduler = engineScheduler;
        this.clock = clock;
        this.sourceFailuresCounter = sourceFailuresCounter;
    }

    public Mono<PriceData> fetch(PriceSource source, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return Mono.defer(() -> {
            DexType dex = source.getDex();
            if (!sourceRegistry.tryAcquire(dex)) {
                log.warn("Rate limit reached for {}, skipping it in this pass", source.getName());
                report(dex, SourceErrorType.SOURCE_RATE_LIMITED, "Rate limit of " + source.getRateLimit()
                        + " per " + source.getRateWindowMillis() + "ms reached");
                return Mono.empty();
            }

            return Mono.fromCallable(() -> adapterRegistry.adapterFor(dex).buildRequest(source, tokenIn, tokenOut, amountIn))
                    .flatMap(request -> Mono.defer(() -> priceSourceClient.execute(request))
                            .timeout(Duration.ofMillis(properties.getTimeout()), engineScheduler)
                            .retryWhen(retrySpec(source)))
                    .map(body -> adapterRegistry.parse(dex, body, QuoteContext.builder()
                            .source(source)
                            .tokenIn(tokenIn)
                            .tokenOut(tokenOut)
                            .amountIn(amountIn)
                            .receivedAt(clock.instant())
                            .build()))
                    .flatMap(data -> accept(source, data))
                    .onErrorResume(error -> {
                        reportFailure(source, error);
                        return Mono.empty();
                    });
        });
    }

    private Mono<PriceData> accept(PriceSource source, PriceData data) {
        Optional<String> violation = validator.violation(data);
        if (violation.isPresent()) {
            log.warn("Invalid price data from {}: {}", source.getName(), violation.get());
            report(source.getDex(), SourceErrorType.INVALID_PRICE_DATA, violation.get());
            return Mono.empty();
        }
        return Mono.just(data);
    }

    /**
     * Up to {@code retryAttempts} attempts in total, waiting {@code retryBaseDelay * n} before retry n.
     */
    private Retry retrySpec(PriceSource source) {
        int maxAttempts = Math.max(1, properties.getRetryAttempts());
        return Retry.from(signals -> signals.concatMap(signal -> {
            long retry = signal.totalRetries() + 1;
            if (retry >= maxAttempts || !isTransient(signal.failure())) {
                return Mono.error(signal.failure());
            }
            Duration delay = Duration.ofMillis(properties.getRetryBaseDelay() * retry);
            log.info("Retrying {} after {} (attempt {}/{}) in {}ms",
                    source.getName(), describe(signal.failure()), retry + 1, maxAttempts, delay.toMillis());
            return Mono.delay(delay, engineScheduler);
        }));
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof TimeoutException || error instanceof IOException || error instanceof WebClientRequestException) {
            return true;
        }
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    private void reportFailure(PriceSource source, Throwable error) {
        sourceFailuresCounter.increment();
        if (error instanceof InvalidPriceDataException) {
            log.warn("Unreadable response from {}: {}", source.getName(), error.getMessage());
            report(source.getDex(), SourceErrorType.INVALID_PRICE_DATA, error.getMessage());
        } else if (error instanceof TimeoutException) {
            log.error("{} timed out after {} attempts", source.getName(), properties.getRetryAttempts());
            report(source.getDex(), SourceErrorType.SOURCE_TIMEOUT, "No response within " + properties.getTimeout() + "ms");
        } else {
            log.error("Error fetching price from {}: {}", source.getName(), describe(error));
            report(source.getDex(), SourceErrorType.SOURCE_FAILURE, describe(error));
        }
    }

    private void report(DexType dex, SourceErrorType type, String message) {
        events.publishError(SourceErrorEvent.builder()
                .dex(dex)
                .type(type)
                .message(message)
                .timestamp(clock.instant())
                .build());
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
