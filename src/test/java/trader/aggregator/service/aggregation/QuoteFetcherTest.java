package trader.aggregator.service.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;
import trader.aggregator.Fixtures;
import trader.aggregator.client.PriceSourceClient;
import trader.aggregator.client.SourceRequest;
import trader.aggregator.client.adapter.DefaultResponseMapper;
import trader.aggregator.client.adapter.SourceAdapterRegistry;
import trader.aggregator.client.adapter.UniswapV3Adapter;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.SourceErrorEvent;
import trader.aggregator.model.SourceErrorType;
import trader.aggregator.service.event.EngineEvents;
import trader.aggregator.service.source.SourceRegistry;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static trader.aggregator.Fixtures.USDC;
import static trader.aggregator.Fixtures.WETH;

class QuoteFetcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PriceSourceClient client = mock(PriceSourceClient.class);
    private final AggregatorProperties properties = new AggregatorProperties();
    private final Clock clock = Clock.fixed(Fixtures.T0, ZoneOffset.UTC);
    private final EngineEvents events = new EngineEvents();
    private final List<SourceErrorEvent> errors = new CopyOnWriteArrayList<>();
    private final Counter failures = new SimpleMeterRegistry().counter("price.source.failures");
    private final PriceSource source = Fixtures.source(DexType.UNISWAP_V3, null);

    private VirtualTimeScheduler scheduler;
    private SourceRegistry sourceRegistry;
    private QuoteFetcher fetcher;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        sourceRegistry = new SourceRegistry(List.of(source), clock);
        events.onError(errors::add);
        fetcher = new QuoteFetcher(client,
                new SourceAdapterRegistry(List.of(new UniswapV3Adapter()), new DefaultResponseMapper()),
                new PriceDataValidator(), sourceRegistry, events, properties, scheduler, clock, failures);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private Mono<PriceData> fetch() {
        return fetcher.fetch(source, USDC, WETH, BigDecimal.ONE);
    }

    private JsonNode json(String body) throws IOException {
        return objectMapper.readTree(body);
    }

    private static WebClientResponseException status(int code) {
        return new WebClientResponseException(code, "status " + code, null, null, null);
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("transient 5xx failures are retried with linear backoff")
        void retriesServerErrors() throws IOException {
            when(client.execute(any(SourceRequest.class))).thenReturn(
                    Mono.error(status(503)),
                    Mono.error(status(502)),
                    Mono.just(json("{\"quoteDecimals\":\"1500.5\",\"gasUseEstimate\":120000,\"liquidity\":\"2000000\"}")));

            StepVerifier.withVirtualTime(() -> fetch(), () -> scheduler, Long.MAX_VALUE)
                    .expectSubscription()
                    .expectNoEvent(Duration.ofMillis(2999))
                    .thenAwait(Duration.ofMillis(1))
                    .assertNext(quote -> {
                        assertThat(quote.getPrice()).isEqualByComparingTo("1500.5");
                        assertThat(quote.getGasEstimate()).isEqualTo(120_000);
                        assertThat(quote.getConfidence()).isEqualTo(90);
                    })
                    .verifyComplete();

            verify(client, times(3)).execute(any(SourceRequest.class));
            assertThat(errors).isEmpty();
        }

        @Test
        @DisplayName("a source that never answers times out on every attempt and reports once")
        void timesOut() {
            when(client.execute(any(SourceRequest.class))).thenReturn(Mono.never());

            StepVerifier.withVirtualTime(() -> fetch(), () -> scheduler, Long.MAX_VALUE)
                    .expectSubscription()
                    .expectNoEvent(Duration.ofMillis(17_999))
                    .thenAwait(Duration.ofMillis(1))
                    .verifyComplete();

            verify(client, times(3)).execute(any(SourceRequest.class));
            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.SOURCE_TIMEOUT);
            assertThat(failures.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("client errors are not retried")
        void clientErrorFailsFast() {
            when(client.execute(any(SourceRequest.class))).thenReturn(Mono.error(status(400)));

            StepVerifier.create(fetch()).verifyComplete();

            verify(client, times(1)).execute(any(SourceRequest.class));
            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.SOURCE_FAILURE);
            assertThat(errors.get(0).getTimestamp()).isEqualTo(Fixtures.T0);
        }
    }

    @Nested
    @DisplayName("response handling")
    class Responses {

        @Test
        void quoteFailingValidationIsDropped() throws IOException {
            when(client.execute(any(SourceRequest.class))).thenReturn(Mono.just(json("{\"quoteDecimals\":\"0\"}")));

            StepVerifier.create(fetch()).verifyComplete();

            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.INVALID_PRICE_DATA);
        }

        @Test
        void nonNumericFieldIsInvalidData() throws IOException {
            when(client.execute(any(SourceRequest.class))).thenReturn(Mono.just(json("{\"quoteDecimals\":\"abc\"}")));

            StepVerifier.create(fetch()).verifyComplete();

            verify(client, times(1)).execute(any(SourceRequest.class));
            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.INVALID_PRICE_DATA);
        }

        @Test
        @DisplayName("unrecognised shapes fall back to the flat field mapping")
        void defaultMapping() throws IOException {
            when(client.execute(any(SourceRequest.class))).thenReturn(Mono.just(json(
                    "{\"price\":\"1499\",\"amountOut\":\"1499\",\"liquidity\":500000,\"gas\":90000}")));

            StepVerifier.create(fetch())
                    .assertNext(quote -> {
                        assertThat(quote.getDex()).isEqualTo(DexType.UNISWAP_V3);
                        assertThat(quote.getAmountOut()).isEqualByComparingTo("1499");
                        assertThat(quote.getGasEstimate()).isEqualTo(90_000);
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("request building")
    class RequestBuilding {

        @Test
        @DisplayName("a malformed endpoint is reported and absorbed")
        void malformedEndpoint() {
            PriceSource broken = PriceSource.builder()
                    .dex(DexType.UNISWAP_V3)
                    .name("Uniswap V3")
                    .apiEndpoint("not a url")
                    .rateLimit(5)
                    .rateWindowMillis(1000)
                    .reliability(90)
                    .build();

            StepVerifier.create(fetcher.fetch(broken, USDC, WETH, BigDecimal.ONE)).verifyComplete();

            verify(client, never()).execute(any(SourceRequest.class));
            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.SOURCE_FAILURE);
            assertThat(failures.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("a source without an adapter is reported and absorbed")
        void missingAdapter() {
            PriceSource curve = Fixtures.source(DexType.CURVE, null);
            QuoteFetcher curveFetcher = new QuoteFetcher(client,
                    new SourceAdapterRegistry(List.of(new UniswapV3Adapter()), new DefaultResponseMapper()),
                    new PriceDataValidator(), new SourceRegistry(List.of(curve), clock), events, properties, scheduler, clock, failures);

            StepVerifier.create(curveFetcher.fetch(curve, USDC, WETH, BigDecimal.ONE)).verifyComplete();

            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.SOURCE_FAILURE);
        }
    }

    @Test
    @DisplayName("a source over its rate limit is skipped without a request")
    void rateLimited() {
        for (int i = 0; i < source.getRateLimit(); i++) {
            sourceRegistry.tryAcquire(DexType.UNISWAP_V3);
        }

        StepVerifier.create(fetch()).verifyComplete();

        verify(client, never()).execute(any(SourceRequest.class));
        assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.SOURCE_RATE_LIMITED);
    }

    @Test
    void classifiesTransientErrors() {
        assertThat(QuoteFetcher.isTransient(new TimeoutException())).isTrue();
        assertThat(QuoteFetcher.isTransient(new IOException("reset"))).isTrue();
        assertThat(QuoteFetcher.isTransient(status(429))).isTrue();
        assertThat(QuoteFetcher.isTransient(status(500))).isTrue();
        assertThat(QuoteFetcher.isTransient(status(404))).isFalse();
        assertThat(QuoteFetcher.isTransient(new IllegalStateException())).isFalse();
    }
}
