package trader.aggregator.service.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;
import trader.aggregator.Fixtures;
import trader.aggregator.client.FeedListener;
import trader.aggregator.client.FeedTransport;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.SourceErrorEvent;
import trader.aggregator.model.SourceErrorType;
import trader.aggregator.service.aggregation.AggregatedPriceAssembler;
import trader.aggregator.service.aggregation.ArbitrageDetector;
import trader.aggregator.service.aggregation.PriceCache;
import trader.aggregator.service.aggregation.PriceDataValidator;
import trader.aggregator.service.event.EngineEvents;
import trader.aggregator.service.source.SourceRegistry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static trader.aggregator.Fixtures.USDC;
import static trader.aggregator.Fixtures.WETH;
import static trader.aggregator.Fixtures.quote;

class FeedManagerTest {

    private static final String FEED_URL = "wss://feed.example/ws";

    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final Fixtures.MutableClock clock = new Fixtures.MutableClock(Fixtures.T0);
    private final AggregatorProperties properties = new AggregatorProperties();
    private final EngineEvents events = new EngineEvents();
    private final List<SourceErrorEvent> errors = new CopyOnWriteArrayList<>();
    private final List<AggregatedPrice> updates = new CopyOnWriteArrayList<>();
    private final FakeTransport transport = new FakeTransport();

    private SourceRegistry sourceRegistry;
    private PriceCache priceCache;
    private FeedManager feedManager;

    @BeforeEach
    void setUp() {
        sourceRegistry = new SourceRegistry(List.of(
                Fixtures.source(DexType.UNISWAP_V3, FEED_URL),
                Fixtures.source(DexType.SUSHISWAP, null)), clock);
        priceCache = new PriceCache(properties, clock, scheduler);
        events.onError(errors::add);
        events.onPriceUpdate(updates::add);
        feedManager = new FeedManager(transport, sourceRegistry, priceCache,
                new AggregatedPriceAssembler(new ArbitrageDetector(properties, clock), properties, clock),
                new PriceDataValidator(), events, properties, scheduler, clock, new ObjectMapper(),
                new SimpleMeterRegistry().counter("feed.updates.applied"));
    }

    @AfterEach
    void tearDown() {
        feedManager.disconnectAll();
        scheduler.dispose();
    }

    @Nested
    @DisplayName("reconnects")
    class Reconnects {

        @Test
        @DisplayName("back off exponentially and give up after the configured attempts")
        void exponentialBackoffThenDeactivate() {
            transport.failConnects = true;

            feedManager.start();
            scheduler.advanceTimeBy(Duration.ofSeconds(60));

            assertThat(transport.connectTimes).containsExactly(0L, 1_000L, 3_000L, 7_000L, 15_000L, 31_000L);
            assertThat(transport.connectTimes.get(4) - transport.connectTimes.get(3)).isGreaterThanOrEqualTo(8_000L);
            assertThat(feedManager.connection(DexType.UNISWAP_V3)).get().satisfies(connection -> {
                assertThat(connection.isInactive()).isTrue();
                assertThat(connection.isOpen()).isFalse();
            });
            assertThat(sourceRegistry.isActive(DexType.UNISWAP_V3)).isFalse();
            assertThat(errors).hasSize(6).allMatch(error -> error.getType() == SourceErrorType.FEED_DISCONNECTED);
        }

        @Test
        void onlySourcesWithAFeedAreOpened() {
            feedManager.start();

            assertThat(transport.uris).containsExactly(URI.create(FEED_URL));
            assertThat(feedManager.connection(DexType.SUSHISWAP)).isEmpty();
        }

        @Test
        @DisplayName("a successful open resets the attempt counter")
        void openResetsAttempts() {
            feedManager.start();
            transport.open(0);
            transport.close(0);
            scheduler.advanceTimeBy(Duration.ofSeconds(1));
            transport.close(1);

            assertThat(feedManager.connection(DexType.UNISWAP_V3).orElseThrow().getReconnectAttemptCount()).isEqualTo(2);

            scheduler.advanceTimeBy(Duration.ofSeconds(2));
            transport.open(2);

            assertThat(feedManager.connection(DexType.UNISWAP_V3).orElseThrow().getReconnectAttemptCount()).isZero();
            assertThat(feedManager.activeConnectionCount()).isEqualTo(1);
        }

        @Test
        void disconnectAllStopsReconnecting() {
            feedManager.start();
            transport.open(0);

            feedManager.disconnectAll();
            scheduler.advanceTimeBy(Duration.ofMinutes(5));

            assertThat(transport.connectTimes).hasSize(1);
            assertThat(feedManager.activeConnectionCount()).isZero();
        }

        @Test
        void reconnectDelayDoubles() {
            assertThat(FeedManager.reconnectDelay(0)).isEqualTo(Duration.ofSeconds(1));
            assertThat(FeedManager.reconnectDelay(3)).isEqualTo(Duration.ofSeconds(8));
        }
    }

    @Nested
    @DisplayName("messages")
    class Messages {

        private final String pairKey = AggregatedPrice.pairKey(USDC, WETH);

        @BeforeEach
        void cacheAggregate() {
            List<PriceData> prices = List.of(quote(DexType.UNISWAP_V3, "100"), quote(DexType.SUSHISWAP, "100.2"));
            priceCache.put(AggregatedPrice.builder()
                    .pairKey(pairKey)
                    .bestPrice(prices.get(1))
                    .allPrices(prices)
                    .validPrices(prices)
                    .stalePrices(List.of())
                    .arbitrageOpportunities(List.of())
                    .lastUpdated(clock.instant())
                    .build());
            feedManager.start();
        }

        @Test
        @DisplayName("a price update patches the cached aggregate and republishes it")
        void appliesPriceUpdate() {
            transport.open(0);
            transport.message(0, "{\"type\":\"price_update\",\"tokenPair\":\"" + pairKey + "\",\"price\":\"101\",\"amountOut\":\"101\"}");

            AggregatedPrice patched = priceCache.getAny(pairKey).orElseThrow();
            assertThat(patched.getAllPrices())
                    .filteredOn(data -> data.getDex() == DexType.UNISWAP_V3)
                    .singleElement()
                    .satisfies(data -> assertThat(data.getPrice()).isEqualByComparingTo("101"));
            assertThat(patched.getBestPrice().getDex()).isEqualTo(DexType.UNISWAP_V3);
            assertThat(updates).hasSize(1);
            assertThat(feedManager.getAppliedUpdates()).isEqualTo(1);
        }

        @Test
        void invalidUpdateIsRejected() {
            transport.open(0);
            transport.message(0, "{\"type\":\"price_update\",\"tokenPair\":\"" + pairKey + "\",\"price\":\"-1\"}");

            assertThat(priceCache.getAny(pairKey).orElseThrow().getAllPrices().get(0).getPrice()).isEqualByComparingTo("100");
            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.INVALID_PRICE_DATA);
            assertThat(updates).isEmpty();
        }

        @Test
        void updatesForUncachedPairsAreDropped() {
            transport.open(0);
            transport.message(0, "{\"type\":\"price_update\",\"tokenPair\":\"1-0xa-0xb\",\"price\":\"5\"}");
            transport.message(0, "not json");

            assertThat(updates).isEmpty();
            assertThat(feedManager.getAppliedUpdates()).isZero();
        }

        @Test
        @DisplayName("subscriptions made before the feed opens are replayed on open")
        void replaysSubscriptions() {
            feedManager.subscribe(DexType.UNISWAP_V3, pairKey);
            transport.open(0);

            assertThat(transport.sent).containsExactly("{\"type\":\"subscribe\",\"tokenPair\":\"" + pairKey + "\"}");
        }
    }

    @Nested
    @DisplayName("heartbeat")
    class Heartbeat {

        @Test
        void pingsLiveFeeds() {
            feedManager.start();
            transport.open(0);
            clock.advance(Duration.ofSeconds(30));

            feedManager.heartbeat();

            assertThat(transport.sent).containsExactly(FeedManager.PING_MESSAGE);
        }

        @Test
        @DisplayName("a feed silent past the timeout is closed and scheduled for reconnect")
        void forcesReconnectOnSilence() {
            feedManager.start();
            transport.open(0);
            clock.advance(Duration.ofMillis(properties.getHeartbeatTimeout() + 1));

            feedManager.heartbeat();

            assertThat(feedManager.activeConnectionCount()).isZero();
            assertThat(errors).extracting(SourceErrorEvent::getType).containsExactly(SourceErrorType.FEED_DISCONNECTED);

            scheduler.advanceTimeBy(Duration.ofSeconds(1));
            assertThat(transport.connectTimes).containsExactly(0L, 1_000L);
        }

        @Test
        @DisplayName("a forced close counts as a single reconnect attempt")
        void forcedCloseReconnectsOnce() {
            feedManager.start();
            transport.open(0);
            clock.advance(Duration.ofMillis(properties.getHeartbeatTimeout() + 1));

            feedManager.heartbeat();
            transport.close(0);
            feedManager.heartbeat();
            scheduler.advanceTimeBy(Duration.ofSeconds(10));

            assertThat(transport.connectTimes).containsExactly(0L, 1_000L);
            assertThat(feedManager.connection(DexType.UNISWAP_V3).orElseThrow().getReconnectAttemptCount()).isEqualTo(1);
            assertThat(errors).hasSize(1);
        }
    }

    private final class FakeTransport implements FeedTransport {
        private final List<Long> connectTimes = new CopyOnWriteArrayList<>();
        private final List<URI> uris = new CopyOnWriteArrayList<>();
        private final List<FeedListener> listeners = new CopyOnWriteArrayList<>();
        private final List<Sinks.Empty<Void>> sessions = new CopyOnWriteArrayList<>();
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private boolean failConnects;

        @Override
        public Mono<Void> connect(URI uri, FeedListener listener) {
            connectTimes.add(scheduler.now(TimeUnit.MILLISECONDS));
            uris.add(uri);
            listeners.add(listener);
            Sinks.Empty<Void> session = Sinks.empty();
            sessions.add(session);
            if (failConnects) {
                return Mono.error(new IOException("connection refused"));
            }
            return session.asMono();
        }

        void open(int connection) {
            listeners.get(connection).onOpen(sent::add);
        }

        void message(int connection, String payload) {
            listeners.get(connection).onMessage(payload);
        }

        void close(int connection) {
            sessions.get(connection).tryEmitEmpty();
        }
    }
}
