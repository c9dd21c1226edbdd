package trader.aggregator.service.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import trader.aggregator.client.FeedListener;
import trader.aggregator.client.FeedSender;
import trader.aggregator.client.FeedTransport;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.SourceErrorEvent;
import trader.aggregator.model.SourceErrorType;
import trader.aggregator.service.aggregation.AggregatedPriceAssembler;
import trader.aggregator.service.aggregation.PriceCache;
import trader.aggregator.service.aggregation.PriceDataValidator;
import trader.aggregator.service.event.EngineEvents;
import trader.aggregator.service.source.SourceRegistry;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps one push connection per source that offers a feed, patching cached aggregates with incremental
 * price updates. Closed connections are retried after {@code 2^attempts} seconds until
 * {@code maxReconnectAttempts} is exhausted, after which the source is deactivated for the session.
 */
@Slf4j
@Component
public class FeedManager {

    static final String PING_MESSAGE = "{\"type\":\"ping\"}";

    private final FeedTransport feedTransport;
    private final SourceRegistry sourceRegistry;
    private final PriceCache priceCache;
    private final AggregatedPriceAssembler assembler;
    private final PriceDataValidator validator;
    private final EngineEvents events;
    private final AggregatorProperties properties;
    private final Scheduler engineScheduler;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Counter feedUpdatesCounter;

    private final Map<DexType, FeedConnection> connections = new ConcurrentHashMap<>();
    private final AtomicLong appliedUpdates = new AtomicLong();
    private volatile boolean stopped;

    public FeedManager(FeedTransport feedTransport,
                       SourceRegistry sourceRegistry,
                       PriceCache priceCache,
                       AggregatedPriceAssembler assembler,
                       PriceDataValidator validator,
                       EngineEvents events,
                       AggregatorProperties properties,
                       @Qualifier("engineScheduler") Scheduler engineScheduler,
                       Clock clock,
                       ObjectMapper objectMapper,
                       Counter feedUpdatesCounter) {
        this.feedTransport = feedTransport;
        this.sourceRegistry = sourceRegistry;
        this.priceCache = priceCache;
        this.assembler = assembler;
        this.validator = validator;
        this.events = events;
        this.properties = properties;
        this.engineScheduler = engineScheduler;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.feedUpdatesCounter = feedUpdatesCounter;
    }

    public void start() {
        if (!properties.isWebsocketEnabled()) {
            log.info("Push feeds disabled by configuration");
            return;
        }
        stopped = false;
        sourceRegistry.all().stream()
                .filter(PriceSource::hasFeed)
                .filter(source -> sourceRegistry.isActive(source.getDex()))
                .forEach(this::open);
    }

    public void open(PriceSource source) {
        FeedConnection connection = connections.computeIfAbsent(source.getDex(), dex -> new FeedConnection(source));
        if (connection.isOpen() || connection.isInactive()) {
            return;
        }
        connect(connection);
    }

    /**
     * Registers interest in a pair; sent immediately when the feed is open and replayed on every reconnect.
     */
    public void subscribe(DexType dex, String pairKey) {
        FeedConnection connection = connections.get(dex);
        if (connection == null) {
            log.debug("No push feed for {}, ignoring subscription to {}", dex, pairKey);
            return;
        }
        if (connection.getSubscriptions().add(pairKey) && connection.isOpen()) {
            send(connection, subscribeMessage(pairKey));
        }
    }

    /**
     * Pings every open feed and force-closes those silent for longer than {@code heartbeatTimeout}.
     */
    public void heartbeat() {
        Instant now = clock.instant();
        for (FeedConnection connection : connections.values()) {
            if (!connection.isOpen()) {
                continue;
            }
            long silentFor = Duration.between(connection.getLastHeartbeat(), now).toMillis();
            if (silentFor > properties.getHeartbeatTimeout()) {
                log.warn("No traffic from {} feed for {}ms, forcing reconnect", connection.getSource().getName(), silentFor);
                Disposable subscription = connection.getSubscription();
                if (subscription != null) {
                    subscription.dispose();
                }
                handleClose(connection, new TimeoutException("Heartbeat timeout after " + silentFor + "ms"));
            } else {
                send(connection, PING_MESSAGE);
            }
        }
    }

    public void disconnectAll() {
        stopped = true;
        connections.values().forEach(connection -> {
            Disposable subscription = connection.getSubscription();
            if (subscription != null) {
                subscription.dispose();
            }
            connection.markClosed();
        });
        log.info("All push feeds disconnected");
    }

    public int activeConnectionCount() {
        return (int) connections.values().stream().filter(FeedConnection::isOpen).count();
    }

    public Optional<FeedConnection> connection(DexType dex) {
        return Optional.ofNullable(connections.get(dex));
    }

    public long getAppliedUpdates() {
        return appliedUpdates.get();
    }

    public static Duration reconnectDelay(int attempts) {
        return Duration.ofSeconds(1L << Math.min(attempts, 20));
    }

    private void connect(FeedConnection connection) {
        if (stopped || connection.isInactive()) {
            return;
        }
        PriceSource source = connection.getSource();
        connection.beginAttempt();
        Disposable subscription = feedTransport.connect(URI.create(source.getWebsocketUrl()), new FeedListener() {
                    @Override
                    public void onOpen(FeedSender sender) {
                        handleOpen(connection, sender);
                    }

                    @Override
                    public void onMessage(String payload) {
                        handleMessage(connection, payload);
                    }
                })
                .subscribe(
                        null,
                        error -> handleClose(connection, error),
                        () -> handleClose(connection, null)
                );
        connection.setSubscription(subscription);
    }

    private void handleOpen(FeedConnection connection, FeedSender sender) {
        connection.markOpen(sender, clock.instant());
        log.info("{} push feed connected", connection.getSource().getName());
        connection.getSubscriptions().forEach(pairKey -> send(connection, subscribeMessage(pairKey)));
    }

    private void handleClose(FeedConnection connection, Throwable error) {
        if (!connection.endAttempt()) {
            log.debug("{} push feed already closed", connection.getSource().getName());
            return;
        }
        connection.markClosed();
        if (stopped) {
            return;
        }

        PriceSource source = connection.getSource();
        String reason = error == null ? "closed by remote" : String.valueOf(error.getMessage());
        log.warn("{} push feed disconnected: {}", source.getName(), reason);
        report(source.getDex(), SourceErrorType.FEED_DISCONNECTED, reason);

        int attempts = connection.getReconnectAttemptCount();
        if (attempts >= properties.getMaxReconnectAttempts()) {
            connection.markInactive();
            sourceRegistry.deactivate(source.getDex(), "push feed gave up after " + attempts + " reconnect attempts");
            return;
        }

        Duration delay = reconnectDelay(attempts);
        connection.getReconnectAttempts().incrementAndGet();
        connection.setNextReconnectAt(clock.instant().plus(delay));
        log.info("Reconnecting {} push feed in {}s (attempt {}/{})",
                source.getName(), delay.toSeconds(), attempts + 1, properties.getMaxReconnectAttempts());
        engineScheduler.schedule(() -> connect(connection), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void handleMessage(FeedConnection connection, String payload) {
        connection.touch(clock.instant());

        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Unparsable message from {} feed: {}", connection.getSource().getName(), e.getMessage());
            return;
        }

        String type = message.path("type").asText();
        if ("price_update".equals(type)) {
            applyPriceUpdate(connection.getSource(), message);
        } else if ("pong".equals(type)) {
            log.debug("Pong from {} feed", connection.getSource().getName());
        }
    }

    private void applyPriceUpdate(PriceSource source, JsonNode message) {
        String pairKey = message.path("tokenPair").asText("");
        Optional<AggregatedPrice> cached = priceCache.getAny(pairKey);
        if (cached.isEmpty()) {
            log.debug("No cached aggregate for {}, dropping {} update", pairKey, source.getName());
            return;
        }

        PriceData patched;
        try {
            patched = cached.get().getAllPrices().stream()
                    .filter(quote -> quote.getDex() == source.getDex())
                    .findFirst()
                    .map(quote -> patch(quote, message))
                    .orElse(null);
        } catch (NumberFormatException e) {
            report(source.getDex(), SourceErrorType.INVALID_PRICE_DATA, "Non-numeric feed update: " + e.getMessage());
            return;
        }
        if (patched == null) {
            return;
        }

        Optional<String> violation = validator.violation(patched);
        if (violation.isPresent()) {
            log.warn("Rejected {} feed update for {}: {}", source.getName(), pairKey, violation.get());
            report(source.getDex(), SourceErrorType.INVALID_PRICE_DATA, violation.get());
            return;
        }

        AggregatedPrice current = cached.get();
        AggregatedPrice recomputed = assembler.assemble(pairKey,
                replace(current.getAllPrices(), patched),
                replace(current.getValidPrices(), patched));
        priceCache.put(recomputed);
        appliedUpdates.incrementAndGet();
        feedUpdatesCounter.increment();
        log.debug("Applied {} feed update to {}: price {}", source.getName(), pairKey, patched.getPrice());
        events.publishPriceUpdate(recomputed);
    }

    private PriceData patch(PriceData quote, JsonNode message) {
        return quote.toBuilder()
                .price(decimal(message, "price").orElse(quote.getPrice()))
                .amountOut(decimal(message, "amountOut").orElse(quote.getAmountOut()))
                .liquidity(decimal(message, "liquidity").orElse(quote.getLiquidity()))
                .timestamp(clock.instant())
                .build();
    }

    private static List<PriceData> replace(List<PriceData> quotes, PriceData patched) {
        List<PriceData> result = new ArrayList<>(quotes.size());
        for (PriceData quote : quotes) {
            result.add(quote.getDex() == patched.getDex() ? patched : quote);
        }
        return result;
    }

    private static Optional<BigDecimal> decimal(JsonNode message, String field) {
        JsonNode value = message.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText()));
    }

    private void send(FeedConnection connection, String text) {
        FeedSender sender = connection.getSender();
        if (sender == null) {
            return;
        }
        try {
            sender.send(text);
        } catch (RuntimeException e) {
            log.error("Error sending to {} feed: {}", connection.getSource().getName(), e.getMessage());
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

    private static String subscribeMessage(String pairKey) {
        return "{\"type\":\"subscribe\",\"tokenPair\":\"" + pairKey + "\"}";
    }
}
