package trader.aggregator.service.feed;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import reactor.core.Disposable;
import trader.aggregator.client.FeedSender;
import trader.aggregator.model.PriceSource;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of the push connection to one source.
 */
@Getter
public class FeedConnection {

    private final PriceSource source;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean attemptLive = new AtomicBoolean();
    private volatile boolean open;
    private volatile boolean inactive;
    private volatile Instant lastHeartbeat;
    private volatile FeedSender sender;
    @Setter
    private volatile Disposable subscription;
    @Setter
    private volatile Instant nextReconnectAt;

    public FeedConnection(PriceSource source) {
        this.source = source;
    }

    void markOpen(FeedSender sender, Instant now) {
        this.sender = sender;
        this.open = true;
        this.lastHeartbeat = now;
        this.nextReconnectAt = null;
        reconnectAttempts.set(0);
    }

    void beginAttempt() {
        attemptLive.set(true);
    }

    /**
     * Ends the current connection attempt. Only the first caller per attempt gets {@code true}.
     */
    boolean endAttempt() {
        return attemptLive.compareAndSet(true, false);
    }

    void markClosed() {
        this.open = false;
        this.sender = null;
    }

    void markInactive() {
        markClosed();
        this.inactive = true;
    }

    void touch(Instant now) {
        this.lastHeartbeat = now;
    }

    public int getReconnectAttemptCount() {
        return reconnectAttempts.get();
    }
}
