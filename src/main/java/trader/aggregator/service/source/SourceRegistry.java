package trader.aggregator.service.source;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import trader.aggregator.config.SourceProperties;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceSource;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-DEX connection metadata and rate limiters. Sources that exhaust their feed reconnects
 * are deactivated here for the rest of the session.
 */
@Slf4j
@Component
public class SourceRegistry {

    private final Map<DexType, PriceSource> sources = new EnumMap<>(DexType.class);
    private final Map<DexType, RateLimiter> limiters = new EnumMap<>(DexType.class);
    private final Set<DexType> inactive = ConcurrentHashMap.newKeySet();
    private final Clock clock;

    @Autowired
    public SourceRegistry(SourceProperties properties, Dotenv dotenv, Clock clock) {
        this(toSources(properties, dotenv), clock);
        properties.getDefinitions().stream()
                .filter(definition -> !definition.isActive())
                .forEach(definition -> inactive.add(definition.getDex()));
    }

    public SourceRegistry(List<PriceSource> sources, Clock clock) {
        this.clock = clock;
        for (PriceSource source : sources) {
            this.sources.put(source.getDex(), source);
            this.limiters.put(source.getDex(), new RateLimiter(source.getRateLimit(), source.getRateWindowMillis()));
        }
        log.info("Price source registry initialized with {}", this.sources.keySet());
    }

    public Optional<PriceSource> find(DexType dex) {
        return Optional.ofNullable(sources.get(dex));
    }

    public Collection<PriceSource> all() {
        return sources.values();
    }

    /**
     * Active sources out of {@code enabled} that serve the given chain, in the order of {@code enabled}.
     */
    public List<PriceSource> eligibleSources(Collection<DexType> enabled, long chainId) {
        return enabled.stream()
                .distinct()
                .map(sources::get)
                .filter(source -> source != null && isActive(source.getDex()) && source.supportsChain(chainId))
                .toList();
    }

    public boolean canAdmit(DexType dex) {
        RateLimiter limiter = limiters.get(dex);
        return limiter != null && limiter.canAdmit(clock.millis());
    }

    public void record(DexType dex) {
        RateLimiter limiter = limiters.get(dex);
        if (limiter != null) {
            limiter.record(clock.millis());
        }
    }

    public boolean tryAcquire(DexType dex) {
        RateLimiter limiter = limiters.get(dex);
        return limiter != null && limiter.tryAcquire(clock.millis());
    }

    public boolean isActive(DexType dex) {
        return sources.containsKey(dex) && !inactive.contains(dex);
    }

    public void deactivate(DexType dex, String reason) {
        if (inactive.add(dex)) {
            log.warn("Price source {} marked inactive: {}", dex, reason);
        }
    }

    private static List<PriceSource> toSources(SourceProperties properties, Dotenv dotenv) {
        return properties.getDefinitions().stream()
                .map(definition -> toSource(definition, dotenv))
                .toList();
    }

    private static PriceSource toSource(SourceProperties.Definition definition, Dotenv dotenv) {
        PriceSource.PriceSourceBuilder builder = PriceSource.builder()
                .dex(definition.getDex())
                .name(definition.getName() != null ? definition.getName() : definition.getDex().getDisplayName())
                .apiEndpoint(definition.getApiEndpoint())
                .websocketUrl(definition.getWebsocketUrl())
                .rateLimit(definition.getRateLimit())
                .rateWindowMillis(definition.getRateWindow())
                .reliability(definition.getReliability())
                .supportedChains(definition.getSupportedChains())
                .headers(definition.getHeaders());

        if (definition.getApiKeyEnv() != null) {
            String apiKey = dotenv.get(definition.getApiKeyEnv(), null);
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("API key {} for {} not found in environment", definition.getApiKeyEnv(), definition.getDex());
            } else {
                builder.header(definition.getApiKeyHeader(), apiKey);
            }
        }
        return builder.build();
    }
}
