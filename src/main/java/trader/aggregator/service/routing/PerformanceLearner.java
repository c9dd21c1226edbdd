package trader.aggregator.service.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.OptimizedRoute;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling execution history per route signature, used to scale confidence and risk of new routes.
 */
@Slf4j
@Component
public class PerformanceLearner {

    private static final double MAX_CONFIDENCE = 95;
    private static final double MIN_RISK = 5;

    private final Map<String, Deque<Boolean>> history = new ConcurrentHashMap<>();
    private final int historySize;

    public PerformanceLearner(RoutingProperties properties) {
        this.historySize = properties.getHistorySize();
    }

    public void recordOutcome(OptimizedRoute route, boolean success) {
        recordOutcome(route.signature(), success);
    }

    public void recordOutcome(String signature, boolean success) {
        Deque<Boolean> outcomes = history.computeIfAbsent(signature, key -> new ArrayDeque<>());
        synchronized (outcomes) {
            outcomes.addLast(success);
            while (outcomes.size() > historySize) {
                outcomes.pollFirst();
            }
        }
        log.debug("Recorded {} for route {}", success ? "success" : "failure", signature);
    }

    public OptionalDouble successRate(String signature) {
        Deque<Boolean> outcomes = history.get(signature);
        if (outcomes == null) {
            return OptionalDouble.empty();
        }
        synchronized (outcomes) {
            if (outcomes.isEmpty()) {
                return OptionalDouble.empty();
            }
            long successes = outcomes.stream().filter(Boolean::booleanValue).count();
            return OptionalDouble.of((double) successes / outcomes.size());
        }
    }

    public OptimizedRoute adjust(OptimizedRoute route) {
        OptionalDouble rate = successRate(route.signature());
        if (rate.isEmpty()) {
            return route;
        }
        double successRate = rate.getAsDouble();
        return route.toBuilder()
                .confidence(Math.min(MAX_CONFIDENCE, route.getConfidence() * successRate))
                .riskScore(Math.max(MIN_RISK, route.getRiskScore() * (2 - successRate)))
                .build();
    }

    public List<OptimizedRoute> adjust(List<OptimizedRoute> routes) {
        return routes.stream().map(this::adjust).toList();
    }

    public void clear() {
        history.clear();
    }

    public int trackedSignatures() {
        return history.size();
    }
}
