package trader.aggregator.service.routing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.OptimizationObjective;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.RouteStep;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-route confidence, risk and timing, and ranking under an {@link OptimizationObjective}.
 */
@Component
@RequiredArgsConstructor
public class RouteScorer {

    private final RoutingProperties properties;

    public double confidenceFor(List<RouteStep> steps) {
        boolean allPoolsKnown = !steps.isEmpty() && steps.stream().allMatch(step -> step.getPoolAddress() != null);
        double confidence = 95 - steps.size() * 5 + (allPoolsKnown ? 5 : 0);
        return Math.max(60, confidence);
    }

    public double riskFor(List<RouteStep> steps) {
        double totalImpact = steps.stream().mapToDouble(RouteStep::getPriceImpact).sum();
        return Math.min(100, 10 + steps.size() * 15 + totalImpact * 10);
    }

    public int estimatedSecondsFor(int stepCount) {
        return stepCount * 15 + 5;
    }

    public List<OptimizedRoute> rank(List<OptimizedRoute> routes, OptimizationObjective objective) {
        List<OptimizedRoute> ranked = new ArrayList<>(routes);
        ranked.sort(comparator(objective, routes));
        return ranked;
    }

    public Comparator<OptimizedRoute> comparator(OptimizationObjective objective, List<OptimizedRoute> candidates) {
        switch (objective) {
            case PRICE:
                return Comparator.comparing(OptimizedRoute::getEstimatedOutput).reversed();
            case GAS:
                return Comparator.comparingLong(OptimizedRoute::getTotalGas);
            case SPEED:
                return Comparator.comparingInt(OptimizedRoute::getEstimatedTimeSeconds);
            case BALANCED:
            default:
                BigDecimal maxOutput = candidates.stream()
                        .map(OptimizedRoute::getEstimatedOutput)
                        .max(Comparator.naturalOrder())
                        .orElse(BigDecimal.ZERO);
                return Comparator.comparingDouble((OptimizedRoute route) -> balancedScore(route, maxOutput)).reversed();
        }
    }

    /**
     * Weighted sum of normalized output, gas saved, speed, confidence and inverse risk.
     */
    public double balancedScore(OptimizedRoute route, BigDecimal maxOutput) {
        RoutingProperties.Weights weights = properties.getWeights();

        double output = maxOutput.signum() > 0
                ? route.getEstimatedOutput().divide(maxOutput, MathContext.DECIMAL64).doubleValue()
                : 0;
        double gasSaved = (double) (properties.getGasCeiling() - route.getTotalGas()) / properties.getGasCeiling();
        double speed = (double) (properties.getSpeedCeiling() - route.getEstimatedTimeSeconds()) / properties.getSpeedCeiling();

        return output * weights.getOutput()
                + gasSaved * weights.getGas()
                + speed * weights.getSpeed()
                + route.getConfidence() / 100 * weights.getConfidence()
                + (100 - route.getRiskScore()) / 100 * weights.getRisk();
    }
}
