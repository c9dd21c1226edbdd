package trader.aggregator.service.routing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.OptimizedRoute;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Equal-slice decomposition of large orders.
 */
@Component
@RequiredArgsConstructor
public class VolumeSplitter {

    private static final int SCALE = 18;
    private static final double MIN_RISK = 5;

    private final RoutingProperties properties;

    public boolean isLargeOrder(BigDecimal amount) {
        return amount.compareTo(properties.getLargeOrderThreshold()) > 0;
    }

    /**
     * {@code ceil(amount / maxSplitSize)} equal slices; rounding dust goes to the last one so the slices sum to the amount.
     */
    public List<BigDecimal> split(BigDecimal amount) {
        if (!isLargeOrder(amount)) {
            return List.of(amount);
        }
        int slices = amount.divide(properties.getMaxSplitSize(), 0, RoundingMode.CEILING).intValueExact();
        BigDecimal slice = amount.divide(BigDecimal.valueOf(slices), SCALE, RoundingMode.DOWN).stripTrailingZeros();

        List<BigDecimal> result = new ArrayList<>(slices);
        for (int i = 0; i < slices - 1; i++) {
            result.add(slice);
        }
        result.add(amount.subtract(slice.multiply(BigDecimal.valueOf(slices - 1L))));
        return result;
    }

    public OptimizedRoute markSplit(OptimizedRoute route) {
        return route.toBuilder()
                .split(true)
                .estimatedTimeSeconds(route.getEstimatedTimeSeconds() + properties.getSplitTimePenalty())
                .riskScore(Math.max(MIN_RISK, route.getRiskScore() - properties.getSplitRiskReduction()))
                .build();
    }
}
