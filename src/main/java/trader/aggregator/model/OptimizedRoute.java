package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizedRoute {
    String id;
    RouteType type;
    List<RouteStep> steps;
    long totalGas;
    double totalFee;
    double totalPriceImpact;
    double confidence;
    BigDecimal estimatedOutput;
    int estimatedTimeSeconds;
    double riskScore;
    Double profitMargin;
    boolean split;

    /**
     * Ordered DEX sequence of the route, used as the key of its execution history.
     */
    public String signature() {
        return steps.stream()
                .map(step -> step.getDex().name())
                .collect(Collectors.joining("-"));
    }
}
