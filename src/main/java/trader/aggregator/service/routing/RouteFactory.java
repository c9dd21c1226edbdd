package trader.aggregator.service.routing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import trader.aggregator.model.OptimizedRoute;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.RouteStep;
import trader.aggregator.model.RouteType;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class RouteFactory {

    private final RouteScorer scorer;

    /**
     * Single-step route straight from an aggregator quote, keeping the quote's own confidence and gas.
     */
    public OptimizedRoute fromQuote(PriceData quote, BigDecimal amountIn) {
        List<RouteStep> steps = List.of(RouteStep.builder()
                .dex(quote.getDex())
                .tokenIn(quote.getTokenIn())
                .tokenOut(quote.getTokenOut())
                .amountIn(amountIn)
                .amountOut(quote.getAmountOut())
                .poolAddress(quote.getPoolAddress())
                .fee(quote.getFee())
                .priceImpact(quote.getPriceImpact())
                .build());

        return OptimizedRoute.builder()
                .id(UUID.randomUUID().toString())
                .type(RouteType.DIRECT)
                .steps(steps)
                .totalGas(quote.getGasEstimate())
                .totalFee(quote.getFee())
                .totalPriceImpact(quote.getPriceImpact())
                .confidence(quote.getConfidence())
                .estimatedOutput(quote.getAmountOut())
                .estimatedTimeSeconds(scorer.estimatedSecondsFor(steps.size()))
                .riskScore(scorer.riskFor(steps))
                .build();
    }

    public OptimizedRoute fromSteps(RouteType type, List<RouteStep> steps, long totalGas) {
        return OptimizedRoute.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .steps(List.copyOf(steps))
                .totalGas(totalGas)
                .totalFee(steps.stream().mapToDouble(RouteStep::getFee).sum())
                .totalPriceImpact(steps.stream().mapToDouble(RouteStep::getPriceImpact).sum())
                .confidence(scorer.confidenceFor(steps))
                .estimatedOutput(steps.get(steps.size() - 1).getAmountOut())
                .estimatedTimeSeconds(scorer.estimatedSecondsFor(steps.size()))
                .riskScore(scorer.riskFor(steps))
                .build();
    }
}
