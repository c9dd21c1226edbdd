package trader.aggregator.service.aggregation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.model.ArbitrageOpportunity;
import trader.aggregator.model.PriceData;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairwise spread scan over the quotes of one pair.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArbitrageDetector {

    private static final BigDecimal MIN_TRADE_AMOUNT = BigDecimal.valueOf(1000);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AggregatorProperties properties;
    private final Clock clock;

    public List<ArbitrageOpportunity> findOpportunities(String pairKey, List<PriceData> prices) {
        List<ArbitrageOpportunity> opportunities = new ArrayList<>();

        for (int i = 0; i < prices.size(); i++) {
            for (int j = i + 1; j < prices.size(); j++) {
                PriceData first = prices.get(i);
                PriceData second = prices.get(j);

                if (first.getLiquidity().compareTo(properties.getMinLiquidity()) < 0
                        || second.getLiquidity().compareTo(properties.getMinLiquidity()) < 0) {
                    continue;
                }

                double spread = spreadPercent(first.getPrice(), second.getPrice());
                if (spread < properties.getArbitrageThreshold()) {
                    continue;
                }

                boolean firstIsCheaper = first.getPrice().compareTo(second.getPrice()) < 0;
                PriceData buy = firstIsCheaper ? first : second;
                PriceData sell = firstIsCheaper ? second : first;
                BigDecimal tradable = first.getLiquidity().min(second.getLiquidity());

                opportunities.add(ArbitrageOpportunity.builder()
                        .pairKey(pairKey)
                        .buyDex(buy.getDex())
                        .sellDex(sell.getDex())
                        .buyPrice(buy.getPrice())
                        .sellPrice(sell.getPrice())
                        .spreadPercent(spread)
                        .profitMargin(spread - properties.getArbitrageFeeBuffer())
                        .volume(tradable)
                        .riskScore(riskScore(first, second))
                        .minAmount(MIN_TRADE_AMOUNT)
                        .maxAmount(tradable)
                        .gasEstimate(first.getGasEstimate() + second.getGasEstimate())
                        .confidence(Math.min(first.getConfidence(), second.getConfidence()))
                        .detectedAt(clock.instant())
                        .build());
            }
        }

        opportunities.sort(Comparator.comparingDouble(ArbitrageOpportunity::getProfitMargin).reversed());
        if (!opportunities.isEmpty()) {
            log.info("Found {} arbitrage opportunities for {}, best spread {}%",
                    opportunities.size(), pairKey, opportunities.get(0).getSpreadPercent());
        }
        return opportunities;
    }

    /**
     * Absolute price difference relative to the lower price, in percent.
     */
    public static double spreadPercent(BigDecimal first, BigDecimal second) {
        BigDecimal lower = first.min(second);
        if (lower.signum() <= 0) {
            return 0;
        }
        return first.subtract(second).abs()
                .divide(lower, 10, RoundingMode.HALF_UP)
                .multiply(HUNDRED)
                .doubleValue();
    }

    static double riskScore(PriceData first, PriceData second) {
        double risk = 30;

        BigDecimal lowerLiquidity = first.getLiquidity().min(second.getLiquidity());
        if (lowerLiquidity.compareTo(BigDecimal.valueOf(100_000)) < 0) {
            risk += 20;
        }
        if (lowerLiquidity.compareTo(BigDecimal.valueOf(50_000)) < 0) {
            risk += 30;
        }

        double higherImpact = Math.max(first.getPriceImpact(), second.getPriceImpact());
        if (higherImpact > 2) {
            risk += 15;
        }
        if (higherImpact > 5) {
            risk += 25;
        }

        double lowerConfidence = Math.min(first.getConfidence(), second.getConfidence());
        if (lowerConfidence < 80) {
            risk += 10;
        }
        if (lowerConfidence < 60) {
            risk += 20;
        }

        if (first.getGasEstimate() + second.getGasEstimate() > 500_000) {
            risk += 15;
        }

        return Math.min(risk, 100);
    }
}
