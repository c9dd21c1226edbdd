package trader.aggregator.service.aggregation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import trader.aggregator.config.AggregatorProperties;
import trader.aggregator.exception.NoValidPricesException;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.model.PriceData;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Builds an {@link AggregatedPrice} from a set of quotes that already passed filtering.
 * Shared by the request path and the push-feed patch path.
 */
@Component
@RequiredArgsConstructor
public class AggregatedPriceAssembler {

    private final ArbitrageDetector arbitrageDetector;
    private final AggregatorProperties properties;
    private final Clock clock;

    public AggregatedPrice assemble(String pairKey, List<PriceData> allPrices, List<PriceData> validPrices) {
        if (validPrices.isEmpty()) {
            throw new NoValidPricesException(pairKey);
        }

        Instant now = clock.instant();
        Instant staleBefore = now.minusMillis(properties.getMaxStaleTime());

        PriceData best = validPrices.stream()
                .max(Comparator.comparing(PriceData::getAmountOut))
                .orElseThrow();

        return AggregatedPrice.builder()
                .pairKey(pairKey)
                .bestPrice(best)
                .allPrices(List.copyOf(allPrices))
                .validPrices(List.copyOf(validPrices))
                .stalePrices(allPrices.stream()
                        .filter(data -> data.getTimestamp().isBefore(staleBefore))
                        .toList())
                .priceSpread(PriceStatistics.spreadOf(validPrices))
                .arbitrageOpportunities(arbitrageDetector.findOpportunities(pairKey, validPrices))
                .lastUpdated(now)
                .build();
    }
}
