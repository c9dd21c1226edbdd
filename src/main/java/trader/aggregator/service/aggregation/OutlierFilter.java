package trader.aggregator.service.aggregation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.model.PriceData;

import java.math.BigDecimal;
import java.util.List;

/**
 * Interquartile-range rejection over the prices of one aggregation pass.
 */
@Slf4j
@Component
public class OutlierFilter {

    static final int MIN_SAMPLE = 3;
    private static final BigDecimal FENCE = new BigDecimal("1.5");

    public List<PriceData> filter(List<PriceData> prices) {
        if (prices.size() < MIN_SAMPLE) {
            return prices;
        }

        List<BigDecimal> sorted = prices.stream()
                .map(PriceData::getPrice)
                .sorted()
                .toList();

        // lower nearest rank over n-1
        int last = sorted.size() - 1;
        BigDecimal q1 = sorted.get((int) Math.floor(0.25 * last));
        BigDecimal q3 = sorted.get((int) Math.floor(0.75 * last));
        BigDecimal iqr = q3.subtract(q1);
        BigDecimal lowerBound = q1.subtract(iqr.multiply(FENCE));
        BigDecimal upperBound = q3.add(iqr.multiply(FENCE));

        List<PriceData> kept = prices.stream()
                .filter(data -> data.getPrice().compareTo(lowerBound) >= 0 && data.getPrice().compareTo(upperBound) <= 0)
                .toList();

        if (kept.size() < prices.size()) {
            log.info("Outlier filter removed {} of {} prices outside [{}, {}]",
                    prices.size() - kept.size(), prices.size(), lowerBound, upperBound);
        }
        return kept;
    }
}
