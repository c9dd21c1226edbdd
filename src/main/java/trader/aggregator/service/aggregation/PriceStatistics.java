package trader.aggregator.service.aggregation;

import lombok.experimental.UtilityClass;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSpread;

import java.util.List;

@UtilityClass
public class PriceStatistics {

    public PriceSpread spreadOf(List<PriceData> prices) {
        double[] sorted = prices.stream()
                .mapToDouble(data -> data.getPrice().doubleValue())
                .sorted()
                .toArray();
        if (sorted.length == 0) {
            return PriceSpread.builder().build();
        }

        double mean = 0;
        for (double price : sorted) {
            mean += price;
        }
        mean /= sorted.length;

        double variance = 0;
        for (double price : sorted) {
            variance += (price - mean) * (price - mean);
        }
        variance /= sorted.length;

        return PriceSpread.builder()
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .median(sorted[sorted.length / 2])
                .average(mean)
                .standardDeviation(Math.sqrt(variance))
                .build();
    }
}
