package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PriceSpread {
    double min;
    double max;
    double median;
    double average;
    double standardDeviation;
}
