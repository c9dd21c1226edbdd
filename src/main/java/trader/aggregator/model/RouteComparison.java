package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RouteComparison {
    OptimizedRoute route;
    int rank;
    double differenceFromBestPercent;
    String recommendation;
}
