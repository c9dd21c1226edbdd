package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EngineStats {
    long totalRequests;
    long successfulRequests;
    long failedRequests;
    long cacheHits;
    long feedUpdates;
    long arbitrageOpportunities;
    double averageResponseTimeMillis;
    int cacheSize;
    int activeFeeds;
}
