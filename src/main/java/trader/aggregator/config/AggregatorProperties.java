package trader.aggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.aggregator.model.DexType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    private long updateInterval = 5000;
    private long maxStaleTime = 30000;
    private boolean cacheEnabled = true;
    private long cacheTtl = 10000;
    private int maxConcurrentRequests = 10;
    private long timeout = 5000;
    private int retryAttempts = 3;
    private long retryBaseDelay = 1000;
    private boolean outlierDetection = true;
    /** Minimum spread in percent for an arbitrage opportunity. */
    private double arbitrageThreshold = 0.5;
    /** Assumed fee plus slippage in percent, subtracted from the spread. */
    private double arbitrageFeeBuffer = 0.6;
    private BigDecimal minLiquidity = BigDecimal.valueOf(10000);
    private boolean websocketEnabled = true;
    private int maxReconnectAttempts = 5;
    private long heartbeatTimeout = 60000;
    private List<DexType> enabledSources = new ArrayList<>(Arrays.asList(DexType.values()));
}
