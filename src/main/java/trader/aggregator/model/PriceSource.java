package trader.aggregator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Static connection metadata of one price source.
 */
@Value
@Builder
public class PriceSource {
    DexType dex;
    String name;
    String apiEndpoint;
    String websocketUrl;
    int rateLimit;
    long rateWindowMillis;
    double reliability;
    @Singular
    List<Long> supportedChains;
    @Singular
    Map<String, String> headers;

    public boolean supportsChain(long chainId) {
        return supportedChains.isEmpty() || supportedChains.contains(chainId);
    }

    public boolean hasFeed() {
        return websocketUrl != null && !websocketUrl.isBlank();
    }
}
