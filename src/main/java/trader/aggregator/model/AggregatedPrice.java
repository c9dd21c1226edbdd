package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Value
@Builder(toBuilder = true)
public class AggregatedPrice {
    String pairKey;
    PriceData bestPrice;
    List<PriceData> allPrices;
    List<PriceData> validPrices;
    List<PriceData> stalePrices;
    PriceSpread priceSpread;
    List<ArbitrageOpportunity> arbitrageOpportunities;
    Instant lastUpdated;

    public static String pairKey(Token tokenIn, Token tokenOut) {
        return tokenIn.getChainId() + "-"
                + tokenIn.getAddress().toLowerCase(Locale.ROOT) + "-"
                + tokenOut.getAddress().toLowerCase(Locale.ROOT);
    }
}
