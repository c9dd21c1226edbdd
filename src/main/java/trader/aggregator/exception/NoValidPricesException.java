package trader.aggregator.exception;

import lombok.Getter;

/**
 * Raised when no source produced a quote that survived validation and outlier filtering.
 */
@Getter
public class NoValidPricesException extends RuntimeException {
    private final String pairKey;

    public NoValidPricesException(String pairKey) {
        super("No valid prices found for " + pairKey);
        this.pairKey = pairKey;
    }
}
