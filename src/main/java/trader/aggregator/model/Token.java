package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

@Value
@Builder
@Jacksonized
public class Token {
    String address;
    String symbol;
    long chainId;
    @Builder.Default
    int decimals = 18;

    /**
     * Identity of the token inside the liquidity graph: chain plus lower-cased address.
     */
    public String key() {
        return chainId + ":" + address.toLowerCase(Locale.ROOT);
    }

    public boolean sameAs(Token other) {
        return other != null && key().equals(other.key());
    }
}
