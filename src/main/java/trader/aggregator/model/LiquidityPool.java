package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Reserve snapshot of one constant-product pool. Treated as immutable for the duration of a calculation.
 */
@Value
@Builder(toBuilder = true)
public class LiquidityPool {
    String address;
    DexType dex;
    Token token0;
    Token token1;
    BigDecimal reserve0;
    BigDecimal reserve1;
    double fee;
    BigDecimal tvl;
    long chainId;

    public boolean touches(Token token) {
        return token0.sameAs(token) || token1.sameAs(token);
    }

    public Token otherToken(Token token) {
        if (token0.sameAs(token)) {
            return token1;
        }
        if (token1.sameAs(token)) {
            return token0;
        }
        throw new IllegalArgumentException("Pool " + address + " does not hold " + token.getSymbol());
    }

    public BigDecimal reserveOf(Token token) {
        if (token0.sameAs(token)) {
            return reserve0;
        }
        if (token1.sameAs(token)) {
            return reserve1;
        }
        throw new IllegalArgumentException("Pool " + address + " does not hold " + token.getSymbol());
    }
}
