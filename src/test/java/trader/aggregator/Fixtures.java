package trader.aggregator;

import trader.aggregator.model.DexType;
import trader.aggregator.model.LiquidityPool;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Shared tokens, quotes and a controllable clock for engine tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    public static final Token USDC = token("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", "USDC", 6);
    public static final Token WETH = token("0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", "WETH", 18);
    public static final Token USDT = token("0xdAC17F958D2ee523a2206206994597C13D831ec7", "USDT", 6);
    public static final Token DAI = token("0x6B175474E89094C44Da98b954EedeAC495271d0F", "DAI", 18);
    public static final Token LINK = token("0x514910771AF9Ca656af840dff83E8264EcF986CA", "LINK", 18);

    private Fixtures() {
    }

    public static Token token(String address, String symbol, int decimals) {
        return Token.builder().address(address).symbol(symbol).chainId(1).decimals(decimals).build();
    }

    public static PriceData quote(DexType dex, String price) {
        return quote(dex, new BigDecimal(price), T0);
    }

    public static PriceData quote(DexType dex, BigDecimal price, Instant timestamp) {
        return PriceData.builder()
                .dex(dex)
                .source(dex.getDisplayName())
                .tokenIn(USDC)
                .tokenOut(WETH)
                .price(price)
                .amountOut(price)
                .priceImpact(0.1)
                .liquidity(BigDecimal.valueOf(1_000_000))
                .gasEstimate(150_000)
                .timestamp(timestamp)
                .confidence(90)
                .poolAddress("0xpool-" + dex.name().toLowerCase())
                .build();
    }

    public static PriceSource source(DexType dex, String websocketUrl) {
        return PriceSource.builder()
                .dex(dex)
                .name(dex.getDisplayName())
                .apiEndpoint("https://" + dex.name().toLowerCase() + ".example")
                .websocketUrl(websocketUrl)
                .rateLimit(5)
                .rateWindowMillis(1000)
                .reliability(90)
                .supportedChain(1L)
                .build();
    }

    public static LiquidityPool pool(String address, DexType dex, Token token0, Token token1,
                                     String reserve0, String reserve1, String tvl) {
        return LiquidityPool.builder()
                .address(address)
                .dex(dex)
                .token0(token0)
                .token1(token1)
                .reserve0(new BigDecimal(reserve0))
                .reserve1(new BigDecimal(reserve1))
                .fee(0.003)
                .tvl(new BigDecimal(tvl))
                .chainId(1)
                .build();
    }

    /**
     * Clock that only moves when told to.
     */
    public static final class MutableClock extends Clock {
        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
