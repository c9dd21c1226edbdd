package trader.aggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.aggregator.model.DexType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "liquidity")
public class LiquidityProperties {
    private String rpcUrl = "https://bsc-dataseed.binance.org";
    private long refreshInterval = 60000;
    private OnChain onChain = new OnChain();
    private List<PoolDefinition> pools = new ArrayList<>();

    @Data
    public static class OnChain {
        private boolean enabled = false;
        private long chainId = 56;
    }

    @Data
    public static class PoolDefinition {
        private String address;
        private DexType dex;
        private long chainId = 1;
        private TokenDefinition token0;
        private TokenDefinition token1;
        private BigDecimal reserve0;
        private BigDecimal reserve1;
        private double fee = 0.003;
        private BigDecimal tvl = BigDecimal.ZERO;
    }

    @Data
    public static class TokenDefinition {
        private String address;
        private String symbol;
        private int decimals = 18;
    }
}
