package trader.aggregator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DexType {
    UNISWAP_V3("Uniswap V3"),
    JUPITER("Jupiter"),
    SUSHISWAP("SushiSwap"),
    CURVE("Curve"),
    BALANCER("Balancer"),
    PANCAKESWAP("PancakeSwap");

    private final String displayName;
}
