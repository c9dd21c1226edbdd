package trader.aggregator.client.adapter;

import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import trader.aggregator.model.DexType;
import trader.aggregator.model.Token;

import java.math.BigDecimal;

@Component
public class BalancerAdapter extends QueryStringSourceAdapter {

    @Override
    public DexType dex() {
        return DexType.BALANCER;
    }

    @Override
    protected String path() {
        return "/sor";
    }

    @Override
    protected void addQueryParams(MultiValueMap<String, String> params, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        params.add("sellToken", tokenIn.getAddress());
        params.add("buyToken", tokenOut.getAddress());
        params.add("sellAmount", plain(amountIn));
        params.add("chainId", String.valueOf(tokenIn.getChainId()));
    }
}
