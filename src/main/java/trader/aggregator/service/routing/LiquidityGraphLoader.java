package trader.aggregator.service.routing;

import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import trader.aggregator.client.OnChainReserveClient;
import trader.aggregator.config.LiquidityProperties;
import trader.aggregator.model.LiquidityPool;
import trader.aggregator.model.Token;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link LiquidityGraph} from configured pools, refreshing reserves on-chain when enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiquidityGraphLoader {

    private final LiquidityProperties properties;
    private final LiquidityGraph graph;
    private final OnChainReserveClient reserveClient;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        reload();
    }

    @Scheduled(fixedRateString = "${liquidity.refresh-interval:60000}", initialDelayString = "${liquidity.refresh-interval:60000}")
    @Observed(name = "liquidity.refresh", contextualName = "reload-liquidity-graph")
    public void reload() {
        List<LiquidityPool> pools = new ArrayList<>();
        for (LiquidityProperties.PoolDefinition definition : properties.getPools()) {
            LiquidityPool pool = toPool(definition);
            if (properties.getOnChain().isEnabled() && pool.getChainId() == properties.getOnChain().getChainId()) {
                pool = refresh(pool);
            }
            pools.add(pool);
        }
        graph.replaceAll(pools);
    }

    private LiquidityPool refresh(LiquidityPool pool) {
        try {
            return reserveClient.refreshReserves(pool);
        } catch (IOException e) {
            log.warn("Keeping configured reserves for pool {}: {}", pool.getAddress(), e.getMessage());
            return pool;
        }
    }

    static LiquidityPool toPool(LiquidityProperties.PoolDefinition definition) {
        return LiquidityPool.builder()
                .address(definition.getAddress())
                .dex(definition.getDex())
                .chainId(definition.getChainId())
                .token0(toToken(definition.getToken0(), definition.getChainId()))
                .token1(toToken(definition.getToken1(), definition.getChainId()))
                .reserve0(definition.getReserve0())
                .reserve1(definition.getReserve1())
                .fee(definition.getFee())
                .tvl(definition.getTvl())
                .build();
    }

    private static Token toToken(LiquidityProperties.TokenDefinition definition, long chainId) {
        return Token.builder()
                .address(definition.getAddress())
                .symbol(definition.getSymbol())
                .decimals(definition.getDecimals())
                .chainId(chainId)
                .build();
    }
}
