package trader.aggregator.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import trader.aggregator.model.LiquidityPool;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * Reads {@code getReserves()} of a constant-product pair contract with a plain {@code eth_call}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnChainReserveClient {

    private static final String READ_ONLY_CALLER = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;

    public LiquidityPool refreshReserves(LiquidityPool pool) throws IOException {
        Function getReserves = new Function(
                "getReserves",
                Collections.emptyList(),
                List.of(new TypeReference<Uint112>() {}, new TypeReference<Uint112>() {}, new TypeReference<Uint32>() {})
        );

        EthCall response = web3j.ethCall(
                Transaction.createEthCallTransaction(READ_ONLY_CALLER, pool.getAddress(), FunctionEncoder.encode(getReserves)),
                DefaultBlockParameterName.LATEST
        ).send();

        if (response.hasError()) {
            throw new IOException("getReserves failed for " + pool.getAddress() + ": " + response.getError().getMessage());
        }

        List<?> values = FunctionReturnDecoder.decode(response.getValue(), getReserves.getOutputParameters());
        if (values.size() < 2) {
            throw new IOException("Empty getReserves response for " + pool.getAddress());
        }

        BigInteger raw0 = (BigInteger) ((Type<?>) values.get(0)).getValue();
        BigInteger raw1 = (BigInteger) ((Type<?>) values.get(1)).getValue();
        log.debug("Reserves of {}: {} / {}", pool.getAddress(), raw0, raw1);

        return pool.toBuilder()
                .reserve0(new BigDecimal(raw0, pool.getToken0().getDecimals()))
                .reserve1(new BigDecimal(raw1, pool.getToken1().getDecimals()))
                .build();
    }
}
