package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ServiceFee {
    BigDecimal inputAmount;
    BigDecimal fee;
    BigDecimal netAmount;
    double rate;
}
