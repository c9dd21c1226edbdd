package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RevenueStats {
    BigDecimal totalRevenue;
    BigDecimal averageFee;
    BigDecimal dailyRevenue;
    long totalTransactions;
}
