package trader.aggregator.service.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.config.RoutingProperties;
import trader.aggregator.model.RevenueStats;
import trader.aggregator.model.ServiceFee;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

@Slf4j
@Component
public class ServiceFeeCalculator {

    private static final int SCALE = 18;
    private static final Duration DAY = Duration.ofDays(1);

    private final double rate;
    private final Clock clock;
    /** Fees of the last 24 hours, oldest first. */
    private final Deque<FeeRecord> recentRecords = new ArrayDeque<>();
    private BigDecimal totalRevenue = BigDecimal.ZERO;
    private long totalTransactions;

    public ServiceFeeCalculator(RoutingProperties properties, Clock clock) {
        this.rate = properties.getServiceFeeRate();
        this.clock = clock;
    }

    public ServiceFee calculate(BigDecimal inputAmount, String userAddress) {
        BigDecimal fee = inputAmount.multiply(BigDecimal.valueOf(rate)).setScale(SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        Instant now = clock.instant();
        synchronized (recentRecords) {
            recentRecords.addLast(new FeeRecord(now, fee));
            totalRevenue = totalRevenue.add(fee);
            totalTransactions++;
            pruneBefore(now.minus(DAY));
        }
        log.info("Service fee {} ({}%) on {} for {}", fee, rate * 100, inputAmount, userAddress);
        return ServiceFee.builder()
                .inputAmount(inputAmount)
                .fee(fee)
                .netAmount(inputAmount.subtract(fee))
                .rate(rate)
                .build();
    }

    public RevenueStats revenueStats() {
        synchronized (recentRecords) {
            pruneBefore(clock.instant().minus(DAY));
            BigDecimal daily = recentRecords.stream().map(FeeRecord::fee).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal average = totalTransactions == 0
                    ? BigDecimal.ZERO
                    : totalRevenue.divide(BigDecimal.valueOf(totalTransactions), SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
            return RevenueStats.builder()
                    .totalRevenue(totalRevenue)
                    .averageFee(average)
                    .dailyRevenue(daily)
                    .totalTransactions(totalTransactions)
                    .build();
        }
    }

    int retainedRecords() {
        synchronized (recentRecords) {
            return recentRecords.size();
        }
    }

    private void pruneBefore(Instant cutoff) {
        while (!recentRecords.isEmpty() && !recentRecords.peekFirst().at().isAfter(cutoff)) {
            recentRecords.removeFirst();
        }
    }

    private static final class FeeRecord {
        private final Instant at;
        private final BigDecimal fee;

        private FeeRecord(Instant at, BigDecimal fee) {
            this.at = at;
            this.fee = fee;
        }

        private Instant at() {
            return at;
        }

        private BigDecimal fee() {
            return fee;
        }
    }
}
