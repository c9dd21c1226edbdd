package trader.aggregator.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceFeeRequest {
    private BigDecimal amountIn;
    private String userAddress;
}
