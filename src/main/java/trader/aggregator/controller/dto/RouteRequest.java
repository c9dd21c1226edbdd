package trader.aggregator.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import trader.aggregator.model.Token;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {
    private Token tokenIn;
    private Token tokenOut;
    private BigDecimal amountIn;
    /** Split orders above the large-order threshold into slices. */
    private boolean largeVolume;
}
