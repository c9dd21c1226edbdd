package trader.aggregator.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteOutcomeRequest {
    /** Dash-joined DEX sequence, e.g. {@code UNISWAP_V3-CURVE}. */
    private String signature;
    private boolean success;
}
