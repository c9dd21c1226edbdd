package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SourceErrorEvent {
    DexType dex;
    SourceErrorType type;
    String message;
    Instant timestamp;
}
