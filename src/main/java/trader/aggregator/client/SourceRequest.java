package trader.aggregator.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.util.Map;

@Value
@Builder
public class SourceRequest {
    @Builder.Default
    HttpMethod method = HttpMethod.GET;
    URI uri;
    @Singular
    Map<String, String> headers;
}
