package trader.aggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.aggregator.model.DexType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourceProperties {
    private List<Definition> definitions = new ArrayList<>();

    @Data
    public static class Definition {
        private DexType dex;
        private String name;
        private String apiEndpoint;
        private String websocketUrl;
        private int rateLimit = 5;
        private long rateWindow = 1000;
        private double reliability = 90;
        private boolean active = true;
        private List<Long> supportedChains = new ArrayList<>();
        private Map<String, String> headers = new HashMap<>();
        /** Name of the .env entry holding the API key, if the source needs one. */
        private String apiKeyEnv;
        private String apiKeyHeader = "x-api-key";
    }
}
