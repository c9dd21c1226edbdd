package trader.aggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DexAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DexAggregatorApplication.class, args);
    }
}
