package trader.aggregator.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import trader.aggregator.exception.InvalidPriceDataException;

import java.math.BigDecimal;
import java.util.Optional;

@UtilityClass
class JsonFields {

    Optional<BigDecimal> decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            throw new InvalidPriceDataException("Field '" + field + "' is not numeric: " + text, e);
        }
    }

    Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    double number(JsonNode node, String field, double defaultValue) {
        return decimal(node, field).map(BigDecimal::doubleValue).orElse(defaultValue);
    }
}
