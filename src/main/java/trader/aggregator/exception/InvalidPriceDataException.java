package trader.aggregator.exception;

/**
 * A source answered, but its body could not be turned into a usable quote.
 */
public class InvalidPriceDataException extends RuntimeException {
    public InvalidPriceDataException(String message) {
        super(message);
    }

    public InvalidPriceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
