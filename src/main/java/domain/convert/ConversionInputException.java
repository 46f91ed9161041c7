package domain.convert;

/**
 * Client input rejected before any pipeline runs (blank code, missing or unknown grammar id).
 */
public class ConversionInputException extends IllegalArgumentException {

    public ConversionInputException(String message) {
        super(message);
    }
}
