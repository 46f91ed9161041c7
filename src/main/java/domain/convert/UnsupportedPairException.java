package domain.convert;

import java.util.List;

/**
 * No pipeline is registered for the requested grammar pair.
 */
public final class UnsupportedPairException extends ConversionInputException {

    private final List<String> supportedPairs;

    public UnsupportedPairException(String source, String target, List<String> supportedPairs) {
        super("Conversion from " + source + " to " + target + " is not supported. Supported pairs: "
                + String.join(", ", supportedPairs));
        this.supportedPairs = List.copyOf(supportedPairs);
    }

    public List<String> getSupportedPairs() {
        return supportedPairs;
    }
}
