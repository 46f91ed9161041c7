package domain.model;

public final class DetectAndConvertResult {

    private final DetectionResult detection;
    private final ConversionResult conversion;

    public DetectAndConvertResult(DetectionResult detection, ConversionResult conversion) {
        this.detection = detection;
        this.conversion = conversion;
    }

    public DetectionResult getDetection() {
        return detection;
    }

    public ConversionResult getConversion() {
        return conversion;
    }
}
