package phishinganalytics.exceptions;

public class ValidationException extends AnalyticsException {
    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
