package phishinganalytics.exceptions;

public class ConflictException extends AnalyticsException {
    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
