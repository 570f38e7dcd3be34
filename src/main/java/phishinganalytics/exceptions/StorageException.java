package phishinganalytics.exceptions;

public class StorageException extends AnalyticsException {
    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
