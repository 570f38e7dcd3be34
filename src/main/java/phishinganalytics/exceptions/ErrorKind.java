package phishinganalytics.exceptions;

public enum ErrorKind {
    VALIDATION(false),
    NOT_FOUND(false),
    CONFLICT(true),
    STORAGE(true);

    private final boolean retriable;

    ErrorKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
