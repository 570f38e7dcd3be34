package phishinganalytics.exceptions;

/**
 * Базовое исключение слоя хранения URL и результатов анализа.
 * Вид ошибки определяет, имеет ли смысл повторять запрос.
 */
public abstract class AnalyticsException extends RuntimeException {
    private final ErrorKind kind;

    protected AnalyticsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalyticsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetriable() {
        return kind.isRetriable();
    }
}
