package phishinganalytics.model;

import phishinganalytics.exceptions.ValidationException;

import java.util.Arrays;
import java.util.Locale;

public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ConfidenceLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("confidence_level", "Не задан уровень уверенности");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(level -> level.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("confidence_level",
                        "Недопустимый уровень уверенности: " + value + " (ожидается high, medium или low)"));
    }
}
