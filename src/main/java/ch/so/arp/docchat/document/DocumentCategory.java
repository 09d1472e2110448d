package ch.so.arp.docchat.document;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import ch.so.arp.docchat.error.ValidationException;

/**
 * Closed set of categories a document can be filed under.
 */
public enum DocumentCategory {

    POLITICS("politics"),
    OPERATIONS("operations"),
    MANUAL("manual");

    private final String value;

    DocumentCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DocumentCategory fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DocumentCategory category : values()) {
                if (category.value.equals(normalized)) {
                    return category;
                }
            }
        }
        throw new ValidationException("Category must be one of: " + allowedValues() + " (got '" + value + "')");
    }

    static String allowedValues() {
        return Arrays.stream(values()).map(DocumentCategory::value).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return value;
    }
}
