package io.draftmate.rag.corpus;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of essay kinds stored in the corpus.
 */
public enum EssayCategory {

    PERSONAL_STATEMENT("personal_statement"),
    SUPPLEMENTAL("supplemental"),
    COMMON_APP("common_app"),
    OTHER("other");

    private final String wireName;

    EssayCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<EssayCategory> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(category -> category.wireName.equals(normalized)).findFirst();
    }

    @JsonCreator
    public static EssayCategory fromWireName(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown essay category: " + value));
    }
}
