package io.draftmate.rag.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Depth of a text analysis requested through {@code analyze_text}.
 */
public enum AnalysisMode {

    QUICK_CHECK("quick_check"),
    DEEP_ANALYSIS("deep_analysis"),
    STRUCTURE_ANALYSIS("structure_analysis");

    private final String wireName;

    AnalysisMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<AnalysisMode> find(String value) {
        return Arrays.stream(values()).filter(mode -> mode.wireName.equals(value)).findFirst();
    }

    static List<String> wireNames() {
        return Arrays.stream(values()).map(AnalysisMode::wireName).toList();
    }
}
