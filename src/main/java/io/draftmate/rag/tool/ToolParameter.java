package io.draftmate.rag.tool;

import java.util.List;
import java.util.Objects;

/**
 * One named parameter of a tool schema.
 *
 * @param name          parameter name as seen by the language model
 * @param type          JSON type of the value
 * @param description   description shown to the language model
 * @param allowedValues closed set of legal values for enumerated string parameters, empty otherwise
 * @param required      whether the parameter must be present
 * @param minimum       inclusive lower bound of integer parameters, or {@code null}
 * @param maximum       inclusive upper bound of integer parameters, or {@code null}
 */
public record ToolParameter(
        String name,
        Type type,
        String description,
        List<String> allowedValues,
        boolean required,
        Integer minimum,
        Integer maximum) {

    public ToolParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    static ToolParameter string(String name, String description, boolean required) {
        return new ToolParameter(name, Type.STRING, description, List.of(), required, null, null);
    }

    static ToolParameter enumeration(String name, String description, List<String> allowedValues, boolean required) {
        return new ToolParameter(name, Type.STRING, description, allowedValues, required, null, null);
    }

    static ToolParameter integer(String name, String description, int minimum, int maximum, boolean required) {
        return new ToolParameter(name, Type.INTEGER, description, List.of(), required, minimum, maximum);
    }

    public boolean isEnumerated() {
        return !allowedValues.isEmpty();
    }

    /**
     * JSON types a parameter may take.
     */
    public enum Type {
        STRING,
        INTEGER
    }
}
