package io.draftmate.rag.tool;

import java.util.List;
import java.util.Objects;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

/**
 * Name, description and parameter contract of a tool the language model may
 * call.
 */
public record ToolDefinition(String name, String description, List<ToolParameter> parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        parameters = List.copyOf(parameters);
    }

    /**
     * Renders the definition as the JSON schema shaped specification sent to
     * the language model.
     */
    public ToolSpecification toSpecification() {
        JsonObjectSchema.Builder schema = JsonObjectSchema.builder();
        for (ToolParameter parameter : parameters) {
            if (parameter.isEnumerated()) {
                schema.addEnumProperty(parameter.name(), parameter.allowedValues(), parameter.description());
            } else if (parameter.type() == ToolParameter.Type.INTEGER) {
                schema.addIntegerProperty(parameter.name(), parameter.description());
            } else {
                schema.addStringProperty(parameter.name(), parameter.description());
            }
        }
        schema.required(parameters.stream().filter(ToolParameter::required).map(ToolParameter::name).toList());
        return ToolSpecification.builder()
                .name(name)
                .description(description)
                .parameters(schema.build())
                .build();
    }
}
