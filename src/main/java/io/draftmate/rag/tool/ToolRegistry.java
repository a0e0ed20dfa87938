package io.draftmate.rag.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import io.draftmate.rag.corpus.EssayCategory;

/**
 * Fixed catalogue of the tools the writing agent offers to the language
 * model. The registry hands the schemas to the model and turns the model's
 * raw tool calls into typed {@link ToolInvocation}s, rejecting unknown names
 * and arguments that violate the schema.
 */
public class ToolRegistry {

    public static final String ANALYZE_TEXT = "analyze_text";
    public static final String SEARCH_SIMILAR = "search_similar";
    public static final String GET_EXAMPLES_BY_TOPIC = "get_examples_by_topic";

    static final int DEFAULT_SEARCH_LIMIT = 5;
    static final int MAX_SEARCH_LIMIT = 20;
    static final String ALL_CATEGORIES = "all";

    private static final List<String> CATEGORY_NAMES = List.of(
            EssayCategory.PERSONAL_STATEMENT.wireName(),
            EssayCategory.SUPPLEMENTAL.wireName(),
            EssayCategory.COMMON_APP.wireName());

    private final ObjectMapper objectMapper;
    private final Map<String, ToolDefinition> definitions;

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();
        for (ToolDefinition definition : builtInDefinitions()) {
            byName.put(definition.name(), definition);
        }
        this.definitions = Map.copyOf(byName);
    }

    private static List<ToolDefinition> builtInDefinitions() {
        List<String> searchCategories = new ArrayList<>(CATEGORY_NAMES);
        searchCategories.add(ALL_CATEGORIES);
        return List.of(
                new ToolDefinition(ANALYZE_TEXT,
                        "Analyze the structure, strengths and weaknesses of a piece of writing",
                        List.of(
                                ToolParameter.string("text", "The text to analyze", true),
                                ToolParameter.enumeration("analysis_type", "Depth of the analysis",
                                        AnalysisMode.wireNames(), true))),
                new ToolDefinition(SEARCH_SIMILAR,
                        "Find example essays that are semantically similar to a query",
                        List.of(
                                ToolParameter.string("query", "Text or theme to search for", true),
                                ToolParameter.enumeration("essay_type", "Essay category to search in",
                                        searchCategories, false),
                                ToolParameter.integer("limit", "Maximum number of examples to return",
                                        1, MAX_SEARCH_LIMIT, false))),
                new ToolDefinition(GET_EXAMPLES_BY_TOPIC,
                        "Get example essays tagged with a specific topic",
                        List.of(
                                ToolParameter.string("topic", "Topic tag, for example leadership or identity", true),
                                ToolParameter.enumeration("essay_type", "Essay category to search in",
                                        CATEGORY_NAMES, false))));
    }

    public List<ToolDefinition> definitions() {
        return List.of(definitions.get(ANALYZE_TEXT), definitions.get(SEARCH_SIMILAR),
                definitions.get(GET_EXAMPLES_BY_TOPIC));
    }

    public List<ToolSpecification> specifications() {
        return definitions().stream().map(ToolDefinition::toSpecification).toList();
    }

    /**
     * Validates a raw tool call from the language model.
     *
     * @throws UnknownToolException          if no tool of that name is registered
     * @throws InvalidToolArgumentsException if the arguments do not match the tool's schema
     */
    public ToolInvocation validate(ToolExecutionRequest request) {
        Objects.requireNonNull(request, "request");
        ToolDefinition definition = definitions.get(request.name());
        if (definition == null) {
            throw new UnknownToolException(request.name());
        }
        JsonNode arguments = parseArguments(definition, request.arguments());
        for (ToolParameter parameter : definition.parameters()) {
            checkParameter(definition, parameter, arguments.get(parameter.name()));
        }
        return switch (definition.name()) {
            case ANALYZE_TEXT -> new ToolInvocation.AnalyzeText(
                    request.id(),
                    arguments.get("text").asText(),
                    AnalysisMode.find(arguments.get("analysis_type").asText()).orElseThrow());
            case SEARCH_SIMILAR -> new ToolInvocation.SearchSimilar(
                    request.id(),
                    arguments.get("query").asText(),
                    category(arguments),
                    isPresent(arguments.get("limit")) ? arguments.get("limit").asInt() : DEFAULT_SEARCH_LIMIT);
            case GET_EXAMPLES_BY_TOPIC -> new ToolInvocation.GetExamplesByTopic(
                    request.id(),
                    arguments.get("topic").asText(),
                    category(arguments));
            default -> throw new UnknownToolException(definition.name());
        };
    }

    private JsonNode parseArguments(ToolDefinition definition, String raw) {
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            throw new InvalidToolArgumentsException(definition.name(), "arguments are not valid JSON");
        }
        if (node == null || !node.isObject()) {
            throw new InvalidToolArgumentsException(definition.name(), "arguments must be a JSON object");
        }
        return node;
    }

    private static void checkParameter(ToolDefinition definition, ToolParameter parameter, JsonNode value) {
        if (!isPresent(value)) {
            if (parameter.required()) {
                throw new InvalidToolArgumentsException(definition.name(),
                        "missing required parameter '" + parameter.name() + "'");
            }
            return;
        }
        switch (parameter.type()) {
            case STRING -> {
                if (!value.isTextual()) {
                    throw new InvalidToolArgumentsException(definition.name(),
                            "parameter '" + parameter.name() + "' must be a string");
                }
                if (parameter.isEnumerated() && !parameter.allowedValues().contains(value.asText())) {
                    throw new InvalidToolArgumentsException(definition.name(),
                            "parameter '" + parameter.name() + "' must be one of " + parameter.allowedValues());
                }
            }
            case INTEGER -> {
                if (!value.isNumber() || !isWhole(value)) {
                    throw new InvalidToolArgumentsException(definition.name(),
                            "parameter '" + parameter.name() + "' must be an integer");
                }
                long number = value.asLong();
                if ((parameter.minimum() != null && number < parameter.minimum())
                        || (parameter.maximum() != null && number > parameter.maximum())) {
                    throw new InvalidToolArgumentsException(definition.name(),
                            "parameter '" + parameter.name() + "' must be between " + parameter.minimum()
                                    + " and " + parameter.maximum());
                }
            }
        }
    }

    private static boolean isWhole(JsonNode value) {
        return value.isIntegralNumber() || value.asDouble() == Math.rint(value.asDouble());
    }

    private static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull();
    }

    private static EssayCategory category(JsonNode arguments) {
        JsonNode value = arguments.get("essay_type");
        if (!isPresent(value) || ALL_CATEGORIES.equals(value.asText())) {
            return null;
        }
        return EssayCategory.fromWireName(value.asText());
    }
}
