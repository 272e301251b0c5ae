package com.abhinavmehta.sgraph.sdk.tools;

import com.abhinavmehta.sgraph.sdk.SGraphClient;
import com.abhinavmehta.sgraph.sdk.dto.PatternKind;
import com.abhinavmehta.sgraph.sdk.exception.ErrorKind;
import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;
import com.abhinavmehta.sgraph.sdk.exception.SGraphException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps tool invocations ({@code sgraph_*} operation name plus JSON arguments) onto
 * {@link SGraphClient} calls and renders the outcome as JSON.
 * <p>
 * Failures never escape as exceptions: they become {@code {"error": {"kind", "message", "defect"}}}.
 * Argument names are snake_case, as tool-calling clients send them.
 */
public class SGraphToolDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SGraphToolDispatcher.class);
    private static final TypeReference<Map<String, Object>> RAW_MAP = new TypeReference<>() {
    };

    private final SGraphClient client;
    private final ObjectMapper objectMapper;
    private final Map<String, Function<JsonNode, Object>> operations = new LinkedHashMap<>();

    public SGraphToolDispatcher(SGraphClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
        registerOperations();
    }

    private void registerOperations() {
        operations.put("sgraph_load_model", args -> {
            String modelId = client.loadModel(requiredText(args, "path"));
            return client.getModelInfo(modelId);
        });
        operations.put("sgraph_list_models", args -> {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("models", client.listModels());
            return result;
        });
        operations.put("sgraph_evict_model", args -> {
            String modelId = requiredText(args, "model_id");
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("modelId", modelId);
            result.put("evicted", client.evictModel(modelId));
            return result;
        });
        operations.put("sgraph_get_model_overview", args -> client.getModelOverview(
                requiredText(args, "model_id"),
                optionalText(args, "root_path"),
                optionalInt(args, "max_depth"),
                optionalBoolean(args, "include_counts", true)));
        operations.put("sgraph_get_root_element", args -> client.getRootElement(requiredText(args, "model_id")));
        operations.put("sgraph_get_element", args -> client.getElement(
                requiredText(args, "model_id"), requiredText(args, "element_path")));
        operations.put("sgraph_get_element_incoming_associations", args -> client.getIncomingAssociations(
                requiredText(args, "model_id"), requiredText(args, "element_path")));
        operations.put("sgraph_get_element_outgoing_associations", args -> client.getOutgoingAssociations(
                requiredText(args, "model_id"), requiredText(args, "element_path")));
        operations.put("sgraph_search_elements_by_name", args -> client.searchElementsByName(
                requiredText(args, "model_id"),
                requiredText(args, "pattern"),
                PatternKind.fromString(optionalText(args, "pattern_kind")),
                optionalText(args, "element_type"),
                optionalText(args, "scope_path"),
                optionalInt(args, "max_results")));
        operations.put("sgraph_get_elements_by_type", args -> client.getElementsByType(
                requiredText(args, "model_id"),
                requiredText(args, "element_type"),
                optionalText(args, "scope_path"),
                optionalInt(args, "max_results")));
        operations.put("sgraph_search_elements_by_attributes", args -> client.searchElementsByAttributes(
                requiredText(args, "model_id"),
                attributeFilters(args),
                optionalText(args, "scope_path"),
                optionalInt(args, "max_results")));
        operations.put("sgraph_get_subtree_dependencies", args -> client.getSubtreeDependencies(
                requiredText(args, "model_id"),
                requiredText(args, "root_path"),
                optionalBoolean(args, "include_external", true),
                optionalInt(args, "max_depth")));
        operations.put("sgraph_get_dependency_chain", args -> client.getDependencyChain(
                requiredText(args, "model_id"),
                requiredText(args, "element_path"),
                optionalText(args, "direction") == null ? "outgoing" : optionalText(args, "direction"),
                optionalInt(args, "max_depth")));
        operations.put("sgraph_get_multiple_elements", args -> client.getMultipleElements(
                requiredText(args, "model_id"), requiredTextList(args, "element_paths")));
    }

    public Set<String> operationNames() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    public JsonNode invoke(String operation, JsonNode args) {
        JsonNode arguments = args == null || args.isNull() ? objectMapper.createObjectNode() : args;
        Function<JsonNode, Object> handler = operation == null ? null : operations.get(operation);
        if (handler == null) {
            log.warn("Unknown tool operation: {}", operation);
            return error(ErrorKind.INVALID_ARGUMENT, "Unknown operation: " + operation);
        }
        log.debug("Invoking {} with {}", operation, arguments);
        try {
            return objectMapper.valueToTree(handler.apply(arguments));
        } catch (SGraphException e) {
            if (e.getKind().isDefect()) {
                log.error("Operation {} hit an internal defect", operation, e);
            } else {
                log.debug("Operation {} failed: {}", operation, e.toString());
            }
            return error(e.getKind(), e.getMessage());
        } catch (IllegalStateException e) {
            // closed client: caller misuse, not a defect
            log.warn("Operation {} rejected: {}", operation, e.getMessage());
            return error(ErrorKind.INVALID_ARGUMENT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in operation {}", operation, e);
            return error(ErrorKind.INTERNAL_ERROR, "Unexpected error: " + e.getMessage());
        }
    }

    private JsonNode error(ErrorKind kind, String message) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode error = root.putObject("error");
        error.put("kind", kind.name());
        error.put("message", message);
        error.put("defect", kind.isDefect());
        return root;
    }

    private Map<String, Object> attributeFilters(JsonNode args) {
        JsonNode node = args.get("attribute_filters");
        if (node == null || node.isNull()) {
            throw new InvalidArgumentException("Missing required argument: attribute_filters");
        }
        if (!node.isObject()) {
            throw new InvalidArgumentException("Argument attribute_filters must be an object");
        }
        return objectMapper.convertValue(node, RAW_MAP);
    }

    private static String requiredText(JsonNode args, String name) {
        String value = optionalText(args, name);
        if (value == null) {
            throw new InvalidArgumentException("Missing required argument: " + name);
        }
        return value;
    }

    private static String optionalText(JsonNode args, String name) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new InvalidArgumentException("Argument " + name + " must be a string");
        }
        return node.asText();
    }

    private static Integer optionalInt(JsonNode args, String name) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new InvalidArgumentException("Argument " + name + " must be an integer");
        }
        return node.asInt();
    }

    private static boolean optionalBoolean(JsonNode args, String name, boolean defaultValue) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new InvalidArgumentException("Argument " + name + " must be a boolean");
        }
        return node.asBoolean();
    }

    private static List<String> requiredTextList(JsonNode args, String name) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            throw new InvalidArgumentException("Missing required argument: " + name);
        }
        if (!node.isArray()) {
            throw new InvalidArgumentException("Argument " + name + " must be an array of strings");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new InvalidArgumentException("Argument " + name + " must be an array of strings");
            }
            values.add(item.asText());
        }
        return values;
    }
}
