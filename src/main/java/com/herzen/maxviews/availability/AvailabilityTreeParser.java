package com.herzen.maxviews.availability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.maxviews.availability.AvailabilityModels.*;
import com.herzen.maxviews.config.MaxViewsProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class AvailabilityTreeParser {
    private final ObjectMapper objectMapper;
    private final MaxViewsProperties properties;

    public AvailabilityTreeParser(ObjectMapper objectMapper, MaxViewsProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ConditionNode parse(String availability) {
        if (availability == null || availability.isBlank()) return Composite.empty();

        JsonNode root;
        try {
            root = objectMapper.readTree(availability);
        } catch (JsonProcessingException e) {
            throw new AvailabilityFormatException("Availability is not valid JSON", e);
        }
        if (root == null || root.isNull()) return Composite.empty();
        return toNode(root, "$");
    }

    private ConditionNode toNode(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new AvailabilityFormatException("Condition at " + path + " must be an object");
        }

        JsonNode children = node.get("c");
        if (children != null) {
            if (!children.isArray()) {
                throw new AvailabilityFormatException("Condition list at " + path + ".c must be an array");
            }
            List<ConditionNode> parsed = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                parsed.add(toNode(children.get(i), path + ".c[" + i + "]"));
            }
            return new Composite(node.path("op").asText("&"), parsed);
        }

        String type = node.path("type").asText(null);
        if (type == null || type.isBlank()) {
            throw new AvailabilityFormatException("Condition at " + path + " has neither children nor type");
        }
        if (!properties.conditionType().equals(type)) {
            return new OtherCondition(type);
        }

        JsonNode limit = node.get("viewslimit");
        if (limit == null || !(limit.isIntegralNumber() || limit.isTextual())) {
            throw new AvailabilityFormatException("View limit at " + path + " has no viewslimit");
        }
        if (limit.isIntegralNumber() && !limit.canConvertToInt()) {
            throw new AvailabilityFormatException("View limit at " + path + " is out of range: " + limit.asText());
        }
        // Older configurations store the limit as a string.
        try {
            int viewsLimit = limit.isTextual() ? Integer.parseInt(limit.asText().trim()) : limit.intValue();
            return new ViewLimitCondition(viewsLimit);
        } catch (IllegalArgumentException e) {
            throw new AvailabilityFormatException("View limit at " + path + " is invalid: " + limit.asText(), e);
        }
    }
}
