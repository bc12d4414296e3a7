package com.roundgrader.checks;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@code {type, ...params}} descriptors into {@link Check} variants.
 * Missing required parameters of a known type raise {@link IllegalArgumentException};
 * an unrecognised type yields {@link Check.Unknown}.
 */
public final class CheckParser {

    private CheckParser() {}

    public static Check parse(JsonNode descriptor) {
        if (descriptor == null || !descriptor.isObject()) {
            throw new IllegalArgumentException("Check descriptor must be a JSON object: " + descriptor);
        }
        String rawType = descriptor.path("type").asText("");
        CheckType type = CheckType.fromWireName(rawType);

        switch (type) {
            case ELEMENT_EXISTS:
                return new Check.ElementExists(
                        requireText(descriptor, "selector", rawType),
                        descriptor.path("min_count").asInt(1));
            case BUTTON_EXISTS:
                return new Check.ButtonExists(textList(descriptor, "text", rawType));
            case CLICK_INTERACTION:
                return new Check.ClickInteraction(
                        requireText(descriptor, "selector", rawType),
                        descriptor.path("result").asText(""));
            case RESPONSIVE_CHECK:
                return new Check.ResponsiveCheck(breakpoints(descriptor));
            case KEYBOARD_EVENT:
                return new Check.KeyboardEvent(
                        requireText(descriptor, "key", rawType),
                        descriptor.path("result").asText(""));
            case CLICK_SEQUENCE:
                return new Check.ClickSequence(
                        textList(descriptor, "buttons", rawType),
                        requireText(descriptor, "result", rawType));
            default:
                return new Check.Unknown(rawType, descriptor);
        }
    }

    private static String requireText(JsonNode descriptor, String field, String type) {
        JsonNode node = descriptor.get(field);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            throw new IllegalArgumentException(type + " check requires '" + field + "'");
        }
        return node.asText();
    }

    // A bare string is accepted where a list is expected.
    private static List<String> textList(JsonNode descriptor, String field, String type) {
        JsonNode node = descriptor.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(type + " check requires '" + field + "'");
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else {
            values.add(node.asText());
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException(type + " check requires a non-empty '" + field + "'");
        }
        return List.copyOf(values);
    }

    private static List<Integer> breakpoints(JsonNode descriptor) {
        JsonNode node = descriptor.get("breakpoints");
        if (node == null || !node.isArray() || node.isEmpty()) {
            return Check.ResponsiveCheck.DEFAULT_BREAKPOINTS;
        }
        List<Integer> widths = new ArrayList<>();
        node.forEach(item -> widths.add(item.asInt()));
        return List.copyOf(widths);
    }
}
