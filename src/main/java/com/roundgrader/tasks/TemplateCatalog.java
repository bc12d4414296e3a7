package com.roundgrader.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.checks.Check;
import com.roundgrader.checks.CheckParser;
import com.roundgrader.checks.CheckType;
import com.roundgrader.models.Attachment;
import com.roundgrader.models.TaskTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed, ordered catalog of assignment templates loaded from a JSON resource.
 * Check descriptors are parsed at load time so malformed entries fail fast; descriptor types the
 * engine does not evaluate are reported once here.
 */
public class TemplateCatalog {
    private static final Logger logger = LoggerFactory.getLogger(TemplateCatalog.class);

    private final List<TaskTemplate> templates;
    private final Map<String, TaskTemplate> byId;

    public TemplateCatalog(List<TaskTemplate> templates) {
        if (templates.isEmpty()) {
            throw new IllegalArgumentException("Template catalog is empty");
        }
        this.templates = List.copyOf(templates);
        this.byId = new LinkedHashMap<>();
        for (TaskTemplate template : templates) {
            if (byId.put(template.getId(), template) != null) {
                throw new IllegalArgumentException("Duplicate template id: " + template.getId());
            }
        }
    }

    /**
     * Load the catalog from a classpath resource such as {@code templates.json}.
     */
    public static TemplateCatalog load(String resource, ObjectMapper objectMapper) throws IOException {
        try (InputStream input = TemplateCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IOException("Template catalog resource not found: " + resource);
            }
            TemplateCatalog catalog = parse(objectMapper.readTree(input));
            logger.info("Loaded {} templates from {}: {}", catalog.size(), resource, catalog.ids());
            return catalog;
        }
    }

    static TemplateCatalog parse(JsonNode root) {
        List<TaskTemplate> templates = new ArrayList<>();
        for (JsonNode node : root.path("templates")) {
            String id = node.path("id").asText();
            if (id.isEmpty() || id.contains(" ")) {
                throw new IllegalArgumentException("Invalid template id: '" + id + "'");
            }
            templates.add(new TaskTemplate(
                    id,
                    node.path("name").asText(id),
                    parseRound(id, 1, node.path("round1")),
                    parseRound(id, 2, node.path("round2"))));
        }
        return new TemplateCatalog(templates);
    }

    private static TaskTemplate.RoundConfig parseRound(String id, int round, JsonNode node) {
        if (!node.isObject() || !node.hasNonNull("brief")) {
            throw new IllegalArgumentException("Template " + id + " round " + round + " has no brief");
        }
        Map<String, List<String>> params = new LinkedHashMap<>();
        node.path("params").fields().forEachRemaining(entry -> {
            List<String> options = new ArrayList<>();
            entry.getValue().forEach(option -> options.add(option.asText()));
            if (options.isEmpty()) {
                throw new IllegalArgumentException(
                        "Template " + id + " round " + round + " param " + entry.getKey() + " has no options");
            }
            params.put(entry.getKey(), options);
        });

        List<Attachment> attachments = new ArrayList<>();
        for (JsonNode a : node.path("attachments")) {
            attachments.add(new Attachment(
                    a.path("name").asText(),
                    a.path("type").asText(),
                    a.hasNonNull("url") ? a.get("url").asText() : null,
                    a.hasNonNull("content") ? a.get("content").asText() : null));
        }

        List<JsonNode> checks = new ArrayList<>();
        for (JsonNode descriptor : node.path("checks")) {
            Check check = CheckParser.parse(descriptor);
            if (check.type() == CheckType.UNKNOWN) {
                logger.debug("Template {} round {} carries check type '{}' that is not evaluated",
                        id, round, ((Check.Unknown) check).rawType());
            }
            checks.add(descriptor);
        }
        return new TaskTemplate.RoundConfig(node.get("brief").asText(), params, attachments, checks);
    }

    public List<TaskTemplate> templates() {
        return templates;
    }

    public Optional<TaskTemplate> find(String templateId) {
        return Optional.ofNullable(byId.get(templateId));
    }

    public TaskTemplate require(String templateId) {
        TaskTemplate template = byId.get(templateId);
        if (template == null) {
            throw new TemplateNotFoundException(templateId, "Template not found: " + templateId);
        }
        return template;
    }

    public List<String> ids() {
        return Collections.unmodifiableList(new ArrayList<>(byId.keySet()));
    }

    public int size() {
        return templates.size();
    }
}
