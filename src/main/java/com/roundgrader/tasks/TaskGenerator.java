package com.roundgrader.tasks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.models.Attachment;
import com.roundgrader.models.GeneratedTask;
import com.roundgrader.models.TaskTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic task content generation.
 * <p>
 * The seed is derived from {@code email-hourBucket}, so generating again for the same participant
 * within the same UTC hour reproduces identical content and therefore the same task id.
 * Round 1 draws a template from the catalog; later rounds reuse the template named by the
 * previous round's task id.
 */
public class TaskGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TaskGenerator.class);

    private static final DateTimeFormatter HOUR_BUCKET =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH").withZone(ZoneOffset.UTC);

    private final TemplateCatalog catalog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TaskGenerator(TemplateCatalog catalog, ObjectMapper objectMapper, Clock clock) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Current wall-clock hour, e.g. {@code 2025-10-16-14}.
     */
    public String currentHourBucket() {
        return HOUR_BUCKET.format(clock.instant());
    }

    public GeneratedTask generateRoundOne(String email, String hourBucket) {
        long seed = seed(email, hourBucket);
        List<TaskTemplate> templates = catalog.templates();
        TaskTemplate template = templates.get(new Random(seed).nextInt(templates.size()));
        logger.debug("Selected template {} for {} at {}", template.getId(), email, hourBucket);
        return generate(template, 1, email, hourBucket);
    }

    /**
     * Content for a later round, keeping the template lineage of {@code previousTaskId}.
     *
     * @throws TemplateNotFoundException if the previous task id does not resolve to a template
     */
    public GeneratedTask generateFollowUp(int round, String email, String hourBucket, String previousTaskId) {
        if (round < 2) {
            throw new IllegalArgumentException("Follow-up rounds start at 2, got " + round);
        }
        TaskTemplate template = catalog.require(templateIdOf(previousTaskId));
        return generate(template, round, email, hourBucket);
    }

    public GeneratedTask generate(TaskTemplate template, int round, String email, String hourBucket) {
        TaskTemplate.RoundConfig config = template.forRound(round);
        Random random = new Random(seed(email, hourBucket));

        String brief = config.getBrief();
        for (Map.Entry<String, List<String>> param : config.getParams().entrySet()) {
            List<String> options = param.getValue();
            String value = options.get(random.nextInt(options.size()));
            brief = brief.replace("{" + param.getKey() + "}", value);
        }

        List<Attachment> attachments = config.getAttachments();
        String taskId = deriveTaskId(template.getId(), brief, stringify(attachments));
        return new GeneratedTask(template.getId(), taskId, round, brief, attachments, config.getChecks());
    }

    /**
     * {@code templateId-} followed by the first five hex characters of SHA-256(brief + attachments).
     */
    public static String deriveTaskId(String templateId, String brief, String attachmentsText) {
        byte[] digest = digest("SHA-256", brief + attachmentsText);
        return templateId + "-" + HexFormat.of().formatHex(digest).substring(0, 5);
    }

    /**
     * Template id part of a {@code {templateId}-{hash}} task id.
     *
     * @throws TemplateNotFoundException if the id has no template part
     */
    public static String templateIdOf(String taskId) {
        int idx = taskId == null ? -1 : taskId.lastIndexOf('-');
        if (idx <= 0) {
            throw new TemplateNotFoundException(taskId, "Malformed task id: " + taskId);
        }
        return taskId.substring(0, idx);
    }

    /**
     * First eight bytes of MD5({@code email-hourBucket}) as a long.
     */
    static long seed(String email, String hourBucket) {
        byte[] digest = digest("MD5", email + "-" + hourBucket);
        return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    }

    private String stringify(List<Attachment> attachments) {
        try {
            return objectMapper.writeValueAsString(attachments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize attachments", e);
        }
    }

    private static byte[] digest(String algorithm, String text) {
        try {
            return MessageDigest.getInstance(algorithm).digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
