package com.roundgrader.utils;

import com.roundgrader.models.CheckResult;
import com.roundgrader.models.Participant;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Participant import and result export.
 */
public class CsvUtils {
    private static final Logger logger = LoggerFactory.getLogger(CsvUtils.class);

    static final String[] PARTICIPANT_HEADER = {"timestamp", "email", "endpoint", "secret"};
    static final String[] RESULT_HEADER = {
            "email", "task", "round", "check", "score", "reason", "logs",
            "repo_url", "commit_sha", "pages_url", "created_at"
    };

    /**
     * Read participants from a CSV with header {@code timestamp,email,endpoint,secret}.
     * Rows without an email or endpoint are skipped with a warning.
     */
    public static List<Participant> readParticipants(Path path) throws IOException {
        List<Participant> participants = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser csvParser = new CSVParser(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim())) {
            for (String column : PARTICIPANT_HEADER) {
                if (!csvParser.getHeaderMap().containsKey(column)) {
                    throw new IOException("Missing column '" + column + "' in " + path);
                }
            }
            for (CSVRecord record : csvParser) {
                String email = record.get("email");
                String endpoint = record.get("endpoint");
                if (TextUtils.isBlank(email) || TextUtils.isBlank(endpoint)) {
                    logger.warn("Skipping participant row {}: email and endpoint are required", record.getRecordNumber());
                    continue;
                }
                participants.add(new Participant(record.get("timestamp"), email, endpoint, record.get("secret")));
            }
        }
        logger.info("Loaded {} participants from {}", participants.size(), path);
        return participants;
    }

    /**
     * Write results to a fresh CSV file with a header row, replacing any existing file.
     */
    public static void writeResults(Path path, List<CheckResult> results) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader(RESULT_HEADER))) {
            for (CheckResult result : results) {
                csvPrinter.printRecord(
                        result.getEmail(),
                        result.getTaskId(),
                        result.getRound(),
                        result.getCheckName(),
                        String.format(Locale.ROOT, "%.2f", result.getScore()),
                        oneLine(result.getReason()),
                        oneLine(result.getLogs()),
                        result.getRepoUrl(),
                        result.getCommitSha(),
                        result.getPagesUrl(),
                        result.getCreatedAt());
            }
        }
        logger.info("Wrote {} results to {}", results.size(), path);
    }

    private static String oneLine(String text) {
        return text != null ? text.replace("\r", " ").replace("\n", " ") : "";
    }
}
