package com.roundgrader.utils;

import com.roundgrader.models.CheckResult;
import com.roundgrader.models.Participant;
import com.roundgrader.models.Submission;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void readsParticipantsAndSkipsIncompleteRows() throws IOException {
        Path csv = tempDir.resolve("participants.csv");
        Files.writeString(csv, String.join("\n",
                "timestamp,email,endpoint,secret",
                "2025-10-16T10:00:00Z, a@x.com ,http://a/api/build,s1",
                "2025-10-16T10:01:00Z,,http://b/api/build,s2",
                "2025-10-16T10:02:00Z,c@x.com,,s3",
                "2025-10-16T10:03:00Z,d@x.com,http://d/api/build,"), StandardCharsets.UTF_8);

        List<Participant> participants = CsvUtils.readParticipants(csv);

        assertEquals(2, participants.size());
        assertEquals(new Participant("2025-10-16T10:00:00Z", "a@x.com", "http://a/api/build", "s1"),
                participants.get(0));
        assertEquals("d@x.com", participants.get(1).email());
        assertEquals("", participants.get(1).secret());
    }

    @Test
    void missingColumnIsReported() throws IOException {
        Path csv = tempDir.resolve("bad.csv");
        Files.writeString(csv, "timestamp,email,secret\nt,a@x.com,s\n", StandardCharsets.UTF_8);

        IOException e = assertThrows(IOException.class, () -> CsvUtils.readParticipants(csv));
        assertTrue(e.getMessage().contains("endpoint"));
    }

    @Test
    void writesOneRowPerResultWithFlattenedText() throws IOException {
        Submission submission = new Submission("a@x.com", "calculator-ab12c", 1, "n1",
                "https://github.com/a/calc", "c1", "https://a.github.io/calc/");
        CheckResult result = CheckResult.forSubmission(submission, "page_load", 0.5,
                "Loaded\nwith warnings", "line1\r\nline2");
        Path out = tempDir.resolve("exports/results.csv");

        CsvUtils.writeResults(out, List.of(result));

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("email,task,round,check,score,reason,logs,repo_url,commit_sha,pages_url,created_at", lines.get(0));
        assertTrue(lines.get(1).startsWith("a@x.com,calculator-ab12c,1,page_load,0.50,Loaded with warnings,line1  line2,"));
        assertTrue(lines.get(1).contains("https://github.com/a/calc,c1,https://a.github.io/calc/"));
    }
}
