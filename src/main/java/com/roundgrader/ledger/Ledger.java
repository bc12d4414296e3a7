package com.roundgrader.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.models.Attachment;
import com.roundgrader.models.CheckResult;
import com.roundgrader.models.Deployment;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for tasks, submissions, results and deployments.
 * <p>
 * All writes go through existence-checked inserts; uniqueness of {@code (email, task, round)}
 * is also enforced by the schema so a racing duplicate fails loudly instead of being stored twice.
 * The ledger is constructed explicitly and handed to whoever needs it.
 */
public class Ledger {
    private static final Logger logger = LoggerFactory.getLogger(Ledger.class);

    private static final String CREATE_TASKS_SQL = """
            CREATE TABLE IF NOT EXISTS tasks (
                id             INTEGER PRIMARY KEY AUTOINCREMENT,
                email          TEXT NOT NULL,
                task           TEXT NOT NULL,
                round          INTEGER NOT NULL,
                nonce          TEXT NOT NULL UNIQUE,
                brief          TEXT NOT NULL,
                attachments    TEXT NOT NULL,
                checks         TEXT NOT NULL,
                evaluation_url TEXT NOT NULL,
                endpoint       TEXT NOT NULL,
                secret         TEXT,
                status_code    INTEGER,
                error          TEXT,
                created_at     TEXT NOT NULL,
                UNIQUE (email, task, round)
            )
            """;

    private static final String CREATE_SUBMISSIONS_SQL = """
            CREATE TABLE IF NOT EXISTS submissions (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                email       TEXT NOT NULL,
                task        TEXT NOT NULL,
                round       INTEGER NOT NULL,
                nonce       TEXT NOT NULL REFERENCES tasks (nonce),
                repo_url    TEXT NOT NULL,
                commit_sha  TEXT NOT NULL,
                pages_url   TEXT NOT NULL,
                received_at TEXT NOT NULL,
                UNIQUE (email, task, round)
            )
            """;

    private static final String CREATE_RESULTS_SQL = """
            CREATE TABLE IF NOT EXISTS results (
                id         INTEGER PRIMARY KEY AUTOINCREMENT,
                email      TEXT NOT NULL,
                task       TEXT NOT NULL,
                round      INTEGER NOT NULL,
                repo_url   TEXT,
                commit_sha TEXT,
                pages_url  TEXT,
                check_name TEXT NOT NULL,
                score      REAL,
                reason     TEXT,
                logs       TEXT,
                created_at TEXT NOT NULL
            )
            """;

    private static final String CREATE_DEPLOYMENTS_SQL = """
            CREATE TABLE IF NOT EXISTS deployments (
                task       TEXT PRIMARY KEY,
                round      INTEGER NOT NULL,
                repo_url   TEXT NOT NULL,
                commit_sha TEXT NOT NULL,
                pages_url  TEXT NOT NULL,
                files      TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;

    private static final List<String> CREATE_INDEX_SQL = List.of(
            "CREATE INDEX IF NOT EXISTS idx_tasks_email_round ON tasks (email, round)",
            "CREATE INDEX IF NOT EXISTS idx_submissions_email_round ON submissions (email, round)",
            "CREATE INDEX IF NOT EXISTS idx_submissions_nonce ON submissions (nonce)",
            "CREATE INDEX IF NOT EXISTS idx_results_email_task_round ON results (email, task, round)"
    );

    private static final String TASK_COLUMNS =
            "email, task, round, nonce, brief, attachments, checks, evaluation_url, endpoint, secret, "
                    + "status_code, error, created_at";

    private static final String INSERT_TASK_SQL =
            "INSERT INTO tasks (" + TASK_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String TASK_EXISTS_SQL =
            "SELECT 1 FROM tasks WHERE email = ? AND task = ? AND round = ?";

    private static final String TASK_BY_NONCE_SQL =
            "SELECT " + TASK_COLUMNS + " FROM tasks WHERE nonce = ?";

    private static final String TASKS_BY_ROUND_SQL =
            "SELECT " + TASK_COLUMNS + " FROM tasks WHERE round = ? ORDER BY id";

    private static final String TASKS_BY_EMAIL_ROUND_SQL =
            "SELECT " + TASK_COLUMNS + " FROM tasks WHERE email = ? AND round = ? ORDER BY id";

    private static final String SUBMISSION_COLUMNS =
            "email, task, round, nonce, repo_url, commit_sha, pages_url, received_at";

    private static final String INSERT_SUBMISSION_SQL =
            "INSERT INTO submissions (" + SUBMISSION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SUBMISSION_EXISTS_SQL =
            "SELECT 1 FROM submissions WHERE email = ? AND task = ? AND round = ?";

    private static final String SUBMISSION_BY_NONCE_SQL =
            "SELECT " + SUBMISSION_COLUMNS + " FROM submissions WHERE nonce = ?";

    private static final String SUBMISSIONS_ALL_SQL =
            "SELECT " + SUBMISSION_COLUMNS + " FROM submissions ORDER BY id";

    private static final String SUBMISSIONS_BY_ROUND_SQL =
            "SELECT " + SUBMISSION_COLUMNS + " FROM submissions WHERE round = ? ORDER BY id";

    private static final String SUBMISSIONS_WITHOUT_RESULTS_SQL = """
            SELECT s.email, s.task, s.round, s.nonce, s.repo_url, s.commit_sha, s.pages_url, s.received_at
            FROM submissions s
            LEFT JOIN results r ON s.email = r.email AND s.task = r.task AND s.round = r.round
            WHERE r.id IS NULL AND (? IS NULL OR s.round = ?)
            ORDER BY s.id
            """;

    private static final String INSERT_RESULT_SQL = """
            INSERT INTO results (email, task, round, repo_url, commit_sha, pages_url,
                                 check_name, score, reason, logs, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String RESULT_EXISTS_SQL =
            "SELECT 1 FROM results WHERE email = ? AND task = ? AND round = ? LIMIT 1";

    private static final String RESULTS_SQL = """
            SELECT email, task, round, repo_url, commit_sha, pages_url, check_name, score, reason, logs, created_at
            FROM results
            WHERE (? IS NULL OR email = ?) AND (? IS NULL OR round = ?)
            ORDER BY email, task, round, id
            """;

    private static final String UPSERT_DEPLOYMENT_SQL = """
            INSERT INTO deployments (task, round, repo_url, commit_sha, pages_url, files, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (task)
            DO UPDATE SET round = excluded.round,
                          repo_url = excluded.repo_url,
                          commit_sha = excluded.commit_sha,
                          pages_url = excluded.pages_url,
                          files = excluded.files,
                          updated_at = excluded.updated_at
            """;

    private static final String DEPLOYMENT_BY_TASK_SQL =
            "SELECT task, round, repo_url, commit_sha, pages_url, files, updated_at FROM deployments WHERE task = ?";

    private static final TypeReference<List<Attachment>> ATTACHMENT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<JsonNode>> CHECK_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> FILE_MAP = new TypeReference<>() {};

    private final JdbcSupport jdbc;
    private final ObjectMapper objectMapper;

    public Ledger(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbc = new JdbcSupport(dataSource);
        this.objectMapper = objectMapper;
    }

    /**
     * Open a SQLite-backed ledger with foreign keys enforced and the schema created.
     */
    public static Ledger open(String jdbcUrl, ObjectMapper objectMapper) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(jdbcUrl);

        Ledger ledger = new Ledger(dataSource, objectMapper);
        ledger.createTables();
        logger.info("Ledger ready at {}", jdbcUrl);
        return ledger;
    }

    public void createTables() {
        List<String> ddl = new ArrayList<>(List.of(
                CREATE_TASKS_SQL, CREATE_SUBMISSIONS_SQL, CREATE_RESULTS_SQL, CREATE_DEPLOYMENTS_SQL));
        ddl.addAll(CREATE_INDEX_SQL);
        jdbc.execute(ddl, "Failed to create ledger schema");
    }

    // ---- tasks ----

    public void insertTask(Task task) {
        String attachments = toJson(task.getAttachments());
        String checks = toJson(task.getChecks());
        jdbc.update(INSERT_TASK_SQL, ps -> {
            ps.setString(1, task.getEmail());
            ps.setString(2, task.getTaskId());
            ps.setInt(3, task.getRound());
            ps.setString(4, task.getNonce());
            ps.setString(5, task.getBrief());
            ps.setString(6, attachments);
            ps.setString(7, checks);
            ps.setString(8, task.getEvaluationUrl());
            ps.setString(9, task.getEndpoint());
            ps.setString(10, task.getSecret());
            if (task.getStatusCode() != null) {
                ps.setInt(11, task.getStatusCode());
            } else {
                ps.setNull(11, Types.INTEGER);
            }
            ps.setString(12, task.getError());
            ps.setString(13, task.getCreatedAt().toString());
        }, "Failed to insert task " + task.getTaskId() + " for " + task.getEmail());
        logger.debug("Stored task {}", task);
    }

    public boolean taskExists(String email, String taskId, int round) {
        return jdbc.exists(TASK_EXISTS_SQL, ps -> {
            ps.setString(1, email);
            ps.setString(2, taskId);
            ps.setInt(3, round);
        }, "Failed to look up task " + taskId);
    }

    public Optional<Task> findTaskByNonce(String nonce) {
        return jdbc.queryOne(TASK_BY_NONCE_SQL, ps -> ps.setString(1, nonce), this::mapTask,
                "Failed to look up task by nonce");
    }

    public List<Task> findTasksByRound(int round) {
        return jdbc.queryList(TASKS_BY_ROUND_SQL, ps -> ps.setInt(1, round), this::mapTask,
                "Failed to list tasks for round " + round);
    }

    public List<Task> findTasks(String email, int round) {
        return jdbc.queryList(TASKS_BY_EMAIL_ROUND_SQL, ps -> {
            ps.setString(1, email);
            ps.setInt(2, round);
        }, this::mapTask, "Failed to list tasks for " + email);
    }

    // ---- submissions ----

    public void insertSubmission(Submission submission) {
        Instant receivedAt = submission.getReceivedAt() != null ? submission.getReceivedAt() : Instant.now();
        jdbc.update(INSERT_SUBMISSION_SQL, ps -> {
            ps.setString(1, submission.getEmail());
            ps.setString(2, submission.getTaskId());
            ps.setInt(3, submission.getRound());
            ps.setString(4, submission.getNonce());
            ps.setString(5, submission.getRepoUrl());
            ps.setString(6, submission.getCommitSha());
            ps.setString(7, submission.getPagesUrl());
            ps.setString(8, receivedAt.toString());
        }, "Failed to insert submission for " + submission.getTaskId());
        submission.setReceivedAt(receivedAt);
    }

    public boolean submissionExists(String email, String taskId, int round) {
        return jdbc.exists(SUBMISSION_EXISTS_SQL, ps -> {
            ps.setString(1, email);
            ps.setString(2, taskId);
            ps.setInt(3, round);
        }, "Failed to look up submission for " + taskId);
    }

    public Optional<Submission> findSubmissionByNonce(String nonce) {
        return jdbc.queryOne(SUBMISSION_BY_NONCE_SQL, ps -> ps.setString(1, nonce), this::mapSubmission,
                "Failed to look up submission by nonce");
    }

    /**
     * All submissions, or only those of one round when {@code round} is not null.
     */
    public List<Submission> findSubmissions(Integer round) {
        if (round == null) {
            return jdbc.queryList(SUBMISSIONS_ALL_SQL, ps -> { }, this::mapSubmission,
                    "Failed to list submissions");
        }
        return jdbc.queryList(SUBMISSIONS_BY_ROUND_SQL, ps -> ps.setInt(1, round), this::mapSubmission,
                "Failed to list submissions for round " + round);
    }

    public List<Submission> findSubmissionsWithoutResults(Integer round) {
        return jdbc.queryList(SUBMISSIONS_WITHOUT_RESULTS_SQL, ps -> {
            setNullableInt(ps, 1, round);
            setNullableInt(ps, 2, round);
        }, this::mapSubmission, "Failed to list submissions without results");
    }

    // ---- results ----

    /**
     * Write every result of one evaluation pass atomically.
     */
    public int insertResults(List<CheckResult> results) {
        if (results.isEmpty()) {
            return 0;
        }
        int written = jdbc.batch(INSERT_RESULT_SQL, results, (ps, r) -> {
            ps.setString(1, r.getEmail());
            ps.setString(2, r.getTaskId());
            ps.setInt(3, r.getRound());
            ps.setString(4, r.getRepoUrl());
            ps.setString(5, r.getCommitSha());
            ps.setString(6, r.getPagesUrl());
            ps.setString(7, r.getCheckName());
            ps.setDouble(8, r.getScore());
            ps.setString(9, r.getReason());
            ps.setString(10, r.getLogs());
            ps.setString(11, r.getCreatedAt().toString());
        }, "Failed to insert results");
        logger.debug("Stored {} results for {}", written, results.get(0).getTaskId());
        return written;
    }

    public boolean resultExists(String email, String taskId, int round) {
        return jdbc.exists(RESULT_EXISTS_SQL, ps -> {
            ps.setString(1, email);
            ps.setString(2, taskId);
            ps.setInt(3, round);
        }, "Failed to look up results for " + taskId);
    }

    /**
     * Results filtered by email and/or round; a null filter matches everything.
     */
    public List<CheckResult> findResults(String email, Integer round) {
        return jdbc.queryList(RESULTS_SQL, ps -> {
            ps.setString(1, email);
            ps.setString(2, email);
            setNullableInt(ps, 3, round);
            setNullableInt(ps, 4, round);
        }, this::mapResult, "Failed to list results");
    }

    // ---- deployments ----

    public void upsertDeployment(Deployment deployment) {
        String files = toJson(deployment.getFiles());
        jdbc.update(UPSERT_DEPLOYMENT_SQL, ps -> {
            ps.setString(1, deployment.getTaskId());
            ps.setInt(2, deployment.getRound());
            ps.setString(3, deployment.getRepoUrl());
            ps.setString(4, deployment.getCommitSha());
            ps.setString(5, deployment.getPagesUrl());
            ps.setString(6, files);
            ps.setString(7, deployment.getUpdatedAt().toString());
        }, "Failed to store deployment for " + deployment.getTaskId());
    }

    public Optional<Deployment> findDeployment(String taskId) {
        return jdbc.queryOne(DEPLOYMENT_BY_TASK_SQL, ps -> ps.setString(1, taskId), this::mapDeployment,
                "Failed to look up deployment for " + taskId);
    }

    // ---- mapping ----

    private Task mapTask(ResultSet rs) throws SQLException {
        Task task = new Task(rs.getString("email"), rs.getString("task"), rs.getInt("round"), rs.getString("nonce"));
        task.setBrief(rs.getString("brief"));
        task.setAttachments(fromJson(rs.getString("attachments"), ATTACHMENT_LIST));
        task.setChecks(fromJson(rs.getString("checks"), CHECK_LIST));
        task.setEvaluationUrl(rs.getString("evaluation_url"));
        task.setEndpoint(rs.getString("endpoint"));
        task.setSecret(rs.getString("secret"));
        int status = rs.getInt("status_code");
        task.setStatusCode(rs.wasNull() ? null : status);
        task.setError(rs.getString("error"));
        task.setCreatedAt(Instant.parse(rs.getString("created_at")));
        return task;
    }

    private Submission mapSubmission(ResultSet rs) throws SQLException {
        Submission submission = new Submission(
                rs.getString("email"),
                rs.getString("task"),
                rs.getInt("round"),
                rs.getString("nonce"),
                rs.getString("repo_url"),
                rs.getString("commit_sha"),
                rs.getString("pages_url"));
        submission.setReceivedAt(Instant.parse(rs.getString("received_at")));
        return submission;
    }

    private CheckResult mapResult(ResultSet rs) throws SQLException {
        CheckResult result = new CheckResult();
        result.setEmail(rs.getString("email"));
        result.setTaskId(rs.getString("task"));
        result.setRound(rs.getInt("round"));
        result.setRepoUrl(rs.getString("repo_url"));
        result.setCommitSha(rs.getString("commit_sha"));
        result.setPagesUrl(rs.getString("pages_url"));
        result.setCheckName(rs.getString("check_name"));
        result.setScore(rs.getDouble("score"));
        result.setReason(rs.getString("reason"));
        result.setLogs(rs.getString("logs"));
        result.setCreatedAt(Instant.parse(rs.getString("created_at")));
        return result;
    }

    private Deployment mapDeployment(ResultSet rs) throws SQLException {
        Deployment deployment = new Deployment(
                rs.getString("task"),
                rs.getInt("round"),
                rs.getString("repo_url"),
                rs.getString("commit_sha"),
                rs.getString("pages_url"),
                fromJson(rs.getString("files"), FILE_MAP));
        deployment.setUpdatedAt(Instant.parse(rs.getString("updated_at")));
        return deployment;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LedgerException("Failed to serialize ledger column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) throws SQLException {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
