package com.tracegate.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracegate.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * JDBC-based {@link EntityGraphStore} for PostgreSQL.
 * <p>
 * Every entity is stored as a Jackson-serialized JSON {@code body} next to the columns the
 * engine queries by (parent, anchor, requirement, plan, ...). Uniqueness invariants are enforced
 * by primary keys and unique constraints, so a concurrent duplicate insert fails in the database
 * and is reported as {@link UniqueViolationException}. Changes to one field of a scope
 * declaration body run under {@code SELECT ... FOR UPDATE}.
 * <p>
 * Tables are created by {@link #createTables()}.
 */
public class JdbcEntityGraphStore implements EntityGraphStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityGraphStore.class);

    /** SQLSTATE for unique_violation, shared by PostgreSQL and H2. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS tg_process_nodes (
                id          VARCHAR(64) PRIMARY KEY,
                parent_id   VARCHAR(64),
                node_level  INTEGER NOT NULL,
                body        TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_process_steps (
                id    VARCHAR(64) PRIMARY KEY,
                body  TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_requirements (
                id         VARCHAR(64) PRIMARY KEY,
                anchor_id  VARCHAR(64),
                body       TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_development_items (
                id              VARCHAR(64) PRIMARY KEY,
                requirement_id  VARCHAR(64),
                body            TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_test_artifacts (
                id                   VARCHAR(64) PRIMARY KEY,
                anchor_id            VARCHAR(64),
                development_item_id  VARCHAR(64),
                requirement_id       VARCHAR(64),
                body                 TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_suites (
                id    VARCHAR(64) PRIMARY KEY,
                body  TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_case_suite_links (
                test_artifact_id  VARCHAR(64) NOT NULL,
                suite_id          VARCHAR(64) NOT NULL,
                body              TEXT NOT NULL,
                PRIMARY KEY (test_artifact_id, suite_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_plans (
                id    VARCHAR(64) PRIMARY KEY,
                body  TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_cycles (
                id       VARCHAR(64) PRIMARY KEY,
                plan_id  VARCHAR(64) NOT NULL,
                body     TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_scope_declarations (
                id           VARCHAR(64) PRIMARY KEY,
                plan_id      VARCHAR(64) NOT NULL,
                source_type  VARCHAR(32) NOT NULL,
                source_id    VARCHAR(64) NOT NULL,
                body         TEXT NOT NULL,
                CONSTRAINT uq_scope_declaration UNIQUE (plan_id, source_type, source_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_plan_case_entries (
                plan_id           VARCHAR(64) NOT NULL,
                test_artifact_id  VARCHAR(64) NOT NULL,
                body              TEXT NOT NULL,
                PRIMARY KEY (plan_id, test_artifact_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_plan_data_sets (
                plan_id      VARCHAR(64) NOT NULL,
                data_set_id  VARCHAR(64) NOT NULL,
                body         TEXT NOT NULL,
                PRIMARY KEY (plan_id, data_set_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_executions (
                id                BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                cycle_id          VARCHAR(64) NOT NULL,
                test_artifact_id  VARCHAR(64) NOT NULL,
                executed_at_ms    BIGINT,
                body              TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tg_defects (
                id          VARCHAR(64) PRIMARY KEY,
                project_id  VARCHAR(64),
                severity    VARCHAR(8),
                body        TEXT NOT NULL
            )
            """
    );

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcEntityGraphStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates the entity tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
        }
        log.info("Entity graph tables ensured ({} tables)", CREATE_TABLES_SQL.size());
    }

    // ── Process hierarchy ───────────────────────────────────────────────

    @Override
    public Optional<ProcessNode> findNode(String id) {
        return queryOne("SELECT body FROM tg_process_nodes WHERE id = ?", ProcessNode.class, id);
    }

    @Override
    public List<ProcessNode> findChildren(String parentId, Integer level) {
        if (level == null) {
            return queryList("SELECT body FROM tg_process_nodes WHERE parent_id = ? ORDER BY id",
                    ProcessNode.class, parentId);
        }
        return queryList("SELECT body FROM tg_process_nodes WHERE parent_id = ? AND node_level = ? ORDER BY id",
                ProcessNode.class, parentId, level);
    }

    @Override
    public Optional<ProcessStep> findProcessStep(String id) {
        return queryOne("SELECT body FROM tg_process_steps WHERE id = ?", ProcessStep.class, id);
    }

    @Override
    public void saveNode(ProcessNode node) {
        String body = toJson(node);
        upsert("UPDATE tg_process_nodes SET parent_id = ?, node_level = ?, body = ? WHERE id = ?",
                new Object[]{node.parentId(), node.level(), body, node.id()},
                "INSERT INTO tg_process_nodes (id, parent_id, node_level, body) VALUES (?, ?, ?, ?)",
                new Object[]{node.id(), node.parentId(), node.level(), body});
    }

    @Override
    public void saveProcessStep(ProcessStep step) {
        saveBodyOnly("tg_process_steps", step.id(), toJson(step));
    }

    // ── Requirements & development items ────────────────────────────────

    @Override
    public Optional<Requirement> findRequirement(String id) {
        return queryOne("SELECT body FROM tg_requirements WHERE id = ?", Requirement.class, id);
    }

    @Override
    public List<Requirement> findRequirementsByAnchor(String anchorId) {
        return queryList("SELECT body FROM tg_requirements WHERE anchor_id = ? ORDER BY id",
                Requirement.class, anchorId);
    }

    @Override
    public Optional<DevelopmentItem> findDevelopmentItem(String id) {
        return queryOne("SELECT body FROM tg_development_items WHERE id = ?", DevelopmentItem.class, id);
    }

    @Override
    public List<DevelopmentItem> findDevelopmentItemsByRequirement(String requirementId) {
        return queryList("SELECT body FROM tg_development_items WHERE requirement_id = ? ORDER BY id",
                DevelopmentItem.class, requirementId);
    }

    @Override
    public void saveRequirement(Requirement requirement) {
        String body = toJson(requirement);
        upsert("UPDATE tg_requirements SET anchor_id = ?, body = ? WHERE id = ?",
                new Object[]{requirement.anchorId(), body, requirement.id()},
                "INSERT INTO tg_requirements (id, anchor_id, body) VALUES (?, ?, ?)",
                new Object[]{requirement.id(), requirement.anchorId(), body});
    }

    @Override
    public void saveDevelopmentItem(DevelopmentItem item) {
        String body = toJson(item);
        upsert("UPDATE tg_development_items SET requirement_id = ?, body = ? WHERE id = ?",
                new Object[]{item.requirementId(), body, item.id()},
                "INSERT INTO tg_development_items (id, requirement_id, body) VALUES (?, ?, ?)",
                new Object[]{item.id(), item.requirementId(), body});
    }

    // ── Test artifacts & suites ─────────────────────────────────────────

    @Override
    public Optional<TestArtifact> findTestArtifact(String id) {
        return queryOne("SELECT body FROM tg_test_artifacts WHERE id = ?", TestArtifact.class, id);
    }

    @Override
    public List<TestArtifact> findTestArtifactsBy(ArtifactLinkField field, String id) {
        // column name comes from the enum, never from caller input
        String sql = "SELECT body FROM tg_test_artifacts WHERE " + field.column() + " = ? ORDER BY id";
        return queryList(sql, TestArtifact.class, id);
    }

    @Override
    public TestArtifact insertTestArtifact(TestArtifact artifact) {
        insertUnique("""
                INSERT INTO tg_test_artifacts (id, anchor_id, development_item_id, requirement_id, body)
                VALUES (?, ?, ?, ?, ?)
                """,
                "Test artifact already exists: " + artifact.id(),
                artifact.id(), artifact.anchorId(), artifact.developmentItemId(), artifact.requirementId(),
                toJson(artifact));
        return artifact;
    }

    @Override
    public void saveTestArtifact(TestArtifact artifact) {
        String body = toJson(artifact);
        upsert("""
                UPDATE tg_test_artifacts
                SET anchor_id = ?, development_item_id = ?, requirement_id = ?, body = ?
                WHERE id = ?
                """,
                new Object[]{artifact.anchorId(), artifact.developmentItemId(), artifact.requirementId(), body,
                        artifact.id()},
                """
                INSERT INTO tg_test_artifacts (id, anchor_id, development_item_id, requirement_id, body)
                VALUES (?, ?, ?, ?, ?)
                """,
                new Object[]{artifact.id(), artifact.anchorId(), artifact.developmentItemId(),
                        artifact.requirementId(), body});
    }

    @Override
    public Optional<Suite> findSuite(String id) {
        return queryOne("SELECT body FROM tg_suites WHERE id = ?", Suite.class, id);
    }

    @Override
    public void saveSuite(Suite suite) {
        saveBodyOnly("tg_suites", suite.id(), toJson(suite));
    }

    @Override
    public CaseSuiteLink insertCaseSuiteLink(CaseSuiteLink link) {
        insertUnique("INSERT INTO tg_case_suite_links (test_artifact_id, suite_id, body) VALUES (?, ?, ?)",
                "Case/suite pair already exists: " + link.testArtifactId() + " / " + link.suiteId(),
                link.testArtifactId(), link.suiteId(), toJson(link));
        return link;
    }

    @Override
    public boolean deleteCaseSuiteLink(String testArtifactId, String suiteId) {
        return update("DELETE FROM tg_case_suite_links WHERE test_artifact_id = ? AND suite_id = ?",
                testArtifactId, suiteId) > 0;
    }

    @Override
    public List<CaseSuiteLink> findLinksForSuite(String suiteId) {
        return queryList("SELECT body FROM tg_case_suite_links WHERE suite_id = ? ORDER BY test_artifact_id",
                CaseSuiteLink.class, suiteId);
    }

    @Override
    public List<CaseSuiteLink> findLinksForCase(String testArtifactId) {
        return queryList("SELECT body FROM tg_case_suite_links WHERE test_artifact_id = ? ORDER BY suite_id",
                CaseSuiteLink.class, testArtifactId);
    }

    // ── Plans ───────────────────────────────────────────────────────────

    @Override
    public Optional<TestPlan> findPlan(String id) {
        return queryOne("SELECT body FROM tg_plans WHERE id = ?", TestPlan.class, id);
    }

    @Override
    public void savePlan(TestPlan plan) {
        saveBodyOnly("tg_plans", plan.id(), toJson(plan));
    }

    @Override
    public Optional<TestCycle> findCycle(String id) {
        return queryOne("SELECT body FROM tg_cycles WHERE id = ?", TestCycle.class, id);
    }

    @Override
    public List<TestCycle> findCycles(String planId) {
        List<TestCycle> cycles = new ArrayList<>(
                queryList("SELECT body FROM tg_cycles WHERE plan_id = ? ORDER BY id", TestCycle.class, planId));
        cycles.sort((a, b) -> a.sequence() != b.sequence()
                ? Integer.compare(a.sequence(), b.sequence())
                : a.id().compareTo(b.id()));
        return cycles;
    }

    @Override
    public void saveCycle(TestCycle cycle) {
        String body = toJson(cycle);
        upsert("UPDATE tg_cycles SET plan_id = ?, body = ? WHERE id = ?",
                new Object[]{cycle.planId(), body, cycle.id()},
                "INSERT INTO tg_cycles (id, plan_id, body) VALUES (?, ?, ?)",
                new Object[]{cycle.id(), cycle.planId(), body});
    }

    @Override
    public List<ScopeDeclaration> findScopeDeclarations(String planId) {
        return queryList("SELECT body FROM tg_scope_declarations WHERE plan_id = ? ORDER BY id",
                ScopeDeclaration.class, planId);
    }

    @Override
    public Optional<ScopeDeclaration> findScopeDeclaration(String id) {
        return queryOne("SELECT body FROM tg_scope_declarations WHERE id = ?", ScopeDeclaration.class, id);
    }

    @Override
    public ScopeDeclaration insertScopeDeclaration(ScopeDeclaration declaration) {
        insertUnique("""
                INSERT INTO tg_scope_declarations (id, plan_id, source_type, source_id, body)
                VALUES (?, ?, ?, ?, ?)
                """,
                "Scope already declared for plan " + declaration.planId() + ": "
                        + declaration.sourceType().code() + " " + declaration.sourceId(),
                declaration.id(), declaration.planId(), declaration.sourceType().code(),
                declaration.sourceId(), toJson(declaration));
        return declaration;
    }

    @Override
    public ScopeDeclaration updateScopeDeclaration(ScopeDeclaration declaration) {
        return modifyDeclaration(declaration.id(),
                existing -> existing.withPlanning(declaration.priority(), declaration.riskLevel()))
                .orElseThrow(() -> new StoreException("Scope declaration vanished during update: "
                        + declaration.id(), null));
    }

    @Override
    public void writeCoverageStatus(String declarationId, CoverageStatus status) {
        modifyDeclaration(declarationId, existing -> existing.withCoverageStatus(status));
    }

    /**
     * Reads, changes and writes back one declaration body while holding its row lock, so a
     * planning edit and a coverage write on the same row never overwrite each other's field.
     */
    private Optional<ScopeDeclaration> modifyDeclaration(String id, UnaryOperator<ScopeDeclaration> change) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                ScopeDeclaration existing = null;
                try (PreparedStatement select = conn.prepareStatement(
                        "SELECT body FROM tg_scope_declarations WHERE id = ? FOR UPDATE")) {
                    bind(select, id);
                    try (ResultSet rs = select.executeQuery()) {
                        if (rs.next()) {
                            existing = fromJson(rs.getString("body"), ScopeDeclaration.class);
                        }
                    }
                }
                if (existing == null) {
                    conn.commit();
                    return Optional.empty();
                }
                ScopeDeclaration changed = change.apply(existing);
                try (PreparedStatement update = conn.prepareStatement(
                        "UPDATE tg_scope_declarations SET body = ? WHERE id = ?")) {
                    bind(update, toJson(changed), id);
                    update.executeUpdate();
                }
                conn.commit();
                return Optional.of(changed);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update scope declaration " + id, e);
        }
    }

    @Override
    public boolean deleteScopeDeclaration(String id) {
        return update("DELETE FROM tg_scope_declarations WHERE id = ?", id) > 0;
    }

    @Override
    public List<PlanCaseEntry> findPlanCaseEntries(String planId) {
        return queryList("SELECT body FROM tg_plan_case_entries WHERE plan_id = ? ORDER BY test_artifact_id",
                PlanCaseEntry.class, planId);
    }

    @Override
    public PlanCaseEntry insertPlanCaseEntry(PlanCaseEntry entry) {
        insertUnique("INSERT INTO tg_plan_case_entries (plan_id, test_artifact_id, body) VALUES (?, ?, ?)",
                "Test artifact " + entry.testArtifactId() + " is already in plan " + entry.planId(),
                entry.planId(), entry.testArtifactId(), toJson(entry));
        return entry;
    }

    @Override
    public boolean deletePlanCaseEntry(String planId, String testArtifactId) {
        return update("DELETE FROM tg_plan_case_entries WHERE plan_id = ? AND test_artifact_id = ?",
                planId, testArtifactId) > 0;
    }

    @Override
    public List<PlanDataSet> findPlanDataSets(String planId) {
        return queryList("SELECT body FROM tg_plan_data_sets WHERE plan_id = ? ORDER BY data_set_id",
                PlanDataSet.class, planId);
    }

    @Override
    public void savePlanDataSet(PlanDataSet dataSet) {
        String body = toJson(dataSet);
        upsert("UPDATE tg_plan_data_sets SET body = ? WHERE plan_id = ? AND data_set_id = ?",
                new Object[]{body, dataSet.planId(), dataSet.dataSetId()},
                "INSERT INTO tg_plan_data_sets (plan_id, data_set_id, body) VALUES (?, ?, ?)",
                new Object[]{dataSet.planId(), dataSet.dataSetId(), body});
    }

    // ── Executions & defects ────────────────────────────────────────────

    @Override
    public List<Execution> findExecutions(String testArtifactId) {
        return queryExecutions("""
                SELECT id, body FROM tg_executions
                WHERE test_artifact_id = ?
                ORDER BY executed_at_ms ASC NULLS FIRST, id ASC
                """, testArtifactId);
    }

    @Override
    public List<Execution> findExecutionsForCycle(String cycleId) {
        return queryExecutions("SELECT id, body FROM tg_executions WHERE cycle_id = ? ORDER BY id", cycleId);
    }

    /**
     * Stores the execution under a database-generated id; any id carried by the argument is ignored.
     */
    @Override
    public Execution insertExecution(Execution execution) {
        String sql = """
                INSERT INTO tg_executions (cycle_id, test_artifact_id, executed_at_ms, body)
                VALUES (?, ?, ?, ?)
                """;
        Long executedAtMs = execution.executedAt() != null ? execution.executedAt().toEpochMilli() : null;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(stmt, execution.cycleId(), execution.testArtifactId(), executedAtMs, toJson(execution));
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for execution of " + execution.testArtifactId(), null);
                }
                Execution stored = execution.withId(keys.getLong("id"));
                log.debug("Recorded execution {} for artifact {} in cycle {}",
                        stored.id(), stored.testArtifactId(), stored.cycleId());
                return stored;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert execution for " + execution.testArtifactId(), e);
        }
    }

    @Override
    public Execution updateExecution(Execution execution) {
        if (execution.id() == null) {
            throw new StoreException("Cannot update an execution without an id", null);
        }
        Long executedAtMs = execution.executedAt() != null ? execution.executedAt().toEpochMilli() : null;
        int rows = update("""
                UPDATE tg_executions
                SET cycle_id = ?, test_artifact_id = ?, executed_at_ms = ?, body = ?
                WHERE id = ?
                """,
                execution.cycleId(), execution.testArtifactId(), executedAtMs, toJson(execution), execution.id());
        if (rows == 0) {
            throw new StoreException("No execution with id " + execution.id(), null);
        }
        return execution;
    }

    @Override
    public List<Defect> findOpenDefects(String projectId, DefectSeverity severity) {
        return queryList("SELECT body FROM tg_defects WHERE project_id = ? AND severity = ? ORDER BY id",
                Defect.class, projectId, severity.name()).stream()
                .filter(d -> d.status() != null && d.status().isOpen())
                .toList();
    }

    @Override
    public void saveDefect(Defect defect) {
        String body = toJson(defect);
        String severity = defect.severity() != null ? defect.severity().name() : null;
        upsert("UPDATE tg_defects SET project_id = ?, severity = ?, body = ? WHERE id = ?",
                new Object[]{defect.projectId(), severity, body, defect.id()},
                "INSERT INTO tg_defects (id, project_id, severity, body) VALUES (?, ?, ?, ?)",
                new Object[]{defect.id(), defect.projectId(), severity, body});
    }

    // ── JDBC plumbing ───────────────────────────────────────────────────

    private void saveBodyOnly(String table, String id, String body) {
        upsert("UPDATE " + table + " SET body = ? WHERE id = ?", new Object[]{body, id},
                "INSERT INTO " + table + " (id, body) VALUES (?, ?)", new Object[]{id, body});
    }

    private void upsert(String updateSql, Object[] updateParams, String insertSql, Object[] insertParams) {
        if (update(updateSql, updateParams) == 0) {
            update(insertSql, insertParams);
        }
    }

    private void insertUnique(String sql, String conflictMessage, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new UniqueViolationException(conflictMessage, e);
            }
            throw new StoreException("Insert failed: " + conflictMessage, e);
        }
    }

    private int update(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Update failed: " + firstLine(sql), e);
        }
    }

    private <T> Optional<T> queryOne(String sql, Class<T> type, Object... params) {
        List<T> rows = queryList(sql, type, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private <T> List<T> queryList(String sql, Class<T> type, Object... params) {
        List<T> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromJson(rs.getString("body"), type));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + firstLine(sql), e);
        }
        return rows;
    }

    private List<Execution> queryExecutions(String sql, String param) {
        List<Execution> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, param);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromJson(rs.getString("body"), Execution.class).withId(rs.getLong("id")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + firstLine(sql), e);
        }
        return rows;
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            if (value == null) {
                stmt.setNull(i + 1, Types.NULL);
            } else if (value instanceof Long l) {
                stmt.setLong(i + 1, l);
            } else if (value instanceof Integer n) {
                stmt.setInt(i + 1, n);
            } else {
                stmt.setString(i + 1, value.toString());
            }
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private static String firstLine(String sql) {
        return sql.strip().lines().findFirst().orElse(sql);
    }
}
