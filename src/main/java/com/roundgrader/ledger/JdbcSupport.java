package com.roundgrader.ledger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns connection and statement lifecycle for the ledger queries and turns
 * {@link SQLException} into {@link LedgerException}. Every call acquires and releases
 * its own connection.
 */
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException(errorContext + ": " + e.getMessage(), e);
        }
    }

    /**
     * Run several DDL statements on one connection.
     */
    void execute(List<String> statements, String errorContext) {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        } catch (SQLException e) {
            throw new LedgerException(errorContext + ": " + e.getMessage(), e);
        }
    }

    /**
     * Insert all rows in a single transaction; nothing is written if any row fails.
     */
    <T> int batch(String sql, List<T> rows, RowBinder<T> binder, String errorContext) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (T row : rows) {
                    binder.bind(ps, row);
                    ps.addBatch();
                }
                int[] counts = ps.executeBatch();
                conn.commit();
                int total = 0;
                for (int count : counts) {
                    total += Math.max(count, 0);
                }
                return total;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new LedgerException(errorContext + ": " + e.getMessage(), e);
        }
    }

    <T> Optional<T> queryOne(String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new LedgerException(errorContext + ": " + e.getMessage(), e);
        }
    }

    <T> List<T> queryList(String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new LedgerException(errorContext + ": " + e.getMessage(), e);
        }
    }

    boolean exists(String sql, StatementPreparer preparer, String errorContext) {
        return queryOne(sql, preparer, rs -> Boolean.TRUE, errorContext).isPresent();
    }

    @FunctionalInterface
    interface StatementPreparer {
        void prepare(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    interface RowBinder<T> {
        void bind(PreparedStatement ps, T row) throws SQLException;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
