package com.familycalendar.core.permissions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-based {@link PermissionBackend} storing one row per granted permission in
 * {@code user_permissions}, keyed by {@code (user_id, permission)}.
 * <p>
 * Writes propagate failures as {@link PermissionStoreException}. Reads log the failure and
 * answer as if the user held nothing, so a broken store never grants access.
 */
public class JdbcPermissionBackend implements PermissionBackend {

    private static final Logger log = LoggerFactory.getLogger(JdbcPermissionBackend.class);

    private static final String TABLE_NAME = "user_permissions";

    /** SQLSTATE for a unique-constraint violation, shared by H2 and PostgreSQL. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                user_id    BIGINT       NOT NULL,
                permission VARCHAR(255) NOT NULL,
                granted_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (user_id, permission)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (user_id, permission) VALUES (?, ?)
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE user_id = ? AND permission = ?
            """.formatted(TABLE_NAME);

    private static final String CHECK_SQL = """
            SELECT COUNT(*) FROM %s WHERE user_id = ? AND permission = ?
            """.formatted(TABLE_NAME);

    private static final String LIST_SQL = """
            SELECT permission FROM %s WHERE user_id = ? ORDER BY permission
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcPermissionBackend(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Creates the permission table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Permission table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void assignPermission(long userId, Permission permission) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setLong(1, userId);
            stmt.setString(2, permission.name());
            stmt.executeUpdate();
            log.debug("Granted '{}' to user {}", permission.name(), userId);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                log.debug("User {} already holds '{}'", userId, permission.name());
                return;
            }
            throw new PermissionStoreException(
                    "Failed to grant '" + permission.name() + "' to user " + userId, e);
        }
    }

    @Override
    public void removePermission(long userId, Permission permission) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setLong(1, userId);
            stmt.setString(2, permission.name());
            int deleted = stmt.executeUpdate();
            log.debug("Revoked '{}' from user {} ({} row(s))", permission.name(), userId, deleted);
        } catch (SQLException e) {
            throw new PermissionStoreException(
                    "Failed to revoke '" + permission.name() + "' from user " + userId, e);
        }
    }

    @Override
    public boolean checkPermission(long userId, Permission permission) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CHECK_SQL)) {
            stmt.setLong(1, userId);
            stmt.setString(2, permission.name());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            log.error("Failed to check '{}' for user {}", permission.name(), userId, e);
            return false;
        }
    }

    @Override
    public List<Permission> listPermissions(long userId) {
        List<Permission> permissions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LIST_SQL)) {
            stmt.setLong(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    permissions.add(Permission.fromName(rs.getString("permission")));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list permissions for user {}", userId, e);
            return List.of();
        }
        return permissions;
    }

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Permission store unreachable: {}", e.getMessage());
            return false;
        }
    }
}
