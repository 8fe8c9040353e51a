package com.familycalendar.core.permissions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcPermissionBackendTest extends PermissionBackendContract {

    @Override
    protected PermissionBackend createBackend() throws SQLException {
        // fresh database per test
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:perm-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        var jdbc = new JdbcPermissionBackend(dataSource);
        jdbc.createTables();
        return jdbc;
    }

    @Test
    @DisplayName("createTables can run on every startup")
    void createTablesIsRepeatable() throws SQLException {
        ((JdbcPermissionBackend) backend).createTables();
        backend.assignPermission(9L, Permission.READ);

        assertTrue(backend.checkPermission(9L, Permission.READ));
    }

    @Test
    @DisplayName("list is sorted by permission name")
    void listIsSorted() {
        backend.assignPermission(8L, Permission.WRITE);
        backend.assignPermission(8L, Permission.ADMIN);
        backend.assignPermission(8L, Permission.READ);

        assertEquals(List.of(Permission.ADMIN, Permission.READ, Permission.WRITE), backend.listPermissions(8L));
    }

    @Nested
    @DisplayName("when the store is unreachable")
    class UnreachableStore {

        private JdbcPermissionBackend broken() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            when(dataSource.getConnection()).thenThrow(new SQLException("connection refused", "08001"));
            return new JdbcPermissionBackend(dataSource);
        }

        @Test
        @DisplayName("writes raise PermissionStoreException")
        void writesFail() throws SQLException {
            var store = broken();

            var ex = assertThrows(PermissionStoreException.class,
                    () -> store.assignPermission(1L, Permission.READ));
            assertInstanceOf(SQLException.class, ex.getCause());
            assertThrows(PermissionStoreException.class,
                    () -> store.removePermission(1L, Permission.READ));
        }

        @Test
        @DisplayName("reads deny instead of failing")
        void readsDeny() throws SQLException {
            var store = broken();

            assertFalse(store.checkPermission(1L, Permission.READ));
            assertTrue(store.listPermissions(1L).isEmpty());
            assertFalse(store.isAvailable());
        }
    }
}
