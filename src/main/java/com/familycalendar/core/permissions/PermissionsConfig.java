package com.familycalendar.core.permissions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that picks the {@link PermissionBackend} from
 * {@code calendar.permissions.backend}.
 * <p>
 * {@code jdbc} (the default) stores permissions in the configured {@link DataSource} and
 * creates the table on startup. {@code memory} keeps them in process memory -- suitable for
 * development and testing but not durable across restarts.
 */
@Configuration
public class PermissionsConfig {

    private static final Logger log = LoggerFactory.getLogger(PermissionsConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "calendar.permissions", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    public PermissionBackend jdbcPermissionBackend(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC permission backend");
        var backend = new JdbcPermissionBackend(dataSource);
        backend.createTables();
        return backend;
    }

    @Bean
    @ConditionalOnProperty(prefix = "calendar.permissions", name = "backend", havingValue = "memory")
    public PermissionBackend memoryPermissionBackend() {
        log.info("Using in-memory permission backend (permissions will not persist across restarts)");
        return new InMemoryPermissionBackend();
    }

    @Bean
    public PermissionsManager permissionsManager(PermissionBackend backend) {
        return new PermissionsManager(backend);
    }
}
