package com.example.skillgap.courses.config;

import com.pgvector.PGvector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Register pgvector types with the JDBC driver so the course search can bind
 * {@link PGvector} query parameters.
 */
@Slf4j
@Configuration
@Profile("!test")
@RequiredArgsConstructor
public class PgvectorConfig {

    private final DataSource dataSource;

    @PostConstruct
    public void registerPgvectorTypes() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            String driverName = driverName(conn);
            if (driverName.toLowerCase(Locale.ROOT).contains("postgresql")) {
                PGvector.registerTypes(conn);
                log.info("Registered pgvector types for course search");
            } else {
                log.debug("Skip pgvector type registration for non-PostgreSQL driver '{}'", driverName);
            }
        }
    }

    private static String driverName(Connection conn) {
        try {
            String name = conn.getMetaData().getDriverName();
            return name == null ? "" : name;
        } catch (SQLException ex) {
            log.debug("Unable to read JDBC driver name: {}", ex.getMessage());
            return "";
        }
    }
}
