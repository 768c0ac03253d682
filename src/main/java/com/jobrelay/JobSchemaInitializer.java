package com.jobrelay;

import com.jobrelay.config.JobRelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code jobrelay/migration} once per database, recording each in
 * {@code jobrelay_schema_migrations} with its checksum. Scripts use the {@code jobrelay_} name prefix for every
 * table and index; a configured table prefix is prepended to all of them.
 */
@Component
@ConditionalOnProperty(prefix = "jobrelay.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VERSION_FILE_PATTERN = Pattern.compile("^V([0-9]+(?:_[0-9]+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    static final String MIGRATION_RESOURCE_PATTERN = "classpath*:jobrelay/migration/V*__*.sql";
    static final String OBJECT_NAME_PREFIX = "jobrelay_";
    private static final long POSTGRES_ADVISORY_LOCK_KEY = 7_301_552_904_118_260_771L;

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(
            DataSource dataSource,
            ObjectProvider<JobRelayProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        JobRelayProperties properties = propertiesProvider.getIfAvailable();
        String configuredPrefix = properties != null
                ? properties.getDatabase().getTablePrefix()
                : environment.getProperty("jobrelay.database.table-prefix", "");
        this.failOnMigrationError = properties != null
                ? properties.getDatabase().isFailOnMigrationError()
                : environment.getProperty("jobrelay.database.fail-on-migration-error", Boolean.class, true);
        this.tablePrefix = normalizePrefix(configuredPrefix);
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = prefixed(OBJECT_NAME_PREFIX + "schema_migrations");
        log.info("Initializing JobRelay schema using history table {}", historyTable);

        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lockIfPostgres(connection);
            try {
                migrate(connection, historyTable);
            } finally {
                unlockIfPostgres(connection, locked);
            }
        } catch (Exception e) {
            String message = "Failed to initialize JobRelay database schema";
            if (failOnMigrationError) {
                throw new IllegalStateException(message, e);
            }
            log.error("{} (continuing because jobrelay.database.fail-on-migration-error=false)", message, e);
        }
    }

    private void migrate(Connection connection, String historyTable) throws SQLException, IOException {
        createHistoryTable(connection, historyTable);
        List<Migration> migrations = loadMigrations();
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No JobRelay migrations found on " + MIGRATION_RESOURCE_PATTERN);
        }

        Map<String, String> appliedChecksums = loadAppliedChecksums(connection, historyTable);
        verifyHistory(migrations, appliedChecksums);

        int applied = 0;
        for (Migration migration : migrations) {
            if (!appliedChecksums.containsKey(migration.version())) {
                apply(connection, historyTable, migration);
                applied++;
            }
        }

        if (applied == 0) {
            log.info("JobRelay schema is up to date ({} migrations applied earlier)", appliedChecksums.size());
        } else {
            log.info("Applied {} JobRelay migration(s)", applied);
        }
    }

    private void createHistoryTable(Connection connection, String historyTable) throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    version VARCHAR(64) PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL,
                    execution_time_ms BIGINT NOT NULL
                )
                """.formatted(historyTable);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private List<Migration> loadMigrations() throws IOException {
        Resource[] resources = resourceResolver.getResources(MIGRATION_RESOURCE_PATTERN);
        List<Migration> migrations = new ArrayList<>(resources.length);
        Map<String, String> fileByVersion = new HashMap<>();

        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = VERSION_FILE_PATTERN.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not follow V{version}__{description}.sql");
            }
            String version = matcher.group(1);
            String previous = fileByVersion.putIfAbsent(version, fileName);
            if (previous != null) {
                throw new IllegalStateException(
                        "Migration version V" + version + " is defined by both " + previous + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            migrations.add(new Migration(version, versionParts(version), matcher.group(2).replace('_', ' '),
                    fileName, sql, sha256(sql)));
        }

        migrations.sort(Comparator.comparing(Migration::versionParts, JobSchemaInitializer::compareVersions));
        return migrations;
    }

    private Map<String, String> loadAppliedChecksums(Connection connection, String historyTable)
            throws SQLException {
        Map<String, String> applied = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void verifyHistory(List<Migration> migrations, Map<String, String> appliedChecksums) {
        Map<String, Migration> byVersion = new HashMap<>();
        migrations.forEach(migration -> byVersion.put(migration.version(), migration));

        appliedChecksums.forEach((version, checksum) -> {
            Migration migration = byVersion.get(version);
            if (migration == null) {
                throw new IllegalStateException(
                        "Migration V" + version + " is recorded in the database but missing from the classpath");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException(
                        "Migration V" + version + " was modified after it had been applied (checksum mismatch)");
            }
        });
    }

    private void apply(Connection connection, String historyTable, Migration migration) {
        boolean originalAutoCommit = true;
        long started = System.nanoTime();
        try {
            originalAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);

            String sql = render(migration.sql());
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8), migration.fileName()),
                    StandardCharsets.UTF_8));

            long executionMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + historyTable
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.setLong(4, executionMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied JobRelay migration V{} ({}) in {} ms", migration.version(), migration.description(),
                    executionMs);
        } catch (Exception e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                log.error("Failed to roll back JobRelay migration V{}", migration.version(), rollbackFailure);
            }
            throw new IllegalStateException(
                    "Failed to apply JobRelay migration V" + migration.version() + " (" + migration.description() + ")",
                    e);
        } finally {
            try {
                connection.setAutoCommit(originalAutoCommit);
            } catch (SQLException e) {
                log.warn("Could not restore auto-commit after JobRelay migration", e);
            }
        }
    }

    String render(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        return sql.replace(OBJECT_NAME_PREFIX, tablePrefix + OBJECT_NAME_PREFIX);
    }

    private boolean lockIfPostgres(Connection connection) {
        try {
            if (!isPostgres(connection)) {
                return false;
            }
            try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
                statement.setLong(1, POSTGRES_ADVISORY_LOCK_KEY);
                statement.execute();
            }
            return true;
        } catch (Exception e) {
            throw new IllegalStateException("Unable to acquire the JobRelay schema migration lock", e);
        }
    }

    private void unlockIfPostgres(Connection connection, boolean locked) {
        if (!locked) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, POSTGRES_ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release the JobRelay schema migration lock", e);
        }
    }

    private boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private String prefixed(String name) {
        String identifier = tablePrefix + name;
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsupported SQL identifier: " + identifier);
        }
        return identifier;
    }

    private static String normalizePrefix(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported jobrelay.database.table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static List<Integer> versionParts(String version) {
        List<Integer> parts = new ArrayList<>();
        for (String part : version.split("_")) {
            parts.add(Integer.parseInt(part));
        }
        return parts;
    }

    private static int compareVersions(List<Integer> left, List<Integer> right) {
        int max = Math.max(left.size(), right.size());
        for (int i = 0; i < max; i++) {
            int l = i < left.size() ? left.get(i) : 0;
            int r = i < right.size() ? right.get(i) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute migration checksum", e);
        }
    }

    private record Migration(
            String version,
            List<Integer> versionParts,
            String description,
            String fileName,
            String sql,
            String checksum) {
    }
}
