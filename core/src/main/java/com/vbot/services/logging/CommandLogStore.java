package com.vbot.services.logging;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Instant;
import java.util.List;

/**
 * CommandLogStore - H2 backed history of every command the pipeline handled.
 */
public class CommandLogStore {
    private static final Logger logger = LoggerFactory.getLogger(CommandLogStore.class);

    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";
    public static final String DENIED = "DENIED";

    private final Jdbi jdbi;

    public record Entry(long userId, String command, String outcome, long elapsedMs, String error, Instant createdAt) {
    }

    public CommandLogStore(String jdbcUrl) {
        this.jdbi = Jdbi.create(jdbcUrl);
        initializeSchema();
    }

    /**
     * File database at the given location, e.g. tools/command_log.
     */
    public static CommandLogStore file(File dbFile) {
        String url = "jdbc:h2:" + dbFile.getAbsolutePath() +
                ";MODE=MySQL" + // MySQL compatibility mode
                ";CACHE_SIZE=8192" +
                ";DATABASE_TO_UPPER=FALSE";
        return new CommandLogStore(url);
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS command_log (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            user_id BIGINT NOT NULL,
                            chat_id BIGINT,
                            command VARCHAR(4096) NOT NULL,
                            outcome VARCHAR(16) NOT NULL,
                            elapsed_ms BIGINT DEFAULT 0,
                            error_message TEXT,
                            created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        )
                    """);
            handle.execute("CREATE INDEX IF NOT EXISTS idx_command_log_outcome ON command_log(outcome)");
            handle.execute("CREATE INDEX IF NOT EXISTS idx_command_log_created ON command_log(created_at)");
        });
        logger.info("🗄️ Command log initialized");
    }

    public void insert(long userId, Long chatId, String command, String outcome, long elapsedMs, String error) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                    INSERT INTO command_log (user_id, chat_id, command, outcome, elapsed_ms, error_message)
                    VALUES (:userId, :chatId, :command, :outcome, :elapsedMs, :error)
                """)
                .bind("userId", userId)
                .bind("chatId", chatId)
                .bind("command", command)
                .bind("outcome", outcome)
                .bind("elapsedMs", elapsedMs)
                .bind("error", error)
                .execute());
    }

    public long countByOutcome(String outcome) {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT COUNT(*) FROM command_log WHERE outcome = :outcome")
                .bind("outcome", outcome)
                .mapTo(Long.class)
                .one());
    }

    public long count() {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT COUNT(*) FROM command_log")
                .mapTo(Long.class)
                .one());
    }

    public List<Entry> recent(int limit) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                    SELECT user_id, command, outcome, elapsed_ms, error_message, created_at
                    FROM command_log ORDER BY id DESC LIMIT :limit
                """)
                .bind("limit", limit)
                .map((rs, ctx) -> new Entry(
                        rs.getLong("user_id"),
                        rs.getString("command"),
                        rs.getString("outcome"),
                        rs.getLong("elapsed_ms"),
                        rs.getString("error_message"),
                        rs.getTimestamp("created_at").toInstant()))
                .list());
    }
}
