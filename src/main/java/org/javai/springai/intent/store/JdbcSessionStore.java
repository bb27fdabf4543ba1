package org.javai.springai.intent.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.javai.springai.intent.IntentCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * {@link SessionStore} backed by a relational database through Spring's {@link JdbcTemplate}.
 *
 * <p>Two tables hold the data: {@code sessions} (the registry, including the last
 * assigned sequence number) and {@code turns} (keyed by session id and sequence).
 * Each append runs in one transaction, so a failed append leaves nothing behind.
 * Retention eviction runs in a second transaction after the append commits; if it
 * fails the next append catches up, because eviction deletes everything at or below
 * a sequence bound.</p>
 *
 * <p>Appends, clears and deletes for one session are serialized by a per-session
 * {@link ReentrantLock}. Sessions never share a Java lock; the only contention
 * between them is the database's own write lock.</p>
 *
 * <pre>{@code
 * SessionStore store = JdbcSessionStore.sqlite(Path.of("data/conversations.db"), RetentionPolicy.defaults());
 * long seq = store.append("session-1", Turn.human("Hello there!"));
 * }</pre>
 */
public class JdbcSessionStore implements SessionStore {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSessionStore.class);
	private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

	/** SQLite primary result codes for a busy or locked database. */
	private static final int SQLITE_BUSY = 5;
	private static final int SQLITE_LOCKED = 6;

	public static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5_000;

	private static final String SELECT_TURN_COLUMNS =
			"SELECT sequence, role, content, intent, confidence, metadata, created_at FROM turns ";

	private static final String SELECT_SESSION_COLUMNS = """
			SELECT s.id, s.created_at, s.last_activity_at, s.retention_limit,
			       (SELECT COUNT(*) FROM turns t WHERE t.session_id = s.id) AS turn_count
			FROM sessions s
			""";

	private final JdbcTemplate jdbc;
	private final TransactionTemplate transactions;
	private final RetentionPolicy retention;
	private final Clock clock;
	private final ObjectMapper mapper = new ObjectMapper();
	private final SessionLocks sessionLocks = new SessionLocks();
	private final RowMapper<Turn> turnMapper = this::mapTurn;

	public JdbcSessionStore(DataSource dataSource, RetentionPolicy retention) {
		this(dataSource, retention, Clock.systemUTC());
	}

	public JdbcSessionStore(DataSource dataSource, RetentionPolicy retention, Clock clock) {
		Objects.requireNonNull(dataSource, "dataSource must not be null");
		this.retention = Objects.requireNonNull(retention, "retention must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.jdbc = new JdbcTemplate(dataSource);
		this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
		initializeSchema();
	}

	/**
	 * Opens (or creates) a SQLite database file in WAL mode.
	 */
	public static JdbcSessionStore sqlite(Path databaseFile, RetentionPolicy retention) {
		return sqlite(databaseFile, retention, Clock.systemUTC());
	}

	public static JdbcSessionStore sqlite(Path databaseFile, RetentionPolicy retention, Clock clock) {
		return new JdbcSessionStore(sqliteDataSource(databaseFile, DEFAULT_BUSY_TIMEOUT_MILLIS), retention, clock);
	}

	/**
	 * Builds a SQLite data source with WAL journaling and a busy timeout, creating
	 * parent directories as needed.
	 */
	public static DataSource sqliteDataSource(Path databaseFile, int busyTimeoutMillis) {
		Objects.requireNonNull(databaseFile, "databaseFile must not be null");
		Path parent = databaseFile.toAbsolutePath().getParent();
		if (parent != null) {
			try {
				Files.createDirectories(parent);
			}
			catch (IOException e) {
				throw new StorageException("Cannot create database directory " + parent, "open", null, false, e);
			}
		}
		SQLiteConfig config = new SQLiteConfig();
		config.setJournalMode(SQLiteConfig.JournalMode.WAL);
		config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
		config.setBusyTimeout(busyTimeoutMillis);
		SQLiteDataSource dataSource = new SQLiteDataSource(config);
		dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
		return dataSource;
	}

	private void initializeSchema() {
		run("initialize", null, () -> {
			jdbc.execute("""
					CREATE TABLE IF NOT EXISTS sessions (
					    id TEXT PRIMARY KEY,
					    created_at INTEGER NOT NULL,
					    last_activity_at INTEGER NOT NULL,
					    retention_limit INTEGER NOT NULL,
					    last_sequence INTEGER NOT NULL DEFAULT 0
					)
					""");
			jdbc.execute("""
					CREATE TABLE IF NOT EXISTS turns (
					    session_id TEXT NOT NULL,
					    sequence INTEGER NOT NULL,
					    role TEXT NOT NULL,
					    content TEXT NOT NULL,
					    intent TEXT,
					    confidence REAL,
					    metadata TEXT NOT NULL DEFAULT '{}',
					    created_at INTEGER NOT NULL,
					    PRIMARY KEY (session_id, sequence)
					)
					""");
			jdbc.execute("CREATE INDEX IF NOT EXISTS idx_sessions_activity ON sessions (last_activity_at)");
			return null;
		});
		logger.info("Session store schema ready (retention: {} turns per session)", retention.maxTurnsPerSession());
	}

	@Override
	public long append(String sessionId, Turn turn) {
		requireSessionId(sessionId);
		Objects.requireNonNull(turn, "turn must not be null");
		if (turn.isCommitted()) {
			throw new IllegalArgumentException("turn already carries sequence " + turn.sequence());
		}
		String metadataJson = writeMetadata(turn.metadata(), sessionId);

		ReentrantLock lock = sessionLocks.lock(sessionId);
		try {
			long now = clock.instant().toEpochMilli();
			Long assigned = run("append", sessionId, () -> transactions.execute(status -> {
				jdbc.update("""
						INSERT OR IGNORE INTO sessions (id, created_at, last_activity_at, retention_limit, last_sequence)
						VALUES (?, ?, ?, ?, 0)
						""", sessionId, now, now, retention.maxTurnsPerSession());
				Long last = jdbc.queryForObject(
						"SELECT last_sequence FROM sessions WHERE id = ?", Long.class, sessionId);
				long next = (last != null ? last : 0L) + 1;
				jdbc.update("""
						INSERT INTO turns (session_id, sequence, role, content, intent, confidence, metadata, created_at)
						VALUES (?, ?, ?, ?, ?, ?, ?, ?)
						""",
						sessionId,
						next,
						turn.role().name(),
						turn.content(),
						turn.intent() != null ? turn.intent().wireName() : null,
						turn.confidence(),
						metadataJson,
						now);
				jdbc.update("""
						UPDATE sessions SET last_sequence = ?, last_activity_at = ?, retention_limit = ?
						WHERE id = ?
						""", next, now, retention.maxTurnsPerSession(), sessionId);
				return next;
			}));
			if (assigned == null) {
				throw new StorageException("Append produced no sequence number", "append", sessionId, false, null);
			}
			logger.debug("Appended {} turn #{} to session {}", turn.role(), assigned, sessionId);
			evict(sessionId, assigned);
			return assigned;
		}
		finally {
			sessionLocks.unlock(sessionId, lock);
		}
	}

	private void evict(String sessionId, long latestSequence) {
		long bound = retention.evictUpTo(latestSequence);
		if (bound <= 0) {
			return;
		}
		try {
			Integer removed = transactions.execute(status ->
					jdbc.update("DELETE FROM turns WHERE session_id = ? AND sequence <= ?", sessionId, bound));
			if (removed != null && removed > 0) {
				logger.debug("Evicted {} turn(s) up to #{} from session {}", removed, bound, sessionId);
			}
		}
		catch (DataAccessException | TransactionException e) {
			logger.warn("Retention eviction failed for session {}; it will be retried on the next append",
					sessionId, e);
		}
	}

	@Override
	public List<Turn> readRecent(String sessionId, int limit) {
		requireSessionId(sessionId);
		if (limit <= 0) {
			return List.of();
		}
		List<Turn> newestFirst = run("readRecent", sessionId, () -> jdbc.query(
				SELECT_TURN_COLUMNS + "WHERE session_id = ? ORDER BY sequence DESC LIMIT ?",
				turnMapper, sessionId, limit));
		List<Turn> oldestFirst = new ArrayList<>(newestFirst);
		Collections.reverse(oldestFirst);
		return List.copyOf(oldestFirst);
	}

	@Override
	public List<Turn> history(String sessionId) {
		requireSessionId(sessionId);
		return List.copyOf(run("history", sessionId, () -> jdbc.query(
				SELECT_TURN_COLUMNS + "WHERE session_id = ? ORDER BY sequence ASC", turnMapper, sessionId)));
	}

	@Override
	public List<SessionInfo> listSessions() {
		return List.copyOf(run("listSessions", null, () -> jdbc.query(
				SELECT_SESSION_COLUMNS + "ORDER BY s.last_activity_at DESC, s.id ASC", this::mapSession)));
	}

	@Override
	public Optional<SessionInfo> findSession(String sessionId) {
		requireSessionId(sessionId);
		List<SessionInfo> found = run("findSession", sessionId, () -> jdbc.query(
				SELECT_SESSION_COLUMNS + "WHERE s.id = ?", this::mapSession, sessionId));
		return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
	}

	@Override
	public void deleteSession(String sessionId) {
		requireSessionId(sessionId);
		ReentrantLock lock = sessionLocks.lock(sessionId);
		try {
			Integer removed = run("deleteSession", sessionId, () -> transactions.execute(status -> {
				jdbc.update("DELETE FROM turns WHERE session_id = ?", sessionId);
				return jdbc.update("DELETE FROM sessions WHERE id = ?", sessionId);
			}));
			if (removed != null && removed > 0) {
				logger.info("Deleted session {}", sessionId);
			}
			else {
				logger.debug("Delete requested for unknown session {}", sessionId);
			}
		}
		finally {
			sessionLocks.unlock(sessionId, lock);
		}
	}

	@Override
	public void clearSession(String sessionId) {
		requireSessionId(sessionId);
		ReentrantLock lock = sessionLocks.lock(sessionId);
		try {
			long now = clock.instant().toEpochMilli();
			Integer cleared = run("clearSession", sessionId, () -> transactions.execute(status -> {
				int removed = jdbc.update("DELETE FROM turns WHERE session_id = ?", sessionId);
				jdbc.update("UPDATE sessions SET last_activity_at = ? WHERE id = ?", now, sessionId);
				return removed;
			}));
			logger.info("Cleared {} turn(s) from session {}", cleared != null ? cleared : 0, sessionId);
		}
		finally {
			sessionLocks.unlock(sessionId, lock);
		}
	}

	@Override
	public StoreSummary summary() {
		return run("summary", null, () -> {
			Map<String, Object> sessions = jdbc.queryForMap(
					"SELECT COUNT(*) AS total, MAX(last_activity_at) AS recent FROM sessions");
			Map<String, Object> turns = jdbc.queryForMap("""
					SELECT COUNT(*) AS total,
					       COALESCE(SUM(CASE WHEN role = 'HUMAN' THEN 1 ELSE 0 END), 0) AS human,
					       COALESCE(SUM(CASE WHEN role = 'ASSISTANT' THEN 1 ELSE 0 END), 0) AS assistant
					FROM turns
					""");
			List<String> mostActive = jdbc.queryForList("""
					SELECT session_id FROM turns GROUP BY session_id
					ORDER BY COUNT(*) DESC, session_id ASC LIMIT 1
					""", String.class);
			Number recent = (Number) sessions.get("recent");
			return new StoreSummary(
					intValue(sessions.get("total")),
					intValue(turns.get("total")),
					intValue(turns.get("human")),
					intValue(turns.get("assistant")),
					mostActive.isEmpty() ? null : mostActive.get(0),
					recent != null ? Instant.ofEpochMilli(recent.longValue()) : null);
		});
	}

	private Turn mapTurn(ResultSet rs, int rowNum) throws SQLException {
		String intentName = rs.getString("intent");
		IntentCategory intent = intentName != null ? IntentCategory.fromWireName(intentName) : null;
		if (intent == IntentCategory.UNKNOWN) {
			throw new SQLException("Stored turn carries unknown intent '" + intentName + "'");
		}
		double confidenceValue = rs.getDouble("confidence");
		Double confidence = rs.wasNull() ? null : confidenceValue;
		return new Turn(
				rs.getLong("sequence"),
				Role.valueOf(rs.getString("role")),
				rs.getString("content"),
				intent,
				confidence,
				readMetadata(rs.getString("metadata")),
				Instant.ofEpochMilli(rs.getLong("created_at")));
	}

	private SessionInfo mapSession(ResultSet rs, int rowNum) throws SQLException {
		return new SessionInfo(
				rs.getString("id"),
				Instant.ofEpochMilli(rs.getLong("created_at")),
				Instant.ofEpochMilli(rs.getLong("last_activity_at")),
				rs.getInt("retention_limit"),
				rs.getInt("turn_count"));
	}

	private String writeMetadata(Map<String, Object> metadata, String sessionId) {
		try {
			return mapper.writeValueAsString(metadata);
		}
		catch (JsonProcessingException e) {
			throw new StorageException("Turn metadata cannot be serialized", "append", sessionId, false, e);
		}
	}

	private Map<String, Object> readMetadata(String json) throws SQLException {
		if (json == null || json.isBlank()) {
			return Map.of();
		}
		try {
			return mapper.readValue(json, METADATA_TYPE);
		}
		catch (JsonProcessingException e) {
			throw new SQLException("Stored turn metadata is corrupt", e);
		}
	}

	private <T> T run(String operation, String sessionId, Supplier<T> work) {
		try {
			return work.get();
		}
		catch (DataAccessException e) {
			throw new StorageException("Storage operation '" + operation + "' failed: " + e.getMostSpecificCause().getMessage(),
					operation, sessionId, isTransient(e), e);
		}
		catch (TransactionException e) {
			throw new StorageException("Storage operation '" + operation + "' failed to open a transaction",
					operation, sessionId, false, e);
		}
	}

	static boolean isTransient(DataAccessException e) {
		if (e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException) {
			return true;
		}
		if (e.getMostSpecificCause() instanceof SQLException sql) {
			int primaryCode = sql.getErrorCode() & 0xFF;
			return primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED;
		}
		return false;
	}

	int lockedSessionCount() {
		return sessionLocks.size();
	}

	private static void requireSessionId(String sessionId) {
		SessionIds.requireValid(sessionId);
	}

	private static int intValue(Object value) {
		return value instanceof Number number ? number.intValue() : 0;
	}
}
