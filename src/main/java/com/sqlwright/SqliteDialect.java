/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.sqlwright;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQLite support via the <a href="https://github.com/xerial/sqlite-jdbc">xerial sqlite-jdbc</a> driver.
 * <p>
 * Databases are either a file (whose parent directories are created on first connection) or in-memory. A private
 * in-memory database lives exactly as long as its {@link Database}'s connection; a shared one is visible to every
 * connection in the process until the last one closes.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class SqliteDialect implements Dialect {
	@NonNull
	static final String JDBC_URL_PREFIX = "jdbc:sqlite:";
	@NonNull
	private static final String TABLE_EXISTS_QUERY = "SELECT count(name) AS table_count FROM sqlite_master WHERE type = 'table' AND name = ?";
	@NonNull
	private static final String TABLE_LIST_QUERY = "SELECT name FROM sqlite_master WHERE type = 'table'";
	// last_insert_rowid() is 0 until this connection inserts a row
	@NonNull
	private static final String LAST_INSERT_ID_QUERY = "SELECT NULLIF(last_insert_rowid(), 0)";

	@NonNull
	private final Logger logger;

	public SqliteDialect() {
		this.logger = Logger.getLogger(getClass().getName());
	}

	@NonNull
	@Override
	public DatabaseType getDatabaseType() {
		return DatabaseType.SQLITE;
	}

	@NonNull
	@Override
	public Connection openConnection(@NonNull DatabaseConfiguration configuration) throws SQLException {
		requireNonNull(configuration);

		Path path = configuration.getSqlitePath().orElse(null);

		if (path != null) {
			Path parent = path.getParent();

			if (parent != null && !Files.isDirectory(parent)) {
				getLogger().fine(format("Database directory %s doesn't exist, creating it", parent));

				try {
					Files.createDirectories(parent);
				} catch (IOException e) {
					throw new ConnectionException(format("Unable to create database directory %s", parent), e);
				}
			}
		}

		Properties properties = new Properties();
		Duration busyTimeout = configuration.getBusyTimeout().orElse(null);

		// sqlite-jdbc applies this as PRAGMA busy_timeout when the connection opens
		if (busyTimeout != null)
			properties.setProperty("busy_timeout", String.valueOf(busyTimeout.toMillis()));

		return DriverManager.getConnection(jdbcUrl(configuration), properties);
	}

	@NonNull
	String jdbcUrl(@NonNull DatabaseConfiguration configuration) {
		requireNonNull(configuration);

		if (configuration.isSqliteInMemory())
			return configuration.isSqliteSharedMemory() ? JDBC_URL_PREFIX + "file::memory:?cache=shared" : JDBC_URL_PREFIX + ":memory:";

		Path path = configuration.getSqlitePath().orElseThrow(() ->
				new IllegalStateException("SQLite configuration has neither a database path nor in-memory mode"));

		return JDBC_URL_PREFIX + path;
	}

	@NonNull
	@Override
	public Optional<String> getTableExistsQuery() {
		return Optional.of(TABLE_EXISTS_QUERY);
	}

	@NonNull
	@Override
	public List<Object> tableExistsParameters(@NonNull String schemaName,
																						@NonNull String tableName) {
		requireNonNull(tableName);
		return List.of(tableName);
	}

	@NonNull
	@Override
	public Optional<String> getTableListQuery() {
		return Optional.of(TABLE_LIST_QUERY);
	}

	@NonNull
	@Override
	public List<Object> tableListParameters(@NonNull String schemaName) {
		return List.of();
	}

	@NonNull
	@Override
	public String isoDateProjection(@NonNull String column) {
		requireNonNull(column);
		return format("strftime('%%Y-%%m-%%dT%%H:%%M:%%SZ', %s) AS %s", column, aliasFor(column));
	}

	@NonNull
	@Override
	public Optional<String> getLastInsertIdQuery() {
		return Optional.of(LAST_INSERT_ID_QUERY);
	}

	@NonNull
	private static String aliasFor(@NonNull String column) {
		// "u.created_at" is aliased as "created_at"
		return column.substring(column.lastIndexOf('.') + 1);
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
