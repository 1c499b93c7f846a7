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
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * PostgreSQL support via the <a href="https://jdbc.postgresql.org">PostgreSQL JDBC driver</a>.
 * <p>
 * Sessions run in UTC. Table metadata is read from {@code information_schema.tables}, filtered to the configured
 * schema name ({@code public} unless overridden).
 * <p>
 * The driver only streams rows with a positive fetch size while auto-commit is off, so streaming cursors run
 * inside a transaction.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class PostgresDialect implements Dialect {
	@NonNull
	private static final String TABLE_EXISTS_QUERY = "SELECT count(table_name) AS table_count FROM information_schema.tables "
			+ "WHERE table_schema = ? AND table_name = ?";
	@NonNull
	private static final String TABLE_LIST_QUERY = "SELECT table_name AS name FROM information_schema.tables "
			+ "WHERE table_schema = ? AND table_type = 'BASE TABLE'";
	@NonNull
	private static final String LAST_INSERT_ID_QUERY = "SELECT currval(pg_get_serial_sequence(?, ?))";

	@NonNull
	@Override
	public DatabaseType getDatabaseType() {
		return DatabaseType.POSTGRESQL;
	}

	@NonNull
	@Override
	public Connection openConnection(@NonNull DatabaseConfiguration configuration) throws SQLException {
		requireNonNull(configuration);

		Properties properties = new Properties();
		configuration.getUser().ifPresent(user -> properties.setProperty("user", user));
		configuration.getPassword().ifPresent(password -> properties.setProperty("password", password));

		return DriverManager.getConnection(jdbcUrl(configuration), properties);
	}

	@NonNull
	String jdbcUrl(@NonNull DatabaseConfiguration configuration) {
		requireNonNull(configuration);

		String databaseName = configuration.getDatabaseName().orElseThrow(() ->
				new IllegalStateException("PostgreSQL configuration has no database name"));

		return format("jdbc:postgresql://%s:%d/%s", configuration.getHost(), configuration.getPort(), databaseName);
	}

	@Override
	public void initializeSession(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		try (java.sql.Statement statement = connection.createStatement()) {
			statement.execute("SET TIME ZONE 'UTC'");
		}
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
		requireNonNull(schemaName);
		requireNonNull(tableName);

		return List.of(schemaName, tableName);
	}

	@NonNull
	@Override
	public Optional<String> getTableListQuery() {
		return Optional.of(TABLE_LIST_QUERY);
	}

	@NonNull
	@Override
	public List<Object> tableListParameters(@NonNull String schemaName) {
		requireNonNull(schemaName);
		return List.of(schemaName);
	}

	@Override
	public boolean supportsStreamingCursors() {
		return true;
	}

	@Override
	public boolean streamingRequiresTransaction() {
		return true;
	}

	@NonNull
	@Override
	public String isoDateProjection(@NonNull String column) {
		requireNonNull(column);
		return format("to_char(%s, 'YYYY-MM-DD\"T\"HH24:MI:SS\"Z\"') AS %s", column, column.substring(column.lastIndexOf('.') + 1));
	}

	@NonNull
	@Override
	public Optional<String> getLastInsertIdQuery() {
		return Optional.of(LAST_INSERT_ID_QUERY);
	}

	@NonNull
	@Override
	public List<Object> lastInsertIdParameters(@NonNull String tableName,
																						 @NonNull String primaryKeyColumn) {
		requireNonNull(tableName);
		requireNonNull(primaryKeyColumn);

		return List.of(tableName, primaryKeyColumn);
	}
}
