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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Capabilities that differ between database backends.
 * <p>
 * A {@link Database} picks its dialect when it is constructed: explicitly via
 * {@link DatabaseConfiguration.Builder#dialect(Dialect)}, implicitly from the {@code forSqlite}/{@code forPostgres}
 * configuration builders, or by inspecting the first connection of a plain {@link javax.sql.DataSource}.
 * <p>
 * Metadata queries are parameterized with the dialect's placeholder. Parameters for them are supplied by
 * {@link #tableExistsParameters(String, String)} and {@link #tableListParameters(String)}, so configuration-supplied
 * query overrides must accept the same parameters.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface Dialect {
	@NonNull
	DatabaseType getDatabaseType();

	/**
	 * Opens a connection described by the given {@code configuration}.
	 * <p>
	 * Not used for configurations built from a {@link javax.sql.DataSource}.
	 *
	 * @param configuration the configuration that describes where the database lives
	 * @return an open connection
	 * @throws SQLException if the driver cannot open the connection
	 */
	@NonNull
	Connection openConnection(@NonNull DatabaseConfiguration configuration) throws SQLException;

	/**
	 * Prepares a freshly opened connection, before auto-commit and isolation are applied.
	 *
	 * @param connection the connection to prepare
	 * @throws SQLException if the driver rejects the preparation
	 */
	default void initializeSession(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);
	}

	/**
	 * @return the bind-parameter marker this backend's driver expects
	 */
	@NonNull
	default String getPlaceholder() {
		return "?";
	}

	/**
	 * @return a query whose first column of its first row is non-zero (or {@code true}) if a table exists, or empty
	 * to fall back to JDBC {@link java.sql.DatabaseMetaData}
	 */
	@NonNull
	Optional<String> getTableExistsQuery();

	@NonNull
	List<Object> tableExistsParameters(@NonNull String schemaName,
																		 @NonNull String tableName);

	/**
	 * @return a query whose first column holds one table name per row, or empty to fall back to JDBC
	 * {@link java.sql.DatabaseMetaData}
	 */
	@NonNull
	Optional<String> getTableListQuery();

	@NonNull
	List<Object> tableListParameters(@NonNull String schemaName);

	/**
	 * @return SQL prepended to every statement a {@link QueryBuilder} assembles; empty by default
	 */
	@NonNull
	default String getPreQuery() {
		return "";
	}

	/**
	 * @return SQL appended to every statement a {@link QueryBuilder} assembles; empty by default
	 */
	@NonNull
	default String getPostQuery() {
		return "";
	}

	/**
	 * Whether {@link QueryBuilder#streaming(int)} produces a server-side cursor that reads rows in batches.
	 * Backends that return {@code false} still honor the fetch size as a driver hint.
	 */
	default boolean supportsStreamingCursors() {
		return false;
	}

	/**
	 * Whether a streaming cursor must run inside a transaction (i.e. with auto-commit off) to actually stream.
	 */
	default boolean streamingRequiresTransaction() {
		return false;
	}

	/**
	 * Produces a projection that renders {@code column} as an ISO-8601 UTC date-time string, aliased back to the
	 * column name.
	 *
	 * @param column the date or timestamp column
	 * @return a select-list expression
	 * @throws UnsupportedOperationException if this backend has no such formatting function
	 */
	@NonNull
	String isoDateProjection(@NonNull String column);

	/**
	 * @return a query returning the last generated key of a table as its single column, or empty if unsupported
	 */
	@NonNull
	default Optional<String> getLastInsertIdQuery() {
		return Optional.empty();
	}

	@NonNull
	default List<Object> lastInsertIdParameters(@NonNull String tableName,
																							@NonNull String primaryKeyColumn) {
		requireNonNull(tableName);
		requireNonNull(primaryKeyColumn);
		return List.of();
	}

	/**
	 * Provides the dialect for the given type of database.
	 *
	 * @param databaseType the type of database
	 * @return the matching dialect
	 */
	@NonNull
	static Dialect forDatabaseType(@NonNull DatabaseType databaseType) {
		requireNonNull(databaseType);

		switch (databaseType) {
			case SQLITE:
				return new SqliteDialect();
			case POSTGRESQL:
				return new PostgresDialect();
			default:
				return new GenericDialect();
		}
	}

	/**
	 * Validates a table or column name that is interpolated, unquoted, into generated SQL.
	 *
	 * @param identifier a table or column name
	 * @return the identifier, unchanged
	 * @throws IllegalArgumentException if the identifier contains characters outside {@code [A-Za-z0-9_.$"]}
	 */
	@NonNull
	static String checkIdentifier(@Nullable String identifier) {
		if (identifier == null || identifier.isEmpty() || !identifier.matches("[A-Za-z0-9_.$\"]+"))
			throw new IllegalArgumentException(String.format("Illegal identifier '%s'", identifier));

		return identifier;
	}
}
