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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable description of a database and how a {@link Database} should talk to it.
 * <p>
 * Start from one of the static builder methods:
 * <pre>{@code
 * DatabaseConfiguration configuration = DatabaseConfiguration.forSqlite("app.db")
 *   .schema("users", "CREATE TABLE users (id INTEGER PRIMARY KEY AUTOINCREMENT, first_name TEXT, last_name TEXT)")
 *   .build();
 *
 * DatabaseConfiguration postgres = DatabaseConfiguration.forPostgres("app")
 *   .host("db.internal")
 *   .user("app")
 *   .password(System.getenv("APP_DB_PASSWORD"))
 *   .build();
 * }</pre>
 * Defaults are resolved once, when {@link Builder#build()} is called.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DatabaseConfiguration {
	/**
	 * Relative SQLite paths are resolved against this directory.
	 */
	@NonNull
	public static final Path DEFAULT_SQLITE_DIRECTORY = Paths.get(System.getProperty("user.home"), ".sqlwright");
	@NonNull
	public static final String DEFAULT_SQLITE_FILE_NAME = "sqlwright.db";
	@NonNull
	public static final String SQLITE_MEMORY_DATABASE = ":memory:";
	@NonNull
	public static final Duration DEFAULT_SQLITE_BUSY_TIMEOUT = Duration.ofSeconds(30);
	@NonNull
	public static final String DEFAULT_HOST = "localhost";
	public static final int DEFAULT_POSTGRES_PORT = 5432;
	@NonNull
	public static final String DEFAULT_POSTGRES_USER = "root";
	@NonNull
	public static final String DEFAULT_SCHEMA_NAME = "public";
	public static final int DEFAULT_EXECUTION_LOG_CAPACITY = 1_000;

	@Nullable
	private final DataSource dataSource;
	@Nullable
	private final Dialect dialect;
	@Nullable
	private final Path sqlitePath;
	private final boolean sqliteInMemory;
	private final boolean sqliteSharedMemory;
	@Nullable
	private final String databaseName;
	@NonNull
	private final String host;
	private final int port;
	@Nullable
	private final String user;
	@Nullable
	private final String password;
	private final boolean autoCommit;
	@NonNull
	private final TransactionIsolation transactionIsolation;
	@Nullable
	private final Duration busyTimeout;
	@NonNull
	private final String schemaName;
	@NonNull
	private final List<TableSchema> schemas;
	private final boolean autoCreateSchemas;
	private final boolean executionLogEnabled;
	private final int executionLogCapacity;
	@Nullable
	private final String tableListQuery;
	@Nullable
	private final String tableExistsQuery;

	private DatabaseConfiguration(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.port < 1 || builder.port > 65_535)
			throw new IllegalArgumentException(format("Illegal port %d", builder.port));

		if (builder.executionLogCapacity < 1)
			throw new IllegalArgumentException(format("Execution log capacity must be positive, was %d", builder.executionLogCapacity));

		if (builder.busyTimeout != null && builder.busyTimeout.isNegative())
			throw new IllegalArgumentException("Busy timeout must not be negative");

		Set<String> tableNames = new HashSet<>();

		for (TableSchema schema : builder.schemas)
			if (!tableNames.add(schema.getTableName()))
				throw new IllegalArgumentException(format("Table '%s' is declared more than once", schema.getTableName()));

		this.dataSource = builder.dataSource;
		this.sqliteSharedMemory = builder.kind == Kind.SQLITE && builder.sqliteSharedMemory;
		this.sqliteInMemory = this.sqliteSharedMemory || (builder.kind == Kind.SQLITE && SQLITE_MEMORY_DATABASE.equals(builder.sqliteDatabase));
		this.sqlitePath = builder.kind == Kind.SQLITE && !this.sqliteInMemory ? resolveSqlitePath(builder.sqliteDatabase) : null;
		this.databaseName = builder.databaseName;
		this.host = builder.host == null ? DEFAULT_HOST : builder.host;
		this.port = builder.port;
		this.user = builder.user == null && builder.kind == Kind.POSTGRES ? DEFAULT_POSTGRES_USER : builder.user;
		this.password = builder.password;
		this.autoCommit = builder.autoCommit;
		this.transactionIsolation = builder.transactionIsolation == null ? TransactionIsolation.DEFAULT : builder.transactionIsolation;
		this.busyTimeout = builder.busyTimeout == null && builder.kind == Kind.SQLITE ? DEFAULT_SQLITE_BUSY_TIMEOUT : builder.busyTimeout;
		this.schemaName = builder.schemaName == null ? DEFAULT_SCHEMA_NAME : builder.schemaName;
		this.schemas = Collections.unmodifiableList(new ArrayList<>(builder.schemas));
		this.autoCreateSchemas = builder.autoCreateSchemas;
		this.executionLogEnabled = builder.executionLogEnabled;
		this.executionLogCapacity = builder.executionLogCapacity;
		this.tableListQuery = builder.tableListQuery;
		this.tableExistsQuery = builder.tableExistsQuery;

		if (builder.dialect != null)
			this.dialect = builder.dialect;
		else if (builder.kind == Kind.SQLITE)
			this.dialect = new SqliteDialect();
		else if (builder.kind == Kind.POSTGRES)
			this.dialect = new PostgresDialect();
		else
			this.dialect = null;
	}

	/**
	 * Configures a SQLite database file.
	 * <p>
	 * Relative paths are resolved against {@link #DEFAULT_SQLITE_DIRECTORY}; a blank path means
	 * {@link #DEFAULT_SQLITE_FILE_NAME}; {@value #SQLITE_MEMORY_DATABASE} means a private in-memory database.
	 *
	 * @param database the database file path
	 * @return a configuration builder
	 */
	@NonNull
	public static Builder forSqlite(@Nullable String database) {
		Builder builder = new Builder(Kind.SQLITE);
		builder.sqliteDatabase = database == null || database.trim().isEmpty() ? DEFAULT_SQLITE_FILE_NAME : database.trim();
		return builder;
	}

	@NonNull
	public static Builder forSqlite(@NonNull Path database) {
		requireNonNull(database);
		return forSqlite(database.toString());
	}

	/**
	 * Configures a private in-memory SQLite database, discarded when its {@link Database} closes.
	 *
	 * @return a configuration builder
	 */
	@NonNull
	public static Builder forSqliteInMemory() {
		return forSqlite(SQLITE_MEMORY_DATABASE);
	}

	@NonNull
	public static Builder forPostgres(@NonNull String databaseName) {
		requireNonNull(databaseName);

		if (databaseName.trim().isEmpty())
			throw new IllegalArgumentException("Database name must not be blank");

		Builder builder = new Builder(Kind.POSTGRES);
		builder.databaseName = databaseName.trim();
		builder.port = DEFAULT_POSTGRES_PORT;
		return builder;
	}

	/**
	 * Configures a database reached through an existing {@link DataSource}.
	 * <p>
	 * Unless a {@link Builder#dialect(Dialect)} is given, the dialect is detected from the first connection.
	 *
	 * @param dataSource the data source to draw the connection from
	 * @return a configuration builder
	 */
	@NonNull
	public static Builder forDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		Builder builder = new Builder(Kind.DATA_SOURCE);
		builder.dataSource = dataSource;
		return builder;
	}

	@NonNull
	private static Path resolveSqlitePath(@NonNull String database) {
		requireNonNull(database);

		Path path = Paths.get(database);
		return path.isAbsolute() ? path : DEFAULT_SQLITE_DIRECTORY.resolve(path).toAbsolutePath();
	}

	@NonNull
	public Optional<DataSource> getDataSource() {
		return Optional.ofNullable(this.dataSource);
	}

	/**
	 * @return the configured or implied dialect, or empty if it is detected from the first connection
	 */
	@NonNull
	public Optional<Dialect> getDialect() {
		return Optional.ofNullable(this.dialect);
	}

	/**
	 * @return the absolute path of a file-based SQLite database
	 */
	@NonNull
	public Optional<Path> getSqlitePath() {
		return Optional.ofNullable(this.sqlitePath);
	}

	public boolean isSqliteInMemory() {
		return this.sqliteInMemory;
	}

	public boolean isSqliteSharedMemory() {
		return this.sqliteSharedMemory;
	}

	@NonNull
	public Optional<String> getDatabaseName() {
		return Optional.ofNullable(this.databaseName);
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	@NonNull
	public Optional<String> getUser() {
		return Optional.ofNullable(this.user);
	}

	@NonNull
	public Optional<String> getPassword() {
		return Optional.ofNullable(this.password);
	}

	public boolean isAutoCommit() {
		return this.autoCommit;
	}

	@NonNull
	public TransactionIsolation getTransactionIsolation() {
		return this.transactionIsolation;
	}

	@NonNull
	public Optional<Duration> getBusyTimeout() {
		return Optional.ofNullable(this.busyTimeout);
	}

	/**
	 * @return the schema (namespace) that table metadata queries are restricted to, where the backend has them
	 */
	@NonNull
	public String getSchemaName() {
		return this.schemaName;
	}

	/**
	 * @return declared tables, in creation order
	 */
	@NonNull
	public List<TableSchema> getSchemas() {
		return this.schemas;
	}

	public boolean isAutoCreateSchemas() {
		return this.autoCreateSchemas;
	}

	public boolean isExecutionLogEnabled() {
		return this.executionLogEnabled;
	}

	public int getExecutionLogCapacity() {
		return this.executionLogCapacity;
	}

	@NonNull
	public Optional<String> getTableListQuery() {
		return Optional.ofNullable(this.tableListQuery);
	}

	@NonNull
	public Optional<String> getTableExistsQuery() {
		return Optional.ofNullable(this.tableExistsQuery);
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(6);

		if (this.dialect != null)
			components.add(format("databaseType=%s", this.dialect.getDatabaseType().name()));

		if (this.sqliteInMemory)
			components.add(this.sqliteSharedMemory ? "sqlite=shared memory" : "sqlite=memory");
		else if (this.sqlitePath != null)
			components.add(format("sqlitePath=%s", this.sqlitePath));

		if (this.databaseName != null)
			components.add(format("databaseName=%s, host=%s, port=%d", this.databaseName, this.host, this.port));

		if (this.dataSource != null)
			components.add(format("dataSource=%s", this.dataSource));

		components.add(format("autoCommit=%s", this.autoCommit));
		components.add(format("schemas=%d", this.schemas.size()));

		// Never include the password
		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	private enum Kind {
		SQLITE,
		POSTGRES,
		DATA_SOURCE
	}

	/**
	 * Builder used to construct instances of {@link DatabaseConfiguration}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Kind kind;
		@NonNull
		private final List<TableSchema> schemas;
		@Nullable
		private DataSource dataSource;
		@Nullable
		private Dialect dialect;
		@Nullable
		private String sqliteDatabase;
		private boolean sqliteSharedMemory;
		@Nullable
		private String databaseName;
		@Nullable
		private String host;
		private int port;
		@Nullable
		private String user;
		@Nullable
		private String password;
		private boolean autoCommit;
		@Nullable
		private TransactionIsolation transactionIsolation;
		@Nullable
		private Duration busyTimeout;
		@Nullable
		private String schemaName;
		private boolean autoCreateSchemas;
		private boolean executionLogEnabled;
		private int executionLogCapacity;
		@Nullable
		private String tableListQuery;
		@Nullable
		private String tableExistsQuery;

		private Builder(@NonNull Kind kind) {
			this.kind = requireNonNull(kind);
			this.schemas = new ArrayList<>();
			this.port = DEFAULT_POSTGRES_PORT;
			this.autoCommit = true;
			this.autoCreateSchemas = true;
			this.executionLogEnabled = true;
			this.executionLogCapacity = DEFAULT_EXECUTION_LOG_CAPACITY;
		}

		/**
		 * Overrides the dialect implied by the builder method, or disables auto-detection for a {@link DataSource}.
		 *
		 * @param dialect the dialect to use (null for the default)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder dialect(@Nullable Dialect dialect) {
			this.dialect = dialect;
			return this;
		}

		/**
		 * Uses an in-memory SQLite database shared by every connection in this process, in place of the configured path.
		 *
		 * @param sharedMemory whether to use the shared in-memory database
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder sharedMemory(boolean sharedMemory) {
			if (this.kind != Kind.SQLITE)
				throw new IllegalStateException("Shared memory applies to SQLite databases only");

			this.sqliteSharedMemory = sharedMemory;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(int port) {
			this.port = port;
			return this;
		}

		@NonNull
		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		/**
		 * Defaults to {@code true}. With auto-commit off, call {@link Database#commit()} to persist changes.
		 *
		 * @param autoCommit whether each statement commits on its own
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder autoCommit(boolean autoCommit) {
			this.autoCommit = autoCommit;
			return this;
		}

		@NonNull
		public Builder transactionIsolation(@Nullable TransactionIsolation transactionIsolation) {
			this.transactionIsolation = transactionIsolation;
			return this;
		}

		/**
		 * How long SQLite waits for a lock before failing. Defaults to 30 seconds for SQLite; ignored elsewhere.
		 *
		 * @param busyTimeout the lock wait, or null for the default
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder busyTimeout(@Nullable Duration busyTimeout) {
			this.busyTimeout = busyTimeout;
			return this;
		}

		@NonNull
		public Builder schemaName(@Nullable String schemaName) {
			this.schemaName = schemaName;
			return this;
		}

		/**
		 * Declares a table and the statement that creates it. Tables are created in declaration order.
		 *
		 * @param tableName       the table name
		 * @param createStatement the statement that creates the table
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder schema(@NonNull String tableName,
													@NonNull String createStatement) {
			this.schemas.add(TableSchema.of(tableName, createStatement));
			return this;
		}

		@NonNull
		public Builder schemas(@NonNull List<TableSchema> schemas) {
			requireNonNull(schemas);

			this.schemas.clear();
			this.schemas.addAll(schemas);
			return this;
		}

		/**
		 * Whether to create missing declared tables when the {@link Database} is built. Defaults to {@code true}.
		 *
		 * @param autoCreateSchemas whether to create missing tables up front
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder autoCreateSchemas(boolean autoCreateSchemas) {
			this.autoCreateSchemas = autoCreateSchemas;
			return this;
		}

		@NonNull
		public Builder executionLogEnabled(boolean executionLogEnabled) {
			this.executionLogEnabled = executionLogEnabled;
			return this;
		}

		@NonNull
		public Builder executionLogCapacity(int executionLogCapacity) {
			this.executionLogCapacity = executionLogCapacity;
			return this;
		}

		/**
		 * Replaces the dialect's table-list query. It receives the same parameters as the dialect's own query.
		 *
		 * @param tableListQuery the query, or null for the dialect's
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder tableListQuery(@Nullable String tableListQuery) {
			this.tableListQuery = tableListQuery;
			return this;
		}

		/**
		 * Replaces the dialect's table-exists query. It receives the same parameters as the dialect's own query.
		 *
		 * @param tableExistsQuery the query, or null for the dialect's
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder tableExistsQuery(@Nullable String tableExistsQuery) {
			this.tableExistsQuery = tableExistsQuery;
			return this;
		}

		@NonNull
		public DatabaseConfiguration build() {
			return new DatabaseConfiguration(this);
		}
	}
}
