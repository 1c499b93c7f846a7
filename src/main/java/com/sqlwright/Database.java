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
import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.Temporal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Main class for performing database access operations.
 * <p>
 * A {@code Database} owns a single JDBC {@link Connection}, opened on first use and released by {@link #close()}:
 * <pre>{@code
 * try (Database database = Database.withConfiguration(DatabaseConfiguration.forSqlite("app.db")
 *     .schema("users", "CREATE TABLE users (id INTEGER PRIMARY KEY AUTOINCREMENT, first_name TEXT, last_name TEXT)")
 *     .build()).build()) {
 *   database.action("INSERT INTO users (first_name, last_name) VALUES (?, ?)", "John", "Doe");
 *   Optional<Row> user = database.fetchOne("SELECT * FROM users WHERE first_name = ?", "John");
 *   List<Row> does = database.builder("users").where("last_name", "Doe").all();
 * }
 * }</pre>
 * Instances are not threadsafe; share one between threads through {@link AsyncDatabase}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class Database implements AutoCloseable {
	@NonNull
	private final DatabaseConfiguration configuration;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;
	@NonNull
	private final AtomicLong statementIdGenerator;
	@NonNull
	private final Deque<StatementLog> executionLog;
	@NonNull
	private final Set<String> tablesCreated;
	@Nullable
	private Dialect dialect;
	@Nullable
	private Connection connection;
	@Nullable
	private Duration pendingConnectionAcquisitionDuration;
	@NonNull
	private DatabaseOperationSupportStatus executeLargeUpdateSupported;
	private boolean closed;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.configuration = requireNonNull(builder.configuration);
		this.statementLogger = builder.statementLogger == null ? new DefaultStatementLogger() : builder.statementLogger;
		this.logger = Logger.getLogger(getClass().getName());
		this.statementIdGenerator = new AtomicLong();
		this.executionLog = new ArrayDeque<>();
		this.tablesCreated = new HashSet<>();
		this.dialect = this.configuration.getDialect().orElse(null);
		this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.UNKNOWN;

		if (this.configuration.isAutoCreateSchemas() && this.configuration.getSchemas().size() > 0) {
			try {
				createSchemas();

				if (!this.configuration.isAutoCommit())
					commit();
			} catch (RuntimeException e) {
				try {
					close();
				} catch (RuntimeException cleanupException) {
					e.addSuppressed(cleanupException);
				}

				throw e;
			}
		}
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DatabaseConfiguration}.
	 *
	 * @param configuration describes the database to connect to
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withConfiguration(@NonNull DatabaseConfiguration configuration) {
		requireNonNull(configuration);
		return new Builder(configuration);
	}

	/**
	 * Executes any SQL statement and returns its open {@link Cursor}, which the caller must close.
	 *
	 * @param sql        the SQL to execute
	 * @param parameters {@link PreparedStatement} parameters, if any
	 * @return an open cursor over the statement's results
	 * @throws QueryException if the driver rejects the statement
	 */
	@NonNull
	public Cursor query(@NonNull String sql,
											Object @Nullable ... parameters) {
		requireNonNull(sql);
		return openCursor(sql, parametersAsList(parameters), null);
	}

	@NonNull
	public Cursor query(@NonNull String sql,
											@NonNull List<?> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		return openCursor(sql, parameters, null);
	}

	/**
	 * Executes a statement that returns no rows, such as {@code INSERT}, {@code UPDATE}, {@code DELETE} or DDL.
	 *
	 * @param sql        the SQL to execute
	 * @param parameters {@link PreparedStatement} parameters, if any
	 * @return the number of rows affected
	 * @throws QueryException if the driver rejects the statement
	 */
	public long action(@NonNull String sql,
										 Object @Nullable ... parameters) {
		requireNonNull(sql);
		return action(sql, parametersAsList(parameters));
	}

	public long action(@NonNull String sql,
										 @NonNull List<?> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		Statement statement = newStatement(sql);
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Long rowCount = null;
		Exception exception = null;
		Throwable thrown = null;

		try {
			Connection connection = acquireConnection();
			connectionAcquisitionDuration = takeConnectionAcquisitionDuration();
			long startTime = nanoTime();

			try (PreparedStatement preparedStatement = prepareStatement(connection, sql, parameters)) {
				preparationDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();
				rowCount = executeUpdate(preparedStatement);
				executionDuration = Duration.ofNanos(nanoTime() - startTime);
			}

			return rowCount;
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (SQLException e) {
			QueryException wrapped = new QueryException(sql, e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException e) {
			exception = e;
			thrown = e;
			throw e;
		} finally {
			StatementLog statementLog = StatementLog.withStatement(statement, getDatabaseTypeIfKnown())
					.parameters(parameters)
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.rowCount(rowCount)
					.exception(exception)
					.build();

			Throwable cleanupFailure = logStatement(statementLog, null);

			if (cleanupFailure != null)
				rethrowCleanupFailure(cleanupFailure, thrown);
		}
	}

	/**
	 * Executes a query and returns its first row.
	 *
	 * @param sql        the SQL query to execute
	 * @param parameters {@link PreparedStatement} parameters, if any
	 * @return the first row, or empty if there were none
	 */
	@NonNull
	public Optional<Row> fetchOne(@NonNull String sql,
																Object @Nullable ... parameters) {
		requireNonNull(sql);
		return fetchOne(sql, parametersAsList(parameters));
	}

	@NonNull
	public Optional<Row> fetchOne(@NonNull String sql,
																@NonNull List<?> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		try (Cursor cursor = openCursor(sql, parameters, null)) {
			return cursor.fetchOne();
		}
	}

	/**
	 * Executes a query and returns every row.
	 *
	 * @param sql        the SQL query to execute
	 * @param parameters {@link PreparedStatement} parameters, if any
	 * @return the rows, possibly empty
	 */
	@NonNull
	public List<Row> fetchAll(@NonNull String sql,
														Object @Nullable ... parameters) {
		requireNonNull(sql);
		return fetchAll(sql, parametersAsList(parameters));
	}

	@NonNull
	public List<Row> fetchAll(@NonNull String sql,
														@NonNull List<?> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		try (Cursor cursor = openCursor(sql, parameters, null)) {
			return cursor.fetchAll();
		}
	}

	/**
	 * Inserts a row built from column-value pairs, in map iteration order.
	 * <pre>{@code
	 * Map<String, Object> fields = new LinkedHashMap<>();
	 * fields.put("first_name", "John");
	 * fields.put("last_name", "Doe");
	 * database.insert("users", fields);
	 * }</pre>
	 *
	 * @param table  the table to insert into
	 * @param fields column names mapped to values
	 * @return the number of rows inserted
	 */
	public long insert(@NonNull String table,
										 @NonNull Map<String, ?> fields) {
		requireNonNull(table);
		requireNonNull(fields);

		if (fields.isEmpty())
			throw new IllegalArgumentException(format("No fields given for insert into '%s'", table));

		Dialect.checkIdentifier(table);
		String placeholder = getDialect().getPlaceholder();
		List<String> columns = new ArrayList<>(fields.size());
		List<Object> parameters = new ArrayList<>(fields.size());

		for (Map.Entry<String, ?> entry : fields.entrySet()) {
			columns.add(Dialect.checkIdentifier(entry.getKey()));
			parameters.add(entry.getValue());
		}

		String sql = format("INSERT INTO %s (%s) VALUES (%s)", table, String.join(", ", columns),
				columns.stream().map(column -> placeholder).collect(Collectors.joining(", ")));

		return action(sql, parameters);
	}

	/**
	 * Gets the key most recently generated on this connection for the {@code id} column of {@code table}.
	 *
	 * @param table the table that was inserted into
	 * @return the last generated key, or empty if this connection has not generated one
	 * @throws DatabaseException if this database's dialect cannot report generated keys
	 */
	@NonNull
	public Optional<Long> lastInsertId(@NonNull String table) {
		return lastInsertId(table, "id");
	}

	@NonNull
	public Optional<Long> lastInsertId(@NonNull String table,
																		 @NonNull String primaryKeyColumn) {
		requireNonNull(table);
		requireNonNull(primaryKeyColumn);

		Dialect dialect = getDialect();
		String sql = dialect.getLastInsertIdQuery().orElseThrow(() ->
				new DatabaseException(format("Last insert ID lookup is not supported for %s databases", dialect.getDatabaseType().name())));

		Optional<Row> row = fetchOne(sql, dialect.lastInsertIdParameters(table, primaryKeyColumn));

		if (row.isEmpty() || row.get().get(0) == null)
			return Optional.empty();

		Object value = row.get().get(0);

		if (value instanceof Number)
			return Optional.of(((Number) value).longValue());

		throw new DatabaseException(format("Expected a numeric key for table '%s' but got %s", table, value.getClass().getName()));
	}

	public boolean tableExists(@NonNull String table) {
		requireNonNull(table);

		Dialect dialect = getDialect();
		String sql = getConfiguration().getTableExistsQuery().orElse(dialect.getTableExistsQuery().orElse(null));

		if (sql == null)
			return listTablesFromMetaData().stream().anyMatch(tableName -> tableName.equalsIgnoreCase(table));

		Optional<Row> row = fetchOne(sql, dialect.tableExistsParameters(getConfiguration().getSchemaName(), table));

		if (row.isEmpty())
			return false;

		Object value = row.get().get(0);

		if (value instanceof Boolean)
			return (Boolean) value;

		if (value instanceof Number)
			return ((Number) value).longValue() > 0L;

		return false;
	}

	/**
	 * @return the names of the tables in this database (or, for PostgreSQL, in the configured schema)
	 */
	@NonNull
	public List<String> listTables() {
		Dialect dialect = getDialect();
		String sql = getConfiguration().getTableListQuery().orElse(dialect.getTableListQuery().orElse(null));

		if (sql == null)
			return listTablesFromMetaData();

		return fetchAll(sql, dialect.tableListParameters(getConfiguration().getSchemaName())).stream()
				.map(row -> String.valueOf(row.get(0)))
				.collect(Collectors.toList());
	}

	@NonNull
	protected List<String> listTablesFromMetaData() {
		Connection connection = acquireConnection();
		List<String> tableNames = new ArrayList<>();

		try (ResultSet resultSet = connection.getMetaData().getTables(null, null, "%", new String[]{"TABLE"})) {
			while (resultSet.next())
				tableNames.add(resultSet.getString("TABLE_NAME"));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to read table metadata", e);
		}

		return tableNames;
	}

	/**
	 * Creates declared tables which don't exist yet.
	 *
	 * @param tables the declared tables to create, or none for all of them
	 * @return which tables were created and which were skipped
	 * @throws IllegalArgumentException if a named table was not declared
	 */
	@NonNull
	public SchemaResult createSchemas(@NonNull String... tables) {
		requireNonNull(tables);

		List<String> requestedTables = Arrays.asList(tables);

		for (String table : requestedTables)
			declaredSchema(table).orElseThrow(() -> new IllegalArgumentException(format("No schema declared for table '%s'", table)));

		SchemaResult schemaResult = SchemaResult.empty();

		for (TableSchema tableSchema : getConfiguration().getSchemas())
			if (requestedTables.isEmpty() || requestedTables.contains(tableSchema.getTableName()))
				schemaResult = schemaResult.plus(createSchema(tableSchema.getTableName(), tableSchema.getCreateStatement()));

		return schemaResult;
	}

	/**
	 * Creates a declared table if it doesn't exist yet.
	 *
	 * @param table the declared table
	 * @return whether the table was created or skipped
	 * @throws IllegalArgumentException if the table was not declared
	 */
	@NonNull
	public SchemaResult createSchema(@NonNull String table) {
		requireNonNull(table);

		TableSchema tableSchema = declaredSchema(table).orElseThrow(() ->
				new IllegalArgumentException(format("No schema declared for table '%s' and no create statement given", table)));

		return createSchema(table, tableSchema.getCreateStatement());
	}

	/**
	 * Runs {@code createStatement} unless {@code table} already exists.
	 *
	 * @param table           the table name
	 * @param createStatement the statement that creates it
	 * @return whether the table was created or skipped
	 */
	@NonNull
	public SchemaResult createSchema(@NonNull String table,
																	 @NonNull String createStatement) {
		requireNonNull(table);
		requireNonNull(createStatement);

		if (this.tablesCreated.contains(table)) {
			getLogger().fine(format("Table %s was already created by this instance, skipping existence check", table));
			return new SchemaResult(List.of(), List.of(), List.of(table));
		}

		SchemaResult schemaResult;

		if (tableExists(table)) {
			getLogger().fine(format("Table %s already exists, not creating it", table));
			schemaResult = new SchemaResult(List.of(), List.of(), List.of(table));
		} else {
			getLogger().fine(format("Table %s doesn't exist, creating it", table));
			action(createStatement);
			schemaResult = new SchemaResult(List.of(table), List.of(), List.of());
		}

		this.tablesCreated.add(table);
		return schemaResult;
	}

	/**
	 * Drops tables which exist, in reverse declaration order.
	 * <p>
	 * Named tables which were never declared are dropped too, after the declared ones.
	 *
	 * @param tables the tables to drop, or none for every declared table
	 * @return which tables were dropped and which were skipped
	 */
	@NonNull
	public SchemaResult dropSchemas(@NonNull String... tables) {
		requireNonNull(tables);

		List<String> requestedTables = Arrays.asList(tables);
		List<String> declaredTables = getConfiguration().getSchemas().stream()
				.map(TableSchema::getTableName)
				.collect(Collectors.toList());
		Collections.reverse(declaredTables);

		List<String> tablesToDrop = new ArrayList<>();

		for (String declaredTable : declaredTables)
			if (requestedTables.isEmpty() || requestedTables.contains(declaredTable))
				tablesToDrop.add(declaredTable);

		for (String requestedTable : requestedTables)
			if (!tablesToDrop.contains(requestedTable))
				tablesToDrop.add(requestedTable);

		List<String> droppedTables = new ArrayList<>();
		List<String> skippedTables = new ArrayList<>();

		for (String table : tablesToDrop) {
			if (dropTable(table))
				droppedTables.add(table);
			else
				skippedTables.add(table);
		}

		return new SchemaResult(List.of(), droppedTables, skippedTables);
	}

	/**
	 * Drops and then re-creates declared tables. Existing data is lost.
	 *
	 * @param tables the declared tables to recreate, or none for all of them
	 * @return the combined drop and create results
	 */
	@NonNull
	public SchemaResult recreateSchemas(@NonNull String... tables) {
		requireNonNull(tables);

		SchemaResult dropResult = dropSchemas(tables);
		String[] declaredTables = Arrays.stream(tables)
				.filter(table -> declaredSchema(table).isPresent())
				.toArray(String[]::new);

		// Recreating a subset made only of undeclared tables must not fall through to "create everything"
		if (tables.length > 0 && declaredTables.length == 0)
			return dropResult;

		return dropResult.plus(createSchemas(declaredTables));
	}

	/**
	 * Drops {@code table} if it exists.
	 *
	 * @param table the table to drop
	 * @return {@code true} if the table was dropped, {@code false} if it didn't exist
	 */
	public boolean dropTable(@NonNull String table) {
		requireNonNull(table);

		Dialect.checkIdentifier(table);
		this.tablesCreated.remove(table);

		if (!tableExists(table)) {
			getLogger().fine(format("Table %s doesn't exist, not dropping it", table));
			return false;
		}

		action(format("DROP TABLE %s", table));
		return true;
	}

	/**
	 * Drops each table which exists.
	 *
	 * @param tables the tables to drop
	 * @return each table name mapped to whether it was dropped, in argument order
	 */
	@NonNull
	public Map<String, Boolean> dropTables(@NonNull String... tables) {
		requireNonNull(tables);

		Map<String, Boolean> results = new LinkedHashMap<>(tables.length);

		for (String table : tables)
			results.put(table, dropTable(table));

		return Collections.unmodifiableMap(results);
	}

	/**
	 * Commits the current transaction. A no-op in auto-commit mode or before the connection is opened.
	 */
	public void commit() {
		Connection connection = this.connection;

		if (connection == null)
			return;

		try {
			if (!connection.getAutoCommit())
				connection.commit();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to commit transaction", e);
		}
	}

	/**
	 * Rolls back the current transaction. A no-op in auto-commit mode or before the connection is opened.
	 */
	public void rollback() {
		Connection connection = this.connection;

		if (connection == null)
			return;

		try {
			if (!connection.getAutoCommit())
				connection.rollback();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to roll back transaction", e);
		}
	}

	/**
	 * Creates a query builder for {@code table}, bound to this database.
	 *
	 * @param table the table to query
	 * @return a new query builder
	 */
	@NonNull
	public QueryBuilder builder(@NonNull String table) {
		requireNonNull(table);
		return new QueryBuilder(this, table);
	}

	/**
	 * @return the most recent statement logs, oldest first, if the execution log is enabled
	 */
	@NonNull
	public List<StatementLog> getExecutionLog() {
		return List.copyOf(this.executionLog);
	}

	public void clearExecutionLog() {
		this.executionLog.clear();
	}

	/**
	 * Gets this database's dialect, opening the connection first if the dialect must be detected.
	 *
	 * @return the dialect
	 */
	@NonNull
	public Dialect getDialect() {
		if (this.dialect == null)
			acquireConnection();

		return requireNonNull(this.dialect);
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return getDialect().getDatabaseType();
	}

	@NonNull
	public DatabaseConfiguration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	public boolean isClosed() {
		return this.closed;
	}

	/**
	 * Closes the connection, if open. Further use of this instance fails with {@link ConnectionException}.
	 * Closing more than once is a no-op.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		Connection connection = this.connection;
		this.connection = null;

		if (connection == null)
			return;

		try {
			connection.close();
			getLogger().fine(format("Closed connection to %s", getConfiguration()));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	@NonNull
	Cursor openCursor(@NonNull String sql,
										@NonNull List<?> parameters,
										@Nullable Integer fetchSize) {
		requireNonNull(sql);
		requireNonNull(parameters);

		Statement statement = newStatement(sql);
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		PreparedStatement preparedStatement = null;
		ResultSet resultSet = null;
		Cursor.CloseAction closeAction = null;
		Exception exception = null;
		Throwable thrown = null;
		boolean opened = false;

		try {
			Connection connection = acquireConnection();
			connectionAcquisitionDuration = takeConnectionAcquisitionDuration();
			long startTime = nanoTime();

			if (fetchSize != null && !getDialect().supportsStreamingCursors())
				getLogger().fine(format("%s has no server-side cursors, passing fetch size %d to the driver as a hint",
						getDialect().getDatabaseType().name(), fetchSize));

			if (fetchSize != null && getDialect().streamingRequiresTransaction() && connection.getAutoCommit()) {
				connection.setAutoCommit(false);
				closeAction = () -> {
					try {
						connection.commit();
					} finally {
						connection.setAutoCommit(true);
					}
				};
			}

			preparedStatement = prepareStatement(connection, sql, parameters);

			if (fetchSize != null)
				preparedStatement.setFetchSize(fetchSize);

			preparationDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			boolean hasResultSet = preparedStatement.execute();
			resultSet = hasResultSet ? preparedStatement.getResultSet() : null;
			long updateCount = hasResultSet ? -1L : updateCount(preparedStatement);
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);

			Cursor cursor = new Cursor(this, statement, parameters, preparedStatement, resultSet, updateCount, closeAction,
					connectionAcquisitionDuration, preparationDuration, executionDuration);
			opened = true;
			return cursor;
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (SQLException e) {
			QueryException wrapped = new QueryException(sql, e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException e) {
			exception = e;
			thrown = e;
			throw e;
		} finally {
			if (!opened) {
				Throwable cleanupFailure = closeQuietly(resultSet, null);
				cleanupFailure = closeQuietly(preparedStatement, cleanupFailure);

				if (closeAction != null) {
					try {
						closeAction.perform();
					} catch (Throwable cleanupException) {
						cleanupFailure = accumulate(cleanupFailure, cleanupException);
					}
				}

				StatementLog statementLog = StatementLog.withStatement(statement, getDatabaseTypeIfKnown())
						.parameters(parameters)
						.connectionAcquisitionDuration(connectionAcquisitionDuration)
						.preparationDuration(preparationDuration)
						.exception(exception)
						.build();

				cleanupFailure = logStatement(statementLog, cleanupFailure);

				if (cleanupFailure != null)
					rethrowCleanupFailure(cleanupFailure, thrown);
			}
		}
	}

	/**
	 * Records a finished statement and hands it to the statement logger.
	 *
	 * @return {@code cleanupFailure}, with any logger failure accumulated into it
	 */
	@Nullable
	Throwable logStatement(@NonNull StatementLog statementLog,
												 @Nullable Throwable cleanupFailure) {
		requireNonNull(statementLog);

		if (getConfiguration().isExecutionLogEnabled()) {
			if (this.executionLog.size() >= getConfiguration().getExecutionLogCapacity())
				this.executionLog.removeFirst();

			this.executionLog.addLast(statementLog);
		}

		try {
			getStatementLogger().log(statementLog);
		} catch (Throwable cleanupException) {
			cleanupFailure = accumulate(cleanupFailure, cleanupException);
		}

		return cleanupFailure;
	}

	@NonNull
	protected Connection acquireConnection() {
		if (this.closed)
			throw new ConnectionException("Database is closed");

		if (this.connection != null)
			return this.connection;

		long startTime = nanoTime();
		Connection connection = null;

		try {
			DataSource dataSource = getConfiguration().getDataSource().orElse(null);

			if (dataSource != null)
				connection = dataSource.getConnection();
			else
				connection = requireNonNull(this.dialect).openConnection(getConfiguration());

			if (this.dialect == null) {
				this.dialect = Dialect.forDatabaseType(DatabaseType.fromConnection(connection));
				getLogger().fine(format("Detected %s database", this.dialect.getDatabaseType().name()));
			}

			this.dialect.initializeSession(connection);

			if (connection.getAutoCommit() != getConfiguration().isAutoCommit())
				connection.setAutoCommit(getConfiguration().isAutoCommit());

			Integer transactionIsolation = getConfiguration().getTransactionIsolation().getJdbcLevel().orElse(null);

			if (transactionIsolation != null)
				connection.setTransactionIsolation(transactionIsolation);
		} catch (SQLException | RuntimeException e) {
			ConnectionException wrapped = e instanceof ConnectionException
					? (ConnectionException) e
					: new ConnectionException(format("Unable to connect to %s", getConfiguration()), e);

			if (connection != null) {
				try {
					connection.close();
				} catch (Throwable cleanupException) {
					wrapped.addSuppressed(cleanupException);
				}
			}

			throw wrapped;
		}

		this.connection = connection;
		this.pendingConnectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
		getLogger().fine(format("Opened connection to %s", getConfiguration()));

		return connection;
	}

	@NonNull
	protected PreparedStatement prepareStatement(@NonNull Connection connection,
																							 @NonNull String sql,
																							 @NonNull List<?> parameters) throws SQLException {
		requireNonNull(connection);
		requireNonNull(sql);
		requireNonNull(parameters);

		PreparedStatement preparedStatement = connection.prepareStatement(sql);

		try {
			bindParameters(preparedStatement, parameters);
		} catch (SQLException | RuntimeException e) {
			try {
				preparedStatement.close();
			} catch (Throwable cleanupException) {
				e.addSuppressed(cleanupException);
			}

			throw e;
		}

		return preparedStatement;
	}

	protected void bindParameters(@NonNull PreparedStatement preparedStatement,
																@NonNull List<?> parameters) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameters);

		for (int i = 0; i < parameters.size(); ++i) {
			Object parameter = normalizeParameter(parameters.get(i));

			if (parameter != null) {
				preparedStatement.setObject(i + 1, parameter);
			} else {
				try {
					ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

					if (parameterMetaData != null)
						preparedStatement.setNull(i + 1, parameterMetaData.getParameterType(i + 1));
					else
						preparedStatement.setNull(i + 1, Types.NULL);
				} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
					preparedStatement.setNull(i + 1, Types.NULL);
				}
			}
		}
	}

	/**
	 * Converts a parameter to a type the driver binds natively.
	 */
	@Nullable
	protected Object normalizeParameter(@Nullable Object parameter) {
		if (parameter instanceof Optional)
			parameter = ((Optional<?>) parameter).orElse(null);

		if (parameter == null)
			return null;

		if (parameter instanceof Enum)
			return ((Enum<?>) parameter).name();

		if (parameter instanceof BigInteger)
			return new BigDecimal((BigInteger) parameter);

		// SQLite has no date or UUID types; ISO strings keep strftime() and comparisons working
		if (getDatabaseTypeIfKnown() == DatabaseType.SQLITE && (parameter instanceof Temporal || parameter instanceof UUID))
			return parameter.toString();

		if (parameter instanceof Instant)
			return Timestamp.from((Instant) parameter);

		return parameter;
	}

	private long executeUpdate(@NonNull PreparedStatement preparedStatement) throws SQLException {
		DatabaseOperationSupportStatus executeLargeUpdateSupported = this.executeLargeUpdateSupported;

		// Use the appropriate "large" value if we know it.
		// If we don't know it, detect it and store it.
		if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.YES)
			return preparedStatement.executeLargeUpdate();

		if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.NO)
			return preparedStatement.executeUpdate();

		try {
			long updateCount = preparedStatement.executeLargeUpdate();
			this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.YES;
			return updateCount;
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.NO;
			return preparedStatement.executeUpdate();
		}
	}

	private long updateCount(@NonNull PreparedStatement preparedStatement) throws SQLException {
		if (this.executeLargeUpdateSupported != DatabaseOperationSupportStatus.NO) {
			try {
				return preparedStatement.getLargeUpdateCount();
			} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
				this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.NO;
			}
		}

		return preparedStatement.getUpdateCount();
	}

	@NonNull
	private Statement newStatement(@NonNull String sql) {
		return Statement.of(this.statementIdGenerator.incrementAndGet(), sql);
	}

	@Nullable
	private Duration takeConnectionAcquisitionDuration() {
		Duration connectionAcquisitionDuration = this.pendingConnectionAcquisitionDuration;
		this.pendingConnectionAcquisitionDuration = null;
		return connectionAcquisitionDuration;
	}

	@NonNull
	private DatabaseType getDatabaseTypeIfKnown() {
		return this.dialect == null ? DatabaseType.GENERIC : this.dialect.getDatabaseType();
	}

	@NonNull
	private Optional<TableSchema> declaredSchema(@NonNull String table) {
		return getConfiguration().getSchemas().stream()
				.filter(tableSchema -> tableSchema.getTableName().equals(table))
				.findFirst();
	}

	@NonNull
	private static List<?> parametersAsList(Object @Nullable ... parameters) {
		return parameters == null ? List.of() : Arrays.asList(parameters);
	}

	@Nullable
	static Throwable closeQuietly(@Nullable AutoCloseable closeable,
																@Nullable Throwable cleanupFailure) {
		if (closeable == null)
			return cleanupFailure;

		try {
			closeable.close();
		} catch (Throwable cleanupException) {
			cleanupFailure = accumulate(cleanupFailure, cleanupException);
		}

		return cleanupFailure;
	}

	@NonNull
	static Throwable accumulate(@Nullable Throwable cleanupFailure,
															@NonNull Throwable cleanupException) {
		if (cleanupFailure == null)
			return cleanupException;

		cleanupFailure.addSuppressed(cleanupException);
		return cleanupFailure;
	}

	static void rethrowCleanupFailure(@NonNull Throwable cleanupFailure,
																		@Nullable Throwable thrown) {
		requireNonNull(cleanupFailure);

		if (thrown != null) {
			thrown.addSuppressed(cleanupFailure);
		} else if (cleanupFailure instanceof RuntimeException) {
			throw (RuntimeException) cleanupFailure;
		} else if (cleanupFailure instanceof Error) {
			throw (Error) cleanupFailure;
		} else {
			throw new DatabaseException(cleanupFailure);
		}
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DatabaseConfiguration configuration;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull DatabaseConfiguration configuration) {
			this.configuration = requireNonNull(configuration);
		}

		/**
		 * Defaults to a {@link DefaultStatementLogger}.
		 *
		 * @param statementLogger receives a log of each statement
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * Builds the database, creating missing declared tables if the configuration asks for it.
		 *
		 * @return a new database
		 * @throws ConnectionException if tables must be created and the connection cannot be opened
		 */
		@NonNull
		public Database build() {
			return new Database(this);
		}
	}
}
