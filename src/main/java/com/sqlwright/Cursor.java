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
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * An executed statement and its pending results.
 * <p>
 * Rows are read from the driver on demand. Statements which produce no result set (updates, DDL) yield no rows and
 * report the number of affected rows through {@link #getRowCount()}.
 * <p>
 * Always close a cursor, ideally with try-with-resources. A failure while reading rows closes the cursor immediately.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class Cursor implements Iterable<Row>, AutoCloseable {
	@NonNull
	private final Database database;
	@NonNull
	private final Statement statement;
	@NonNull
	private final List<?> parameters;
	@NonNull
	private final PreparedStatement preparedStatement;
	@Nullable
	private final ResultSet resultSet;
	@NonNull
	private final List<String> columnNames;
	private final long updateCount;
	@Nullable
	private final CloseAction closeAction;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	private long fetchNanos;
	private long rowsFetched;
	private boolean exhausted;
	private boolean closed;
	@Nullable
	private Exception exception;
	@Nullable
	private Throwable thrown;

	Cursor(@NonNull Database database,
				 @NonNull Statement statement,
				 @NonNull List<?> parameters,
				 @NonNull PreparedStatement preparedStatement,
				 @Nullable ResultSet resultSet,
				 long updateCount,
				 @Nullable CloseAction closeAction,
				 @Nullable Duration connectionAcquisitionDuration,
				 @Nullable Duration preparationDuration,
				 @Nullable Duration executionDuration) throws SQLException {
		this.database = requireNonNull(database);
		this.statement = requireNonNull(statement);
		this.parameters = requireNonNull(parameters);
		this.preparedStatement = requireNonNull(preparedStatement);
		this.resultSet = resultSet;
		this.updateCount = updateCount;
		this.closeAction = closeAction;
		this.connectionAcquisitionDuration = connectionAcquisitionDuration;
		this.preparationDuration = preparationDuration;
		this.executionDuration = executionDuration;
		this.columnNames = resultSet == null ? List.of() : columnNames(resultSet.getMetaData());
		this.exhausted = resultSet == null;
	}

	@NonNull
	private static List<String> columnNames(@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnNames = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columnNames.add(resultSetMetaData.getColumnLabel(i));

		return Collections.unmodifiableList(columnNames);
	}

	/**
	 * Reads the next row.
	 *
	 * @return the next row, or empty if every row has been read
	 * @throws DatabaseException if this cursor is closed
	 * @throws QueryException    if the driver fails while reading
	 */
	@NonNull
	public Optional<Row> fetchOne() {
		ensureOpen();

		if (this.exhausted)
			return Optional.empty();

		ResultSet resultSet = requireNonNull(this.resultSet);
		long startTime = nanoTime();

		try {
			if (!resultSet.next()) {
				this.exhausted = true;
				return Optional.empty();
			}

			List<Object> values = new ArrayList<>(this.columnNames.size());

			for (int i = 1; i <= this.columnNames.size(); ++i)
				values.add(resultSet.getObject(i));

			++this.rowsFetched;
			return Optional.of(Row.of(this.columnNames, values));
		} catch (SQLException e) {
			throw fail(e);
		} finally {
			this.fetchNanos += nanoTime() - startTime;
		}
	}

	/**
	 * Reads up to {@code maximumRows} rows.
	 *
	 * @param maximumRows the most rows to read
	 * @return the rows read, fewer than {@code maximumRows} only if the results ran out
	 */
	@NonNull
	public List<Row> fetchMany(int maximumRows) {
		if (maximumRows < 0)
			throw new IllegalArgumentException(format("Row count must not be negative, was %d", maximumRows));

		List<Row> rows = new ArrayList<>(Math.min(maximumRows, 64));

		while (rows.size() < maximumRows) {
			Optional<Row> row = fetchOne();

			if (row.isEmpty())
				break;

			rows.add(row.get());
		}

		return rows;
	}

	/**
	 * @return every row not yet read
	 */
	@NonNull
	public List<Row> fetchAll() {
		List<Row> rows = new ArrayList<>();

		for (Optional<Row> row = fetchOne(); row.isPresent(); row = fetchOne())
			rows.add(row.get());

		return rows;
	}

	/**
	 * Iterates over the rows not yet read. The iterator does not close this cursor.
	 */
	@NonNull
	@Override
	public Iterator<Row> iterator() {
		return new Iterator<>() {
			@Nullable
			private Row nextRow;

			@Override
			public boolean hasNext() {
				if (this.nextRow == null && !isClosed())
					this.nextRow = fetchOne().orElse(null);

				return this.nextRow != null;
			}

			@Override
			public Row next() {
				if (!hasNext())
					throw new NoSuchElementException();

				Row row = this.nextRow;
				this.nextRow = null;
				return row;
			}
		};
	}

	/**
	 * Streams the rows not yet read. Closing the stream closes this cursor.
	 */
	@NonNull
	public Stream<Row> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false)
				.onClose(this::close);
	}

	/**
	 * The number of rows read so far for a query, or the number of rows affected by any other statement
	 * ({@code -1} if the driver did not report it).
	 */
	public long getRowCount() {
		return this.resultSet == null ? this.updateCount : this.rowsFetched;
	}

	/**
	 * @return the result column labels, in order; empty for statements without results
	 */
	@NonNull
	public List<String> getColumnNames() {
		return this.columnNames;
	}

	public boolean hasResultSet() {
		return this.resultSet != null;
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	public boolean isClosed() {
		return this.closed;
	}

	/**
	 * Releases the statement and its results. Closing more than once is a no-op.
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		Throwable cleanupFailure = null;

		try {
			cleanupFailure = Database.closeQuietly(this.resultSet, cleanupFailure);
			cleanupFailure = Database.closeQuietly(this.preparedStatement, cleanupFailure);

			if (this.closeAction != null) {
				try {
					this.closeAction.perform();
				} catch (Throwable cleanupException) {
					cleanupFailure = Database.accumulate(cleanupFailure, cleanupException);
				}
			}
		} finally {
			StatementLog statementLog = StatementLog.withStatement(this.statement, this.database.getDatabaseType())
					.parameters(this.parameters)
					.connectionAcquisitionDuration(this.connectionAcquisitionDuration)
					.preparationDuration(this.preparationDuration)
					.executionDuration(this.executionDuration)
					.fetchDuration(this.fetchNanos == 0L ? null : Duration.ofNanos(this.fetchNanos))
					.rowCount(getRowCount())
					.exception(this.exception)
					.build();

			cleanupFailure = this.database.logStatement(statementLog, cleanupFailure);
		}

		if (cleanupFailure != null)
			Database.rethrowCleanupFailure(cleanupFailure, this.thrown);
	}

	@NonNull
	private QueryException fail(@NonNull SQLException e) {
		QueryException wrapped = new QueryException(this.statement.getSql(), e);
		this.exception = wrapped;
		this.thrown = wrapped;
		close();
		return wrapped;
	}

	private void ensureOpen() {
		if (this.closed)
			throw new DatabaseException(format("Cursor for statement %d is closed", this.statement.getId()));
	}

	/**
	 * Work to run after the statement is released, such as ending the transaction a streaming cursor opened.
	 */
	@FunctionalInterface
	interface CloseAction {
		void perform() throws SQLException;
	}
}
