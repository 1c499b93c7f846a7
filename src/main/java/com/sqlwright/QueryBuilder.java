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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent builder for parameterized single-table {@code SELECT} statements.
 * <pre>{@code
 * List<Row> rows = database.builder("users")
 *   .select("first_name", "last_name")
 *   .where("last_name", "Doe")
 *   .whereOr("last_name", "Smith")
 *   .order("first_name")
 *   .limit(10)
 *   .all();
 * }</pre>
 * Clauses are assembled in a fixed order: {@code SELECT}, {@code FROM}, {@code WHERE}, {@code GROUP BY},
 * {@code ORDER BY}, {@code LIMIT}/{@code OFFSET}, wrapped in the dialect's pre- and post-query fragments.
 * <p>
 * {@code WHERE} conditions are joined left-to-right with {@code AND} ({@link #where(String, Object)}) or {@code OR}
 * ({@link #whereOr(String, Object)}) and are never parenthesized, so SQL precedence applies:
 * {@code where("a", 1).where("b", 2).whereOr("b", 3)} yields {@code a = ? AND b = ? OR b = ?}, which SQL reads as
 * {@code (a = ? AND b = ?) OR b = ?}.
 * <p>
 * A builder owns at most one shared {@link Cursor}, opened by {@link #execute()}, {@link #fetchNext()},
 * {@link #all()} or iteration. While that cursor is open ({@link QueryBuilderState#EXECUTED}) clause methods throw
 * {@link QueryBuilderStateException}; once it is exhausted or closed, clause methods are allowed again and the next
 * terminal call re-executes.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryBuilder implements Iterable<Row>, AutoCloseable {
	@NonNull
	private final Database database;
	@NonNull
	private final String table;
	@NonNull
	private final List<String> selectColumns;
	@NonNull
	private final List<Condition> conditions;
	@NonNull
	private final List<String> groupColumns;
	@NonNull
	private final List<String> orderColumns;
	@NonNull
	private SortDirection orderDirection;
	@Nullable
	private Long limit;
	@Nullable
	private Long offset;
	@Nullable
	private Integer fetchSize;
	@NonNull
	private QueryBuilderState state;
	@Nullable
	private Cursor cursor;
	@NonNull
	private final Logger logger;

	QueryBuilder(@NonNull Database database,
							 @NonNull String table) {
		requireNonNull(database);
		requireNonNull(table);

		if (table.trim().isEmpty())
			throw new IllegalArgumentException("Table name must not be blank");

		this.database = database;
		this.table = table;
		this.selectColumns = new ArrayList<>();
		this.conditions = new ArrayList<>();
		this.groupColumns = new ArrayList<>();
		this.orderColumns = new ArrayList<>();
		this.orderDirection = SortDirection.DESC;
		this.state = QueryBuilderState.EMPTY;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Adds columns or expressions to the select list. With none, {@code *} is selected.
	 *
	 * @param columns columns or expressions, e.g. {@code "COUNT(last_name) AS total"}
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder select(@NonNull String... columns) {
		List<String> validatedColumns = validatedColumns(columns);

		beginMutation();
		this.selectColumns.addAll(validatedColumns);
		return this;
	}

	/**
	 * Adds date or timestamp columns to the select list, rendered as ISO-8601 UTC strings and aliased back to their
	 * own names.
	 *
	 * @param columns date or timestamp columns
	 * @return this builder, for chaining
	 * @throws UnsupportedOperationException if the dialect cannot format dates
	 */
	@NonNull
	public QueryBuilder selectDate(@NonNull String... columns) {
		List<String> validatedColumns = validatedColumns(columns);
		Dialect dialect = this.database.getDialect();
		List<String> projections = new ArrayList<>(validatedColumns.size());

		for (String column : validatedColumns)
			projections.add(dialect.isoDateProjection(column));

		beginMutation();
		this.selectColumns.addAll(projections);
		return this;
	}

	/**
	 * Adds an {@code AND}-joined equality condition. A {@code null} value renders {@code column IS NULL}.
	 *
	 * @param column the column or expression to compare
	 * @param value  the value to compare against
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder where(@NonNull String column,
														@Nullable Object value) {
		return addCondition(Conjunction.AND, column, value, "=", null);
	}

	/**
	 * Adds an {@code AND}-joined condition with the given comparison operator.
	 * <p>
	 * A {@code null} value is only accepted with {@code =} (rendering {@code IS NULL}) or {@code !=}/{@code <>}
	 * (rendering {@code IS NOT NULL}).
	 *
	 * @param column  the column or expression to compare
	 * @param value   the value to compare against
	 * @param compare the comparison operator, e.g. {@code >=} or {@code LIKE}
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder where(@NonNull String column,
														@Nullable Object value,
														@NonNull String compare) {
		return addCondition(Conjunction.AND, column, value, compare, null);
	}

	/**
	 * Adds an {@code AND}-joined condition whose right-hand side is {@code placeholder}, such as {@code LOWER(?)}.
	 *
	 * @param column      the column or expression to compare
	 * @param value       the value to bind
	 * @param compare     the comparison operator
	 * @param placeholder an expression containing exactly one bind-parameter marker
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder where(@NonNull String column,
														@Nullable Object value,
														@NonNull String compare,
														@NonNull String placeholder) {
		requireNonNull(placeholder);
		return addCondition(Conjunction.AND, column, value, compare, placeholder);
	}

	/**
	 * Adds an {@code OR}-joined equality condition. A {@code null} value renders {@code column IS NULL}.
	 *
	 * @param column the column or expression to compare
	 * @param value  the value to compare against
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder whereOr(@NonNull String column,
															@Nullable Object value) {
		return addCondition(Conjunction.OR, column, value, "=", null);
	}

	@NonNull
	public QueryBuilder whereOr(@NonNull String column,
															@Nullable Object value,
															@NonNull String compare) {
		return addCondition(Conjunction.OR, column, value, compare, null);
	}

	@NonNull
	public QueryBuilder whereOr(@NonNull String column,
															@Nullable Object value,
															@NonNull String compare,
															@NonNull String placeholder) {
		requireNonNull(placeholder);
		return addCondition(Conjunction.OR, column, value, compare, placeholder);
	}

	@NonNull
	public QueryBuilder groupBy(@NonNull String... columns) {
		List<String> validatedColumns = validatedColumns(columns);

		beginMutation();
		this.groupColumns.addAll(validatedColumns);
		return this;
	}

	/**
	 * Orders by the given columns, descending. Replaces any previous ordering.
	 *
	 * @param columns the columns to order by
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder order(@NonNull String... columns) {
		return order(SortDirection.DESC, columns);
	}

	/**
	 * Orders by the given columns in {@code direction}, which applies to the clause as a whole
	 * ({@code ORDER BY a, b ASC}). Replaces any previous ordering.
	 *
	 * @param direction the sort direction
	 * @param columns   the columns to order by
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder order(@NonNull SortDirection direction,
														@NonNull String... columns) {
		requireNonNull(direction);
		List<String> validatedColumns = validatedColumns(columns);

		beginMutation();
		this.orderColumns.clear();
		this.orderColumns.addAll(validatedColumns);
		this.orderDirection = direction;
		return this;
	}

	/**
	 * Synonym for {@link #order(String...)}.
	 */
	@NonNull
	public QueryBuilder orderBy(@NonNull String... columns) {
		return order(columns);
	}

	/**
	 * Synonym for {@link #order(SortDirection, String...)}.
	 */
	@NonNull
	public QueryBuilder orderBy(@NonNull SortDirection direction,
															@NonNull String... columns) {
		return order(direction, columns);
	}

	/**
	 * Caps the number of rows returned. Clears any offset set previously.
	 *
	 * @param limit the most rows to return
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder limit(long limit) {
		if (limit < 0)
			throw new IllegalArgumentException(format("Limit must not be negative, was %d", limit));

		beginMutation();
		this.limit = limit;
		this.offset = null;
		return this;
	}

	@NonNull
	public QueryBuilder limit(long limit,
														long offset) {
		if (limit < 0)
			throw new IllegalArgumentException(format("Limit must not be negative, was %d", limit));

		if (offset < 0)
			throw new IllegalArgumentException(format("Offset must not be negative, was %d", offset));

		beginMutation();
		this.limit = limit;
		this.offset = offset;
		return this;
	}

	/**
	 * Reads rows in batches of {@code fetchSize} instead of all at once.
	 * <p>
	 * For PostgreSQL this opens a server-side cursor; if auto-commit is on, a transaction is opened for the cursor's
	 * lifetime and committed when the cursor is released. Other dialects pass the fetch size to the driver as a hint.
	 *
	 * @param fetchSize the number of rows per round trip
	 * @return this builder, for chaining
	 */
	@NonNull
	public QueryBuilder streaming(int fetchSize) {
		if (fetchSize < 1)
			throw new IllegalArgumentException(format("Fetch size must be positive, was %d", fetchSize));

		beginMutation();
		this.fetchSize = fetchSize;
		return this;
	}

	/**
	 * Generates the SQL for the clauses added so far. Repeated calls with no intervening change return identical SQL.
	 *
	 * @return the SQL statement
	 */
	@NonNull
	public String buildQuery() {
		Dialect dialect = this.database.getDialect();
		List<String> fragments = new ArrayList<>(8);

		if (dialect.getPreQuery().length() > 0)
			fragments.add(dialect.getPreQuery());

		fragments.add(format("SELECT %s FROM %s", this.selectColumns.isEmpty() ? "*" : String.join(", ", this.selectColumns), this.table));

		if (this.conditions.size() > 0) {
			List<String> conditionFragments = new ArrayList<>(this.conditions.size());

			for (int i = 0; i < this.conditions.size(); ++i) {
				Condition condition = this.conditions.get(i);
				conditionFragments.add(i == 0 ? condition.sql : format("%s %s", condition.conjunction.name(), condition.sql));
			}

			fragments.add(format("WHERE %s", String.join(" ", conditionFragments)));
		}

		if (this.groupColumns.size() > 0)
			fragments.add(format("GROUP BY %s", String.join(", ", this.groupColumns)));

		if (this.orderColumns.size() > 0)
			fragments.add(format("ORDER BY %s %s", String.join(", ", this.orderColumns), this.orderDirection.getSql()));

		if (this.limit != null) {
			fragments.add(format("LIMIT %d", this.limit));

			if (this.offset != null)
				fragments.add(format("OFFSET %d", this.offset));
		}

		if (dialect.getPostQuery().length() > 0)
			fragments.add(dialect.getPostQuery());

		String sql = String.join(" ", fragments);

		if (this.state == QueryBuilderState.EMPTY || this.state == QueryBuilderState.ACCUMULATING) {
			this.state = QueryBuilderState.BUILT;
			getLogger().fine(format("Built query: %s", sql));
		}

		return sql;
	}

	/**
	 * @return the values bound to the generated SQL's placeholders, in placeholder order
	 */
	@NonNull
	public List<@Nullable Object> getParameters() {
		List<Object> parameters = new ArrayList<>(this.conditions.size());

		for (Condition condition : this.conditions)
			if (condition.bound)
				parameters.add(condition.value);

		return Collections.unmodifiableList(parameters);
	}

	/**
	 * Executes the query on this builder's shared cursor, replacing (and closing) any cursor opened before.
	 * <p>
	 * The returned cursor is owned by this builder; release it with {@link #closeCursor()}.
	 *
	 * @return the open cursor
	 */
	@NonNull
	public Cursor execute() {
		try {
			releaseCursor();
		} finally {
			if (this.state == QueryBuilderState.EXECUTED)
				this.state = QueryBuilderState.CLOSED;
		}

		String sql = buildQuery();
		this.cursor = this.database.openCursor(sql, getParameters(), this.fetchSize);
		this.state = QueryBuilderState.EXECUTED;

		return this.cursor;
	}

	/**
	 * Runs the query on a cursor of its own and returns the first row. The shared cursor is not touched.
	 *
	 * @return the first row, or empty if there were none
	 */
	@NonNull
	public Optional<Row> fetch() {
		String sql = buildQuery();

		try (Cursor cursor = this.database.openCursor(sql, getParameters(), this.fetchSize)) {
			return cursor.fetchOne();
		}
	}

	/**
	 * Reads the next row from the shared cursor, executing the query first if needed.
	 * <p>
	 * When the rows run out, the cursor is released and every further call returns empty until a clause method or
	 * {@link #execute()} starts a new cycle.
	 *
	 * @return the next row, or empty at exhaustion
	 * @throws QueryBuilderStateException if the cursor was released by {@link #closeCursor()}
	 */
	@NonNull
	public Optional<Row> fetchNext() {
		if (this.state == QueryBuilderState.EXHAUSTED)
			return Optional.empty();

		Cursor cursor = openSharedCursor(false);
		Optional<Row> row = fetchFromSharedCursor(cursor);

		if (row.isEmpty())
			exhaust();

		return row;
	}

	/**
	 * Returns every remaining row of the open shared cursor or, if none is open, of a fresh execution.
	 *
	 * @return the rows, possibly empty
	 */
	@NonNull
	public List<Row> all() {
		Cursor cursor = openSharedCursor(true);
		List<Row> rows = new ArrayList<>();

		for (Optional<Row> row = fetchFromSharedCursor(cursor); row.isPresent(); row = fetchFromSharedCursor(cursor))
			rows.add(row.get());

		exhaust();
		return rows;
	}

	/**
	 * Runs the query on a cursor of its own and returns the row at {@code index}.
	 *
	 * @param index zero-based row position
	 * @return the row, or empty if the query returned {@code index} rows or fewer
	 */
	@NonNull
	public Optional<Row> get(int index) {
		if (index < 0)
			throw new IndexOutOfBoundsException(format("Row index must not be negative, was %d", index));

		String sql = buildQuery();

		try (Cursor cursor = this.database.openCursor(sql, getParameters(), this.fetchSize)) {
			if (cursor.fetchMany(index).size() < index)
				return Optional.empty();

			return cursor.fetchOne();
		}
	}

	/**
	 * Lazily iterates over the remaining rows of the open shared cursor or, if none is open, of a fresh execution.
	 * The cursor is released once the iterator is exhausted.
	 */
	@NonNull
	@Override
	public Iterator<Row> iterator() {
		Cursor cursor = openSharedCursor(true);

		return new Iterator<>() {
			@Nullable
			private Row nextRow;
			private boolean done;

			@Override
			public boolean hasNext() {
				if (this.nextRow == null && !this.done) {
					if (QueryBuilder.this.cursor != cursor) {
						// Shared cursor was replaced or released underneath us
						this.done = true;
					} else {
						this.nextRow = fetchFromSharedCursor(cursor).orElse(null);

						if (this.nextRow == null) {
							this.done = true;
							exhaust();
						}
					}
				}

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
	 * Streams rows as {@link #iterator()} does. Closing the stream releases the shared cursor.
	 */
	@NonNull
	public Stream<Row> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false)
				.onClose(this::closeCursor);
	}

	/**
	 * Releases the shared cursor, if open. Calling this more than once is a no-op.
	 */
	public void closeCursor() {
		if (this.cursor == null)
			return;

		try {
			releaseCursor();
		} finally {
			this.state = QueryBuilderState.CLOSED;
		}
	}

	@Override
	public void close() {
		closeCursor();
	}

	@NonNull
	public QueryBuilderState getState() {
		return this.state;
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{table=%s, state=%s}", getClass().getSimpleName(), getTable(), getState().name());
	}

	@NonNull
	private QueryBuilder addCondition(@NonNull Conjunction conjunction,
																		@NonNull String column,
																		@Nullable Object value,
																		@NonNull String compare,
																		@Nullable String placeholder) {
		requireNonNull(conjunction);
		requireNonBlank(column, "Column");
		requireNonBlank(compare, "Comparison operator");

		String dialectPlaceholder = this.database.getDialect().getPlaceholder();
		String operator = compare.trim();
		Condition condition;

		if (value == null) {
			String normalizedOperator = operator.toUpperCase(Locale.ENGLISH);

			if (normalizedOperator.equals("=") || normalizedOperator.equals("IS"))
				condition = new Condition(conjunction, format("%s IS NULL", column), null, false);
			else if (normalizedOperator.equals("!=") || normalizedOperator.equals("<>") || normalizedOperator.equals("IS NOT"))
				condition = new Condition(conjunction, format("%s IS NOT NULL", column), null, false);
			else
				throw new IllegalArgumentException(format("Cannot compare column '%s' to NULL with operator '%s'", column, compare));
		} else {
			String rightHandSide = placeholder == null ? dialectPlaceholder : placeholder;

			if (countOccurrences(rightHandSide, dialectPlaceholder) != 1)
				throw new IllegalArgumentException(format("Placeholder '%s' must contain exactly one '%s'", rightHandSide, dialectPlaceholder));

			condition = new Condition(conjunction, format("%s %s %s", column, operator, rightHandSide), value, true);
		}

		beginMutation();
		this.conditions.add(condition);
		return this;
	}

	// Clause methods validate every argument before touching any state
	@NonNull
	private static List<String> validatedColumns(@NonNull String[] columns) {
		requireNonNull(columns);

		List<String> validatedColumns = new ArrayList<>(columns.length);

		for (String column : columns)
			validatedColumns.add(requireNonBlank(column, "Column"));

		return validatedColumns;
	}

	private void beginMutation() {
		if (this.state == QueryBuilderState.EXECUTED)
			throw new QueryBuilderStateException("Cannot change the query while its cursor is open. "
					+ "Read the remaining rows or call closeCursor() first.", this.state);

		this.state = QueryBuilderState.ACCUMULATING;
	}

	@NonNull
	private Cursor openSharedCursor(boolean reexecuteAfterRelease) {
		if (this.state == QueryBuilderState.EXECUTED && this.cursor != null && !this.cursor.isClosed())
			return this.cursor;

		if (this.state == QueryBuilderState.EXECUTED || (this.state == QueryBuilderState.CLOSED && !reexecuteAfterRelease))
			throw new QueryBuilderStateException("The cursor was closed. Change the query or call execute() to run it again.", this.state);

		return execute();
	}

	@NonNull
	private Optional<Row> fetchFromSharedCursor(@NonNull Cursor cursor) {
		try {
			return cursor.fetchOne();
		} catch (RuntimeException e) {
			// A failed fetch closes the cursor, so there is nothing left to release
			this.cursor = null;
			this.state = QueryBuilderState.CLOSED;
			throw e;
		}
	}

	private void exhaust() {
		try {
			releaseCursor();
		} finally {
			this.state = QueryBuilderState.EXHAUSTED;
		}
	}

	private void releaseCursor() {
		Cursor cursor = this.cursor;
		this.cursor = null;

		if (cursor != null)
			cursor.close();
	}

	@NonNull
	private static String requireNonBlank(@Nullable String value,
																				@NonNull String description) {
		if (value == null || value.trim().isEmpty())
			throw new IllegalArgumentException(format("%s must not be blank", description));

		return value;
	}

	private static int countOccurrences(@NonNull String string,
																			@NonNull String substring) {
		int count = 0;

		for (int index = string.indexOf(substring); index >= 0; index = string.indexOf(substring, index + substring.length()))
			++count;

		return count;
	}

	private enum Conjunction {
		AND,
		OR
	}

	private static final class Condition {
		@NonNull
		private final Conjunction conjunction;
		@NonNull
		private final String sql;
		@Nullable
		private final Object value;
		private final boolean bound;

		private Condition(@NonNull Conjunction conjunction,
											@NonNull String sql,
											@Nullable Object value,
											boolean bound) {
			this.conjunction = conjunction;
			this.sql = sql;
			this.value = value;
			this.bound = bound;
		}
	}
}
