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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Asynchronous counterpart of {@link QueryBuilder}, created by {@link AsyncDatabase#builder(String)}.
 * <p>
 * Clause methods return immediately and are queued on the database's worker thread in call order. A clause that
 * fails there (a bad operator, a change while the cursor is open) is reported by the next terminal call's future,
 * and clauses queued after the failure are skipped up to that terminal call.
 * <pre>{@code
 * asyncDatabase.builder("users")
 *   .where("last_name", "Doe")
 *   .order(SortDirection.ASC, "first_name")
 *   .all()
 *   .thenAccept(rows -> rows.forEach(System.out::println));
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public class AsyncQueryBuilder implements AutoCloseable {
	@NonNull
	private final AsyncDatabase asyncDatabase;
	@NonNull
	private final QueryBuilder queryBuilder;
	// Only touched on the worker thread
	@Nullable
	private RuntimeException deferredFailure;

	AsyncQueryBuilder(@NonNull AsyncDatabase asyncDatabase,
										@NonNull QueryBuilder queryBuilder) {
		requireNonNull(asyncDatabase);
		requireNonNull(queryBuilder);

		this.asyncDatabase = asyncDatabase;
		this.queryBuilder = queryBuilder;
	}

	@NonNull
	public AsyncQueryBuilder select(@NonNull String... columns) {
		requireNonNull(columns);
		return enqueueClause(queryBuilder -> queryBuilder.select(columns));
	}

	@NonNull
	public AsyncQueryBuilder selectDate(@NonNull String... columns) {
		requireNonNull(columns);
		return enqueueClause(queryBuilder -> queryBuilder.selectDate(columns));
	}

	@NonNull
	public AsyncQueryBuilder where(@NonNull String column,
																 @Nullable Object value) {
		requireNonNull(column);
		return enqueueClause(queryBuilder -> queryBuilder.where(column, value));
	}

	@NonNull
	public AsyncQueryBuilder where(@NonNull String column,
																 @Nullable Object value,
																 @NonNull String compare) {
		requireNonNull(column);
		requireNonNull(compare);
		return enqueueClause(queryBuilder -> queryBuilder.where(column, value, compare));
	}

	@NonNull
	public AsyncQueryBuilder where(@NonNull String column,
																 @Nullable Object value,
																 @NonNull String compare,
																 @NonNull String placeholder) {
		requireNonNull(column);
		requireNonNull(compare);
		requireNonNull(placeholder);
		return enqueueClause(queryBuilder -> queryBuilder.where(column, value, compare, placeholder));
	}

	@NonNull
	public AsyncQueryBuilder whereOr(@NonNull String column,
																	 @Nullable Object value) {
		requireNonNull(column);
		return enqueueClause(queryBuilder -> queryBuilder.whereOr(column, value));
	}

	@NonNull
	public AsyncQueryBuilder whereOr(@NonNull String column,
																	 @Nullable Object value,
																	 @NonNull String compare) {
		requireNonNull(column);
		requireNonNull(compare);
		return enqueueClause(queryBuilder -> queryBuilder.whereOr(column, value, compare));
	}

	@NonNull
	public AsyncQueryBuilder whereOr(@NonNull String column,
																	 @Nullable Object value,
																	 @NonNull String compare,
																	 @NonNull String placeholder) {
		requireNonNull(column);
		requireNonNull(compare);
		requireNonNull(placeholder);
		return enqueueClause(queryBuilder -> queryBuilder.whereOr(column, value, compare, placeholder));
	}

	@NonNull
	public AsyncQueryBuilder groupBy(@NonNull String... columns) {
		requireNonNull(columns);
		return enqueueClause(queryBuilder -> queryBuilder.groupBy(columns));
	}

	@NonNull
	public AsyncQueryBuilder order(@NonNull String... columns) {
		requireNonNull(columns);
		return enqueueClause(queryBuilder -> queryBuilder.order(columns));
	}

	@NonNull
	public AsyncQueryBuilder order(@NonNull SortDirection direction,
																 @NonNull String... columns) {
		requireNonNull(direction);
		requireNonNull(columns);
		return enqueueClause(queryBuilder -> queryBuilder.order(direction, columns));
	}

	@NonNull
	public AsyncQueryBuilder limit(long limit) {
		return enqueueClause(queryBuilder -> queryBuilder.limit(limit));
	}

	@NonNull
	public AsyncQueryBuilder limit(long limit,
																 long offset) {
		return enqueueClause(queryBuilder -> queryBuilder.limit(limit, offset));
	}

	@NonNull
	public AsyncQueryBuilder streaming(int fetchSize) {
		return enqueueClause(queryBuilder -> queryBuilder.streaming(fetchSize));
	}

	@NonNull
	public CompletableFuture<String> buildQuery() {
		return enqueueTerminal(QueryBuilder::buildQuery);
	}

	@NonNull
	public CompletableFuture<List<@Nullable Object>> getParameters() {
		return enqueueTerminal(QueryBuilder::getParameters);
	}

	@NonNull
	public CompletableFuture<Optional<Row>> fetch() {
		return enqueueTerminal(QueryBuilder::fetch);
	}

	@NonNull
	public CompletableFuture<Optional<Row>> fetchNext() {
		return enqueueTerminal(QueryBuilder::fetchNext);
	}

	@NonNull
	public CompletableFuture<List<Row>> all() {
		return enqueueTerminal(QueryBuilder::all);
	}

	@NonNull
	public CompletableFuture<Optional<Row>> get(int index) {
		return enqueueTerminal(queryBuilder -> queryBuilder.get(index));
	}

	@NonNull
	public CompletableFuture<QueryBuilderState> getState() {
		return enqueueTerminal(QueryBuilder::getState);
	}

	@NonNull
	public CompletableFuture<Void> closeCursor() {
		return enqueueTerminal(queryBuilder -> {
			queryBuilder.closeCursor();
			return null;
		});
	}

	/**
	 * Queues {@link #closeCursor()} and waits for it. Does nothing once the {@link AsyncDatabase} is closed, since
	 * closing it already released the cursor along with the connection.
	 */
	@Override
	public void close() {
		if (this.asyncDatabase.isClosed())
			return;

		closeCursor().join();
	}

	@NonNull
	public String getTable() {
		return this.queryBuilder.getTable();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{table=%s}", getClass().getSimpleName(), getTable());
	}

	@NonNull
	private AsyncQueryBuilder enqueueClause(@NonNull Consumer<QueryBuilder> clause) {
		requireNonNull(clause);

		this.asyncDatabase.submit(database -> {
			if (this.deferredFailure == null) {
				try {
					clause.accept(this.queryBuilder);
				} catch (RuntimeException e) {
					this.deferredFailure = e;
				}
			}

			return null;
		});

		return this;
	}

	@NonNull
	private <T> CompletableFuture<T> enqueueTerminal(@NonNull Function<QueryBuilder, T> terminal) {
		requireNonNull(terminal);

		return this.asyncDatabase.submit(database -> {
			RuntimeException deferredFailure = this.deferredFailure;

			if (deferredFailure != null) {
				this.deferredFailure = null;
				throw deferredFailure;
			}

			return terminal.apply(this.queryBuilder);
		});
	}
}
