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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Asynchronous facade over a {@link Database}.
 * <p>
 * Every operation is queued on a single worker thread which owns the wrapped database, so operations run one at a
 * time, strictly in submission order, and callers on any thread can share one instance:
 * <pre>{@code
 * try (AsyncDatabase database = AsyncDatabase.wrap(Database.withConfiguration(configuration).build())) {
 *   database.action("INSERT INTO items (name) VALUES (?)", "Orange")
 *     .thenCompose(ignored -> database.builder("items").where("name", "Orange").fetch())
 *     .thenAccept(row -> System.out.println(row));
 * }
 * }</pre>
 * There is no timeout layer; a queued operation can only be abandoned by closing.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class AsyncDatabase implements AutoCloseable {
	@NonNull
	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

	@NonNull
	private final Database database;
	@NonNull
	private final ExecutorService executorService;
	@NonNull
	private final AtomicBoolean closed;
	@NonNull
	private final Logger logger;

	protected AsyncDatabase(@NonNull Database database) {
		requireNonNull(database);

		this.database = database;
		this.closed = new AtomicBoolean(false);
		this.logger = Logger.getLogger(getClass().getName());
		this.executorService = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, format("sqlwright-async-%d", THREAD_COUNTER.incrementAndGet()));
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Wraps {@code database}. From now on it must only be used through the returned instance.
	 *
	 * @param database the database to wrap
	 * @return an asynchronous facade over {@code database}
	 */
	@NonNull
	public static AsyncDatabase wrap(@NonNull Database database) {
		requireNonNull(database);
		return new AsyncDatabase(database);
	}

	/**
	 * Runs an arbitrary operation against the wrapped database on the worker thread.
	 * <p>
	 * The operation must not hand out objects that keep using the database, such as an open {@link Cursor}.
	 *
	 * @param operation the work to run
	 * @param <T>       the result type
	 * @return a future completed with the operation's result
	 */
	@NonNull
	public <T> CompletableFuture<T> submit(@NonNull Function<Database, T> operation) {
		requireNonNull(operation);

		if (this.closed.get())
			return CompletableFuture.failedFuture(new ConnectionException("Database is closed"));

		try {
			return CompletableFuture.supplyAsync(() -> operation.apply(this.database), this.executorService);
		} catch (RejectedExecutionException e) {
			return CompletableFuture.failedFuture(new ConnectionException("Database is closed", e));
		}
	}

	@NonNull
	public CompletableFuture<Long> action(@NonNull String sql,
																				Object @Nullable ... parameters) {
		requireNonNull(sql);
		return submit(database -> database.action(sql, parameters));
	}

	@NonNull
	public CompletableFuture<Optional<Row>> fetchOne(@NonNull String sql,
																									 Object @Nullable ... parameters) {
		requireNonNull(sql);
		return submit(database -> database.fetchOne(sql, parameters));
	}

	@NonNull
	public CompletableFuture<List<Row>> fetchAll(@NonNull String sql,
																							 Object @Nullable ... parameters) {
		requireNonNull(sql);
		return submit(database -> database.fetchAll(sql, parameters));
	}

	@NonNull
	public CompletableFuture<Long> insert(@NonNull String table,
																				@NonNull Map<String, ?> fields) {
		requireNonNull(table);
		requireNonNull(fields);

		return submit(database -> database.insert(table, fields));
	}

	@NonNull
	public CompletableFuture<Optional<Long>> lastInsertId(@NonNull String table) {
		requireNonNull(table);
		return submit(database -> database.lastInsertId(table));
	}

	@NonNull
	public CompletableFuture<Boolean> tableExists(@NonNull String table) {
		requireNonNull(table);
		return submit(database -> database.tableExists(table));
	}

	@NonNull
	public CompletableFuture<List<String>> listTables() {
		return submit(Database::listTables);
	}

	@NonNull
	public CompletableFuture<SchemaResult> createSchemas(@NonNull String... tables) {
		requireNonNull(tables);
		return submit(database -> database.createSchemas(tables));
	}

	@NonNull
	public CompletableFuture<SchemaResult> dropSchemas(@NonNull String... tables) {
		requireNonNull(tables);
		return submit(database -> database.dropSchemas(tables));
	}

	@NonNull
	public CompletableFuture<SchemaResult> recreateSchemas(@NonNull String... tables) {
		requireNonNull(tables);
		return submit(database -> database.recreateSchemas(tables));
	}

	@NonNull
	public CompletableFuture<Boolean> dropTable(@NonNull String table) {
		requireNonNull(table);
		return submit(database -> database.dropTable(table));
	}

	@NonNull
	public CompletableFuture<Void> commit() {
		return submit(database -> {
			database.commit();
			return null;
		});
	}

	@NonNull
	public CompletableFuture<Void> rollback() {
		return submit(database -> {
			database.rollback();
			return null;
		});
	}

	/**
	 * Creates an asynchronous query builder for {@code table}, bound to this database.
	 *
	 * @param table the table to query
	 * @return a new query builder
	 */
	@NonNull
	public AsyncQueryBuilder builder(@NonNull String table) {
		requireNonNull(table);
		return new AsyncQueryBuilder(this, new QueryBuilder(this.database, table));
	}

	/**
	 * Queues closing the wrapped database behind every operation already submitted, then stops the worker thread.
	 *
	 * @return a future completed once the database is closed
	 */
	@NonNull
	public CompletableFuture<Void> closeAsync() {
		if (!this.closed.compareAndSet(false, true))
			return CompletableFuture.completedFuture(null);

		CompletableFuture<Void> future = CompletableFuture.runAsync(this.database::close, this.executorService);
		this.executorService.shutdown();
		getLogger().fine("Async database closing");

		return future;
	}

	/**
	 * Closes as {@link #closeAsync()} does and waits for it. Closing more than once is a no-op.
	 */
	@Override
	public void close() {
		closeAsync().join();
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
