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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class AsyncDatabaseTests {
	@Test
	public void testOperationsRunInSubmissionOrder() {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			List<Integer> completionOrder = Collections.synchronizedList(new ArrayList<>());
			List<CompletableFuture<Long>> futures = new ArrayList<>();

			for (int i = 0; i < 20; ++i) {
				int index = i;
				futures.add(database.action("INSERT INTO items (name) VALUES (?)", "Item " + i)
						.whenComplete((result, throwable) -> completionOrder.add(index)));
			}

			CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

			List<Row> rows = database.fetchAll("SELECT name FROM items ORDER BY id").join();

			Assertions.assertEquals(20, rows.size());
			Assertions.assertEquals("Item 0", rows.get(0).get("name"));
			Assertions.assertEquals("Item 19", rows.get(19).get("name"));

			for (int i = 0; i < 20; ++i)
				Assertions.assertEquals(i, completionOrder.get(i));
		}
	}

	@Test
	public void testConcurrentCallers() throws InterruptedException {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			int threadCount = 4;
			CountDownLatch countDownLatch = new CountDownLatch(threadCount);
			List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

			for (int i = 0; i < threadCount; ++i) {
				int threadIndex = i;

				new Thread(() -> {
					try {
						for (int j = 0; j < 10; ++j)
							database.insert("items", Map.of("name", "Thread " + threadIndex)).join();
					} catch (Throwable t) {
						failures.add(t);
					} finally {
						countDownLatch.countDown();
					}
				}).start();
			}

			Assertions.assertTrue(countDownLatch.await(30, TimeUnit.SECONDS));
			Assertions.assertTrue(failures.isEmpty(), "Concurrent inserts failed: " + failures);
			Assertions.assertEquals(40L, database.fetchOne("SELECT COUNT(*) AS total FROM items").join().get().getLong("total"));
		}
	}

	@Test
	public void testFailuresCompleteExceptionally() {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			CompletionException e = Assertions.assertThrows(CompletionException.class,
					() -> database.fetchAll("SELECT * FROM nowhere").join());

			Assertions.assertTrue(e.getCause() instanceof QueryException);
			Assertions.assertTrue(database.tableExists("users").join(), "A failure should not break later operations");
		}
	}

	@Test
	public void testSchemaOperations() {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			Assertions.assertEquals(List.of("items", "users"), database.dropSchemas().join().getDroppedTables());
			Assertions.assertFalse(database.dropTable("users").join());
			Assertions.assertEquals(List.of("users"), database.createSchemas("users").join().getCreatedTables());
			Assertions.assertEquals(2, database.recreateSchemas().join().getCreatedCount());
			Assertions.assertTrue(database.listTables().join().contains("items"));
		}
	}

	@Test
	public void testInsertAndLastInsertId() {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			database.insert("items", Map.of("name", "Orange"));
			Optional<Long> id = database.lastInsertId("items").join();

			Assertions.assertEquals(Optional.of(1L), id);
			Assertions.assertEquals("Orange", database.submit(db -> db.fetchOne("SELECT name FROM items WHERE id = ?", id.get())
					.map(row -> row.getString("name"))
					.orElse(null)).join());
		}
	}

	@Test
	public void testAsyncQueryBuilder() {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			database.submit(db -> {
				TestDatabases.insertUsers(db);
				return null;
			}).join();

			AsyncQueryBuilder queryBuilder = database.builder("users")
					.where("last_name", "Doe")
					.order(SortDirection.ASC, "first_name");

			Assertions.assertEquals("SELECT * FROM users WHERE last_name = ? ORDER BY first_name ASC", queryBuilder.buildQuery().join());
			Assertions.assertEquals("Jane", queryBuilder.fetchNext().join().get().get("first_name"));
			Assertions.assertEquals(QueryBuilderState.EXECUTED, queryBuilder.getState().join());

			queryBuilder.close();

			Assertions.assertEquals(QueryBuilderState.CLOSED, queryBuilder.getState().join());
			Assertions.assertEquals(2, queryBuilder.all().join().size());
			Assertions.assertEquals(QueryBuilderState.EXHAUSTED, queryBuilder.getState().join());
			Assertions.assertEquals("John", queryBuilder.get(1).join().get().get("first_name"));
		}
	}

	@Test
	public void testAsyncQueryBuilderDefersClauseFailures() {
		try (AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase())) {
			AsyncQueryBuilder queryBuilder = database.builder("users")
					.where("id", null, ">")
					.limit(1);

			CompletionException e = Assertions.assertThrows(CompletionException.class, () -> queryBuilder.fetch().join());

			Assertions.assertTrue(e.getCause() instanceof IllegalArgumentException);
			Assertions.assertTrue(queryBuilder.fetch().join().isEmpty(), "The failure is reported once");
		}
	}

	@Test
	public void testQueryBuilderCloseAfterDatabaseClose() {
		AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase());

		try (AsyncQueryBuilder queryBuilder = database.builder("users")) {
			Assertions.assertTrue(queryBuilder.fetchNext().join().isEmpty());
			database.close();
		}

		Assertions.assertTrue(database.isClosed());
	}

	@Test
	public void testClose() {
		AsyncDatabase database = AsyncDatabase.wrap(TestDatabases.createSqliteDatabase());

		database.action("INSERT INTO items (name) VALUES (?)", "Queued before close");
		database.close();
		database.close();

		Assertions.assertTrue(database.isClosed());

		CompletionException e = Assertions.assertThrows(CompletionException.class, () -> database.listTables().join());

		Assertions.assertTrue(e.getCause() instanceof ConnectionException);
	}
}
