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
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class SqliteDatabaseTests {
	public record User(Long id, String firstName, String lastName, String address) {}

	@Test
	public void testSchemasAreCreatedOnConstruction() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			Assertions.assertEquals(DatabaseType.SQLITE, database.getDatabaseType());
			Assertions.assertTrue(database.tableExists("users"));
			Assertions.assertTrue(database.tableExists("items"));
			Assertions.assertFalse(database.tableExists("orders"));
			Assertions.assertTrue(database.listTables().containsAll(List.of("users", "items")));
		}
	}

	@Test
	public void testCreateSchemasSkipsExistingTables() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			SchemaResult schemaResult = database.createSchemas();

			Assertions.assertEquals(0, schemaResult.getCreatedCount());
			Assertions.assertEquals(List.of("users", "items"), schemaResult.getSkippedTables());
			Assertions.assertThrows(IllegalArgumentException.class, () -> database.createSchemas("orders"));
		}
	}

	@Test
	public void testAutoCreateCanBeDisabled() {
		try (Database database = Database.withConfiguration(TestDatabases.sqliteWithUsers().autoCreateSchemas(false).build()).build()) {
			Assertions.assertFalse(database.tableExists("users"));

			SchemaResult schemaResult = database.createSchemas("users");

			Assertions.assertEquals(List.of("users"), schemaResult.getCreatedTables());
			Assertions.assertTrue(database.tableExists("users"));
			Assertions.assertFalse(database.tableExists("items"));
		}
	}

	@Test
	public void testDropAndRecreateSchemas() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			TestDatabases.insertUsers(database);

			SchemaResult dropResult = database.dropSchemas();

			Assertions.assertEquals(List.of("items", "users"), dropResult.getDroppedTables(), "Tables should drop in reverse order");
			Assertions.assertFalse(database.tableExists("users"));
			Assertions.assertEquals(List.of("users"), database.dropSchemas("users").getSkippedTables());

			SchemaResult recreateResult = database.recreateSchemas();

			Assertions.assertEquals(List.of("users", "items"), recreateResult.getCreatedTables());
			Assertions.assertEquals(0L, database.fetchOne("SELECT COUNT(*) AS total FROM users").get().getLong("total"));
		}
	}

	@Test
	public void testDropTables() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			database.action("CREATE TABLE scratch (id INTEGER)");

			Map<String, Boolean> results = database.dropTables("scratch", "missing");

			Assertions.assertEquals(Boolean.TRUE, results.get("scratch"));
			Assertions.assertEquals(Boolean.FALSE, results.get("missing"));
			Assertions.assertThrows(IllegalArgumentException.class, () -> database.dropTable("users; DROP TABLE items"));
		}
	}

	@Test
	public void testActionReturnsAffectedRowCount() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			TestDatabases.insertUsers(database);

			long updated = database.action("UPDATE users SET address = ? WHERE last_name = ?", "Unknown", "Doe");

			Assertions.assertEquals(2L, updated);
			Assertions.assertEquals(0L, database.action("DELETE FROM users WHERE last_name = ?", "Nobody"));
		}
	}

	@Test
	public void testFetchOneAndFetchAll() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			Assertions.assertTrue(database.fetchOne("SELECT * FROM users").isEmpty());
			Assertions.assertTrue(database.fetchAll("SELECT * FROM users").isEmpty());

			TestDatabases.insertUsers(database);

			Row row = database.fetchOne("SELECT * FROM users WHERE first_name = ?", "John").get();

			Assertions.assertEquals("Doe", row.get("last_name"));
			Assertions.assertEquals("John", row.get(1));
			Assertions.assertEquals(4, database.fetchAll("SELECT * FROM users").size());
		}
	}

	@Test
	public void testInsertAndLastInsertId() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			Map<String, Object> fields = new LinkedHashMap<>();
			fields.put("first_name", "Chris");
			fields.put("last_name", "Example");

			Assertions.assertTrue(database.lastInsertId("users").isEmpty(), "Nothing inserted on this connection yet");
			Assertions.assertEquals(1L, database.insert("users", fields));

			Long id = database.lastInsertId("users").orElseThrow();
			User user = database.fetchOne("SELECT * FROM users WHERE id = ?", id).get().as(User.class);

			Assertions.assertEquals("Chris", user.firstName());
			Assertions.assertEquals("Example", user.lastName());
			Assertions.assertNull(user.address());
			Assertions.assertThrows(IllegalArgumentException.class, () -> database.insert("users", Map.of()));
		}
	}

	@Test
	public void testQueryCursor() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			TestDatabases.insertUsers(database);

			try (Cursor cursor = database.query("SELECT first_name FROM users ORDER BY id")) {
				Assertions.assertTrue(cursor.hasResultSet());
				Assertions.assertEquals(List.of("first_name"), cursor.getColumnNames());
				Assertions.assertEquals("John", cursor.fetchOne().get().get("first_name"));
				Assertions.assertEquals(2, cursor.fetchMany(2).size());
				Assertions.assertEquals(1, cursor.fetchAll().size());
				Assertions.assertTrue(cursor.fetchOne().isEmpty());
				Assertions.assertEquals(4L, cursor.getRowCount());
			}

			Cursor cursor = database.query("SELECT * FROM users");
			cursor.close();
			cursor.close();

			Assertions.assertThrows(DatabaseException.class, cursor::fetchOne);
		}
	}

	@Test
	public void testCursorIteration() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			TestDatabases.insertUsers(database);

			List<String> firstNames = new ArrayList<>();

			try (Cursor cursor = database.query("SELECT first_name FROM users ORDER BY first_name")) {
				for (Row row : cursor)
					firstNames.add(row.getString("first_name"));
			}

			Assertions.assertEquals(List.of("Aaron", "Dave", "Jane", "John"), firstNames);
		}
	}

	@Test
	public void testBadSqlThrowsQueryException() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			QueryException e = Assertions.assertThrows(QueryException.class, () -> database.fetchAll("SELECT * FROM nowhere"));

			Assertions.assertEquals(Optional.of("SELECT * FROM nowhere"), e.getSql());
			Assertions.assertTrue(e.getErrorCode().isPresent(), "Driver error codes are carried over");
			Assertions.assertTrue(database.getExecutionLog().get(database.getExecutionLog().size() - 1).getException().isPresent());
		}
	}

	@Test
	public void testExecutionLog() {
		try (Database database = TestDatabases.createSqliteDatabase()) {
			database.clearExecutionLog();
			database.action("INSERT INTO users (first_name) VALUES (?)", "Logged");
			database.fetchAll("SELECT * FROM users");

			List<StatementLog> executionLog = database.getExecutionLog();

			Assertions.assertEquals(2, executionLog.size());
			Assertions.assertEquals("INSERT INTO users (first_name) VALUES (?)", executionLog.get(0).getStatement().getSql());
			Assertions.assertEquals(List.of("Logged"), executionLog.get(0).getParameters());
			Assertions.assertEquals(Optional.of(1L), executionLog.get(0).getRowCount());
			Assertions.assertEquals(Optional.of(1L), executionLog.get(1).getRowCount());
			Assertions.assertTrue(executionLog.get(1).getStatement().getId() > executionLog.get(0).getStatement().getId());
		}
	}

	@Test
	public void testExecutionLogIsBounded() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqliteInMemory()
				.executionLogCapacity(3)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			for (int i = 0; i < 5; ++i)
				database.fetchOne("SELECT ? AS value", i);

			List<StatementLog> executionLog = database.getExecutionLog();

			Assertions.assertEquals(3, executionLog.size());
			Assertions.assertEquals(List.of(2), executionLog.get(0).getParameters());
		}
	}

	@Test
	public void testStatementLoggerReceivesEveryStatement() {
		List<StatementLog> statementLogs = new ArrayList<>();
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqliteInMemory()
				.executionLogEnabled(false)
				.build();

		try (Database database = Database.withConfiguration(configuration).statementLogger(statementLogs::add).build()) {
			database.action("CREATE TABLE t (id INTEGER)");
			database.fetchAll("SELECT * FROM t");

			Assertions.assertEquals(2, statementLogs.size());
			Assertions.assertTrue(database.getExecutionLog().isEmpty());
			Assertions.assertEquals(DatabaseType.SQLITE, statementLogs.get(1).getDatabaseType());
		}
	}

	@Test
	public void testClosedDatabaseRejectsUse() {
		Database database = TestDatabases.createSqliteDatabase();
		database.close();
		database.close();

		Assertions.assertTrue(database.isClosed());
		Assertions.assertThrows(ConnectionException.class, () -> database.fetchAll("SELECT * FROM users"));
	}

	@Test
	public void testManualCommitAndRollback() {
		DatabaseConfiguration configuration = TestDatabases.sqliteWithUsers()
				.autoCommit(false)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			database.action("INSERT INTO users (first_name) VALUES (?)", "Kept");
			database.commit();
			database.action("INSERT INTO users (first_name) VALUES (?)", "Discarded");
			database.rollback();

			List<Row> rows = database.fetchAll("SELECT first_name FROM users");

			Assertions.assertEquals(1, rows.size());
			Assertions.assertEquals("Kept", rows.get(0).get("first_name"));
		}
	}

	@Test
	public void testFileDatabaseCreatesParentDirectories(@TempDir Path temporaryDirectory) {
		Path databaseFile = temporaryDirectory.resolve("nested").resolve("test.db");
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqlite(databaseFile)
				.schema("users", TestDatabases.USERS_TABLE_SQL)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			database.action("INSERT INTO users (first_name) VALUES (?)", "Persisted");
		}

		Assertions.assertTrue(Files.exists(databaseFile));

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertEquals("Persisted", database.fetchOne("SELECT first_name FROM users").get().get(0));
		}
	}

	@Test
	public void testSharedMemoryDatabaseIsVisibleAcrossInstances() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqliteInMemory()
				.sharedMemory(true)
				.schema("shared_values", "CREATE TABLE shared_values (value TEXT)")
				.build();

		try (Database first = Database.withConfiguration(configuration).build();
				 Database second = Database.withConfiguration(configuration).build()) {
			first.action("INSERT INTO shared_values (value) VALUES (?)", "hello");

			Assertions.assertEquals("hello", second.fetchOne("SELECT value FROM shared_values").get().get("value"));
		}
	}
}
