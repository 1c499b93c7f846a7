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
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DatabaseConfigurationTests {
	@Test
	public void testSqliteDefaults() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqlite("").build();

		Assertions.assertEquals(DatabaseConfiguration.DEFAULT_SQLITE_DIRECTORY.resolve(DatabaseConfiguration.DEFAULT_SQLITE_FILE_NAME).toAbsolutePath(),
				configuration.getSqlitePath().orElseThrow());
		Assertions.assertFalse(configuration.isSqliteInMemory());
		Assertions.assertEquals(DatabaseConfiguration.DEFAULT_SQLITE_BUSY_TIMEOUT, configuration.getBusyTimeout().orElseThrow());
		Assertions.assertTrue(configuration.isAutoCommit());
		Assertions.assertTrue(configuration.isAutoCreateSchemas());
		Assertions.assertEquals(TransactionIsolation.DEFAULT, configuration.getTransactionIsolation());
		Assertions.assertTrue(configuration.getDialect().orElseThrow() instanceof SqliteDialect);
	}

	@Test
	public void testSqlitePaths() {
		DatabaseConfiguration relative = DatabaseConfiguration.forSqlite("app/data.db").build();
		DatabaseConfiguration absolute = DatabaseConfiguration.forSqlite(Paths.get("/tmp/sqlwright/data.db")).build();

		Assertions.assertEquals(DatabaseConfiguration.DEFAULT_SQLITE_DIRECTORY.resolve("app/data.db").toAbsolutePath(),
				relative.getSqlitePath().orElseThrow());
		Assertions.assertEquals("jdbc:sqlite:/tmp/sqlwright/data.db", new SqliteDialect().jdbcUrl(absolute));
	}

	@Test
	public void testSqliteMemoryUrls() {
		DatabaseConfiguration memory = DatabaseConfiguration.forSqliteInMemory().build();
		DatabaseConfiguration sharedMemory = DatabaseConfiguration.forSqlite("ignored.db").sharedMemory(true).build();

		Assertions.assertTrue(memory.isSqliteInMemory());
		Assertions.assertTrue(memory.getSqlitePath().isEmpty());
		Assertions.assertEquals("jdbc:sqlite::memory:", new SqliteDialect().jdbcUrl(memory));
		Assertions.assertTrue(sharedMemory.isSqliteSharedMemory());
		Assertions.assertEquals("jdbc:sqlite:file::memory:?cache=shared", new SqliteDialect().jdbcUrl(sharedMemory));
		Assertions.assertThrows(IllegalStateException.class, () -> DatabaseConfiguration.forPostgres("app").sharedMemory(true));
	}

	@Test
	public void testPostgresDefaults() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forPostgres("app").password("secret").build();

		Assertions.assertEquals(DatabaseConfiguration.DEFAULT_HOST, configuration.getHost());
		Assertions.assertEquals(DatabaseConfiguration.DEFAULT_POSTGRES_PORT, configuration.getPort());
		Assertions.assertEquals("root", configuration.getUser().orElseThrow());
		Assertions.assertTrue(configuration.getBusyTimeout().isEmpty());
		Assertions.assertFalse(configuration.toString().contains("secret"), "Passwords must not be logged");
		Assertions.assertThrows(IllegalArgumentException.class, () -> DatabaseConfiguration.forPostgres(" "));
	}

	@Test
	public void testValidation() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> DatabaseConfiguration.forPostgres("app").port(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DatabaseConfiguration.forSqliteInMemory().executionLogCapacity(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DatabaseConfiguration.forSqliteInMemory().busyTimeout(Duration.ofSeconds(-1)).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DatabaseConfiguration.forSqliteInMemory()
				.schema("users", "CREATE TABLE users (id INTEGER)")
				.schema("users", "CREATE TABLE users (id INTEGER)")
				.build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> TableSchema.of(" ", "CREATE TABLE x (id INTEGER)"));
	}

	@Test
	public void testSchemasKeepDeclarationOrder() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqliteInMemory()
				.schemas(List.of(TableSchema.of("b", "CREATE TABLE b (id INTEGER)"), TableSchema.of("a", "CREATE TABLE a (id INTEGER)")))
				.schema("c", "CREATE TABLE c (id INTEGER)")
				.build();

		Assertions.assertEquals(List.of("b", "a", "c"), configuration.getSchemas().stream().map(TableSchema::getTableName).toList());
	}

	@Test
	public void testDataSourceDialectOverride() {
		DatabaseConfiguration detected = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testDataSourceDialectOverride")).build();
		DatabaseConfiguration overridden = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testDataSourceDialectOverride"))
				.dialect(new GenericDialect())
				.build();

		Assertions.assertTrue(detected.getDialect().isEmpty());
		Assertions.assertTrue(overridden.getDialect().orElseThrow() instanceof GenericDialect);
		Assertions.assertTrue(detected.getDataSource().isPresent());
	}
}
