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
import java.util.List;
import java.util.Map;

/**
 * Runs against an in-memory HSQLDB {@link javax.sql.DataSource}, which needs no dialect-specific handling.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class GenericDatabaseTests {
	private static final String PEOPLE_TABLE_SQL = "CREATE TABLE people ("
			+ "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
			+ "first_name VARCHAR(50), "
			+ "last_name VARCHAR(50))";

	public record Person(Integer id, String firstName, String lastName) {}

	@Test
	public void testDialectIsDetected() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testDialectIsDetected"))
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertTrue(configuration.getDialect().isEmpty());
			Assertions.assertEquals(DatabaseType.GENERIC, database.getDatabaseType());
			Assertions.assertTrue(database.getDialect() instanceof GenericDialect);
		}
	}

	@Test
	public void testSchemasUseMetadata() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testSchemasUseMetadata"))
				.schema("people", PEOPLE_TABLE_SQL)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertTrue(database.tableExists("people"));
			Assertions.assertTrue(database.tableExists("PEOPLE"));
			Assertions.assertFalse(database.tableExists("places"));
			Assertions.assertEquals(List.of("PEOPLE"), database.listTables());
			Assertions.assertEquals(List.of("people"), database.createSchemas().getSkippedTables());
			Assertions.assertTrue(database.dropTable("people"));
			Assertions.assertFalse(database.tableExists("people"));
		}
	}

	@Test
	public void testUppercaseLabelsResolve() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testUppercaseLabelsResolve"))
				.schema("people", PEOPLE_TABLE_SQL)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			database.insert("people", Map.of("first_name", "Ada"));

			Row row = database.builder("people").where("first_name", "Ada").fetch().get();

			Assertions.assertEquals("FIRST_NAME", row.getColumnNames().get(1));
			Assertions.assertEquals("Ada", row.get("first_name"));
			Assertions.assertEquals("Ada", row.as(Person.class).firstName());
			Assertions.assertNull(row.as(Person.class).lastName());
		}
	}

	@Test
	public void testBuilderLimitAndOffset() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testBuilderLimitAndOffset"))
				.schema("people", PEOPLE_TABLE_SQL)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			for (String firstName : List.of("A", "B", "C", "D"))
				database.insert("people", Map.of("first_name", firstName));

			List<Row> rows = database.builder("people")
					.order(SortDirection.ASC, "first_name")
					.limit(2, 1)
					.all();

			Assertions.assertEquals(2, rows.size());
			Assertions.assertEquals("B", rows.get(0).getString("first_name"));
			Assertions.assertEquals("C", rows.get(1).getString("first_name"));
		}
	}

	@Test
	public void testUnsupportedDialectFeatures() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testUnsupportedDialectFeatures"))
				.schema("people", PEOPLE_TABLE_SQL)
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertThrows(DatabaseException.class, () -> database.lastInsertId("people"));
			Assertions.assertThrows(UnsupportedOperationException.class, () -> database.builder("people").selectDate("id"));
		}
	}

	@Test
	public void testConfiguredTableQueriesOverrideMetadata() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testConfiguredTableQueriesOverrideMetadata"))
				.schema("people", PEOPLE_TABLE_SQL)
				.tableExistsQuery("SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC' AND LOWER(TABLE_NAME) = ?")
				.tableListQuery("SELECT LOWER(TABLE_NAME) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC'")
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertTrue(database.tableExists("people"));
			Assertions.assertEquals(List.of("people"), database.listTables());
		}
	}

	@Test
	public void testConnectionFailureIsReported() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forDataSource(TestDatabases.createInMemoryDataSource("testConnectionFailureIsReported;ifexists=true"))
				.build();

		try (Database database = Database.withConfiguration(configuration).build()) {
			Assertions.assertThrows(ConnectionException.class, database::listTables);
		}
	}
}
