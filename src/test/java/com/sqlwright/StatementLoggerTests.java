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
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class StatementLoggerTests {
	@Test
	public void testFormatting() {
		StatementLog statementLog = StatementLog.withStatement(Statement.of(1L, "SELECT * FROM users WHERE id = ?"), DatabaseType.SQLITE)
				.parameters(Arrays.asList(42, "x".repeat(150), new byte[]{1, 2, 3}, null))
				.executionDuration(Duration.ofMillis(2))
				.fetchDuration(Duration.ofMillis(1))
				.rowCount(3L)
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);

		Assertions.assertTrue(formatted.startsWith("SELECT * FROM users WHERE id = ?\nParameters: 42, '"));
		Assertions.assertTrue(formatted.contains("x".repeat(100) + "...'"), "Long parameters should be ellipsized");
		Assertions.assertTrue(formatted.contains("[byte array of length 3], null"));
		Assertions.assertTrue(formatted.contains("fetching rows"));
		Assertions.assertTrue(formatted.endsWith("3 row[s]"));
		Assertions.assertEquals(Duration.ofMillis(3), statementLog.getTotalDuration());
	}

	@Test
	public void testFailuresLogAtWarning() {
		List<LogRecord> logRecords = new ArrayList<>();
		Logger logger = Logger.getLogger("com.sqlwright.StatementLoggerTests");
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord logRecord) {
				logRecords.add(logRecord);
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};

		logger.addHandler(handler);

		try {
			StatementLog statementLog = StatementLog.withStatement(Statement.of(2L, "SELECT broken"), DatabaseType.GENERIC)
					.exception(new QueryException("SELECT broken", new SQLException("syntax error")))
					.build();

			new DefaultStatementLogger("com.sqlwright.StatementLoggerTests", Level.FINE).log(statementLog);

			Assertions.assertEquals(1, logRecords.size());
			Assertions.assertEquals(Level.WARNING, logRecords.get(0).getLevel());
			Assertions.assertTrue(logRecords.get(0).getMessage().contains("Failed due to java.sql.SQLException: syntax error"));
		} finally {
			logger.removeHandler(handler);
		}
	}

	@Test
	public void testLoggerFailureSurfacesAfterSuccess() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqliteInMemory().build();
		Database database = Database.withConfiguration(configuration)
				.statementLogger(statementLog -> {
					throw new IllegalStateException("logger failed");
				})
				.build();

		try {
			IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
					() -> database.action("CREATE TABLE t (id INTEGER)"));

			Assertions.assertEquals("logger failed", e.getMessage());
			Assertions.assertEquals(1, database.getExecutionLog().size(), "The statement is still recorded");
		} finally {
			database.close();
		}
	}

	@Test
	public void testLoggerFailureIsSuppressedOnStatementFailure() {
		DatabaseConfiguration configuration = DatabaseConfiguration.forSqliteInMemory().build();
		Database database = Database.withConfiguration(configuration)
				.statementLogger(statementLog -> {
					throw new IllegalStateException("logger failed");
				})
				.build();

		try {
			QueryException e = Assertions.assertThrows(QueryException.class, () -> database.action("DELETE FROM nowhere"));

			Assertions.assertEquals(1, e.getSuppressed().length);
			Assertions.assertEquals("logger failed", e.getSuppressed()[0].getMessage());
		} finally {
			database.close();
		}
	}
}
