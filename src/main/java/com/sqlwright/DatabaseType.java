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

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * The database engines this library knows how to talk to. Anything else is {@link #GENERIC}.
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	GENERIC(null, null),
	SQLITE("sqlite", "jdbc:sqlite:"),
	POSTGRESQL("postgres", "jdbc:postgresql:");

	// Lowercase fragment of DatabaseMetaData#getDatabaseProductName() identifying the engine
	@Nullable
	private final String productNameFragment;
	@Nullable
	private final String jdbcUrlPrefix;

	DatabaseType(@Nullable String productNameFragment,
							 @Nullable String jdbcUrlPrefix) {
		this.productNameFragment = productNameFragment;
		this.jdbcUrlPrefix = jdbcUrlPrefix;
	}

	/**
	 * Identifies the engine behind an open connection. The driver-reported product name is checked first and the
	 * connection URL second.
	 *
	 * @param connection an open connection
	 * @return the engine, or {@link #GENERIC} if it is not one we special-case
	 * @throws DatabaseException if the connection metadata cannot be read
	 */
	@NonNull
	public static DatabaseType fromConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		DatabaseMetaData metaData;
		String productName;
		String url;

		try {
			metaData = connection.getMetaData();
			productName = metaData.getDatabaseProductName();
			url = metaData.getURL();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to read connection metadata", e);
		}

		String normalizedProductName = productName == null ? "" : productName.toLowerCase(Locale.ROOT);
		String normalizedUrl = url == null ? "" : url.toLowerCase(Locale.ROOT);

		for (DatabaseType databaseType : values())
			if (databaseType.productNameFragment != null && normalizedProductName.contains(databaseType.productNameFragment))
				return databaseType;

		for (DatabaseType databaseType : values())
			if (databaseType.jdbcUrlPrefix != null && normalizedUrl.startsWith(databaseType.jdbcUrlPrefix))
				return databaseType;

		return GENERIC;
	}
}
