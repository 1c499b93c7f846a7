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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Dialect for any JDBC database without special handling.
 * <p>
 * Connections come from the configured {@link javax.sql.DataSource}, and table metadata is read through
 * {@link java.sql.DatabaseMetaData}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class GenericDialect implements Dialect {
	@NonNull
	@Override
	public DatabaseType getDatabaseType() {
		return DatabaseType.GENERIC;
	}

	@NonNull
	@Override
	public Connection openConnection(@NonNull DatabaseConfiguration configuration) {
		requireNonNull(configuration);
		throw new ConnectionException("A generic database needs a DataSource. Use DatabaseConfiguration.forDataSource(...)");
	}

	@NonNull
	@Override
	public Optional<String> getTableExistsQuery() {
		return Optional.empty();
	}

	@NonNull
	@Override
	public List<Object> tableExistsParameters(@NonNull String schemaName,
																						@NonNull String tableName) {
		requireNonNull(tableName);
		return List.of(tableName);
	}

	@NonNull
	@Override
	public Optional<String> getTableListQuery() {
		return Optional.empty();
	}

	@NonNull
	@Override
	public List<Object> tableListParameters(@NonNull String schemaName) {
		return List.of();
	}

	@NonNull
	@Override
	public String isoDateProjection(@NonNull String column) {
		requireNonNull(column);
		throw new UnsupportedOperationException("ISO date projection is not available for generic databases");
	}
}
