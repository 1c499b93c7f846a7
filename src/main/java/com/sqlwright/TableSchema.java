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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A table name paired with the statement that creates it.
 * <p>
 * Declared on a {@link DatabaseConfiguration}, in creation order, so a {@link Database} can create missing tables
 * and drop them again (in reverse order).
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TableSchema {
	@NonNull
	private final String tableName;
	@NonNull
	private final String createStatement;

	private TableSchema(@NonNull String tableName,
											@NonNull String createStatement) {
		requireNonNull(tableName);
		requireNonNull(createStatement);

		if (tableName.trim().isEmpty())
			throw new IllegalArgumentException("Table name must not be blank");

		if (createStatement.trim().isEmpty())
			throw new IllegalArgumentException(format("Create statement for table '%s' must not be blank", tableName));

		this.tableName = tableName;
		this.createStatement = createStatement;
	}

	@NonNull
	public static TableSchema of(@NonNull String tableName,
															 @NonNull String createStatement) {
		return new TableSchema(tableName, createStatement);
	}

	@NonNull
	public String getTableName() {
		return this.tableName;
	}

	@NonNull
	public String getCreateStatement() {
		return this.createStatement;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TableSchema))
			return false;

		TableSchema tableSchema = (TableSchema) object;

		return Objects.equals(tableSchema.getTableName(), getTableName())
				&& Objects.equals(tableSchema.getCreateStatement(), getCreateStatement());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTableName(), getCreateStatement());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{tableName=%s}", getClass().getSimpleName(), getTableName());
	}
}
