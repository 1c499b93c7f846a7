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

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text tagged with a sequence number. Numbers increase by one for each statement a {@link Database} prepares,
 * which lets log lines for the same statement be correlated.
 *
 * @since 1.0.0
 */
@Immutable
public final class Statement {
	private final long id;
	@NonNull
	private final String sql;

	private Statement(long id,
										@NonNull String sql) {
		this.id = id;
		this.sql = requireNonNull(sql);
	}

	@NonNull
	public static Statement of(long id,
														 @NonNull String sql) {
		return new Statement(id, sql);
	}

	public long getId() {
		return this.id;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof Statement
				&& ((Statement) other).id == this.id
				&& ((Statement) other).sql.equals(this.sql);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.id, this.sql);
	}

	@Override
	@NonNull
	public String toString() {
		// Multi-line SQL collapsed onto one line
		return format("Statement #%d: %s", this.id, this.sql.replaceAll("\\s*\\R\\s*", " ").trim());
	}
}
