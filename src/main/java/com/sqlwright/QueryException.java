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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

/**
 * Thrown when the driver rejects a statement: malformed SQL, a constraint violation, a type mismatch, or a failure
 * while reading results.
 * <p>
 * The driver's own message is preserved as this exception's message.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryException extends DatabaseException {
	@Nullable
	private final String sql;

	/**
	 * Creates a {@code QueryException} for the given {@code sql} which wraps the given {@code cause}.
	 *
	 * @param sql   the statement that failed
	 * @param cause the cause of this exception
	 */
	public QueryException(@Nullable String sql,
												@Nullable Throwable cause) {
		super(cause == null ? null : cause.getMessage(), cause);
		this.sql = sql;
	}

	/**
	 * Creates a {@code QueryException} for the given {@code sql}.
	 *
	 * @param message a message describing this exception
	 * @param sql     the statement that failed
	 * @param cause   the cause of this exception
	 */
	public QueryException(@Nullable String message,
												@Nullable String sql,
												@Nullable Throwable cause) {
		super(message, cause);
		this.sql = sql;
	}

	/**
	 * @return the SQL that failed, or empty if not available
	 */
	@NonNull
	public Optional<String> getSql() {
		return Optional.ofNullable(this.sql);
	}
}
