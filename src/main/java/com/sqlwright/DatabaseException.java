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

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Root of the exceptions thrown by this library.
 * <p>
 * When a {@link SQLException} appears anywhere in the cause chain, its vendor error code and SQLSTATE are captured and
 * made available through {@link #getErrorCode()} and {@link #getSqlState()}. Errors raised by a PostgreSQL server
 * also carry a {@link ServerError} with the detail, hint and offending object names the server reported.
 * <p>
 * See {@link ConnectionException}, {@link QueryException} and {@link QueryBuilderStateException} for the specific
 * failure kinds.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	private static final String POSTGRES_EXCEPTION_CLASS_NAME = "org.postgresql.util.PSQLException";

	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final ServerError serverError;

	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		SQLException sqlException = findSqlException(cause);

		this.errorCode = sqlException == null ? null : sqlException.getErrorCode();
		this.sqlState = sqlException == null ? null : sqlException.getSQLState();
		this.serverError = sqlException == null ? null : ServerError.fromSqlException(sqlException);
	}

	@Nullable
	private static SQLException findSqlException(@Nullable Throwable cause) {
		// Bounded walk in case of a cyclic cause chain
		Throwable current = cause;

		for (int depth = 0; current != null && depth < 16; ++depth) {
			if (current instanceof SQLException)
				return (SQLException) current;

			current = current.getCause();
		}

		return null;
	}

	/**
	 * @return the vendor error code of the underlying {@link SQLException}, or empty if there is none
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * @return the SQLSTATE of the underlying {@link SQLException}, or empty if there is none
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * @return the structured error reported by a PostgreSQL server, or empty for other databases
	 */
	@NonNull
	public Optional<ServerError> getServerError() {
		return Optional.ofNullable(this.serverError);
	}

	@NonNull
	public Optional<String> getDetail() {
		return getServerError().map(ServerError::getDetail);
	}

	@NonNull
	public Optional<String> getHint() {
		return getServerError().map(ServerError::getHint);
	}

	@NonNull
	public Optional<String> getConstraint() {
		return getServerError().map(ServerError::getConstraint);
	}

	@Override
	@NonNull
	public String toString() {
		StringJoiner details = new StringJoiner(", ", " [", "]").setEmptyValue("");

		if (this.sqlState != null)
			details.add("sqlState=" + this.sqlState);
		if (this.errorCode != null)
			details.add("errorCode=" + this.errorCode);
		if (this.serverError != null)
			details.add("serverError=" + this.serverError);

		String message = getLocalizedMessage();
		return getClass().getName() + (message == null ? "" : ": " + message) + details;
	}

	/**
	 * Fields of an {@code ErrorResponse} sent by a PostgreSQL server. Any of them may be {@code null}.
	 *
	 * @since 1.0.0
	 */
	@Immutable
	public static final class ServerError {
		@Nullable
		private final String severity;
		@Nullable
		private final String detail;
		@Nullable
		private final String hint;
		@Nullable
		private final String schema;
		@Nullable
		private final String table;
		@Nullable
		private final String column;
		@Nullable
		private final String constraint;
		@Nullable
		private final Integer position;

		private ServerError(org.postgresql.util.@NonNull ServerErrorMessage message) {
			this.severity = message.getSeverity();
			this.detail = message.getDetail();
			this.hint = message.getHint();
			this.schema = message.getSchema();
			this.table = message.getTable();
			this.column = message.getColumn();
			this.constraint = message.getConstraint();
			// The driver reports 0 when the server sent no position
			this.position = message.getPosition() > 0 ? message.getPosition() : null;
		}

		@Nullable
		static ServerError fromSqlException(@NonNull SQLException sqlException) {
			// Compare by name so the PostgreSQL driver is only loaded once one of its exceptions exists
			if (!POSTGRES_EXCEPTION_CLASS_NAME.equals(sqlException.getClass().getName()))
				return null;

			org.postgresql.util.ServerErrorMessage message = ((org.postgresql.util.PSQLException) sqlException).getServerErrorMessage();
			return message == null ? null : new ServerError(message);
		}

		@Nullable
		public String getSeverity() {
			return this.severity;
		}

		@Nullable
		public String getDetail() {
			return this.detail;
		}

		@Nullable
		public String getHint() {
			return this.hint;
		}

		@Nullable
		public String getSchema() {
			return this.schema;
		}

		@Nullable
		public String getTable() {
			return this.table;
		}

		@Nullable
		public String getColumn() {
			return this.column;
		}

		@Nullable
		public String getConstraint() {
			return this.constraint;
		}

		/**
		 * @return the 1-based character offset into the statement text where the error was detected
		 */
		@Nullable
		public Integer getPosition() {
			return this.position;
		}

		@Override
		@NonNull
		public String toString() {
			StringJoiner joiner = new StringJoiner(", ", "{", "}");

			if (this.severity != null)
				joiner.add("severity=" + this.severity);
			if (this.detail != null)
				joiner.add("detail=" + this.detail);
			if (this.hint != null)
				joiner.add("hint=" + this.hint);
			if (this.schema != null)
				joiner.add("schema=" + this.schema);
			if (this.table != null)
				joiner.add("table=" + this.table);
			if (this.column != null)
				joiner.add("column=" + this.column);
			if (this.constraint != null)
				joiner.add("constraint=" + this.constraint);
			if (this.position != null)
				joiner.add("position=" + this.position);

			return joiner.toString();
		}
	}
}
