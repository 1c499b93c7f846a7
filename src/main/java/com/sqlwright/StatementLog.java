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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * What happened when a {@link Statement} ran: the bound parameters, the time spent in each {@link Phase}, the row
 * count and the failure, if any.
 * <p>
 * Produced by {@link Database} for its {@link StatementLogger} and, when enabled, kept in
 * {@link Database#getExecutionLog()}.
 *
 * @since 1.0.0
 */
@Immutable
public final class StatementLog {
	/**
	 * The timed steps of running a statement, in the order they happen.
	 */
	public enum Phase {
		/**
		 * Opening the connection. Only recorded for the statement that caused the lazy open.
		 */
		CONNECTION_ACQUISITION,
		PREPARATION,
		EXECUTION,
		/**
		 * Reading rows through a {@link Cursor}.
		 */
		FETCH
	}

	@NonNull
	private final Statement statement;
	@NonNull
	private final DatabaseType databaseType;
	@NonNull
	private final List<@Nullable Object> parameters;
	@NonNull
	private final Map<Phase, Duration> durationsByPhase;
	@Nullable
	private final Long rowCount;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		this.statement = builder.statement;
		this.databaseType = builder.databaseType;
		this.parameters = Collections.unmodifiableList(new ArrayList<Object>(builder.parameters));
		this.durationsByPhase = Collections.unmodifiableMap(new EnumMap<>(builder.durationsByPhase));
		this.rowCount = builder.rowCount;
		this.exception = builder.exception;
	}

	@NonNull
	public static Builder withStatement(@NonNull Statement statement,
																			@NonNull DatabaseType databaseType) {
		return new Builder(requireNonNull(statement), requireNonNull(databaseType));
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	@NonNull
	public Optional<Duration> getDuration(@NonNull Phase phase) {
		requireNonNull(phase);
		return Optional.ofNullable(this.durationsByPhase.get(phase));
	}

	/**
	 * @return the recorded phases and their durations, in {@link Phase} order
	 */
	@NonNull
	public Map<Phase, Duration> getDurationsByPhase() {
		return this.durationsByPhase;
	}

	/**
	 * @return the sum of all recorded phases
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.durationsByPhase.values().stream().reduce(Duration.ZERO, Duration::plus);
	}

	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return getDuration(Phase.CONNECTION_ACQUISITION);
	}

	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return getDuration(Phase.PREPARATION);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return getDuration(Phase.EXECUTION);
	}

	@NonNull
	public Optional<Duration> getFetchDuration() {
		return getDuration(Phase.FETCH);
	}

	/**
	 * @return rows read through a cursor, or rows affected by an update
	 */
	@NonNull
	public Optional<Long> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof StatementLog))
			return false;

		StatementLog that = (StatementLog) other;

		return this.statement.equals(that.statement)
				&& this.databaseType == that.databaseType
				&& this.parameters.equals(that.parameters)
				&& this.durationsByPhase.equals(that.durationsByPhase)
				&& Objects.equals(this.rowCount, that.rowCount)
				&& Objects.equals(this.exception, that.exception);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.statement, this.databaseType, this.parameters, this.durationsByPhase, this.rowCount,
				this.exception);
	}

	@Override
	@NonNull
	public String toString() {
		StringBuilder description = new StringBuilder("StatementLog{")
				.append(this.statement)
				.append(" on ").append(this.databaseType)
				.append(", took ").append(getTotalDuration());

		if (!this.parameters.isEmpty())
			description.append(", parameters=").append(this.parameters);
		if (!this.durationsByPhase.isEmpty())
			description.append(", phases=").append(this.durationsByPhase);
		if (this.rowCount != null)
			description.append(", rowCount=").append(this.rowCount);
		if (this.exception != null)
			description.append(", exception=").append(this.exception);

		return description.append('}').toString();
	}

	/**
	 * Collects the measurements for one {@link StatementLog}. {@code null} arguments clear a value.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Statement statement;
		@NonNull
		private final DatabaseType databaseType;
		@NonNull
		private final Map<Phase, Duration> durationsByPhase = new EnumMap<>(Phase.class);
		@NonNull
		private List<?> parameters = List.of();
		@Nullable
		private Long rowCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull Statement statement,
										@NonNull DatabaseType databaseType) {
			this.statement = statement;
			this.databaseType = databaseType;
		}

		@NonNull
		public Builder parameters(@Nullable List<?> parameters) {
			this.parameters = parameters == null ? List.of() : parameters;
			return this;
		}

		@NonNull
		public Builder duration(@NonNull Phase phase,
														@Nullable Duration duration) {
			requireNonNull(phase);

			if (duration == null)
				this.durationsByPhase.remove(phase);
			else
				this.durationsByPhase.put(phase, duration);

			return this;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration duration) {
			return duration(Phase.CONNECTION_ACQUISITION, duration);
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration duration) {
			return duration(Phase.PREPARATION, duration);
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration duration) {
			return duration(Phase.EXECUTION, duration);
		}

		@NonNull
		public Builder fetchDuration(@Nullable Duration duration) {
			return duration(Phase.FETCH, duration);
		}

		@NonNull
		public Builder rowCount(@Nullable Long rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
