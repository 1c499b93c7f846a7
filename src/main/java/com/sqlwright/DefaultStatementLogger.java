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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link StatementLogger} that writes to a {@code java.util.logging} logger, by default
 * <code>{@value #DEFAULT_LOGGER_NAME}</code> at {@link Level#FINE}.
 * <p>
 * Failed statements are raised to {@link Level#WARNING} so they show up under a stock logging configuration.
 * Subclasses may override {@link #formatStatementLog(StatementLog)} or {@link #formatParameter(Object)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.sqlwright.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	// Longer string parameters are truncated
	private static final int PARAMETER_DISPLAY_LIMIT = 100;

	@NonNull
	private static final Map<StatementLog.Phase, String> PHASE_DESCRIPTIONS = Map.of(
			StatementLog.Phase.CONNECTION_ACQUISITION, "acquiring connection",
			StatementLog.Phase.PREPARATION, "preparing statement",
			StatementLog.Phase.EXECUTION, "executing statement",
			StatementLog.Phase.FETCH, "fetching rows");

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	public DefaultStatementLogger(@NonNull String loggerName,
																@NonNull Level loggerLevel) {
		this.logger = Logger.getLogger(requireNonNull(loggerName));
		this.loggerLevel = requireNonNull(loggerLevel);
	}

	@Override
	public void log(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		Level level = getLoggerLevel();

		if (statementLog.getException().isPresent() && level.intValue() < Level.WARNING.intValue())
			level = Level.WARNING;

		if (getLogger().isLoggable(level))
			getLogger().log(level, formatStatementLog(statementLog));
	}

	/**
	 * Renders a log entry as newline-separated lines: the SQL, then parameters, phase timings, row count and failure,
	 * each only when present.
	 */
	@NonNull
	protected String formatStatementLog(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		StringJoiner lines = new StringJoiner("\n");
		lines.add(statementLog.getStatement().getSql());

		List<@Nullable Object> parameters = statementLog.getParameters();

		if (!parameters.isEmpty()) {
			StringJoiner formattedParameters = new StringJoiner(", ", "Parameters: ", "");

			for (Object parameter : parameters)
				formattedParameters.add(formatParameter(parameter));

			lines.add(formattedParameters.toString());
		}

		if (!statementLog.getDurationsByPhase().isEmpty()) {
			StringJoiner timings = new StringJoiner(", ");

			for (Map.Entry<StatementLog.Phase, Duration> entry : statementLog.getDurationsByPhase().entrySet())
				timings.add(format("%s %s", entry.getValue(), PHASE_DESCRIPTIONS.get(entry.getKey())));

			lines.add(timings.toString());
		}

		statementLog.getRowCount().ifPresent(rowCount -> lines.add(format("%d row[s]", rowCount)));

		statementLog.getException().ifPresent(exception -> {
			// Report what the driver said rather than our wrapper
			Throwable reported = exception instanceof DatabaseException && exception.getCause() != null
					? exception.getCause() : exception;
			lines.add("Failed due to " + reported);
		});

		return lines.toString();
	}

	@NonNull
	protected String formatParameter(@Nullable Object parameter) {
		if (parameter == null || parameter instanceof Number || parameter instanceof Boolean)
			return String.valueOf(parameter);

		if (parameter instanceof byte[])
			return format("[byte array of length %d]", ((byte[]) parameter).length);

		String text = parameter.toString().trim();

		if (text.length() > PARAMETER_DISPLAY_LIMIT)
			text = text.substring(0, PARAMETER_DISPLAY_LIMIT) + "...";

		return "'" + text + "'";
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
