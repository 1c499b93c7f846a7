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

/**
 * Receives a {@link StatementLog} for every statement a {@link Database} runs.
 * <p>
 * Statements whose results are discarded are reported as soon as they finish. Queries read through a
 * {@link Cursor} are reported when the cursor closes, so the log includes result-reading time and the row count.
 * <p>
 * A {@link Database} may be shared between threads, so implementations must be threadsafe. If an implementation
 * throws while the statement itself failed, the logging failure is attached to the statement's exception as a
 * suppressed exception.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface StatementLogger {
	void log(@NonNull StatementLog statementLog);
}
