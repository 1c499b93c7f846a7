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

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link QueryBuilder} operation is invoked in a state that does not permit it, for example
 * adding a {@code WHERE} condition while a cursor is open, or calling {@link QueryBuilder#fetchNext()}
 * after {@link QueryBuilder#closeCursor()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class QueryBuilderStateException extends DatabaseException {
	@NonNull
	private final QueryBuilderState state;

	/**
	 * Creates a {@code QueryBuilderStateException}.
	 *
	 * @param message a message describing this exception
	 * @param state   the builder state at the time of the failure
	 */
	public QueryBuilderStateException(@NonNull String message,
																		@NonNull QueryBuilderState state) {
		super(requireNonNull(message));
		this.state = requireNonNull(state);
	}

	/**
	 * @return the builder state at the time of the failure
	 */
	@NonNull
	public QueryBuilderState getState() {
		return this.state;
	}
}
