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

/**
 * Lifecycle of a {@link QueryBuilder}.
 *
 * @since 1.0.0
 */
public enum QueryBuilderState {
	/**
	 * Just constructed, no clauses added.
	 */
	EMPTY,
	/**
	 * One or more clause-setting calls were made since the last build.
	 */
	ACCUMULATING,
	/**
	 * SQL was generated and no clause has changed since.
	 */
	BUILT,
	/**
	 * The builder's shared cursor is open.
	 */
	EXECUTED,
	/**
	 * Every row of the shared cursor was consumed and the cursor was released.
	 */
	EXHAUSTED,
	/**
	 * The shared cursor was released explicitly via {@link QueryBuilder#closeCursor()}.
	 */
	CLOSED
}
