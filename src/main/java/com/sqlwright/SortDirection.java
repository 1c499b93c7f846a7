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

/**
 * Direction of a {@link QueryBuilder} {@code ORDER BY} clause.
 *
 * @since 1.0.0
 */
public enum SortDirection {
	ASC("ASC"),
	DESC("DESC");

	@NonNull
	private final String sql;

	SortDirection(@NonNull String sql) {
		this.sql = sql;
	}

	@NonNull
	String getSql() {
		return this.sql;
	}
}
