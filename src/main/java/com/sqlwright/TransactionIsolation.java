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

import java.sql.Connection;
import java.util.Optional;

/**
 * Transaction isolation requested for a {@link Database}'s connection. Applied once, right after the connection is
 * opened.
 * <p>
 * SQLite only distinguishes {@link #SERIALIZABLE} (its default) from {@link #READ_UNCOMMITTED} (shared-cache mode).
 *
 * @since 1.0.0
 */
public enum TransactionIsolation {
	/**
	 * Keep whatever the driver picked.
	 */
	DEFAULT,
	READ_UNCOMMITTED,
	READ_COMMITTED,
	REPEATABLE_READ,
	SERIALIZABLE;

	/**
	 * @return the matching {@code Connection.TRANSACTION_*} constant, or empty for {@link #DEFAULT}
	 */
	@NonNull
	Optional<Integer> getJdbcLevel() {
		switch (this) {
			case READ_UNCOMMITTED:
				return Optional.of(Connection.TRANSACTION_READ_UNCOMMITTED);
			case READ_COMMITTED:
				return Optional.of(Connection.TRANSACTION_READ_COMMITTED);
			case REPEATABLE_READ:
				return Optional.of(Connection.TRANSACTION_REPEATABLE_READ);
			case SERIALIZABLE:
				return Optional.of(Connection.TRANSACTION_SERIALIZABLE);
			default:
				return Optional.empty();
		}
	}
}
