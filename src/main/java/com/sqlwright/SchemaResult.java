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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of a schema operation such as {@link Database#createSchemas(String...)}: which tables were created,
 * which were dropped and which were skipped because there was nothing to do.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SchemaResult {
	@NonNull
	private static final SchemaResult EMPTY = new SchemaResult(List.of(), List.of(), List.of());

	@NonNull
	private final List<String> createdTables;
	@NonNull
	private final List<String> droppedTables;
	@NonNull
	private final List<String> skippedTables;

	SchemaResult(@NonNull List<String> createdTables,
							 @NonNull List<String> droppedTables,
							 @NonNull List<String> skippedTables) {
		requireNonNull(createdTables);
		requireNonNull(droppedTables);
		requireNonNull(skippedTables);

		this.createdTables = Collections.unmodifiableList(new ArrayList<>(createdTables));
		this.droppedTables = Collections.unmodifiableList(new ArrayList<>(droppedTables));
		this.skippedTables = Collections.unmodifiableList(new ArrayList<>(skippedTables));
	}

	@NonNull
	static SchemaResult empty() {
		return EMPTY;
	}

	/**
	 * Combines this result with another, preserving order.
	 */
	@NonNull
	SchemaResult plus(@NonNull SchemaResult other) {
		requireNonNull(other);

		List<String> createdTables = new ArrayList<>(getCreatedTables());
		createdTables.addAll(other.getCreatedTables());
		List<String> droppedTables = new ArrayList<>(getDroppedTables());
		droppedTables.addAll(other.getDroppedTables());
		List<String> skippedTables = new ArrayList<>(getSkippedTables());
		skippedTables.addAll(other.getSkippedTables());

		return new SchemaResult(createdTables, droppedTables, skippedTables);
	}

	@NonNull
	public List<String> getCreatedTables() {
		return this.createdTables;
	}

	@NonNull
	public List<String> getDroppedTables() {
		return this.droppedTables;
	}

	@NonNull
	public List<String> getSkippedTables() {
		return this.skippedTables;
	}

	public int getCreatedCount() {
		return this.createdTables.size();
	}

	public int getDroppedCount() {
		return this.droppedTables.size();
	}

	public int getSkippedCount() {
		return this.skippedTables.size();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof SchemaResult))
			return false;

		SchemaResult schemaResult = (SchemaResult) object;

		return Objects.equals(schemaResult.getCreatedTables(), getCreatedTables())
				&& Objects.equals(schemaResult.getDroppedTables(), getDroppedTables())
				&& Objects.equals(schemaResult.getSkippedTables(), getSkippedTables());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCreatedTables(), getDroppedTables(), getSkippedTables());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{createdTables=%s, droppedTables=%s, skippedTables=%s}", getClass().getSimpleName(),
				getCreatedTables(), getDroppedTables(), getSkippedTables());
	}
}
