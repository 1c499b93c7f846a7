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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Read-only snapshot of a single result record: column names zipped, by position, with their values.
 * <p>
 * Values may be looked up by column name ({@link #get(String)}) or by position ({@link #get(int)}).
 * Name lookups are exact first, then case-insensitive, so a column selected as {@code name} is found whether the
 * driver reports it as {@code name} (SQLite, PostgreSQL) or {@code NAME} (HSQLDB).
 * <p>
 * To work with named fields, map the row to a record with {@link #as(Class)}:
 * <pre>{@code
 * record User(Long id, String firstName, String lastName) {}
 *
 * Optional<Row> row = database.fetchOne("SELECT * FROM users WHERE id = ?", 1);
 * Optional<User> user = row.map(r -> r.as(User.class));
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Row {
	@NonNull
	private final List<String> columnNames;
	@NonNull
	private final List<@Nullable Object> values;
	@NonNull
	private final Map<String, Integer> indicesByColumnName;
	@NonNull
	private final Map<String, Integer> indicesByNormalizedColumnName;

	private Row(@NonNull List<String> columnNames,
							@NonNull List<?> values) {
		requireNonNull(columnNames);
		requireNonNull(values);

		if (columnNames.size() != values.size())
			throw new IllegalArgumentException(format("Row has %d column names but %d values", columnNames.size(), values.size()));

		Map<String, Integer> indicesByColumnName = new HashMap<>(columnNames.size());
		Map<String, Integer> indicesByNormalizedColumnName = new HashMap<>(columnNames.size());

		for (int i = 0; i < columnNames.size(); ++i) {
			String columnName = requireNonNull(columnNames.get(i));
			// First occurrence wins for duplicate labels; positional access still reaches the rest
			indicesByColumnName.putIfAbsent(columnName, i);
			indicesByNormalizedColumnName.putIfAbsent(normalizeColumnName(columnName), i);
		}

		this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
		this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
		this.indicesByColumnName = indicesByColumnName;
		this.indicesByNormalizedColumnName = indicesByNormalizedColumnName;
	}

	/**
	 * Creates a row from parallel lists of column names and values.
	 *
	 * @param columnNames the column names, in result order
	 * @param values      the values, in the same order as {@code columnNames}
	 * @return a row
	 * @throws IllegalArgumentException if the lists differ in size
	 */
	@NonNull
	public static Row of(@NonNull List<String> columnNames,
											 @NonNull List<?> values) {
		requireNonNull(columnNames);
		requireNonNull(values);

		return new Row(columnNames, values);
	}

	/**
	 * Gets the value of the given column.
	 *
	 * @param columnName the column name (or alias) as selected
	 * @return the value, which may be {@code null}
	 * @throws IllegalArgumentException if this row has no such column
	 */
	@Nullable
	public Object get(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.values.get(indexOf(columnName));
	}

	/**
	 * Gets the value at the given zero-based position.
	 *
	 * @param index the column position
	 * @return the value, which may be {@code null}
	 * @throws IndexOutOfBoundsException if {@code index} is out of range
	 */
	@Nullable
	public Object get(int index) {
		return this.values.get(index);
	}

	public boolean hasColumn(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.indicesByColumnName.containsKey(columnName)
				|| this.indicesByNormalizedColumnName.containsKey(normalizeColumnName(columnName));
	}

	@Nullable
	public String getString(@NonNull String columnName) {
		Object value = get(columnName);
		return value == null ? null : value.toString();
	}

	@Nullable
	public Long getLong(@NonNull String columnName) {
		Object value = get(columnName);

		if (value == null)
			return null;
		if (value instanceof Number)
			return ((Number) value).longValue();
		if (value instanceof String)
			return Long.valueOf(((String) value).trim());

		throw incompatibleType(columnName, value, Long.class);
	}

	@Nullable
	public Integer getInteger(@NonNull String columnName) {
		Long value = getLong(columnName);
		return value == null ? null : Math.toIntExact(value);
	}

	@Nullable
	public Double getDouble(@NonNull String columnName) {
		Object value = get(columnName);

		if (value == null)
			return null;
		if (value instanceof Number)
			return ((Number) value).doubleValue();
		if (value instanceof String)
			return Double.valueOf(((String) value).trim());

		throw incompatibleType(columnName, value, Double.class);
	}

	@Nullable
	public BigDecimal getBigDecimal(@NonNull String columnName) {
		Object value = get(columnName);

		if (value == null)
			return null;
		if (value instanceof BigDecimal)
			return (BigDecimal) value;
		if (value instanceof BigInteger)
			return new BigDecimal((BigInteger) value);
		if (value instanceof Double || value instanceof Float)
			return BigDecimal.valueOf(((Number) value).doubleValue());
		if (value instanceof Number)
			return BigDecimal.valueOf(((Number) value).longValue());
		if (value instanceof String)
			return new BigDecimal(((String) value).trim());

		throw incompatibleType(columnName, value, BigDecimal.class);
	}

	/**
	 * Gets a boolean value. SQLite has no boolean type, so numeric values are {@code true} when non-zero.
	 */
	@Nullable
	public Boolean getBoolean(@NonNull String columnName) {
		Object value = get(columnName);

		if (value == null)
			return null;
		if (value instanceof Boolean)
			return (Boolean) value;
		if (value instanceof Number)
			return ((Number) value).longValue() != 0L;
		if (value instanceof String)
			return Boolean.valueOf(((String) value).trim());

		throw incompatibleType(columnName, value, Boolean.class);
	}

	/**
	 * Maps this row to an instance of the given record type.
	 * <p>
	 * Each record component is matched to a column by its name, trying the name as-is and in {@code snake_case}
	 * ({@code firstName} matches {@code first_name}), unless the component is annotated with {@link DatabaseColumn}.
	 * Components with no matching column receive {@code null}.
	 *
	 * @param recordType the record type to instantiate
	 * @param <T>        the record type
	 * @return a new record instance
	 * @throws DatabaseException if a value cannot be converted to its component type
	 */
	@NonNull
	public <T extends Record> T as(@NonNull Class<T> recordType) {
		requireNonNull(recordType);
		return RowMapper.toRecord(this, recordType);
	}

	/**
	 * @return the column names, in result order
	 */
	@NonNull
	public List<String> getColumnNames() {
		return this.columnNames;
	}

	/**
	 * @return the values, in result order
	 */
	@NonNull
	public List<@Nullable Object> getValues() {
		return this.values;
	}

	public int size() {
		return this.values.size();
	}

	/**
	 * @return an unmodifiable, ordered view of this row keyed by column name
	 */
	@NonNull
	public Map<String, @Nullable Object> asMap() {
		Map<String, Object> map = new LinkedHashMap<>(this.columnNames.size());

		for (int i = 0; i < this.columnNames.size(); ++i)
			map.putIfAbsent(this.columnNames.get(i), this.values.get(i));

		return Collections.unmodifiableMap(map);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row))
			return false;

		Row row = (Row) object;

		return Objects.equals(row.getColumnNames(), getColumnNames())
				&& Objects.equals(row.getValues(), getValues());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumnNames(), getValues());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(this.columnNames.size());

		for (int i = 0; i < this.columnNames.size(); ++i)
			components.add(format("%s=%s", this.columnNames.get(i), this.values.get(i)));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	int indexOf(@NonNull String columnName) {
		requireNonNull(columnName);

		Integer index = this.indicesByColumnName.get(columnName);

		if (index == null)
			index = this.indicesByNormalizedColumnName.get(normalizeColumnName(columnName));

		if (index == null)
			throw new IllegalArgumentException(format("No column named '%s' in row. Available columns: %s", columnName, this.columnNames));

		return index;
	}

	@NonNull
	static String normalizeColumnName(@NonNull String columnName) {
		requireNonNull(columnName);
		return columnName.toLowerCase(Locale.ENGLISH);
	}

	@NonNull
	private IllegalArgumentException incompatibleType(@NonNull String columnName,
																										@NonNull Object value,
																										@NonNull Class<?> targetType) {
		return new IllegalArgumentException(format("Column '%s' holds a %s, which cannot be read as %s",
				columnName, value.getClass().getName(), targetType.getSimpleName()));
	}
}
