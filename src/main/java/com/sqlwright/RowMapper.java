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
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps {@link Row} instances to records, matching record components to column names.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class RowMapper {
	@NonNull
	private static final ConcurrentMap<Class<?>, RecordPlan> RECORD_PLANS_BY_TYPE = new ConcurrentHashMap<>();

	private RowMapper() {
		// Non-instantiable
	}

	@NonNull
	static <T extends Record> T toRecord(@NonNull Row row,
																			 @NonNull Class<T> recordType) {
		requireNonNull(row);
		requireNonNull(recordType);

		if (!recordType.isRecord())
			throw new IllegalArgumentException(format("%s is not a record type", recordType.getName()));

		RecordPlan recordPlan = RECORD_PLANS_BY_TYPE.computeIfAbsent(recordType, RowMapper::planFor);
		Object[] args = new Object[recordPlan.components.size()];

		for (int i = 0; i < recordPlan.components.size(); ++i) {
			ComponentPlan component = recordPlan.components.get(i);
			Object value = null;
			String matchedColumnName = null;

			for (String columnName : component.columnNames) {
				if (row.hasColumn(columnName)) {
					value = row.get(columnName);
					matchedColumnName = columnName;
					break;
				}
			}

			// It's considered programmer error to have a NULL value and map it to a primitive (which does not support null)
			if (value == null && component.type.isPrimitive())
				throw new DatabaseException(format("Column '%s' is NULL or missing but record component '%s' of %s is primitive (%s). "
								+ "Use a non-primitive type or COALESCE in SQL.",
						matchedColumnName == null ? component.columnNames.get(0) : matchedColumnName, component.name,
						recordType.getSimpleName(), component.type.getSimpleName()));

			args[i] = value == null ? null : convert(value, component.type, component.name, recordType);
		}

		try {
			@SuppressWarnings("unchecked")
			Constructor<T> constructor = (Constructor<T>) recordPlan.constructor;
			return constructor.newInstance(args);
		} catch (InvocationTargetException e) {
			throw new DatabaseException(format("Unable to instantiate %s", recordType.getName()), e.getCause());
		} catch (ReflectiveOperationException e) {
			throw new DatabaseException(format("Unable to instantiate %s", recordType.getName()), e);
		}
	}

	@NonNull
	private static RecordPlan planFor(@NonNull Class<?> recordType) {
		requireNonNull(recordType);

		RecordComponent[] recordComponents = recordType.getRecordComponents();
		List<ComponentPlan> components = new ArrayList<>(recordComponents.length);
		Class<?>[] parameterTypes = new Class<?>[recordComponents.length];

		for (int i = 0; i < recordComponents.length; ++i) {
			RecordComponent recordComponent = recordComponents[i];
			DatabaseColumn databaseColumn = recordComponent.getAnnotation(DatabaseColumn.class);
			List<String> columnNames = databaseColumn == null || databaseColumn.value().length == 0
					? columnNamesForComponentName(recordComponent.getName())
					: Arrays.asList(databaseColumn.value());

			components.add(new ComponentPlan(recordComponent.getName(), recordComponent.getType(), columnNames));
			parameterTypes[i] = recordComponent.getType();
		}

		try {
			Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
			constructor.setAccessible(true);
			return new RecordPlan(constructor, components);
		} catch (NoSuchMethodException e) {
			throw new DatabaseException(format("Unable to find canonical constructor for %s", recordType.getName()), e);
		}
	}

	/**
	 * Massages a record component name to match standard database column names (camelCase -> camel_case).
	 * <p>
	 * Component {@code address1} matches both {@code address1} and {@code address_1}.
	 */
	@NonNull
	static List<String> columnNamesForComponentName(@NonNull String componentName) {
		requireNonNull(componentName);

		Set<String> columnNames = new LinkedHashSet<>(3);
		columnNames.add(componentName);

		String snakeCaseName = componentName.replaceAll("([a-z])([A-Z]+)", "$1_$2").toLowerCase(Locale.ENGLISH);
		columnNames.add(snakeCaseName);
		columnNames.add(snakeCaseName.replaceAll("(\\D)(\\d)", "$1_$2"));

		return Collections.unmodifiableList(new ArrayList<>(columnNames));
	}

	@NonNull
	private static Object convert(@NonNull Object value,
																@NonNull Class<?> type,
																@NonNull String componentName,
																@NonNull Class<?> recordType) {
		Class<?> targetType = boxedClass(type);

		if (targetType.isInstance(value))
			return value;

		Object converted = null;

		if (value instanceof Number) {
			Number number = (Number) value;

			if (targetType == Long.class)
				converted = number.longValue();
			else if (targetType == Integer.class)
				converted = Math.toIntExact(number.longValue());
			else if (targetType == Short.class)
				converted = number.shortValue();
			else if (targetType == Double.class)
				converted = number.doubleValue();
			else if (targetType == Float.class)
				converted = number.floatValue();
			else if (targetType == BigDecimal.class)
				converted = new BigDecimal(number.toString());
			else if (targetType == BigInteger.class)
				converted = new BigDecimal(number.toString()).toBigInteger();
			else if (targetType == Boolean.class)
				converted = number.longValue() != 0L;
			else if (targetType == Instant.class)
				converted = Instant.ofEpochMilli(number.longValue());
		} else if (value instanceof String) {
			String string = (String) value;

			if (targetType.isEnum())
				converted = enumValue(targetType, string);
			else if (targetType == UUID.class)
				converted = UUID.fromString(string);
			else if (targetType == LocalDate.class)
				converted = LocalDate.parse(string);
			else if (targetType == LocalDateTime.class)
				converted = LocalDateTime.parse(string.replace(' ', 'T'));
			else if (targetType == Instant.class)
				converted = Instant.parse(string);
			else if (targetType == BigDecimal.class)
				converted = new BigDecimal(string);
		} else if (value instanceof Timestamp) {
			Timestamp timestamp = (Timestamp) value;

			if (targetType == Instant.class)
				converted = timestamp.toInstant();
			else if (targetType == LocalDateTime.class)
				converted = timestamp.toLocalDateTime();
		} else if (value instanceof java.sql.Date && targetType == LocalDate.class) {
			converted = ((java.sql.Date) value).toLocalDate();
		} else if (value instanceof UUID && targetType == String.class) {
			converted = value.toString();
		}

		if (converted == null && targetType == String.class)
			converted = value.toString();

		if (converted == null)
			throw new DatabaseException(format("Record component '%s' of %s has type %s, but the column value is a %s",
					componentName, recordType.getSimpleName(), type.getName(), value.getClass().getName()));

		return converted;
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	@NonNull
	private static Object enumValue(@NonNull Class<?> enumType,
																	@NonNull String name) {
		return Enum.valueOf((Class<? extends Enum>) enumType, name);
	}

	@NonNull
	private static Class<?> boxedClass(@NonNull Class<?> type) {
		if (!type.isPrimitive())
			return type;
		if (type == int.class)
			return Integer.class;
		if (type == long.class)
			return Long.class;
		if (type == double.class)
			return Double.class;
		if (type == float.class)
			return Float.class;
		if (type == short.class)
			return Short.class;
		if (type == boolean.class)
			return Boolean.class;
		if (type == byte.class)
			return Byte.class;
		if (type == char.class)
			return Character.class;

		return type;
	}

	@ThreadSafe
	private static final class RecordPlan {
		@NonNull
		private final Constructor<?> constructor;
		@NonNull
		private final List<ComponentPlan> components;

		private RecordPlan(@NonNull Constructor<?> constructor,
											 @NonNull List<ComponentPlan> components) {
			this.constructor = requireNonNull(constructor);
			this.components = requireNonNull(components);
		}
	}

	@ThreadSafe
	private static final class ComponentPlan {
		@NonNull
		private final String name;
		@NonNull
		private final Class<?> type;
		@NonNull
		private final List<String> columnNames;

		private ComponentPlan(@NonNull String name,
													@NonNull Class<?> type,
													@NonNull List<String> columnNames) {
			this.name = requireNonNull(name);
			this.type = requireNonNull(type);
			this.columnNames = requireNonNull(columnNames);
		}
	}
}
