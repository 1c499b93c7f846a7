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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class RowTests {
	public record Product(Long id, String productName, BigDecimal price, Boolean active) {}

	public record Address(String address1, String address2) {}

	public record Event(UUID eventId, SortDirection direction, LocalDate eventDate, LocalDateTime createdAt, Instant updatedAt) {}

	public record Counter(int count) {}

	@Test
	public void testLookupByNameAndPosition() {
		Row row = Row.of(List.of("id", "name"), List.of(1, "Orange"));

		Assertions.assertEquals(1, row.get("id"));
		Assertions.assertEquals("Orange", row.get(1));
		Assertions.assertEquals("Orange", row.get("NAME"), "Name lookups fall back to case-insensitive matching");
		Assertions.assertTrue(row.hasColumn("Id"));
		Assertions.assertFalse(row.hasColumn("price"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> row.get("price"));
		Assertions.assertThrows(IndexOutOfBoundsException.class, () -> row.get(2));
	}

	@Test
	public void testExactMatchWinsOverCaseInsensitiveMatch() {
		Row row = Row.of(List.of("NAME", "name"), List.of("upper", "lower"));

		Assertions.assertEquals("lower", row.get("name"));
		Assertions.assertEquals("upper", row.get("NAME"));
		Assertions.assertEquals("upper", row.get("Name"));
	}

	@Test
	public void testTypedGetters() {
		Row row = Row.of(List.of("count", "ratio", "flag", "amount", "text"), Arrays.asList(3, 0.5, 1, "12.50", null));

		Assertions.assertEquals(3L, row.getLong("count"));
		Assertions.assertEquals(3, row.getInteger("count"));
		Assertions.assertEquals(0.5, row.getDouble("ratio"));
		Assertions.assertEquals(Boolean.TRUE, row.getBoolean("flag"));
		Assertions.assertEquals(new BigDecimal("12.50"), row.getBigDecimal("amount"));
		Assertions.assertNull(row.getString("text"));
		Assertions.assertNull(row.getLong("text"));
	}

	@Test
	public void testMismatchedSizesAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Row.of(List.of("a", "b"), List.of(1)));
	}

	@Test
	public void testAsMapPreservesOrder() {
		Row row = Row.of(List.of("b", "a"), Arrays.asList(2, null));

		Assertions.assertEquals(List.of("b", "a"), List.copyOf(row.asMap().keySet()));
		Assertions.assertNull(row.asMap().get("a"));
		Assertions.assertEquals(2, row.size());
		Assertions.assertEquals(Row.of(List.of("b", "a"), Arrays.asList(2, null)), row);
	}

	@Test
	public void testRecordMapping() {
		Row row = Row.of(List.of("id", "product_name", "price", "active"), List.of(7, "Orange", 1.25, 1));
		Product product = row.as(Product.class);

		Assertions.assertEquals(new Product(7L, "Orange", new BigDecimal("1.25"), true), product);
	}

	@Test
	public void testDigitSuffixedComponentNames() {
		Row row = Row.of(List.of("address_1", "address2"), List.of("1 Main St", "Apt 2"));
		Address address = row.as(Address.class);

		Assertions.assertEquals("1 Main St", address.address1());
		Assertions.assertEquals("Apt 2", address.address2());
	}

	@Test
	public void testRecordMappingConversions() {
		UUID eventId = UUID.randomUUID();
		Instant updatedAt = Instant.parse("2024-01-02T03:04:05Z");
		Row row = Row.of(List.of("event_id", "direction", "event_date", "created_at", "updated_at"),
				List.of(eventId.toString(), "ASC", "2024-01-02", "2024-01-02 03:04:05", Timestamp.from(updatedAt)));

		Event event = row.as(Event.class);

		Assertions.assertEquals(eventId, event.eventId());
		Assertions.assertEquals(SortDirection.ASC, event.direction());
		Assertions.assertEquals(LocalDate.of(2024, 1, 2), event.eventDate());
		Assertions.assertEquals(LocalDateTime.of(2024, 1, 2, 3, 4, 5), event.createdAt());
		Assertions.assertEquals(updatedAt, event.updatedAt());
	}

	@Test
	public void testNullPrimitiveComponentIsRejected() {
		Row row = Row.of(List.of("count"), Arrays.asList((Object) null));

		Assertions.assertThrows(DatabaseException.class, () -> row.as(Counter.class));
		Assertions.assertEquals(new Counter(3), Row.of(List.of("count"), List.of(3L)).as(Counter.class));
	}

	@Test
	public void testIncompatibleComponentTypeIsRejected() {
		Row row = Row.of(List.of("id", "product_name", "price", "active"), List.of(List.of(), "Orange", 1.25, 1));

		Assertions.assertThrows(DatabaseException.class, () -> row.as(Product.class));
	}

	@Test
	public void testColumnNamesForComponentName() {
		Assertions.assertEquals(List.of("firstName", "first_name"), RowMapper.columnNamesForComponentName("firstName"));
		Assertions.assertEquals(List.of("address1", "address_1"), RowMapper.columnNamesForComponentName("address1"));
		Assertions.assertEquals(List.of("name"), RowMapper.columnNamesForComponentName("name"));
	}
}
