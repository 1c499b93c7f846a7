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

/**
 * Thin wrapper over JDBC for SQLite and PostgreSQL (or any {@link javax.sql.DataSource}) with declarative table
 * schemas and a fluent single-table query builder.
 * <p>
 * Start with {@link com.sqlwright.DatabaseConfiguration}, build a {@link com.sqlwright.Database} from it, and use
 * {@link com.sqlwright.Database#builder(String)} for {@code SELECT}s. {@link com.sqlwright.AsyncDatabase} offers the
 * same operations as {@link java.util.concurrent.CompletableFuture}s.
 *
 * @since 1.0.0
 */
package com.sqlwright;
