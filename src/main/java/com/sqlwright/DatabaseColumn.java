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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the column(s) a record component is read from by {@link Row#as(Class)}.
 * <p>
 * Useful for aggregate aliases or columns that do not map well to camel-case Java names:
 *
 * <pre>
 * record LastNameTotal(&#064;DatabaseColumn(&quot;last_name&quot;) String name,
 *                      &#064;DatabaseColumn({ &quot;total&quot;, &quot;count&quot; }) Long total) {}
 *
 * database.builder(&quot;users&quot;).select(&quot;last_name&quot;, &quot;COUNT(last_name) AS total&quot;).groupBy(&quot;last_name&quot;)
 *   .all().stream().map(row -&gt; row.as(LastNameTotal.class));
 * </pre>
 *
 * @since 1.0.0
 */
@Target(ElementType.RECORD_COMPONENT)
@Retention(RetentionPolicy.RUNTIME)
public @interface DatabaseColumn {
	String[] value();
}
