/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.sieve.index;

import com.google.common.base.Preconditions;
import org.immutables.value.Value;

/** A key column requested when creating an index, before it is resolved against a schema. */
@Value.Immutable
public interface IndexColumn {
  String columnName();

  @Value.Default
  default boolean ascending() {
    return true;
  }

  @Value.Check
  default void check() {
    Preconditions.checkArgument(!columnName().isEmpty(), "Invalid column name: (empty)");
  }

  static IndexColumn asc(String columnName) {
    return ImmutableIndexColumn.builder().columnName(columnName).ascending(true).build();
  }

  static IndexColumn desc(String columnName) {
    return ImmutableIndexColumn.builder().columnName(columnName).ascending(false).build();
  }
}
