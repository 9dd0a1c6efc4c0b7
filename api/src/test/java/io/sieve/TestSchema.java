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
package io.sieve;

import static io.sieve.types.Types.NestedField.optional;
import static io.sieve.types.Types.NestedField.required;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import io.sieve.types.Types;
import org.junit.jupiter.api.Test;

public class TestSchema {
  private static final Schema SCHEMA =
      new Schema(
          required("id", Types.LongType.get()),
          optional("name", Types.StringType.get()),
          optional("ts", Types.TimestampType.get()));

  @Test
  public void testOrdinalLookup() {
    assertThat(SCHEMA.ordinal("id")).isEqualTo(0);
    assertThat(SCHEMA.ordinal("ts")).isEqualTo(2);
    assertThat(SCHEMA.ordinal("missing")).isNull();
    assertThat(SCHEMA.findType("name")).isEqualTo(Types.StringType.get());
    assertThat(SCHEMA.findField("missing")).isNull();
  }

  @Test
  public void testEmptyColumnName() {
    assertThatThrownBy(() -> SCHEMA.ordinal(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid column name: (empty)");
  }

  @Test
  public void testInvalidOrdinal() {
    assertThatThrownBy(() -> SCHEMA.column(3))
        .isInstanceOf(IndexOutOfBoundsException.class)
        .hasMessageStartingWith("Invalid column ordinal");
  }

  @Test
  public void testSelectKeepsRequestedOrder() {
    Schema selected = SCHEMA.select(ImmutableList.of(2, 0));
    assertThat(selected.columns())
        .containsExactly(
            optional("ts", Types.TimestampType.get()), required("id", Types.LongType.get()));
  }

  @Test
  public void testSelectByName() {
    Schema selected = SCHEMA.selectByName(ImmutableList.of("name", "id"));
    assertThat(selected.ordinal("name")).isEqualTo(0);
    assertThat(selected.ordinal("id")).isEqualTo(1);

    assertThatThrownBy(() -> SCHEMA.selectByName(ImmutableList.of("missing")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot find column: missing");
  }

  @Test
  public void testDuplicateColumnNames() {
    Schema schema =
        new Schema(required("id", Types.LongType.get()), optional("id", Types.IntegerType.get()));
    assertThatThrownBy(() -> schema.ordinal("id"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid schema: duplicate column names");
  }

  @Test
  public void testEquality() {
    Schema copy =
        new Schema(
            required("id", Types.LongType.get()),
            optional("name", Types.StringType.get()),
            optional("ts", Types.TimestampType.get()));
    assertThat(copy).isEqualTo(SCHEMA).hasSameHashCodeAs(SCHEMA);
    assertThat(SCHEMA.select(ImmutableList.of(0, 1))).isNotEqualTo(SCHEMA);
  }
}
