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

import io.sieve.types.Types;
import org.junit.jupiter.api.Test;

public class TestSchemaParser {

  @Test
  public void testPrimitiveColumns() {
    Schema schema =
        new Schema(
            required("id", Types.LongType.get()),
            optional("flag", Types.BooleanType.get()),
            optional("day", Types.DateType.get()),
            optional("payload", Types.BinaryType.get()));

    String json = SchemaParser.toJson(schema);
    assertThat(json)
        .isEqualTo(
            "{\"type\":\"struct\",\"fields\":["
                + "{\"name\":\"id\",\"required\":true,\"type\":\"long\"},"
                + "{\"name\":\"flag\",\"required\":false,\"type\":\"boolean\"},"
                + "{\"name\":\"day\",\"required\":false,\"type\":\"date\"},"
                + "{\"name\":\"payload\",\"required\":false,\"type\":\"binary\"}]}");
    assertThat(SchemaParser.fromJson(json)).isEqualTo(schema);
  }

  @Test
  public void testNestedStruct() {
    Schema schema =
        new Schema(
            required("id", Types.IntegerType.get()),
            optional(
                "location",
                Types.StructType.of(
                    required("lat", Types.DoubleType.get()),
                    required("lon", Types.DoubleType.get()))));

    assertThat(SchemaParser.fromJson(SchemaParser.toJson(schema, true))).isEqualTo(schema);
  }

  @Test
  public void testUnknownType() {
    String json =
        "{\"type\":\"struct\",\"fields\":[{\"name\":\"a\",\"required\":true,\"type\":\"uuid\"}]}";
    assertThatThrownBy(() -> SchemaParser.fromJson(json))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse type string to primitive: uuid");
  }
}
