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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import io.sieve.types.Type;
import io.sieve.types.Types;
import io.sieve.util.JsonUtil;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

public class SchemaParser {

  private SchemaParser() {}

  private static final String TYPE = "type";
  private static final String STRUCT = "struct";
  private static final String FIELDS = "fields";
  private static final String NAME = "name";
  private static final String REQUIRED = "required";

  private static void toJson(Types.StructType struct, JsonGenerator generator) throws IOException {
    generator.writeStartObject();

    generator.writeStringField(TYPE, STRUCT);
    generator.writeArrayFieldStart(FIELDS);
    for (Types.NestedField field : struct.fields()) {
      generator.writeStartObject();
      generator.writeStringField(NAME, field.name());
      generator.writeBooleanField(REQUIRED, field.isRequired());
      generator.writeFieldName(TYPE);
      toJson(field.type(), generator);
      generator.writeEndObject();
    }
    generator.writeEndArray();

    generator.writeEndObject();
  }

  static void toJson(Type type, JsonGenerator generator) throws IOException {
    if (type.isPrimitiveType()) {
      generator.writeString(type.toString());
    } else {
      Preconditions.checkArgument(
          type.typeId() == Type.TypeID.STRUCT, "Cannot write unknown type: %s", type);
      toJson((Types.StructType) type, generator);
    }
  }

  public static void toJson(Schema schema, JsonGenerator generator) throws IOException {
    toJson(schema.asStruct(), generator);
  }

  public static String toJson(Schema schema) {
    return toJson(schema, false);
  }

  public static String toJson(Schema schema, boolean pretty) {
    return JsonUtil.generate(gen -> toJson(schema.asStruct(), gen), pretty);
  }

  private static Type typeFromJson(JsonNode json) {
    if (json.isTextual()) {
      return Types.fromPrimitiveString(json.asText());
    } else if (json.isObject()) {
      String type = JsonUtil.getString(TYPE, json);
      if (STRUCT.equals(type)) {
        return structFromJson(json);
      }
    }

    throw new IllegalArgumentException("Cannot parse type from json: " + json);
  }

  private static Types.StructType structFromJson(JsonNode json) {
    Iterator<JsonNode> elements = JsonUtil.getArrayElements(FIELDS, json);
    List<Types.NestedField> fields = Lists.newArrayList();
    while (elements.hasNext()) {
      JsonNode field = elements.next();
      Preconditions.checkArgument(
          field.isObject(), "Cannot parse struct field from non-object: %s", field);

      String name = JsonUtil.getString(NAME, field);
      Type type = typeFromJson(JsonUtil.get(TYPE, field));
      boolean isRequired = JsonUtil.getBool(REQUIRED, field);
      fields.add(Types.NestedField.of(!isRequired, name, type));
    }

    return Types.StructType.of(fields);
  }

  public static Schema fromJson(JsonNode json) {
    Type type = typeFromJson(json);
    Preconditions.checkArgument(
        type.typeId() == Type.TypeID.STRUCT, "Cannot create schema, not a struct type: %s", type);
    return new Schema(((Types.StructType) type).fields());
  }

  public static Schema fromJson(String json) {
    return JsonUtil.parse(json, SchemaParser::fromJson);
  }
}
