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
package io.sieve.catalog;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.sieve.Schema;

/** A table resolved by the caller: its name, live schema, storage format and file listing. */
public class Relation {
  private final String name;
  private final Schema schema;
  private final FileFormat format;
  private final FileCatalog fileCatalog;

  public static Relation of(
      String name, Schema schema, FileFormat format, FileCatalog fileCatalog) {
    return new Relation(name, schema, format, fileCatalog);
  }

  private Relation(String name, Schema schema, FileFormat format, FileCatalog fileCatalog) {
    Preconditions.checkArgument(name != null, "Invalid relation name: null");
    Preconditions.checkArgument(schema != null, "Invalid schema: null");
    Preconditions.checkArgument(format != null, "Invalid file format: null");
    Preconditions.checkArgument(fileCatalog != null, "Invalid file catalog: null");
    this.name = name;
    this.schema = schema;
    this.format = format;
    this.fileCatalog = fileCatalog;
  }

  public String name() {
    return name;
  }

  public Schema schema() {
    return schema;
  }

  public FileFormat format() {
    return format;
  }

  public FileCatalog fileCatalog() {
    return fileCatalog;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("format", format)
        .add("location", fileCatalog.location())
        .toString();
  }
}
