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
package io.sieve.exec;

import io.sieve.Schema;
import io.sieve.StructLike;
import io.sieve.catalog.DataFile;
import io.sieve.io.CloseableIterable;

/** The projected rows of one data file, handed to a task. */
public class DataFileRows {
  private final DataFile file;
  private final Schema projection;
  private final CloseableIterable<StructLike> rows;

  public DataFileRows(DataFile file, Schema projection, CloseableIterable<StructLike> rows) {
    this.file = file;
    this.projection = projection;
    this.rows = rows;
  }

  public DataFile file() {
    return file;
  }

  /** Returns the schema of the projected rows. */
  public Schema projection() {
    return projection;
  }

  public CloseableIterable<StructLike> rows() {
    return rows;
  }
}
