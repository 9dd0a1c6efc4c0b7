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
import io.sieve.io.CloseableIterable;
import io.sieve.io.InputFile;
import java.io.Serializable;

/** Decodes the rows of a data file. Supplied by the application that owns the file format. */
@FunctionalInterface
public interface RowReader extends Serializable {

  /**
   * Opens a data file for reading.
   *
   * @param file the data file
   * @param schema the schema of the file's rows
   * @return the rows in file order; closing the iterable releases the file
   */
  CloseableIterable<StructLike> read(InputFile file, Schema schema);
}
