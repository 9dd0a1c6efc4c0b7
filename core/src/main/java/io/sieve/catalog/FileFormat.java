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

/** Data file formats a relation can be stored in. */
public enum FileFormat {
  SIEVE("io.sieve.data.SieveDataFile"),
  PARQUET("io.sieve.data.ParquetDataFile"),
  CSV(null),
  JSON(null);

  private final String readerClassName;

  FileFormat(String readerClassName) {
    this.readerClassName = readerClassName;
  }

  /** Returns true if indexes can be built over files of this format. */
  public boolean isIndexable() {
    return readerClassName != null;
  }

  /**
   * Returns the name recorded in partition metadata for the reader of this format.
   *
   * @return a class name, or null if the format is not indexable
   */
  public String readerClassName() {
    return readerClassName;
  }
}
