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
import io.sieve.catalog.DataFile;
import java.util.List;

/** Runs a task over the rows of many data files. */
public interface ExecutionEngine {

  /**
   * Runs {@code task} once per data file and waits for every task to finish.
   *
   * @param files data files to process
   * @param schema the schema of the data files
   * @param projection ordinals of the columns each task receives, in order
   * @param task the work to run per file
   * @return one result per file, in the order of {@code files}
   * @throws RuntimeException the first task failure, with later failures suppressed
   */
  <R> List<R> runJob(
      List<DataFile> files, Schema schema, List<Integer> projection, TaskFunction<R> task);
}
