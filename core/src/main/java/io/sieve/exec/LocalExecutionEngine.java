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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.sieve.Schema;
import io.sieve.StructLike;
import io.sieve.catalog.DataFile;
import io.sieve.data.GenericRow;
import io.sieve.exceptions.RuntimeIOException;
import io.sieve.io.CloseableIterable;
import io.sieve.io.FileIO;
import io.sieve.types.Types;
import io.sieve.util.Tasks;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one task per data file on a local worker pool.
 *
 * <p>The job stops scheduling new tasks after the first failure and rethrows it once running tasks
 * have finished. A failed task is retried up to the configured number of times.
 */
public class LocalExecutionEngine implements ExecutionEngine {
  private static final Logger LOG = LoggerFactory.getLogger(LocalExecutionEngine.class);

  private final FileIO io;
  private final RowReader reader;
  private final ExecutorService workerPool;
  private final int retries;

  public LocalExecutionEngine(
      FileIO io, RowReader reader, ExecutorService workerPool, int retries) {
    Preconditions.checkArgument(io != null, "Invalid file io: null");
    Preconditions.checkArgument(reader != null, "Invalid row reader: null");
    Preconditions.checkArgument(retries >= 0, "Invalid number of retries: %s", retries);
    this.io = io;
    this.reader = reader;
    this.workerPool = workerPool;
    this.retries = retries;
  }

  @Override
  public <R> List<R> runJob(
      List<DataFile> files, Schema schema, List<Integer> projection, TaskFunction<R> task) {
    Types.StructType projected = schema.select(projection).asStruct();
    AtomicReferenceArray<R> results = new AtomicReferenceArray<>(files.size());
    List<Integer> positions =
        IntStream.range(0, files.size()).boxed().collect(Collectors.toList());

    LOG.info("Running {} tasks over {} data files", task.getClass().getSimpleName(), files.size());
    try {
      Tasks.foreach(positions)
          .executeWith(workerPool)
          .stopOnFailure()
          .throwFailureWhenFinished()
          .retry(retries)
          .run(
              pos -> results.set(pos, runTask(files.get(pos), schema, projected, projection, task)),
              IOException.class);
    } catch (IOException e) {
      throw new RuntimeIOException(e);
    }

    ImmutableList.Builder<R> builder = ImmutableList.builder();
    for (int pos = 0; pos < files.size(); pos += 1) {
      builder.add(results.get(pos));
    }

    return builder.build();
  }

  private <R> R runTask(
      DataFile file,
      Schema schema,
      Types.StructType projected,
      List<Integer> projection,
      TaskFunction<R> task)
      throws IOException {
    LOG.debug("Reading {}", file.path());
    try (CloseableIterable<StructLike> rows =
        reader.read(io.newInputFile(file.path(), file.length()), schema)) {
      CloseableIterable<StructLike> keys =
          CloseableIterable.transform(
              rows, row -> GenericRow.project(row, projected, projection));
      return task.apply(new DataFileRows(file, new Schema(projected.fields()), keys));
    }
  }
}
