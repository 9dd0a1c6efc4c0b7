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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.MoreExecutors;
import io.sieve.Schema;
import io.sieve.StructLike;
import io.sieve.TestTables;
import io.sieve.catalog.DataFile;
import io.sieve.io.LocalFileIO;
import io.sieve.types.Types;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestLocalExecutionEngine {
  @TempDir private File root;

  private ExecutorService pool;
  private List<DataFile> files;

  @BeforeEach
  public void before() throws IOException {
    this.pool = Executors.newFixedThreadPool(2);
    this.files =
        ImmutableList.of(
            dataFile(TestTables.writeCsv(root, "p=1/a.csv", "1,ann,10", "2,bob,20")),
            dataFile(TestTables.writeCsv(root, "p=2/b.csv", "3,,30")));
  }

  @AfterEach
  public void after() {
    MoreExecutors.shutdownAndAwaitTermination(pool, Duration.ofSeconds(10));
  }

  private static DataFile dataFile(String path) {
    File file = new File(path);
    return DataFile.of(path, file.getParent(), file.length());
  }

  @Test
  public void testProjectsRowsPerFile() {
    LocalExecutionEngine engine =
        new LocalExecutionEngine(new LocalFileIO(), TestTables.CSV, pool, 0);

    List<List<Object>> results =
        engine.runJob(
            files,
            TestTables.SCHEMA,
            ImmutableList.of(1, 0),
            rows -> {
              assertThat(rows.projection().columns())
                  .extracting(Types.NestedField::name)
                  .containsExactly("name", "id");
              List<Object> values = Lists.newArrayList();
              for (StructLike row : rows.rows()) {
                values.add(row.get(0, String.class));
                values.add(row.get(1, Integer.class));
              }
              return values;
            });

    assertThat(results)
        .containsExactly(Lists.newArrayList("ann", 1, "bob", 2), Lists.newArrayList(null, 3));
  }

  @Test
  public void testRetriesFailedTasks() {
    AtomicInteger attempts = new AtomicInteger();
    LocalExecutionEngine engine =
        new LocalExecutionEngine(new LocalFileIO(), TestTables.CSV, pool, 2);

    List<String> results =
        engine.runJob(
            files.subList(0, 1),
            TestTables.SCHEMA,
            ImmutableList.of(0),
            rows -> {
              if (attempts.incrementAndGet() < 3) {
                throw new IOException("Flaky read of " + rows.file().path());
              }
              return rows.file().path();
            });

    assertThat(attempts).hasValue(3);
    assertThat(results).containsExactly(files.get(0).path());
  }

  @Test
  public void testFailurePropagates() {
    LocalExecutionEngine engine =
        new LocalExecutionEngine(new LocalFileIO(), TestTables.CSV, pool, 0);
    Schema schema = TestTables.SCHEMA;

    assertThatThrownBy(
            () ->
                engine.runJob(
                    files,
                    schema,
                    ImmutableList.of(0),
                    rows -> {
                      throw new IllegalStateException("Cannot index " + rows.file().path());
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageStartingWith("Cannot index");
  }

  @Test
  public void testInvalidRetries() {
    assertThatThrownBy(() -> new LocalExecutionEngine(new LocalFileIO(), TestTables.CSV, pool, -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid number of retries: -1");
  }
}
