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
package io.sieve.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableMap;
import io.sieve.SieveProperties;
import io.sieve.TestTables;
import io.sieve.exec.ExecutionEngine;
import io.sieve.exec.LocalExecutionEngine;
import io.sieve.hadoop.HadoopFileIO;
import io.sieve.io.LocalFileIO;
import io.sieve.statistics.StatisticsType;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.Test;

public class TestSieveSession {

  @Test
  public void testDefaultBackend() {
    try (SieveSession session = TestTables.session(TestTables.CSV)) {
      assertThat(session.backend()).isEqualTo(SessionBackend.DEFAULT);
      assertThat(session.io()).isInstanceOf(LocalFileIO.class);
      assertThat(session.engine()).isInstanceOf(LocalExecutionEngine.class);
      assertThat(session.properties()).containsEntry(SieveProperties.WORKER_THREADS, "2");
      assertThat(session.io().properties()).isEqualTo(session.properties());
    }
  }

  @Test
  public void testExtendedBackend() {
    Configuration conf = new Configuration();
    try (SieveSession session =
        SieveSession.builder()
            .withProperty(SieveProperties.SESSION_BACKEND, "Extended")
            .withHadoopConf(conf)
            .withRowReader(TestTables.CSV)
            .build()) {
      assertThat(session.backend()).isEqualTo(SessionBackend.EXTENDED);
      assertThat(session.io()).isInstanceOf(HadoopFileIO.class);
      assertThat(((HadoopFileIO) session.io()).conf()).isSameAs(conf);
    }
  }

  @Test
  public void testUnknownBackend() {
    assertThatThrownBy(
            () ->
                SieveSession.builder()
                    .withProperty(SieveProperties.SESSION_BACKEND, "cloud")
                    .withRowReader(TestTables.CSV)
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown session backend: cloud");
  }

  @Test
  public void testRequiresReaderOrEngine() {
    assertThatThrownBy(() -> SieveSession.builder().build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot build a session without a row reader or execution engine");
  }

  @Test
  public void testSuppliedEngineAndFileIO() {
    ExecutionEngine engine = mock(ExecutionEngine.class);
    LocalFileIO io = mock(LocalFileIO.class);
    try (SieveSession session =
        SieveSession.builder().withExecutionEngine(engine).withFileIO(io).build()) {
      assertThat(session.engine()).isSameAs(engine);
      assertThat(session.io()).isSameAs(io);
    }

    verify(io).close();
  }

  @Test
  public void testStatisticsOptionsFromProperties() {
    try (SieveSession session =
        SieveSession.builder()
            .withProperties(
                ImmutableMap.of(SieveProperties.STATISTICS_TYPES, "minmax, bloomfilter"))
            .withRowReader(TestTables.CSV)
            .build()) {
      assertThat(session.statisticsOptions().types())
          .containsExactly(StatisticsType.MIN_MAX, StatisticsType.BLOOM_FILTER);
    }
  }
}
