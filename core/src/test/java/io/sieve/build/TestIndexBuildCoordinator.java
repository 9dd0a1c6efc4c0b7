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
package io.sieve.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sieve.SieveProperties;
import io.sieve.TestTables;
import io.sieve.build.IndexBuildCoordinator.JobState;
import io.sieve.catalog.Relation;
import io.sieve.exceptions.JobAbortedException;
import io.sieve.exceptions.RuntimeIOException;
import io.sieve.exceptions.ValidationException;
import io.sieve.exec.RowReader;
import io.sieve.index.BitmapIndex;
import io.sieve.index.IndexFiles;
import io.sieve.index.IndexSegmentReader;
import io.sieve.index.IndexType;
import io.sieve.io.LocalFileIO;
import io.sieve.session.SieveSession;
import io.sieve.statistics.StatisticsOptions;
import io.sieve.types.Types;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestIndexBuildCoordinator {
  private static final Types.StructType ID_KEY =
      Types.StructType.of(TestTables.SCHEMA.column(0));

  @TempDir private File tableDir;

  private SieveSession session;
  private String fileA;
  private String fileB;

  @BeforeEach
  public void before() throws IOException {
    this.fileA = TestTables.writeCsv(tableDir, "p=1/a.csv", "1,ann,10", "2,bob,20", "1,ann,30");
    this.fileB = TestTables.writeCsv(tableDir, "p=2/b.csv", "3,cat,");
  }

  @AfterEach
  public void after() {
    if (session != null) {
      session.close();
    }
  }

  private IndexBuildCoordinator coordinator(boolean isAppend) {
    return new IndexBuildCoordinator(
        session.io(), "by_id", BitmapIndex.of(0), StatisticsOptions.defaults(), isAppend);
  }

  private Relation relation() {
    return TestTables.relation(session.io(), tableDir);
  }

  @Test
  public void testCommitPublishesSegments() throws IOException {
    this.session = TestTables.session(TestTables.CSV);
    IndexBuildCoordinator coordinator = coordinator(false);
    coordinator.driverSideSetup();
    assertThat(coordinator.state()).isEqualTo(JobState.DRIVER_SETUP);

    List<BuildResult> results = coordinator.run(session.engine(), relation());

    assertThat(coordinator.state()).isEqualTo(JobState.COMMITTED);
    assertThat(results).extracting(BuildResult::dataFile).containsExactly(fileA, fileB);
    assertThat(results).extracting(BuildResult::rowCount).containsExactly(3L, 1L);
    assertThat(results)
        .extracting(BuildResult::parent)
        .containsExactly(new File(tableDir, "p=1").getPath(), new File(tableDir, "p=2").getPath());
    assertThat(results.get(0).fingerprint().remaining()).isEqualTo(32);

    assertThat(TestTables.listFiles(tableDir))
        .containsExactly("p=1/a.by_id.index", "p=1/a.csv", "p=2/b.by_id.index", "p=2/b.csv");

    IndexSegmentReader segment =
        IndexSegmentReader.read(
            session.io().newInputFile(new File(tableDir, "p=1/a.by_id.index").getPath()), ID_KEY);
    assertThat(segment.type()).isEqualTo(IndexType.BITMAP);
    assertThat(segment.keyCount()).isEqualTo(2);
  }

  @Test
  public void testTaskFailureAbortsJob() throws IOException {
    TestTables.writeCsv(tableDir, "p=2/bad.csv", "4,dan,1");
    RowReader failing =
        (file, schema) -> {
          if (file.location().endsWith("bad.csv")) {
            throw new IllegalStateException("Cannot decode " + file.location());
          }
          return TestTables.CSV.read(file, schema);
        };
    this.session = TestTables.session(failing);
    IndexBuildCoordinator coordinator = coordinator(false);
    coordinator.driverSideSetup();

    assertThatThrownBy(() -> coordinator.run(session.engine(), relation()))
        .isInstanceOf(JobAbortedException.class)
        .hasMessageStartingWith("Job " + coordinator.jobId() + " aborted: Cannot decode")
        .hasCauseInstanceOf(IllegalStateException.class)
        .asInstanceOf(InstanceOfAssertFactories.type(JobAbortedException.class))
        .extracting(JobAbortedException::jobId)
        .isEqualTo(coordinator.jobId());

    assertThat(coordinator.state()).isEqualTo(JobState.ABORTED);
    assertThat(TestTables.listFiles(tableDir))
        .containsExactly("p=1/a.csv", "p=2/b.csv", "p=2/bad.csv");
  }

  @Test
  public void testFailedTaskIsRetried() throws IOException {
    AtomicInteger attempts = new AtomicInteger(0);
    RowReader flaky =
        (file, schema) -> {
          if (file.location().endsWith("b.csv") && attempts.getAndIncrement() == 0) {
            throw new IllegalStateException("Transient failure");
          }
          return TestTables.CSV.read(file, schema);
        };
    this.session =
        SieveSession.builder()
            .withRowReader(flaky)
            .withProperty(SieveProperties.TASK_RETRIES, "1")
            .build();
    IndexBuildCoordinator coordinator = coordinator(false);
    coordinator.driverSideSetup();

    assertThat(coordinator.run(session.engine(), relation())).hasSize(2);
    assertThat(attempts.get()).isEqualTo(2);
    assertThat(coordinator.state()).isEqualTo(JobState.COMMITTED);
  }

  @Test
  public void testAppendSkipsIndexedFiles() throws IOException {
    this.session = TestTables.session(TestTables.CSV);
    IndexBuildCoordinator first = coordinator(false);
    first.driverSideSetup();
    first.run(session.engine(), relation());

    String fileC = TestTables.writeCsv(tableDir, "p=2/c.csv", "5,eve,2");
    IndexBuildCoordinator append = coordinator(true);
    append.driverSideSetup();
    List<BuildResult> results = append.run(session.engine(), relation());

    assertThat(results).extracting(BuildResult::dataFile).containsExactly(fileC);
    assertThat(TestTables.listFiles(tableDir)).contains("p=2/c.by_id.index");
  }

  @Test
  public void testIllegalTransitions() {
    this.session = TestTables.session(TestTables.CSV);
    IndexBuildCoordinator coordinator = coordinator(false);

    assertThatThrownBy(() -> coordinator.run(session.engine(), relation()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage(
            "Cannot move job %s to RUNNING: expected DRIVER_SETUP but was CREATED",
            coordinator.jobId());
    assertThatThrownBy(coordinator::abortJob)
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Cannot abort job %s in state CREATED", coordinator.jobId());

    coordinator.driverSideSetup();
    assertThatThrownBy(coordinator::driverSideSetup)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("expected CREATED but was DRIVER_SETUP");
  }

  @Test
  public void testColumnOutsideRelationSchema() {
    this.session = TestTables.session(TestTables.CSV);
    IndexBuildCoordinator coordinator =
        new IndexBuildCoordinator(
            session.io(), "wide", BitmapIndex.of(5), StatisticsOptions.defaults(), false);
    coordinator.driverSideSetup();

    assertThatThrownBy(() -> coordinator.run(session.engine(), relation()))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("Cannot build index wide: column 5 is not in schema");
    assertThat(coordinator.state()).isEqualTo(JobState.DRIVER_SETUP);
  }

  @Test
  public void testFailedCommitRemovesPublishedSegments() throws IOException {
    this.session = TestTables.session(TestTables.CSV);
    IndexBuildCoordinator coordinator =
        new IndexBuildCoordinator(
            new FailingPublishFileIO("b.by_id.index"),
            "by_id",
            BitmapIndex.of(0),
            StatisticsOptions.defaults(),
            false);
    coordinator.driverSideSetup();

    assertThatThrownBy(() -> coordinator.run(session.engine(), relation()))
        .isInstanceOf(JobAbortedException.class)
        .hasRootCauseMessage("Cannot publish b.by_id.index");

    assertThat(coordinator.state()).isEqualTo(JobState.ABORTED);
    assertThat(TestTables.listFiles(tableDir)).containsExactly("p=1/a.csv", "p=2/b.csv");
  }

  @Test
  public void testFailedCommitRestoresReplacedSegments() throws IOException {
    this.session = TestTables.session(TestTables.CSV);
    IndexBuildCoordinator first = coordinator(false);
    first.driverSideSetup();
    first.run(session.engine(), relation());
    File segmentA = new File(tableDir, "p=1/a.by_id.index");
    File segmentB = new File(tableDir, "p=2/b.by_id.index");
    byte[] bytesA = Files.readAllBytes(segmentA.toPath());
    byte[] bytesB = Files.readAllBytes(segmentB.toPath());

    TestTables.writeCsv(tableDir, "p=1/a.csv", "7,zed,1");
    IndexBuildCoordinator rebuild =
        new IndexBuildCoordinator(
            new FailingPublishFileIO("b.by_id.index"),
            "by_id",
            BitmapIndex.of(0),
            StatisticsOptions.defaults(),
            false);
    rebuild.driverSideSetup();

    assertThatThrownBy(() -> rebuild.run(session.engine(), relation()))
        .isInstanceOf(JobAbortedException.class);

    assertThat(rebuild.state()).isEqualTo(JobState.ABORTED);
    assertThat(TestTables.listFiles(tableDir))
        .containsExactly("p=1/a.by_id.index", "p=1/a.csv", "p=2/b.by_id.index", "p=2/b.csv");
    assertThat(Files.readAllBytes(segmentA.toPath())).isEqualTo(bytesA);
    assertThat(Files.readAllBytes(segmentB.toPath())).isEqualTo(bytesB);
  }

  /** Fails to move the staged segment with the given name to its final location. */
  private static class FailingPublishFileIO extends LocalFileIO {
    private final String segmentName;

    private FailingPublishFileIO(String segmentName) {
      this.segmentName = segmentName;
    }

    @Override
    public void rename(String source, String target, boolean overwrite) {
      if (source.contains(IndexFiles.TEMPORARY_DIR) && source.endsWith("/" + segmentName)) {
        throw new RuntimeIOException("Cannot publish %s", segmentName);
      }

      super.rename(source, target, overwrite);
    }
  }
}
