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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import io.sieve.Schema;
import io.sieve.catalog.DataFile;
import io.sieve.catalog.PartitionDirectory;
import io.sieve.catalog.Relation;
import io.sieve.exceptions.JobAbortedException;
import io.sieve.exceptions.ValidationException;
import io.sieve.exec.ExecutionEngine;
import io.sieve.index.IndexDefinition;
import io.sieve.index.IndexDefinitions;
import io.sieve.index.IndexFiles;
import io.sieve.io.FileIO;
import io.sieve.io.SupportsPrefixOperations;
import io.sieve.io.SupportsRenameOperations;
import io.sieve.statistics.StatisticsOptions;
import io.sieve.util.Tasks;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver side of an index build job.
 *
 * <p>A job moves through {@link JobState}: it is set up on the driver, runs one {@link
 * IndexBuildTask} per data file, and then either commits, publishing every staged segment next to
 * its data file, or aborts, removing everything it staged or published. Metadata is not touched
 * here; callers publish it after a successful commit.
 */
public class IndexBuildCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(IndexBuildCoordinator.class);

  public enum JobState {
    CREATED,
    DRIVER_SETUP,
    RUNNING,
    COMMITTING,
    COMMITTED,
    ABORTING,
    ABORTED
  }

  private final FileIO io;
  private final String indexName;
  private final IndexDefinition definition;
  private final StatisticsOptions statisticsOptions;
  private final boolean isAppend;
  private final String jobId;
  private final Set<String> directories = Sets.newLinkedHashSet();
  private final List<String> published = Lists.newArrayList();
  private final List<String> replaced = Lists.newArrayList();
  private JobState state = JobState.CREATED;

  public IndexBuildCoordinator(
      FileIO io,
      String indexName,
      IndexDefinition definition,
      StatisticsOptions statisticsOptions,
      boolean isAppend) {
    Preconditions.checkArgument(io != null, "Invalid file io: null");
    Preconditions.checkArgument(definition != null, "Invalid index definition: null");
    Preconditions.checkArgument(statisticsOptions != null, "Invalid statistics options: null");
    IndexDefinitions.validateName(indexName);
    this.io = io;
    this.indexName = indexName;
    this.definition = definition;
    this.statisticsOptions = statisticsOptions;
    this.isAppend = isAppend;
    this.jobId = UUID.randomUUID().toString();
  }

  public String jobId() {
    return jobId;
  }

  public JobState state() {
    return state;
  }

  /**
   * Validates the job before any task runs.
   *
   * <p>Failures here leave nothing behind and do not abort the job.
   */
  public void driverSideSetup() {
    transition(JobState.CREATED, JobState.DRIVER_SETUP);
    ValidationException.check(
        !definition.ordinals().isEmpty(), "Cannot build index %s: no key columns", indexName);
    ValidationException.check(
        io instanceof SupportsRenameOperations && io instanceof SupportsPrefixOperations,
        "Cannot build index %s: %s does not support rename and prefix operations",
        indexName,
        io.getClass().getName());
    LOG.info("Set up job {} for index {} (append: {})", jobId, indexName, isAppend);
  }

  /**
   * Runs the job over every data file of the relation and commits it.
   *
   * @param engine runs the per-file tasks
   * @param relation the relation to index
   * @return one result per data file that was indexed
   * @throws JobAbortedException if any task or the commit fails; the job is aborted first
   */
  public List<BuildResult> run(ExecutionEngine engine, Relation relation) {
    Schema schema = relation.schema();
    for (int ordinal : definition.ordinals()) {
      ValidationException.check(
          ordinal < schema.size(),
          "Cannot build index %s: column %s is not in schema %s",
          indexName,
          ordinal,
          schema.asStruct());
    }

    transition(JobState.DRIVER_SETUP, JobState.RUNNING);
    List<DataFile> files = Lists.newArrayList();
    for (PartitionDirectory partition : relation.fileCatalog().partitions()) {
      if (!partition.isEmpty()) {
        directories.add(partition.location());
        files.addAll(partition.files());
      }
    }

    IndexBuildTask task =
        new IndexBuildTask(
            jobId,
            indexName,
            definition,
            IndexDefinitions.keySchema(definition, schema).asStruct(),
            statisticsOptions,
            isAppend,
            io);

    try {
      List<List<BuildResult>> perFile =
          engine.runJob(files, schema, definition.ordinals(), task);
      List<BuildResult> results =
          perFile.stream().flatMap(List::stream).collect(ImmutableList.toImmutableList());
      commitJob(results);
      return results;
    } catch (RuntimeException cause) {
      LOG.error("Aborting job {} for index {}", jobId, indexName, cause);
      abortJob();
      throw new JobAbortedException(jobId, cause, "Job %s aborted: %s", jobId, cause.getMessage());
    }
  }

  /**
   * Publishes every staged segment at its final location and removes the staging directories.
   *
   * <p>A segment that already exists at a final location is moved into the job's staging
   * directory first, so that {@link #abortJob()} can put it back.
   */
  public void commitJob(List<BuildResult> results) {
    transition(JobState.RUNNING, JobState.COMMITTING);
    Tasks.foreach(results)
        .stopOnFailure()
        .throwFailureWhenFinished()
        .run(result -> publish(result.dataFile()));

    deleteStaging();
    this.state = JobState.COMMITTED;
    LOG.info(
        "Committed job {}: {} segments for index {} in {} directories",
        jobId,
        results.size(),
        indexName,
        results.stream().map(BuildResult::parent).collect(Collectors.toSet()).size());
  }

  private void publish(String dataFile) {
    SupportsRenameOperations renames = (SupportsRenameOperations) io;
    String target = IndexFiles.segmentLocation(dataFile, indexName);
    if (io.newInputFile(target).exists()) {
      renames.rename(target, IndexFiles.replacedSegmentLocation(jobId, dataFile, indexName), true);
      replaced.add(dataFile);
    }

    renames.rename(IndexFiles.stagedSegmentLocation(jobId, dataFile, indexName), target, false);
    published.add(dataFile);
  }

  /** Removes everything this job staged or published and restores the segments it replaced. */
  public void abortJob() {
    Preconditions.checkState(
        state == JobState.RUNNING || state == JobState.COMMITTING,
        "Cannot abort job %s in state %s",
        jobId,
        state);
    this.state = JobState.ABORTING;
    SupportsRenameOperations renames = (SupportsRenameOperations) io;
    Tasks.foreach(published)
        .suppressFailureWhenFinished()
        .onFailure(
            (dataFile, exc) ->
                LOG.warn("Failed to remove segment of job {} for {}", jobId, dataFile, exc))
        .run(dataFile -> io.deleteFile(IndexFiles.segmentLocation(dataFile, indexName)));
    Tasks.foreach(replaced)
        .suppressFailureWhenFinished()
        .onFailure(
            (dataFile, exc) ->
                LOG.warn("Failed to restore segment of job {} for {}", jobId, dataFile, exc))
        .run(
            dataFile ->
                renames.rename(
                    IndexFiles.replacedSegmentLocation(jobId, dataFile, indexName),
                    IndexFiles.segmentLocation(dataFile, indexName),
                    true));

    deleteStaging();
    this.state = JobState.ABORTED;
    LOG.info(
        "Aborted job {} for index {}: removed {} published segments, restored {}",
        jobId,
        indexName,
        published.size(),
        replaced.size());
  }

  private void deleteStaging() {
    SupportsPrefixOperations prefixes = (SupportsPrefixOperations) io;
    Tasks.foreach(directories)
        .suppressFailureWhenFinished()
        .onFailure(
            (dir, exc) ->
                LOG.warn("Failed to delete staged files of job {} in {}", jobId, dir, exc))
        .run(dir -> prefixes.deletePrefix(IndexFiles.stagingLocation(dir, jobId)));
  }

  private void transition(JobState from, JobState to) {
    Preconditions.checkState(
        state == from, "Cannot move job %s to %s: expected %s but was %s", jobId, to, from, state);
    this.state = to;
  }
}
