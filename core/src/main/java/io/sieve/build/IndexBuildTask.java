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
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.sieve.StructLike;
import io.sieve.catalog.DataFile;
import io.sieve.exec.DataFileRows;
import io.sieve.exec.TaskFunction;
import io.sieve.index.IndexDefinition;
import io.sieve.index.IndexFiles;
import io.sieve.index.IndexSegmentWriter;
import io.sieve.io.FileIO;
import io.sieve.statistics.StatisticsManager;
import io.sieve.statistics.StatisticsOptions;
import io.sieve.types.Types;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the index segment of one data file into the job's staging directory.
 *
 * <p>Holds only immutable configuration, so one instance can be shipped to every worker. Rows
 * arrive already projected to the index key columns.
 */
public class IndexBuildTask implements TaskFunction<List<BuildResult>> {
  private static final Logger LOG = LoggerFactory.getLogger(IndexBuildTask.class);

  private final String jobId;
  private final String indexName;
  private final IndexDefinition definition;
  private final Types.StructType keyType;
  private final StatisticsOptions statisticsOptions;
  private final boolean isAppend;
  private final FileIO io;

  public IndexBuildTask(
      String jobId,
      String indexName,
      IndexDefinition definition,
      Types.StructType keyType,
      StatisticsOptions statisticsOptions,
      boolean isAppend,
      FileIO io) {
    Preconditions.checkArgument(jobId != null, "Invalid job id: null");
    Preconditions.checkArgument(indexName != null, "Invalid index name: null");
    this.jobId = jobId;
    this.indexName = indexName;
    this.definition = definition;
    this.keyType = keyType;
    this.statisticsOptions = statisticsOptions;
    this.isAppend = isAppend;
    this.io = io;
  }

  @Override
  public List<BuildResult> apply(DataFileRows rows) {
    DataFile file = rows.file();
    String segment = IndexFiles.segmentLocation(file.path(), indexName);
    if (isAppend && io.newInputFile(segment).exists()) {
      LOG.debug("Skipping {}: segment {} already exists", file.path(), segment);
      return ImmutableList.of();
    }

    IndexSegmentWriter writer =
        new IndexSegmentWriter(definition, keyType, new StatisticsManager(statisticsOptions));
    int position = 0;
    for (StructLike key : rows.rows()) {
      writer.add(key, position);
      position += 1;
    }

    String staged = IndexFiles.stagedSegmentLocation(jobId, file.path(), indexName);
    long length = writer.write(io.newOutputFile(staged));
    LOG.debug(
        "Staged segment {} ({} bytes, {} keys) for {}",
        staged,
        length,
        writer.keyCount(),
        file.path());

    return ImmutableList.of(
        ImmutableBuildResult.builder()
            .fingerprint(fingerprint(file, writer.rowCount()))
            .rowCount(writer.rowCount())
            .dataFile(file.path())
            .parent(file.parent())
            .build());
  }

  private static ByteBuffer fingerprint(DataFile file, long rowCount) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(file.path(), StandardCharsets.UTF_8);
    hasher.putLong(file.length());
    hasher.putLong(rowCount);
    return ByteBuffer.wrap(hasher.hash().asBytes());
  }
}
