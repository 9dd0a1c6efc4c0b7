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
package io.sieve.commands;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.sieve.FileMeta;
import io.sieve.IndexMeta;
import io.sieve.PartitionMetadata;
import io.sieve.StructLike;
import io.sieve.build.BuildResult;
import io.sieve.catalog.Relation;
import io.sieve.session.SieveSession;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings every index of a relation up to date with its data files.
 *
 * <p>Each index known to any partition is built in append mode, so only data files without a
 * segment are read. Only directories where new segments were written get new metadata, which
 * then defines every index of the relation and tracks the newly indexed files.
 *
 * <p>Each index is built by its own job and each job commits on its own. If a later job aborts,
 * segments committed by earlier jobs stay in place but no metadata is written. The next
 * successful refresh rebuilds the missing segments and records the files they cover.
 */
public class RefreshIndex extends BaseIndexCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RefreshIndex.class);

  public RefreshIndex(Relation relation) {
    super(relation);
  }

  @Override
  public List<StructLike> run(SieveSession session) {
    String readerClassName = readerClassName("refresh");
    Map<String, Optional<PartitionMetadata>> existing =
        loadMetadata(session, nonEmptyPartitions());
    Map<String, IndexMeta> indexes = allIndexes(existing);
    if (indexes.isEmpty()) {
      LOG.info("No indexes to refresh on {}", relation().name());
      return ImmutableList.of();
    }

    LOG.info("Refreshing indexes {} on {}", indexes.keySet(), relation().name());
    List<BuildResult> results = Lists.newArrayList();
    for (IndexMeta indexMeta : indexes.values()) {
      results.addAll(buildIndex(session, indexMeta.name(), indexMeta.definition(), true));
    }

    Map<String, List<BuildResult>> resultsByParent = byParent(results);
    for (Map.Entry<String, List<BuildResult>> entry : resultsByParent.entrySet()) {
      String dir = entry.getKey();
      Optional<PartitionMetadata> meta = existing.getOrDefault(dir, Optional.empty());
      PartitionMetadata.Builder builder = PartitionMetadata.builder();
      if (meta.isPresent()) {
        builder.withSchema(meta.get().schema());
        meta.get().fileMetas().forEach(builder::addFileMeta);
      } else {
        builder.withSchema(relation().schema());
      }

      indexes.values().forEach(builder::addIndexMeta);
      builder.withReaderClassName(readerClassName);

      for (BuildResult result : entry.getValue()) {
        if (!builder.containsFileMeta(result.dataFile())) {
          builder.addFileMeta(
              FileMeta.of(result.fingerprint(), result.rowCount(), result.dataFile()));
        }
      }

      session.metadataStore().write(dir, builder.build(), true);
    }

    LOG.info("Refreshed {} directories of {}", resultsByParent.size(), relation().name());
    relation().fileCatalog().refresh();
    return ImmutableList.of();
  }
}
