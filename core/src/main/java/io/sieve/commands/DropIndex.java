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
import com.google.common.collect.Maps;
import io.sieve.PartitionMetadata;
import io.sieve.StructLike;
import io.sieve.catalog.Relation;
import io.sieve.exceptions.IndexNotFoundException;
import io.sieve.index.IndexFiles;
import io.sieve.io.FileInfo;
import io.sieve.io.SupportsPrefixOperations;
import io.sieve.session.SieveSession;
import io.sieve.util.LocationUtil;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Removes an index from the metadata of every partition and deletes its segments. */
public class DropIndex extends BaseIndexCommand {
  private static final Logger LOG = LoggerFactory.getLogger(DropIndex.class);

  private final String indexName;
  private final boolean allowNotExists;

  public DropIndex(Relation relation, String indexName, boolean allowNotExists) {
    super(relation);
    this.indexName = indexName;
    this.allowNotExists = allowNotExists;
  }

  @Override
  public List<StructLike> run(SieveSession session) {
    readerClassName("drop");
    LOG.info("Dropping index {} from {}", indexName, relation().name());

    Map<String, PartitionMetadata> updated = Maps.newLinkedHashMap();
    for (Map.Entry<String, Optional<PartitionMetadata>> entry :
        loadMetadata(session, nonEmptyPartitions()).entrySet()) {
      if (entry.getValue().isEmpty()) {
        continue;
      }

      PartitionMetadata meta = entry.getValue().get();
      if (!meta.containsIndexMeta(indexName)) {
        if (!allowNotExists) {
          throw new IndexNotFoundException(
              "Index %s does not exist on %s (%s)", indexName, relation().name(), entry.getKey());
        }

        LOG.warn("Index {} does not exist in {}", indexName, entry.getKey());
      }

      updated.put(
          entry.getKey(), PartitionMetadata.buildFrom(meta).removeIndexMeta(indexName).build());
    }

    updated.forEach(
        (dir, meta) -> {
          session.metadataStore().write(dir, meta, true);
          deleteSegments(session, dir);
        });

    return ImmutableList.of();
  }

  private void deleteSegments(SieveSession session, String directory) {
    SupportsPrefixOperations io = (SupportsPrefixOperations) session.io();
    String dir = LocationUtil.stripTrailingSlash(directory);
    int deleted = 0;
    for (FileInfo file : io.listPrefix(dir)) {
      if (dir.equals(LocationUtil.parent(file.location()))
          && IndexFiles.isSegmentOf(file.location(), indexName)) {
        io.deleteFile(file.location());
        deleted += 1;
      }
    }

    LOG.info("Deleted {} segments of index {} in {}", deleted, indexName, directory);
  }
}
