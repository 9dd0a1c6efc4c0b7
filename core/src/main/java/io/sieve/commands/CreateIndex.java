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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import io.sieve.FileMeta;
import io.sieve.IndexMeta;
import io.sieve.PartitionMetadata;
import io.sieve.StructLike;
import io.sieve.build.BuildResult;
import io.sieve.catalog.PartitionDirectory;
import io.sieve.catalog.Relation;
import io.sieve.exceptions.IndexAlreadyExistsException;
import io.sieve.index.IndexColumn;
import io.sieve.index.IndexDefinition;
import io.sieve.index.IndexDefinitions;
import io.sieve.index.IndexType;
import io.sieve.session.SieveSession;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates an index on every non-empty partition of a relation.
 *
 * <p>Directories without metadata get a fresh sidecar that tracks the files indexed by this build.
 * Directories with metadata keep their schema and files, and gain the new index.
 */
public class CreateIndex extends BaseIndexCommand {
  private static final Logger LOG = LoggerFactory.getLogger(CreateIndex.class);

  private final String indexName;
  private final List<IndexColumn> columns;
  private final boolean allowExists;
  private final IndexType indexType;

  public CreateIndex(
      Relation relation,
      String indexName,
      List<IndexColumn> columns,
      boolean allowExists,
      IndexType indexType) {
    super(relation);
    Preconditions.checkArgument(columns != null, "Invalid index columns: null");
    Preconditions.checkArgument(indexType != null, "Invalid index type: null");
    this.indexName = indexName;
    this.columns = ImmutableList.copyOf(columns);
    this.allowExists = allowExists;
    this.indexType = indexType;
  }

  @Override
  public List<StructLike> run(SieveSession session) {
    String readerClassName = readerClassName("create");
    IndexDefinitions.validateName(indexName);
    IndexDefinition definition =
        IndexDefinitions.resolve(indexType, columns, relation().schema());

    LOG.info("Creating index {} on {}: {}", indexName, relation().name(), definition);
    List<PartitionDirectory> partitions = nonEmptyPartitions();
    Map<String, Optional<PartitionMetadata>> existing = loadMetadata(session, partitions);

    Map<String, PartitionMetadata.Builder> builders = Maps.newLinkedHashMap();
    for (Map.Entry<String, Optional<PartitionMetadata>> entry : existing.entrySet()) {
      builders.put(entry.getKey(), prepare(entry.getKey(), entry.getValue(), readerClassName));
    }

    builders.values().forEach(builder -> builder.addIndexMeta(IndexMeta.of(indexName, definition)));

    List<BuildResult> results = buildIndex(session, indexName, definition, false);

    // directories that already had metadata keep the files they track
    Map<String, List<BuildResult>> resultsByParent = byParent(results);
    for (Map.Entry<String, PartitionMetadata.Builder> entry : builders.entrySet()) {
      if (existing.get(entry.getKey()).isPresent()) {
        continue;
      }

      for (BuildResult result : resultsByParent.getOrDefault(entry.getKey(), ImmutableList.of())) {
        entry
            .getValue()
            .addFileMeta(FileMeta.of(result.fingerprint(), result.rowCount(), result.dataFile()));
      }
    }

    builders.forEach(
        (dir, builder) -> session.metadataStore().write(dir, builder.build(), true));
    LOG.info("Created index {} in {} directories", indexName, builders.size());
    return ImmutableList.of();
  }

  private PartitionMetadata.Builder prepare(
      String directory, Optional<PartitionMetadata> existing, String readerClassName) {
    PartitionMetadata.Builder builder;
    if (existing.isPresent()) {
      PartitionMetadata meta = existing.get();
      if (meta.containsIndexMeta(indexName)) {
        if (!allowExists) {
          throw new IndexAlreadyExistsException(
              "Index %s already exists on %s (%s)", indexName, relation().name(), directory);
        }

        LOG.warn("Replacing existing index {} in {}", indexName, directory);
      }

      builder = PartitionMetadata.buildFrom(meta).removeIndexMeta(indexName);
    } else {
      builder = PartitionMetadata.builder().withSchema(relation().schema());
    }

    return builder.withReaderClassName(readerClassName);
  }
}
