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
import com.google.common.collect.Maps;
import io.sieve.IndexMeta;
import io.sieve.PartitionMetadata;
import io.sieve.build.BuildResult;
import io.sieve.build.IndexBuildCoordinator;
import io.sieve.catalog.PartitionDirectory;
import io.sieve.catalog.Relation;
import io.sieve.exceptions.UnsupportedRelationException;
import io.sieve.index.IndexDefinition;
import io.sieve.session.SieveSession;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

abstract class BaseIndexCommand implements RunnableCommand {
  private final Relation relation;

  BaseIndexCommand(Relation relation) {
    Preconditions.checkArgument(relation != null, "Invalid relation: null");
    this.relation = relation;
  }

  Relation relation() {
    return relation;
  }

  /**
   * Returns the reader class name of the relation's format.
   *
   * @throws UnsupportedRelationException if indexes cannot be kept for the format
   */
  String readerClassName(String action) {
    if (!relation.format().isIndexable()) {
      throw new UnsupportedRelationException(
          "Cannot %s index on %s: unsupported format %s",
          action,
          relation.name(),
          relation.format());
    }

    return relation.format().readerClassName();
  }

  List<PartitionDirectory> nonEmptyPartitions() {
    return relation.fileCatalog().partitions().stream()
        .filter(partition -> !partition.isEmpty())
        .collect(Collectors.toList());
  }

  /** Loads the metadata of every partition, keyed by directory, before anything is written. */
  static Map<String, Optional<PartitionMetadata>> loadMetadata(
      SieveSession session, List<PartitionDirectory> partitions) {
    Map<String, Optional<PartitionMetadata>> metadata = Maps.newLinkedHashMap();
    for (PartitionDirectory partition : partitions) {
      metadata.put(partition.location(), session.metadataStore().load(partition.location()));
    }

    return metadata;
  }

  /** Returns every index defined in any partition, by name; the first definition seen wins. */
  static Map<String, IndexMeta> allIndexes(Map<String, Optional<PartitionMetadata>> metadata) {
    Map<String, IndexMeta> indexes = Maps.newLinkedHashMap();
    for (Optional<PartitionMetadata> meta : metadata.values()) {
      meta.ifPresent(
          existing -> {
            for (IndexMeta indexMeta : existing.indexMetas()) {
              indexes.putIfAbsent(indexMeta.name(), indexMeta);
            }
          });
    }

    return indexes;
  }

  /** Builds an index over every data file of the relation and commits the segments. */
  List<BuildResult> buildIndex(
      SieveSession session, String indexName, IndexDefinition definition, boolean isAppend) {
    IndexBuildCoordinator coordinator =
        new IndexBuildCoordinator(
            session.io(), indexName, definition, session.statisticsOptions(), isAppend);
    // setup failures leave nothing to clean up
    coordinator.driverSideSetup();
    return coordinator.run(session.engine(), relation);
  }

  static Map<String, List<BuildResult>> byParent(List<BuildResult> results) {
    return results.stream()
        .collect(
            Collectors.groupingBy(
                BuildResult::parent, Maps::newLinkedHashMap, Collectors.toList()));
  }
}
