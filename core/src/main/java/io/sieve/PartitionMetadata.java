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
package io.sieve;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Metadata for one partition directory.
 *
 * <p>Partition metadata is stored in the directory's sidecar file and tracks the data files that
 * were indexed, the schema the index ordinals refer to, and every index defined on the directory.
 * It is never modified in place: changes go through a {@link Builder} and the result replaces the
 * sidecar as a whole.
 */
@SuppressWarnings("ImmutablesStyle")
@Value.Immutable(builder = false)
@Value.Style(allParameters = true, visibilityString = "PACKAGE")
public interface PartitionMetadata extends Serializable {

  int SUPPORTED_FORMAT_VERSION = 1;
  int DEFAULT_FORMAT_VERSION = 1;

  /**
   * Return the format version of this metadata.
   *
   * @return the format version
   */
  int formatVersion();

  /**
   * Return the schema that index definitions in this directory refer to.
   *
   * @return the partition schema
   */
  Schema schema();

  /**
   * Return the name of the reader class that decodes the directory's data files.
   *
   * @return a class name, opaque to index maintenance
   */
  String readerClassName();

  /**
   * Return the data files tracked by this directory, in the order they were added.
   *
   * @return a list of file metas
   */
  List<FileMeta> fileMetas();

  /**
   * Return the indexes defined on this directory, in the order they were added.
   *
   * @return a list of index metas
   */
  List<IndexMeta> indexMetas();

  @Value.Derived
  @Value.Auxiliary
  default Map<String, FileMeta> fileMetasByPath() {
    ImmutableMap.Builder<String, FileMeta> builder = ImmutableMap.builder();
    for (FileMeta fileMeta : fileMetas()) {
      builder.put(fileMeta.path(), fileMeta);
    }

    return builder.build();
  }

  @Value.Derived
  @Value.Auxiliary
  default Map<String, IndexMeta> indexMetasByName() {
    ImmutableMap.Builder<String, IndexMeta> builder = ImmutableMap.builder();
    for (IndexMeta indexMeta : indexMetas()) {
      builder.put(indexMeta.name(), indexMeta);
    }

    return builder.build();
  }

  default FileMeta fileMeta(String path) {
    return fileMetasByPath().get(path);
  }

  default IndexMeta indexMeta(String name) {
    return indexMetasByName().get(name);
  }

  default boolean containsFileMeta(String path) {
    return fileMetasByPath().containsKey(path);
  }

  default boolean containsIndexMeta(String name) {
    return indexMetasByName().containsKey(name);
  }

  @Value.Check
  default void check() {
    Preconditions.checkArgument(
        formatVersion() > 0 && formatVersion() <= SUPPORTED_FORMAT_VERSION,
        "Unsupported format version: %s",
        formatVersion());
    for (IndexMeta indexMeta : indexMetas()) {
      for (int ordinal : indexMeta.definition().ordinals()) {
        Preconditions.checkArgument(
            ordinal < schema().size(),
            "Invalid index %s: column ordinal %s is not in schema %s",
            indexMeta.name(),
            ordinal,
            schema().asStruct());
      }
    }
  }

  static Builder builder() {
    return new Builder();
  }

  static Builder buildFrom(PartitionMetadata base) {
    return new Builder(base);
  }

  /** Builder for PartitionMetadata. */
  class Builder {
    private final Map<String, FileMeta> fileMetas;
    private final Map<String, IndexMeta> indexMetas;
    private int formatVersion = DEFAULT_FORMAT_VERSION;
    private Schema schema = null;
    private String readerClassName = null;

    private Builder() {
      this.fileMetas = Maps.newLinkedHashMap();
      this.indexMetas = Maps.newLinkedHashMap();
    }

    private Builder(PartitionMetadata base) {
      this.fileMetas = Maps.newLinkedHashMap(base.fileMetasByPath());
      this.indexMetas = Maps.newLinkedHashMap(base.indexMetasByName());
      this.formatVersion = base.formatVersion();
      this.schema = base.schema();
      this.readerClassName = base.readerClassName();
    }

    public Builder withFormatVersion(int newFormatVersion) {
      this.formatVersion = newFormatVersion;
      return this;
    }

    public Builder withSchema(Schema newSchema) {
      Preconditions.checkArgument(newSchema != null, "Invalid schema: null");
      this.schema = newSchema;
      return this;
    }

    public Builder withReaderClassName(String newReaderClassName) {
      Preconditions.checkArgument(newReaderClassName != null, "Invalid reader class name: null");
      this.readerClassName = newReaderClassName;
      return this;
    }

    public Builder addFileMeta(FileMeta fileMeta) {
      Preconditions.checkArgument(fileMeta != null, "Invalid file meta: null");
      Preconditions.checkArgument(
          !fileMetas.containsKey(fileMeta.path()),
          "Cannot add file meta: %s is already tracked",
          fileMeta.path());
      fileMetas.put(fileMeta.path(), fileMeta);
      return this;
    }

    public Builder addIndexMeta(IndexMeta indexMeta) {
      Preconditions.checkArgument(indexMeta != null, "Invalid index meta: null");
      Preconditions.checkArgument(
          !indexMetas.containsKey(indexMeta.name()),
          "Cannot add index %s: an index with that name already exists",
          indexMeta.name());
      indexMetas.put(indexMeta.name(), indexMeta);
      return this;
    }

    /** Removes the index with the given name, if there is one. */
    public Builder removeIndexMeta(String name) {
      indexMetas.remove(name);
      return this;
    }

    public boolean containsFileMeta(String path) {
      return fileMetas.containsKey(path);
    }

    public boolean containsIndexMeta(String name) {
      return indexMetas.containsKey(name);
    }

    public PartitionMetadata build() {
      Preconditions.checkArgument(schema != null, "Cannot build partition metadata: no schema");
      Preconditions.checkArgument(
          readerClassName != null, "Cannot build partition metadata: no reader class name");

      return ImmutablePartitionMetadata.of(
          formatVersion,
          schema,
          readerClassName,
          ImmutableList.copyOf(fileMetas.values()),
          ImmutableList.copyOf(indexMetas.values()));
    }
  }
}
