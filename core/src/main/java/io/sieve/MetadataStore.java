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
import io.sieve.exceptions.AlreadyExistsException;
import io.sieve.exceptions.CorruptMetadataException;
import io.sieve.io.FileIO;
import io.sieve.io.InputFile;
import io.sieve.io.OutputFile;
import io.sieve.io.SupportsRenameOperations;
import io.sieve.util.LocationUtil;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and publishes the {@link PartitionMetadata} sidecar of partition directories.
 *
 * <p>Writes go to a temporary file in the same directory that is then renamed over the sidecar, so
 * readers see either the previous metadata or the new metadata, never a partial file.
 */
public class MetadataStore {
  private static final Logger LOG = LoggerFactory.getLogger(MetadataStore.class);

  public static final String SIDECAR_NAME = ".sieve.meta";
  private static final String TEMP_SUFFIX = ".tmp";

  private final SupportsRenameOperations io;

  public MetadataStore(FileIO io) {
    Preconditions.checkArgument(
        io instanceof SupportsRenameOperations,
        "Cannot store partition metadata: %s does not support atomic rename",
        io == null ? null : io.getClass().getName());
    this.io = (SupportsRenameOperations) io;
  }

  public static String sidecarLocation(String directory) {
    return LocationUtil.join(directory, SIDECAR_NAME);
  }

  public boolean exists(String directory) {
    return io.newInputFile(sidecarLocation(directory)).exists();
  }

  /**
   * Loads the metadata of a partition directory.
   *
   * @param directory a partition directory location
   * @return the metadata, or empty if the directory has no sidecar
   * @throws CorruptMetadataException if the sidecar exists but cannot be parsed
   */
  public Optional<PartitionMetadata> load(String directory) {
    InputFile sidecar = io.newInputFile(sidecarLocation(directory));
    if (!sidecar.exists()) {
      return Optional.empty();
    }

    LOG.debug("Loading partition metadata from {}", sidecar.location());
    return Optional.of(PartitionMetadataParser.read(sidecar));
  }

  /**
   * Publishes metadata for a partition directory.
   *
   * @param directory a partition directory location
   * @param metadata the metadata to publish
   * @param overwrite whether an existing sidecar may be replaced
   * @throws AlreadyExistsException if overwrite is false and the directory already has a sidecar
   */
  public void write(String directory, PartitionMetadata metadata, boolean overwrite) {
    Preconditions.checkArgument(metadata != null, "Invalid partition metadata: null");
    String sidecar = sidecarLocation(directory);
    if (!overwrite && io.newInputFile(sidecar).exists()) {
      throw new AlreadyExistsException("Partition metadata already exists: %s", sidecar);
    }

    String temp =
        LocationUtil.join(directory, SIDECAR_NAME + "." + UUID.randomUUID() + TEMP_SUFFIX);
    OutputFile tempFile = io.newOutputFile(temp);
    PartitionMetadataParser.write(metadata, tempFile);

    try {
      io.rename(temp, sidecar, overwrite);
    } catch (RuntimeException e) {
      try {
        io.deleteFile(temp);
      } catch (RuntimeException deleteFailure) {
        e.addSuppressed(deleteFailure);
      }

      throw e;
    }

    LOG.info("Committed partition metadata {}", sidecar);
  }
}
