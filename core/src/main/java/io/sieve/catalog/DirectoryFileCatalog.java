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
package io.sieve.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.sieve.index.IndexFiles;
import io.sieve.io.FileIO;
import io.sieve.io.FileInfo;
import io.sieve.io.SupportsPrefixOperations;
import io.sieve.util.LocationUtil;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link FileCatalog} that lists every directory under a table location.
 *
 * <p>Files and directories whose names start with {@code .} or {@code _} are hidden, as are index
 * segments. Each directory that holds at least one data file is a partition. The listing is cached
 * until {@link #refresh()}.
 */
public class DirectoryFileCatalog implements FileCatalog {
  private static final Logger LOG = LoggerFactory.getLogger(DirectoryFileCatalog.class);
  private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();

  private final SupportsPrefixOperations io;
  private final String location;
  private final Cache<String, List<PartitionDirectory>> listings;

  public DirectoryFileCatalog(FileIO io, String location) {
    Preconditions.checkArgument(
        io instanceof SupportsPrefixOperations,
        "Cannot list %s: %s does not support prefix listing",
        location,
        io == null ? null : io.getClass().getName());
    this.io = (SupportsPrefixOperations) io;
    this.location = LocationUtil.stripTrailingSlash(location);
    this.listings = Caffeine.newBuilder().softValues().build();
  }

  @Override
  public String location() {
    return location;
  }

  @Override
  public List<PartitionDirectory> partitions() {
    return listings.get(location, this::listPartitions);
  }

  @Override
  public void refresh() {
    LOG.debug("Refreshing file listing of {}", location);
    listings.invalidateAll();
  }

  private List<PartitionDirectory> listPartitions(String root) {
    Map<String, List<DataFile>> filesByParent = Maps.newTreeMap();
    for (FileInfo file : io.listPrefix(root)) {
      if (isHidden(root, file.location()) || IndexFiles.isSegment(file.location())) {
        continue;
      }

      String parent = LocationUtil.parent(file.location());
      filesByParent
          .computeIfAbsent(parent, ignored -> Lists.newArrayList())
          .add(DataFile.of(file.location(), parent, file.size()));
    }

    ImmutableList.Builder<PartitionDirectory> partitions = ImmutableList.builder();
    filesByParent.forEach((dir, files) -> partitions.add(PartitionDirectory.of(dir, files)));
    List<PartitionDirectory> result = partitions.build();
    LOG.info("Listed {} partition directories under {}", result.size(), root);
    return result;
  }

  private static boolean isHidden(String root, String fileLocation) {
    String relative = relativize(root, fileLocation);
    for (String segment : PATH_SPLITTER.split(relative)) {
      if (segment.startsWith(".") || segment.startsWith("_")) {
        return true;
      }
    }

    return false;
  }

  private static String relativize(String root, String fileLocation) {
    int pos = fileLocation.indexOf(pathOf(root));
    if (pos >= 0) {
      return fileLocation.substring(pos + pathOf(root).length());
    }

    return LocationUtil.fileName(fileLocation);
  }

  // the path part of a location, ignoring any scheme and authority
  private static String pathOf(String location) {
    int schemeEnd = location.indexOf("://");
    if (schemeEnd >= 0) {
      int pathStart = location.indexOf('/', schemeEnd + 3);
      return pathStart >= 0 ? location.substring(pathStart) : "/";
    } else if (location.startsWith("file:")) {
      return location.substring("file:".length());
    }

    return location;
  }
}
