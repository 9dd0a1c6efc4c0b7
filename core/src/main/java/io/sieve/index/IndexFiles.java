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
package io.sieve.index;

import io.sieve.util.LocationUtil;

/**
 * Locations of index segment files.
 *
 * <p>Each data file gets one segment per index, next to it: {@code <base>.<index>.index}, where
 * {@code base} is the data file name without its extension. While a build runs, segments are
 * staged under {@code <dir>/_temporary/<jobId>/}.
 */
public class IndexFiles {
  public static final String EXTENSION = ".index";
  public static final String TEMPORARY_DIR = "_temporary";
  private static final String REPLACED_SUFFIX = ".replaced";

  private IndexFiles() {}

  public static String segmentName(String dataFile, String indexName) {
    String fileName = LocationUtil.fileName(dataFile);
    int dot = fileName.lastIndexOf('.');
    String base = dot > 0 ? fileName.substring(0, dot) : fileName;
    return base + "." + indexName + EXTENSION;
  }

  /** Returns the published location of the segment for {@code dataFile}. */
  public static String segmentLocation(String dataFile, String indexName) {
    return LocationUtil.join(LocationUtil.parent(dataFile), segmentName(dataFile, indexName));
  }

  public static String stagingLocation(String directory, String jobId) {
    return LocationUtil.join(LocationUtil.join(directory, TEMPORARY_DIR), jobId);
  }

  /** Returns where a job stages the segment for {@code dataFile} before commit. */
  public static String stagedSegmentLocation(String jobId, String dataFile, String indexName) {
    return LocationUtil.join(
        stagingLocation(LocationUtil.parent(dataFile), jobId), segmentName(dataFile, indexName));
  }

  /** Returns where a job keeps the segment it replaces for {@code dataFile} until it commits. */
  public static String replacedSegmentLocation(String jobId, String dataFile, String indexName) {
    return stagedSegmentLocation(jobId, dataFile, indexName) + REPLACED_SUFFIX;
  }

  public static boolean isSegment(String location) {
    return location.endsWith(EXTENSION);
  }

  public static boolean isSegmentOf(String location, String indexName) {
    return location.endsWith("." + indexName + EXTENSION);
  }
}
