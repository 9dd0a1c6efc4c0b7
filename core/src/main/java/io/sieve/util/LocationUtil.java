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
package io.sieve.util;

import com.google.common.base.Preconditions;

public class LocationUtil {
  private static final String PATH_DELIM = "/";

  private LocationUtil() {}

  public static String stripTrailingSlash(String path) {
    Preconditions.checkArgument(
        path != null && path.length() > 0, "path must not be null or empty");

    String result = path;
    while (result.length() > 1 && result.endsWith(PATH_DELIM)) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  /** Returns {@code name} resolved inside the directory {@code location}. */
  public static String join(String location, String name) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Invalid name: null or empty");
    String dir = stripTrailingSlash(location);
    return dir.endsWith(PATH_DELIM) ? dir + name : dir + PATH_DELIM + name;
  }

  /** Returns the last path segment of a location. */
  public static String fileName(String location) {
    String path = stripTrailingSlash(location);
    return path.substring(path.lastIndexOf(PATH_DELIM) + 1);
  }

  /** Returns the location without its last path segment, or null for a bare name. */
  public static String parent(String location) {
    String path = stripTrailingSlash(location);
    int pos = path.lastIndexOf(PATH_DELIM);
    if (pos < 0) {
      return null;
    } else if (pos == 0) {
      return PATH_DELIM;
    }

    return path.substring(0, pos);
  }
}
