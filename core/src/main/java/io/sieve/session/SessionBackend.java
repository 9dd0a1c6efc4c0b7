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
package io.sieve.session;

import com.google.common.base.Preconditions;
import java.util.Locale;

/** Storage backends a session can run against. */
public enum SessionBackend {
  /** Local filesystem. */
  DEFAULT("default"),
  /** Any Hadoop-compatible filesystem, configured through a Hadoop Configuration. */
  EXTENDED("extended");

  private final String backendName;

  SessionBackend(String backendName) {
    this.backendName = backendName;
  }

  public String backendName() {
    return backendName;
  }

  public static SessionBackend fromName(String name) {
    Preconditions.checkArgument(name != null, "Invalid session backend: null");
    String lower = name.toLowerCase(Locale.ROOT);
    for (SessionBackend backend : values()) {
      if (backend.backendName.equals(lower)) {
        return backend;
      }
    }

    throw new IllegalArgumentException(String.format("Unknown session backend: %s", name));
  }
}
