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

/** Session configuration keys and their defaults. */
public class SieveProperties {

  private SieveProperties() {}

  /** Selects the session backend: {@code default} (local files) or {@code extended} (Hadoop). */
  public static final String SESSION_BACKEND = "sieve.session.backend";

  public static final String SESSION_BACKEND_DEFAULT = "default";

  public static final String WORKER_THREADS = "sieve.worker.num-threads";

  /** Comma-separated statistics kinds kept for every index segment. */
  public static final String STATISTICS_TYPES = "sieve.index.statistics.types";

  public static final String STATISTICS_TYPES_DEFAULT = "minmax";

  public static final String BLOOM_FILTER_FPP = "sieve.index.bloom-filter.fpp";

  public static final double BLOOM_FILTER_FPP_DEFAULT = 0.01;

  public static final String BLOOM_FILTER_EXPECTED_KEYS = "sieve.index.bloom-filter.expected-keys";

  public static final int BLOOM_FILTER_EXPECTED_KEYS_DEFAULT = 10000;

  /**
   * Attempts after the first for a failed build task. A task that still fails aborts the whole job.
   */
  public static final String TASK_RETRIES = "sieve.task.retries";

  public static final int TASK_RETRIES_DEFAULT = 0;
}
