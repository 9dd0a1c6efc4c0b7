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
package io.sieve.exceptions;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Exception raised after an index build job has been aborted.
 *
 * <p>The cause is the task failure that triggered the abort. By the time this is thrown, every
 * staged output of the job has been removed and no metadata has been written.
 */
public class JobAbortedException extends RuntimeException {
  private final String jobId;

  @FormatMethod
  public JobAbortedException(String jobId, Throwable cause, String message, Object... args) {
    super(String.format(message, args), cause);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
