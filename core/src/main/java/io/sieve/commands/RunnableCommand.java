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

import com.google.common.collect.ImmutableList;
import io.sieve.Schema;
import io.sieve.StructLike;
import io.sieve.session.SieveSession;
import java.util.List;

/** An index maintenance command over one relation. */
public interface RunnableCommand {
  Schema NO_OUTPUT = new Schema(ImmutableList.of());

  /** Returns the schema of the rows returned by {@link #run}. */
  default Schema output() {
    return NO_OUTPUT;
  }

  /**
   * Runs the command.
   *
   * @param session the session to run in
   * @return result rows matching {@link #output()}; empty for commands with no output
   */
  List<StructLike> run(SieveSession session);
}
