/*
 * Copyright 2017 Viktor Csomor
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.viktorc.dx4j.api;

import java.util.Map;
import java.util.Optional;

/**
 * An interface for the definition of the parameters a {@link ComputeBackend} is initialized with.
 *
 * @author Viktor Csomor
 */
public interface BackendConfig {

  /**
   * Returns the address of an existing cluster to attach to. If it is not present, the backend is expected to start a new local cluster.
   *
   * @return The address of the cluster to connect to.
   */
  Optional<String> getAddress();

  /**
   * Returns the number of CPUs the backend should use for independent invocations if it starts a new cluster.
   *
   * @return The number of CPUs to make available to the cluster.
   */
  Optional<Integer> getNumCpus();

  /**
   * Returns any additional, backend specific options. They are forwarded to the backend verbatim.
   *
   * @return An unmodifiable map of additional options.
   */
  Map<String, String> getOptions();

}
