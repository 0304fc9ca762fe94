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

/**
 * The settings and attributes of an initialized {@link ComputeBackend} connection.
 *
 * @author Viktor Csomor
 */
public interface BackendContext {

  /**
   * Returns the resolved address of the cluster the backend is connected to.
   *
   * @return The address of the cluster.
   */
  String getAddress();

  /**
   * Returns the number of CPUs available to independent invocations in the cluster.
   *
   * @return The number of CPUs of the cluster.
   */
  int getNumCpus();

  /**
   * Returns whether the backend started the cluster itself as opposed to attaching to an existing one.
   *
   * @return Whether the cluster is owned by the backend.
   */
  boolean isClusterOwner();

  /**
   * Returns the options the backend was initialized with.
   *
   * @return An unmodifiable map of the options.
   */
  Map<String, String> getOptions();

}
