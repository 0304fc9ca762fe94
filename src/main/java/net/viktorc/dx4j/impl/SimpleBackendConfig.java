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
package net.viktorc.dx4j.impl;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import net.viktorc.dx4j.api.BackendConfig;

/**
 * A simple implementation of the {@link BackendConfig} interface.
 *
 * @author Viktor Csomor
 */
public class SimpleBackendConfig implements BackendConfig {

  private final String address;
  private final Integer numCpus;
  private final Map<String, String> options;

  /**
   * Constructs a <code>SimpleBackendConfig</code> instance according to the specified parameters.
   *
   * @param address The address of the cluster to attach to. If it is null, a new local cluster is started.
   * @param numCpus The number of CPUs of the new cluster. If it is null, it will be ignored.
   * @param options Additional backend specific options. If it is null, it will be ignored.
   * @throws IllegalArgumentException If the number of CPUs is less than 1.
   */
  public SimpleBackendConfig(String address, Integer numCpus, Map<String, String> options) {
    if (numCpus != null && numCpus < 1) {
      throw new IllegalArgumentException("The number of CPUs must be at least 1");
    }
    this.address = address;
    this.numCpus = numCpus;
    this.options = options == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(options));
  }

  /**
   * Constructs a <code>SimpleBackendConfig</code> instance according to the specified parameters.
   *
   * @param address The address of the cluster to attach to. If it is null, a new local cluster is started.
   * @param numCpus The number of CPUs of the new cluster. If it is null, it will be ignored.
   */
  public SimpleBackendConfig(String address, Integer numCpus) {
    this(address, numCpus, null);
  }

  /**
   * Constructs a <code>SimpleBackendConfig</code> instance for attaching to the cluster at the specified address.
   *
   * @param address The address of the cluster to attach to. If it is null, a new local cluster is started.
   */
  public SimpleBackendConfig(String address) {
    this(address, null);
  }

  /**
   * Constructs a <code>SimpleBackendConfig</code> instance for starting a new local cluster with the specified number of CPUs.
   *
   * @param numCpus The number of CPUs of the new cluster.
   */
  public SimpleBackendConfig(int numCpus) {
    this(null, numCpus);
  }

  /**
   * Constructs a <code>SimpleBackendConfig</code> instance for starting a new local cluster with the default parameters.
   */
  public SimpleBackendConfig() {
    this(null, null);
  }

  @Override
  public Optional<String> getAddress() {
    return Optional.ofNullable(address);
  }

  @Override
  public Optional<Integer> getNumCpus() {
    return Optional.ofNullable(numCpus);
  }

  @Override
  public Map<String, String> getOptions() {
    return options;
  }

  @Override
  public String toString() {
    return String.format("{address:%s,numCpus:%s,options:%s}", address, numCpus, options);
  }

}
