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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import net.viktorc.dx4j.api.BackendConfig;
import net.viktorc.dx4j.api.BackendContext;
import net.viktorc.dx4j.api.ComputeBackend;
import net.viktorc.dx4j.api.FailedStartupException;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An implementation of the {@link ComputeBackend} interface backed by a {@link LocalCluster}. If the configuration it is initialized with
 * does not specify an address, it starts its own cluster which it stops on shutdown; otherwise it attaches to the running cluster
 * registered under the address and only detaches from it on shutdown. Every worker it creates runs on a dedicated thread and is
 * terminated on shutdown. Each initialization counts as a reference to the backend and the backend is only torn down on release once
 * no references remain.
 *
 * @author Viktor Csomor
 */
public class LocalComputeBackend implements ComputeBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalComputeBackend.class);

  private final Object lock;
  private final List<LocalWorker> workers;

  private LocalCluster cluster;
  private LocalBackendContext context;
  private int numOfReferences;

  /**
   * Constructs an uninitialized backend.
   */
  public LocalComputeBackend() {
    lock = new Object();
    workers = new ArrayList<>();
  }

  /**
   * Returns the number of references held to the backend.
   *
   * @return The number of initializations not yet matched by a release.
   */
  public int getNumOfReferences() {
    synchronized (lock) {
      return numOfReferences;
    }
  }

  /**
   * Returns the cluster the backend is initialized with.
   *
   * @return The cluster.
   * @throws IllegalStateException If the backend is not initialized.
   */
  private LocalCluster getCluster() {
    if (cluster == null) {
      throw new IllegalStateException("The backend is not initialized");
    }
    return cluster;
  }

  @Override
  public BackendContext init(BackendConfig config) throws FailedStartupException {
    if (config == null) {
      throw new IllegalArgumentException("The configuration cannot be null");
    }
    synchronized (lock) {
      if (context != null) {
        numOfReferences++;
        LOGGER.debug("Backend already initialized with {}; ignoring configuration {} ({} references)", context, config,
            numOfReferences);
        return context;
      }
      boolean clusterOwner;
      Optional<String> address = config.getAddress();
      if (address.isPresent()) {
        cluster = LocalCluster.lookup(address.get())
            .orElseThrow(() -> new FailedStartupException(String.format("No running cluster at address %s", address.get())));
        clusterOwner = false;
        LOGGER.debug("Backend attached to {}", cluster);
      } else {
        cluster = LocalCluster.start(config.getNumCpus().orElse(Runtime.getRuntime().availableProcessors()));
        clusterOwner = true;
        LOGGER.debug("Backend started {}", cluster);
      }
      context = new LocalBackendContext(cluster.getAddress(), cluster.getNumCpus(), clusterOwner, config.getOptions());
      numOfReferences = 1;
      return context;
    }
  }

  @Override
  public boolean isInitialized() {
    synchronized (lock) {
      return context != null;
    }
  }

  @Override
  public Optional<BackendContext> getContext() {
    synchronized (lock) {
      return Optional.ofNullable(context);
    }
  }

  @Override
  public <T> ResultHandle<T> remote(String name, Callable<T> task) {
    LocalCluster localCluster;
    synchronized (lock) {
      localCluster = getCluster();
    }
    return localCluster.schedule(name, task);
  }

  @Override
  public Worker newWorker() {
    synchronized (lock) {
      LocalWorker worker = new LocalWorker(String.format("%s-worker-%d", getCluster().getAddress(), workers.size()));
      workers.add(worker);
      LOGGER.trace("Worker {} created", worker);
      return worker;
    }
  }

  @Override
  public void release() {
    synchronized (lock) {
      if (context == null) {
        return;
      }
      if (--numOfReferences > 0) {
        LOGGER.debug("Backend reference released; {} references left", numOfReferences);
        return;
      }
      tearDown();
    }
  }

  @Override
  public void shutdown() {
    synchronized (lock) {
      if (context == null) {
        return;
      }
      tearDown();
    }
  }

  /**
   * Terminates the workers and stops or detaches from the cluster. It must be called while holding the lock.
   */
  private void tearDown() {
    for (LocalWorker worker : workers) {
      worker.terminate();
    }
    workers.clear();
    if (context.isClusterOwner()) {
      cluster.stop();
    } else {
      LOGGER.debug("Backend detached from {}", cluster);
    }
    cluster = null;
    context = null;
    numOfReferences = 0;
  }

  @Override
  public String toString() {
    return String.format("localComputeBackend@%s", Integer.toHexString(hashCode()));
  }

  /**
   * The context of an initialized {@link LocalComputeBackend}.
   *
   * @author Viktor Csomor
   */
  private static class LocalBackendContext implements BackendContext {

    private final String address;
    private final int numCpus;
    private final boolean clusterOwner;
    private final Map<String, String> options;

    /**
     * Constructs a context according to the specified parameters.
     *
     * @param address The address of the cluster.
     * @param numCpus The number of CPUs of the cluster.
     * @param clusterOwner Whether the backend started the cluster.
     * @param options The options of the backend.
     */
    LocalBackendContext(String address, int numCpus, boolean clusterOwner, Map<String, String> options) {
      this.address = address;
      this.numCpus = numCpus;
      this.clusterOwner = clusterOwner;
      this.options = options;
    }

    @Override
    public String getAddress() {
      return address;
    }

    @Override
    public int getNumCpus() {
      return numCpus;
    }

    @Override
    public boolean isClusterOwner() {
      return clusterOwner;
    }

    @Override
    public Map<String, String> getOptions() {
      return options;
    }

    @Override
    public String toString() {
      return String.format("{address:%s,numCpus:%d,clusterOwner:%s}", address, numCpus, clusterOwner);
    }

  }

}
