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

import net.viktorc.dx4j.api.ComputeBackend;
import net.viktorc.dx4j.api.DistributedExecutorService;
import net.viktorc.dx4j.api.FailedStartupException;

/**
 * A class for convenience and factory methods for creating instances of implementations of the {@link
 * net.viktorc.dx4j.api.DistributedExecutorService} interface.
 *
 * @author Viktor Csomor
 */
public class DistributedExecutors {

  /**
   * Not initializable; only static methods...
   */
  private DistributedExecutors() {
  }

  /**
   * Returns an executor that submits every task as an independent invocation to the backend, leaving the degree of parallelism up to the
   * backend. Shutting the executor down does not destroy the backend. It is a convenience method for the constructor {@link
   * net.viktorc.dx4j.impl.DistributedExecutor#DistributedExecutor(ComputeBackend)}.
   *
   * @param backend The backend to distribute the tasks over.
   * @return An executor without a worker pool.
   * @throws FailedStartupException If the backend fails to initialize.
   */
  public static DistributedExecutorService newElasticExecutor(ComputeBackend backend) throws FailedStartupException {
    return new DistributedExecutor(backend);
  }

  /**
   * Returns an executor backed by a pool of a fixed number of workers. Shutting the executor down does not destroy the backend. It is a
   * convenience method for the constructor {@link net.viktorc.dx4j.impl.DistributedExecutor#DistributedExecutor(ComputeBackend,
   * Integer)}.
   *
   * @param backend The backend to create the workers with.
   * @param numOfWorkers The number of workers in the pool.
   * @return An executor with a fixed size worker pool.
   * @throws FailedStartupException If the backend fails to initialize.
   */
  public static DistributedExecutorService newFixedExecutor(ComputeBackend backend, int numOfWorkers) throws FailedStartupException {
    return new DistributedExecutor(backend, numOfWorkers);
  }

  /**
   * Returns an executor backed by a single worker that executes the tasks one at a time. It is a convenience method for calling {@link
   * #newFixedExecutor(ComputeBackend, int)} with <code>numOfWorkers</code> set to <code>1</code>.
   *
   * @param backend The backend to create the worker with.
   * @return An executor with a single worker.
   * @throws FailedStartupException If the backend fails to initialize.
   */
  public static DistributedExecutorService newSingleWorkerExecutor(ComputeBackend backend) throws FailedStartupException {
    return newFixedExecutor(backend, 1);
  }

  /**
   * Returns an executor running on a new {@link LocalCluster} with one CPU per available processor. The executor owns its backend, so
   * shutting it down stops the cluster.
   *
   * @param numOfWorkers The number of workers in the pool or <code>null</code> if the tasks are to be submitted as independent
   * invocations.
   * @return An executor running on a local cluster.
   * @throws FailedStartupException If the local cluster fails to start.
   */
  public static DistributedExecutorService newLocalExecutor(Integer numOfWorkers) throws FailedStartupException {
    return new DistributedExecutor(new LocalComputeBackend(), numOfWorkers, true);
  }

  /**
   * Returns an executor running on a new {@link LocalCluster} that submits every task as an independent invocation. It is a convenience
   * method for calling {@link #newLocalExecutor(Integer)} with <code>numOfWorkers</code> set to <code>null</code>.
   *
   * @return An executor running on a local cluster.
   * @throws FailedStartupException If the local cluster fails to start.
   */
  public static DistributedExecutorService newLocalExecutor() throws FailedStartupException {
    return newLocalExecutor(null);
  }

  /**
   * Returns an executor attached to the running {@link LocalCluster} registered under the specified address. Shutting the executor down
   * detaches it from the cluster without stopping it.
   *
   * @param address The address of the cluster.
   * @param numOfWorkers The number of workers in the pool or <code>null</code> if the tasks are to be submitted as independent
   * invocations.
   * @return An executor attached to a running local cluster.
   * @throws FailedStartupException If there is no cluster running at the address.
   */
  public static DistributedExecutorService newClusterExecutor(String address, Integer numOfWorkers) throws FailedStartupException {
    return new DistributedExecutor(new LocalComputeBackend(), numOfWorkers, true, new SimpleBackendConfig(address));
  }

}
