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

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * An interface that outlines the operations a distributed compute runtime has to provide for it to be driven by a
 * {@link DistributedExecutorService}. Placement, transport, and fault tolerance of the units of work are the responsibility of the
 * implementations.
 *
 * <p>A backend is a reference-counted handle. It is initialized lazily by its first user and every call to
 * {@link #init(BackendConfig)} acquires a reference to it, which allows multiple executors to share it. Users give up their references
 * by calling {@link #release()}; the backend is torn down when the last reference is released or when {@link #shutdown()} is called.
 * After a teardown, it may be initialized again.</p>
 *
 * @author Viktor Csomor
 */
public interface ComputeBackend {

  /**
   * Acquires a reference to the backend. If the backend is not initialized, it is initialized or attached to an existing cluster if the
   * configuration specifies an address. If it is already initialized, the existing context is returned and the configuration is
   * ignored.
   *
   * @param config The configuration of the backend.
   * @return The context of the initialized backend.
   * @throws FailedStartupException If the cluster could not be started or attached to.
   */
  BackendContext init(BackendConfig config) throws FailedStartupException;

  /**
   * Returns whether the backend is initialized.
   *
   * @return Whether {@link #init(BackendConfig)} has been called since the construction or the last shutdown of the backend.
   */
  boolean isInitialized();

  /**
   * Returns the context of the backend if it is initialized.
   *
   * @return The context of the backend.
   */
  Optional<BackendContext> getContext();

  /**
   * Schedules the specified task as an independent invocation. The backend is free to run it on any of its available resources.
   *
   * @param name A human-readable name of the task for observability.
   * @param task The task to execute.
   * @param <T> The return type of the task.
   * @return A handle for waiting on, cancelling, and retrieving the outcome of the task.
   * @throws IllegalStateException If the backend is not initialized.
   */
  <T> ResultHandle<T> remote(String name, Callable<T> task);

  /**
   * Creates a new long-lived worker.
   *
   * @return A handle to the new worker.
   * @throws IllegalStateException If the backend is not initialized.
   */
  Worker newWorker();

  /**
   * Releases a reference acquired by {@link #init(BackendConfig)}. If it was the last reference, the backend is torn down the same way
   * as by {@link #shutdown()}. Calling it on an uninitialized backend has no effect.
   */
  void release();

  /**
   * Tears down the backend regardless of the number of references held to it. Workers created by the backend are terminated and tasks that have not started executing fail with a
   * {@link DisruptedExecutionException}. Calling it on an uninitialized backend has no effect.
   */
  void shutdown();

}
