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

import java.util.concurrent.Callable;

/**
 * A handle to a long-lived worker of a {@link ComputeBackend}. A worker executes the units of work invoked on it one at a time in the
 * order of invocation.
 *
 * @author Viktor Csomor
 */
public interface Worker {

  /**
   * Has the worker execute the specified task once it is done with the tasks invoked on it earlier. It does not block.
   *
   * @param task The task to execute.
   * @param <T> The return type of the task.
   * @return A handle for waiting on, cancelling, and retrieving the outcome of the task.
   * @throws IllegalStateException If the worker has been terminated.
   */
  <T> ResultHandle<T> invoke(Callable<T> task);

  /**
   * Returns whether the worker still accepts invocations.
   *
   * @return Whether the worker has not been terminated.
   */
  boolean isAlive();

  /**
   * Terminates the worker. Tasks that have not started executing yet fail with a {@link DisruptedExecutionException}. Calling it more
   * than once has no effect.
   */
  void terminate();

}
