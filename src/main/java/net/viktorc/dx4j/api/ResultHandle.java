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

import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * A {@link Future} representing the deferred outcome of a single unit of work handed to a {@link ComputeBackend}. Besides the standard
 * <code>Future</code> contract, it exposes the life cycle state of the work which only ever moves from {@link State#PENDING} to
 * {@link State#RUNNING} and on to {@link State#FINISHED}, or from {@link State#PENDING} straight to {@link State#CANCELLED}. A unit of work
 * that has started running cannot be cancelled.
 *
 * @param <T> The return type of the unit of work.
 * @author Viktor Csomor
 */
public interface ResultHandle<T> extends Future<T> {

  /**
   * Returns a human-readable name of the unit of work the handle represents.
   *
   * @return The name of the task.
   */
  String getName();

  /**
   * Returns the current state of the unit of work.
   *
   * @return The state of the handle.
   */
  State getState();

  /**
   * Returns whether the unit of work has started but not yet completed its execution.
   *
   * @return Whether the task is running.
   */
  default boolean isRunning() {
    return getState() == State.RUNNING;
  }

  /**
   * Registers a callback to invoke once the handle is done, i.e. it either finished or got cancelled. If the handle is already done, the
   * callback is invoked immediately in the calling thread; otherwise it is invoked exactly once in the thread that completes the handle.
   *
   * @param callback The callback to invoke with this handle as its argument.
   */
  void addDoneCallback(Consumer<? super ResultHandle<T>> callback);

  /**
   * The life cycle states of a unit of work.
   *
   * @author Viktor Csomor
   */
  enum State {
    PENDING,
    RUNNING,
    FINISHED,
    CANCELLED
  }

}
