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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.ResultIterator;
import net.viktorc.dx4j.api.UncheckedExecutionException;
import net.viktorc.dx4j.api.UncheckedTimeoutException;

/**
 * A {@link ResultIterator} that returns the results of a group of tasks in the order the tasks were submitted in, waiting for each with
 * the time remaining until the deadline. Every handle is cancelled once it has been waited on, which has no effect if it completed. If
 * waiting for a result fails or the iterator is closed before it is exhausted, the handles whose results have not been consumed are
 * cancelled.
 *
 * @param <T> The result type.
 * @author Viktor Csomor
 */
class SubmissionOrderIterator<T> implements ResultIterator<T> {

  private final Deque<ResultHandle<T>> remainingHandles;
  private final Deadline deadline;

  /**
   * Constructs an iterator over the results of the specified handles.
   *
   * @param handles The handles of the tasks in the order of submission.
   * @param deadline The deadline for producing all the results.
   */
  SubmissionOrderIterator(List<? extends ResultHandle<T>> handles, Deadline deadline) {
    this.deadline = deadline;
    remainingHandles = new ArrayDeque<>(handles);
  }

  /**
   * Waits for the result of the handle and cancels it afterwards.
   *
   * @param handle The handle to wait on.
   * @return The result of the task.
   * @throws InterruptedException If the thread is interrupted while waiting.
   * @throws ExecutionException If the task failed.
   * @throws TimeoutException If the deadline passes while waiting.
   */
  private T resultOrCancel(ResultHandle<T> handle) throws InterruptedException, ExecutionException, TimeoutException {
    try {
      if (deadline.isSet()) {
        return handle.get(deadline.getRemainingNanos(), TimeUnit.NANOSECONDS);
      }
      return handle.get();
    } finally {
      handle.cancel(false);
    }
  }

  @Override
  public boolean hasNext() {
    return !remainingHandles.isEmpty();
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    boolean success = false;
    try {
      T result = resultOrCancel(remainingHandles.pollFirst());
      success = true;
      return result;
    } catch (TimeoutException e) {
      throw new UncheckedTimeoutException(e);
    } catch (ExecutionException e) {
      throw new UncheckedExecutionException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UncheckedExecutionException(e);
    } finally {
      if (!success) {
        close();
      }
    }
  }

  @Override
  public void close() {
    ResultHandle<T> handle;
    while ((handle = remainingHandles.pollFirst()) != null) {
      handle.cancel(false);
    }
  }

}
