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

import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.ResultIterator;
import net.viktorc.dx4j.api.UncheckedExecutionException;
import net.viktorc.dx4j.api.UncheckedTimeoutException;

/**
 * A {@link ResultIterator} that returns the results of a group of tasks in the order the tasks complete. Each call to {@link #next()}
 * blocks until at least one of the tasks whose result has not been returned yet completes or the deadline passes. Tasks whose results have
 * not been consumed are left alone, so closing the iterator has no effect.
 *
 * @param <T> The result type.
 * @author Viktor Csomor
 */
class CompletionOrderIterator<T> implements ResultIterator<T> {

  private final BlockingQueue<ResultHandle<T>> completedHandles;
  private final int numOfHandles;
  private final Deadline deadline;

  private int numOfConsumedHandles;

  /**
   * Constructs an iterator over the results of the specified handles.
   *
   * @param handles The handles of the tasks.
   * @param deadline The deadline for producing all the results.
   */
  CompletionOrderIterator(List<? extends ResultHandle<T>> handles, Deadline deadline) {
    this.deadline = deadline;
    completedHandles = new LinkedBlockingQueue<>();
    numOfHandles = handles.size();
    for (ResultHandle<T> handle : handles) {
      handle.addDoneCallback(completedHandles::add);
    }
  }

  /**
   * Blocks until the next handle completes.
   *
   * @return The next completed handle.
   * @throws InterruptedException If the thread is interrupted while waiting.
   * @throws TimeoutException If the deadline passes while waiting.
   */
  private ResultHandle<T> takeNextCompleted() throws InterruptedException, TimeoutException {
    if (!deadline.isSet()) {
      return completedHandles.take();
    }
    ResultHandle<T> handle = completedHandles.poll(deadline.getRemainingNanos(), TimeUnit.NANOSECONDS);
    if (handle == null) {
      throw new TimeoutException(String.format("%d of %d results not produced in time", numOfHandles - numOfConsumedHandles,
          numOfHandles));
    }
    return handle;
  }

  @Override
  public boolean hasNext() {
    return numOfConsumedHandles < numOfHandles;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    ResultHandle<T> handle;
    try {
      handle = takeNextCompleted();
    } catch (TimeoutException e) {
      throw new UncheckedTimeoutException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UncheckedExecutionException(e);
    }
    numOfConsumedHandles++;
    try {
      return handle.get();
    } catch (ExecutionException e) {
      throw new UncheckedExecutionException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UncheckedExecutionException(e);
    }
  }

  @Override
  public void close() {
  }

}
