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
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import net.viktorc.dx4j.api.DisruptedExecutionException;
import net.viktorc.dx4j.api.ResultHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An implementation of the {@link ResultHandle} interface that is also the {@link Runnable} a backend thread executes. Running the
 * instance moves it into the {@link State#RUNNING} state unless it has been cancelled, calls the wrapped task, and records its return
 * value or the exception it threw. The outcome is recorded exactly once; later attempts to complete the instance are ignored.
 *
 * @param <T> The return type of the task.
 * @author Viktor Csomor
 */
public class TaskFuture<T> implements ResultHandle<T>, Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskFuture.class);

  private final String name;
  private final Callable<? extends T> task;
  private final Object lock;
  private final List<Consumer<? super ResultHandle<T>>> callbacks;

  private State state;
  private T result;
  private Throwable exception;

  /**
   * Constructs a pending handle for the specified task.
   *
   * @param name The name of the task.
   * @param task The task to execute.
   * @throws IllegalArgumentException If the task is null.
   */
  public TaskFuture(String name, Callable<? extends T> task) {
    if (task == null) {
      throw new IllegalArgumentException("The task cannot be null");
    }
    this.name = name;
    this.task = task;
    lock = new Object();
    callbacks = new ArrayList<>();
    state = State.PENDING;
  }

  /**
   * Fails the handles among the specified runnables that have not been completed with a {@link DisruptedExecutionException}. It is meant
   * to be called with the runnables drained from the queue of a thread pool that has been shut down.
   *
   * @param runnables The runnables that never got executed.
   * @param message The reason the runnables are not going to be executed.
   * @return The number of handles that have been failed.
   */
  static int disruptAll(Collection<Runnable> runnables, String message) {
    int count = 0;
    for (Runnable runnable : runnables) {
      if (runnable instanceof TaskFuture && ((TaskFuture<?>) runnable).fail(new DisruptedExecutionException(message))) {
        count++;
      }
    }
    return count;
  }

  /**
   * Moves the handle into the running state if it is still pending.
   *
   * @return Whether the task may be executed; <code>false</code> if the handle has been cancelled or completed.
   */
  boolean setRunningOrNotifyCancel() {
    synchronized (lock) {
      if (state != State.PENDING) {
        return false;
      }
      state = State.RUNNING;
      return true;
    }
  }

  /**
   * Records the return value of the task.
   *
   * @param value The value returned by the task.
   * @return Whether the value was recorded; <code>false</code> if the handle was already done.
   */
  boolean complete(T value) {
    return setOutcome(value, null);
  }

  /**
   * Records the exception the task failed with.
   *
   * @param e The exception.
   * @return Whether the exception was recorded; <code>false</code> if the handle was already done.
   */
  boolean fail(Throwable e) {
    return setOutcome(null, e);
  }

  /**
   * Sets the outcome of the task and notifies the waiting threads and the registered callbacks.
   *
   * @param value The return value of the task.
   * @param e The exception thrown by the task or <code>null</code>.
   * @return Whether the outcome was set.
   */
  private boolean setOutcome(T value, Throwable e) {
    synchronized (lock) {
      if (isDoneState()) {
        return false;
      }
      result = value;
      exception = e;
      state = State.FINISHED;
      lock.notifyAll();
    }
    invokeCallbacks();
    return true;
  }

  /**
   * Returns whether the handle is done. It must be called while holding the lock.
   *
   * @return Whether the state is final.
   */
  private boolean isDoneState() {
    return state == State.FINISHED || state == State.CANCELLED;
  }

  /**
   * Invokes and removes the registered callbacks. Exceptions thrown by the callbacks are logged.
   */
  private void invokeCallbacks() {
    List<Consumer<? super ResultHandle<T>>> callbacksToInvoke;
    synchronized (lock) {
      callbacksToInvoke = new ArrayList<>(callbacks);
      callbacks.clear();
    }
    for (Consumer<? super ResultHandle<T>> callback : callbacksToInvoke) {
      invokeCallback(callback);
    }
  }

  /**
   * Invokes the callback logging any exception it throws.
   *
   * @param callback The callback to invoke.
   */
  private void invokeCallback(Consumer<? super ResultHandle<T>> callback) {
    try {
      callback.accept(this);
    } catch (RuntimeException e) {
      LOGGER.error(String.format("Done callback of %s failed", this), e);
    }
  }

  /**
   * Returns the outcome of the task. It must be called while holding the lock once the handle is done.
   *
   * @return The return value of the task.
   * @throws ExecutionException If the task failed.
   */
  private T getOutcome() throws ExecutionException {
    if (state == State.CANCELLED) {
      throw new CancellationException(String.format("Task %s cancelled", this));
    }
    if (exception != null) {
      throw new ExecutionException(exception);
    }
    return result;
  }

  @Override
  public void run() {
    if (!setRunningOrNotifyCancel()) {
      return;
    }
    LOGGER.trace("Task {} started", this);
    try {
      complete(task.call());
    } catch (Throwable e) {
      LOGGER.trace(String.format("Task %s failed", this), e);
      fail(e);
      if (e instanceof Error) {
        throw (Error) e;
      }
    }
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public State getState() {
    synchronized (lock) {
      return state;
    }
  }

  @Override
  public void addDoneCallback(Consumer<? super ResultHandle<T>> callback) {
    synchronized (lock) {
      if (!isDoneState()) {
        callbacks.add(callback);
        return;
      }
    }
    invokeCallback(callback);
  }

  /**
   * Cancels the task if it has not started running yet. As a running task cannot be cancelled, <code>mayInterruptIfRunning</code> is
   * ignored.
   */
  @Override
  public boolean cancel(boolean mayInterruptIfRunning) {
    synchronized (lock) {
      if (state != State.PENDING) {
        return false;
      }
      state = State.CANCELLED;
      lock.notifyAll();
    }
    LOGGER.trace("Task {} cancelled", this);
    invokeCallbacks();
    return true;
  }

  @Override
  public boolean isCancelled() {
    return getState() == State.CANCELLED;
  }

  @Override
  public boolean isDone() {
    synchronized (lock) {
      return isDoneState();
    }
  }

  @Override
  public T get() throws InterruptedException, ExecutionException {
    synchronized (lock) {
      while (!isDoneState()) {
        lock.wait();
      }
      return getOutcome();
    }
  }

  @Override
  public T get(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
    synchronized (lock) {
      long timeoutNs = unit.toNanos(timeout);
      long deadline = System.nanoTime() + timeoutNs;
      while (!isDoneState() && timeoutNs > 0) {
        lock.wait(timeoutNs / 1000000, (int) (timeoutNs % 1000000));
        timeoutNs = deadline - System.nanoTime();
      }
      if (!isDoneState()) {
        throw new TimeoutException(String.format("Task %s timed out", this));
      }
      return getOutcome();
    }
  }

  @Override
  public String toString() {
    return String.format("%s@%s", name, Integer.toHexString(hashCode()));
  }

}
