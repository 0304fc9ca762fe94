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
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import net.viktorc.dx4j.api.ComputeBackend;
import net.viktorc.dx4j.api.DisruptedExecutionException;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.Worker;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.PooledObjectFactory;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-size pool of {@link Worker} instances created by a {@link ComputeBackend}. Submitted tasks are handed to the next idle worker
 * or, if all the workers are busy, queued in the order of submission until a worker becomes available. The idle and busy workers are kept
 * track of by a non-blocking {@link GenericObjectPool}, and every submission is assigned a monotonically increasing task index under the
 * lock of the pool. This class uses <a href="https://www.slf4j.org/">SLF4J</a> for logging.
 *
 * @author Viktor Csomor
 */
public class WorkerPool implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

  private final int size;
  private final GenericObjectPool<Worker> workers;
  private final Deque<TaskFuture<?>> taskQueue;
  private final Object lock;

  private long nextTaskIndex;
  private boolean closed;

  /**
   * Constructs a pool and creates all its workers.
   *
   * @param backend The backend to create the workers with. It has to be initialized.
   * @param size The number of workers in the pool.
   * @throws IllegalArgumentException If the backend is null or the size is less than 1.
   * @throws IllegalStateException If the backend fails to create the workers.
   */
  public WorkerPool(ComputeBackend backend, int size) {
    if (backend == null) {
      throw new IllegalArgumentException("The backend cannot be null");
    }
    if (size < 1) {
      throw new IllegalArgumentException("The size of the worker pool must be at least 1");
    }
    this.size = size;
    workers = new GenericObjectPool<>(new WorkerFactory(backend));
    workers.setBlockWhenExhausted(false);
    workers.setMaxTotal(size);
    workers.setMaxIdle(size);
    // Workers that stopped are replaced on borrowing.
    workers.setTestOnBorrow(true);
    // FIFO so that the workers take turns.
    workers.setLifo(false);
    taskQueue = new ArrayDeque<>();
    lock = new Object();
    try {
      for (int i = 0; i < size; i++) {
        workers.addObject();
      }
    } catch (Exception e) {
      workers.close();
      throw new IllegalStateException("Failed to create the workers of the pool", e);
    }
    LOGGER.debug("Worker pool of {} workers started", size);
  }

  /**
   * Returns the number of workers the pool was created with.
   *
   * @return The size of the pool.
   */
  public int getSize() {
    return size;
  }

  /**
   * Returns the number of workers not executing a task.
   *
   * @return The number of idle workers.
   */
  public int getNumOfIdleWorkers() {
    return workers.getNumIdle();
  }

  /**
   * Returns the number of workers executing a task.
   *
   * @return The number of busy workers.
   */
  public int getNumOfBusyWorkers() {
    return workers.getNumActive();
  }

  /**
   * Returns the number of tasks waiting for a worker.
   *
   * @return The number of queued tasks.
   */
  public int getNumOfQueuedTasks() {
    synchronized (lock) {
      return taskQueue.size();
    }
  }

  /**
   * Returns the index the next submitted task will be assigned.
   *
   * @return The next task index.
   */
  public long getNextTaskIndex() {
    synchronized (lock) {
      return nextTaskIndex;
    }
  }

  /**
   * Returns whether the pool has been closed.
   *
   * @return Whether {@link #close()} has been called.
   */
  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /**
   * Returns the statistics of the pool as a string.
   *
   * @return A string of statistics concerning the pool.
   */
  private String getPoolStats() {
    return "Idle workers: " + workers.getNumIdle() + "; busy workers: " + workers.getNumActive() + "; queued tasks: " + taskQueue.size();
  }

  /**
   * Submits the task to the next idle worker or queues it if all the workers are busy. It does not block.
   *
   * @param name The name of the task.
   * @param task The task to execute.
   * @param <T> The return type of the task.
   * @return The handle of the task assigned the next task index.
   * @throws IllegalStateException If the pool has been closed.
   */
  public <T> ResultHandle<T> submit(String name, Callable<T> task) {
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("The worker pool has been closed");
      }
      long taskIndex = nextTaskIndex++;
      TaskFuture<T> future = new TaskFuture<>(String.format("%s#%d", name, taskIndex), task);
      taskQueue.addLast(future);
      LOGGER.trace("Task {} received", future);
      dispatchQueuedTasks();
      return future;
    }
  }

  /**
   * Hands queued tasks to idle workers while there are both. Tasks cancelled while in the queue are discarded. It must be called while
   * holding the lock.
   */
  private void dispatchQueuedTasks() {
    while (!closed && !taskQueue.isEmpty()) {
      if (taskQueue.peekFirst().isDone()) {
        LOGGER.trace("Task {} discarded", taskQueue.pollFirst());
        continue;
      }
      Worker worker = borrowIdleWorker();
      if (worker == null) {
        return;
      }
      dispatch(worker, taskQueue.pollFirst());
    }
  }

  /**
   * Takes an idle worker out of the object pool without blocking.
   *
   * @return An idle worker or <code>null</code> if all the workers are busy.
   */
  private Worker borrowIdleWorker() {
    try {
      return workers.borrowObject();
    } catch (NoSuchElementException e) {
      return null;
    } catch (Exception e) {
      throw new IllegalStateException("Failed to borrow a worker", e);
    }
  }

  /**
   * Has the worker execute the task and arranges for the worker to be returned to the pool once it is done. It must be called while
   * holding the lock.
   *
   * @param worker The borrowed worker.
   * @param future The task to execute.
   */
  private void dispatch(Worker worker, TaskFuture<?> future) {
    ResultHandle<Void> workerHandle;
    try {
      workerHandle = worker.invoke(() -> {
        future.run();
        return null;
      });
    } catch (IllegalStateException e) {
      future.fail(new DisruptedExecutionException(e));
      discardWorker(worker);
      return;
    }
    LOGGER.trace("Task {} dispatched to worker {}", future, worker);
    workerHandle.addDoneCallback(h -> onWorkerDone(worker, future));
  }

  /**
   * Returns the worker to the pool and dispatches the next queued task. If the task never got to run because the worker was terminated,
   * the task fails with a {@link DisruptedExecutionException}.
   *
   * @param worker The worker that is done.
   * @param future The task the worker executed.
   */
  private void onWorkerDone(Worker worker, TaskFuture<?> future) {
    if (future.fail(new DisruptedExecutionException(String.format("Worker %s stopped before completing task %s", worker, future)))) {
      LOGGER.debug("Task {} disrupted", future);
    }
    synchronized (lock) {
      if (worker.isAlive()) {
        workers.returnObject(worker);
      } else {
        discardWorker(worker);
      }
      LOGGER.trace("Task {} done; {}", future, getPoolStats());
      dispatchQueuedTasks();
    }
  }

  /**
   * Removes a worker that stopped from the object pool. It must be called while holding the lock.
   *
   * @param worker The worker to remove.
   */
  private void discardWorker(Worker worker) {
    try {
      workers.invalidateObject(worker);
    } catch (Exception e) {
      LOGGER.warn(String.format("Failed to discard worker %s", worker), e);
    }
  }

  /**
   * Closes the pool and terminates its workers. Idle workers are terminated immediately and busy ones once they are done with their
   * current tasks. Queued tasks fail with a {@link DisruptedExecutionException}. Calling it more than once has no effect.
   */
  @Override
  public void close() {
    List<TaskFuture<?>> queuedTasks;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      queuedTasks = new ArrayList<>(taskQueue);
      taskQueue.clear();
      workers.close();
    }
    for (TaskFuture<?> future : queuedTasks) {
      future.fail(new DisruptedExecutionException(String.format("Worker pool closed before task %s could start", future)));
    }
    LOGGER.debug("Worker pool closed; {} queued tasks disrupted", queuedTasks.size());
  }

  @Override
  public String toString() {
    return String.format("workerPool@%s", Integer.toHexString(hashCode()));
  }

  /**
   * An implementation of the {@link PooledObjectFactory} interface for creating workers through the backend and terminating them when
   * they are evicted from the object pool.
   *
   * @author Viktor Csomor
   */
  private static class WorkerFactory implements PooledObjectFactory<Worker> {

    private final ComputeBackend backend;

    /**
     * Constructs a factory using the specified backend.
     *
     * @param backend The backend to create the workers with.
     */
    WorkerFactory(ComputeBackend backend) {
      this.backend = backend;
    }

    @Override
    public PooledObject<Worker> makeObject() {
      return new DefaultPooledObject<>(backend.newWorker());
    }

    @Override
    public void destroyObject(PooledObject<Worker> p) {
      p.getObject().terminate();
    }

    @Override
    public boolean validateObject(PooledObject<Worker> p) {
      return p.getObject().isAlive();
    }

    @Override
    public void activateObject(PooledObject<Worker> p) { /* No-operation. */ }

    @Override
    public void passivateObject(PooledObject<Worker> p) { /* No-operation. */ }

  }

}
