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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Function;
import net.viktorc.dx4j.api.BackendConfig;
import net.viktorc.dx4j.api.BackendContext;
import net.viktorc.dx4j.api.ComputeBackend;
import net.viktorc.dx4j.api.DistributedExecutorService;
import net.viktorc.dx4j.api.FailedStartupException;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.ResultIterator;
import net.viktorc.dx4j.api.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An implementation of the {@link DistributedExecutorService} interface that distributes the submitted tasks over a {@link ComputeBackend}.
 * If it is constructed without a worker count, every submission becomes an independent invocation and the backend decides how many tasks
 * run in parallel. If a worker count is specified, a {@link WorkerPool} of that many workers is created and the tasks are executed by the
 * workers of the pool, bounding the parallelism by the worker count.
 *
 * <p>The two configurations differ in the order in which {@link #starMap(Function, long, TimeUnit, int, Iterable[])} returns the
 * results: with a worker pool, the results are returned in the order the tasks complete; without one, in the order the tasks were
 * submitted in.</p>
 *
 * <p>If <code>destroyBackendOnShutdown</code> is <code>false</code>, shutting the executor down only clears the list of outstanding
 * handles, leaving the backend running for other executors, and the executor keeps accepting submissions. Otherwise, the shutdown
 * releases the reference the executor acquired on the backend and any further submission is rejected. The backend is only torn down
 * once no other executor holds a reference to it.</p>
 *
 * <p>This class uses <a href="https://www.slf4j.org/">SLF4J</a> for logging.</p>
 *
 * @author Viktor Csomor
 */
public class DistributedExecutor implements DistributedExecutorService {

  private static final String LAMBDA_CLASS_MARKER = "$$Lambda";
  private static final Logger LOGGER = LoggerFactory.getLogger(DistributedExecutor.class);

  private final ComputeBackend backend;
  private final Integer workerCount;
  private final boolean destroyBackendOnShutdown;
  private final BackendContext context;
  private final WorkerPool workerPool;
  private final List<ResultHandle<?>> outstandingHandles;
  private final CountDownLatch terminationLatch;
  private final Object mainLock;

  private volatile boolean shutdown;

  /**
   * Constructs an executor that distributes its tasks over the specified backend. The executor acquires a reference to the backend,
   * which initializes it with the configuration unless it is already initialized, in which case the executor shares it.
   *
   * @param backend The backend to execute the tasks on.
   * @param workerCount The number of workers to execute the tasks with. If it is <code>null</code>, every task is an independent
   * invocation and the parallelism is determined by the backend.
   * @param destroyBackendOnShutdown Whether the executor's reference to the backend is to be released when the executor is shut down,
   * tearing the backend down if no other executor holds it.
   * @param config The configuration to initialize the backend with.
   * @throws FailedStartupException If the backend fails to initialize.
   * @throws IllegalArgumentException If the backend or the configuration is <code>null</code> or the worker count is less than 1.
   */
  public DistributedExecutor(ComputeBackend backend, Integer workerCount, boolean destroyBackendOnShutdown, BackendConfig config)
      throws FailedStartupException {
    if (backend == null) {
      throw new IllegalArgumentException("The backend cannot be null");
    }
    if (config == null) {
      throw new IllegalArgumentException("The backend configuration cannot be null");
    }
    if (workerCount != null && workerCount < 1) {
      throw new IllegalArgumentException(String.format("The worker count must be at least 1; %d given", workerCount));
    }
    this.backend = backend;
    this.workerCount = workerCount;
    this.destroyBackendOnShutdown = destroyBackendOnShutdown;
    outstandingHandles = new ArrayList<>();
    terminationLatch = new CountDownLatch(1);
    mainLock = new Object();
    context = backend.init(config);
    try {
      workerPool = workerCount == null ? null : new WorkerPool(backend, workerCount);
    } catch (RuntimeException e) {
      backend.release();
      throw e;
    }
    LOGGER.debug("Executor {} started on {} with {}", this, context,
        workerCount == null ? "independent invocations" : String.format("a pool of %d workers", workerCount));
  }

  /**
   * Constructs an executor using the default backend configuration. See
   * {@link #DistributedExecutor(ComputeBackend, Integer, boolean, BackendConfig)}.
   *
   * @param backend The backend to execute the tasks on.
   * @param workerCount The number of workers to execute the tasks with or <code>null</code>.
   * @param destroyBackendOnShutdown Whether the executor's reference to the backend is to be released when the executor is shut down.
   * @throws FailedStartupException If the backend fails to initialize.
   */
  public DistributedExecutor(ComputeBackend backend, Integer workerCount, boolean destroyBackendOnShutdown) throws FailedStartupException {
    this(backend, workerCount, destroyBackendOnShutdown, new SimpleBackendConfig());
  }

  /**
   * Constructs an executor that leaves the backend running on shutdown. See
   * {@link #DistributedExecutor(ComputeBackend, Integer, boolean, BackendConfig)}.
   *
   * @param backend The backend to execute the tasks on.
   * @param workerCount The number of workers to execute the tasks with or <code>null</code>.
   * @throws FailedStartupException If the backend fails to initialize.
   */
  public DistributedExecutor(ComputeBackend backend, Integer workerCount) throws FailedStartupException {
    this(backend, workerCount, false);
  }

  /**
   * Constructs an executor without a worker pool that leaves the backend running on shutdown. See
   * {@link #DistributedExecutor(ComputeBackend, Integer, boolean, BackendConfig)}.
   *
   * @param backend The backend to execute the tasks on.
   * @throws FailedStartupException If the backend fails to initialize.
   */
  public DistributedExecutor(ComputeBackend backend) throws FailedStartupException {
    this(backend, null);
  }

  /**
   * Derives a human-readable name from the class of the function. Lambdas and method references are named after the class they are
   * declared in.
   *
   * @param function The function to name.
   * @return The name of the function.
   */
  static String getTaskName(Object function) {
    String className = function.getClass().getName();
    String name = className.substring(className.lastIndexOf('.') + 1);
    int lambdaMarkerIndex = name.indexOf(LAMBDA_CLASS_MARKER);
    return lambdaMarkerIndex < 0 ? name : name.substring(0, lambdaMarkerIndex) + ".lambda";
  }

  /**
   * Returns the backend the executor distributes its tasks over.
   *
   * @return The backend.
   */
  public ComputeBackend getBackend() {
    return backend;
  }

  /**
   * Returns the number of workers the executor was constructed with.
   *
   * @return The worker count or an empty optional if the executor uses independent invocations.
   */
  public Optional<Integer> getWorkerCount() {
    return Optional.ofNullable(workerCount);
  }

  /**
   * Returns the pool of workers executing the tasks.
   *
   * @return The worker pool or an empty optional if the executor uses independent invocations.
   */
  public Optional<WorkerPool> getWorkerPool() {
    return Optional.ofNullable(workerPool);
  }

  /**
   * Returns whether the executor releases its reference to the backend when it is shut down.
   *
   * @return Whether the shutdown releases the backend.
   */
  public boolean isDestroyBackendOnShutdown() {
    return destroyBackendOnShutdown;
  }

  /**
   * Returns the handles of the tasks submitted since the construction or the last shutdown of the executor.
   *
   * @return A snapshot of the outstanding handles in the order of submission.
   */
  public List<ResultHandle<?>> getOutstandingHandles() {
    synchronized (mainLock) {
      return new ArrayList<>(outstandingHandles);
    }
  }

  /**
   * Throws an exception if the executor has been shut down.
   *
   * @throws RejectedExecutionException If the executor has been shut down.
   */
  private void checkShutdown() {
    if (shutdown) {
      throw new RejectedExecutionException("New task submitted after the executor was shut down");
    }
  }

  /**
   * Submits the task to the worker pool if there is one or to the backend as an independent invocation, and records the handle of the
   * task. The submission and the recording of the handle are atomic.
   *
   * @param name The name of the task.
   * @param task The task to execute.
   * @param <T> The return type of the task.
   * @return The handle of the task.
   * @throws RejectedExecutionException If the executor has been shut down or the backend does not accept the task.
   */
  private <T> ResultHandle<T> submitTask(String name, Callable<T> task) {
    synchronized (mainLock) {
      checkShutdown();
      ResultHandle<T> handle;
      try {
        handle = workerPool != null ? workerPool.submit(name, task) : backend.remote(name, task);
      } catch (IllegalStateException e) {
        throw new RejectedExecutionException(e);
      }
      outstandingHandles.add(handle);
      LOGGER.trace("Task {} submitted", handle);
      return handle;
    }
  }

  /**
   * Waits for the handles in the running state to complete. Failures of the tasks are logged. If the thread is interrupted, it stops
   * waiting and restores the interrupt flag.
   *
   * @param handles The handles to wait for.
   */
  private void awaitRunningTasks(List<ResultHandle<?>> handles) {
    LOGGER.debug("Waiting for running tasks to complete...");
    for (ResultHandle<?> handle : handles) {
      if (!handle.isRunning()) {
        continue;
      }
      try {
        handle.get();
      } catch (ExecutionException | CancellationException e) {
        LOGGER.debug(String.format("Task %s did not complete successfully", handle), e);
      } catch (InterruptedException e) {
        LOGGER.warn(e.getMessage(), e);
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  @Override
  public BackendContext getContext() {
    return context;
  }

  @Override
  public <T> ResultHandle<T> submit(Callable<T> task) {
    if (task == null) {
      throw new IllegalArgumentException("The task cannot be null");
    }
    return submitTask(getTaskName(task), task);
  }

  @Override
  public <T> ResultHandle<T> submit(Runnable task, T result) {
    if (task == null) {
      throw new IllegalArgumentException("The task cannot be null");
    }
    return submitTask(getTaskName(task), () -> {
      task.run();
      return result;
    });
  }

  @Override
  public ResultHandle<?> submit(Runnable task) {
    return submit(task, null);
  }

  @Override
  public <A, T> ResultHandle<T> submit(Function<? super A, ? extends T> function, A arg) {
    if (function == null) {
      throw new IllegalArgumentException("The function cannot be null");
    }
    return submitTask(getTaskName(function), () -> function.apply(arg));
  }

  @Override
  public <A, B, T> ResultHandle<T> submit(BiFunction<? super A, ? super B, ? extends T> function, A arg1, B arg2) {
    if (function == null) {
      throw new IllegalArgumentException("The function cannot be null");
    }
    return submitTask(getTaskName(function), () -> function.apply(arg1, arg2));
  }

  /**
   * Submits a task for each tuple of the zipped iterables and returns an iterator over the results.
   *
   * @param name The name of the tasks.
   * @param function The function to apply to the list of arguments at each position.
   * @param timeout The maximum amount of time to wait for all the results. If it is negative, there is no limit.
   * @param unit The time unit of the timeout.
   * @param chunkSize Must be at least 1; it has no other effect.
   * @param iterables The iterables to zip.
   * @param <T> The result type.
   * @return An iterator over the results in completion order if there is a worker pool or in submission order otherwise.
   */
  private <T> ResultIterator<T> mapTasks(String name, Function<? super List<Object>, ? extends T> function, long timeout, TimeUnit unit,
      int chunkSize, Iterable<?>... iterables) {
    if (unit == null) {
      throw new IllegalArgumentException("The time unit cannot be null");
    }
    if (chunkSize < 1) {
      throw new IllegalArgumentException("The chunk size must be at least 1");
    }
    checkShutdown();
    Deadline deadline = Deadline.after(timeout, unit);
    List<Iterator<?>> iterators = new ArrayList<>(iterables.length);
    for (Iterable<?> iterable : iterables) {
      iterators.add(iterable.iterator());
    }
    // Every task is submitted before the first result is requested.
    List<ResultHandle<T>> handles = new ArrayList<>();
    while (!iterators.isEmpty() && iterators.stream().allMatch(Iterator::hasNext)) {
      List<Object> args = new ArrayList<>(iterators.size());
      for (Iterator<?> iterator : iterators) {
        args.add(iterator.next());
      }
      List<Object> argList = Collections.unmodifiableList(args);
      handles.add(submitTask(name, () -> function.apply(argList)));
    }
    LOGGER.debug("{} tasks of mapping {} submitted", handles.size(), name);
    if (workerPool != null) {
      return new CompletionOrderIterator<>(handles, deadline);
    }
    return new SubmissionOrderIterator<>(handles, deadline);
  }

  @Override
  public <T> ResultIterator<T> starMap(Function<? super List<Object>, ? extends T> function, long timeout, TimeUnit unit, int chunkSize,
      Iterable<?>... iterables) {
    if (function == null) {
      throw new IllegalArgumentException("The function cannot be null");
    }
    return mapTasks(getTaskName(function), function, timeout, unit, chunkSize, iterables);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <A, T> ResultIterator<T> map(Function<? super A, ? extends T> function, Iterable<? extends A> args, long timeout,
      TimeUnit unit) {
    if (function == null) {
      throw new IllegalArgumentException("The function cannot be null");
    }
    return mapTasks(getTaskName(function), argList -> function.apply((A) argList.get(0)), timeout, unit, 1, args);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <A, B, T> ResultIterator<T> map(BiFunction<? super A, ? super B, ? extends T> function, Iterable<? extends A> args1,
      Iterable<? extends B> args2, long timeout, TimeUnit unit) {
    if (function == null) {
      throw new IllegalArgumentException("The function cannot be null");
    }
    return mapTasks(getTaskName(function), argList -> function.apply((A) argList.get(0), (B) argList.get(1)), timeout, unit, 1, args1,
        args2);
  }

  @Override
  public void shutdown(boolean wait, boolean cancelPending) {
    List<ResultHandle<?>> handles;
    synchronized (mainLock) {
      handles = new ArrayList<>(outstandingHandles);
      outstandingHandles.clear();
      if (!destroyBackendOnShutdown) {
        LOGGER.debug("Executor {} released {} outstanding handles; backend left running", this, handles.size());
        return;
      }
      if (shutdown) {
        return;
      }
      shutdown = true;
    }
    LOGGER.debug("Shutting down executor {}...", this);
    if (cancelPending) {
      int numOfCancelledTasks = 0;
      for (ResultHandle<?> handle : handles) {
        if (handle.cancel(false)) {
          numOfCancelledTasks++;
        }
      }
      LOGGER.debug("{} pending tasks cancelled", numOfCancelledTasks);
    }
    if (wait) {
      awaitRunningTasks(handles);
    }
    if (workerPool != null) {
      workerPool.close();
    }
    backend.release();
    terminationLatch.countDown();
    LOGGER.debug("Executor {} shut down", this);
  }

  @Override
  public void execute(Runnable command) {
    Future<?> future = submit(command);
    try {
      future.get();
    } catch (ExecutionException e) {
      throw new UncheckedExecutionException(e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new UncheckedExecutionException(e);
    }
  }

  /**
   * Cancels the tasks that have not started running and releases the backend without waiting for the running tasks if the executor is
   * configured to destroy the backend on shutdown. The tasks are closures handed to the backend, so the returned list is always empty.
   *
   * @return An empty list.
   */
  @Override
  public List<Runnable> shutdownNow() {
    shutdown(false, true);
    return Collections.emptyList();
  }

  @Override
  public boolean isShutdown() {
    return shutdown;
  }

  /**
   * Returns whether the executor has released the backend. An executor that does not destroy the backend on shutdown never terminates.
   */
  @Override
  public boolean isTerminated() {
    return terminationLatch.getCount() == 0;
  }

  /**
   * Waits for a destroying shutdown to release the backend. If the executor is not configured to destroy the backend on shutdown, it
   * never terminates and this method always waits out the whole timeout and returns <code>false</code>, even after
   * {@link #shutdown()}.
   */
  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return terminationLatch.await(timeout, unit);
  }

  @Override
  public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
    List<Future<T>> futures = new ArrayList<>();
    for (Callable<T> t : tasks) {
      futures.add(submit(t));
    }
    for (Future<T> f : futures) {
      try {
        if (!f.isDone()) {
          f.get();
        }
      } catch (ExecutionException | CancellationException e) {
        LOGGER.debug(e.getMessage(), e);
      }
    }
    return futures;
  }

  @Override
  public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit) throws InterruptedException {
    List<Future<T>> futures = new ArrayList<>();
    for (Callable<T> t : tasks) {
      futures.add(submit(t));
    }
    Deadline deadline = Deadline.after(Math.max(timeout, 0), unit);
    for (int i = 0; i < futures.size(); i++) {
      Future<T> f = futures.get(i);
      try {
        if (!f.isDone()) {
          f.get(deadline.getRemainingNanos(), TimeUnit.NANOSECONDS);
        }
      } catch (ExecutionException | CancellationException e) {
        LOGGER.debug(e.getMessage(), e);
      } catch (TimeoutException e) {
        for (int j = i; j < futures.size(); j++) {
          futures.get(j).cancel(true);
        }
        break;
      }
    }
    return futures;
  }

  /**
   * Submits the tasks and returns the result of the first one to complete successfully. The handles are put on a queue as they
   * complete, and the queue is polled until either a task succeeds, all of them fail, or the deadline passes. The tasks that have not
   * started running by then are cancelled.
   *
   * @param tasks The tasks to execute.
   * @param deadline The deadline by which a task has to succeed.
   * @param <T> The return type of the tasks.
   * @return The result of the first successful task.
   * @throws InterruptedException If the thread is interrupted while waiting.
   * @throws ExecutionException If none of the tasks completed successfully.
   * @throws TimeoutException If no task succeeded before the deadline.
   */
  private <T> T invokeFirstSuccessful(Collection<? extends Callable<T>> tasks, Deadline deadline)
      throws InterruptedException, ExecutionException, TimeoutException {
    if (tasks.isEmpty()) {
      throw new IllegalArgumentException("The collection of tasks cannot be empty");
    }
    BlockingQueue<ResultHandle<T>> completedHandles = new LinkedBlockingQueue<>();
    List<ResultHandle<T>> handles = new ArrayList<>(tasks.size());
    try {
      for (Callable<T> t : tasks) {
        ResultHandle<T> handle = submit(t);
        handles.add(handle);
        handle.addDoneCallback(completedHandles::add);
      }
      ExecutionException execException = null;
      for (int i = 0; i < handles.size(); i++) {
        ResultHandle<T> handle;
        if (deadline.isSet()) {
          handle = completedHandles.poll(deadline.getRemainingNanos(), TimeUnit.NANOSECONDS);
          if (handle == null) {
            throw new TimeoutException("No task completed successfully before the deadline");
          }
        } else {
          handle = completedHandles.take();
        }
        try {
          return handle.get();
        } catch (ExecutionException e) {
          execException = e;
        } catch (CancellationException e) {
          LOGGER.debug(e.getMessage(), e);
        }
      }
      if (execException == null) {
        throw new ExecutionException(new Exception("No task completed successfully"));
      }
      throw execException;
    } finally {
      for (ResultHandle<T> handle : handles) {
        handle.cancel(true);
      }
    }
  }

  @Override
  public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
    try {
      return invokeFirstSuccessful(tasks, Deadline.after(-1, TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      throw new IllegalStateException("Timed out without a deadline", e);
    }
  }

  @Override
  public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
      throws InterruptedException, ExecutionException, TimeoutException {
    return invokeFirstSuccessful(tasks, Deadline.after(Math.max(timeout, 0), unit));
  }

  @Override
  public String toString() {
    return String.format("distributedExecutor@%s", Integer.toHexString(hashCode()));
  }

}
