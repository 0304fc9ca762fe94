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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An interface for executors that distribute the tasks submitted to them over a {@link ComputeBackend}. It extends the
 * {@link ExecutorService} interface with the submission of functions together with their arguments, the mapping of functions over
 * iterables, and a shutdown method that takes the cancellation of pending tasks into account.
 *
 * <p>Unlike regular executor services, an implementation may be configured to leave the backend running on shutdown, in which case
 * {@link #shutdown()} only clears its bookkeeping and further submissions are still accepted.</p>
 *
 * @author Viktor Csomor
 */
public interface DistributedExecutorService extends ExecutorService, AutoCloseable {

  /**
   * Returns the context of the backend the executor distributes its tasks over.
   *
   * @return The backend context.
   */
  BackendContext getContext();

  @Override
  <T> ResultHandle<T> submit(Callable<T> task);

  @Override
  <T> ResultHandle<T> submit(Runnable task, T result);

  @Override
  ResultHandle<?> submit(Runnable task);

  /**
   * Submits the function to be executed with the specified argument.
   *
   * @param function The function to execute.
   * @param arg The argument to apply the function to.
   * @param <A> The argument type.
   * @param <T> The result type.
   * @return A handle representing the outcome of <code>function.apply(arg)</code>.
   * @throws java.util.concurrent.RejectedExecutionException If the executor has been shut down.
   */
  <A, T> ResultHandle<T> submit(Function<? super A, ? extends T> function, A arg);

  /**
   * Submits the function to be executed with the specified arguments.
   *
   * @param function The function to execute.
   * @param arg1 The first argument.
   * @param arg2 The second argument.
   * @param <A> The type of the first argument.
   * @param <B> The type of the second argument.
   * @param <T> The result type.
   * @return A handle representing the outcome of <code>function.apply(arg1, arg2)</code>.
   * @throws java.util.concurrent.RejectedExecutionException If the executor has been shut down.
   */
  <A, B, T> ResultHandle<T> submit(BiFunction<? super A, ? super B, ? extends T> function, A arg1, B arg2);

  /**
   * Maps the function over the zipped iterables. Each tuple of elements at the same position becomes one submission, the number of
   * submissions being bounded by the shortest iterable. All tasks are submitted before this method returns. The order of the results
   * depends on the implementation.
   *
   * @param function The function to apply to the list of arguments at each position.
   * @param timeout The maximum amount of time to wait for all the results. If it is negative, there is no limit.
   * @param unit The time unit of the timeout.
   * @param chunkSize Ignored beyond validation; retained for compatibility with local executors.
   * @param iterables The iterables to zip.
   * @param <T> The result type.
   * @return An iterator over the results.
   * @throws java.util.concurrent.RejectedExecutionException If the executor has been shut down.
   * @throws IllegalArgumentException If the chunk size is less than 1.
   */
  <T> ResultIterator<T> starMap(Function<? super List<Object>, ? extends T> function, long timeout, TimeUnit unit, int chunkSize,
      Iterable<?>... iterables);

  /**
   * Maps the function over the zipped iterables without a deadline. See
   * {@link #starMap(Function, long, TimeUnit, int, Iterable[])}.
   *
   * @param function The function to apply to the list of arguments at each position.
   * @param iterables The iterables to zip.
   * @param <T> The result type.
   * @return An iterator over the results.
   */
  default <T> ResultIterator<T> starMap(Function<? super List<Object>, ? extends T> function, Iterable<?>... iterables) {
    return starMap(function, -1, TimeUnit.NANOSECONDS, 1, iterables);
  }

  /**
   * Maps the function over the iterable with a deadline for all the results.
   *
   * @param function The function to apply.
   * @param args The arguments.
   * @param timeout The maximum amount of time to wait for all the results. If it is negative, there is no limit.
   * @param unit The time unit of the timeout.
   * @param <A> The argument type.
   * @param <T> The result type.
   * @return An iterator over the results.
   */
  @SuppressWarnings("unchecked")
  default <A, T> ResultIterator<T> map(Function<? super A, ? extends T> function, Iterable<? extends A> args, long timeout,
      TimeUnit unit) {
    return starMap(argList -> function.apply((A) argList.get(0)), timeout, unit, 1, args);
  }

  /**
   * Maps the function over the iterable.
   *
   * @param function The function to apply.
   * @param args The arguments.
   * @param <A> The argument type.
   * @param <T> The result type.
   * @return An iterator over the results.
   */
  default <A, T> ResultIterator<T> map(Function<? super A, ? extends T> function, Iterable<? extends A> args) {
    return map(function, args, -1, TimeUnit.NANOSECONDS);
  }

  /**
   * Maps the function over the two zipped iterables with a deadline for all the results.
   *
   * @param function The function to apply.
   * @param args1 The first arguments.
   * @param args2 The second arguments.
   * @param timeout The maximum amount of time to wait for all the results. If it is negative, there is no limit.
   * @param unit The time unit of the timeout.
   * @param <A> The type of the first argument.
   * @param <B> The type of the second argument.
   * @param <T> The result type.
   * @return An iterator over the results.
   */
  @SuppressWarnings("unchecked")
  default <A, B, T> ResultIterator<T> map(BiFunction<? super A, ? super B, ? extends T> function, Iterable<? extends A> args1,
      Iterable<? extends B> args2, long timeout, TimeUnit unit) {
    return starMap(argList -> function.apply((A) argList.get(0), (B) argList.get(1)), timeout, unit, 1, args1, args2);
  }

  /**
   * Maps the function over the two zipped iterables.
   *
   * @param function The function to apply.
   * @param args1 The first arguments.
   * @param args2 The second arguments.
   * @param <A> The type of the first argument.
   * @param <B> The type of the second argument.
   * @param <T> The result type.
   * @return An iterator over the results.
   */
  default <A, B, T> ResultIterator<T> map(BiFunction<? super A, ? super B, ? extends T> function, Iterable<? extends A> args1,
      Iterable<? extends B> args2) {
    return map(function, args1, args2, -1, TimeUnit.NANOSECONDS);
  }

  /**
   * Cleans up the resources associated with the executor. It is safe to call it more than once.
   *
   * @param wait Whether to wait for the running tasks to complete.
   * @param cancelPending Whether to cancel the tasks that have not started running yet.
   */
  void shutdown(boolean wait, boolean cancelPending);

  /**
   * Waits for the running tasks and cleans up the resources of the executor. Equivalent to <code>shutdown(true, false)</code>.
   */
  @Override
  default void shutdown() {
    shutdown(true, false);
  }

  /**
   * Shuts the executor down. It allows the executor to be used in try-with-resources statements.
   */
  @Override
  default void close() {
    shutdown();
  }

}
