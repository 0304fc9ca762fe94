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

import java.util.Iterator;

/**
 * A lazy iterator over the results of a mapping. All the tasks of the mapping are submitted before the iterator is created, so iterating
 * only ever waits for results. Closing the iterator before it is exhausted releases the tasks whose results have not been consumed; what
 * that means depends on the executor.
 *
 * @param <T> The result type.
 * @author Viktor Csomor
 */
public interface ResultIterator<T> extends Iterator<T>, AutoCloseable {

  /**
   * Returns the next result, waiting for it if necessary.
   *
   * @return The next result.
   * @throws UncheckedTimeoutException If the deadline of the mapping passes while waiting for the result.
   * @throws UncheckedExecutionException If the task producing the result failed or the waiting thread got interrupted.
   * @throws java.util.concurrent.CancellationException If the task producing the result was cancelled.
   * @throws java.util.NoSuchElementException If there are no more results.
   */
  @Override
  T next();

  @Override
  void close();

}
