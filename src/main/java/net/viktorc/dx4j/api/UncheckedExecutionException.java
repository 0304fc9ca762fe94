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

/**
 * An exception thrown where the execution of a task fails or is interrupted but the signature of the method does not allow for checked
 * exceptions, e.g. while iterating over the results of {@link DistributedExecutorService#map(java.util.function.Function, Iterable)}.
 *
 * @author Viktor Csomor
 */
public class UncheckedExecutionException extends RuntimeException {

  /**
   * Constructs a wrapper for the specified exception.
   *
   * @param e The source exception.
   */
  public UncheckedExecutionException(Throwable e) {
    super(e);
  }

}
