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
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An implementation of the {@link Worker} interface that executes the tasks invoked on it sequentially on a dedicated daemon thread.
 *
 * @author Viktor Csomor
 */
class LocalWorker implements Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalWorker.class);

  private final String name;
  private final ThreadPoolExecutor thread;

  /**
   * Constructs a worker and starts its thread.
   *
   * @param name The name of the worker.
   */
  LocalWorker(String name) {
    this.name = name;
    thread = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), new NamedThreadFactory(name));
    thread.prestartCoreThread();
  }

  @Override
  public <T> ResultHandle<T> invoke(Callable<T> task) {
    TaskFuture<T> future = new TaskFuture<>(name, task);
    try {
      thread.execute(future);
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException(String.format("Worker %s has been terminated", name), e);
    }
    return future;
  }

  @Override
  public boolean isAlive() {
    return !thread.isShutdown();
  }

  @Override
  public synchronized void terminate() {
    if (thread.isShutdown()) {
      return;
    }
    List<Runnable> unstartedTasks = thread.shutdownNow();
    int numOfDisruptedTasks = TaskFuture.disruptAll(unstartedTasks, String.format("Worker %s terminated", name));
    LOGGER.debug("Worker {} terminated; {} unstarted tasks disrupted", name, numOfDisruptedTasks);
  }

  @Override
  public String toString() {
    return name;
  }

}
