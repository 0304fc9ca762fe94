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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.viktorc.dx4j.api.ResultHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-JVM stand-in for a compute cluster. It runs independent invocations on a fixed number of daemon threads, one per CPU of the
 * cluster. Running clusters are registered under their addresses so that {@link LocalComputeBackend} instances can attach to them.
 *
 * @author Viktor Csomor
 */
public class LocalCluster {

  private static final String ADDRESS_FORMAT = "local://127.0.0.1:%d";
  private static final int FIRST_PORT = 6379;
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalCluster.class);
  private static final AtomicInteger PORT_COUNTER = new AtomicInteger(FIRST_PORT);
  private static final Map<String, LocalCluster> RUNNING_CLUSTERS = new ConcurrentHashMap<>();

  private final String address;
  private final int numCpus;
  private final ThreadPoolExecutor taskThreadPool;

  /**
   * Constructs a cluster with the specified number of CPUs.
   *
   * @param address The address of the cluster.
   * @param numCpus The number of threads to run independent invocations on.
   */
  private LocalCluster(String address, int numCpus) {
    this.address = address;
    this.numCpus = numCpus;
    taskThreadPool = new ThreadPoolExecutor(numCpus, numCpus, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
        new NamedThreadFactory("localCluster[" + address + "]"));
  }

  /**
   * Starts a new cluster and registers it under a newly assigned address.
   *
   * @param numCpus The number of CPUs of the cluster.
   * @return The running cluster.
   * @throws IllegalArgumentException If the number of CPUs is less than 1.
   */
  public static LocalCluster start(int numCpus) {
    if (numCpus < 1) {
      throw new IllegalArgumentException("The number of CPUs must be at least 1");
    }
    String address = String.format(ADDRESS_FORMAT, PORT_COUNTER.getAndIncrement());
    LocalCluster cluster = new LocalCluster(address, numCpus);
    RUNNING_CLUSTERS.put(address, cluster);
    LOGGER.debug("Local cluster started at {} with {} CPUs", address, numCpus);
    return cluster;
  }

  /**
   * Looks up the running cluster registered under the specified address.
   *
   * @param address The address of the cluster.
   * @return The cluster at the address if there is one running.
   */
  public static Optional<LocalCluster> lookup(String address) {
    return Optional.ofNullable(RUNNING_CLUSTERS.get(address));
  }

  /**
   * Returns the address of the cluster.
   *
   * @return The address the cluster is registered under.
   */
  public String getAddress() {
    return address;
  }

  /**
   * Returns the number of CPUs of the cluster.
   *
   * @return The number of threads independent invocations are executed on.
   */
  public int getNumCpus() {
    return numCpus;
  }

  /**
   * Returns whether the cluster is running.
   *
   * @return Whether the cluster has not been stopped yet.
   */
  public boolean isRunning() {
    return !taskThreadPool.isShutdown();
  }

  /**
   * Schedules the task for execution on the first available CPU of the cluster.
   *
   * @param name The name of the task.
   * @param task The task to execute.
   * @param <T> The return type of the task.
   * @return A handle for the task.
   * @throws IllegalStateException If the cluster has been stopped.
   */
  <T> ResultHandle<T> schedule(String name, Callable<T> task) {
    TaskFuture<T> future = new TaskFuture<>(name, task);
    try {
      taskThreadPool.execute(future);
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException(String.format("Cluster %s is not running", address), e);
    }
    LOGGER.trace("Task {} scheduled on cluster {}", future, address);
    return future;
  }

  /**
   * Stops the cluster and removes it from the registry. Tasks that have not started executing fail with a
   * {@link net.viktorc.dx4j.api.DisruptedExecutionException} and running tasks are interrupted. Calling it more than once has no effect.
   */
  public synchronized void stop() {
    RUNNING_CLUSTERS.remove(address, this);
    if (taskThreadPool.isShutdown()) {
      return;
    }
    List<Runnable> unstartedTasks = taskThreadPool.shutdownNow();
    int numOfDisruptedTasks = TaskFuture.disruptAll(unstartedTasks, String.format("Cluster %s stopped", address));
    LOGGER.debug("Local cluster at {} stopped; {} unstarted tasks disrupted", address, numOfDisruptedTasks);
  }

  @Override
  public String toString() {
    return String.format("localCluster[%s]", address);
  }

}
