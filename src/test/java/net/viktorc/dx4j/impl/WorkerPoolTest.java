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
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import net.viktorc.dx4j.api.DisruptedExecutionException;
import net.viktorc.dx4j.api.FailedStartupException;
import net.viktorc.dx4j.api.ResultHandle;
import net.viktorc.dx4j.api.ResultHandle.State;
import org.hamcrest.CoreMatchers;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * A unit test class for {@link WorkerPool}.
 *
 * @author Viktor Csomor
 */
public class WorkerPoolTest extends TestCase {

  private LocalComputeBackend backend;

  @Before
  public void setUp() throws FailedStartupException {
    backend = new LocalComputeBackend();
    backend.init(new SimpleBackendConfig(1));
  }

  @After
  public void tearDown() {
    backend.shutdown();
  }

  @Test
  public void testThrowsIllegalArgumentExceptionIfSizeLessThanOne() {
    exceptionRule.expect(IllegalArgumentException.class);
    new WorkerPool(backend, 0);
  }

  @Test
  public void testThrowsIllegalArgumentExceptionIfBackendNull() {
    exceptionRule.expect(IllegalArgumentException.class);
    new WorkerPool(null, 1);
  }

  @Test
  public void testThrowsIllegalStateExceptionIfBackendNotInitialized() {
    exceptionRule.expect(IllegalStateException.class);
    new WorkerPool(new LocalComputeBackend(), 1);
  }

  @Test
  public void testAllWorkersIdleAfterConstruction() {
    WorkerPool pool = new WorkerPool(backend, 3);
    try {
      Assert.assertEquals(3, pool.getSize());
      Assert.assertEquals(3, pool.getNumOfIdleWorkers());
      Assert.assertEquals(0, pool.getNumOfBusyWorkers());
      Assert.assertEquals(0, pool.getNumOfQueuedTasks());
    } finally {
      pool.close();
    }
  }

  @Test
  public void testTasksQueuedIfAllWorkersBusy() throws Exception {
    WorkerPool pool = new WorkerPool(backend, 2);
    CountDownLatch releaseLatch = new CountDownLatch(1);
    try {
      List<ResultHandle<Integer>> handles = new ArrayList<>();
      for (int i = 0; i < 3; i++) {
        int value = i;
        handles.add(pool.submit("task", () -> {
          releaseLatch.await();
          return value;
        }));
      }
      Assert.assertEquals(0, pool.getNumOfIdleWorkers());
      Assert.assertEquals(2, pool.getNumOfBusyWorkers());
      Assert.assertEquals(1, pool.getNumOfQueuedTasks());
      Assert.assertEquals(State.PENDING, handles.get(2).getState());
      releaseLatch.countDown();
      for (int i = 0; i < 3; i++) {
        Assert.assertEquals(Integer.valueOf(i), handles.get(i).get());
      }
    } finally {
      pool.close();
    }
  }

  @Test
  public void testHandlesNamedByTaskIndex() {
    WorkerPool pool = new WorkerPool(backend, 1);
    try {
      Assert.assertEquals("task#0", pool.submit("task", () -> 1).getName());
      Assert.assertEquals("task#1", pool.submit("task", () -> 1).getName());
      Assert.assertEquals(2, pool.getNextTaskIndex());
    } finally {
      pool.close();
    }
  }

  @Test
  public void testParallelismBoundedBySize() throws Exception {
    WorkerPool pool = new WorkerPool(backend, 2);
    AtomicInteger numOfRunningTasks = new AtomicInteger(0);
    AtomicInteger maxNumOfRunningTasks = new AtomicInteger(0);
    try {
      List<ResultHandle<Integer>> handles = new ArrayList<>();
      for (int i = 0; i < 6; i++) {
        handles.add(pool.submit("task", () -> {
          maxNumOfRunningTasks.accumulateAndGet(numOfRunningTasks.incrementAndGet(), Math::max);
          try {
            return sleepAndGet(100);
          } finally {
            numOfRunningTasks.decrementAndGet();
          }
        }));
      }
      for (ResultHandle<Integer> handle : handles) {
        handle.get();
      }
      Assert.assertEquals(2, maxNumOfRunningTasks.get());
    } finally {
      pool.close();
    }
  }

  @Test
  public void testCancelledQueuedTaskNotExecuted() throws Exception {
    WorkerPool pool = new WorkerPool(backend, 1);
    CountDownLatch releaseLatch = new CountDownLatch(1);
    AtomicInteger counter = new AtomicInteger(0);
    try {
      ResultHandle<Integer> blocking = pool.submit("task", () -> {
        releaseLatch.await();
        return 0;
      });
      ResultHandle<Integer> queued = pool.submit("task", counter::incrementAndGet);
      ResultHandle<Integer> next = pool.submit("task", () -> 2);
      Assert.assertTrue(queued.cancel(false));
      releaseLatch.countDown();
      Assert.assertEquals(Integer.valueOf(0), blocking.get());
      Assert.assertEquals(Integer.valueOf(2), next.get());
      Assert.assertTrue(queued.isCancelled());
      Assert.assertEquals(0, counter.get());
    } finally {
      pool.close();
    }
  }

  @Test
  public void testTaskFailureDoesNotAffectWorker() throws Exception {
    WorkerPool pool = new WorkerPool(backend, 1);
    try {
      ResultHandle<Integer> failed = pool.submit("task", () -> {
        throw new IllegalArgumentException();
      });
      ResultHandle<Integer> succeeded = pool.submit("task", () -> 1);
      Assert.assertEquals(Integer.valueOf(1), succeeded.get());
      try {
        failed.get();
        Assert.fail();
      } catch (ExecutionException e) {
        Assert.assertTrue(e.getCause() instanceof IllegalArgumentException);
      }
    } finally {
      pool.close();
    }
  }

  @Test
  public void testCloseDisruptsQueuedTasks() throws Exception {
    WorkerPool pool = new WorkerPool(backend, 1);
    CountDownLatch releaseLatch = new CountDownLatch(1);
    ResultHandle<Integer> running = pool.submit("task", () -> {
      releaseLatch.await();
      return 0;
    });
    ResultHandle<Integer> queued = pool.submit("task", () -> 1);
    pool.close();
    Assert.assertTrue(pool.isClosed());
    releaseLatch.countDown();
    Assert.assertEquals(Integer.valueOf(0), running.get());
    exceptionRule.expect(ExecutionException.class);
    exceptionRule.expectCause(CoreMatchers.isA(DisruptedExecutionException.class));
    queued.get();
  }

  @Test
  public void testSubmitThrowsIllegalStateExceptionIfClosed() {
    WorkerPool pool = new WorkerPool(backend, 1);
    pool.close();
    pool.close();
    exceptionRule.expect(IllegalStateException.class);
    pool.submit("task", () -> 1);
  }

  @Test
  public void testTerminatedWorkerReplaced() throws Exception {
    WorkerPool pool = new WorkerPool(backend, 1);
    try {
      Assert.assertEquals(Integer.valueOf(1), pool.submit("task", () -> 1).get());
      backend.shutdown();
      backend.init(new SimpleBackendConfig(1));
      Assert.assertEquals(Integer.valueOf(2), pool.submit("task", () -> 2).get());
    } finally {
      pool.close();
    }
  }

}
