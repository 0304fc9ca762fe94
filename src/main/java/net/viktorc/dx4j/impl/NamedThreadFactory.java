package net.viktorc.dx4j.impl;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An implementation of the {@link ThreadFactory} interface that provides descriptive thread names, creates daemon threads so that
 * backend threads never keep the JVM alive, and logs the exceptions that are not caught in the created threads.
 *
 * @author Viktor Csomor
 */
class NamedThreadFactory implements ThreadFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(NamedThreadFactory.class);

  private final String poolName;
  private final ThreadFactory defaultFactory;

  /**
   * Constructs an instance according to the specified parameters.
   *
   * @param poolName The name of the thread pool. It will be prepended to the name of the created threads.
   */
  NamedThreadFactory(String poolName) {
    this.poolName = poolName;
    defaultFactory = Executors.defaultThreadFactory();
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = defaultFactory.newThread(r);
    thread.setName(thread.getName().replaceFirst("pool-[0-9]+", poolName));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) -> LOGGER.error(e.getMessage(), e));
    return thread;
  }

}
