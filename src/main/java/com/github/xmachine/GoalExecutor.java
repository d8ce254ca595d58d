package com.github.xmachine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.xmachine.XMachineException.Code;

/**
 * Runs independent generation goals, e.g. one search per unresolved transition, on a fixed pool of
 * daemon worker threads. Results come back keyed in goal submission order, never in completion
 * order, so callers produce the same artifacts for any number of workers.
 *
 * With a single worker the goals run on the caller thread.
 */
final class GoalExecutor implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(GoalExecutor.class.getSimpleName());

  private final int workerThreads;
  private final ExecutorService workers;

  GoalExecutor(final String generatorId, final int workerThreads) {
    this.workerThreads = workerThreads;
    if (workerThreads > 1) {
      workers = Executors.newFixedThreadPool(workerThreads, new WorkerFactory(generatorId));
    } else {
      workers = null;
    }
  }

  <K, R> Map<K, R> run(final Map<K, Callable<R>> goals) throws XMachineException {
    final Map<K, R> results = new LinkedHashMap<>();
    if (goals.isEmpty()) {
      return results;
    }
    if (workers == null) {
      for (final Map.Entry<K, Callable<R>> goal : goals.entrySet()) {
        results.put(goal.getKey(), call(goal.getValue()));
      }
      return results;
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Scheduling %d goals on %d workers", goals.size(), workerThreads));
    }
    final List<K> keys = new ArrayList<>(goals.keySet());
    final List<Future<R>> futures = new ArrayList<>(keys.size());
    for (final K key : keys) {
      futures.add(workers.submit(goals.get(key)));
    }
    try {
      for (int i = 0; i < keys.size(); i++) {
        results.put(keys.get(i), futures.get(i).get());
      }
    } catch (InterruptedException exception) {
      cancel(futures);
      Thread.currentThread().interrupt();
      throw new XMachineException(Code.INTERRUPTED, exception);
    } catch (ExecutionException exception) {
      cancel(futures);
      final Throwable cause = exception.getCause();
      if (cause instanceof XMachineException) {
        throw (XMachineException) cause;
      }
      throw new XMachineException(Code.UNKNOWN_FAILURE, cause);
    }
    return results;
  }

  private static <R> R call(final Callable<R> goal) throws XMachineException {
    try {
      return goal.call();
    } catch (XMachineException problem) {
      throw problem;
    } catch (Exception problem) {
      throw new XMachineException(Code.UNKNOWN_FAILURE, problem);
    }
  }

  private static <R> void cancel(final List<Future<R>> futures) {
    for (final Future<R> future : futures) {
      future.cancel(true);
    }
  }

  @Override
  public void close() {
    if (workers != null) {
      workers.shutdownNow();
    }
  }

  private static final class WorkerFactory implements ThreadFactory {
    private final String generatorId;
    private final AtomicInteger counter = new AtomicInteger();

    private WorkerFactory(final String generatorId) {
      this.generatorId = generatorId;
    }

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread worker = new Thread(runnable);
      worker.setName("explorer-" + generatorId + "-" + counter.incrementAndGet());
      worker.setDaemon(true);
      return worker;
    }
  }

}
