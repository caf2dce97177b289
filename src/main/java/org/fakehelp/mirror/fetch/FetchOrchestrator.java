/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.fetch;

import org.fakehelp.mirror.upstream.UpstreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one fetch operation over a batch of inputs with a bounded number of
 * operations in flight.
 *
 * <p>A batch is best effort: single failures are collected and the batch
 * carries on. If at least one input succeeded, the successful results are
 * returned in completion order and all failures are dropped. Only if every
 * input failed does the batch fail, with the failure that was recorded
 * first.</p>
 *
 * <p>No timeout is imposed on single operations. Operations that need one
 * have to enforce it themselves and fail with an exception.</p>
 */
public class FetchOrchestrator implements ThreadFactory {

  private static final Logger logger = LoggerFactory.getLogger(
      FetchOrchestrator.class);

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private final AtomicInteger currentThreadNo = new AtomicInteger();

  /**
   * Fetch all inputs with at most {@code concurrency} operations in flight.
   *
   * @param inputs Inputs to process, each attempted exactly once.
   * @param concurrency Maximum number of operations running at a time.
   * @param operation Operation to run per input.
   * @param <I> Input type.
   * @param <R> Result type.
   * @return Successful results in completion order, possibly empty if there
   *     were no inputs.
   * @throws UpstreamException First recorded failure, if no input succeeded.
   * @throws InterruptedException Thrown if interrupted while waiting for the
   *     batch to complete.
   */
  public <I, R> List<R> fetchAll(List<I> inputs, int concurrency,
      FetchOperation<I, R> operation)
      throws UpstreamException, InterruptedException {
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1, "
          + "but is " + concurrency + ".");
    }
    if (inputs.isEmpty()) {
      return new ArrayList<>();
    }
    LinkedBlockingQueue<I> queue = new LinkedBlockingQueue<>(inputs);
    List<R> results = Collections.synchronizedList(new ArrayList<>());
    List<UpstreamException> errors
        = Collections.synchronizedList(new ArrayList<>());
    int workers = Math.min(concurrency, inputs.size());
    ExecutorService executor = Executors.newFixedThreadPool(workers, this);
    try {
      for (int i = 0; i < workers; i++) {
        executor.execute(() -> drain(queue, operation, results, errors));
      }
      executor.shutdown();
      while (!executor.awaitTermination(1L, TimeUnit.MINUTES)) {
        logger.debug("Still waiting for {} of {} inputs.",
            inputs.size() - results.size() - errors.size(), inputs.size());
      }
    } finally {
      executor.shutdownNow();
    }
    if (!errors.isEmpty()) {
      logger.debug("{} of {} fetches failed.", errors.size(), inputs.size());
    }
    if (results.isEmpty() && !errors.isEmpty()) {
      throw errors.get(0);
    }
    return new ArrayList<>(results);
  }

  private static <I, R> void drain(LinkedBlockingQueue<I> queue,
      FetchOperation<I, R> operation, List<R> results,
      List<UpstreamException> errors) {
    I input;
    while (null != (input = queue.poll())) {
      try {
        results.add(operation.fetch(input));
      } catch (UpstreamException e) {
        errors.add(e);
      } catch (RuntimeException e) {
        errors.add(new UpstreamException(UpstreamException.Kind.UNEXPECTED,
            "Fetching " + input + " failed: " + e.getMessage(), e));
      }
    }
  }

  /**
   * Provide a nice name for debugging.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("Fetch-Worker-" + currentThreadNo.incrementAndGet());
    return newThread;
  }
}
