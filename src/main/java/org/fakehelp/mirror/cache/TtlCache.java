/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory cache whose entries expire a fixed number of milliseconds after
 * they were stored.
 *
 * <p>Every stored entry with a finite time-to-live holds one task on the
 * cache's timer thread that removes the entry when it fires. Storing a new
 * value under an existing key replaces the value and restarts its timer, so
 * an entry is never removed earlier than the time-to-live after its most
 * recent {@link #set} or {@link #extend}. A time-to-live of zero or less
 * disables expiry altogether.</p>
 *
 * <p>A {@link #get} racing an expiry may still observe the value until the
 * removal task has run.</p>
 *
 * @param <V> Type of cached values.
 */
public class TtlCache<V> implements ThreadFactory, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

  private static final AtomicInteger cacheNo = new AtomicInteger();

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private final String name;

  private final long ttlMillis;

  private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();

  private final ScheduledExecutorService timer;

  /** Cached value together with the task that is going to remove it. */
  private static final class Entry<V> {

    private final V value;

    private volatile ScheduledFuture<?> removal;

    private Entry(V value) {
      this.value = value;
    }
  }

  /**
   * Create a cache with the given time-to-live.
   *
   * @param ttlMillis Milliseconds before an entry expires, or zero or less to
   *     keep entries until they are removed explicitly.
   */
  public TtlCache(long ttlMillis) {
    this.ttlMillis = ttlMillis;
    this.name = "TtlCache-" + cacheNo.incrementAndGet();
    this.timer = ttlMillis > 0
        ? Executors.newSingleThreadScheduledExecutor(this)
        : null;
  }

  /** Returns the cached value or {@code null} if there is none. */
  public V get(String key) {
    if (isEmpty(key)) {
      return null;
    }
    Entry<V> entry = this.entries.get(key);
    return null == entry ? null : entry.value;
  }

  /**
   * Store the given value and schedule its removal. Empty keys and
   * {@code null} values are ignored.
   */
  public void set(String key, V value) {
    if (isEmpty(key) || null == value) {
      return;
    }
    Entry<V> entry = new Entry<>(value);
    Entry<V> previous = this.entries.put(key, entry);
    if (null != previous) {
      cancel(previous);
    }
    this.scheduleRemoval(key, entry);
  }

  /**
   * Cancel any pending removal of the given key and schedule a new one,
   * starting the full time-to-live again.
   */
  public void extend(String key) {
    if (isEmpty(key)) {
      return;
    }
    Entry<V> entry = this.entries.get(key);
    if (null != entry) {
      cancel(entry);
      this.scheduleRemoval(key, entry);
    }
  }

  /** Remove the given key and cancel its pending removal, if any. */
  public void remove(String key) {
    if (isEmpty(key)) {
      return;
    }
    Entry<V> entry = this.entries.remove(key);
    if (null != entry) {
      cancel(entry);
    }
  }

  /** Number of entries currently held. */
  public int size() {
    return this.entries.size();
  }

  private void scheduleRemoval(String key, Entry<V> entry) {
    if (null == this.timer) {
      return;
    }
    /* Only remove the entry this task was created for, a later set on the
     * same key has its own task. */
    entry.removal = this.timer.schedule(() -> {
      if (this.entries.remove(key, entry)) {
        logger.trace("Expired {} from {}.", key, this.name);
      }
    }, this.ttlMillis, TimeUnit.MILLISECONDS);
  }

  private static void cancel(Entry<?> entry) {
    ScheduledFuture<?> removal = entry.removal;
    if (null != removal) {
      removal.cancel(false);
    }
  }

  private static boolean isEmpty(String key) {
    return null == key || key.isEmpty();
  }

  /** Drop all entries and stop the timer thread. */
  @Override
  public void close() {
    this.entries.clear();
    if (null != this.timer) {
      this.timer.shutdownNow();
    }
  }

  /**
   * Provide a nice name for debugging.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName(this.name + "-Timer");
    return newThread;
  }
}
