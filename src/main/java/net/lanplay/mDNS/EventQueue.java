package net.lanplay.mDNS;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The channel between the engine thread, which offers record batches, and the consumer thread,
 * which drains them. Safe for one producer and one consumer.
 *
 * The queue is bounded. A batch that does not fit is not enqueued; instead the generation it
 * belongs to is marked overflowed, which the consumer reports as an error rather than carrying on
 * with an incomplete record stream.
 */
public class EventQueue {
  private static final Logger LOG = LoggerFactory.getLogger(EventQueue.class);

  public static final long NO_OVERFLOW = -1;

  private final Queue<RecordBatch> batches = new ConcurrentLinkedQueue<>();

  private final AtomicInteger size = new AtomicInteger();

  private final int bound;

  private final EngineStatistics statistics;

  private volatile long overflowedGeneration = NO_OVERFLOW;

  public EventQueue(final int bound, final EngineStatistics statistics) {
    this.bound = bound;
    this.statistics = statistics;
  }

  /**
   * Called from the engine thread.
   *
   * @return false if the queue is full and the batch was not enqueued
   */
  public boolean offer(final RecordBatch batch) {
    if (size.incrementAndGet() > bound) {
      size.decrementAndGet();
      if (overflowedGeneration != batch.getGeneration()) {
        LOG.warn("Event queue overflowed its bound of {} batches, generation {} is incomplete",
            bound, batch.getGeneration());
      }
      overflowedGeneration = batch.getGeneration();
      statistics.queueOverflow();
      return false;
    }

    batches.add(batch);
    statistics.eventQueued();
    return true;
  }

  /**
   * Called from the consumer thread. Never blocks.
   *
   * @return The batches enqueued so far, oldest first
   */
  public List<RecordBatch> drain() {
    List<RecordBatch> drained = new ArrayList<>();
    RecordBatch batch;
    while ((batch = batches.poll()) != null) {
      size.decrementAndGet();
      drained.add(batch);
    }
    return drained;
  }

  /**
   * Discards every queued batch and the overflow mark, when a new generation starts.
   */
  public void reset() {
    drain();
    overflowedGeneration = NO_OVERFLOW;
  }

  /**
   * @return The generation of the last batch that did not fit, or {@link #NO_OVERFLOW}
   */
  public long getOverflowedGeneration() {
    return overflowedGeneration;
  }

  public int size() {
    return size.get();
  }

  public int getBound() {
    return bound;
  }
}
