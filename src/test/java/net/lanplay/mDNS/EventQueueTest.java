package net.lanplay.mDNS;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import org.junit.jupiter.api.Test;

class EventQueueTest {

  private final EngineStatistics statistics = new EngineStatistics();

  @Test
  void drainsInOfferOrder() {
    EventQueue queue = new EventQueue(4, statistics);
    RecordBatch first = batch(1);
    RecordBatch second = batch(1);

    queue.offer(first);
    queue.offer(second);

    assertThat(queue.drain()).containsExactly(first, second);
    assertThat(queue.size()).isZero();
    assertThat(queue.drain()).isEmpty();
  }

  @Test
  void overflowMarksTheGenerationAndKeepsTheQueuedBatches() {
    EventQueue queue = new EventQueue(2, statistics);

    assertThat(queue.offer(batch(7))).isTrue();
    assertThat(queue.offer(batch(7))).isTrue();
    assertThat(queue.offer(batch(7))).isFalse();

    assertThat(queue.getOverflowedGeneration()).isEqualTo(7);
    assertThat(queue.size()).isEqualTo(2);
    assertThat(statistics.snapshot().getQueueOverflows()).isEqualTo(1);
    assertThat(statistics.snapshot().getEventsQueued()).isEqualTo(2);
  }

  @Test
  void resetClearsBatchesAndTheOverflowMark() {
    EventQueue queue = new EventQueue(1, statistics);
    queue.offer(batch(3));
    queue.offer(batch(3));

    queue.reset();

    assertThat(queue.size()).isZero();
    assertThat(queue.getOverflowedGeneration()).isEqualTo(EventQueue.NO_OVERFLOW);
    assertThat(queue.offer(batch(4))).isTrue();
  }

  private static RecordBatch batch(final long generation) {
    return new RecordBatch(generation, Collections.emptyList());
  }
}
