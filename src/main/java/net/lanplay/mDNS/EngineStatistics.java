package net.lanplay.mDNS;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters updated by the engine, read and network threads and by the consumer thread.
 */
public class EngineStatistics {
  private final LongAdder packetsReceived = new LongAdder();

  private final LongAdder packetsSent = new LongAdder();

  private final LongAdder parseFailures = new LongAdder();

  private final LongAdder malformedTxtEntries = new LongAdder();

  private final LongAdder queriesSent = new LongAdder();

  private final LongAdder responsesSent = new LongAdder();

  private final LongAdder eventsQueued = new LongAdder();

  private final LongAdder queueOverflows = new LongAdder();

  public void packetReceived() {
    packetsReceived.increment();
  }

  public void packetSent() {
    packetsSent.increment();
  }

  public void parseFailure() {
    parseFailures.increment();
  }

  public void malformedTxtEntries(final int count) {
    if (count > 0) {
      malformedTxtEntries.add(count);
    }
  }

  public void querySent() {
    queriesSent.increment();
  }

  public void responseSent() {
    responsesSent.increment();
  }

  public void eventQueued() {
    eventsQueued.increment();
  }

  public void queueOverflow() {
    queueOverflows.increment();
  }

  public EngineMetrics snapshot() {
    return new EngineMetrics(packetsReceived.sum(), packetsSent.sum(), parseFailures.sum(),
        malformedTxtEntries.sum(), queriesSent.sum(), responsesSent.sum(), eventsQueued.sum(),
        queueOverflows.sum());
  }
}
