package net.lanplay.mDNS;

/**
 * A point in time copy of the counters of an engine.
 */
public class EngineMetrics {
  private final long packetsReceived;

  private final long packetsSent;

  private final long parseFailures;

  private final long malformedTxtEntries;

  private final long queriesSent;

  private final long responsesSent;

  private final long eventsQueued;

  private final long queueOverflows;

  EngineMetrics(final long packetsReceived, final long packetsSent, final long parseFailures,
      final long malformedTxtEntries, final long queriesSent, final long responsesSent,
      final long eventsQueued, final long queueOverflows) {
    this.packetsReceived = packetsReceived;
    this.packetsSent = packetsSent;
    this.parseFailures = parseFailures;
    this.malformedTxtEntries = malformedTxtEntries;
    this.queriesSent = queriesSent;
    this.responsesSent = responsesSent;
    this.eventsQueued = eventsQueued;
    this.queueOverflows = queueOverflows;
  }

  public long getPacketsReceived() {
    return packetsReceived;
  }

  /**
   * @return Datagrams handed to a socket, one per endpoint a message was written to
   */
  public long getPacketsSent() {
    return packetsSent;
  }

  /**
   * @return Datagrams dropped because they were not valid DNS messages
   */
  public long getParseFailures() {
    return parseFailures;
  }

  /**
   * @return TXT entries skipped while decoding peer records
   */
  public long getMalformedTxtEntries() {
    return malformedTxtEntries;
  }

  public long getQueriesSent() {
    return queriesSent;
  }

  public long getResponsesSent() {
    return responsesSent;
  }

  /**
   * @return Record batches handed to browse sessions
   */
  public long getEventsQueued() {
    return eventsQueued;
  }

  public long getQueueOverflows() {
    return queueOverflows;
  }

  @Override
  public String toString() {
    return "EngineMetrics[received=" + packetsReceived + ", sent=" + packetsSent
        + ", parseFailures=" + parseFailures + ", malformedTxt=" + malformedTxtEntries
        + ", queries=" + queriesSent + ", responses=" + responsesSent + ", queued=" + eventsQueued
        + ", overflows=" + queueOverflows + "]";
  }
}
