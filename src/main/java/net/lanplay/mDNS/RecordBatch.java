package net.lanplay.mDNS;

import java.util.Collections;
import java.util.List;
import org.xbill.DNS.Record;

/**
 * The records of one received message, or one cache sweep, that concern a browse session. A
 * record with a TTL of 0 left the cache.
 */
public class RecordBatch {
  private final long generation;

  private final List<Record> records;

  public RecordBatch(final long generation, final List<Record> records) {
    this.generation = generation;
    this.records = Collections.unmodifiableList(records);
  }

  /**
   * @return The generation of the browse session the batch was produced for
   */
  public long getGeneration() {
    return generation;
  }

  public List<Record> getRecords() {
    return records;
  }

  @Override
  public String toString() {
    return "RecordBatch[generation=" + generation + ", " + records.size() + " records]";
  }
}
