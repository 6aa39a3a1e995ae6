package net.lanplay.mDNS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

/**
 * The records learned from the network, grouped in record sets keyed by name, type and class.
 *
 * Changes are reported back to the caller: a record new to its set is returned as is, a record
 * that left its set (goodbye, expiry, cache flush) is returned as a copy with a TTL of 0.
 *
 * Not thread safe, the cache belongs to the engine thread. Every method takes the current time so
 * expiry can be driven by the caller.
 */
public class MulticastDNSCache {

  private static class RRsetKey {
    private final Name name;

    private final int type;

    private final int dclass;

    RRsetKey(final Record record) {
      this(record.getName(), record.getType(), record.getDClass() & 0x7FFF);
    }

    RRsetKey(final Name name, final int type, final int dclass) {
      this.name = name;
      this.type = type;
      this.dclass = dclass;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, dclass);
    }

    @Override
    public boolean equals(final Object obj) {
      if (obj == this) {
        return true;
      } else if (obj instanceof RRsetKey) {
        RRsetKey that = (RRsetKey) obj;
        return type == that.type && dclass == that.dclass && name.equals(that.name);
      }
      return false;
    }
  }

  private static class Entry {
    private Record record;

    private long receivedAt;

    private int refreshStep;

    Entry(final Record record, final long receivedAt) {
      this.record = record;
      this.receivedAt = receivedAt;
    }

    long expiresAt() {
      return receivedAt + (record.getTTL() * 1000);
    }

    long remainingSeconds(final long now) {
      return Math.max(0, (expiresAt() - now) / 1000);
    }
  }

  private final Map<RRsetKey, Map<Record, Entry>> rrsets = new HashMap<>();

  /**
   * Merges the records of one received message into the cache.
   *
   * @return The records that changed the cache, in message order
   */
  public List<Record> update(final List<Record> records, final long now) {
    List<Record> changes = new ArrayList<>();
    Set<RRsetKey> flushed = new HashSet<>();
    Set<Record> received = new HashSet<>();

    for (Record raw : records) {
      if (!isCacheable(raw)) {
        continue;
      }

      boolean cacheFlush = MulticastDNSUtils.isCacheFlush(raw);
      Record record = MulticastDNSUtils.normalize(raw);
      RRsetKey key = new RRsetKey(record);

      if (record.getTTL() == 0) {
        Map<Record, Entry> rrset = rrsets.get(key);
        if (rrset != null && rrset.remove(record) != null) {
          changes.add(record);
          if (rrset.isEmpty()) {
            rrsets.remove(key);
          }
        }
        continue;
      }

      Map<Record, Entry> rrset = rrsets.computeIfAbsent(key, k -> new LinkedHashMap<>());

      // Members of the set received in the same message survive the flush [RFC 6762 10.2].
      if (cacheFlush && flushed.add(key)) {
        Iterator<Map.Entry<Record, Entry>> iterator = rrset.entrySet().iterator();
        while (iterator.hasNext()) {
          Record member = iterator.next().getKey();
          if (!member.equals(record) && !received.contains(member)) {
            iterator.remove();
            // a replaced SRV or TXT is superseded by the record that flushed it
            if (record.getType() == Type.A || record.getType() == Type.AAAA) {
              changes.add(MulticastDNSUtils.withTTL(member, 0));
            }
          }
        }
      }
      received.add(record);

      Entry entry = rrset.get(record);
      if (entry == null) {
        rrset.put(record, new Entry(record, now));
        changes.add(record);
      } else {
        entry.record = record;
        entry.receivedAt = now;
        entry.refreshStep = 0;
      }
    }

    return changes;
  }

  /**
   * Removes the records whose TTL ran out.
   *
   * @return The removed records, with a TTL of 0
   */
  public List<Record> expire(final long now) {
    List<Record> expired = new ArrayList<>();

    Iterator<Map<Record, Entry>> sets = rrsets.values().iterator();
    while (sets.hasNext()) {
      Map<Record, Entry> rrset = sets.next();
      Iterator<Entry> entries = rrset.values().iterator();
      while (entries.hasNext()) {
        Entry entry = entries.next();
        if (now >= entry.expiresAt()) {
          entries.remove();
          expired.add(MulticastDNSUtils.withTTL(entry.record, 0));
        }
      }
      if (rrset.isEmpty()) {
        sets.remove();
      }
    }

    return expired;
  }

  /**
   * Finds the watched records that crossed their next refresh point, at 80%, 85%, 90% and 95% of
   * their lifetime [RFC 6762 5.2]. Each point is reported once per received copy of the record.
   */
  public List<Record> refreshDue(final long now, final Predicate<Record> watched) {
    List<Record> due = new ArrayList<>();

    for (Map<Record, Entry> rrset : rrsets.values()) {
      for (Entry entry : rrset.values()) {
        long age = now - entry.receivedAt;
        long lifetime = entry.record.getTTL() * 1000;
        boolean crossed = false;
        while (entry.refreshStep < Constants.REFRESH_THRESHOLDS.length
            && age >= lifetime * Constants.REFRESH_THRESHOLDS[entry.refreshStep]) {
          entry.refreshStep++;
          crossed = true;
        }

        if (crossed && watched.test(entry.record)) {
          due.add(entry.record);
        }
      }
    }

    return due;
  }

  /**
   * @return The cached records of the set, each carrying its remaining TTL
   */
  public List<Record> lookup(final Name name, final int type, final int dclass, final long now) {
    Map<Record, Entry> rrset = rrsets.get(new RRsetKey(name, type, dclass & 0x7FFF));
    if (rrset == null) {
      return Collections.emptyList();
    }

    List<Record> records = new ArrayList<>();
    for (Entry entry : rrset.values()) {
      long remaining = entry.remainingSeconds(now);
      if (remaining > 0) {
        records.add(MulticastDNSUtils.withTTL(entry.record, remaining));
      }
    }
    return records;
  }

  /**
   * @return The cached records of the set that are worth sending as known answers, those with more
   * than half their TTL left [RFC 6762 7.1]
   */
  public List<Record> knownAnswers(final Name name, final int type, final int dclass,
      final long now) {
    Map<Record, Entry> rrset = rrsets.get(new RRsetKey(name, type, dclass & 0x7FFF));
    if (rrset == null) {
      return Collections.emptyList();
    }

    List<Record> records = new ArrayList<>();
    for (Entry entry : rrset.values()) {
      long remaining = entry.remainingSeconds(now);
      if (remaining * 2 > entry.record.getTTL()) {
        records.add(MulticastDNSUtils.withTTL(entry.record, remaining));
      }
    }
    return records;
  }

  public int size() {
    int size = 0;
    for (Map<Record, Entry> rrset : rrsets.values()) {
      size += rrset.size();
    }
    return size;
  }

  public void clear() {
    rrsets.clear();
  }

  private static boolean isCacheable(final Record record) {
    switch (record.getType()) {
      case Type.PTR:
      case Type.SRV:
      case Type.TXT:
      case Type.A:
      case Type.AAAA:
        return true;
      default:
        return false;
    }
  }
}
