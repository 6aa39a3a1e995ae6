package net.lanplay.mDNS;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import net.lanplay.mDNS.model.ServiceType;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

/**
 * The engine side of a browse session: queries for one service type with an exponential back-off,
 * resolves the instances it learns about, and hands the records concerning them to the session's
 * {@link EventQueue} tagged with the session generation.
 *
 * All methods but {@link #close()} run on the engine thread.
 */
class BrowseOperation implements Runnable, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(BrowseOperation.class);

  private final MulticastDNSEngine engine;

  private final ServiceType serviceType;

  private final long generation;

  private final EventQueue queue;

  private final Set<Name> instances = new LinkedHashSet<>();

  private final Map<Name, Name> targets = new HashMap<>();

  private final Map<Name, Long> lastResolveQuery = new HashMap<>();

  private ScheduledFuture<?> future;

  private int broadcastDelay = 0;

  private long lastBroadcast;

  private volatile boolean cancelled = false;

  BrowseOperation(final MulticastDNSEngine engine, final ServiceType serviceType,
      final long generation, final EventQueue queue) {
    this.engine = engine;
    this.serviceType = serviceType;
    this.generation = generation;
    this.queue = queue;
  }

  ServiceType getServiceType() {
    return serviceType;
  }

  long getGeneration() {
    return generation;
  }

  boolean isCancelled() {
    return cancelled;
  }

  /**
   * Delivers what the cache already knows about the service type, then starts querying.
   */
  void start(final long now) {
    deliver(engine.getCache().lookup(serviceType.getName(), Type.PTR, DClass.IN, now), now);

    engine.getExecutors().execute(this);
  }

  /**
   * Sends the browse query and schedules the next one, 1 second later at first and twice as long
   * each time after that, up to an hour [RFC 6762 5.2].
   */
  public void run() {
    if (cancelled) {
      return;
    }

    long now = System.currentTimeMillis();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Broadcasting query for {}.{}", serviceType, lastBroadcast <= 0 ? ""
          : " Last broadcast was " + ((double) (now - lastBroadcast) / (double) 1000)
              + " seconds ago.");
    }
    lastBroadcast = now;

    broadcastDelay = broadcastDelay > 0
        ? Math.min(broadcastDelay * 2, Constants.MAX_QUERY_INTERVAL_SECONDS) : 1;
    future = engine.getExecutors().schedule(this, broadcastDelay, TimeUnit.SECONDS);

    Message query = MulticastDNSUtils.newQuery();
    Name name = serviceType.getName();
    query.addRecord(Record.newRecord(name, Type.PTR, DClass.IN), Section.QUESTION);
    MulticastDNSUtils.addAll(query, engine.getCache().knownAnswers(name, Type.PTR, DClass.IN, now),
        Section.ANSWER);
    engine.send(query);
  }

  /**
   * Picks the records that concern this session out of a cache change set and queues them. The
   * cache only reports changes, so a new instance, or an instance with a new server, is completed
   * with the records already cached for it.
   */
  void deliver(final List<Record> changes, final long now) {
    if (cancelled || changes.isEmpty()) {
      return;
    }

    MulticastDNSCache cache = engine.getCache();
    Name typeName = serviceType.getName();
    List<Record> relevant = new ArrayList<>();
    for (Record record : changes) {
      Name name = record.getName();
      boolean goodbye = record.getTTL() == 0;
      switch (record.getType()) {
        case Type.PTR:
          Name instance = ((PTRRecord) record).getTarget();
          if (name.equals(typeName) && serviceType.isInstance(instance)) {
            relevant.add(record);
            if (goodbye) {
              forget(instance);
            } else if (instances.add(instance)) {
              for (Record srv : cache.lookup(instance, Type.SRV, DClass.IN, now)) {
                relevant.add(srv);
                targets.put(instance, ((SRVRecord) srv).getTarget());
                relevant.addAll(addresses(((SRVRecord) srv).getTarget(), now));
              }
              relevant.addAll(cache.lookup(instance, Type.TXT, DClass.IN, now));
            }
          }
          break;
        case Type.SRV:
          if (serviceType.isInstance(name)) {
            relevant.add(record);
            if (goodbye) {
              targets.remove(name);
            } else {
              Name target = ((SRVRecord) record).getTarget();
              Name previous = targets.put(name, target);
              if (previous == null) {
                relevant.addAll(cache.lookup(name, Type.TXT, DClass.IN, now));
              }
              if (!target.equals(previous)) {
                relevant.addAll(addresses(target, now));
              }
            }
          }
          break;
        case Type.TXT:
          if (serviceType.isInstance(name)) {
            relevant.add(record);
          }
          break;
        case Type.A:
        case Type.AAAA:
          if (targets.containsValue(name)) {
            relevant.add(record);
          }
          break;
        default:
          break;
      }
    }

    if (!relevant.isEmpty()) {
      LOG.trace("Queueing {} records for {} generation {}", relevant.size(), serviceType,
          generation);
      queue.offer(new RecordBatch(generation, relevant));
    }
  }

  /**
   * Queries for the service and address records of known instances that are not cached, at most
   * once per second for each name.
   */
  void resolveMissing(final long now) {
    if (cancelled) {
      return;
    }

    MulticastDNSCache cache = engine.getCache();
    Message query = MulticastDNSUtils.newQuery();
    for (Name instance : instances) {
      List<Record> srvs = cache.lookup(instance, Type.SRV, DClass.IN, now);
      if (srvs.isEmpty()) {
        if (mayQuery(instance, now)) {
          query.addRecord(Record.newRecord(instance, Type.SRV, DClass.IN), Section.QUESTION);
          query.addRecord(Record.newRecord(instance, Type.TXT, DClass.IN), Section.QUESTION);
        }
        continue;
      }

      for (Record srv : srvs) {
        Name target = ((SRVRecord) srv).getTarget();
        if (cache.lookup(target, Type.A, DClass.IN, now).isEmpty()
            && cache.lookup(target, Type.AAAA, DClass.IN, now).isEmpty()
            && mayQuery(target, now)) {
          query.addRecord(Record.newRecord(target, Type.A, DClass.IN), Section.QUESTION);
          query.addRecord(Record.newRecord(target, Type.AAAA, DClass.IN), Section.QUESTION);
        }
      }
    }

    if (!query.getSection(Section.QUESTION).isEmpty()) {
      LOG.debug("Resolving {} names for {}", query.getSection(Section.QUESTION).size(),
          serviceType);
      engine.send(query);
    }
  }

  /**
   * @return true if the record is one this session keeps fresh in the cache
   */
  boolean watches(final Record record) {
    Name name = record.getName();
    switch (record.getType()) {
      case Type.PTR:
        return name.equals(serviceType.getName());
      case Type.SRV:
      case Type.TXT:
        return instances.contains(name);
      case Type.A:
      case Type.AAAA:
        return targets.containsValue(name);
      default:
        return false;
    }
  }

  private List<Record> addresses(final Name target, final long now) {
    List<Record> addresses = new ArrayList<>(
        engine.getCache().lookup(target, Type.A, DClass.IN, now));
    addresses.addAll(engine.getCache().lookup(target, Type.AAAA, DClass.IN, now));
    return addresses;
  }

  private boolean mayQuery(final Name name, final long now) {
    Long last = lastResolveQuery.get(name);
    if (last != null && now - last < Constants.RESOLVE_QUERY_INTERVAL_MILLIS) {
      return false;
    }
    lastResolveQuery.put(name, now);
    return true;
  }

  private void forget(final Name instance) {
    instances.remove(instance);
    targets.remove(instance);
    lastResolveQuery.remove(instance);
  }

  /**
   * Stops querying. Callable from any thread; batches already queued are left to the generation
   * check of the consumer.
   */
  public void close() {
    cancelled = true;
  }

  /**
   * Cancels the query timer, on the engine thread.
   */
  void cancel() {
    cancelled = true;
    if (future != null) {
      future.cancel(false);
      future = null;
    }
  }

  @Override
  public String toString() {
    return "BrowseOperation[" + serviceType + ", generation " + generation + "]";
  }
}
