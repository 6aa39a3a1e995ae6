package net.lanplay.mDNS;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.lanplay.mDNS.model.DiscoveredService;
import net.lanplay.mDNS.model.DiscoveredService.State;
import net.lanplay.mDNS.model.ServiceEvent;
import net.lanplay.mDNS.model.ServiceType;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import net.lanplay.mDNS.utils.TxtCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.Type;

/**
 * Folds the record batches of one browse session into service lifecycle events. Runs on the
 * consumer thread only.
 *
 * A service is discovered once its host name, port and at least one address are known. Identical
 * re-announcements produce nothing; a change of address, port or TXT metadata produces one update.
 * A goodbye or expiry of the PTR or SRV record, or the loss of every address, produces one removal,
 * after which the name starts over.
 */
public class EventBridge {
  private static final Logger LOG = LoggerFactory.getLogger(EventBridge.class);

  private static class Instance {
    private final Name name;

    private final String instanceName;

    private Name target;

    private int port = -1;

    private Map<String, String> txt = Collections.emptyMap();

    private DiscoveredService resolved;

    Instance(final Name name) {
      this.name = name;
      this.instanceName = MulticastDNSUtils.instanceLabel(name);
    }
  }

  private final ServiceType serviceType;

  private final EngineStatistics statistics;

  private final Map<Name, Instance> instances = new LinkedHashMap<>();

  private final Map<Name, Set<InetAddress>> hosts = new HashMap<>();

  private final long generation;

  public EventBridge(final ServiceType serviceType, final long generation,
      final EngineStatistics statistics) {
    this.serviceType = serviceType;
    this.generation = generation;
    this.statistics = statistics;
  }

  public long getGeneration() {
    return generation;
  }

  /**
   * @return The number of services known, resolved or not
   */
  public int size() {
    return instances.size();
  }

  /**
   * Applies one batch. Batches of another generation are discarded.
   *
   * @return The resulting events, in the order of the records that caused them
   */
  public List<ServiceEvent> apply(final RecordBatch batch) {
    if (batch.getGeneration() != generation) {
      LOG.trace("Discarding {} of {} while at generation {}", batch, serviceType, generation);
      return Collections.emptyList();
    }

    List<ServiceEvent> events = new ArrayList<>();
    Set<Name> touched = new LinkedHashSet<>();
    for (Record record : batch.getRecords()) {
      Name name = record.getName();
      boolean goodbye = record.getTTL() == 0;
      switch (record.getType()) {
        case Type.PTR:
          Name instance = ((PTRRecord) record).getTarget();
          if (!serviceType.isInstance(instance)) {
            break;
          }
          if (goodbye) {
            remove(instance, touched, events);
          } else {
            instances.computeIfAbsent(instance, Instance::new);
            touched.add(instance);
          }
          break;
        case Type.SRV:
          if (!serviceType.isInstance(name)) {
            break;
          }
          if (goodbye) {
            remove(name, touched, events);
          } else {
            SRVRecord srv = (SRVRecord) record;
            Instance state = instances.computeIfAbsent(name, Instance::new);
            state.target = srv.getTarget();
            state.port = srv.getPort();
            touched.add(name);
          }
          break;
        case Type.TXT:
          // a TXT goodbye on its own leaves the service in place
          if (!goodbye && serviceType.isInstance(name)) {
            TxtCodec.Decoded decoded = TxtCodec.decode(((TXTRecord) record).getStringsAsByteArrays());
            statistics.malformedTxtEntries(decoded.getMalformedEntries());
            instances.computeIfAbsent(name, Instance::new).txt = decoded.getProperties();
            touched.add(name);
          }
          break;
        case Type.A:
        case Type.AAAA:
          InetAddress address = record instanceof ARecord ? ((ARecord) record).getAddress()
              : ((AAAARecord) record).getAddress();
          Set<InetAddress> addresses = hosts.computeIfAbsent(name, n -> new LinkedHashSet<>());
          if (goodbye) {
            addresses.remove(address);
            if (addresses.isEmpty()) {
              hosts.remove(name);
            }
          } else {
            addresses.add(address);
          }
          for (Instance state : instances.values()) {
            if (name.equals(state.target)) {
              touched.add(state.name);
            }
          }
          break;
        default:
          break;
      }
    }

    flush(touched, events);
    return events;
  }

  private void flush(final Set<Name> touched, final List<ServiceEvent> events) {
    for (Name name : touched) {
      Instance state = instances.get(name);
      if (state != null) {
        evaluate(state, events);
      }
    }
    touched.clear();
  }

  private void evaluate(final Instance state, final List<ServiceEvent> events) {
    Set<InetAddress> addresses = state.target == null ? null : hosts.get(state.target);
    if (state.port < 0 || addresses == null || addresses.isEmpty()) {
      if (state.resolved != null) {
        // lost every address: gone until an address shows up again
        events.add(new ServiceEvent(ServiceEvent.Type.REMOVED,
            state.resolved.withState(State.REMOVED), generation));
        state.resolved = null;
      }
      return;
    }

    DiscoveredService service = new DiscoveredService(state.instanceName, serviceType,
        state.target.toString(), addresses, state.port, state.txt, State.RESOLVED);
    if (state.resolved == null) {
      events.add(new ServiceEvent(ServiceEvent.Type.DISCOVERED, service, generation));
    } else if (!state.resolved.sameEndpoint(service)) {
      events.add(new ServiceEvent(ServiceEvent.Type.UPDATED, service, generation));
    }
    state.resolved = service;
  }

  private void remove(final Name name, final Set<Name> touched,
      final List<ServiceEvent> events) {
    // changes seen earlier in the batch are reported before the removal
    touched.remove(name);
    flush(touched, events);
    Instance state = instances.remove(name);
    if (state != null && state.resolved != null) {
      events.add(new ServiceEvent(ServiceEvent.Type.REMOVED,
          state.resolved.withState(State.REMOVED), generation));
    }
  }
}
