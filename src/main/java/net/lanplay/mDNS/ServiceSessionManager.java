package net.lanplay.mDNS;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import net.lanplay.mDNS.SessionRegistry.AdvertiseSlot;
import net.lanplay.mDNS.SessionRegistry.BrowseSlot;
import net.lanplay.mDNS.model.AdvertiseRecord;
import net.lanplay.mDNS.model.AdvertiseRecord.RegistrationState;
import net.lanplay.mDNS.model.ServiceEvent;
import net.lanplay.mDNS.model.ServiceType;
import net.lanplay.mDNS.utils.ListenerProcessor;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import net.lanplay.mDNS.utils.TxtCodec;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Name;
import org.xbill.DNS.TextParseException;

/**
 * Browses for and advertises DNS-SD services on the local link, for a host that runs a single
 * thread and advances in steps.
 *
 * <p>None of the methods waits on the network. The protocol runs on background threads of a
 * {@link MulticastDNSEngine} created on first use; its events are collected by
 * {@link #pollBrowse(BrowseHandle)} or, with listeners registered, by {@link #process()} once per
 * tick.
 *
 * <p>Each owner has at most one browse session and one advertisement at a time. Starting another
 * one first stops the previous one; stopping an idle or stale session does nothing.
 *
 * <pre>
 * ServiceSessionManager sessions = new ServiceSessionManager();
 * AdvertiseHandle ad = sessions.advertise("Game Server A", "_mygame._tcp.local.", 7350,
 *     Collections.singletonMap("version", "1.0"));
 * BrowseHandle browse = sessions.startBrowse("_mygame._tcp.local.");
 * ...
 * for (ServiceEvent event : sessions.pollBrowse(browse)) {
 *   ...
 * }
 * ...
 * sessions.close();
 * </pre>
 */
public class ServiceSessionManager implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ServiceSessionManager.class);

  private final EngineConfig config;

  private final SessionRegistry registry = new SessionRegistry();

  private MulticastDNSEngine engine;

  private boolean closed = false;

  /**
   * Creates a manager configured from the dnsjava options, see {@link EngineConfig}.
   */
  public ServiceSessionManager() {
    this(EngineConfig.fromOptions());
  }

  public ServiceSessionManager(final EngineConfig config) {
    this.config = config;
  }

  public BrowseHandle startBrowse(final String serviceType) throws ServiceSessionException {
    return startBrowse(SessionRegistry.DEFAULT_OWNER, serviceType);
  }

  /**
   * Starts browsing for a service type, stopping the owner's previous browse session.
   *
   * @throws ServiceSessionException {@link REASON#INVALID_SERVICE_TYPE} for a malformed type;
   * {@link REASON#ENGINE_UNAVAILABLE} or {@link REASON#MULTICAST_BLOCKED} if the engine could not
   * be started; {@link REASON#ENGINE_CLOSED} after {@link #close()}
   */
  public BrowseHandle startBrowse(final Object owner, final String serviceType)
      throws ServiceSessionException {
    final String operation = "startBrowse";
    ServiceType type = parseServiceType(operation, serviceType, null);

    synchronized (registry) {
      MulticastDNSEngine engine = engine(operation, serviceType, null);

      BrowseSlot slot = registry.browseSlot(owner);
      stop(slot);

      long generation = registry.nextGeneration();
      EventQueue queue = slot.queue(config.getQueueBound(), engine.getStatistics());
      queue.reset();

      BrowseOperation browse;
      try {
        browse = engine.subscribe(type, generation, queue);
      } catch (ServiceSessionException e) {
        throw e.withContext(operation, serviceType, null);
      }

      BrowseHandle handle = new BrowseHandle(owner, type, generation);
      slot.activate(handle, new EventBridge(type, generation, engine.getStatistics()), browse);
      LOG.debug("Browsing for {} as {}", type, handle);
      return handle;
    }
  }

  /**
   * Returns the events of the session since the last poll, oldest first. Never blocks.
   *
   * @return The events, empty if there are none or the handle is stale
   * @throws ServiceSessionException {@link REASON#QUEUE_OVERFLOW} if events were lost because the
   * session was not polled often enough; the session must be restarted
   */
  public List<ServiceEvent> pollBrowse(final BrowseHandle handle) throws ServiceSessionException {
    synchronized (registry) {
      BrowseSlot slot = registry.currentBrowse(handle);
      if (slot == null) {
        return Collections.emptyList();
      }

      EventQueue queue = slot.getQueue();
      if (queue.getOverflowedGeneration() == handle.getGeneration()) {
        throw new ServiceSessionException(REASON.QUEUE_OVERFLOW,
            "More than " + queue.getBound() + " record batches were waiting, restart the browse")
            .withContext("pollBrowse", handle.getServiceType().toString(), null);
      }

      List<ServiceEvent> events = new ArrayList<>();
      for (RecordBatch batch : queue.drain()) {
        events.addAll(slot.getBridge().apply(batch));
      }
      return events;
    }
  }

  /**
   * Stops the session. Events of the session not polled yet are discarded.
   */
  public void stopBrowse(final BrowseHandle handle) {
    synchronized (registry) {
      BrowseSlot slot = registry.currentBrowse(handle);
      if (slot != null) {
        stop(slot);
        LOG.debug("Stopped {}", handle);
      }
    }
  }

  private void stop(final BrowseSlot slot) {
    BrowseOperation previous = slot.deactivate();
    if (previous != null && engine != null) {
      engine.unsubscribe(previous);
    }
  }

  public AdvertiseHandle advertise(final String instanceName, final String serviceType,
      final int port, final Map<String, String> txt) throws ServiceSessionException {
    return advertise(SessionRegistry.DEFAULT_OWNER, instanceName, serviceType, port, txt);
  }

  /**
   * Advertises a service, withdrawing the owner's previous advertisement. The name is probed for
   * in the background; a conflict found then is reported through
   * {@link #registrationState(AdvertiseHandle)} and {@link AdvertiseListener#advertiseError}.
   *
   * @param port clamped into 1..65535
   * @param txt the TXT metadata, may be null or empty
   * @throws ServiceSessionException {@link REASON#INVALID_SERVICE_TYPE},
   * {@link REASON#INVALID_INSTANCE_NAME}, {@link REASON#INVALID_TXT_KEY} or
   * {@link REASON#ENTRY_TOO_LONG} for invalid arguments; {@link REASON#NAME_CONFLICT} if this
   * host already advertises the name; {@link REASON#ENGINE_UNAVAILABLE} or
   * {@link REASON#MULTICAST_BLOCKED} if the engine could not be started
   */
  public AdvertiseHandle advertise(final Object owner, final String instanceName,
      final String serviceType, final int port, final Map<String, String> txt)
      throws ServiceSessionException {
    final String operation = "advertise";
    ServiceType type = parseServiceType(operation, serviceType, instanceName);

    if (StringUtils.isEmpty(instanceName)) {
      throw new ServiceSessionException(REASON.INVALID_INSTANCE_NAME, "Instance name is empty")
          .withContext(operation, serviceType, instanceName);
    }

    Name name;
    try {
      name = MulticastDNSUtils.instanceName(instanceName, type.getName());
    } catch (TextParseException e) {
      throw new ServiceSessionException(REASON.INVALID_INSTANCE_NAME, e.getMessage(), e)
          .withContext(operation, serviceType, instanceName);
    }

    byte[] txtWire;
    try {
      txtWire = TxtCodec.encode(txt);
    } catch (ServiceSessionException e) {
      throw e.withContext(operation, serviceType, instanceName);
    }

    int clamped = Math.max(1, Math.min(0xFFFF, port));
    if (clamped != port) {
      LOG.warn("Port {} of \"{}\" is out of range, advertising port {}", port, instanceName,
          clamped);
    }

    synchronized (registry) {
      MulticastDNSEngine engine = engine(operation, serviceType, instanceName);

      AdvertiseSlot slot = registry.advertiseSlot(owner);
      withdraw(slot);

      AdvertiseRecord record = new AdvertiseRecord(instanceName, type, clamped,
          txt == null ? Collections.emptyMap() : txt);
      Registration registration;
      try {
        registration = engine.register(record, name, txtWire);
      } catch (ServiceSessionException e) {
        throw e.withContext(operation, serviceType, instanceName);
      }

      AdvertiseHandle handle = new AdvertiseHandle(owner, registry.nextGeneration(),
          record.getFullName());
      slot.activate(handle, record, registration);
      return handle;
    }
  }

  /**
   * Withdraws the advertisement. The goodbye is sent in the background.
   */
  public void unadvertise(final AdvertiseHandle handle) {
    synchronized (registry) {
      AdvertiseSlot slot = registry.currentAdvertise(handle);
      if (slot != null) {
        withdraw(slot);
        LOG.debug("Withdrew {}", handle);
      }
    }
  }

  private void withdraw(final AdvertiseSlot slot) {
    Registration previous = slot.deactivate();
    if (previous != null && engine != null) {
      engine.unregister(previous);
    }
  }

  /**
   * @return The full name of the advertised service, e.g.
   * {@code Game Server A._mygame._tcp.local.}, or an empty string if the advertisement is no
   * longer live
   */
  public String registeredFullName(final AdvertiseHandle handle) {
    synchronized (registry) {
      AdvertiseSlot slot = registry.currentAdvertise(handle);
      if (slot == null) {
        return "";
      }

      RegistrationState state = slot.getRecord().getState();
      return state == RegistrationState.PENDING || state == RegistrationState.REGISTERED
          ? slot.getRecord().getFullName() : "";
    }
  }

  /**
   * @return The state of the advertisement, {@link RegistrationState#UNREGISTERED} for a stale
   * handle
   */
  public RegistrationState registrationState(final AdvertiseHandle handle) {
    synchronized (registry) {
      AdvertiseSlot slot = registry.currentAdvertise(handle);
      return slot == null ? RegistrationState.UNREGISTERED : slot.getRecord().getState();
    }
  }

  /**
   * @return Why the advertisement failed, or null if it did not
   */
  public ServiceSessionException registrationError(final AdvertiseHandle handle) {
    synchronized (registry) {
      AdvertiseSlot slot = registry.currentAdvertise(handle);
      return slot == null ? null : slot.getRecord().getFailure();
    }
  }

  public boolean isBrowsing() {
    return isBrowsing(SessionRegistry.DEFAULT_OWNER);
  }

  public boolean isBrowsing(final Object owner) {
    return registry.isBrowsing(owner);
  }

  public boolean isAdvertising() {
    return isAdvertising(SessionRegistry.DEFAULT_OWNER);
  }

  public boolean isAdvertising(final Object owner) {
    return registry.isAdvertising(owner);
  }

  public BrowseListener addBrowseListener(final BrowseListener listener) {
    return addBrowseListener(SessionRegistry.DEFAULT_OWNER, listener);
  }

  public BrowseListener addBrowseListener(final Object owner, final BrowseListener listener) {
    return registry.browseListeners(owner).registerListener(listener);
  }

  public BrowseListener removeBrowseListener(final Object owner, final BrowseListener listener) {
    return registry.browseListeners(owner).unregisterListener(listener);
  }

  public AdvertiseListener addAdvertiseListener(final AdvertiseListener listener) {
    return addAdvertiseListener(SessionRegistry.DEFAULT_OWNER, listener);
  }

  public AdvertiseListener addAdvertiseListener(final Object owner,
      final AdvertiseListener listener) {
    return registry.advertiseListeners(owner).registerListener(listener);
  }

  public AdvertiseListener removeAdvertiseListener(final Object owner,
      final AdvertiseListener listener) {
    return registry.advertiseListeners(owner).unregisterListener(listener);
  }

  /**
   * The per tick hook: polls every browse session whose owner has listeners and dispatches the
   * events, then reports advertisements that failed since the last call. A browse session that
   * fails is reported to {@link BrowseListener#browseError} and stopped.
   */
  public void process() {
    for (BrowseSlot slot : registry.activeBrowseSlots()) {
      ListenerProcessor<BrowseListener> listeners = registry.browseListeners(slot.getOwner());
      BrowseHandle handle;
      synchronized (registry) {
        handle = slot.getHandle();
      }
      if (handle == null || !listeners.hasListeners()) {
        continue;
      }

      BrowseListener dispatcher = listeners.getDispatcher();
      try {
        for (ServiceEvent event : pollBrowse(handle)) {
          switch (event.getType()) {
            case DISCOVERED:
              dispatcher.serviceDiscovered(handle, event.getService());
              break;
            case UPDATED:
              dispatcher.serviceUpdated(handle, event.getService());
              break;
            case REMOVED:
              dispatcher.serviceRemoved(handle, event.getService());
              break;
            default:
              break;
          }
        }
      } catch (ServiceSessionException e) {
        LOG.warn("Browse session {} failed, stopping it", handle, e);
        stopBrowse(handle);
        dispatcher.browseError(handle, e);
      }
    }

    for (AdvertiseSlot slot : registry.activeAdvertiseSlots()) {
      AdvertiseHandle handle;
      ServiceSessionException failure;
      synchronized (registry) {
        if (!slot.reportFailure()) {
          continue;
        }
        handle = slot.getHandle();
        failure = slot.getRecord().getFailure();
      }
      registry.advertiseListeners(slot.getOwner()).getDispatcher().advertiseError(handle, failure);
    }
  }

  /**
   * @return The counters of the engine, all zero before the engine is started
   */
  public EngineMetrics getMetrics() {
    synchronized (registry) {
      return engine == null ? new EngineStatistics().snapshot() : engine.getMetrics();
    }
  }

  public EngineConfig getConfig() {
    return config;
  }

  /**
   * Stops every session, withdraws every advertisement and shuts the engine down. Waits for the
   * background threads at most {@link EngineConfig#getTeardownTimeoutMillis()}. Calling it again
   * does nothing.
   */
  public void close() {
    MulticastDNSEngine engine;
    synchronized (registry) {
      if (closed) {
        return;
      }
      closed = true;
      registry.clear();
      engine = this.engine;
      this.engine = null;
    }

    if (engine != null) {
      engine.close();
    }
    LOG.debug("Service session manager closed");
  }

  private MulticastDNSEngine engine(final String operation, final String serviceType,
      final String instanceName) throws ServiceSessionException {
    if (closed) {
      throw new ServiceSessionException(REASON.ENGINE_CLOSED, "The session manager is closed")
          .withContext(operation, serviceType, instanceName);
    }

    if (engine == null) {
      try {
        engine = MulticastDNSEngine.start(config);
      } catch (ServiceSessionException e) {
        LOG.warn("mDNS engine could not be started: {}", e.getMessage());
        throw e.withContext(operation, serviceType, instanceName);
      }
    }
    return engine;
  }

  private static ServiceType parseServiceType(final String operation, final String serviceType,
      final String instanceName) throws ServiceSessionException {
    try {
      return ServiceType.parse(serviceType);
    } catch (ServiceSessionException e) {
      throw e.withContext(operation, serviceType, instanceName);
    }
  }
}
