package net.lanplay.mDNS;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import net.lanplay.mDNS.model.AdvertiseRecord;
import net.lanplay.mDNS.model.AdvertiseRecord.RegistrationState;
import net.lanplay.mDNS.model.ServiceType;
import net.lanplay.mDNS.net.NetworkProcessor;
import net.lanplay.mDNS.net.Packet;
import net.lanplay.mDNS.net.PacketListener;
import net.lanplay.mDNS.resolvers.Cacher;
import net.lanplay.mDNS.resolvers.MulticastDNSResponder;
import net.lanplay.mDNS.utils.Executors;
import net.lanplay.mDNS.utils.IpUtil;
import net.lanplay.mDNS.utils.MessageWriter;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Header;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.TextParseException;

/**
 * The multicast DNS protocol engine [RFC 6762, RFC 6763]. Owns the sockets, the record cache, the
 * browse and registration timers, and the single engine thread all of them run on.
 *
 * Read threads hand each datagram over to the engine thread unparsed, so the cache, the browse
 * operations and the registrations are never touched concurrently. The methods called by
 * the consumer ({@link #subscribe}, {@link #unsubscribe}, {@link #register}, {@link #unregister})
 * only do bookkeeping and post work to the engine thread; none of them waits on the network.
 */
public class MulticastDNSEngine implements PacketListener, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(MulticastDNSEngine.class);

  private final EngineConfig config;

  private final boolean mdnsVerbose;

  private final Executors executors = new Executors();

  private final EngineStatistics statistics = new EngineStatistics();

  private final MulticastDNSCache cache = new MulticastDNSCache();

  private final Cacher cacher;

  private final MulticastDNSResponder<Registration> responder;

  private final Name hostName;

  private final List<BrowseOperation> operations = new ArrayList<>();

  private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

  private final AtomicBoolean closed = new AtomicBoolean(false);

  private List<NetworkProcessor> processors = Collections.emptyList();

  private List<InetAddress> hostAddresses = Collections.emptyList();

  private MulticastDNSEngine(final EngineConfig config) throws ServiceSessionException {
    this.config = config;
    this.mdnsVerbose = config.isVerbose();

    String label = config.getHostName() != null
        ? MulticastDNSUtils.toHostLabel(config.getHostName()) : MulticastDNSUtils.getHostName();
    try {
      hostName = Name.fromString(label + "." + Constants.LINK_LOCAL_DOMAIN);
    } catch (TextParseException e) {
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "Invalid host name \"" + label + "\"", e);
    }

    cacher = new Cacher(mdnsVerbose, cache);
    responder = new MulticastDNSResponder<>(mdnsVerbose,
        new MulticastDNSResponder.RecordSource<Registration>() {
          public List<Record> answer(final Registration owner, final Record question) {
            return owner.answer(question);
          }

          public List<Record> additionals(final Registration owner, final Record answer) {
            return owner.additionals(answer);
          }
        });
  }

  /**
   * Opens the network endpoints and starts the engine thread.
   *
   * @throws ServiceSessionException {@link REASON#ENGINE_UNAVAILABLE} if no socket could be
   * bound, {@link REASON#MULTICAST_BLOCKED} if sockets were bound but no multicast group could be
   * joined
   */
  public static MulticastDNSEngine start(final EngineConfig config)
      throws ServiceSessionException {
    MulticastDNSEngine engine = new MulticastDNSEngine(config);
    try {
      engine.open();
    } catch (ServiceSessionException | RuntimeException e) {
      engine.close();
      throw e;
    }
    return engine;
  }

  private void open() throws ServiceSessionException {
    processors = config.getNetworkProcessorFactory().open(config, this, executors);

    Set<InetAddress> addresses = new LinkedHashSet<>();
    for (NetworkProcessor processor : processors) {
      addresses.add(processor.getInterfaceAddress());
    }
    hostAddresses = IpUtil.sortIPv4First(addresses);

    for (NetworkProcessor processor : processors) {
      processor.start();
    }

    executors.scheduleWithFixedDelay(this::sweep, Constants.CACHE_SWEEP_INTERVAL_MILLIS,
        Constants.CACHE_SWEEP_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);

    LOG.info("mDNS engine started as {} on {}", hostName, processors);
  }

  /**
   * Starts browsing for a service type. Records are delivered to the queue tagged with the
   * generation.
   */
  BrowseOperation subscribe(final ServiceType serviceType, final long generation,
      final EventQueue queue) throws ServiceSessionException {
    checkOpen();

    BrowseOperation operation = new BrowseOperation(this, serviceType, generation, queue);
    boolean accepted = executors.execute(() -> {
      if (!operation.isCancelled()) {
        operations.add(operation);
        operation.start(System.currentTimeMillis());
      }
    });
    if (!accepted) {
      throw new ServiceSessionException(REASON.ENGINE_CLOSED, "The mDNS engine is shutting down");
    }

    LOG.debug("Subscribed to {} generation {}", serviceType, generation);
    return operation;
  }

  /**
   * Stops browsing. Takes effect at once for new records; the query timer is cancelled on the
   * engine thread.
   */
  void unsubscribe(final BrowseOperation operation) {
    if (operation == null) {
      return;
    }

    operation.close();
    executors.execute(() -> {
      operation.cancel();
      operations.remove(operation);
    });
    LOG.debug("Unsubscribed from {} generation {}", operation.getServiceType(),
        operation.getGeneration());
  }

  /**
   * Claims the service name and starts probing for it.
   *
   * @throws ServiceSessionException {@link REASON#NAME_CONFLICT} if this engine already advertises
   * the name
   */
  Registration register(final AdvertiseRecord record, final Name instanceName,
      final byte[] txtWire) throws ServiceSessionException {
    checkOpen();

    Registration registration = new Registration(this, record, instanceName, hostName,
        hostAddresses, txtWire);
    Registration existing = registrations.putIfAbsent(registration.getKey(), registration);
    if (existing != null) {
      throw new ServiceSessionException(REASON.NAME_CONFLICT,
          "\"" + record.getFullName() + "\" is already advertised by this host");
    }

    if (!executors.execute(registration::start)) {
      registrations.remove(registration.getKey(), registration);
      throw new ServiceSessionException(REASON.ENGINE_CLOSED, "The mDNS engine is shutting down");
    }

    LOG.debug("Registering {}", record);
    return registration;
  }

  /**
   * Withdraws the registration at once and sends the goodbye from the engine thread.
   */
  void unregister(final Registration registration) {
    if (registration == null) {
      return;
    }

    registrations.remove(registration.getKey(), registration);
    RegistrationState previous = registration.getRecord().withdraw();
    if (previous == RegistrationState.UNREGISTERED) {
      return;
    }

    executors.execute(registration::goodbye);
    LOG.debug("Unregistered {}", registration.getRecord().getFullName());
  }

  void registrationFailed(final Registration registration) {
    registrations.remove(registration.getKey(), registration);
  }

  /**
   * Multicasts a message on every endpoint.
   *
   * @return The number of endpoints it was written to
   */
  int send(final Message message) {
    if (mdnsVerbose) {
      LOG.info("Broadcasting message\n{}", message);
    }

    try {
      return MessageWriter.writeMessageToWire(message, processors, statistics);
    } catch (IOException e) {
      LOG.warn("Error broadcasting message", e);
      return 0;
    }
  }

  public void packetReceived(final NetworkProcessor processor, final Packet packet) {
    statistics.packetReceived();
    if (!executors.execute(() -> handlePacket(processor, packet))) {
      LOG.trace("Engine shutting down, dropping {}", packet);
    }
  }

  private void handlePacket(final NetworkProcessor processor, final Packet packet) {
    byte[] data = packet.getData();
    if (data.length < Header.LENGTH) {
      statistics.parseFailure();
      LOG.debug("Error parsing mDNS packet {} - Invalid DNS header - too short", packet.getId());
      return;
    }

    Message message;
    try {
      message = new Message(data);
    } catch (IOException e) {
      statistics.parseFailure();
      LOG.debug("Error parsing mDNS packet {} from {}", packet.getId(), packet.getSource(), e);
      return;
    }

    if (mdnsVerbose) {
      LOG.info("mDNS Datagram Received from {}\n{}", packet.getSource(), message);
    }

    long now = System.currentTimeMillis();
    if (message.getHeader().getFlag(Flags.QR)) {
      List<Record> records = MulticastDNSUtils.extractRecords(message, Section.ANSWER,
          Section.AUTHORITY, Section.ADDITIONAL);
      for (Registration registration : new ArrayList<>(registrations.values())) {
        registration.handleResponse(records);
      }

      List<Record> changes = cacher.receiveMessage(message, now);
      for (BrowseOperation operation : new ArrayList<>(operations)) {
        operation.deliver(changes, now);
        operation.resolveMissing(now);
      }
    } else {
      respond(processor, packet, message);
    }
  }

  private void respond(final NetworkProcessor processor, final Packet packet,
      final Message query) {
    List<Registration> answering = new ArrayList<>();
    for (Registration registration : registrations.values()) {
      if (registration.isAnswering()) {
        answering.add(registration);
      }
    }
    if (answering.isEmpty()) {
      return;
    }

    boolean legacyUnicast = packet.getSourcePort() != config.getPort();
    Message response = responder.receiveMessage(query, answering, legacyUnicast);
    if (response == null) {
      return;
    }

    try {
      if (legacyUnicast) {
        MessageWriter.writeMessageTo(response, processor, packet.getSource(), statistics);
      } else {
        MessageWriter.writeMessageToWire(response, processors, statistics);
      }
    } catch (IOException e) {
      LOG.warn("Error replying to query from {}", packet.getSource(), e);
    }
  }

  /**
   * Runs once a second: removes expired records, reporting them to the browse operations, and
   * queries for watched records that are about to expire.
   */
  private void sweep() {
    long now = System.currentTimeMillis();

    List<Record> expired = cache.expire(now);
    if (CollectionUtils.isNotEmpty(expired)) {
      LOG.debug("Expired records {}", expired);
      for (BrowseOperation operation : new ArrayList<>(operations)) {
        operation.deliver(expired, now);
      }
    }

    List<Record> due = cache.refreshDue(now, record -> {
      for (BrowseOperation operation : operations) {
        if (operation.watches(record)) {
          return true;
        }
      }
      return false;
    });
    if (CollectionUtils.isNotEmpty(due)) {
      Message query = MulticastDNSUtils.newQuery();
      for (Record record : due) {
        Record question = Record.newRecord(record.getName(), record.getType(), DClass.IN);
        if (!query.findRecord(question, Section.QUESTION)) {
          query.addRecord(question, Section.QUESTION);
        }
      }
      LOG.debug("Refreshing {} records", due.size());
      send(query);
    }
  }

  MulticastDNSCache getCache() {
    return cache;
  }

  Executors getExecutors() {
    return executors;
  }

  EngineStatistics getStatistics() {
    return statistics;
  }

  public EngineConfig getConfig() {
    return config;
  }

  public Name getHostName() {
    return hostName;
  }

  public EngineMetrics getMetrics() {
    return statistics.snapshot();
  }

  private void checkOpen() throws ServiceSessionException {
    if (closed.get()) {
      throw new ServiceSessionException(REASON.ENGINE_CLOSED, "The mDNS engine has been closed");
    }
  }

  /**
   * Sends the goodbyes of the live registrations, then stops the engine thread and the read
   * threads. Waits at most the configured teardown timeout for them, then forces them down.
   */
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    long deadline = System.currentTimeMillis() + config.getTeardownTimeoutMillis();

    List<Registration> live = new ArrayList<>(registrations.values());
    registrations.clear();
    for (Registration registration : live) {
      if (registration.getRecord().withdraw() != RegistrationState.UNREGISTERED) {
        executors.execute(registration::goodbye);
      }
    }
    executors.execute(() -> {
      operations.forEach(BrowseOperation::cancel);
      operations.clear();
      cache.clear();
    });

    executors.shutdown(config.getTeardownTimeoutMillis(), TimeUnit.MILLISECONDS);

    processors.forEach(IOUtils::closeQuietly);
    for (NetworkProcessor processor : processors) {
      processor.join(deadline - System.currentTimeMillis());
    }

    LOG.info("mDNS engine {} closed, {}", hostName, statistics.snapshot());
  }
}
