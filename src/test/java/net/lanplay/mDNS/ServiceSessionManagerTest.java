package net.lanplay.mDNS;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import net.lanplay.mDNS.model.AdvertiseRecord.RegistrationState;
import net.lanplay.mDNS.model.DiscoveredService;
import net.lanplay.mDNS.model.ServiceEvent;
import net.lanplay.mDNS.net.LoopbackSegment;
import net.lanplay.mDNS.net.NetworkProcessorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

class ServiceSessionManagerTest {

  private static final String TYPE = "_mygame._tcp.local.";

  private static final long TIMEOUT_MILLIS = 10_000;

  private final LoopbackSegment segment = new LoopbackSegment();

  private final List<ServiceSessionManager> managers = new ArrayList<>();

  @AfterEach
  void tearDown() {
    managers.forEach(ServiceSessionManager::close);
  }

  @Test
  void peerDiscoversAnAdvertisedService() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");

    BrowseHandle browse = peer.startBrowse(TYPE);
    AdvertiseHandle ad = host.advertise("Game Server A", TYPE, 7350,
        Collections.singletonMap("version", "1.0"));
    assertThat(host.registeredFullName(ad)).isEqualTo("Game Server A._mygame._tcp.local.");

    List<ServiceEvent> events = awaitEvents(peer, browse, ServiceEvent.Type.DISCOVERED);

    assertThat(events).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.DISCOVERED);
    DiscoveredService service = events.get(0).getService();
    assertThat(service.getInstanceName()).isEqualTo("Game Server A");
    assertThat(service.getFullName()).isEqualTo("Game Server A._mygame._tcp.local.");
    assertThat(service.getHostname()).isEqualTo("host-a.local.");
    assertThat(service.getPort()).isEqualTo(7350);
    assertThat(service.getAddresses()).containsExactly(InetAddress.getByName("10.0.0.1"));
    assertThat(service.getTxt()).containsExactly(entry("version", "1.0"));
    assertThat(host.registrationState(ad)).isEqualTo(RegistrationState.REGISTERED);
  }

  @Test
  void laterBrowserFindsAnAlreadyRegisteredService() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");

    AdvertiseHandle ad = host.advertise("Game Server A", TYPE, 7350, null);
    awaitState(host, ad, RegistrationState.REGISTERED);
    BrowseHandle browse = peer.startBrowse(TYPE);

    List<ServiceEvent> events = awaitEvents(peer, browse, ServiceEvent.Type.DISCOVERED);

    assertThat(events).extracting(event -> event.getService().getInstanceName())
        .containsExactly("Game Server A");
    assertThat(events.get(0).getService().getTxt()).isEmpty();
  }

  @Test
  void hostDiscoversItsOwnService() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");

    BrowseHandle browse = host.startBrowse(TYPE);
    host.advertise("Game Server A", TYPE, 70_000, null);

    List<ServiceEvent> events = awaitEvents(host, browse, ServiceEvent.Type.DISCOVERED);

    assertThat(events).hasSize(1);
    assertThat(events.get(0).getService().getPort()).isEqualTo(65535);
  }

  @Test
  void unadvertisedServiceIsRemovedAtThePeer() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");
    BrowseHandle browse = peer.startBrowse(TYPE);
    AdvertiseHandle ad = host.advertise("Game Server A", TYPE, 7350, null);
    awaitEvents(peer, browse, ServiceEvent.Type.DISCOVERED);

    host.unadvertise(ad);
    List<ServiceEvent> events = awaitEvents(peer, browse, ServiceEvent.Type.REMOVED);

    assertThat(events).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.REMOVED);
    assertThat(events.get(0).getService().getState()).isEqualTo(DiscoveredService.State.REMOVED);
    assertThat(host.registeredFullName(ad)).isEmpty();
    assertThat(host.isAdvertising()).isFalse();
    host.unadvertise(ad);
  }

  @Test
  void restartingABrowseLeavesOneSession() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");

    BrowseHandle first = peer.startBrowse(TYPE);
    BrowseHandle second = peer.startBrowse(TYPE);
    assertThat(second).isNotEqualTo(first);
    assertThat(second.getGeneration()).isGreaterThan(first.getGeneration());

    host.advertise("Game Server A", TYPE, 7350, null);
    List<ServiceEvent> events = awaitEvents(peer, second, ServiceEvent.Type.DISCOVERED);

    assertThat(events).hasSize(1);
    assertThat(peer.pollBrowse(first)).isEmpty();
    peer.stopBrowse(first);
    assertThat(peer.isBrowsing()).isTrue();
    peer.stopBrowse(second);
    assertThat(peer.isBrowsing()).isFalse();
    peer.stopBrowse(second);
    assertThat(peer.pollBrowse(second)).isEmpty();
  }

  @Test
  void ownersBrowseIndependently() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");
    Object lobby = new Object();

    BrowseHandle mine = peer.startBrowse(TYPE);
    BrowseHandle theirs = peer.startBrowse(lobby, TYPE);
    host.advertise("Game Server A", TYPE, 7350, null);

    assertThat(awaitEvents(peer, mine, ServiceEvent.Type.DISCOVERED)).hasSize(1);
    assertThat(awaitEvents(peer, theirs, ServiceEvent.Type.DISCOVERED)).hasSize(1);
    assertThat(peer.isBrowsing(lobby)).isTrue();
  }

  @Test
  void sameNameTwiceOnOneHostIsAConflict() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    host.advertise("Game Server A", TYPE, 7350, null);

    assertThatThrownBy(() -> host.advertise(new Object(), "game server a", TYPE, 7351, null))
        .isInstanceOfSatisfying(ServiceSessionException.class, e -> {
          assertThat(e.getReason()).isEqualTo(REASON.NAME_CONFLICT);
          assertThat(e.getOperation()).isEqualTo("advertise");
          assertThat(e.getInstanceName()).isEqualTo("game server a");
        });
    assertThat(host.isAdvertising()).isTrue();
  }

  @Test
  void readvertisingReplacesThePreviousAdvertisement() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");

    AdvertiseHandle first = host.advertise("Game Server A", TYPE, 7350, null);
    AdvertiseHandle second = host.advertise("Game Server A", TYPE, 7351, null);

    assertThat(host.registeredFullName(first)).isEmpty();
    assertThat(host.registrationState(first)).isEqualTo(RegistrationState.UNREGISTERED);
    assertThat(host.registeredFullName(second)).isEqualTo("Game Server A._mygame._tcp.local.");
    awaitState(host, second, RegistrationState.REGISTERED);
  }

  @Test
  void nameClaimedByAnotherHostFailsTheAdvertisement() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");
    AdvertiseHandle claimed = host.advertise("Game Server A", TYPE, 7350, null);
    awaitState(host, claimed, RegistrationState.REGISTERED);

    List<ServiceSessionException> reported = new CopyOnWriteArrayList<>();
    peer.addAdvertiseListener((handle, e) -> reported.add(e));
    AdvertiseHandle late = peer.advertise("Game Server A", TYPE, 7351, null);
    awaitState(peer, late, RegistrationState.FAILED);

    ServiceSessionException error = peer.registrationError(late);
    assertThat(error.getReason()).isEqualTo(REASON.NAME_CONFLICT);
    assertThat(error.getOperation()).isEqualTo("advertise");
    assertThat(error.getInstanceName()).isEqualTo("Game Server A");
    assertThat(peer.registeredFullName(late)).isEmpty();
    assertThat(host.registrationState(claimed)).isEqualTo(RegistrationState.REGISTERED);
    assertThat(peer.isAdvertising()).isFalse();
    assertThat(host.isAdvertising()).isTrue();

    peer.process();
    peer.process();
    assertThat(reported).containsExactly(error);
  }

  @Test
  void invalidArgumentsAreRejectedWithTheirContext() {
    AtomicInteger opened = new AtomicInteger();
    ServiceSessionManager sessions = manager(failingFactory(opened, REASON.ENGINE_UNAVAILABLE));

    assertThatThrownBy(() -> sessions.startBrowse("_mygame._tcp"))
        .isInstanceOfSatisfying(ServiceSessionException.class, e -> {
          assertThat(e.getReason()).isEqualTo(REASON.INVALID_SERVICE_TYPE);
          assertThat(e.getOperation()).isEqualTo("startBrowse");
          assertThat(e.getServiceType()).isEqualTo("_mygame._tcp");
        });
    assertThatThrownBy(() -> sessions.advertise("", TYPE, 7350, null))
        .isInstanceOfSatisfying(ServiceSessionException.class,
            e -> assertThat(e.getReason()).isEqualTo(REASON.INVALID_INSTANCE_NAME));
    assertThatThrownBy(() -> sessions.advertise("Game Server A", TYPE, 7350,
        Collections.singletonMap("a=b", "c")))
        .isInstanceOfSatisfying(ServiceSessionException.class, e -> {
          assertThat(e.getReason()).isEqualTo(REASON.INVALID_TXT_KEY);
          assertThat(e.getMessage()).startsWith("advertise(\"Game Server A\", " + TYPE + ")");
        });

    assertThat(opened).hasValue(0);
  }

  @Test
  void engineStartFailureIsReportedAndRetried() {
    AtomicInteger opened = new AtomicInteger();
    ServiceSessionManager sessions = manager(failingFactory(opened, REASON.MULTICAST_BLOCKED));

    assertThatThrownBy(() -> sessions.startBrowse(TYPE))
        .isInstanceOfSatisfying(ServiceSessionException.class, e -> {
          assertThat(e.getReason()).isEqualTo(REASON.MULTICAST_BLOCKED);
          assertThat(e.isEngineUnavailable()).isTrue();
          assertThat(e.getOperation()).isEqualTo("startBrowse");
        });
    assertThatThrownBy(() -> sessions.advertise("Game Server A", TYPE, 7350, null))
        .isInstanceOf(ServiceSessionException.class);

    assertThat(opened).hasValue(2);
    assertThat(sessions.isBrowsing()).isFalse();
  }

  @Test
  void closedManagerRejectsNewSessions() throws Exception {
    ServiceSessionManager sessions = manager("host-a", "10.0.0.1");
    BrowseHandle browse = sessions.startBrowse(TYPE);
    AdvertiseHandle ad = sessions.advertise("Game Server A", TYPE, 7350, null);

    sessions.close();
    sessions.close();

    assertThat(sessions.pollBrowse(browse)).isEmpty();
    assertThat(sessions.registeredFullName(ad)).isEmpty();
    assertThat(segment.getMembers()).isEmpty();
    assertThatThrownBy(() -> sessions.startBrowse(TYPE))
        .isInstanceOfSatisfying(ServiceSessionException.class,
            e -> assertThat(e.getReason()).isEqualTo(REASON.ENGINE_CLOSED));
    assertThatThrownBy(() -> sessions.advertise("Game Server A", TYPE, 7350, null))
        .isInstanceOfSatisfying(ServiceSessionException.class,
            e -> assertThat(e.getReason()).isEqualTo(REASON.ENGINE_CLOSED));
  }

  @Test
  void slowConsumerOverflowsItsQueue() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager(EngineConfig.builder().port(Constants.DEFAULT_PORT)
        .hostName("host-b").queueBound(1).teardownTimeoutMillis(1000)
        .networkProcessorFactory(segment.factory("10.0.0.2")).build());

    BrowseHandle browse = peer.startBrowse(TYPE);
    host.advertise("Lobby 1", TYPE, 7350, null);
    host.advertise(new Object(), "Lobby 2", TYPE, 7351, null);
    await(() -> peer.getMetrics().getQueueOverflows() > 0);

    for (int attempt = 0; attempt < 2; attempt++) {
      assertThatThrownBy(() -> peer.pollBrowse(browse))
          .isInstanceOfSatisfying(ServiceSessionException.class, e -> {
            assertThat(e.getReason()).isEqualTo(REASON.QUEUE_OVERFLOW);
            assertThat(e.getOperation()).isEqualTo("pollBrowse");
          });
    }

    BrowseHandle restarted = peer.startBrowse(TYPE);
    assertThat(peer.pollBrowse(restarted)).isNotNull();
  }

  @Test
  void processDispatchesToListeners() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");
    List<String> calls = new CopyOnWriteArrayList<>();
    peer.addBrowseListener(new BrowseListener() {
      public void serviceDiscovered(final BrowseHandle handle, final DiscoveredService service) {
        calls.add("discovered " + service.getInstanceName());
      }

      public void serviceUpdated(final BrowseHandle handle, final DiscoveredService service) {
        calls.add("updated " + service.getInstanceName());
      }

      public void serviceRemoved(final BrowseHandle handle, final DiscoveredService service) {
        calls.add("removed " + service.getInstanceName());
      }

      public void browseError(final BrowseHandle handle, final ServiceSessionException e) {
        calls.add("error " + e.getReason());
      }
    });

    peer.startBrowse(TYPE);
    AdvertiseHandle ad = host.advertise("Game Server A", TYPE, 7350, null);
    await(() -> {
      peer.process();
      return calls.contains("discovered Game Server A");
    });
    host.unadvertise(ad);
    await(() -> {
      peer.process();
      return calls.contains("removed Game Server A");
    });

    assertThat(calls).containsExactly("discovered Game Server A", "removed Game Server A");
  }

  @Test
  void removedListenerIsNoLongerCalled() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    ServiceSessionManager peer = manager("host-b", "10.0.0.2");
    List<String> kept = new CopyOnWriteArrayList<>();
    List<String> dropped = new CopyOnWriteArrayList<>();
    BrowseListener keeper = new RecordingBrowseListener(kept);
    BrowseListener leaver = new RecordingBrowseListener(dropped);
    peer.addBrowseListener(keeper);
    peer.addBrowseListener(leaver);
    AdvertiseListener failures = (handle, e) -> dropped.add("error " + e.getReason());
    host.addAdvertiseListener(failures);

    assertThat(peer.removeBrowseListener(SessionRegistry.DEFAULT_OWNER, leaver)).isSameAs(leaver);
    assertThat(host.removeAdvertiseListener(SessionRegistry.DEFAULT_OWNER, failures))
        .isSameAs(failures);

    peer.startBrowse(TYPE);
    host.advertise("Game Server A", TYPE, 7350, null);
    await(() -> {
      peer.process();
      return kept.contains("discovered Game Server A");
    });

    assertThat(dropped).isEmpty();
  }

  @Test
  void legacyUnicastQueryGetsADirectReply() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    AdvertiseHandle ad = host.advertise("Game Server A", TYPE, 7350, null);
    awaitState(host, ad, RegistrationState.REGISTERED);

    Message query = new Message(0x1234);
    Record question = Record.newRecord(Name.fromString(TYPE), Type.PTR, DClass.IN);
    query.addRecord(question, Section.QUESTION);
    segment.inject(query.toWire(), new InetSocketAddress("10.0.0.9", 40000));

    byte[] reply = segment.getMembers().get(0).pollUnicast(TIMEOUT_MILLIS);
    assertThat(reply).isNotNull();
    Message response = new Message(reply);
    assertThat(response.getHeader().getID()).isEqualTo(0x1234);
    assertThat(response.getSection(Section.QUESTION)).containsExactly(question);
    assertThat(response.getSection(Section.ANSWER)).isNotEmpty()
        .allSatisfy(record -> {
          assertThat(record.getTTL()).isLessThanOrEqualTo(10);
          assertThat(record.getDClass()).isEqualTo(DClass.IN);
        });
    assertThat(response.getSection(Section.ADDITIONAL))
        .anySatisfy(record -> assertThat(record.getType()).isEqualTo(Type.SRV));
  }

  @Test
  void metricsCountTraffic() throws Exception {
    ServiceSessionManager host = manager("host-a", "10.0.0.1");
    assertThat(host.getMetrics().getPacketsSent()).isZero();

    AdvertiseHandle ad = host.advertise("Game Server A", TYPE, 7350, null);
    awaitState(host, ad, RegistrationState.REGISTERED);

    EngineMetrics metrics = host.getMetrics();
    assertThat(metrics.getQueriesSent()).isGreaterThanOrEqualTo(Constants.PROBE_COUNT);
    assertThat(metrics.getResponsesSent()).isPositive();
    assertThat(metrics.getPacketsSent()).isGreaterThanOrEqualTo(Constants.PROBE_COUNT + 1);
    // the segment loops every multicast back to its sender
    assertThat(metrics.getPacketsReceived()).isPositive();
    assertThat(metrics.getParseFailures()).isZero();

    segment.inject(new byte[] {1, 2, 3}, new InetSocketAddress("10.0.0.9", 5353));
    await(() -> host.getMetrics().getParseFailures() == 1);
  }

  private static class RecordingBrowseListener implements BrowseListener {
    private final List<String> calls;

    RecordingBrowseListener(final List<String> calls) {
      this.calls = calls;
    }

    public void serviceDiscovered(final BrowseHandle handle, final DiscoveredService service) {
      calls.add("discovered " + service.getInstanceName());
    }

    public void serviceUpdated(final BrowseHandle handle, final DiscoveredService service) {
      calls.add("updated " + service.getInstanceName());
    }

    public void serviceRemoved(final BrowseHandle handle, final DiscoveredService service) {
      calls.add("removed " + service.getInstanceName());
    }

    public void browseError(final BrowseHandle handle, final ServiceSessionException e) {
      calls.add("error " + e.getReason());
    }
  }

  private ServiceSessionManager manager(final String hostName, final String address) {
    return manager(EngineConfig.builder().port(Constants.DEFAULT_PORT).hostName(hostName)
        .teardownTimeoutMillis(1000).networkProcessorFactory(segment.factory(address)).build());
  }

  private ServiceSessionManager manager(final NetworkProcessorFactory factory) {
    return manager(EngineConfig.builder().port(Constants.DEFAULT_PORT).hostName("host-x")
        .teardownTimeoutMillis(1000).networkProcessorFactory(factory).build());
  }

  private ServiceSessionManager manager(final EngineConfig config) {
    ServiceSessionManager sessions = new ServiceSessionManager(config);
    managers.add(sessions);
    return sessions;
  }

  private static NetworkProcessorFactory failingFactory(final AtomicInteger opened,
      final REASON reason) {
    return (config, listener, executors) -> {
      opened.incrementAndGet();
      throw new ServiceSessionException(reason, "No multicast for tests");
    };
  }

  /**
   * Polls until an event of the given type arrived.
   */
  private static List<ServiceEvent> awaitEvents(final ServiceSessionManager sessions,
      final BrowseHandle handle, final ServiceEvent.Type type) throws Exception {
    Predicate<ServiceEvent> wanted = event -> event.getType() == type;
    List<ServiceEvent> events = new ArrayList<>();
    long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
    while (events.stream().noneMatch(wanted) && System.currentTimeMillis() < deadline) {
      events.addAll(sessions.pollBrowse(handle));
      Thread.sleep(20);
    }
    assertThat(events).as("events of %s", handle).anyMatch(wanted);
    return events;
  }

  private static void awaitState(final ServiceSessionManager sessions,
      final AdvertiseHandle handle, final RegistrationState state) throws Exception {
    await(() -> sessions.registrationState(handle) == state);
  }

  private static void await(final BooleanSupplier condition) throws Exception {
    long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
    while (!condition.getAsBoolean()) {
      assertThat(System.currentTimeMillis()).as("waited too long").isLessThan(deadline);
      Thread.sleep(20);
    }
  }
}
