package net.lanplay.mDNS;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;
import net.lanplay.mDNS.model.DiscoveredService;
import net.lanplay.mDNS.model.ServiceEvent;
import net.lanplay.mDNS.model.ServiceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.TXTRecord;

class EventBridgeTest {

  private static final Name TYPE = Name.fromConstantString("_mygame._tcp.local.");

  private static final Name INSTANCE = Name.fromConstantString("lobby._mygame._tcp.local.");

  private static final Name HOST = Name.fromConstantString("host-a.local.");

  private final EngineStatistics statistics = new EngineStatistics();

  private EventBridge bridge;

  private InetAddress address;

  @BeforeEach
  void setUp() throws Exception {
    bridge = new EventBridge(ServiceType.parse("_mygame._tcp.local."), 1, statistics);
    address = InetAddress.getByName("192.168.1.20");
  }

  @Test
  void serviceIsDiscoveredOnceItResolves() {
    assertThat(apply(ptr(4500))).isEmpty();
    assertThat(apply(txt(4500, "version=1.0"))).isEmpty();
    assertThat(apply(srv(120, 7350))).isEmpty();

    List<ServiceEvent> events = apply(a(120, address));

    assertThat(events).hasSize(1);
    ServiceEvent event = events.get(0);
    assertThat(event.getType()).isEqualTo(ServiceEvent.Type.DISCOVERED);
    assertThat(event.getGeneration()).isEqualTo(1);
    DiscoveredService service = event.getService();
    assertThat(service.getInstanceName()).isEqualTo("lobby");
    assertThat(service.getPort()).isEqualTo(7350);
    assertThat(service.getAddresses()).containsExactly(address);
    assertThat(service.getTxt()).containsExactly(entry("version", "1.0"));
    assertThat(service.getState()).isEqualTo(DiscoveredService.State.RESOLVED);
  }

  @Test
  void aWholeServiceInOneBatchIsOneEvent() {
    List<ServiceEvent> events = apply(ptr(4500), srv(120, 7350), txt(4500, "version=1.0"),
        a(120, address));

    assertThat(events).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.DISCOVERED);
  }

  @Test
  void identicalRecordsProduceNothing() {
    apply(ptr(4500), srv(120, 7350), a(120, address));

    assertThat(apply(srv(120, 7350), a(120, address))).isEmpty();
  }

  @Test
  void metadataChangeIsAnUpdate() {
    apply(ptr(4500), srv(120, 7350), txt(4500, "version=1.0"), a(120, address));

    List<ServiceEvent> events = apply(txt(4500, "version=1.1"));

    assertThat(events).hasSize(1);
    assertThat(events.get(0).getType()).isEqualTo(ServiceEvent.Type.UPDATED);
    assertThat(events.get(0).getService().getTxt()).containsEntry("version", "1.1");
  }

  @Test
  void portChangeIsAnUpdate() {
    apply(ptr(4500), srv(120, 7350), a(120, address));

    List<ServiceEvent> events = apply(srv(120, 7351));

    assertThat(events).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.UPDATED);
    assertThat(events.get(0).getService().getPort()).isEqualTo(7351);
  }

  @Test
  void goodbyeRemovesOnceAndTheNameCanReturn() {
    apply(ptr(4500), srv(120, 7350), a(120, address));

    List<ServiceEvent> removed = apply(ptr(0));
    assertThat(removed).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.REMOVED);
    assertThat(removed.get(0).getService().getState())
        .isEqualTo(DiscoveredService.State.REMOVED);
    assertThat(apply(srv(0, 7350))).isEmpty();
    assertThat(bridge.size()).isZero();

    assertThat(apply(ptr(4500), srv(120, 7350))).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.DISCOVERED);
  }

  @Test
  void goodbyeOfAnUnresolvedServiceIsSilent() {
    apply(ptr(4500));

    assertThat(apply(ptr(0))).isEmpty();
  }

  @Test
  void txtGoodbyeAloneKeepsTheService() {
    apply(ptr(4500), srv(120, 7350), txt(4500, "version=1.0"), a(120, address));

    assertThat(apply(txt(0, "version=1.0"))).isEmpty();
    assertThat(bridge.size()).isEqualTo(1);
  }

  @Test
  void losingEveryAddressRemovesTheService() throws Exception {
    InetAddress second = InetAddress.getByName("192.168.1.21");
    apply(ptr(4500), srv(120, 7350), a(120, address), a(120, second));

    assertThat(apply(a(0, address))).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.UPDATED);
    assertThat(apply(a(0, second))).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.REMOVED);
    assertThat(apply(a(120, second))).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.DISCOVERED);
  }

  @Test
  void instancesOfOtherTypesAreIgnored() {
    Name other = Name.fromConstantString("_other._tcp.local.");
    Name instance = Name.fromConstantString("lobby._other._tcp.local.");

    assertThat(apply(new PTRRecord(other, DClass.IN, 4500, instance),
        new SRVRecord(instance, DClass.IN, 120, 0, 0, 7350, HOST), a(120, address))).isEmpty();
    assertThat(bridge.size()).isZero();
  }

  @Test
  void batchesOfAnotherGenerationAreDiscarded() {
    List<ServiceEvent> events = bridge.apply(new RecordBatch(2,
        Arrays.asList(ptr(4500), srv(120, 7350), a(120, address))));

    assertThat(events).isEmpty();
    assertThat(bridge.size()).isZero();
    assertThat(bridge.getGeneration()).isEqualTo(1);
  }

  @Test
  void eventsFollowTheOrderOfTheirRecords() {
    Name other = Name.fromConstantString("arena._mygame._tcp.local.");
    apply(ptr(4500), srv(120, 7350), a(120, address), new PTRRecord(TYPE, DClass.IN, 4500, other),
        new SRVRecord(other, DClass.IN, 120, 0, 0, 7351, HOST));

    List<ServiceEvent> events = apply(srv(120, 9), new PTRRecord(TYPE, DClass.IN, 0, other));

    assertThat(events).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.UPDATED, ServiceEvent.Type.REMOVED);
    assertThat(events.get(0).getService().getInstanceName()).isEqualTo("lobby");
    assertThat(events.get(0).getService().getPort()).isEqualTo(9);
    assertThat(events.get(1).getService().getInstanceName()).isEqualTo("arena");
  }

  @Test
  void anUpdateAfterARemovalInTheSameBatchFollowsIt() {
    Name other = Name.fromConstantString("arena._mygame._tcp.local.");
    apply(ptr(4500), srv(120, 7350), a(120, address), new PTRRecord(TYPE, DClass.IN, 4500, other),
        new SRVRecord(other, DClass.IN, 120, 0, 0, 7351, HOST));

    List<ServiceEvent> events = apply(new PTRRecord(TYPE, DClass.IN, 0, other), srv(120, 9));

    assertThat(events).extracting(ServiceEvent::getType)
        .containsExactly(ServiceEvent.Type.REMOVED, ServiceEvent.Type.UPDATED);
  }

  @Test
  void malformedTxtEntriesAreCounted() {
    apply(ptr(4500), srv(120, 7350), txt(4500, "=orphan", "version=1.0"), a(120, address));

    assertThat(statistics.snapshot().getMalformedTxtEntries()).isEqualTo(1);
  }

  private List<ServiceEvent> apply(final Record... records) {
    return bridge.apply(new RecordBatch(bridge.getGeneration(), Arrays.asList(records)));
  }

  private static Record ptr(final long ttl) {
    return new PTRRecord(TYPE, DClass.IN, ttl, INSTANCE);
  }

  private static Record srv(final long ttl, final int port) {
    return new SRVRecord(INSTANCE, DClass.IN, ttl, 0, 0, port, HOST);
  }

  private static Record txt(final long ttl, final String... strings) {
    return new TXTRecord(INSTANCE, DClass.IN, ttl, Arrays.asList(strings));
  }

  private static Record a(final long ttl, final InetAddress address) {
    return new ARecord(HOST, DClass.IN, ttl, address);
  }
}
