package net.lanplay.mDNS;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import net.lanplay.mDNS.model.AdvertiseRecord;
import net.lanplay.mDNS.model.AdvertiseRecord.RegistrationState;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.NSECRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

/**
 * The engine side of an advertised service: the records it owns and the probe, announce and
 * re-announce timers [RFC 6762 Section 8]. Everything but construction runs on the engine thread.
 */
class Registration {
  private static final Logger LOG = LoggerFactory.getLogger(Registration.class);

  private final MulticastDNSEngine engine;

  private final AdvertiseRecord record;

  private final Name serviceName;

  private final Name instanceName;

  private final Record ptr;

  private final Record servicesPtr;

  private final Record srv;

  private final Record txt;

  private final Record nsec;

  private final List<Record> addresses = new ArrayList<>();

  private ScheduledFuture<?> future;

  private boolean announced = false;

  Registration(final MulticastDNSEngine engine, final AdvertiseRecord record,
      final Name instanceName, final Name hostName, final List<InetAddress> hostAddresses,
      final byte[] txtWire) throws ServiceSessionException {
    this.engine = engine;
    this.record = record;
    this.serviceName = record.getServiceType().getName();
    this.instanceName = instanceName;

    int flush = DClass.IN | Constants.CACHE_FLUSH;
    ptr = new PTRRecord(serviceName, DClass.IN, Constants.DEFAULT_PTR_TTL, instanceName);
    servicesPtr = new PTRRecord(Constants.SERVICES_DOMAIN_NAME, DClass.IN,
        Constants.DEFAULT_PTR_TTL, serviceName);
    srv = new SRVRecord(instanceName, flush, Constants.DEFAULT_SRV_TTL, 0, 0, record.getPort(),
        hostName);
    txt = Record.newRecord(instanceName, Type.TXT, flush, Constants.DEFAULT_TXT_TTL, txtWire);
    if (txt == null) {
      throw new ServiceSessionException(REASON.ENTRY_TOO_LONG,
          "TXT data of " + txtWire.length + " bytes does not form a valid TXT record");
    }
    nsec = new NSECRecord(instanceName, flush, Constants.DEFAULT_SRV_TTL, instanceName,
        new int[]{Type.TXT, Type.SRV});

    for (InetAddress address : hostAddresses) {
      if (address instanceof Inet4Address) {
        addresses.add(new ARecord(hostName, flush, Constants.DEFAULT_A_TTL, address));
      } else {
        addresses.add(new AAAARecord(hostName, flush, Constants.DEFAULT_A_TTL, address));
      }
    }
  }

  /**
   * @return The key under which the engine knows this registration, the lower case full name
   */
  String getKey() {
    return keyOf(record);
  }

  static String keyOf(final AdvertiseRecord record) {
    return record.getFullName().toLowerCase(Locale.ROOT);
  }

  AdvertiseRecord getRecord() {
    return record;
  }

  /**
   * @return true once the name is claimed and the responder may answer for it
   */
  boolean isAnswering() {
    return record.getState() == RegistrationState.REGISTERED;
  }

  void start() {
    probe(0);
  }

  private void probe(final int count) {
    if (record.getState() != RegistrationState.PENDING) {
      return;
    }

    Message probe = MulticastDNSUtils.newQuery();
    probe.addRecord(Record.newRecord(instanceName, Type.ANY, DClass.IN), Section.QUESTION);
    probe.addRecord(MulticastDNSUtils.normalize(srv), Section.AUTHORITY);
    probe.addRecord(MulticastDNSUtils.normalize(txt), Section.AUTHORITY);

    LOG.debug("Probing for \"{}\" ({} of {})", record.getFullName(), count + 1,
        Constants.PROBE_COUNT);
    engine.send(probe);

    if (count + 1 < Constants.PROBE_COUNT) {
      future = engine.getExecutors().schedule(() -> probe(count + 1),
          Constants.PROBE_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
    } else {
      future = engine.getExecutors().schedule(() -> announce(0),
          Constants.PROBE_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
    }
  }

  private void announce(final int count) {
    RegistrationState state = record.getState();
    if (state != RegistrationState.PENDING && state != RegistrationState.REGISTERED) {
      return;
    }

    if (!announce()) {
      fail(new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "The announcement could not be sent on any network interface"));
      return;
    }

    if (record.transition(RegistrationState.PENDING, RegistrationState.REGISTERED)) {
      LOG.info("Registered \"{}\" on port {}", record.getFullName(), record.getPort());
    }

    if (count + 1 < Constants.ANNOUNCE_COUNT) {
      future = engine.getExecutors().schedule(() -> announce(count + 1),
          Constants.ANNOUNCE_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
    } else {
      future = engine.getExecutors().scheduleWithFixedDelay(this::reannounce,
          Constants.REANNOUNCE_INTERVAL_MILLIS, Constants.REANNOUNCE_INTERVAL_MILLIS,
          TimeUnit.MILLISECONDS);
    }
  }

  private void reannounce() {
    if (isAnswering() && !announce()) {
      LOG.warn("Re-announcement of \"{}\" could not be sent", record.getFullName());
    }
  }

  private boolean announce() {
    Message announcement = MulticastDNSUtils.newResponse(0);
    for (Record answer : answerRecords()) {
      announcement.addRecord(answer, Section.ANSWER);
    }
    MulticastDNSUtils.addAll(announcement, addresses, Section.ADDITIONAL);
    announcement.addRecord(nsec, Section.ADDITIONAL);

    boolean sent = engine.send(announcement) > 0;
    announced |= sent;
    return sent;
  }

  /**
   * Fails a registration that is still probing when a peer answers for the same name with a
   * different service record.
   */
  void handleResponse(final List<Record> records) {
    if (record.getState() != RegistrationState.PENDING) {
      return;
    }

    Record ours = MulticastDNSUtils.normalize(srv);
    for (Record received : records) {
      if (received.getType() == Type.SRV && received.getTTL() > 0
          && received.getName().equals(instanceName)
          && !MulticastDNSUtils.normalize(received).equals(ours)) {
        LOG.warn("Name conflict for \"{}\", a peer advertises {}", record.getFullName(),
            received);
        fail(new ServiceSessionException(REASON.NAME_CONFLICT,
            "Another host already advertises \"" + record.getFullName() + "\""));
        return;
      }
    }
  }

  private void fail(final ServiceSessionException failure) {
    cancel();
    record.fail(failure.withContext("advertise", record.getServiceType().toString(),
        record.getInstanceName()));
    engine.registrationFailed(this);
  }

  /**
   * @return The records of this registration that answer the question
   */
  List<Record> answer(final Record question) {
    List<Record> answers = new ArrayList<>();
    for (Record candidate : answerRecords()) {
      if (MulticastDNSUtils.answersQuestion(question, candidate)) {
        answers.add(candidate);
      }
    }
    for (Record candidate : addresses) {
      if (MulticastDNSUtils.answersQuestion(question, candidate)) {
        answers.add(candidate);
      }
    }
    return answers;
  }

  /**
   * @return The records a resolver will want next after receiving the answer [RFC 6763 12]
   */
  List<Record> additionals(final Record answer) {
    if (answer.getType() == Type.PTR && answer.getName().equals(serviceName)) {
      List<Record> additionals = new ArrayList<>();
      additionals.add(srv);
      additionals.add(txt);
      additionals.addAll(addresses);
      additionals.add(nsec);
      return additionals;
    } else if (answer.getType() == Type.SRV) {
      return Collections.unmodifiableList(addresses);
    }
    return Collections.emptyList();
  }

  private List<Record> answerRecords() {
    List<Record> records = new ArrayList<>();
    records.add(ptr);
    records.add(srv);
    records.add(txt);
    records.add(servicesPtr);
    return records;
  }

  void cancel() {
    if (future != null) {
      future.cancel(false);
      future = null;
    }
  }

  /**
   * Sends the service records with a TTL of 0, once. The address records stay, they belong to the
   * host and may be shared with other registrations.
   */
  void goodbye() {
    cancel();
    if (!announced) {
      return;
    }

    Message goodbye = MulticastDNSUtils.newResponse(0);
    goodbye.addRecord(MulticastDNSUtils.withTTL(ptr, 0), Section.ANSWER);
    goodbye.addRecord(MulticastDNSUtils.withTTL(srv, 0), Section.ANSWER);
    goodbye.addRecord(MulticastDNSUtils.withTTL(txt, 0), Section.ANSWER);
    LOG.debug("Sending goodbye for \"{}\"", record.getFullName());
    engine.send(goodbye);
    announced = false;
  }

  @Override
  public String toString() {
    return "Registration[" + record + "]";
  }
}
