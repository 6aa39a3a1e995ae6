package net.lanplay.mDNS.resolvers;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.lanplay.mDNS.Constants;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

class MulticastDNSResponderTest {

  private static final Name TYPE = Name.fromConstantString("_mygame._tcp.local.");

  private static final Name INSTANCE = Name.fromConstantString("lobby._mygame._tcp.local.");

  private static final Name HOST = Name.fromConstantString("host-a.local.");

  private Record ptr;

  private Record srv;

  private Record a;

  private MulticastDNSResponder<List<Record>> responder;

  @BeforeEach
  void setUp() throws Exception {
    ptr = new PTRRecord(TYPE, DClass.IN, 4500, INSTANCE);
    srv = new SRVRecord(INSTANCE, DClass.IN | Constants.CACHE_FLUSH, 120, 0, 0, 7350, HOST);
    a = new ARecord(HOST, DClass.IN | Constants.CACHE_FLUSH, 120,
        InetAddress.getByName("10.0.0.1"));

    responder = new MulticastDNSResponder<>(false,
        new MulticastDNSResponder.RecordSource<List<Record>>() {
          public List<Record> answer(final List<Record> owner, final Record question) {
            List<Record> answers = new ArrayList<>();
            for (Record record : owner) {
              if (MulticastDNSUtils.answersQuestion(question, record)) {
                answers.add(record);
              }
            }
            return answers;
          }

          public List<Record> additionals(final List<Record> owner, final Record answer) {
            if (answer.getType() == Type.PTR) {
              List<Record> additionals = new ArrayList<>();
              additionals.add(srv);
              additionals.add(a);
              return additionals;
            }
            return Collections.emptyList();
          }
        });
  }

  @Test
  void answersWithTheRecordsAndTheirAdditionals() {
    Message response = responder.receiveMessage(query(TYPE, Type.PTR), owners(), false);

    assertThat(response.getHeader().getID()).isZero();
    assertThat(response.getHeader().getFlag(Flags.QR)).isTrue();
    assertThat(response.getHeader().getFlag(Flags.AA)).isTrue();
    assertThat(response.getSection(Section.QUESTION)).isEmpty();
    assertThat(response.getSection(Section.ANSWER)).containsExactly(ptr);
    assertThat(response.getSection(Section.ADDITIONAL)).containsExactly(srv, a);
  }

  @Test
  void additionalsAlreadyAnsweredAreNotRepeated() {
    Message query = query(TYPE, Type.PTR);
    query.addRecord(Record.newRecord(INSTANCE, Type.SRV, DClass.IN), Section.QUESTION);

    Message response = responder.receiveMessage(query, owners(), false);

    assertThat(response.getSection(Section.ANSWER)).containsExactly(ptr, srv);
    assertThat(response.getSection(Section.ADDITIONAL)).containsExactly(a);
  }

  @Test
  void knownAnswerWithHalfItsLifetimeLeftIsSuppressed() {
    Message query = query(TYPE, Type.PTR);
    query.addRecord(MulticastDNSUtils.withTTL(ptr, 2250), Section.ANSWER);

    assertThat(responder.receiveMessage(query, owners(), false)).isNull();
  }

  @Test
  void staleKnownAnswerIsAnsweredAgain() {
    Message query = query(TYPE, Type.PTR);
    query.addRecord(MulticastDNSUtils.withTTL(ptr, 2000), Section.ANSWER);

    Message response = responder.receiveMessage(query, owners(), false);

    assertThat(response.getSection(Section.ANSWER)).containsExactly(ptr);
  }

  @Test
  void legacyQueryIsEchoedWithCappedTTLs() {
    Message query = query(TYPE, Type.PTR);
    query.getHeader().setID(0x2a2a);

    Message response = responder.receiveMessage(query, owners(), true);

    assertThat(response.getHeader().getID()).isEqualTo(0x2a2a);
    assertThat(response.getSection(Section.QUESTION))
        .containsExactlyElementsOf(query.getSection(Section.QUESTION));
    assertThat(response.getSection(Section.ANSWER)).singleElement()
        .satisfies(record -> assertThat(record.getTTL())
            .isEqualTo(MulticastDNSResponder.LEGACY_UNICAST_TTL));
    assertThat(response.getSection(Section.ADDITIONAL)).allSatisfy(record -> {
      assertThat(record.getDClass()).isEqualTo(DClass.IN);
      assertThat(record.getTTL()).isEqualTo(MulticastDNSResponder.LEGACY_UNICAST_TTL);
    });
  }

  @Test
  void unknownNamesAndResponsesGetNoReply() {
    assertThat(responder.receiveMessage(
        query(Name.fromConstantString("_other._tcp.local."), Type.PTR), owners(), false)).isNull();

    Message response = query(TYPE, Type.PTR);
    response.getHeader().setFlag(Flags.QR);
    assertThat(responder.receiveMessage(response, owners(), false)).isNull();
  }

  private List<List<Record>> owners() {
    List<Record> records = new ArrayList<>();
    records.add(ptr);
    records.add(srv);
    records.add(a);
    return Collections.singletonList(records);
  }

  private static Message query(final Name name, final int type) {
    Message query = MulticastDNSUtils.newQuery();
    query.addRecord(Record.newRecord(name, type, DClass.IN), Section.QUESTION);
    return query;
  }
}
