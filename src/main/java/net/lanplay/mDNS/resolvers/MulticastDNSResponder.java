package net.lanplay.mDNS.resolvers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import net.lanplay.mDNS.utils.MulticastDNSUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Header;
import org.xbill.DNS.Message;
import org.xbill.DNS.Opcode;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;

/**
 * Builds the replies to queries from the network for the records this host owns.
 *
 * @param <T> The owner of a set of records, asked for the answers to each question
 */
public class MulticastDNSResponder<T> {
  private static final Logger LOG = LoggerFactory.getLogger(MulticastDNSResponder.class);

  /**
   * TTL cap of records sent to legacy resolvers [RFC 6762 6.7].
   */
  public static final long LEGACY_UNICAST_TTL = 10;

  /**
   * The records an owner contributes to a reply.
   */
  public interface RecordSource<T> {
    List<Record> answer(T owner, Record question);

    List<Record> additionals(T owner, Record answer);
  }

  private final boolean mdnsVerbose;

  private final RecordSource<T> source;

  public MulticastDNSResponder(final boolean mdnsVerbose, final RecordSource<T> source) {
    this.mdnsVerbose = mdnsVerbose;
    this.source = source;
  }

  /**
   * Answers a query from the owners. Answers the querier listed as known with at least half their
   * TTL left are suppressed [RFC 6762 7.1].
   *
   * @param legacyUnicast true for a query from a port other than the mDNS port, answered by
   * unicast with the query id and question echoed back
   * @return The reply, or null if there is nothing to say
   */
  public Message receiveMessage(final Message query, final Collection<T> owners,
      final boolean legacyUnicast) {
    Header header = query.getHeader();
    int opcode = header.getOpcode();

    if (header.getFlag(Flags.QR)) {
      return null;
    }

    if (opcode != Opcode.QUERY) {
      LOG.warn("Receive - Received Invalid Request - Opcode: {}", Opcode.string(opcode));
      return null;
    }

    if (mdnsVerbose) {
      LOG.info("Receive - Query RCode: {}; Opcode: {}", Rcode.string(query.getRcode()),
          Opcode.string(opcode));
    }

    List<Record> knownAnswers = query.getSection(Section.ANSWER);
    List<Record> answers = new ArrayList<>();
    List<Record> additionals = new ArrayList<>();
    for (Record question : query.getSection(Section.QUESTION)) {
      for (T owner : owners) {
        for (Record answer : source.answer(owner, question)) {
          if (isKnown(answer, knownAnswers)) {
            continue;
          }
          answers.add(answer);
          additionals.addAll(source.additionals(owner, answer));
        }
      }
    }

    if (answers.isEmpty()) {
      if (mdnsVerbose) {
        LOG.info("Receive - No response, client knows answer or the names are not ours.");
      }
      return null;
    }

    Message response;
    Function<Record, Record> adjust;
    if (legacyUnicast) {
      response = MulticastDNSUtils.newResponse(header.getID());
      for (Record question : query.getSection(Section.QUESTION)) {
        response.addRecord(question, Section.QUESTION);
      }
      adjust = record -> MulticastDNSUtils.withTTL(MulticastDNSUtils.normalize(record),
          Math.min(record.getTTL(), LEGACY_UNICAST_TTL));
    } else {
      response = MulticastDNSUtils.newResponse(0);
      adjust = Function.identity();
    }

    MulticastDNSUtils.addAll(response, map(answers, adjust), Section.ANSWER);
    for (Record additional : map(additionals, adjust)) {
      if (!response.findRecord(additional, Section.ANSWER)
          && !response.findRecord(additional, Section.ADDITIONAL)) {
        response.addRecord(additional, Section.ADDITIONAL);
      }
    }

    if (mdnsVerbose) {
      LOG.info("Receive - Query Reply\n{}", response);
    }
    return response;
  }

  private static boolean isKnown(final Record answer, final List<Record> knownAnswers) {
    Record ours = MulticastDNSUtils.normalize(answer);
    for (Record known : knownAnswers) {
      if (MulticastDNSUtils.normalize(known).equals(ours) && known.getTTL() * 2 >= ours.getTTL()) {
        return true;
      }
    }
    return false;
  }

  private static List<Record> map(final List<Record> records,
      final Function<Record, Record> adjust) {
    List<Record> mapped = new ArrayList<>(records.size());
    for (Record record : records) {
      mapped.add(adjust.apply(record));
    }
    return mapped;
  }
}
