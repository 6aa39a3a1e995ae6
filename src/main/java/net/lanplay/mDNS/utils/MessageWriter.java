package net.lanplay.mDNS.utils;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import net.lanplay.mDNS.EngineStatistics;
import net.lanplay.mDNS.net.NetworkProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Header;
import org.xbill.DNS.Message;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;

/**
 * Writes DNS messages to the network endpoints of an engine.
 */
public class MessageWriter {
  private static final Logger LOG = LoggerFactory.getLogger(MessageWriter.class);

  private MessageWriter() {

  }

  /**
   * Multicasts the message on every endpoint. A query too large for an endpoint is split into
   * several queries, the known answers spread over them; a response too large is an error.
   *
   * @return The number of endpoints the message was written to
   * @throws IOException if a response does not fit a datagram
   */
  public static int writeMessageToWire(final Message message,
      final List<? extends NetworkProcessor> processors, final EngineStatistics statistics)
      throws IOException {
    Header header = message.getHeader();
    header.setID(0);
    boolean response = header.getFlag(Flags.QR);

    byte[] out = message.toWire(Message.MAXLENGTH);
    int written = 0;
    for (NetworkProcessor processor : processors) {
      int maxUDPSize = processor.getMaxPayloadSize();
      if (out.length > maxUDPSize) {
        if (response) {
          throw new IOException("DNS Message too large! - " + out.length + " bytes in size.");
        }

        int parts = 0;
        for (Message part : splitQuery(message, maxUDPSize)) {
          if (write(part.toWire(maxUDPSize), processor, null, statistics)) {
            parts++;
          }
        }
        if (parts > 0) {
          written++;
          statistics.querySent();
        }
        continue;
      }

      if (write(out, processor, null, statistics)) {
        written++;
        if (response) {
          statistics.responseSent();
        } else {
          statistics.querySent();
        }
      }
    }

    return written;
  }

  /**
   * Sends a reply to a single peer on the endpoint the query arrived on, keeping the message id.
   */
  public static boolean writeMessageTo(final Message message, final NetworkProcessor processor,
      final SocketAddress target, final EngineStatistics statistics) throws IOException {
    byte[] out = message.toWire(processor.getMaxPayloadSize());
    boolean sent = write(out, processor, target, statistics);
    if (sent) {
      statistics.responseSent();
    }
    return sent;
  }

  private static boolean write(final byte[] data, final NetworkProcessor processor,
      final SocketAddress target, final EngineStatistics statistics) {
    try {
      if (target == null) {
        processor.send(data);
      } else {
        processor.send(data, target);
      }
      statistics.packetSent();
      return true;
    } catch (IOException e) {
      LOG.warn("Error writing {} bytes to {}", data.length, processor, e);
      return false;
    }
  }

  /**
   * Splits a query per RFC 6762 Section 7.2: the questions go into the first message and the known
   * answers are spread over as many messages as needed, all but the last carrying the TC bit.
   */
  static List<Message> splitQuery(final Message message, final int maxSize) {
    List<Message> messages = new ArrayList<>();

    Message current = MulticastDNSUtils.newQuery();
    for (Record question : message.getSection(Section.QUESTION)) {
      current.addRecord(question, Section.QUESTION);
    }

    for (Record answer : message.getSection(Section.ANSWER)) {
      current.addRecord(answer, Section.ANSWER);
      if (current.toWire().length > maxSize && current.getSection(Section.ANSWER).size() > 1) {
        current.removeRecord(answer, Section.ANSWER);
        current.getHeader().setFlag(Flags.TC);
        messages.add(current);

        current = MulticastDNSUtils.newQuery();
        current.addRecord(answer, Section.ANSWER);
      }
    }
    messages.add(current);

    return messages;
  }
}
