package net.lanplay.mDNS.utils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.lanplay.mDNS.Constants;
import org.apache.commons.lang3.StringUtils;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Header;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.NameTooLongException;
import org.xbill.DNS.Opcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

public class MulticastDNSUtils {

  private static final int MAX_LABEL_LENGTH = 63;

  private MulticastDNSUtils() {
  }

  public static List<Record> extractRecords(final Message message, final int... sections) {
    List<Record> records = new ArrayList<>();

    for (int section : sections) {
      records.addAll(message.getSection(section));
    }

    return records;
  }

  /**
   * Tests if the record answers the question: same name, matching type (or ANY) and matching class
   * once the cache-flush / unicast-response bit is masked off.
   */
  public static boolean answersQuestion(final Record question, final Record record) {
    int questionType = question.getType();
    int questionDClass = question.getDClass() & 0x7FFF;

    return ((questionType == Type.ANY) || (questionType == record.getType()))
        && question.getName().equals(record.getName())
        && ((questionDClass == DClass.ANY) || (questionDClass == (record.getDClass() & 0x7FFF)));
  }

  public static boolean isCacheFlush(final Record record) {
    return (record.getDClass() & Constants.CACHE_FLUSH) != 0;
  }

  /**
   * @return The record with the cache-flush bit cleared from its class
   */
  public static Record normalize(final Record record) {
    if (isCacheFlush(record)) {
      return copy(record, record.getDClass() & 0x7FFF, record.getTTL());
    }
    return record;
  }

  /**
   * @return A copy of the record carrying the given TTL
   */
  public static Record withTTL(final Record record, final long ttl) {
    return copy(record, record.getDClass(), ttl);
  }

  /**
   * Rebuilds the record from its uncompressed wire form, which keeps the case of any names in the
   * rdata.
   */
  private static Record copy(final Record record, final int dclass, final long ttl) {
    byte[] wire = record.toWire(Section.ANSWER);
    // owner name, then type, class, TTL and rdata length
    int offset = record.getName().toWire().length + 10;
    return Record.newRecord(record.getName(), record.getType(), dclass, ttl,
        Arrays.copyOfRange(wire, offset, wire.length));
  }

  public static Message newQuery() {
    Message query = new Message(0);
    query.getHeader().setOpcode(Opcode.QUERY);
    return query;
  }

  /**
   * Creates an authoritative mDNS response; responses always carry message id 0 when multicast.
   */
  public static Message newResponse(final int id) {
    Message response = new Message(id);
    Header header = response.getHeader();
    header.setOpcode(Opcode.QUERY);
    header.setFlag(Flags.QR);
    header.setFlag(Flags.AA);
    return response;
  }

  public static void addAll(final Message message, final List<Record> records, final int section) {
    for (Record record : records) {
      if (!message.findRecord(record, section)) {
        message.addRecord(record, section);
      }
    }
  }

  /**
   * Builds the DNS name of a service instance. The instance name is a single label that may hold
   * spaces, dots and UTF-8 text, so every byte that is not plainly printable is escaped.
   *
   * @throws TextParseException if the instance name is empty or longer than a DNS label
   */
  public static Name instanceName(final String instance, final Name serviceType)
      throws TextParseException {
    byte[] bytes = instance.getBytes(StandardCharsets.UTF_8);
    if (bytes.length == 0 || bytes.length > MAX_LABEL_LENGTH) {
      throw new TextParseException("Instance name \"" + instance + "\" must hold 1 to "
          + MAX_LABEL_LENGTH + " bytes, not " + bytes.length);
    }

    StringBuilder escaped = new StringBuilder();
    for (byte b : bytes) {
      int c = b & 0xFF;
      if (c > 0x20 && c < 0x7F && "\\.\"()@;$".indexOf(c) < 0) {
        escaped.append((char) c);
      } else {
        escaped.append('\\').append(StringUtils.leftPad(Integer.toString(c), 3, '0'));
      }
    }

    try {
      return Name.concatenate(Name.fromString(escaped.toString()), serviceType);
    } catch (NameTooLongException e) {
      throw new TextParseException("Instance name \"" + instance + "\" is too long");
    }
  }

  /**
   * @return The first label of the name as text, undoing the escaping of
   * {@link #instanceName(String, Name)}
   */
  public static String instanceLabel(final Name instance) {
    byte[] label = instance.getLabel(0);
    return new String(Arrays.copyOfRange(label, 1, label.length), StandardCharsets.UTF_8);
  }

  /**
   * Returns the bare name of this host, without any domain, suitable as the first label of a
   * {@code .local.} host name.
   */
  public static String getHostName() {
    String hostname = System.getenv().get("HOSTNAME");
    if (StringUtils.isBlank(hostname)) {
      hostname = System.getenv().get("COMPUTERNAME");
    }

    if (StringUtils.isBlank(hostname)) {
      try {
        InetAddress localhost = InetAddress.getLocalHost();
        hostname = localhost.getHostName();
      } catch (UnknownHostException e) {
        hostname = null;
      }
    }

    return toHostLabel(hostname);
  }

  /**
   * Reduces a host name to a single DNS label of letters, digits and hyphens.
   */
  public static String toHostLabel(final String hostname) {
    String label = StringUtils.substringBefore(StringUtils.trimToEmpty(hostname), ".");
    label = label.replaceAll("[^A-Za-z0-9-]", "-");
    label = StringUtils.strip(label, "-");
    label = StringUtils.left(label, MAX_LABEL_LENGTH);
    return StringUtils.isBlank(label) ? Constants.DEFAULT_HOST_NAME : label;
  }
}
