package net.lanplay.mDNS.resolvers;

import java.util.Collections;
import java.util.List;
import net.lanplay.mDNS.MulticastDNSCache;
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
 * Caches the records of responses received from the network.
 */
public class Cacher {
  private static final Logger LOG = LoggerFactory.getLogger(Cacher.class);

  private final boolean mdnsVerbose;

  private final MulticastDNSCache cache;

  public Cacher(final boolean mdnsVerbose, final MulticastDNSCache cache) {
    this.mdnsVerbose = mdnsVerbose;
    this.cache = cache;
  }

  /**
   * @return The records that changed the cache, see {@link MulticastDNSCache#update(List, long)}
   */
  public List<Record> receiveMessage(final Message message, final long now) {
    Header header = message.getHeader();
    int rcode = message.getRcode();
    int opcode = header.getOpcode();

    if (mdnsVerbose) {
      LOG.info("Receive - RCode: {}; Opcode: {}", Rcode.string(rcode), Opcode.string(opcode));
    }

    if (!header.getFlag(Flags.QR)) {
      return Collections.emptyList();
    }

    if (opcode != Opcode.QUERY) {
      LOG.debug("Ignoring response with opcode {}", Opcode.string(opcode));
      return Collections.emptyList();
    }

    if (rcode != Rcode.NOERROR) {
      // mDNS responders always send NOERROR [RFC 6762 18.11]
      LOG.debug("Ignoring response with rcode {}", Rcode.string(rcode));
      return Collections.emptyList();
    }

    List<Record> changes = cache.update(MulticastDNSUtils.extractRecords(message, Section.ANSWER,
        Section.AUTHORITY, Section.ADDITIONAL), now);
    if (mdnsVerbose && !changes.isEmpty()) {
      LOG.info("Receive - Cache changed by {}", changes);
    }
    return changes;
  }
}
