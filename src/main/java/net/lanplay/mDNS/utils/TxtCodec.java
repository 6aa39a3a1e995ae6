package net.lanplay.mDNS.utils;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.lanplay.mDNS.ServiceSessionException;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts between a key/value mapping and the DNS-SD TXT record layout, a sequence of
 * length-prefixed strings of the form {@code key=value} (RFC 6763 Section 6).
 */
public class TxtCodec {

  /**
   * Maximum number of bytes an entry can consist of, the length prefix excluded.
   */
  public static final int MAX_ENTRY_LENGTH = 255;

  /**
   * A TXT record without entries still holds a single empty string.
   */
  public static final byte[] EMPTY_TXT = new byte[]{0};

  /**
   * The outcome of decoding a TXT record. Entries that could not be used were skipped and counted.
   */
  public static class Decoded {
    private final Map<String, String> properties;

    private final int malformedEntries;

    Decoded(final Map<String, String> properties, final int malformedEntries) {
      this.properties = Collections.unmodifiableMap(properties);
      this.malformedEntries = malformedEntries;
    }

    public Map<String, String> getProperties() {
      return properties;
    }

    public int getMalformedEntries() {
      return malformedEntries;
    }
  }

  private TxtCodec() {
  }

  /**
   * Encodes the mapping in iteration order. A null value is written as an empty value.
   *
   * @throws ServiceSessionException {@link REASON#INVALID_TXT_KEY} if a key is empty, contains
   * '=' or characters outside printable US-ASCII; {@link REASON#ENTRY_TOO_LONG} if an entry exceeds
   * {@value #MAX_ENTRY_LENGTH} bytes
   */
  public static byte[] encode(final Map<String, String> properties) throws ServiceSessionException {
    if (MapUtils.isEmpty(properties)) {
      return EMPTY_TXT.clone();
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (Map.Entry<String, String> property : properties.entrySet()) {
      String key = property.getKey();
      if (StringUtils.isEmpty(key) || key.indexOf('=') >= 0 || !isPrintableAscii(key)) {
        throw new ServiceSessionException(REASON.INVALID_TXT_KEY,
            "TXT key \"" + key + "\" must be non-empty printable ASCII without '='");
      }

      byte[] entry = (key + "=" + StringUtils.defaultString(property.getValue()))
          .getBytes(StandardCharsets.UTF_8);
      if (entry.length > MAX_ENTRY_LENGTH) {
        throw new ServiceSessionException(REASON.ENTRY_TOO_LONG,
            "TXT entry for key \"" + key + "\" is " + entry.length + " bytes, the limit is "
                + MAX_ENTRY_LENGTH);
      }

      out.write(entry.length);
      out.write(entry, 0, entry.length);
    }

    return out.toByteArray();
  }

  /**
   * Decodes the wire layout: a sequence of length-prefixed strings. An entry whose length prefix
   * runs past the end of the data ends decoding and is counted as malformed.
   */
  public static Decoded decode(final byte[] data) {
    List<byte[]> entries = new ArrayList<>();
    int malformed = 0;

    int index = 0;
    while (data != null && index < data.length) {
      int length = data[index++] & 0xFF;
      if (index + length > data.length) {
        malformed++;
        break;
      }

      byte[] entry = new byte[length];
      System.arraycopy(data, index, entry, 0, length);
      entries.add(entry);
      index += length;
    }

    Decoded decoded = decode(entries);
    return malformed == 0 ? decoded
        : new Decoded(decoded.getProperties(), decoded.getMalformedEntries() + malformed);
  }

  /**
   * Decodes already split entries, as held by a parsed TXT record. Each entry is split on the first
   * '='; an entry without '=' is a present boolean key with an empty value; a later entry for a key
   * replaces an earlier one; empty entries are skipped; entries with an empty or non-ASCII key are
   * skipped and counted. A value that is not valid UTF-8 decodes as an empty value.
   */
  public static Decoded decode(final List<byte[]> entries) {
    Map<String, String> properties = new LinkedHashMap<>();
    int malformed = 0;

    for (byte[] entry : entries) {
      if (entry == null || entry.length == 0) {
        continue;
      }

      int separator = indexOf(entry, (byte) '=');
      int keyLength = separator < 0 ? entry.length : separator;
      if (keyLength == 0) {
        malformed++;
        continue;
      }

      String key = new String(entry, 0, keyLength, StandardCharsets.US_ASCII);
      if (!isPrintableAscii(entry, keyLength)) {
        malformed++;
        continue;
      }

      String value = "";
      if (separator >= 0) {
        value = decodeUtf8(entry, separator + 1, entry.length - separator - 1);
      }

      // last occurrence wins, and moves the key to the position it was last seen at
      properties.remove(key);
      properties.put(key, value);
    }

    return new Decoded(properties, malformed);
  }

  private static int indexOf(final byte[] data, final byte b) {
    for (int index = 0; index < data.length; index++) {
      if (data[index] == b) {
        return index;
      }
    }
    return -1;
  }

  private static boolean isPrintableAscii(final String text) {
    for (int index = 0; index < text.length(); index++) {
      char c = text.charAt(index);
      if (c < 0x20 || c > 0x7E) {
        return false;
      }
    }
    return true;
  }

  private static boolean isPrintableAscii(final byte[] data, final int length) {
    for (int index = 0; index < length; index++) {
      if (data[index] < 0x20 || data[index] > 0x7E) {
        return false;
      }
    }
    return true;
  }

  private static String decodeUtf8(final byte[] data, final int offset, final int length) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(data, offset, length))
          .toString();
    } catch (CharacterCodingException e) {
      return "";
    }
  }
}
