package net.lanplay.mDNS.model;

import java.util.Locale;
import net.lanplay.mDNS.Constants;
import net.lanplay.mDNS.ServiceSessionException;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import org.apache.commons.lang3.StringUtils;
import org.xbill.DNS.Name;
import org.xbill.DNS.TextParseException;

/**
 * A normalized DNS-SD service type such as {@code _mygame._tcp.local.}. Two service types that
 * differ only in case are the same service type.
 */
public class ServiceType {
  private static final int MAX_SERVICE_NAME_LENGTH = 15;

  private final String text;

  private final Name name;

  private ServiceType(final String text, final Name name) {
    this.text = text;
    this.name = name;
  }

  /**
   * Parses a service type of the form {@code _service._tcp.local.} or {@code _service._udp.local.}.
   * The trailing dot of the link-local domain is required.
   *
   * @throws ServiceSessionException with {@link REASON#INVALID_SERVICE_TYPE} if the text is
   * malformed
   */
  public static ServiceType parse(final String serviceType) throws ServiceSessionException {
    if (StringUtils.isBlank(serviceType)) {
      throw invalid(serviceType, "service type is empty");
    }

    if (!StringUtils.endsWithIgnoreCase(serviceType, "." + Constants.LINK_LOCAL_DOMAIN)) {
      throw invalid(serviceType, "service type must end with \"." + Constants.LINK_LOCAL_DOMAIN
          + "\"");
    }

    String[] labels = serviceType.split("\\.");
    if (labels.length != 3) {
      throw invalid(serviceType, "expected <_service>.<_tcp|_udp>." + Constants.LINK_LOCAL_DOMAIN);
    }

    String service = labels[0];
    if (service.length() < 2 || service.charAt(0) != '_'
        || service.length() - 1 > MAX_SERVICE_NAME_LENGTH) {
      throw invalid(serviceType, "service label \"" + service
          + "\" must start with '_' and hold 1 to " + MAX_SERVICE_NAME_LENGTH + " characters");
    }

    for (int index = 1; index < service.length(); index++) {
      char c = service.charAt(index);
      if (!(Character.isLetterOrDigit(c) && c < 0x80) && c != '-') {
        throw invalid(serviceType, "service label \"" + service + "\" contains '" + c + "'");
      }
    }

    String protocol = labels[1];
    if (!"_tcp".equalsIgnoreCase(protocol) && !"_udp".equalsIgnoreCase(protocol)) {
      throw invalid(serviceType, "protocol label must be _tcp or _udp, not \"" + protocol + "\"");
    }

    try {
      return new ServiceType(serviceType, Name.fromString(serviceType));
    } catch (TextParseException e) {
      throw new ServiceSessionException(REASON.INVALID_SERVICE_TYPE,
          "\"" + serviceType + "\" is not a valid DNS name", e);
    }
  }

  private static ServiceSessionException invalid(final String serviceType, final String detail) {
    return new ServiceSessionException(REASON.INVALID_SERVICE_TYPE,
        "Invalid service type \"" + serviceType + "\": " + detail);
  }

  /**
   * @return The absolute DNS name browsed with PTR queries
   */
  public Name getName() {
    return name;
  }

  /**
   * Tests if the name is a service instance of this type, that is exactly one label below it.
   */
  public boolean isInstance(final Name instance) {
    return instance != null && instance.labels() == name.labels() + 1 && instance.subdomain(name);
  }

  @Override
  public int hashCode() {
    return text.toLowerCase(Locale.ROOT).hashCode();
  }

  @Override
  public boolean equals(final Object obj) {
    if (obj == this) {
      return true;
    } else if (obj instanceof ServiceType) {
      return text.equalsIgnoreCase(((ServiceType) obj).text);
    }

    return false;
  }

  @Override
  public String toString() {
    return text;
  }
}
