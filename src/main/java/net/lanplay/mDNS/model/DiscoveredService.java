package net.lanplay.mDNS.model;

import java.net.InetAddress;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.lanplay.mDNS.utils.IpUtil;

/**
 * One network endpoint of a browsed service type, as seen by a browse session.
 *
 * Only {@link State#RESOLVED} services carry addresses. A {@link State#REMOVED} service is the
 * tombstone delivered with the single removal event of an endpoint.
 */
public class DiscoveredService {

  public enum State {
    PARTIAL, RESOLVED, REMOVED
  }

  private final String instanceName;

  private final ServiceType serviceType;

  private final String hostname;

  private final Set<InetAddress> addresses;

  private final int port;

  private final Map<String, String> txt;

  private final State state;

  public DiscoveredService(final String instanceName, final ServiceType serviceType,
      final String hostname, final Collection<InetAddress> addresses, final int port,
      final Map<String, String> txt, final State state) {
    this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
    this.serviceType = Objects.requireNonNull(serviceType, "serviceType");
    this.hostname = hostname;
    this.addresses = Collections.unmodifiableSet(new LinkedHashSet<>(IpUtil.sortIPv4First(addresses)));
    this.port = port;
    this.txt = Collections.unmodifiableMap(new LinkedHashMap<>(txt));
    this.state = state;
  }

  /**
   * @return A copy of this service in the given state, addresses dropped unless resolved
   */
  public DiscoveredService withState(final State state) {
    return new DiscoveredService(instanceName, serviceType, hostname,
        state == State.PARTIAL ? Collections.emptySet() : addresses, port, txt, state);
  }

  public String getInstanceName() {
    return instanceName;
  }

  public ServiceType getServiceType() {
    return serviceType;
  }

  /**
   * @return The instance name followed by the service type, e.g.
   * {@code Game Server A._mygame._tcp.local.}
   */
  public String getFullName() {
    return instanceName + "." + serviceType;
  }

  public String getHostname() {
    return hostname;
  }

  /**
   * @return The addresses of the host, IPv4 addresses first
   */
  public Set<InetAddress> getAddresses() {
    return addresses;
  }

  public int getPort() {
    return port;
  }

  public Map<String, String> getTxt() {
    return txt;
  }

  public State getState() {
    return state;
  }

  /**
   * Tests if both describe the same reachable endpoint: host, addresses, port and TXT metadata.
   */
  public boolean sameEndpoint(final DiscoveredService other) {
    return other != null && port == other.port && Objects.equals(hostname, other.hostname)
        && addresses.equals(other.addresses) && txt.equals(other.txt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instanceName.toLowerCase(Locale.ROOT), serviceType, hostname, addresses,
        port, txt, state);
  }

  @Override
  public boolean equals(final Object obj) {
    if (obj == this) {
      return true;
    } else if (obj instanceof DiscoveredService) {
      DiscoveredService that = (DiscoveredService) obj;
      return instanceName.equalsIgnoreCase(that.instanceName)
          && serviceType.equals(that.serviceType) && state == that.state && sameEndpoint(that);
    }

    return false;
  }

  @Override
  public String toString() {
    return getFullName() + " [" + state + "] " + hostname + ":" + port + " " + addresses + " " + txt;
  }
}
