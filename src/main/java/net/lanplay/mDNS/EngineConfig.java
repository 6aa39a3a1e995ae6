package net.lanplay.mDNS;

import com.google.common.primitives.Ints;
import java.util.Optional;
import net.lanplay.mDNS.net.DatagramProcessorFactory;
import net.lanplay.mDNS.net.NetworkProcessorFactory;
import org.apache.commons.lang3.StringUtils;
import org.xbill.DNS.Options;

/**
 * Settings of a {@link MulticastDNSEngine}. Defaults come from the dnsjava {@link Options}
 * (system property {@code dnsjava.options}, e.g.
 * {@code -Ddnsjava.options=mdns_interface=192.168.1.20,mdns_ipv6=false}).
 *
 * <ul>
 * <li>{@code mdns_port} - UDP port, default 5353</li>
 * <li>{@code mdns_interface} - restrict the engine to the interface holding this address</li>
 * <li>{@code mdns_ipv6} - also use the IPv6 group, default true</li>
 * <li>{@code mdns_multicast_loopback} - receive our own multicast packets, default true</li>
 * <li>{@code mdns_socket_ttl} - IP TTL of outgoing packets, default 255</li>
 * <li>{@code mdns_queue_bound} - record batches a browse session may hold before overflowing</li>
 * <li>{@code mdns_teardown_timeout} - milliseconds to wait for workers at shutdown</li>
 * <li>{@code mdns_host_name} - host label to advertise instead of the machine name</li>
 * <li>{@code mdns_verbose} - log every packet at info level</li>
 * </ul>
 */
public class EngineConfig {

  public static final int DEFAULT_SOCKET_TTL = 255;

  public static final int DEFAULT_QUEUE_BOUND = 10000;

  public static final long DEFAULT_TEARDOWN_TIMEOUT_MILLIS = 2000;

  private final int port;

  private final String interfaceAddress;

  private final boolean ipv6;

  private final boolean multicastLoopback;

  private final int socketTtl;

  private final int queueBound;

  private final long teardownTimeoutMillis;

  private final String hostName;

  private final boolean verbose;

  private final NetworkProcessorFactory networkProcessorFactory;

  private EngineConfig(final Builder builder) {
    this.port = builder.port;
    this.interfaceAddress = builder.interfaceAddress;
    this.ipv6 = builder.ipv6;
    this.multicastLoopback = builder.multicastLoopback;
    this.socketTtl = builder.socketTtl;
    this.queueBound = builder.queueBound;
    this.teardownTimeoutMillis = builder.teardownTimeoutMillis;
    this.hostName = builder.hostName;
    this.verbose = builder.verbose;
    this.networkProcessorFactory = builder.networkProcessorFactory;
  }

  /**
   * @return A configuration built from the dnsjava options only
   */
  public static EngineConfig fromOptions() {
    return builder().build();
  }

  /**
   * @return A builder preloaded with the dnsjava options
   */
  public static Builder builder() {
    return new Builder();
  }

  public int getPort() {
    return port;
  }

  /**
   * @return The address of the only interface to use, or null to use every usable interface
   */
  public String getInterfaceAddress() {
    return interfaceAddress;
  }

  public boolean isIPv6() {
    return ipv6;
  }

  public boolean isMulticastLoopback() {
    return multicastLoopback;
  }

  public int getSocketTtl() {
    return socketTtl;
  }

  public int getQueueBound() {
    return queueBound;
  }

  public long getTeardownTimeoutMillis() {
    return teardownTimeoutMillis;
  }

  /**
   * @return The host label to advertise, or null to derive it from the machine name
   */
  public String getHostName() {
    return hostName;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public NetworkProcessorFactory getNetworkProcessorFactory() {
    return networkProcessorFactory;
  }

  @Override
  public String toString() {
    return "EngineConfig[port=" + port + ", interface=" + interfaceAddress + ", ipv6=" + ipv6
        + ", loopback=" + multicastLoopback + ", ttl=" + socketTtl + ", queueBound=" + queueBound
        + ", teardownTimeout=" + teardownTimeoutMillis + "ms, host=" + hostName + "]";
  }

  public static class Builder {
    private int port = intOption("mdns_port", Constants.DEFAULT_PORT);

    private String interfaceAddress = StringUtils.trimToNull(Options.value("mdns_interface"));

    private boolean ipv6 = booleanOption("mdns_ipv6", true);

    private boolean multicastLoopback = booleanOption("mdns_multicast_loopback", true);

    private int socketTtl = intOption("mdns_socket_ttl", DEFAULT_SOCKET_TTL);

    private int queueBound = intOption("mdns_queue_bound", DEFAULT_QUEUE_BOUND);

    private long teardownTimeoutMillis = intOption("mdns_teardown_timeout",
        (int) DEFAULT_TEARDOWN_TIMEOUT_MILLIS);

    private String hostName = StringUtils.trimToNull(Options.value("mdns_host_name"));

    private boolean verbose = Options.check("mdns_verbose") || Options.check("verbose");

    private NetworkProcessorFactory networkProcessorFactory = new DatagramProcessorFactory();

    Builder() {
    }

    public Builder port(final int port) {
      this.port = port;
      return this;
    }

    /**
     * Restricts the engine to one interface, given by one of its addresses. Null or blank uses
     * every usable interface.
     */
    public Builder interfaceAddress(final String interfaceAddress) {
      this.interfaceAddress = StringUtils.trimToNull(interfaceAddress);
      return this;
    }

    public Builder ipv6(final boolean ipv6) {
      this.ipv6 = ipv6;
      return this;
    }

    public Builder multicastLoopback(final boolean multicastLoopback) {
      this.multicastLoopback = multicastLoopback;
      return this;
    }

    public Builder socketTtl(final int socketTtl) {
      this.socketTtl = socketTtl;
      return this;
    }

    public Builder queueBound(final int queueBound) {
      this.queueBound = queueBound;
      return this;
    }

    public Builder teardownTimeoutMillis(final long teardownTimeoutMillis) {
      this.teardownTimeoutMillis = teardownTimeoutMillis;
      return this;
    }

    public Builder hostName(final String hostName) {
      this.hostName = StringUtils.trimToNull(hostName);
      return this;
    }

    public Builder verbose(final boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder networkProcessorFactory(final NetworkProcessorFactory factory) {
      this.networkProcessorFactory = factory;
      return this;
    }

    public EngineConfig build() {
      if (port <= 0 || port > 0xFFFF) {
        throw new IllegalArgumentException("Invalid mDNS port " + port);
      }
      if (queueBound <= 0) {
        throw new IllegalArgumentException("Queue bound must be positive, not " + queueBound);
      }
      if (networkProcessorFactory == null) {
        throw new IllegalArgumentException("A network processor factory is required");
      }
      return new EngineConfig(this);
    }

    private static int intOption(final String key, final int defaultValue) {
      return Optional.ofNullable(Options.value(key)).map(Ints::tryParse).orElse(defaultValue);
    }

    private static boolean booleanOption(final String key, final boolean defaultValue) {
      String value = Options.value(key);
      if (StringUtils.isBlank(value)) {
        return defaultValue;
      }
      return "true".equalsIgnoreCase(value) || "t".equalsIgnoreCase(value)
          || "yes".equalsIgnoreCase(value) || "y".equalsIgnoreCase(value);
    }
  }
}
