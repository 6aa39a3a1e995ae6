package net.lanplay.mDNS.net;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.lanplay.mDNS.Constants;
import net.lanplay.mDNS.EngineConfig;
import net.lanplay.mDNS.ServiceSessionException;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import net.lanplay.mDNS.utils.Executors;
import net.lanplay.mDNS.utils.IpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a {@link DatagramProcessor} per usable interface address: IPv4 addresses join
 * {@value Constants#DEFAULT_IPv4_ADDRESS}, IPv6 addresses join {@value Constants#DEFAULT_IPv6_ADDRESS}.
 * Interfaces that fail are skipped as long as one succeeds.
 */
public class DatagramProcessorFactory implements NetworkProcessorFactory {
  private static final Logger LOG = LoggerFactory.getLogger(DatagramProcessorFactory.class);

  public List<NetworkProcessor> open(final EngineConfig config, final PacketListener listener,
      final Executors executors) throws ServiceSessionException {
    InetAddress ipv4Group;
    InetAddress ipv6Group;
    try {
      ipv4Group = InetAddress.getByName(Constants.DEFAULT_IPv4_ADDRESS);
      ipv6Group = InetAddress.getByName(Constants.DEFAULT_IPv6_ADDRESS);
    } catch (UnknownHostException e) {
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "Cannot resolve the mDNS group addresses", e);
    }

    List<InetAddress> ifaceAddresses = interfaceAddresses(config);
    if (ifaceAddresses.isEmpty()) {
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "No up, multicast capable network interface found");
    }

    List<NetworkProcessor> processors = new ArrayList<>();
    ServiceSessionException firstFailure = null;
    ServiceSessionException blocked = null;
    for (InetAddress ifaceAddress : ifaceAddresses) {
      InetAddress group = ifaceAddress instanceof Inet4Address ? ipv4Group : ipv6Group;
      try {
        processors.add(new DatagramProcessor(ifaceAddress, group, config.getPort(),
            config.isMulticastLoopback(), config.getSocketTtl(), listener, executors));
        LOG.debug("Opened mDNS endpoint on {} for group {}", ifaceAddress, group);
      } catch (ServiceSessionException e) {
        LOG.warn("Could not open mDNS endpoint on {}: {}", ifaceAddress, e.getMessage());
        if (firstFailure == null) {
          firstFailure = e;
        }
        if (blocked == null && e.getReason() == REASON.MULTICAST_BLOCKED) {
          blocked = e;
        }
      } catch (IOException e) {
        LOG.warn("Could not open mDNS endpoint on {}", ifaceAddress, e);
        if (firstFailure == null) {
          firstFailure = new ServiceSessionException(REASON.ENGINE_UNAVAILABLE, e.getMessage(), e);
        }
      }
    }

    if (processors.isEmpty()) {
      // a blocked join is reported in preference to other failures
      throw blocked != null ? blocked : firstFailure;
    }
    return processors;
  }

  private static List<InetAddress> interfaceAddresses(final EngineConfig config)
      throws ServiceSessionException {
    if (config.getInterfaceAddress() == null) {
      return IpUtil.getMulticastInterfaceAddresses(true, config.isIPv6());
    }

    try {
      InetAddress address = InetAddress.getByName(config.getInterfaceAddress());
      if (!(address instanceof Inet4Address) && !config.isIPv6()) {
        throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
            "Interface address " + config.getInterfaceAddress() + " is IPv6 but IPv6 is disabled");
      }
      return Collections.singletonList(address);
    } catch (UnknownHostException e) {
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "Invalid interface address \"" + config.getInterfaceAddress() + "\"", e);
    }
  }
}
