package net.lanplay.mDNS.utils;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.collections4.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IpUtil {
  private static final Logger LOG = LoggerFactory.getLogger(IpUtil.class);

  private static final Comparator<InetAddress> IPV4_FIRST =
      Comparator.comparingInt(address -> address instanceof Inet4Address ? 0 : 1);

  private IpUtil() {
  }

  /**
   * Orders the addresses so that IPv4 addresses come before IPv6 addresses. The relative order
   * within each family is kept and duplicates are dropped.
   */
  public static List<InetAddress> sortIPv4First(final Collection<InetAddress> addresses) {
    if (CollectionUtils.isEmpty(addresses)) {
      return Collections.emptyList();
    }

    List<InetAddress> sorted = new ArrayList<>(new LinkedHashSet<>(addresses));
    sorted.sort(IPV4_FIRST);
    return sorted;
  }

  /**
   * Lists the addresses of the up, non-virtual, non-loopback, multicast capable interfaces.
   * Interfaces sharing a hardware address are only listed once.
   */
  public static List<InetAddress> getMulticastInterfaceAddresses(final boolean ipv4,
      final boolean ipv6) {
    List<InetAddress> addresses = new ArrayList<>();
    Set<String> macs = new HashSet<>();

    try {
      Enumeration<NetworkInterface> netIfaces = NetworkInterface.getNetworkInterfaces();
      while (netIfaces != null && netIfaces.hasMoreElements()) {
        NetworkInterface netIface = netIfaces.nextElement();
        if (!netIface.isUp() || netIface.isVirtual() || netIface.isLoopback()
            || !netIface.supportsMulticast()) {
          continue;
        }

        byte[] hwAddr = netIface.getHardwareAddress();
        if (hwAddr != null && !macs.add(toMac(hwAddr))) {
          continue;
        }

        for (InetAddress address : Collections.list(netIface.getInetAddresses())) {
          boolean isIPv4 = address instanceof Inet4Address;
          if ((isIPv4 && ipv4) || (!isIPv4 && ipv6)) {
            addresses.add(address);
          }
        }
      }
    } catch (SocketException e) {
      LOG.warn("Error listing network interfaces", e);
    }

    return sortIPv4First(addresses);
  }

  private static String toMac(final byte[] hwAddr) {
    StringBuilder builder = new StringBuilder();
    for (byte octet : hwAddr) {
      if (builder.length() > 0) {
        builder.append(':');
      }
      builder.append(Integer.toHexString(octet & 0x0FF));
    }
    return builder.toString();
  }
}
