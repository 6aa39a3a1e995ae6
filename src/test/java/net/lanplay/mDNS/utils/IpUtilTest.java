package net.lanplay.mDNS.utils;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class IpUtilTest {

  @Test
  void ordersIPv4BeforeIPv6KeepingOrderWithinAFamily() throws Exception {
    InetAddress v6a = InetAddress.getByName("fe80::1");
    InetAddress v4a = InetAddress.getByName("192.168.1.20");
    InetAddress v6b = InetAddress.getByName("2001:db8::7");
    InetAddress v4b = InetAddress.getByName("10.0.0.5");

    List<InetAddress> sorted = IpUtil.sortIPv4First(Arrays.asList(v6a, v4a, v6b, v4b, v4a));

    assertThat(sorted).containsExactly(v4a, v4b, v6a, v6b);
  }

  @Test
  void emptyInputGivesEmptyList() {
    assertThat(IpUtil.sortIPv4First(null)).isEmpty();
  }

  @Test
  void interfaceAddressesRespectTheFamilyFilter() {
    assertThat(IpUtil.getMulticastInterfaceAddresses(true, false))
        .allMatch(address -> address instanceof Inet4Address);
    assertThat(IpUtil.getMulticastInterfaceAddresses(false, false)).isEmpty();
  }
}
