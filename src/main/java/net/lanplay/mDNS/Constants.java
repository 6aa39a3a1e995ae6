package net.lanplay.mDNS;

import org.xbill.DNS.Name;

public interface Constants {

  long DEFAULT_RR_WITHOUT_HOST_TTL = 4500; // 75 Minutes

  long DEFAULT_RR_WITH_HOST_TTL = 120; // 2 Minutes

  long DEFAULT_SRV_TTL = DEFAULT_RR_WITH_HOST_TTL;

  long DEFAULT_TXT_TTL = DEFAULT_RR_WITHOUT_HOST_TTL;

  long DEFAULT_A_TTL = DEFAULT_RR_WITH_HOST_TTL;

  long DEFAULT_PTR_TTL = DEFAULT_RR_WITHOUT_HOST_TTL;

  String LINK_LOCAL_DOMAIN = "local.";

  Name LINK_LOCAL_DOMAIN_NAME = Name.fromConstantString(LINK_LOCAL_DOMAIN);

  String SERVICES_NAME = "_services._dns-sd._udp";

  Name SERVICES_DOMAIN_NAME = Name.fromConstantString(SERVICES_NAME + "." + LINK_LOCAL_DOMAIN);

  int DEFAULT_PORT = 5353;

  String DEFAULT_IPv4_ADDRESS = "224.0.0.251";

  String DEFAULT_IPv6_ADDRESS = "FF02::FB";

  int CACHE_FLUSH = 0x8000;

  int UNICAST_RESPONSE = 0x8000;

  String DEFAULT_HOST_NAME = "unknown-host";

  /** Delay between the three probe queries sent before a name is claimed, RFC 6762 Section 8.1. */
  long PROBE_INTERVAL_MILLIS = 250;

  int PROBE_COUNT = 3;

  /** Delay between the two initial announcements, RFC 6762 Section 8.3. */
  long ANNOUNCE_INTERVAL_MILLIS = 1000;

  int ANNOUNCE_COUNT = 2;

  /** Registered services are re-announced at 80% of the host bound record TTL. */
  long REANNOUNCE_INTERVAL_MILLIS = DEFAULT_RR_WITH_HOST_TTL * 800;

  /** Browse queries back off from one second up to one hour, RFC 6762 Section 5.2. */
  int MAX_QUERY_INTERVAL_SECONDS = 3600;

  double[] REFRESH_THRESHOLDS = {0.80, 0.85, 0.90, 0.95};

  long CACHE_SWEEP_INTERVAL_MILLIS = 1000;

  long RESOLVE_QUERY_INTERVAL_MILLIS = 1000;
}
