package net.lanplay.mDNS;

public interface AdvertiseListener {
  /**
   * An advertisement failed after {@link ServiceSessionManager#advertise} returned, typically
   * because a peer already uses the name. Reported once, from
   * {@link ServiceSessionManager#process()}.
   */
  void advertiseError(AdvertiseHandle handle, ServiceSessionException e);
}
