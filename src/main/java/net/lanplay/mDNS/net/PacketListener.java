package net.lanplay.mDNS.net;

public interface PacketListener {
  /**
   * Called from the read thread of a {@link NetworkProcessor} for every datagram received.
   */
  void packetReceived(NetworkProcessor processor, Packet packet);
}
