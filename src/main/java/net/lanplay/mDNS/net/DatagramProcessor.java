package net.lanplay.mDNS.net;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.net.StandardSocketOptions;
import net.lanplay.mDNS.ServiceSessionException;
import net.lanplay.mDNS.ServiceSessionException.REASON;
import net.lanplay.mDNS.utils.Executors;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link NetworkProcessor} over a UDP multicast socket bound to the mDNS port.
 */
public class DatagramProcessor extends NetworkProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(DatagramProcessor.class);

  private final NetworkInterface netIface;

  private final MulticastSocket socket;

  private final boolean loopback;

  private final int ttl;

  /**
   * Binds the socket and joins the group on the interface holding {@code ifaceAddress}.
   *
   * @throws ServiceSessionException {@link REASON#ENGINE_UNAVAILABLE} if the socket cannot be
   * opened or bound, {@link REASON#MULTICAST_BLOCKED} if the group cannot be joined
   */
  public DatagramProcessor(final InetAddress ifaceAddress, final InetAddress address,
      final int port, final boolean loopback, final int ttl, final PacketListener listener,
      final Executors executors) throws IOException {
    super(ifaceAddress, address, port, listener, executors);
    this.loopback = loopback;
    this.ttl = ttl;

    netIface = NetworkInterface.getByInetAddress(ifaceAddress);
    if (netIface == null) {
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "No network interface holds the address " + ifaceAddress.getHostAddress());
    }

    MulticastSocket socket;
    try {
      // MulticastSocket enables SO_REUSEADDR before binding, so other responders can share the port
      socket = new MulticastSocket(port);
    } catch (IOException | SecurityException e) {
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "Could not bind UDP port " + port + " for " + netIface.getName() + ": " + e.getMessage(),
          e);
    }

    try {
      socket.setOption(StandardSocketOptions.IP_MULTICAST_LOOP, loopback);
      // mDNS packets go out with an IP TTL of 255 [RFC 6762 11]
      socket.setTimeToLive(ttl);
      socket.setNetworkInterface(netIface);
    } catch (IOException e) {
      IOUtils.closeQuietly(socket);
      throw new ServiceSessionException(REASON.ENGINE_UNAVAILABLE,
          "Could not configure the multicast socket on " + netIface.getName() + ": "
              + e.getMessage(), e);
    }

    try {
      socket.joinGroup(new InetSocketAddress(address, 0), netIface);
    } catch (IOException | SecurityException e) {
      IOUtils.closeQuietly(socket);
      throw new ServiceSessionException(REASON.MULTICAST_BLOCKED,
          "Could not join multicast group " + address.getHostAddress() + " on "
              + netIface.getName() + ": " + e.getMessage(), e);
    }

    this.socket = socket;

    try {
      int ifaceMtu = netIface.getMTU();
      mtu = ifaceMtu > 0 ? ifaceMtu : DEFAULT_MTU;
    } catch (SocketException e) {
      LOG.warn("Error getting MTU from Network Interface {}. Using default MTU.", netIface, e);
    }
  }

  @Override
  public void close() throws IOException {
    if (exit) {
      return;
    }
    super.close();

    try {
      socket.leaveGroup(new InetSocketAddress(address, 0), netIface);
    } catch (IOException e) {
      LOG.debug("Error leaving multicast group {} on {}", address.getHostAddress(),
          netIface.getName(), e);
    }

    // unblocks the read thread
    socket.close();
  }

  public boolean isLoopback() {
    return loopback;
  }

  public int getTTL() {
    return ttl;
  }

  public void run() {
    byte[] buffer = new byte[MAX_PACKET_SIZE];
    while (!exit) {
      try {
        DatagramPacket datagram = new DatagramPacket(buffer, buffer.length);
        socket.receive(datagram);
        if (datagram.getLength() > 0) {
          dispatch(new Packet(datagram));
        }
      } catch (IOException e) {
        if (!exit) {
          LOG.warn("Error receiving data from {}", address, e);
        }
      }
    }
    LOG.debug("Read thread of {} exiting", this);
  }

  @Override
  public void send(final byte[] data) throws IOException {
    send(data, new InetSocketAddress(address, port));
  }

  @Override
  public void send(final byte[] data, final SocketAddress target) throws IOException {
    if (exit) {
      return;
    }

    DatagramPacket packet = new DatagramPacket(data, data.length, target);
    try {
      socket.send(packet);
    } catch (IOException e) {
      LOG.trace("Error sending datagram to {}", target, e);
      throw new IOException(
          "Exception \"" + e.getMessage() + "\" occurred while sending datagram to \"" + target
              + "\".", e);
    }
  }
}
