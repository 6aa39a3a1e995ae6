package net.lanplay.mDNS.net;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.SocketAddress;
import net.lanplay.mDNS.utils.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One multicast endpoint of an engine: a group address joined on one local interface. Datagrams are
 * read on a dedicated daemon thread and handed to the {@link PacketListener}, which must not block.
 */
public abstract class NetworkProcessor implements Runnable, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(NetworkProcessor.class);

  // Normally MTU size is 1500, but can be up to 9000 for jumbo frames.
  public static final int DEFAULT_MTU = 1500;

  public static final int MAX_PACKET_SIZE = 9000;

  protected final Executors executors;

  protected final InetAddress ifaceAddress;

  protected final InetAddress address;

  protected final int port;

  protected int mtu = DEFAULT_MTU;

  protected volatile boolean exit = false;

  protected final PacketListener listener;

  protected Thread networkReadThread = null;

  public NetworkProcessor(final InetAddress ifaceAddress, final InetAddress address, final int port,
      final PacketListener listener, final Executors executors) throws IOException {
    if (ifaceAddress.getAddress().length != address.getAddress().length) {
      throw new IOException("Interface address " + ifaceAddress + " and group address " + address
          + " must be of the same IP version");
    }

    this.ifaceAddress = ifaceAddress;
    this.address = address;
    this.port = port;
    this.listener = listener;
    this.executors = executors;
  }

  public void close() throws IOException {
    exit = true;
  }

  public InetAddress getInterfaceAddress() {
    return ifaceAddress;
  }

  /**
   * @return The largest DNS message that fits a single datagram on this interface
   */
  public int getMaxPayloadSize() {
    return mtu - 40 /* IPv6 Header Size */ - 8 /* UDP Header */;
  }

  /**
   * Sends the data to the multicast group.
   */
  public abstract void send(byte[] data) throws IOException;

  /**
   * Sends the data to a single peer, used for replies to legacy unicast queries.
   */
  public abstract void send(byte[] data, SocketAddress target) throws IOException;

  public void start() {
    exit = false;

    Thread t = executors.newNetworkThread(this);
    t.start();
    networkReadThread = t;
  }

  /**
   * Waits for the read thread to exit after {@link #close()}.
   *
   * @return true if the thread has exited
   */
  public boolean join(final long millis) {
    Thread t = networkReadThread;
    if (t == null) {
      return true;
    }

    try {
      t.join(Math.max(1, millis));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }

    if (t.isAlive()) {
      LOG.warn("{} did not exit within {} ms", t.getName(), millis);
      return false;
    }
    return true;
  }

  protected void dispatch(final Packet packet) {
    LOG.trace("-----> Received packet {} on {} <-----", packet.getId(), ifaceAddress);
    try {
      listener.packetReceived(this, packet);
    } catch (RuntimeException e) {
      LOG.warn("Error dispatching packet {}", packet.getId(), e);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + ifaceAddress.getHostAddress() + " -> "
        + address.getHostAddress() + ":" + port + "]";
  }
}
