package net.lanplay.mDNS.net;

import java.net.DatagramPacket;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A datagram read from the network, with the address it came from.
 */
public class Packet {
  private static final AtomicInteger SEQUENCE = new AtomicInteger();

  protected final int id = SEQUENCE.incrementAndGet();

  private final byte[] data;

  private final SocketAddress source;

  protected Packet(final DatagramPacket datagram) {
    this(Arrays.copyOfRange(datagram.getData(), datagram.getOffset(),
        datagram.getOffset() + datagram.getLength()), datagram.getSocketAddress());
  }

  public Packet(final byte[] data, final SocketAddress source) {
    this.data = data;
    this.source = source;
  }

  public int getId() {
    return id;
  }

  public byte[] getData() {
    return data;
  }

  public SocketAddress getSource() {
    return source;
  }

  /**
   * @return The source port, or -1 if the source is not an IP socket address
   */
  public int getSourcePort() {
    return source instanceof InetSocketAddress ? ((InetSocketAddress) source).getPort() : -1;
  }

  @Override
  public String toString() {
    return "Packet " + id + " from " + source + " (" + data.length + " bytes)";
  }
}
