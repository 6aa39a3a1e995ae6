package net.lanplay.mDNS.model;

/**
 * A lifecycle notification produced by a browse session.
 */
public class ServiceEvent {

  public enum Type {
    /** The service became resolved: host name, at least one address and a port are known. */
    DISCOVERED,
    /** A resolved service changed its addresses, port or TXT metadata. */
    UPDATED,
    /** A discovered service said goodbye or its records expired. */
    REMOVED
  }

  private final Type type;

  private final DiscoveredService service;

  private final long generation;

  public ServiceEvent(final Type type, final DiscoveredService service, final long generation) {
    this.type = type;
    this.service = service;
    this.generation = generation;
  }

  public Type getType() {
    return type;
  }

  public DiscoveredService getService() {
    return service;
  }

  /**
   * @return The generation of the browse session that produced this event
   */
  public long getGeneration() {
    return generation;
  }

  @Override
  public String toString() {
    return type + " " + service;
  }
}
