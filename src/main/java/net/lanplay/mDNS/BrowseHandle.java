package net.lanplay.mDNS;

import java.util.Objects;
import net.lanplay.mDNS.model.ServiceType;

/**
 * Opaque reference to one browse session. A handle outlives its session: once the session is
 * stopped or replaced the handle is stale and every call taking it is a no-op.
 */
public final class BrowseHandle {
  private final Object owner;

  private final ServiceType serviceType;

  private final long generation;

  BrowseHandle(final Object owner, final ServiceType serviceType, final long generation) {
    this.owner = owner;
    this.serviceType = serviceType;
    this.generation = generation;
  }

  public Object getOwner() {
    return owner;
  }

  public ServiceType getServiceType() {
    return serviceType;
  }

  public long getGeneration() {
    return generation;
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, generation);
  }

  @Override
  public boolean equals(final Object obj) {
    if (obj == this) {
      return true;
    } else if (obj instanceof BrowseHandle) {
      BrowseHandle that = (BrowseHandle) obj;
      return generation == that.generation && owner.equals(that.owner);
    }
    return false;
  }

  @Override
  public String toString() {
    return "BrowseHandle[" + serviceType + ", generation " + generation + "]";
  }
}
