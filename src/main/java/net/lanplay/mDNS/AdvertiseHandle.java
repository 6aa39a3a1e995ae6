package net.lanplay.mDNS;

import java.util.Objects;

/**
 * Opaque reference to one advertisement. Stale once the advertisement is withdrawn or replaced.
 */
public final class AdvertiseHandle {
  private final Object owner;

  private final long generation;

  private final String fullName;

  AdvertiseHandle(final Object owner, final long generation, final String fullName) {
    this.owner = owner;
    this.generation = generation;
    this.fullName = fullName;
  }

  public Object getOwner() {
    return owner;
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
    } else if (obj instanceof AdvertiseHandle) {
      AdvertiseHandle that = (AdvertiseHandle) obj;
      return generation == that.generation && owner.equals(that.owner);
    }
    return false;
  }

  @Override
  public String toString() {
    return "AdvertiseHandle[" + fullName + ", generation " + generation + "]";
  }
}
