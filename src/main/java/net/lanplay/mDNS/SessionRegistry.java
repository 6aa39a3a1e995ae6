package net.lanplay.mDNS;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import net.lanplay.mDNS.model.AdvertiseRecord;
import net.lanplay.mDNS.utils.ListenerProcessor;

/**
 * Knows, per owner, whether a browse session and an advertisement are active. Each owner has one
 * browse slot and one advertise slot, each either idle or holding exactly one session.
 *
 * Callers hold the registry monitor while moving a slot between idle and active.
 */
public class SessionRegistry {

  /**
   * The owner used by the calls that do not name one.
   */
  public static final Object DEFAULT_OWNER = new Object() {
    @Override
    public String toString() {
      return "default owner";
    }
  };

  static class BrowseSlot {
    private final Object owner;

    private EventQueue queue;

    private BrowseHandle handle;

    private EventBridge bridge;

    private BrowseOperation operation;

    BrowseSlot(final Object owner) {
      this.owner = owner;
    }

    Object getOwner() {
      return owner;
    }

    /**
     * @return The queue of this owner, shared by its successive sessions
     */
    EventQueue queue(final int bound, final EngineStatistics statistics) {
      if (queue == null) {
        queue = new EventQueue(bound, statistics);
      }
      return queue;
    }

    EventQueue getQueue() {
      return queue;
    }

    BrowseHandle getHandle() {
      return handle;
    }

    EventBridge getBridge() {
      return bridge;
    }

    boolean isActive() {
      return handle != null;
    }

    void activate(final BrowseHandle handle, final EventBridge bridge,
        final BrowseOperation operation) {
      this.handle = handle;
      this.bridge = bridge;
      this.operation = operation;
    }

    /**
     * @return The operation that was active, or null if the slot was idle
     */
    BrowseOperation deactivate() {
      BrowseOperation previous = operation;
      handle = null;
      bridge = null;
      operation = null;
      if (queue != null) {
        queue.reset();
      }
      return previous;
    }
  }

  static class AdvertiseSlot {
    private final Object owner;

    private AdvertiseHandle handle;

    private AdvertiseRecord record;

    private Registration registration;

    private boolean failureReported;

    AdvertiseSlot(final Object owner) {
      this.owner = owner;
    }

    Object getOwner() {
      return owner;
    }

    AdvertiseHandle getHandle() {
      return handle;
    }

    AdvertiseRecord getRecord() {
      return record;
    }

    boolean isActive() {
      return handle != null;
    }

    /**
     * @return true while the advertisement is probing or registered
     */
    boolean isLive() {
      return isActive() && record.getState() != AdvertiseRecord.RegistrationState.FAILED;
    }

    /**
     * @return true the first time it is called for a failed advertisement
     */
    boolean reportFailure() {
      if (failureReported || record == null
          || record.getState() != AdvertiseRecord.RegistrationState.FAILED) {
        return false;
      }
      failureReported = true;
      return true;
    }

    void activate(final AdvertiseHandle handle, final AdvertiseRecord record,
        final Registration registration) {
      this.handle = handle;
      this.record = record;
      this.registration = registration;
      this.failureReported = false;
    }

    /**
     * @return The registration that was active, or null if the slot was idle
     */
    Registration deactivate() {
      Registration previous = registration;
      handle = null;
      record = null;
      registration = null;
      return previous;
    }
  }

  private final AtomicLong generations = new AtomicLong();

  private final Map<Object, BrowseSlot> browseSlots = new HashMap<>();

  private final Map<Object, AdvertiseSlot> advertiseSlots = new HashMap<>();

  private final Map<Object, ListenerProcessor<BrowseListener>> browseListeners = new HashMap<>();

  private final Map<Object, ListenerProcessor<AdvertiseListener>> advertiseListeners =
      new HashMap<>();

  /**
   * @return A generation number never handed out before
   */
  long nextGeneration() {
    return generations.incrementAndGet();
  }

  synchronized BrowseSlot browseSlot(final Object owner) {
    return browseSlots.computeIfAbsent(owner, BrowseSlot::new);
  }

  synchronized AdvertiseSlot advertiseSlot(final Object owner) {
    return advertiseSlots.computeIfAbsent(owner, AdvertiseSlot::new);
  }

  /**
   * @return The slot the handle belongs to, or null if the handle is stale
   */
  synchronized BrowseSlot currentBrowse(final BrowseHandle handle) {
    BrowseSlot slot = handle == null ? null : browseSlots.get(handle.getOwner());
    return slot != null && handle.equals(slot.getHandle()) ? slot : null;
  }

  /**
   * @return The slot the handle belongs to, or null if the handle is stale
   */
  synchronized AdvertiseSlot currentAdvertise(final AdvertiseHandle handle) {
    AdvertiseSlot slot = handle == null ? null : advertiseSlots.get(handle.getOwner());
    return slot != null && handle.equals(slot.getHandle()) ? slot : null;
  }

  synchronized List<BrowseSlot> activeBrowseSlots() {
    List<BrowseSlot> active = new ArrayList<>();
    for (BrowseSlot slot : browseSlots.values()) {
      if (slot.isActive()) {
        active.add(slot);
      }
    }
    return active;
  }

  synchronized List<AdvertiseSlot> activeAdvertiseSlots() {
    List<AdvertiseSlot> active = new ArrayList<>();
    for (AdvertiseSlot slot : advertiseSlots.values()) {
      if (slot.isActive()) {
        active.add(slot);
      }
    }
    return active;
  }

  public synchronized boolean isBrowsing(final Object owner) {
    BrowseSlot slot = browseSlots.get(owner);
    return slot != null && slot.isActive();
  }

  public synchronized boolean isAdvertising(final Object owner) {
    AdvertiseSlot slot = advertiseSlots.get(owner);
    return slot != null && slot.isLive();
  }

  synchronized ListenerProcessor<BrowseListener> browseListeners(final Object owner) {
    return browseListeners.computeIfAbsent(owner,
        o -> new ListenerProcessor<>(BrowseListener.class));
  }

  synchronized ListenerProcessor<AdvertiseListener> advertiseListeners(final Object owner) {
    return advertiseListeners.computeIfAbsent(owner,
        o -> new ListenerProcessor<>(AdvertiseListener.class));
  }

  /**
   * Drops every slot and listener, when the manager is closed.
   */
  synchronized void clear() {
    browseSlots.values().forEach(BrowseSlot::deactivate);
    advertiseSlots.values().forEach(AdvertiseSlot::deactivate);
    browseSlots.clear();
    advertiseSlots.clear();
    browseListeners.values().forEach(ListenerProcessor::close);
    advertiseListeners.values().forEach(ListenerProcessor::close);
    browseListeners.clear();
    advertiseListeners.clear();
  }
}
