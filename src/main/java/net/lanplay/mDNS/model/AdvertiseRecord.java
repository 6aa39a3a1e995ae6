package net.lanplay.mDNS.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import net.lanplay.mDNS.ServiceSessionException;

/**
 * A service advertised by this host. The identity fields never change; the registration state is
 * advanced by the engine thread and read by the consumer.
 */
public class AdvertiseRecord {

  public enum RegistrationState {
    PENDING, REGISTERED, FAILED, UNREGISTERED
  }

  private final String instanceName;

  private final ServiceType serviceType;

  private final int port;

  private final Map<String, String> txt;

  private final AtomicReference<RegistrationState> state =
      new AtomicReference<>(RegistrationState.PENDING);

  private volatile ServiceSessionException failure;

  public AdvertiseRecord(final String instanceName, final ServiceType serviceType, final int port,
      final Map<String, String> txt) {
    this.instanceName = instanceName;
    this.serviceType = serviceType;
    this.port = port;
    this.txt = Collections.unmodifiableMap(new LinkedHashMap<>(txt));
  }

  public String getInstanceName() {
    return instanceName;
  }

  public ServiceType getServiceType() {
    return serviceType;
  }

  public String getFullName() {
    return instanceName + "." + serviceType;
  }

  public int getPort() {
    return port;
  }

  public Map<String, String> getTxt() {
    return txt;
  }

  public RegistrationState getState() {
    return state.get();
  }

  public ServiceSessionException getFailure() {
    return failure;
  }

  /**
   * Moves the registration from one state to another.
   *
   * @return false if the registration was no longer in the expected state
   */
  public boolean transition(final RegistrationState from, final RegistrationState to) {
    return state.compareAndSet(from, to);
  }

  /**
   * Marks the registration failed unless it already reached a terminal state.
   */
  public boolean fail(final ServiceSessionException failure) {
    RegistrationState current = state.get();
    while (current == RegistrationState.PENDING || current == RegistrationState.REGISTERED) {
      // published before the state so a reader seeing FAILED also sees the cause
      this.failure = failure;
      if (state.compareAndSet(current, RegistrationState.FAILED)) {
        return true;
      }
      current = state.get();
    }
    return false;
  }

  /**
   * Marks the registration withdrawn.
   *
   * @return the state it was in before
   */
  public RegistrationState withdraw() {
    return state.getAndSet(RegistrationState.UNREGISTERED);
  }

  @Override
  public String toString() {
    return getFullName() + " port " + port + " [" + state.get() + "]";
  }
}
