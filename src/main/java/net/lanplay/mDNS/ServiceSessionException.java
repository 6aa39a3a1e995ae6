package net.lanplay.mDNS;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Failure reported by a browse or advertise session. The {@link REASON} tells the host what kind
 * of remedy applies, the context fields tell it which call and which service were involved.
 */
public class ServiceSessionException extends IOException {
  private static final long serialVersionUID = 202405121731L;

  public enum REASON {
    /** A socket could not be opened or bound, or no usable network interface exists. */
    ENGINE_UNAVAILABLE,
    /**
     * Joining the mDNS multicast group failed. This is the usual symptom of a platform that blocks
     * inbound multicast until the application holds a multicast lock.
     */
    MULTICAST_BLOCKED,
    NAME_CONFLICT,
    INVALID_SERVICE_TYPE,
    INVALID_INSTANCE_NAME,
    INVALID_TXT_KEY,
    ENTRY_TOO_LONG,
    /** The consumer polled too infrequently and the event backlog exceeded its bound. */
    QUEUE_OVERFLOW,
    ENGINE_CLOSED
  }

  private final REASON reason;

  private final String operation;

  private final String serviceType;

  private final String instanceName;

  public ServiceSessionException(final REASON reason, final String message) {
    this(reason, message, null);
  }

  public ServiceSessionException(final REASON reason, final String message, final Throwable cause) {
    this(reason, message, cause, null, null, null);
  }

  private ServiceSessionException(final REASON reason, final String message, final Throwable cause,
      final String operation, final String serviceType, final String instanceName) {
    super(message, cause);
    this.reason = reason;
    this.operation = operation;
    this.serviceType = serviceType;
    this.instanceName = instanceName;
  }

  /**
   * Returns a copy of this exception that names the consumer call, service type and instance the
   * failure belongs to. Values already present are kept.
   */
  public ServiceSessionException withContext(final String operation, final String serviceType,
      final String instanceName) {
    ServiceSessionException e = new ServiceSessionException(reason, super.getMessage(), getCause(),
        StringUtils.defaultIfEmpty(this.operation, operation),
        StringUtils.defaultIfEmpty(this.serviceType, serviceType),
        StringUtils.defaultIfEmpty(this.instanceName, instanceName));
    e.setStackTrace(getStackTrace());
    return e;
  }

  public REASON getReason() {
    return reason;
  }

  public String getOperation() {
    return operation;
  }

  public String getServiceType() {
    return serviceType;
  }

  public String getInstanceName() {
    return instanceName;
  }

  /**
   * @return true if the failure is one of the resource acquisition kinds, multicast blocked
   * included.
   */
  public boolean isEngineUnavailable() {
    return reason == REASON.ENGINE_UNAVAILABLE || reason == REASON.MULTICAST_BLOCKED;
  }

  @Override
  public String getMessage() {
    if (operation == null) {
      return super.getMessage();
    }

    List<String> arguments = new ArrayList<>();
    if (instanceName != null) {
      arguments.add("\"" + instanceName + "\"");
    }
    if (serviceType != null) {
      arguments.add(serviceType);
    }
    return operation + "(" + String.join(", ", arguments) + ") failed [" + reason + "]: "
        + super.getMessage();
  }
}
