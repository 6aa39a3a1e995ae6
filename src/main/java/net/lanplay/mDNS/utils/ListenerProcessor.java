package net.lanplay.mDNS.utils;

import java.io.Closeable;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans calls on a listener interface out to every registered listener, in registration order.
 * A listener may halt delivery to the listeners after it by throwing a
 * {@link StopDispatchException}. A listener that fails is logged and skipped.
 *
 * @param <T> The listener interface
 */
@SuppressWarnings("unchecked")
public class ListenerProcessor<T> implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(ListenerProcessor.class);

  public static class StopDispatchException extends RuntimeException {
    private static final long serialVersionUID = 201401211841L;

    public StopDispatchException() {
      super();
    }
  }

  protected static class Dispatcher implements InvocationHandler {
    private final ListenerProcessor<?> processor;

    protected Dispatcher(final ListenerProcessor<?> processor) {
      this.processor = processor;
    }

    public Object invoke(final Object proxy, final Method method, final Object[] args)
        throws Throwable {
      if (method.getDeclaringClass() == Object.class) {
        return method.invoke(processor, args);
      }

      for (Object listener : processor.listeners) {
        try {
          method.invoke(listener, args);
        } catch (InvocationTargetException e) {
          if (e.getTargetException() instanceof StopDispatchException) {
            break;
          }
          LOG.warn("Listener {} failed handling {}", listener, method.getName(),
              e.getTargetException());
        } catch (IllegalAccessException e) {
          LOG.warn("Listener {} cannot be called", listener, e);
        }
      }

      return null;
    }
  }

  private final Class<T> iface;

  private final List<T> listeners = new CopyOnWriteArrayList<>();

  private final T dispatcher;

  public ListenerProcessor(final Class<T> iface) {
    if (!iface.isInterface()) {
      throw new IllegalArgumentException("\"" + iface.getName() + "\" is not an interface.");
    }

    this.iface = iface;
    this.dispatcher = (T) Proxy.newProxyInstance(iface.getClassLoader(), new Class[]{iface},
        new Dispatcher(this));
  }

  public void close() {
    listeners.clear();
  }

  public T getDispatcher() {
    return dispatcher;
  }

  public boolean hasListeners() {
    return !listeners.isEmpty();
  }

  /**
   * @return The listener, or null if it is null or does not implement the interface
   */
  public T registerListener(final T listener) {
    if ((listener != null) && iface.isInstance(listener)) {
      ((CopyOnWriteArrayList<T>) listeners).addIfAbsent(listener);
      return listener;
    }

    return null;
  }

  /**
   * @return The listener that was removed, or null if it was not registered
   */
  public T unregisterListener(final T listener) {
    return listener != null && listeners.remove(listener) ? listener : null;
  }
}
