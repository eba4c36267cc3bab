package io.playgroundx.persistence.log;

import io.playgroundx.persistence.page.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Wraps an interface implementation so every call is logged.\n
 * DEBUG: call with arguments, then result summary and elapsed milliseconds.\n
 * ERROR: any exception, which is then rethrown unchanged.
 */
public final class LoggingProxy {
  private LoggingProxy() {}

  public static <T> T wrap(Class<T> iface, T target) {
    return wrap(iface, target, LoggerFactory.getLogger(target.getClass()));
  }

  public static <T> T wrap(Class<T> iface, T target, Logger log) {
    Objects.requireNonNull(iface, "iface");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(log, "log");
    if (!iface.isInterface()) throw new IllegalArgumentException("Not an interface: " + iface.getName());
    Object proxy = Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[]{iface}, new Handler(target, log));
    return iface.cast(proxy);
  }

  /** Returns the wrapped object, or {@code maybeProxy} itself when it was not produced by {@link #wrap}. */
  public static Object unwrap(Object maybeProxy) {
    if (maybeProxy != null && Proxy.isProxyClass(maybeProxy.getClass())
        && Proxy.getInvocationHandler(maybeProxy) instanceof Handler h) {
      return h.target;
    }
    return maybeProxy;
  }

  private static final class Handler implements InvocationHandler {
    private final Object target;
    private final Logger log;

    Handler(Object target, Logger log) {
      this.target = target;
      this.log = log;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      if (method.getDeclaringClass() == Object.class) return invokeObjectMethod(proxy, method, args);

      String name = method.getName();
      if (log.isDebugEnabled()) {
        log.debug("playgroundx.call method={} args={}", name, args == null ? "[]" : Arrays.deepToString(args));
      }
      long start = System.nanoTime();
      try {
        Object result = method.invoke(target, args);
        if (log.isDebugEnabled()) {
          log.debug("playgroundx.call_done method={} durationMs={} result={}",
              name, (System.nanoTime() - start) / 1_000_000.0, summarize(result));
        }
        return result;
      } catch (InvocationTargetException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        log.error("playgroundx.call_failed method={} durationMs={} error={}",
            name, (System.nanoTime() - start) / 1_000_000.0, cause.toString());
        throw cause;
      } catch (IllegalAccessException e) {
        throw new UndeclaredThrowableException(e);
      }
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) throws Throwable {
      return switch (method.getName()) {
        case "equals" -> proxy == args[0];
        case "hashCode" -> System.identityHashCode(proxy);
        case "toString" -> "LoggingProxy[" + target + "]";
        default -> method.invoke(target, args);
      };
    }
  }

  static String summarize(Object r) {
    if (r == null) return "null";
    if (r instanceof PagedResult<?> p) {
      return "PagedResult(rows=" + p.data().size() + ", pagination=" + p.pagination() + ")";
    }
    if (r instanceof Collection<?> c) return r.getClass().getSimpleName() + "(size=" + c.size() + ")";
    if (r instanceof Optional<?> o) return o.isPresent() ? "Optional(present)" : "Optional.empty";
    if (r instanceof Number || r instanceof Boolean || r instanceof CharSequence) return String.valueOf(r);
    return r.getClass().getSimpleName();
  }
}
