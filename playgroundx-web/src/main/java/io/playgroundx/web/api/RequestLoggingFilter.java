package io.playgroundx.web.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Tags each request with an id (from {@code X-Request-ID} or a fresh UUID) and echoes it in the
 * response. The id, full URL and client address are exposed to log lines through the MDC for the
 * duration of the request. Request begin/end are logged with the duration.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public final class RequestLoggingFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  public static final String REQUEST_ID_HEADER = "X-Request-ID";
  public static final String MDC_KEY = "request_id";
  public static final String MDC_URL = "url";
  public static final String MDC_REMOTE_ADDR = "remote_addr";

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    long start = System.nanoTime();
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) requestId = UUID.randomUUID().toString();
    else requestId = requestId.trim();

    MDC.put(MDC_KEY, requestId);
    MDC.put(MDC_URL, url(request));
    MDC.put(MDC_REMOTE_ADDR, request.getRemoteAddr() == null ? "-" : request.getRemoteAddr());
    response.setHeader(REQUEST_ID_HEADER, requestId);
    String args = args(request);
    log.info("<--BEGIN: {} {} {}", request.getMethod(), request.getRequestURI(), args);
    try {
      filterChain.doFilter(request, response);
    } finally {
      double ms = (System.nanoTime() - start) / 1_000_000.0;
      log.info("{} ms {} {} {} {} :END-->",
          String.format(Locale.ROOT, "%.2f", ms), request.getMethod(), request.getRequestURI(), response.getStatus(), args);
      MDC.remove(MDC_KEY);
      MDC.remove(MDC_URL);
      MDC.remove(MDC_REMOTE_ADDR);
    }
  }

  static String url(HttpServletRequest request) {
    StringBuffer url = request.getRequestURL();
    if (request.getQueryString() != null) url.append('?').append(request.getQueryString());
    return url.toString();
  }

  static String args(HttpServletRequest request) {
    Map<String, String> out = new LinkedHashMap<>();
    request.getParameterMap().forEach((k, v) -> out.put(k, v == null || v.length == 0 ? "" : String.join(",", v)));
    return out.toString();
  }
}
