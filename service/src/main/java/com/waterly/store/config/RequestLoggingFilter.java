package com.waterly.store.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs one line per request and tags the request's log lines with a request id, taken from
 * {@code X-Request-Id} when the caller sends one.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String MDC_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator");
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(MDC_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      if (response.getStatus() >= 500) {
        log.warn("HTTP {} {} from {} -> {} ({} ms)", request.getMethod(), describe(request),
            clientIp(request), response.getStatus(), duration);
      } else {
        log.info("HTTP {} {} from {} -> {} ({} ms)", request.getMethod(), describe(request),
            clientIp(request), response.getStatus(), duration);
      }
      MDC.remove(MDC_KEY);
    }
  }

  static String describe(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  private static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
