package io.studentdeals.platform.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/** Resolves client IP and user agent from a servlet request, honouring reverse proxy headers. */
public final class RequestOriginResolver {

  public static final int DEFAULT_MAX_USER_AGENT_LENGTH = 500;

  private RequestOriginResolver() {}

  /**
   * Resolves the origin of the request bound to the current thread, or {@link RequestOrigin#NONE}
   * outside of an HTTP request.
   */
  public static RequestOrigin current(int maxUserAgentLength) {
    if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
      return resolve(attrs.getRequest(), maxUserAgentLength);
    }
    return RequestOrigin.NONE;
  }

  public static RequestOrigin resolve(HttpServletRequest request, int maxUserAgentLength) {
    return new RequestOrigin(
        clientIp(request), truncate(request.getHeader("User-Agent"), maxUserAgentLength));
  }

  /** First X-Forwarded-For entry, then X-Real-IP, then the transport-level remote address. */
  static String clientIp(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String first = forwardedFor.split(",")[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return request.getRemoteAddr();
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
