package io.studentdeals.platform.security;

/**
 * Best-effort network origin of a request.
 *
 * @param ipAddress client IP; null when no request is in scope
 * @param userAgent User-Agent header truncated to the configured length; nullable
 */
public record RequestOrigin(String ipAddress, String userAgent) {

  public static final RequestOrigin NONE = new RequestOrigin(null, null);
}
