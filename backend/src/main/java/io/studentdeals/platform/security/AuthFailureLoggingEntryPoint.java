package io.studentdeals.platform.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs authentication failures, then lets {@link BearerTokenAuthenticationEntryPoint} write the
 * 401. Failed authentications are not audit entries: there is no actor to attribute them to.
 */
@Component
public class AuthFailureLoggingEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AuthFailureLoggingEntryPoint.class);

  private final BearerTokenAuthenticationEntryPoint delegate =
      new BearerTokenAuthenticationEntryPoint();

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        RequestOriginResolver.clientIp(request));
    delegate.commence(request, response, authException);
  }
}
