package io.studentdeals.platform.security;

import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * {@link ActorResolver} reading the JWT in the security context: subject as user id, {@code email}
 * and {@code role} claims.
 */
@Component
public class JwtActorResolver implements ActorResolver {

  private static final Logger log = LoggerFactory.getLogger(JwtActorResolver.class);

  @Override
  public Optional<CurrentActor> currentActor() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken token)) {
      return Optional.empty();
    }
    var jwt = token.getToken();
    String subject = jwt.getSubject();
    if (subject == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new CurrentActor(
              UUID.fromString(subject),
              jwt.getClaimAsString("email"),
              jwt.getClaimAsString(JwtRoleAuthenticationConverter.ROLE_CLAIM)));
    } catch (IllegalArgumentException e) {
      log.debug("JWT subject is not a platform user id: sub={}", subject);
      return Optional.empty();
    }
  }
}
