package io.studentdeals.platform.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/** Maps the platform's single {@code role} claim to one Spring authority. */
public class JwtRoleAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLE_CLAIM = "role";

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.STUDENT, Roles.AUTHORITY_STUDENT,
          Roles.MERCHANT_CORPORATE, Roles.AUTHORITY_MERCHANT_CORPORATE,
          Roles.MERCHANT_BRANCH, Roles.AUTHORITY_MERCHANT_BRANCH,
          Roles.ADMIN, Roles.AUTHORITY_ADMIN);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String role = jwt.getClaimAsString(ROLE_CLAIM);
    String authority = role != null ? ROLE_MAPPING.get(role) : null;
    return authority != null ? List.of(new SimpleGrantedAuthority(authority)) : List.of();
  }
}
