package io.studentdeals.platform.audit.interception;

import io.studentdeals.platform.audit.AuditProperties;
import io.studentdeals.platform.audit.AuditValueSnapshots;
import io.studentdeals.platform.security.ActorResolver;
import io.studentdeals.platform.security.RequestOriginResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Builds {@link OperationRequest}s from servlet requests, for controllers that dispatch through
 * {@link AuditInterceptor}. Usage inside a controller method:
 *
 * <pre>{@code
 * return updateOffer.handle(operationRequests.from(request, dto));
 * }</pre>
 */
@Component
public class HttpOperationRequests {

  private final ActorResolver actorResolver;
  private final AuditValueSnapshots snapshots;
  private final AuditProperties properties;

  public HttpOperationRequests(
      ActorResolver actorResolver, AuditValueSnapshots snapshots, AuditProperties properties) {
    this.actorResolver = actorResolver;
    this.snapshots = snapshots;
    this.properties = properties;
  }

  /** Path parameters are read from the URI template variables resolved by Spring MVC. */
  public OperationRequest from(HttpServletRequest request, Object body) {
    return from(request, body, uriTemplateVariables(request));
  }

  public OperationRequest from(
      HttpServletRequest request, Object body, Map<String, String> pathParams) {
    var queryParams = new LinkedHashMap<String, String>();
    request
        .getParameterMap()
        .forEach(
            (name, values) -> {
              if (values != null && values.length > 0) {
                queryParams.put(name, values[0]);
              }
            });
    return new OperationRequest(
        OperationVerb.fromMethod(request.getMethod()),
        snapshots.toTree(body),
        pathParams,
        queryParams,
        actorResolver.currentActor().orElse(null),
        RequestOriginResolver.resolve(request, properties.maxUserAgentLength()));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> uriTemplateVariables(HttpServletRequest request) {
    Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return variables instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
  }
}
