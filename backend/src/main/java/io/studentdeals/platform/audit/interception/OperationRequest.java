package io.studentdeals.platform.audit.interception;

import io.studentdeals.platform.security.CurrentActor;
import io.studentdeals.platform.security.RequestOrigin;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Input surface of a dispatched operation: everything the interceptor and the metadata extractors
 * may look at.
 *
 * @param verb triggering verb; decides the {@link OperationKind}
 * @param body request payload as a JSON-shaped map; null when the operation has no body
 * @param pathParams path parameters, never null
 * @param queryParams query parameters (first value per name), never null
 * @param actor authenticated actor; null for anonymous or system-triggered operations
 * @param origin client IP and user agent, never null
 */
public record OperationRequest(
    OperationVerb verb,
    Map<String, Object> body,
    Map<String, String> pathParams,
    Map<String, String> queryParams,
    CurrentActor actor,
    RequestOrigin origin) {

  public OperationRequest {
    verb = verb != null ? verb : OperationVerb.OTHER;
    body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : null;
    pathParams = copyOf(pathParams);
    queryParams = copyOf(queryParams);
    origin = origin != null ? origin : RequestOrigin.NONE;
  }

  public String pathParam(String name) {
    return pathParams.get(name);
  }

  public Object bodyValue(String name) {
    return body != null ? body.get(name) : null;
  }

  public Optional<CurrentActor> currentActor() {
    return Optional.ofNullable(actor);
  }

  public static Builder builder(OperationVerb verb) {
    return new Builder(verb);
  }

  private static Map<String, String> copyOf(Map<String, String> source) {
    return source != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
        : Collections.emptyMap();
  }

  public static final class Builder {

    private final OperationVerb verb;
    private Map<String, Object> body;
    private final Map<String, String> pathParams = new LinkedHashMap<>();
    private final Map<String, String> queryParams = new LinkedHashMap<>();
    private CurrentActor actor;
    private RequestOrigin origin;

    private Builder(OperationVerb verb) {
      this.verb = verb;
    }

    public Builder body(Map<String, Object> body) {
      this.body = body;
      return this;
    }

    public Builder pathParam(String name, String value) {
      this.pathParams.put(name, value);
      return this;
    }

    public Builder queryParam(String name, String value) {
      this.queryParams.put(name, value);
      return this;
    }

    public Builder actor(CurrentActor actor) {
      this.actor = actor;
      return this;
    }

    public Builder origin(RequestOrigin origin) {
      this.origin = origin;
      return this;
    }

    public OperationRequest build() {
      return new OperationRequest(verb, body, pathParams, queryParams, actor, origin);
    }
  }
}
