package io.studentdeals.platform.security;

import java.util.Optional;

/** Resolves the authenticated actor of the current request, if any. */
public interface ActorResolver {

  /** Empty for anonymous requests and for system-triggered work outside a request. */
  Optional<CurrentActor> currentActor();
}
