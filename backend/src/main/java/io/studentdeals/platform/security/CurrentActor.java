package io.studentdeals.platform.security;

import java.util.UUID;

/**
 * Authenticated user performing a request.
 *
 * @param id platform user id
 * @param email contact identity; nullable when the token carries no email claim
 * @param role platform role (see {@link Roles})
 */
public record CurrentActor(UUID id, String email, String role) {}
