package io.studentdeals.platform.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Platform user as seen by the audit subsystem: identity, contact email and role. Accounts are
 * created by the authentication module, which owns the other columns of {@code users}.
 */
@Entity
@Table(name = "users")
public class AppUser {

  @Id private UUID id;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "role", nullable = false, length = 50)
  private String role;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AppUser() {}

  public AppUser(UUID id, String email, String role) {
    this.id = id;
    this.email = email;
    this.role = role;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getRole() {
    return role;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
