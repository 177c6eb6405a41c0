package io.studentdeals.platform.audit.interception;

import java.util.Locale;

/** Triggering verb of an operation, as seen on the HTTP method. */
public enum OperationVerb {
  GET(OperationKind.GENERIC),
  POST(OperationKind.CREATE),
  PUT(OperationKind.UPDATE),
  PATCH(OperationKind.UPDATE),
  DELETE(OperationKind.DELETE),
  OTHER(OperationKind.GENERIC);

  private final OperationKind kind;

  OperationVerb(OperationKind kind) {
    this.kind = kind;
  }

  public OperationKind kind() {
    return kind;
  }

  /** Maps an HTTP method name; anything unrecognised becomes {@link #OTHER}. */
  public static OperationVerb fromMethod(String method) {
    if (method == null) {
      return OTHER;
    }
    return switch (method.trim().toUpperCase(Locale.ROOT)) {
      case "GET" -> GET;
      case "POST" -> POST;
      case "PUT" -> PUT;
      case "PATCH" -> PATCH;
      case "DELETE" -> DELETE;
      default -> OTHER;
    };
  }
}
