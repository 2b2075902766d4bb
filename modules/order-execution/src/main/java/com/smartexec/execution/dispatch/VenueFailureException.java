package com.smartexec.execution.dispatch;

public class VenueFailureException extends RuntimeException {
  private final String venue;

  public VenueFailureException(String venue, String message) {
    super(message);
    this.venue = venue;
  }

  public VenueFailureException(String venue, String message, Throwable cause) {
    super(message, cause);
    this.venue = venue;
  }

  public String venue() {
    return venue;
  }
}
