package com.dinoair.resilience.failure;

/**
 * Error reported by an external AI service, carrying the HTTP status when there is one.
 */
public class DependencyException extends RuntimeException {
  public static final int NO_STATUS = -1;

  private final String dependency;
  private final int statusCode;

  public DependencyException(String dependency, int statusCode, String message) {
    super(message);
    this.dependency = dependency;
    this.statusCode = statusCode;
  }

  public DependencyException(String dependency, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
    this.statusCode = NO_STATUS;
  }

  public String getDependency() {
    return dependency;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isServerError() {
    return statusCode >= 500;
  }

  public boolean isNotFound() {
    return statusCode == 404;
  }
}
