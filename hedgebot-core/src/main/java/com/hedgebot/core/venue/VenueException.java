package com.hedgebot.core.venue;

import lombok.Getter;

/**
 * A venue call that failed before producing a result (network, timeout, API error).
 */
@Getter
public class VenueException extends RuntimeException {

  private final String errorCode;
  private final boolean retryable;

  public VenueException(String errorCode, String message, boolean retryable) {
    super(message);
    this.errorCode = errorCode;
    this.retryable = retryable;
  }

  public VenueException(String errorCode, String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.retryable = retryable;
  }

  public static VenueException transientFailure(String message, Throwable cause) {
    return new VenueException("TRANSIENT", message, true, cause);
  }
}
