package com.hedgebot.core.venue;

/**
 * The venue rejected the session token ({@code INVALID_SESSION_INFORMATION}, {@code ANGX-0003}).
 */
public class VenueSessionException extends VenueException {

  public VenueSessionException(String errorCode, String message) {
    super(errorCode, message, true);
  }
}
