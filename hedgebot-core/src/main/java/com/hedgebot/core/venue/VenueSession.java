package com.hedgebot.core.venue;

/**
 * Supplies the venue session token. {@link #invalidate()} forces the next {@link #token()}
 * call to log in again.
 */
public interface VenueSession {

  String token();

  void invalidate();

  static VenueSession fixed(String token) {
    return new VenueSession() {
      @Override
      public String token() {
        return token;
      }

      @Override
      public void invalidate() {
      }
    };
  }
}
