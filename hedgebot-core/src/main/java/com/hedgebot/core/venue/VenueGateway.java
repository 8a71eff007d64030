package com.hedgebot.core.venue;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Session-aware front for a {@link MarketVenue}.
 *
 * Every call is attempted at most twice: a retryable failure is retried once immediately, and a
 * session failure invalidates the session so the retry runs with a fresh token. A second failure
 * propagates to the caller.
 */
@Slf4j
public final class VenueGateway {

  private static final Pattern SESSION_ERROR = Pattern.compile("INVALID_SESSION_INFORMATION|ANGX-0003",
      Pattern.CASE_INSENSITIVE);

  private final MarketVenue venue;
  private final VenueSession session;
  private final Counter retriesCounter;
  private final Counter reauthCounter;
  private final Counter failuresCounter;

  public VenueGateway(@NonNull MarketVenue venue, @NonNull VenueSession session, @NonNull MeterRegistry meterRegistry) {
    this.venue = venue;
    this.session = session;
    this.retriesCounter = Counter.builder("hedgebot.venue.retries")
        .description("Venue calls retried after a transient failure")
        .register(meterRegistry);
    this.reauthCounter = Counter.builder("hedgebot.venue.reauth")
        .description("Venue calls retried after session re-authentication")
        .register(meterRegistry);
    this.failuresCounter = Counter.builder("hedgebot.venue.failures")
        .description("Venue calls that failed after retry")
        .register(meterRegistry);
  }

  public MarketBook marketBook(String marketId, String label) {
    return call(label, token -> venue.listMarketBook(token, marketId));
  }

  public PlaceResult placeOrder(OrderRequest request, String label) {
    return call(label, token -> venue.placeOrder(token, request));
  }

  public CancelResult cancelOrder(String betId, String marketId, String label) {
    return call(label, token -> venue.cancelOrder(token, betId, marketId));
  }

  public Optional<CurrentOrder> currentOrder(String betId, String label) {
    List<CurrentOrder> orders = call(label, token -> venue.listCurrentOrders(token, List.of(betId)));
    if (orders == null) {
      return Optional.empty();
    }
    return orders.stream().filter(o -> betId.equals(o.betId())).findFirst();
  }

  public Optional<ClearedOrder> clearedOrder(String betId, String label) {
    List<ClearedOrder> orders = call(label, token -> venue.listClearedOrders(token, List.of(betId)));
    if (orders == null) {
      return Optional.empty();
    }
    return orders.stream().filter(o -> betId.equals(o.betId())).findFirst();
  }

  private <T> T call(String label, Function<String, T> op) {
    try {
      return op.apply(session.token());
    } catch (VenueException first) {
      if (isSessionError(first)) {
        log.warn("venue session rejected during {} ({}), re-authenticating", label, first.getErrorCode());
        session.invalidate();
        reauthCounter.increment();
      } else if (first.isRetryable()) {
        log.warn("venue call {} failed ({}), retrying once", label, first.getMessage());
        retriesCounter.increment();
      } else {
        failuresCounter.increment();
        throw first;
      }
      try {
        return op.apply(session.token());
      } catch (VenueException second) {
        failuresCounter.increment();
        log.error("venue call {} failed after retry: {}", label, second.getMessage());
        throw second;
      }
    }
  }

  static boolean isSessionError(VenueException e) {
    if (e instanceof VenueSessionException) {
      return true;
    }
    String code = e.getErrorCode() == null ? "" : e.getErrorCode();
    String message = e.getMessage() == null ? "" : e.getMessage();
    return SESSION_ERROR.matcher(code).find() || SESSION_ERROR.matcher(message).find();
  }
}
