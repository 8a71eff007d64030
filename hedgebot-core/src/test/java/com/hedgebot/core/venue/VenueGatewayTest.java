package com.hedgebot.core.venue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VenueGatewayTest {

  private static final MarketBook BOOK = new MarketBook("1.234", MarketStatus.OPEN, true, 50_000, List.of());

  @Mock
  private MarketVenue venue;

  @Mock
  private VenueSession session;

  private SimpleMeterRegistry meterRegistry;
  private VenueGateway gateway;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    gateway = new VenueGateway(venue, session, meterRegistry);
  }

  @Test
  void shouldRetryTransientFailureOnce() {
    when(session.token()).thenReturn("t1");
    when(venue.listMarketBook("t1", "1.234"))
        .thenThrow(VenueException.transientFailure("timeout", null))
        .thenReturn(BOOK);

    MarketBook book = gateway.marketBook("1.234", "book");

    assertThat(book).isEqualTo(BOOK);
    assertThat(meterRegistry.counter("hedgebot.venue.retries").count()).isEqualTo(1.0);
    verify(session, never()).invalidate();
  }

  @Test
  void shouldReauthenticateOnSessionError() {
    when(session.token()).thenReturn("expired", "fresh");
    when(venue.listMarketBook("expired", "1.234"))
        .thenThrow(new VenueSessionException("INVALID_SESSION_INFORMATION", "session expired"));
    when(venue.listMarketBook("fresh", "1.234")).thenReturn(BOOK);

    MarketBook book = gateway.marketBook("1.234", "book");

    assertThat(book).isEqualTo(BOOK);
    verify(session).invalidate();
    assertThat(meterRegistry.counter("hedgebot.venue.reauth").count()).isEqualTo(1.0);
  }

  @Test
  void shouldRecogniseSessionErrorByCode() {
    assertThat(VenueGateway.isSessionError(new VenueException("ANGX-0003", "bad token", false))).isTrue();
    assertThat(VenueGateway.isSessionError(new VenueException("TOO_MUCH_DATA", "too much", false))).isFalse();
  }

  @Test
  void shouldPropagateSecondFailure() {
    when(session.token()).thenReturn("t1");
    when(venue.cancelOrder(anyString(), eq("bet-1"), eq("1.234")))
        .thenThrow(VenueException.transientFailure("timeout", null));

    assertThatThrownBy(() -> gateway.cancelOrder("bet-1", "1.234", "cancel"))
        .isInstanceOf(VenueException.class);
    verify(venue, times(2)).cancelOrder(anyString(), eq("bet-1"), eq("1.234"));
    assertThat(meterRegistry.counter("hedgebot.venue.failures").count()).isEqualTo(1.0);
  }

  @Test
  void shouldNotRetryPermanentFailure() {
    when(session.token()).thenReturn("t1");
    when(venue.placeOrder(anyString(), any()))
        .thenThrow(new VenueException("INVALID_INPUT", "bad request", false));
    OrderRequest request = new OrderRequest("1.234", 47972L, Side.BACK, 10, 2.0, PersistenceType.LAPSE, "ref");

    assertThatThrownBy(() -> gateway.placeOrder(request, "entry")).isInstanceOf(VenueException.class);
    verify(venue, times(1)).placeOrder(anyString(), any());
  }

  @Test
  void shouldPickRequestedOrderFromCurrentOrders() {
    when(session.token()).thenReturn("t1");
    CurrentOrder other = new CurrentOrder("bet-2", Side.LAY, OrderStatus.EXECUTABLE, 1.9, 0, 10, null);
    CurrentOrder mine = new CurrentOrder("bet-1", Side.BACK, OrderStatus.EXECUTION_COMPLETE, 2.0, 10, 0, 2.0);
    when(venue.listCurrentOrders("t1", List.of("bet-1"))).thenReturn(List.of(other, mine));
    when(venue.listClearedOrders("t1", List.of("bet-9"))).thenReturn(null);

    assertThat(gateway.currentOrder("bet-1", "check")).contains(mine);
    assertThat(gateway.clearedOrder("bet-9", "cleared")).isEqualTo(Optional.empty());
  }
}
