package com.hedgebot.engine.execution;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.venue.CancelResult;
import com.hedgebot.core.venue.ClearedOrder;
import com.hedgebot.core.venue.CurrentOrder;
import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.MarketStatus;
import com.hedgebot.core.venue.MarketVenue;
import com.hedgebot.core.venue.OrderRequest;
import com.hedgebot.core.venue.OrderStatus;
import com.hedgebot.core.venue.PersistenceType;
import com.hedgebot.core.venue.PlaceResult;
import com.hedgebot.core.venue.PriceSize;
import com.hedgebot.core.venue.RunnerBook;
import com.hedgebot.core.venue.Side;
import com.hedgebot.core.venue.VenueGateway;
import com.hedgebot.core.venue.VenueSession;
import com.hedgebot.engine.sim.PaperMarketVenue;
import com.hedgebot.engine.support.MutableClock;
import com.hedgebot.engine.trade.PlacedOrder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderVerificationControllerTest {

    private static final String MARKET_ID = "1.234567";
    private static final long SELECTION_ID = 47972L;

    private final HedgeBotProperties.Verification verification =
            new HedgeBotProperties.Verification(2_000L, 2_000L, 500L, 3_000L, 500L, 5, 3, 1);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-14T15:20:00Z"));

    @Mock
    private MarketVenue venue;

    private OrderVerificationController controller;

    @BeforeEach
    void setUp() {
        controller = controllerFor(venue);
    }

    @Test
    void inspectFallsBackToClearedOrders() {
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of());
        when(venue.listClearedOrders(eq("token"), any())).thenReturn(List.of(new ClearedOrder("b1", Side.BACK, 200.0, 2.0)));

        OrderView view = controller.inspect("b1", 200.0);

        assertThat(view.state()).isEqualTo(OrderView.State.FULLY_MATCHED);
        assertThat(view.sizeMatched()).isEqualTo(200.0);
        assertThat(view.averagePrice()).isEqualTo(2.0);
    }

    @Test
    void inspectReportsOpenOrderWithoutConsultingClearedView() {
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of(
                new CurrentOrder("b1", Side.LAY, OrderStatus.EXECUTABLE, 1.82, 50.0, 169.78, 1.82)));

        OrderView view = controller.inspect("b1", 219.78);

        assertThat(view.state()).isEqualTo(OrderView.State.OPEN);
        assertThat(view.sizeMatched()).isEqualTo(50.0);
        verify(venue, never()).listClearedOrders(anyString(), any());
    }

    @Test
    void inspectReportsNotFoundWhenAbsentFromBothViews() {
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of());
        when(venue.listClearedOrders(eq("token"), any())).thenReturn(List.of());

        OrderView view = controller.inspect("b1", 200.0);

        assertThat(view.isNotFound()).isTrue();
        assertThat(view.fill().isEmpty()).isTrue();
    }

    @Test
    void rejectedPlacementReportsErrorWithoutRecordingAnOrder() throws Exception {
        when(venue.placeOrder(eq("token"), any())).thenReturn(PlaceResult.rejected("INSUFFICIENT_FUNDS"));
        List<PlacedOrder> placed = new ArrayList<>();

        VerificationResult result = controller.placeAndVerify(backAt(2.0, 200.0),
                VerifyOptions.once(2_000L, 500L), placed::add);

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.REJECTED);
        assertThat(result.errorCode()).isEqualTo("INSUFFICIENT_FUNDS");
        assertThat(result.remainingSize()).isEqualTo(200.0);
        assertThat(placed).isEmpty();
    }

    @Test
    void repeatedNotFoundReadsAreMissingNotClosed() throws Exception {
        when(venue.cancelOrder("token", "b1", MARKET_ID)).thenReturn(CancelResult.cancelled(200.0));
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of());
        when(venue.listClearedOrders(eq("token"), any())).thenReturn(List.of());

        CancelConfirmation cancel = controller.cancelAndConfirm("b1", MARKET_ID, 200.0);

        assertThat(cancel.closed()).isFalse();
        assertThat(cancel.missing()).isTrue();
        assertThat(cancel.reason()).isEqualTo("NOT_FOUND");
        assertThat(cancel.attempts()).isEqualTo(1);
        assertThat(cancel.lastView().isNotFound()).isTrue();
        verify(venue, times(3)).listCurrentOrders(eq("token"), any());
    }

    @Test
    void orderVanishingFromBothViewsIsNotReportedAsUnmatched() throws Exception {
        when(venue.placeOrder(eq("token"), any())).thenReturn(PlaceResult.accepted("b1", 0.0, null));
        when(venue.cancelOrder("token", "b1", MARKET_ID)).thenReturn(CancelResult.failed("BET_TAKEN_OR_LAPSED"));
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of());
        when(venue.listClearedOrders(eq("token"), any())).thenReturn(List.of());
        List<PlacedOrder> placed = new ArrayList<>();

        VerificationResult result = controller.placeAndVerify(backAt(2.0, 200.0), VerifyOptions.once(1_000L, 500L),
                placed::add);

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.UNVERIFIED);
        assertThat(result.outcome().unresolved()).isTrue();
        assertThat(result.betIds()).containsExactly("b1");
        assertThat(placed).hasSize(1);
    }

    @Test
    void resolveFlagsRecordedOrderMissingFromBothViews() throws Exception {
        when(venue.cancelOrder("token", "b1", MARKET_ID)).thenReturn(CancelResult.failed("BET_TAKEN_OR_LAPSED"));
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of());
        when(venue.listClearedOrders(eq("token"), any())).thenReturn(List.of());
        PlacedOrder recorded = new PlacedOrder("b1", 2.0, 200.0, "abcd1234-entry-0", clock.instant());

        VerificationResult result = controller.resolve(List.of(recorded), MARKET_ID, 200.0);

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.UNVERIFIED);
        assertThat(result.hasMatch()).isFalse();
    }

    @Test
    void clearedOrderWithNothingMatchedIsVerifiedNone() throws Exception {
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of());
        when(venue.listClearedOrders(eq("token"), any())).thenReturn(List.of(new ClearedOrder("b1", Side.BACK, 0.0, 2.0)));
        PlacedOrder recorded = new PlacedOrder("b1", 2.0, 200.0, "abcd1234-entry-0", clock.instant());

        VerificationResult result = controller.resolve(List.of(recorded), MARKET_ID, 200.0);

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.NONE);
        verify(venue, never()).cancelOrder(anyString(), anyString(), anyString());
    }

    @Test
    void cancelIsReissuedWithBackoffUntilDeadline() throws Exception {
        when(venue.cancelOrder("token", "b1", MARKET_ID)).thenReturn(CancelResult.failed("TIMEOUT_ERROR"));
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of(
                new CurrentOrder("b1", Side.BACK, OrderStatus.EXECUTABLE, 2.0, 0.0, 200.0, null)));

        CancelConfirmation cancel = controller.cancelAndConfirm("b1", MARKET_ID, 200.0);

        assertThat(cancel.closed()).isFalse();
        assertThat(cancel.reason()).isEqualTo("DEADLINE");
        assertThat(cancel.attempts()).isEqualTo(2);
        assertThat(cancel.elapsedMillis()).isEqualTo(3_000L);
        assertThat(cancel.lastView().isOpen()).isTrue();
    }

    @Test
    void permanentCancelErrorStopsReissuingButKeepsPolling() throws Exception {
        when(venue.cancelOrder("token", "b1", MARKET_ID)).thenReturn(CancelResult.failed("INVALID_BET_ID"));
        when(venue.listCurrentOrders(eq("token"), any()))
                .thenReturn(List.of(new CurrentOrder("b1", Side.BACK, OrderStatus.EXECUTABLE, 2.0, 0.0, 200.0, null)))
                .thenReturn(List.of(new CurrentOrder("b1", Side.BACK, OrderStatus.EXECUTION_COMPLETE, 2.0, 0.0, 0.0, null)));

        CancelConfirmation cancel = controller.cancelAndConfirm("b1", MARKET_ID, 200.0);

        assertThat(cancel.closed()).isTrue();
        assertThat(cancel.lastView().state()).isEqualTo(OrderView.State.CLOSED_UNMATCHED);
        verify(venue, times(1)).cancelOrder("token", "b1", MARKET_ID);
    }

    @Test
    void unconfirmedCancelKeepsBestKnownFill() throws Exception {
        when(venue.placeOrder(eq("token"), any())).thenReturn(PlaceResult.accepted("b1", 0.0, null));
        when(venue.cancelOrder("token", "b1", MARKET_ID)).thenReturn(CancelResult.failed("TIMEOUT_ERROR"));
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of(
                new CurrentOrder("b1", Side.BACK, OrderStatus.EXECUTABLE, 2.0, 40.0, 160.0, 2.0)));

        VerificationResult result = controller.placeAndVerify(backAt(2.0, 200.0), VerifyOptions.once(1_000L, 500L),
                order -> {
                });

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.CANCEL_UNCONFIRMED);
        assertThat(result.matchedSize()).isEqualTo(40.0);
        assertThat(result.betIds()).containsExactly("b1");
    }

    @Test
    void resolveReadsBackClosedRecordedOrderWithoutCancelling() throws Exception {
        when(venue.listCurrentOrders(eq("token"), any())).thenReturn(List.of(
                new CurrentOrder("b1", Side.BACK, OrderStatus.EXECUTION_COMPLETE, 2.0, 120.0, 0.0, 2.0)));
        PlacedOrder recorded = new PlacedOrder("b1", 2.0, 200.0, "abcd1234-entry-0", clock.instant());

        VerificationResult result = controller.resolve(List.of(recorded), MARKET_ID, 200.0);

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.PARTIAL);
        assertThat(result.matchedSize()).isEqualTo(120.0);
        assertThat(result.remainingSize()).isEqualTo(80.0);
        verify(venue, never()).cancelOrder(anyString(), anyString(), anyString());
    }

    @Test
    void unmatchedRemainderIsCancelledAndReplacedAtNewPrice() throws Exception {
        PaperMarketVenue paper = new PaperMarketVenue(new HedgeBotProperties.Paper(true, false));
        paper.publishBook(book(2.0, 120.0, 2.04));
        OrderVerificationController paperController = controllerFor(paper);
        VerifyOptions options = new VerifyOptions(2_000L, 500L, 1, 2_000L, runner -> {
            // market moves up while the remainder is being re-priced
            paper.publishBook(book(2.02, 500.0, 2.04));
            return 2.02;
        });
        List<PlacedOrder> placed = new ArrayList<>();

        VerificationResult result = paperController.placeAndVerify(backAt(2.0, 200.0), options, placed::add);

        assertThat(result.outcome()).isEqualTo(VerificationOutcome.FILLED);
        assertThat(result.matchedSize()).isEqualTo(200.0);
        assertThat(result.matchedPrice()).isEqualTo(2.008);
        assertThat(result.betIds()).hasSize(2);
        assertThat(placed).extracting(PlacedOrder::customerRef).containsExactly("abcd1234-entry-0", "abcd1234-entry-1");
        assertThat(placed).extracting(PlacedOrder::size).containsExactly(200.0, 80.0);
        assertThat(paper.orders(MARKET_ID)).noneMatch(CurrentOrder::isOpen);
    }

    private OrderVerificationController controllerFor(MarketVenue target) {
        VenueGateway gateway = new VenueGateway(target, VenueSession.fixed("token"), new SimpleMeterRegistry());
        return new OrderVerificationController(gateway, verification,
                millis -> clock.advance(Duration.ofMillis(millis)), clock);
    }

    private static OrderRequest backAt(double price, double size) {
        return new OrderRequest(MARKET_ID, SELECTION_ID, Side.BACK, size, price, PersistenceType.LAPSE,
                "abcd1234-entry-0");
    }

    private static MarketBook book(double back, double backSize, double lay) {
        RunnerBook runner = new RunnerBook(SELECTION_ID, 0.0, back, List.of(new PriceSize(back, backSize)),
                List.of(new PriceSize(lay, 1_000.0)));
        return new MarketBook(MARKET_ID, MarketStatus.OPEN, true, 50_000.0, List.of(runner));
    }
}
