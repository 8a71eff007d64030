package com.hedgebot.engine.execution;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.settlement.Fill;
import com.hedgebot.core.settlement.SettlementCalculator;
import com.hedgebot.core.venue.CancelResult;
import com.hedgebot.core.venue.ClearedOrder;
import com.hedgebot.core.venue.CurrentOrder;
import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.OrderRequest;
import com.hedgebot.core.venue.PlaceResult;
import com.hedgebot.core.venue.RunnerBook;
import com.hedgebot.core.venue.VenueException;
import com.hedgebot.core.venue.VenueGateway;
import com.hedgebot.engine.trade.PlacedOrder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Places orders and establishes how much of them really matched.
 *
 * The venue's placement response is never trusted for the matched size: every answer comes from polling the order,
 * and an order that vanished from the current-orders view is looked up among cleared orders before it counts as
 * gone. Cancels are confirmed the same way.
 */
@Slf4j
public class OrderVerificationController {

    /**
     * Sizes below this are treated as nothing (venue sizes are in pence).
     */
    static final double SIZE_EPSILON = 0.005;

    private static final Set<String> PERMANENT_CANCEL_ERRORS = Set.of("BET_ACTION_ERROR", "INVALID_BET_ID", "NO_MARKET_ID");
    private static final long CANCEL_BACKOFF_MILLIS = 2_000L;

    private final VenueGateway gateway;
    private final HedgeBotProperties.Verification verification;
    private final Sleeper sleeper;
    private final Clock clock;

    public OrderVerificationController(@NonNull VenueGateway gateway,
                                       @NonNull HedgeBotProperties.Verification verification,
                                       @NonNull Sleeper sleeper,
                                       @NonNull Clock clock) {
        this.gateway = gateway;
        this.verification = verification;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Single placement without verification, for resting orders (hedges) that are checked on later ticks.
     */
    public PlaceResult place(OrderRequest request, String label) {
        PlaceResult result = gateway.placeOrder(request, label);
        if (result.success()) {
            log.info("{} placed (betId={}, side={}, size={}, price={}, ref={})",
                    label, result.betId(), request.side(), request.size(), request.price(), request.customerRef());
        } else {
            log.warn("{} rejected (side={}, size={}, price={}, errorCode={})",
                    label, request.side(), request.size(), request.price(), result.errorCode());
        }
        return result;
    }

    public VerificationResult placeAndVerify(OrderRequest request, long maxWaitMillis, long pollMillis)
            throws InterruptedException {
        return placeAndVerify(request, VerifyOptions.once(maxWaitMillis, pollMillis), order -> {
        });
    }

    /**
     * Place, wait for the match, cancel a remainder and optionally re-place it at a fresh price.
     *
     * @param onPlaced called with every accepted order before any waiting starts
     */
    public VerificationResult placeAndVerify(OrderRequest request, VerifyOptions options, Consumer<PlacedOrder> onPlaced)
            throws InterruptedException {
        List<Fill> fills = new ArrayList<>();
        List<String> betIds = new ArrayList<>();
        double requestedSize = request.size();
        OrderRequest current = request;
        long waitMillis = options.maxWaitMillis();
        int retries = 0;
        String errorCode = null;

        while (true) {
            PlaceResult placed = gateway.placeOrder(current, "place " + current.customerRef());
            if (!placed.success() || placed.betId() == null) {
                log.warn("placement rejected (ref={}, size={}, price={}, errorCode={})",
                        current.customerRef(), current.size(), current.price(), placed.errorCode());
                if (betIds.isEmpty()) {
                    return VerificationResult.rejected(placed.errorCode(), requestedSize);
                }
                errorCode = placed.errorCode();
                break;
            }
            String betId = placed.betId();
            betIds.add(betId);
            onPlaced.accept(new PlacedOrder(betId, current.price(), current.size(), current.customerRef(), clock.instant()));
            log.info("order placed, verifying (betId={}, side={}, size={}, price={}, waitMillis={})",
                    betId, current.side(), current.size(), current.price(), waitMillis);

            OrderView view = awaitMatch(betId, current.size(), waitMillis, options.pollMillis());
            if (view.state() == OrderView.State.FULLY_MATCHED || view.state() == OrderView.State.CLOSED_WITH_PARTIAL
                    || view.state() == OrderView.State.CLOSED_UNMATCHED) {
                fills.add(view.fill());
            } else {
                CancelConfirmation cancel = cancelAndConfirm(betId, current.marketId(), current.size());
                if (!cancel.closed()) {
                    log.warn("cancel of unmatched remainder not confirmed (betId={}, attempts={}, reason={})",
                            betId, cancel.attempts(), cancel.reason());
                    fills.add(bestKnownFill(view, cancel.lastView()));
                    return result(fills, betIds, requestedSize, unconfirmed(cancel), errorCode);
                }
                fills.add(bestKnownFill(view, cancel.lastView()));
            }

            double remaining = remaining(requestedSize, fills);
            if (remaining <= SIZE_EPSILON || retries >= options.maxRetries() || options.repricer() == null) {
                break;
            }
            Double newPrice = reprice(current, options);
            if (newPrice == null || Double.compare(newPrice, current.price()) == 0) {
                log.info("remainder not re-placed, price unchanged (betId={}, remaining={}, price={})",
                        betId, remaining, current.price());
                break;
            }
            retries++;
            current = current.withSizeAndPrice(remaining, newPrice, CustomerRefs.nextAttempt(current.customerRef()));
            waitMillis = options.retryWaitMillis();
            log.info("re-placing unmatched remainder (retry={}, size={}, price={})", retries, remaining, newPrice);
        }
        Fill total = SettlementCalculator.aggregate(fills);
        VerificationOutcome outcome = outcomeOf(total, requestedSize);
        return result(fills, betIds, requestedSize, outcome, errorCode);
    }

    /**
     * Settle a set of previously placed orders: any still open is cancelled and confirmed, then all fills are summed.
     */
    public VerificationResult resolve(List<PlacedOrder> orders, String marketId, double requestedSize)
            throws InterruptedException {
        List<Fill> fills = new ArrayList<>();
        List<String> betIds = new ArrayList<>();
        for (PlacedOrder order : orders) {
            betIds.add(order.betId());
            OrderView view = inspect(order.betId(), order.size());
            if (view.isClosed()) {
                fills.add(view.fill());
                continue;
            }
            CancelConfirmation cancel = cancelAndConfirm(order.betId(), marketId, order.size());
            fills.add(bestKnownFill(view, cancel.lastView()));
            if (!cancel.closed()) {
                log.warn("recorded order still unresolved (betId={}, reason={})", order.betId(), cancel.reason());
                return result(fills, betIds, requestedSize, unconfirmed(cancel), null);
            }
        }
        Fill total = SettlementCalculator.aggregate(fills);
        return result(fills, betIds, requestedSize, outcomeOf(total, requestedSize), null);
    }

    /**
     * Cancel an order and keep re-checking until it is confirmed closed, it has been missing from both venue
     * views for {@code notFoundThreshold} consecutive reads, or the confirmation deadline passes. Only the first
     * of these counts as closed.
     */
    public CancelConfirmation cancelAndConfirm(String betId, String marketId, double requestedSize)
            throws InterruptedException {
        long start = clock.millis();
        long deadline = start + verification.cancelConfirmMillis();
        long nextCancelAt = start;
        int attempts = 0;
        int notFound = 0;
        boolean reissue = true;
        OrderView last = OrderView.notFound(betId);

        while (true) {
            long now = clock.millis();
            if (reissue && attempts < verification.maxCancelAttempts() && now >= nextCancelAt) {
                attempts++;
                reissue = issueCancel(betId, marketId, attempts);
                nextCancelAt = now + CANCEL_BACKOFF_MILLIS * attempts;
            }
            try {
                last = inspect(betId, requestedSize);
                if (last.isNotFound()) {
                    notFound++;
                    if (notFound >= verification.notFoundThreshold()) {
                        log.warn("order absent from both views, fill unknown (betId={}, reads={})", betId, notFound);
                        return new CancelConfirmation(false, attempts, clock.millis() - start, last,
                                CancelConfirmation.NOT_FOUND);
                    }
                } else {
                    notFound = 0;
                    if (last.isClosed()) {
                        return new CancelConfirmation(true, attempts, clock.millis() - start, last, last.state().name());
                    }
                }
            } catch (VenueException e) {
                log.warn("order check failed during cancel confirmation (betId={}): {}", betId, e.getMessage());
            }
            if (clock.millis() >= deadline) {
                return new CancelConfirmation(false, attempts, clock.millis() - start, last, "DEADLINE");
            }
            sleeper.sleep(verification.cancelPollMillis());
        }
    }

    /**
     * Current state of an order: current orders first, then cleared orders, otherwise {@code NOT_FOUND}.
     */
    public OrderView inspect(String betId, double requestedSize) {
        Optional<CurrentOrder> current = gateway.currentOrder(betId, "check " + betId);
        if (current.isPresent()) {
            CurrentOrder order = current.get();
            if (order.isOpen()) {
                return new OrderView(betId, OrderView.State.OPEN, order.sizeMatched(), order.sizeRemaining(),
                        order.averagePriceMatched());
            }
            Double price = order.averagePriceMatched() != null ? order.averagePriceMatched() : order.priceRequested();
            return closedView(betId, order.sizeMatched(), requestedSize, price);
        }
        Optional<ClearedOrder> cleared = gateway.clearedOrder(betId, "cleared " + betId);
        if (cleared.isPresent()) {
            ClearedOrder order = cleared.get();
            log.debug("order found in cleared orders (betId={}, sizeSettled={})", betId, order.sizeSettled());
            return closedView(betId, order.sizeSettled(), requestedSize, order.priceMatched());
        }
        return OrderView.notFound(betId);
    }

    private static VerificationOutcome unconfirmed(CancelConfirmation cancel) {
        return cancel.missing() ? VerificationOutcome.UNVERIFIED : VerificationOutcome.CANCEL_UNCONFIRMED;
    }

    private OrderView awaitMatch(String betId, double size, long maxWaitMillis, long pollMillis) throws InterruptedException {
        long deadline = clock.millis() + maxWaitMillis;
        OrderView last = OrderView.notFound(betId);
        while (true) {
            try {
                OrderView view = inspect(betId, size);
                if (!view.isNotFound()) {
                    last = view;
                }
                if (view.isClosed()) {
                    return view;
                }
            } catch (VenueException e) {
                log.warn("order check failed while verifying (betId={}): {}", betId, e.getMessage());
            }
            if (clock.millis() >= deadline) {
                return last;
            }
            sleeper.sleep(pollMillis);
        }
    }

    private boolean issueCancel(String betId, String marketId, int attempt) {
        try {
            CancelResult result = gateway.cancelOrder(betId, marketId, "cancel " + betId);
            if (result.success()) {
                log.info("cancel issued (betId={}, attempt={}, sizeCancelled={})", betId, attempt, result.sizeCancelled());
                return true;
            }
            if (PERMANENT_CANCEL_ERRORS.contains(result.errorCode())) {
                log.info("cancel rejected permanently, polling only (betId={}, errorCode={})", betId, result.errorCode());
                return false;
            }
            log.warn("cancel rejected (betId={}, attempt={}, errorCode={})", betId, attempt, result.errorCode());
        } catch (VenueException e) {
            log.warn("cancel call failed (betId={}, attempt={}): {}", betId, attempt, e.getMessage());
        }
        return true;
    }

    private Double reprice(OrderRequest request, VerifyOptions options) {
        MarketBook book = gateway.marketBook(request.marketId(), "reprice " + request.marketId());
        Optional<RunnerBook> runner = book.runner(request.selectionId());
        return runner.map(options.repricer()).orElse(null);
    }

    private static OrderView closedView(String betId, double matched, double requestedSize, Double price) {
        OrderView.State state;
        if (matched <= SIZE_EPSILON) {
            state = OrderView.State.CLOSED_UNMATCHED;
        } else if (matched >= requestedSize - SIZE_EPSILON) {
            state = OrderView.State.FULLY_MATCHED;
        } else {
            state = OrderView.State.CLOSED_WITH_PARTIAL;
        }
        return new OrderView(betId, state, matched, 0.0, price);
    }

    /**
     * A not-found read after cancelling says nothing about what matched before; keep the last real observation.
     */
    private static Fill bestKnownFill(OrderView beforeCancel, OrderView afterCancel) {
        if (afterCancel != null && !afterCancel.isNotFound()) {
            return afterCancel.fill();
        }
        return beforeCancel == null ? Fill.NONE : beforeCancel.fill();
    }

    private static double remaining(double requestedSize, List<Fill> fills) {
        BigDecimal matched = BigDecimal.ZERO;
        for (Fill fill : fills) {
            matched = matched.add(BigDecimal.valueOf(fill.size()));
        }
        BigDecimal remaining = BigDecimal.valueOf(requestedSize).subtract(matched).setScale(2, RoundingMode.HALF_UP);
        return Math.max(0.0, remaining.doubleValue());
    }

    private static VerificationOutcome outcomeOf(Fill total, double requestedSize) {
        if (total.isEmpty()) {
            return VerificationOutcome.NONE;
        }
        return total.size() >= requestedSize - SIZE_EPSILON ? VerificationOutcome.FILLED : VerificationOutcome.PARTIAL;
    }

    private static VerificationResult result(List<Fill> fills, List<String> betIds, double requestedSize,
                                             VerificationOutcome outcome, String errorCode) {
        Fill total = SettlementCalculator.aggregate(fills);
        Double price = total.isEmpty() ? null : total.price();
        return new VerificationResult(total.size(), price, remaining(requestedSize, fills), outcome, betIds, errorCode);
    }
}
