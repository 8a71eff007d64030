package com.hedgebot.engine.sim;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.venue.CancelResult;
import com.hedgebot.core.venue.ClearedOrder;
import com.hedgebot.core.venue.CurrentOrder;
import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.MarketStatus;
import com.hedgebot.core.venue.MarketVenue;
import com.hedgebot.core.venue.OrderRequest;
import com.hedgebot.core.venue.OrderStatus;
import com.hedgebot.core.venue.PlaceResult;
import com.hedgebot.core.venue.PriceSize;
import com.hedgebot.core.venue.RunnerBook;
import com.hedgebot.core.venue.Side;
import com.hedgebot.core.venue.VenueException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * In-memory exchange for paper trading and tests.
 *
 * Books are pushed from outside ({@link #publishBook}); orders match against the pushed prices. A BACK order fills
 * against back offers at or above its price, a LAY order against lay offers at or below it. With {@code fillOnCross}
 * resting orders are re-matched on every pushed book. A repeated {@code customerRef} on the same market returns the
 * order already placed under it.
 */
@Slf4j
public class PaperMarketVenue implements MarketVenue {

    private final HedgeBotProperties.Paper config;

    private final Map<String, MarketBook> books = new LinkedHashMap<>();
    private final Map<String, PaperOrder> ordersById = new LinkedHashMap<>();

    public PaperMarketVenue(@NonNull HedgeBotProperties.Paper config) {
        this.config = config;
        log.info("paper venue enabled (fillOnCross={}, hideCompletedOrders={})",
                config.fillOnCross(), config.hideCompletedOrders());
    }

    public synchronized void publishBook(MarketBook book) {
        Objects.requireNonNull(book, "book");
        books.put(book.marketId(), book);
        if (book.isClosed()) {
            lapseOpenOrders(book.marketId());
            return;
        }
        if (Boolean.TRUE.equals(config.fillOnCross())) {
            for (PaperOrder order : ordersById.values()) {
                if (order.marketId.equals(book.marketId()) && order.isOpen()) {
                    match(order, book);
                }
            }
        }
    }

    public synchronized void closeMarket(String marketId) {
        MarketBook book = books.get(marketId);
        if (book == null) {
            return;
        }
        publishBook(new MarketBook(marketId, MarketStatus.CLOSED, book.inplay(), book.totalMatched(), book.runners()));
    }

    @Override
    public synchronized MarketBook listMarketBook(String sessionToken, String marketId) {
        MarketBook book = books.get(marketId);
        if (book == null) {
            throw new VenueException("MARKET_NOT_FOUND", "no paper book for market " + marketId, false);
        }
        return book;
    }

    @Override
    public synchronized PlaceResult placeOrder(String sessionToken, OrderRequest request) {
        MarketBook book = books.get(request.marketId());
        if (book == null) {
            return PlaceResult.rejected("MARKET_NOT_FOUND");
        }
        if (book.status() != MarketStatus.OPEN) {
            return PlaceResult.rejected("MARKET_NOT_OPEN");
        }
        if (request.customerRef() != null) {
            for (PaperOrder existing : ordersById.values()) {
                if (request.customerRef().equals(existing.customerRef) && existing.marketId.equals(request.marketId())) {
                    log.info("paper order deduplicated on customerRef {} (betId={})", request.customerRef(), existing.betId);
                    return PlaceResult.accepted(existing.betId, existing.sizeMatched, existing.averagePrice());
                }
            }
        }
        PaperOrder order = new PaperOrder("paper-" + UUID.randomUUID(), request);
        ordersById.put(order.betId, order);
        match(order, book);
        log.info("paper order placed (betId={}, side={}, size={}, price={}, matched={})",
                order.betId, order.side, order.size, order.price, order.sizeMatched);
        return PlaceResult.accepted(order.betId, order.sizeMatched, order.averagePrice());
    }

    @Override
    public synchronized CancelResult cancelOrder(String sessionToken, String betId, String marketId) {
        PaperOrder order = ordersById.get(betId);
        if (order == null) {
            return CancelResult.failed("INVALID_BET_ID");
        }
        if (!order.isOpen()) {
            return CancelResult.failed("BET_TAKEN_OR_LAPSED");
        }
        double cancelled = order.sizeRemaining;
        order.sizeRemaining = 0.0;
        order.status = OrderStatus.EXECUTION_COMPLETE;
        log.info("paper order cancelled (betId={}, cancelled={}, matched={})", betId, cancelled, order.sizeMatched);
        return CancelResult.cancelled(cancelled);
    }

    @Override
    public synchronized List<CurrentOrder> listCurrentOrders(String sessionToken, Collection<String> betIds) {
        List<CurrentOrder> out = new ArrayList<>();
        for (String betId : betIds) {
            PaperOrder order = ordersById.get(betId);
            if (order == null) {
                continue;
            }
            if (!order.isOpen() && Boolean.TRUE.equals(config.hideCompletedOrders())) {
                continue;
            }
            out.add(new CurrentOrder(order.betId, order.side, order.status, order.price, order.sizeMatched,
                    order.sizeRemaining, order.averagePrice()));
        }
        return out;
    }

    @Override
    public synchronized List<ClearedOrder> listClearedOrders(String sessionToken, Collection<String> betIds) {
        List<ClearedOrder> out = new ArrayList<>();
        for (String betId : betIds) {
            PaperOrder order = ordersById.get(betId);
            if (order != null && !order.isOpen() && order.sizeMatched > 0) {
                out.add(new ClearedOrder(order.betId, order.side, order.sizeMatched, order.averagePrice()));
            }
        }
        return out;
    }

    public synchronized List<CurrentOrder> orders(String marketId) {
        List<CurrentOrder> out = new ArrayList<>();
        for (PaperOrder order : ordersById.values()) {
            if (order.marketId.equals(marketId)) {
                out.add(new CurrentOrder(order.betId, order.side, order.status, order.price, order.sizeMatched,
                        order.sizeRemaining, order.averagePrice()));
            }
        }
        return out;
    }

    private void lapseOpenOrders(String marketId) {
        for (PaperOrder order : ordersById.values()) {
            if (order.marketId.equals(marketId) && order.isOpen()) {
                order.sizeRemaining = 0.0;
                order.status = OrderStatus.EXECUTION_COMPLETE;
                log.info("paper order lapsed on market close (betId={}, matched={})", order.betId, order.sizeMatched);
            }
        }
    }

    private static void match(PaperOrder order, MarketBook book) {
        RunnerBook runner = book.runner(order.selectionId).orElse(null);
        if (runner == null) {
            return;
        }
        List<PriceSize> levels = order.side == Side.BACK ? runner.availableToBack() : runner.availableToLay();
        for (PriceSize level : levels) {
            if (order.sizeRemaining <= 0) {
                break;
            }
            boolean crosses = order.side == Side.BACK ? level.price() >= order.price : level.price() <= order.price;
            if (!crosses) {
                break;
            }
            double take = round2(Math.min(order.sizeRemaining, level.size()));
            if (take <= 0) {
                continue;
            }
            order.fill(take, level.price());
        }
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.DOWN).doubleValue();
    }

    private static final class PaperOrder {
        private final String betId;
        private final String marketId;
        private final long selectionId;
        private final Side side;
        private final double size;
        private final double price;
        private final String customerRef;
        private OrderStatus status = OrderStatus.EXECUTABLE;
        private double sizeMatched;
        private double sizeRemaining;
        private double matchedNotional;

        private PaperOrder(String betId, OrderRequest request) {
            this.betId = betId;
            this.marketId = request.marketId();
            this.selectionId = request.selectionId();
            this.side = request.side();
            this.size = request.size();
            this.price = request.price();
            this.customerRef = request.customerRef();
            this.sizeRemaining = request.size();
        }

        private boolean isOpen() {
            return status == OrderStatus.EXECUTABLE && sizeRemaining > 0;
        }

        private void fill(double amount, double atPrice) {
            sizeMatched = round2(sizeMatched + amount);
            sizeRemaining = round2(Math.max(0.0, size - sizeMatched));
            matchedNotional += amount * atPrice;
            if (sizeRemaining <= 0) {
                status = OrderStatus.EXECUTION_COMPLETE;
            }
        }

        private Double averagePrice() {
            if (sizeMatched <= 0) {
                return null;
            }
            return BigDecimal.valueOf(matchedNotional / sizeMatched).setScale(2, RoundingMode.HALF_UP).doubleValue();
        }
    }
}
