package com.hedgebot.core.venue;

import java.util.Collection;
import java.util.List;

/**
 * Exchange operations the engine relies on. Implementations own the wire transport and
 * report failures as {@link VenueException}; placement and cancellation rejections come back
 * as results instead.
 */
public interface MarketVenue {

  MarketBook listMarketBook(String sessionToken, String marketId);

  PlaceResult placeOrder(String sessionToken, OrderRequest request);

  CancelResult cancelOrder(String sessionToken, String betId, String marketId);

  List<CurrentOrder> listCurrentOrders(String sessionToken, Collection<String> betIds);

  List<ClearedOrder> listClearedOrders(String sessionToken, Collection<String> betIds);
}
