package com.hedgebot.engine.store;

import com.hedgebot.engine.trade.TradeEvent;

import java.util.List;

public interface TradeEventLog {

    void append(TradeEvent event);

    List<TradeEvent> findByTrade(String tradeId);
}
