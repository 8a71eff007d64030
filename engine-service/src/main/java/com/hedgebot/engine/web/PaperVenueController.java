package com.hedgebot.engine.web;

import com.hedgebot.core.venue.CurrentOrder;
import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.MarketStatus;
import com.hedgebot.core.venue.RunnerBook;
import com.hedgebot.engine.sim.PaperMarketVenue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Feeds the paper venue. Only present in PAPER mode.
 */
@RestController
@RequestMapping("/api/paper")
@Validated
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "hedgebot", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperVenueController {

    private final @NonNull PaperMarketVenue venue;

    @PostMapping("/books/{marketId}")
    public ResponseEntity<MarketBook> publishBook(
            @PathVariable("marketId") String marketId,
            @Valid @RequestBody BookRequest request
    ) {
        MarketBook book = new MarketBook(marketId, MarketStatus.parse(request.status()),
                Boolean.TRUE.equals(request.inplay()), request.totalMatched() == null ? 0.0 : request.totalMatched(),
                request.runners());
        venue.publishBook(book);
        return ResponseEntity.ok(book);
    }

    @PostMapping("/markets/{marketId}/close")
    public ResponseEntity<List<CurrentOrder>> closeMarket(@PathVariable("marketId") String marketId) {
        venue.closeMarket(marketId);
        return ResponseEntity.ok(venue.orders(marketId));
    }

    @GetMapping("/markets/{marketId}/orders")
    public ResponseEntity<List<CurrentOrder>> orders(@PathVariable("marketId") String marketId) {
        return ResponseEntity.ok(venue.orders(marketId));
    }

    public record BookRequest(
            String status,
            Boolean inplay,
            @PositiveOrZero Double totalMatched,
            @NotEmpty List<RunnerBook> runners
    ) {}
}
