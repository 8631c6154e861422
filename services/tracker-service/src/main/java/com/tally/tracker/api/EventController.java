package com.tally.tracker.api;

import com.tally.tracker.api.dto.BuyRequest;
import com.tally.tracker.api.dto.EventLoggedResponse;
import com.tally.tracker.api.dto.VisitRequest;
import com.tally.tracker.domain.EventTrackingService;
import com.tally.tracker.domain.RequestOrigin;
import com.tally.tracker.infrastructure.web.ClientAddressResolver;
import com.tally.tracker.infrastructure.web.RequestTimestampResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingest endpoints. Each call appends one event to the ledger and returns the running total.
 *
 * <p>Bodies are validated before anything touches the ledger. The client address and generation
 * time come from the request headers, see {@link ClientAddressResolver} and {@link
 * RequestTimestampResolver}.
 */
@RestController
@RequestMapping("/api/v1")
public class EventController {

    private final EventTrackingService trackingService;
    private final ClientAddressResolver clientAddressResolver;
    private final RequestTimestampResolver timestampResolver;

    public EventController(
            EventTrackingService trackingService,
            ClientAddressResolver clientAddressResolver,
            RequestTimestampResolver timestampResolver) {
        this.trackingService = trackingService;
        this.clientAddressResolver = clientAddressResolver;
        this.timestampResolver = timestampResolver;
    }

    @PostMapping("/buy")
    public EventLoggedResponse logBuy(
            @Valid @RequestBody BuyRequest body, HttpServletRequest request) {
        long total =
                trackingService.logPurchase(
                        body.userId(),
                        body.promotionId(),
                        body.productId(),
                        body.productQuantity(),
                        originOf(request));
        return new EventLoggedResponse(
                true, total, "Buy logged successfully. Total buys: " + total);
    }

    @PostMapping("/visit")
    public EventLoggedResponse logVisit(
            @Valid @RequestBody VisitRequest body, HttpServletRequest request) {
        long total = trackingService.logVisit(body.userId(), body.pageUrl(), originOf(request));
        return new EventLoggedResponse(
                true, total, "Visit logged successfully. Total events: " + total);
    }

    private RequestOrigin originOf(HttpServletRequest request) {
        return new RequestOrigin(
                clientAddressResolver.resolve(request), timestampResolver.resolve(request));
    }
}
