package com.marginengine.api.controller;

import com.marginengine.api.dto.request.PriceTickRequest;
import com.marginengine.domain.model.MarkPrice;
import com.marginengine.exception.ResourceNotFoundException;
import com.marginengine.pricefeed.PriceFeedAdapter;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Oracle ingress and latest mark lookup.
 * <ul>
 *   <li>POST /api/prices -- submit one tick; stale or duplicate ticks are acknowledged
 *       with {@code accepted=false}</li>
 *   <li>GET /api/prices/{base}/{quote} -- latest accepted mark</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/prices")
public class PriceFeedController {

    private final PriceFeedAdapter priceFeedAdapter;

    public PriceFeedController(PriceFeedAdapter priceFeedAdapter) {
        this.priceFeedAdapter = priceFeedAdapter;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> submitTick(@Valid @RequestBody PriceTickRequest request) {
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : Instant.now();
        boolean accepted = priceFeedAdapter.onTick(request.getSymbol(), request.getPrice(), timestamp);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("symbol", PriceFeedAdapter.normalizeSymbol(request.getSymbol()));
        result.put("accepted", accepted);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{base}/{quote}")
    public ResponseEntity<MarkPrice> getLatest(@PathVariable String base, @PathVariable String quote) {
        String pair = base + "/" + quote;
        return ResponseEntity.ok(
                priceFeedAdapter.latest(pair).orElseThrow(() -> new ResourceNotFoundException("Mark price", pair)));
    }
}
