package com.evenexus.api.controller;

import com.evenexus.api.dto.response.ApiResponse;
import com.evenexus.api.dto.response.ItemPriceResponse;
import com.evenexus.market.MarketPriceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for single-item market prices.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/market-data/prices/{typeId} -- best, average and optional quantity-weighted
 *       prices at a hub</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-data")
public class MarketPriceController {

    private final MarketPriceService marketPriceService;

    public MarketPriceController(MarketPriceService marketPriceService) {
        this.marketPriceService = marketPriceService;
    }

    @GetMapping("/prices/{typeId}")
    public ResponseEntity<ApiResponse<ItemPriceResponse>> getPrices(
            @PathVariable int typeId,
            @RequestParam(required = false) Integer regionId,
            @RequestParam(required = false) Integer systemId,
            @RequestParam(required = false) Long quantity) {
        return ResponseEntity.ok(ApiResponse.of(marketPriceService.getPrices(typeId, regionId, systemId, quantity)));
    }
}
