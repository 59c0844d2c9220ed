package com.evenexus.api.controller;

import com.evenexus.api.dto.request.AppraisalItemRequest;
import com.evenexus.api.dto.request.AppraisalRequest;
import com.evenexus.api.dto.request.DiscountUpdateRequest;
import com.evenexus.api.dto.response.ApiResponse;
import com.evenexus.api.dto.response.AppraisalResponse;
import com.evenexus.api.dto.response.AppraisalWarning;
import com.evenexus.api.dto.response.DiscountResponse;
import com.evenexus.appraisal.AppraisalService;
import com.evenexus.appraisal.DiscountSetting;
import com.evenexus.appraisal.ValuationPresenter;
import com.evenexus.config.AppraisalConfig;
import com.evenexus.domain.model.ItemDemand;
import com.evenexus.domain.model.PortfolioValuation;
import com.evenexus.domain.model.TradingHub;
import com.evenexus.mapper.AppraisalResponseMapper;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for contract appraisal.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/appraisals -- value a bundle of items at a hub</li>
 *   <li>GET /api/appraisals/discount -- the session's discount percent</li>
 *   <li>PUT /api/appraisals/discount -- set the session's discount from raw user input</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/appraisals")
public class AppraisalController {

    private final AppraisalService appraisalService;
    private final DiscountSetting discountSetting;
    private final ValuationPresenter valuationPresenter;
    private final AppraisalResponseMapper appraisalResponseMapper;
    private final AppraisalConfig appraisalConfig;

    public AppraisalController(
            AppraisalService appraisalService,
            DiscountSetting discountSetting,
            ValuationPresenter valuationPresenter,
            AppraisalResponseMapper appraisalResponseMapper,
            AppraisalConfig appraisalConfig) {
        this.appraisalService = appraisalService;
        this.discountSetting = discountSetting;
        this.valuationPresenter = valuationPresenter;
        this.appraisalResponseMapper = appraisalResponseMapper;
        this.appraisalConfig = appraisalConfig;
    }

    /**
     * Values the submitted items. Region and system fall back to the configured hub, and the
     * discount to the session's setting, when not given. Unfilled demand is still a 200, with
     * liquidity warnings on the envelope.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<AppraisalResponse>> appraise(@Valid @RequestBody AppraisalRequest request) {
        TradingHub defaultHub = appraisalConfig.defaultHub();
        TradingHub hub = TradingHub.of(
                request.getRegionId() != null ? request.getRegionId() : defaultHub.getRegionId(),
                request.getSystemId() != null ? request.getSystemId() : defaultHub.getSystemId());

        List<ItemDemand> items = request.getItems().stream()
                .map(AppraisalController::toDemand)
                .toList();
        int percent = discountSetting.resolve(request.getDiscountPercent());

        PortfolioValuation valuation = appraisalService.valuate(items, hub, percent);
        return ResponseEntity.ok(ApiResponse.of(
                appraisalResponseMapper.toResponse(valuation, hub), AppraisalWarning.of(valuation)));
    }

    @GetMapping("/discount")
    public ResponseEntity<ApiResponse<DiscountResponse>> getDiscount() {
        return ResponseEntity.ok(ApiResponse.of(discountResponse(null)));
    }

    /**
     * Sets the discount from raw text. Rejected input still returns 200, with
     * {@code accepted=false}, the previous percent and a DISCOUNT_REJECTED warning.
     */
    @PutMapping("/discount")
    public ResponseEntity<ApiResponse<DiscountResponse>> updateDiscount(
            @Valid @RequestBody DiscountUpdateRequest request) {
        boolean accepted = discountSetting.accept(request.getValue());
        List<AppraisalWarning> warnings = accepted ? List.of() : List.of(AppraisalWarning.DISCOUNT_REJECTED);
        return ResponseEntity.ok(ApiResponse.of(discountResponse(accepted), warnings));
    }

    private DiscountResponse discountResponse(Boolean accepted) {
        int percent = discountSetting.getPercent();
        return DiscountResponse.builder()
                .accepted(accepted)
                .percent(percent)
                .effectivePercent(valuationPresenter.effectivePercent(percent))
                .cap(valuationPresenter.getDiscountCap())
                .multiplier(valuationPresenter.multiplier(percent))
                .build();
    }

    private static ItemDemand toDemand(AppraisalItemRequest item) {
        return ItemDemand.of(item.getTypeId(), item.getQuantity());
    }
}
