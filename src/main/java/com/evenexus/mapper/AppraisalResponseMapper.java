package com.evenexus.mapper;

import com.evenexus.api.dto.response.AppraisalResponse;
import com.evenexus.api.dto.response.ItemValuationResponse;
import com.evenexus.domain.model.ItemValuation;
import com.evenexus.domain.model.PortfolioValuation;
import com.evenexus.domain.model.TradingHub;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from valuation results to the appraisal API response.
 */
@Mapper
public interface AppraisalResponseMapper {

    @Mapping(source = "valuation.insufficientLiquidity", target = "hasInsufficientLiquidity")
    @Mapping(source = "hub.regionId", target = "regionId")
    @Mapping(source = "hub.systemId", target = "systemId")
    AppraisalResponse toResponse(PortfolioValuation valuation, TradingHub hub);

    @Mapping(target = "averageBuyPrice", expression = "java(item.averageBuyPrice())")
    @Mapping(target = "averageSellPrice", expression = "java(item.averageSellPrice())")
    ItemValuationResponse toItemResponse(ItemValuation item);
}
