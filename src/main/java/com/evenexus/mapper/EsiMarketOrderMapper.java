package com.evenexus.mapper;

import com.evenexus.domain.model.MarketOrder;
import com.evenexus.market.EsiMarketOrder;
import java.math.BigDecimal;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from ESI order payloads to the {@link MarketOrder} domain model.
 *
 * <p>ESI publishes prices as JSON doubles; they are converted with
 * {@link BigDecimal#valueOf(double)} so a price of 5.01 stays 5.01.
 */
@Mapper
public interface EsiMarketOrderMapper {

    @Mapping(source = "price", target = "price", qualifiedByName = "toPrice")
    MarketOrder toDomain(EsiMarketOrder order);

    List<MarketOrder> toDomainList(List<EsiMarketOrder> orders);

    @Named("toPrice")
    default BigDecimal toPrice(double price) {
        return BigDecimal.valueOf(price);
    }
}
