package com.evenexus.market;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Wire shape of an entry from ESI {@code GET /markets/{region_id}/orders/}. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EsiMarketOrder {

    @JsonProperty("order_id")
    private long orderId;

    @JsonProperty("type_id")
    private int typeId;

    @JsonProperty("location_id")
    private long locationId;

    @JsonProperty("system_id")
    private int systemId;

    @JsonProperty("is_buy_order")
    private boolean buyOrder;

    private double price;

    @JsonProperty("volume_remain")
    private long volumeRemain;

    @JsonProperty("volume_total")
    private long volumeTotal;

    @JsonProperty("min_volume")
    private int minVolume;

    private int duration;

    private String range;

    private Instant issued;
}
