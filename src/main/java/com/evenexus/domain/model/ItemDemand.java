package com.evenexus.domain.model;

import lombok.Value;

/**
 * A requested quantity of one item type. After normalization a bundle holds at most
 * one demand per type id.
 */
@Value
public class ItemDemand {

    int typeId;

    long quantity;

    public static ItemDemand of(int typeId, long quantity) {
        return new ItemDemand(typeId, quantity);
    }
}
