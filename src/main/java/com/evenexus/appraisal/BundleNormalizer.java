package com.evenexus.appraisal;

import com.evenexus.domain.model.ItemDemand;
import com.evenexus.exception.BusinessException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Merges a bundle's item lines into one quantity per type id. */
@Component
public class BundleNormalizer {

    /**
     * Sums quantities per type id. Zero quantities are kept; they value to zero.
     *
     * @throws BusinessException if an entry is null, has a negative quantity, or the summed
     *     quantity for a type id overflows a long
     */
    public Map<Integer, Long> normalize(List<ItemDemand> items) {
        Map<Integer, Long> quantities = new LinkedHashMap<>();
        if (items == null) {
            return quantities;
        }
        for (int i = 0; i < items.size(); i++) {
            ItemDemand item = items.get(i);
            if (item == null) {
                throw new BusinessException("Item entry must not be null", Map.of("index", i));
            }
            if (item.getQuantity() < 0) {
                throw new BusinessException(
                        "Item quantity must not be negative",
                        Map.of("index", i, "typeId", item.getTypeId(), "quantity", item.getQuantity()));
            }
            quantities.merge(item.getTypeId(), item.getQuantity(), (sum, quantity) -> addQuantity(item, sum, quantity));
        }
        return quantities;
    }

    private static long addQuantity(ItemDemand item, long sum, long quantity) {
        try {
            return Math.addExact(sum, quantity);
        } catch (ArithmeticException e) {
            throw new BusinessException(
                    "Total quantity for type " + item.getTypeId() + " is too large",
                    Map.of("typeId", item.getTypeId(), "quantity", item.getQuantity()));
        }
    }
}
