package com.evenexus.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Raw discount text as typed by the user; parsed and validated by the discount setting. */
@Data
public class DiscountUpdateRequest {

    @NotNull(message = "value is required")
    private String value;
}
