package com.evenexus.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppraisalItemRequest {

    @NotNull(message = "typeId is required")
    @Positive(message = "typeId must be positive")
    private Integer typeId;

    @NotNull(message = "quantity is required")
    @PositiveOrZero(message = "quantity must not be negative")
    private Long quantity;
}
