package com.evenexus.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Data;

/**
 * Request payload for appraising a bundle of items, typically the contents of a contract.
 *
 * <p>Items may repeat a type id; quantities are summed. Region and system default to the
 * configured hub when omitted. {@code discountPercent} is optional: when absent or invalid
 * the session's accepted discount is used.
 */
@Data
public class AppraisalRequest {

    @NotEmpty(message = "items must not be empty")
    @Size(max = 5000, message = "items must not exceed 5000 entries")
    @Valid
    private List<AppraisalItemRequest> items;

    @Positive(message = "regionId must be positive")
    private Integer regionId;

    @Positive(message = "systemId must be positive")
    private Integer systemId;

    private Integer discountPercent;
}
