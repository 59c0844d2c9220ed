package com.evenexus.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.Getter;

/**
 * Success envelope returned by the appraisal and market price endpoints.
 *
 * <p>{@code warnings} names conditions the caller should show next to the data, see
 * {@link AppraisalWarning}. It is omitted when empty.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<String> warnings;

    private final Instant timestamp;

    private ApiResponse(T data, List<String> warnings) {
        this.data = data;
        this.warnings = warnings;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, List.of());
    }

    public static <T> ApiResponse<T> of(T data, List<AppraisalWarning> warnings) {
        return new ApiResponse<>(data, warnings.stream().map(Enum::name).toList());
    }
}
