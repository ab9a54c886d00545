package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.ErrorCategory;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FailureBreakdown {
    private ErrorCategory category;
    private String code;
    private String label;
    private long count;
    private String recommendation;
    private String sampleError;

    public static FailureBreakdown of(ErrorCategory category, long count, String sampleError) {
        return FailureBreakdown.builder()
                .category(category)
                .code(category.getCode())
                .label(category.getLabel())
                .count(count)
                .recommendation(category.getRecommendation())
                .sampleError(sampleError)
                .build();
    }
}
