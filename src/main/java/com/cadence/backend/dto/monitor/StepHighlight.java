package com.cadence.backend.dto.monitor;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StepHighlight {
    private int stepNumber;
    private String metric;
    private String value;
}
