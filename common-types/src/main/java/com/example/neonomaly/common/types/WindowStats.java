package com.example.neonomaly.common.types;

import lombok.Builder;
import lombok.Value;

// Population statistics over the readings of one window
@Value
@Builder
public class WindowStats {
    long count;
    double mean;
    double stdDev; // population (divide by N)
}
