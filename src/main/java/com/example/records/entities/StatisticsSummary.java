package com.example.records.entities;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StatisticsSummary {
    int count;
    double meanPercentage;
    // first occurrence wins on ties
    StudentRecord highest;
    StudentRecord lowest;
    int passCount;
    int failCount;
}
