package com.arbitration.award.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArbitratorProfile {
    private boolean active;
    private boolean seniorReviewer;
    private int yearsExperience;
    private int casesCompleted;
}
