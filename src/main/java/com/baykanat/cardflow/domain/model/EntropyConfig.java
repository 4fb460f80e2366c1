package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntropyConfig {

    private String tenantId;
    private ConfigScope scope;
    private Duration autoPostponePeriod;
    private String updatedBy;
    private Instant updatedAt;
}
