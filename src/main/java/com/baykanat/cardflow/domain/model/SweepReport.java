package com.baykanat.cardflow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Tek bir entropy taramasının özeti. */
@Value
@Builder
public class SweepReport {

    Instant startedAt;
    Instant finishedAt;
    int tenantsScanned;
    int boardsScanned;
    int candidates;
    int postponed;
    int skipped;
    int failed;
}
