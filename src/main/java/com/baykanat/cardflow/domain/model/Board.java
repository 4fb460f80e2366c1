package com.baykanat.cardflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Board {

    private String id;
    private String tenantId;
    private String name;
    private Instant createdAt;
}
