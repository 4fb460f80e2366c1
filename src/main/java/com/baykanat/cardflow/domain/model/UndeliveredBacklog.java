package com.baykanat.cardflow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Açık bundle'ı olmayan alıcının teslim edilmemiş bildirimleri; earliest en eski bildirim zamanı. */
@Value
@Builder
public class UndeliveredBacklog {

    String tenantId;
    String recipientId;
    Instant earliest;
}
