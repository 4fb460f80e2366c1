package com.baykanat.cardflow.api.controller;

import com.baykanat.cardflow.api.dto.DeliveryResponse;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.service.NotificationBundler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Pencere bitmeden manuel teslim; zamanlanmış teslim sonrasında no-op olur. */
@RestController
@RequestMapping("/notification-bundles")
@RequiredArgsConstructor
@Tag(name = "Notifications", description = "Notification bundle delivery")
public class NotificationBundleController {

    private final NotificationBundler notificationBundler;

    @PostMapping("/{bundleId}/deliver")
    @Operation(summary = "Deliver a bundle now", description = "Already delivered or claimed bundles yield SKIPPED")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Delivery outcome"),
            @ApiResponse(responseCode = "404", description = "Bundle not found in the caller's tenant")
    })
    public DeliveryResponse deliver(@Parameter(hidden = true) AccessContext ctx, @PathVariable String bundleId) {
        return DeliveryResponse.builder()
                .bundleId(bundleId)
                .outcome(notificationBundler.deliver(ctx, bundleId))
                .build();
    }
}
