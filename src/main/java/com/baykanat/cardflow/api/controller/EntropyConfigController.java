package com.baykanat.cardflow.api.controller;

import com.baykanat.cardflow.api.dto.EffectivePeriodResponse;
import com.baykanat.cardflow.api.dto.EntropyConfigRequest;
import com.baykanat.cardflow.api.dto.EntropyConfigResponse;
import com.baykanat.cardflow.domain.mapper.CardflowMapper;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.ConfigScope;
import com.baykanat.cardflow.domain.service.EntropyConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Auto-postpone süresi ayarları; yazma yalnızca admin. */
@RestController
@RequestMapping("/entropy-configs")
@RequiredArgsConstructor
@Tag(name = "Entropy", description = "Auto-postpone period configuration")
public class EntropyConfigController {

    private final EntropyConfigService configService;
    private final CardflowMapper mapper;

    @PutMapping("/tenant")
    @Operation(summary = "Set the tenant-wide period", description = "Applies to boards without their own period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Period stored"),
            @ApiResponse(responseCode = "400", description = "Missing or non-positive period"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin")
    })
    public EntropyConfigResponse configureTenant(@Parameter(hidden = true) AccessContext ctx,
                                                 @Valid @RequestBody EntropyConfigRequest request) {
        return mapper.toResponse(configService.configure(ctx, ConfigScope.tenant(ctx.getTenantId()), request.getAutoPostponePeriod()));
    }

    @PutMapping("/boards/{boardId}")
    @Operation(summary = "Set a board's period", description = "Overrides the tenant-wide period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Period stored"),
            @ApiResponse(responseCode = "400", description = "Missing or non-positive period"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin"),
            @ApiResponse(responseCode = "404", description = "Board not found")
    })
    public EntropyConfigResponse configureBoard(@Parameter(hidden = true) AccessContext ctx,
                                                @PathVariable String boardId,
                                                @Valid @RequestBody EntropyConfigRequest request) {
        return mapper.toResponse(configService.configure(ctx, ConfigScope.board(boardId), request.getAutoPostponePeriod()));
    }

    @GetMapping("/boards/{boardId}/effective")
    @Operation(summary = "Resolved period for a board", description = "Board setting, else tenant setting, else the default")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Resolved period"),
            @ApiResponse(responseCode = "404", description = "Board not found")
    })
    public EffectivePeriodResponse effectivePeriod(@Parameter(hidden = true) AccessContext ctx, @PathVariable String boardId) {
        return EffectivePeriodResponse.builder()
                .boardId(boardId)
                .autoPostponePeriod(configService.effectivePeriod(ctx, boardId))
                .build();
    }
}
