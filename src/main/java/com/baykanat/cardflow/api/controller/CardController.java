package com.baykanat.cardflow.api.controller;

import com.baykanat.cardflow.api.dto.CardResponse;
import com.baykanat.cardflow.api.dto.CommentRequest;
import com.baykanat.cardflow.api.dto.CommentResponse;
import com.baykanat.cardflow.api.dto.CreateCardRequest;
import com.baykanat.cardflow.api.dto.EventResponse;
import com.baykanat.cardflow.api.dto.ExpiryWarningResponse;
import com.baykanat.cardflow.api.dto.TransitionRequest;
import com.baykanat.cardflow.domain.mapper.CardflowMapper;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.LifecycleAction;
import com.baykanat.cardflow.domain.model.TransitionParams;
import com.baykanat.cardflow.domain.service.CardService;
import com.baykanat.cardflow.domain.service.EntropyScheduler;
import com.baykanat.cardflow.domain.service.LifecycleEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/** Kart okuma/yazma, yaşam döngüsü geçişleri ve işbirliği uçları. */
@Slf4j
@RestController
@RequestMapping("/cards")
@RequiredArgsConstructor
@Tag(name = "Cards", description = "Card lifecycle and collaboration")
public class CardController {

    private final CardService cardService;
    private final LifecycleEngine lifecycleEngine;
    private final EntropyScheduler entropyScheduler;
    private final CardflowMapper mapper;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Create a card", description = "The card starts drafted; the creator watches it")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Card created"),
            @ApiResponse(responseCode = "400", description = "Invalid payload"),
            @ApiResponse(responseCode = "404", description = "Board not found"),
            @ApiResponse(responseCode = "422", description = "Column is not on the board")
    })
    public ResponseEntity<CardResponse> createCard(@Parameter(hidden = true) AccessContext ctx,
                                                   @Valid @RequestBody CreateCardRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(cardService.create(ctx, request.getBoardId(), request.getTitle(),
                        request.getColumnId(), request.getDueOn())));
    }

    @GetMapping("/{cardId}")
    @Operation(summary = "Read a card with its effective state")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card found"),
            @ApiResponse(responseCode = "404", description = "Card not found")
    })
    public CardResponse getCard(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        return mapper.toResponse(cardService.get(ctx, cardId));
    }

    @DeleteMapping("/{cardId}")
    @Operation(summary = "Delete a card", description = "Comments and watchers are removed; events are kept")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Card deleted"),
            @ApiResponse(responseCode = "404", description = "Card not found")
    })
    public ResponseEntity<Void> deleteCard(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        cardService.delete(ctx, cardId);
        return ResponseEntity.noContent().build();
    }

    /** publish, close, postpone, reopen, resume, triageInto. */
    @PostMapping("/{cardId}/transitions")
    @Operation(summary = "Apply a lifecycle transition")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transition applied"),
            @ApiResponse(responseCode = "400", description = "Invalid payload or missing column_id"),
            @ApiResponse(responseCode = "404", description = "Card not found"),
            @ApiResponse(responseCode = "409", description = "Transition not allowed from the current state, or concurrent modification"),
            @ApiResponse(responseCode = "422", description = "Column does not exist on the card's board")
    })
    public CardResponse transition(@Parameter(hidden = true) AccessContext ctx,
                                   @PathVariable String cardId,
                                   @Valid @RequestBody TransitionRequest request) {
        log.debug("Transition request: card={}, action={}, actor={}", cardId, request.getAction().getValue(), ctx.getActorId());
        TransitionParams params = request.getAction() == LifecycleAction.TRIAGE_INTO
                ? TransitionParams.toColumn(request.getColumnId())
                : TransitionParams.none();
        return mapper.toResponse(lifecycleEngine.transition(ctx, cardId, request.getAction(), params));
    }

    @PostMapping("/{cardId}/comments")
    @Operation(summary = "Comment on a card", description = "The author starts watching the card; the card becomes active again")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Comment added"),
            @ApiResponse(responseCode = "400", description = "Blank body"),
            @ApiResponse(responseCode = "404", description = "Card not found"),
            @ApiResponse(responseCode = "409", description = "Card is still drafted")
    })
    public ResponseEntity<CommentResponse> addComment(@Parameter(hidden = true) AccessContext ctx,
                                                      @PathVariable String cardId,
                                                      @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(cardService.addComment(ctx, cardId, request.getBody())));
    }

    @GetMapping("/{cardId}/comments")
    @Operation(summary = "List a card's comments", description = "Oldest first")
    public List<CommentResponse> comments(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        return mapper.toCommentResponses(cardService.comments(ctx, cardId));
    }

    @PutMapping("/{cardId}/watch")
    @Operation(summary = "Watch a card", description = "Idempotent")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Caller watches the card"),
            @ApiResponse(responseCode = "404", description = "Card not found")
    })
    public ResponseEntity<Void> watch(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        cardService.watch(ctx, cardId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{cardId}/watch")
    @Operation(summary = "Stop watching a card", description = "Idempotent")
    public ResponseEntity<Void> unwatch(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        cardService.unwatch(ctx, cardId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{cardId}/golden")
    @Operation(summary = "Gild a card")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card is golden"),
            @ApiResponse(responseCode = "409", description = "Card is already golden")
    })
    public CardResponse gild(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        return mapper.toResponse(cardService.gild(ctx, cardId));
    }

    @DeleteMapping("/{cardId}/golden")
    @Operation(summary = "Ungild a card")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card is no longer golden"),
            @ApiResponse(responseCode = "409", description = "Card is not golden")
    })
    public CardResponse ungild(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        return mapper.toResponse(cardService.ungild(ctx, cardId));
    }

    @GetMapping("/{cardId}/events")
    @Operation(summary = "Event thread of a card", description = "Also readable after the card was deleted")
    public List<EventResponse> events(@Parameter(hidden = true) AccessContext ctx, @PathVariable String cardId) {
        return mapper.toEventResponses(cardService.events(ctx, cardId));
    }

    @GetMapping("/approaching-expiry")
    @Operation(summary = "Open cards close to auto-postpone",
            description = "Cards past the warning ratio of their board's period, soonest first. Read-only")
    public List<ExpiryWarningResponse> approachingExpiry(@Parameter(hidden = true) AccessContext ctx) {
        return mapper.toWarningResponses(entropyScheduler.listApproachingExpiry(ctx, clock.instant()));
    }
}
