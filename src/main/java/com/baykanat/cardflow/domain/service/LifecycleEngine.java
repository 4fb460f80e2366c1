package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.domain.exception.ConcurrencyConflictException;
import com.baykanat.cardflow.domain.exception.InvalidReferenceException;
import com.baykanat.cardflow.domain.exception.InvalidTransitionException;
import com.baykanat.cardflow.domain.exception.NotFoundException;
import com.baykanat.cardflow.domain.exception.ValidationException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.BoardColumn;
import com.baykanat.cardflow.domain.model.Card;
import com.baykanat.cardflow.domain.model.CardStatus;
import com.baykanat.cardflow.domain.model.EffectiveState;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.EventAction;
import com.baykanat.cardflow.domain.model.EventTarget;
import com.baykanat.cardflow.domain.model.LifecycleAction;
import com.baykanat.cardflow.domain.model.TransitionParams;
import com.baykanat.cardflow.infrastructure.persistence.BoardJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.CardJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Kart durum makinesi. Kart durumunu yazan ve yaşam döngüsü event'i üreten tek bileşen.
 *
 * <p>Kullanıcı ve entropy taraması aynı {@link #apply} yolundan geçer; tarama yalnızca
 * sistem aktörü ve ek bir uygunluk koşulu ile çağırır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleEngine {

    static final String DEFAULT_TITLE = "Untitled";
    static final String ENTROPY_REASON = "entropy";

    private final CardJdbcRepository cardRepository;
    private final BoardJdbcRepository boardRepository;
    private final EventLog eventLog;
    private final CardActivityNotifier activityNotifier;
    private final Clock clock;

    /** Kullanıcı kaynaklı geçiş; uygun değilse InvalidTransition, yarış kaybedilirse ConcurrencyConflict. */
    @Transactional
    public Card transition(AccessContext ctx, String cardId, LifecycleAction action, TransitionParams params) {
        Card card = load(ctx, cardId);
        Instant now = clock.instant();
        Card next = apply(ctx, card, action, params != null ? params : TransitionParams.none(), now);
        if (!cardRepository.update(next, card.getVersion())) {
            throw new ConcurrencyConflictException(cardId, card.getVersion());
        }
        recordEvent(ctx, next, action.getEventAction(), params != null ? params.getEventPayload() : Map.of(), now);
        log.info("Card {} {}: {} -> {} by {}", cardId, action.getValue(),
                card.effectiveState().getValue(), next.effectiveState().getValue(), ctx.getActorId());
        return next;
    }

    /**
     * Entropy taraması için erteleme. Kart aynı transaction içinde yeniden okunur; hâlâ açık ve
     * lastActiveAt &lt; cutoff değilse ya da version yarışı kaybedilirse hiçbir şey yazılmaz.
     *
     * @return true → kart ertelendi; false → sessizce atlandı
     */
    @Transactional
    public boolean autoPostpone(AccessContext ctx, String cardId, Instant cutoff) {
        Optional<Card> current = cardRepository.findById(ctx.getTenantId(), cardId);
        if (current.isEmpty()) {
            log.debug("Auto-postpone skipped, card {} no longer exists", cardId);
            return false;
        }
        Card card = current.get();
        if (!card.effectiveState().isOpen() || !card.getLastActiveAt().isBefore(cutoff)) {
            log.debug("Auto-postpone skipped for card {}: state={}, lastActiveAt={}, cutoff={}",
                    cardId, card.effectiveState().getValue(), card.getLastActiveAt(), cutoff);
            return false;
        }
        Instant now = clock.instant();
        Map<String, Object> payload = Map.of("reason", ENTROPY_REASON);
        Card next = apply(ctx, card, LifecycleAction.POSTPONE, TransitionParams.withPayload(payload), now);
        if (!cardRepository.update(next, card.getVersion())) {
            log.debug("Auto-postpone skipped for card {}: modified concurrently", cardId);
            return false;
        }
        recordEvent(ctx, next, EventAction.POSTPONE, payload, now);
        log.info("Card {} auto-postponed after inactivity since {}", cardId, card.getLastActiveAt());
        return true;
    }

    /** Yorum gibi işbirliği aktivitesi: lastActiveAt güncellenir, gerekirse activity spike işaretlenir. */
    @Transactional
    public Card recordActivity(AccessContext ctx, String cardId, boolean spikeDetected) {
        Card card = load(ctx, cardId);
        Instant now = clock.instant();
        Card.CardBuilder next = touch(card.toBuilder(), card, now);
        if (spikeDetected && card.effectiveState().isOpen() && card.getActivitySpikeAt() == null) {
            next.activitySpikeAt(now);
            log.info("Activity spike detected on card {}", cardId);
        }
        Card updated = next.build();
        if (!cardRepository.update(updated, card.getVersion())) {
            throw new ConcurrencyConflictException(cardId, card.getVersion());
        }
        return updated;
    }

    /** gild / ungild; kart zaten istenen durumdaysa InvalidTransition. */
    @Transactional
    public Card setGolden(AccessContext ctx, String cardId, boolean golden) {
        Card card = load(ctx, cardId);
        EventAction action = golden ? EventAction.GILD : EventAction.UNGILD;
        if (card.isGolden() == golden) {
            throw new InvalidTransitionException(
                    String.format("Cannot %s card %s: card is already %s",
                            action.getValue(), cardId, golden ? "golden" : "not golden"),
                    action.getValue(), card.effectiveState());
        }
        Card updated = card.toBuilder().golden(golden).version(card.getVersion() + 1).build();
        if (!cardRepository.update(updated, card.getVersion())) {
            throw new ConcurrencyConflictException(cardId, card.getVersion());
        }
        recordEvent(ctx, updated, action, Map.of(), clock.instant());
        return updated;
    }

    /** Saf geçiş fonksiyonu: guard kontrolü ve yeni kart değeri; yazma yapmaz. */
    Card apply(AccessContext ctx, Card card, LifecycleAction action, TransitionParams params, Instant now) {
        EffectiveState state = card.effectiveState();
        if (!action.isAllowedFrom(state)) {
            throw new InvalidTransitionException(card.getId(), action.getValue(), state, action.getAllowedFrom());
        }

        Card.CardBuilder next = card.toBuilder();
        switch (action) {
            case PUBLISH -> next.status(CardStatus.PUBLISHED)
                    .title(card.getTitle() == null || card.getTitle().isBlank() ? DEFAULT_TITLE : card.getTitle());
            case CLOSE -> next.closedAt(now).closedBy(ctx.getActorId())
                    .postponedAt(null).postponedBy(null);
            case POSTPONE -> next.postponedAt(now).postponedBy(ctx.getActorId())
                    .columnId(null)
                    .closedAt(null).closedBy(null)
                    .activitySpikeAt(null);
            case REOPEN -> next.closedAt(null).closedBy(null);
            case RESUME -> next.postponedAt(null).postponedBy(null).activitySpikeAt(null);
            case TRIAGE_INTO -> next.columnId(resolveColumn(ctx, card, params.getColumnId()).getId())
                    .postponedAt(null).postponedBy(null);
        }
        return touch(next, card, now).build();
    }

    private Card.CardBuilder touch(Card.CardBuilder next, Card card, Instant now) {
        // lastActiveAt geri gitmez
        Instant lastActive = card.getLastActiveAt() != null && card.getLastActiveAt().isAfter(now)
                ? card.getLastActiveAt() : now;
        return next.lastActiveAt(lastActive).version(card.getVersion() + 1);
    }

    private BoardColumn resolveColumn(AccessContext ctx, Card card, String columnId) {
        if (columnId == null || columnId.isBlank()) {
            throw new ValidationException("triageInto requires a columnId");
        }
        BoardColumn column = boardRepository.findColumn(ctx.getTenantId(), columnId)
                .orElseThrow(() -> new InvalidReferenceException("Column " + columnId + " does not exist"));
        if (!column.getBoardId().equals(card.getBoardId())) {
            throw new InvalidReferenceException(String.format(
                    "Column %s belongs to board %s, card %s is on board %s",
                    columnId, column.getBoardId(), card.getId(), card.getBoardId()));
        }
        return column;
    }

    private Card load(AccessContext ctx, String cardId) {
        return cardRepository.findById(ctx.getTenantId(), cardId)
                .orElseThrow(() -> new NotFoundException("Card", cardId));
    }

    private void recordEvent(AccessContext ctx, Card card, EventAction action, Map<String, Object> payload, Instant now) {
        Event event = eventLog.append(ctx, card.getBoardId(), action, EventTarget.card(card.getId()), payload, now);
        activityNotifier.notifyWatchers(ctx, event, card.getId());
    }
}
