package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.InvalidReferenceException;
import com.baykanat.cardflow.domain.exception.InvalidTransitionException;
import com.baykanat.cardflow.domain.exception.NotFoundException;
import com.baykanat.cardflow.domain.exception.ValidationException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.BoardColumn;
import com.baykanat.cardflow.domain.model.Card;
import com.baykanat.cardflow.domain.model.CardStatus;
import com.baykanat.cardflow.domain.model.Comment;
import com.baykanat.cardflow.domain.model.EffectiveState;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.EventAction;
import com.baykanat.cardflow.domain.model.EventTarget;
import com.baykanat.cardflow.infrastructure.persistence.BoardJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.CardJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.CommentJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.WatcherJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Kart oluşturma/silme ve işbirliği eylemleri (yorum, izleme, gild). Kart durumu LifecycleEngine'de değişir. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CardService {

    private final CardJdbcRepository cardRepository;
    private final BoardJdbcRepository boardRepository;
    private final CommentJdbcRepository commentRepository;
    private final WatcherJdbcRepository watcherRepository;
    private final LifecycleEngine lifecycleEngine;
    private final EventLog eventLog;
    private final CardActivityNotifier activityNotifier;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Kart drafted olarak açılır; kolon verilmezse triage'da bekler. Oluşturan kişi kartı izler.
     * Kart numarası tenant sayacından alınır, dueOn isteğe bağlıdır.
     */
    @Transactional
    public Card create(AccessContext ctx, String boardId, String title, String columnId, LocalDate dueOn) {
        boardRepository.findBoard(ctx.getTenantId(), boardId)
                .orElseThrow(() -> new NotFoundException("Board", boardId));
        if (columnId != null) {
            BoardColumn column = boardRepository.findColumn(ctx.getTenantId(), columnId)
                    .orElseThrow(() -> new InvalidReferenceException("Column " + columnId + " does not exist"));
            if (!column.getBoardId().equals(boardId)) {
                throw new InvalidReferenceException("Column " + columnId + " is not on board " + boardId);
            }
        }
        Instant now = clock.instant();
        Card card = Card.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(ctx.getTenantId())
                .number(cardRepository.nextNumber(ctx.getTenantId()))
                .boardId(boardId)
                .columnId(columnId)
                .title(title != null ? title.trim() : "")
                .dueOn(dueOn)
                .creatorId(ctx.getActorId())
                .status(CardStatus.DRAFTED)
                .lastActiveAt(now)
                .createdAt(now)
                .version(0)
                .build();
        cardRepository.insert(card);
        watcherRepository.add(ctx.getTenantId(), card.getId(), ctx.getActorId());
        eventLog.append(ctx, boardId, EventAction.CREATE, EventTarget.card(card.getId()), Map.of(), now);
        log.info("Card #{} ({}) created on board {} by {}", card.getNumber(), card.getId(), boardId, ctx.getActorId());
        return card;
    }

    public Card get(AccessContext ctx, String cardId) {
        return cardRepository.findById(ctx.getTenantId(), cardId)
                .orElseThrow(() -> new NotFoundException("Card", cardId));
    }

    /** Yorumlar ve izleyiciler kartla silinir; event ve bildirimler kalır. */
    @Transactional
    public void delete(AccessContext ctx, String cardId) {
        Card card = get(ctx, cardId);
        if (!cardRepository.delete(ctx.getTenantId(), cardId)) {
            throw new NotFoundException("Card", cardId);
        }
        eventLog.append(ctx, card.getBoardId(), EventAction.DELETE, EventTarget.card(cardId),
                Map.of("title", card.getTitle()), clock.instant());
        log.info("Card {} deleted by {}", cardId, ctx.getActorId());
    }

    /**
     * Yorum ekler. Yazan kartı izlemeye başlar, kartın aktivitesi güncellenir ve
     * pencere içindeki yorum sayısı eşiği aşarsa activity spike işaretlenir.
     */
    @Transactional
    public Comment addComment(AccessContext ctx, String cardId, String body) {
        if (body == null || body.isBlank()) {
            throw new ValidationException("Comment body must not be blank");
        }
        Card card = get(ctx, cardId);
        if (card.effectiveState() == EffectiveState.DRAFTED) {
            throw new InvalidTransitionException(
                    "Cannot comment on card " + cardId + ": card is still drafted",
                    EventAction.COMMENT.getValue(), EffectiveState.DRAFTED);
        }

        Instant now = clock.instant();
        Comment comment = Comment.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(ctx.getTenantId())
                .cardId(cardId)
                .authorId(ctx.getActorId())
                .body(body)
                .createdAt(now)
                .build();
        commentRepository.insert(comment);
        watcherRepository.add(ctx.getTenantId(), cardId, ctx.getActorId());

        EventTarget target = EventTarget.card(cardId);
        Event event = eventLog.append(ctx, card.getBoardId(), EventAction.COMMENT, target,
                Map.of("commentId", comment.getId()), now);

        AppProperties.ActivitySpikeProperties spike = appProperties.getActivitySpike();
        int recent = eventLog.countByTargetSince(ctx.getTenantId(), target, EventAction.COMMENT, now.minus(spike.getWindow()));
        lifecycleEngine.recordActivity(ctx, cardId, recent >= spike.getThreshold());

        activityNotifier.notifyWatchers(ctx, event, cardId);
        return comment;
    }

    public List<Comment> comments(AccessContext ctx, String cardId) {
        get(ctx, cardId);
        return commentRepository.findByCard(ctx.getTenantId(), cardId);
    }

    @Transactional
    public boolean watch(AccessContext ctx, String cardId) {
        get(ctx, cardId);
        return watcherRepository.add(ctx.getTenantId(), cardId, ctx.getActorId());
    }

    @Transactional
    public boolean unwatch(AccessContext ctx, String cardId) {
        get(ctx, cardId);
        return watcherRepository.remove(ctx.getTenantId(), cardId, ctx.getActorId());
    }

    public Card gild(AccessContext ctx, String cardId) {
        return lifecycleEngine.setGolden(ctx, cardId, true);
    }

    public Card ungild(AccessContext ctx, String cardId) {
        return lifecycleEngine.setGolden(ctx, cardId, false);
    }

    /** Kartın event akışı; silinmiş kartın kayıtları da okunabilir. */
    public List<Event> events(AccessContext ctx, String cardId) {
        return eventLog.findByTarget(ctx.getTenantId(), EventTarget.card(cardId));
    }
}
