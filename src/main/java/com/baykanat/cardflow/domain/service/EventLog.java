package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.EventAction;
import com.baykanat.cardflow.domain.model.EventTarget;
import com.baykanat.cardflow.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only event kaydı; tenant ve hedef ile anahtarlanır.
 *
 * <p>Yazma yalnızca LifecycleEngine ve CardService içinden yapılır. Güncelleme/silme yok.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventLog {

    private final EventJdbcRepository eventRepository;

    /** Çağıranın transaction'ında event ekler ve yazılan kaydı döner. */
    public Event append(AccessContext ctx, String boardId, EventAction action, EventTarget target,
                        Map<String, Object> payload, Instant createdAt) {
        Event event = Event.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(ctx.getTenantId())
                .boardId(boardId)
                .actorId(ctx.getActorId())
                .action(action)
                .target(target)
                .payload(payload != null ? payload : Map.of())
                .createdAt(createdAt)
                .build();
        eventRepository.insert(event);
        log.debug("Event appended: tenant={}, action={}, target={}:{}, actor={}",
                event.getTenantId(), action.getValue(), target.getType().getValue(), target.getId(), event.getActorId());
        return event;
    }

    public List<Event> findByTarget(String tenantId, EventTarget target) {
        return eventRepository.findByTarget(tenantId, target);
    }

    public List<Event> findByAction(String tenantId, EventAction action, Instant since) {
        return eventRepository.findByAction(tenantId, action, since);
    }

    public int countByTargetSince(String tenantId, EventTarget target, EventAction action, Instant since) {
        return eventRepository.countByTargetSince(tenantId, target, action, since);
    }
}
