package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.infrastructure.persistence.WatcherJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/** Bildirim üreten event'ler için alıcıları (kartı izleyenler, eylemi yapan hariç) çözer. */
@Slf4j
@Component
@RequiredArgsConstructor
public class CardActivityNotifier {

    private final WatcherJdbcRepository watcherRepository;
    private final NotificationBundler notificationBundler;

    public void notifyWatchers(AccessContext ctx, Event event, String cardId) {
        if (!event.getAction().isNotifiable()) {
            return;
        }
        List<String> recipients = watcherRepository.findUserIds(ctx.getTenantId(), cardId).stream()
                .filter(userId -> !userId.equals(event.getActorId()))
                .toList();
        if (recipients.isEmpty()) {
            log.debug("No recipients for event {} on card {}", event.getAction().getValue(), cardId);
            return;
        }
        notificationBundler.record(ctx, event, recipients);
    }
}
