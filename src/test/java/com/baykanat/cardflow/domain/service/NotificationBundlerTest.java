package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.DeliveryUnavailableException;
import com.baykanat.cardflow.domain.exception.NotFoundException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.BundleStatus;
import com.baykanat.cardflow.domain.model.DeliveryOutcome;
import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.EventAction;
import com.baykanat.cardflow.domain.model.EventTarget;
import com.baykanat.cardflow.domain.model.Notification;
import com.baykanat.cardflow.domain.model.NotificationBatch;
import com.baykanat.cardflow.domain.model.NotificationBundle;
import com.baykanat.cardflow.domain.model.Role;
import com.baykanat.cardflow.domain.model.UndeliveredBacklog;
import com.baykanat.cardflow.infrastructure.persistence.NotificationBundleJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.NotificationJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NotificationBundler.
 *
 * <p>Runs outside a transaction, so delivery callbacks are handed to the TaskScheduler immediately.
 * Verifies window opening, idempotent delivery and the retry path.
 */
@ExtendWith(MockitoExtension.class)
class NotificationBundlerTest {

    private static final Instant NOW = Instant.parse("2026-05-05T09:00:00Z");
    private static final AccessContext ACTOR = new AccessContext("t1", "alice", Role.MEMBER);

    @Mock
    private NotificationJdbcRepository notificationRepository;

    @Mock
    private NotificationBundleJdbcRepository bundleRepository;

    @Mock
    private NotificationDeliveryChannel deliveryChannel;

    @Mock
    private TaskScheduler taskScheduler;

    private NotificationBundler bundler;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        bundler = new NotificationBundler(notificationRepository, bundleRepository, deliveryChannel,
                new DeliveryRetryPolicy(Duration.ofMinutes(1), Duration.ofHours(1)), taskScheduler,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Event event(String tenantId) {
        return Event.builder().id("e1").tenantId(tenantId).boardId("b1").actorId("alice")
                .action(EventAction.COMMENT).target(EventTarget.card("c1"))
                .payload(Map.of("commentId", "cm1")).createdAt(NOW).build();
    }

    private static NotificationBundle bundle(BundleStatus status) {
        return NotificationBundle.builder().id("nb1").tenantId("t1").recipientId("bob")
                .windowStart(NOW.minus(Duration.ofMinutes(40)))
                .windowEnd(NOW.minus(Duration.ofMinutes(10)))
                .status(status).build();
    }

    private static NotificationBatch.Item item(String id) {
        return NotificationBatch.Item.builder().notificationId(id).eventId("e-" + id).action("comment")
                .targetType("card").targetId("c1").boardId("b1").actorId("alice").payload(Map.of())
                .createdAt(NOW.minus(Duration.ofMinutes(30))).build();
    }

    @Test
    @DisplayName("record - notifications are stored and a window opens only for recipients without one")
    @SuppressWarnings("unchecked")
    void recordOpensWindowPerRecipient() {
        when(bundleRepository.insertPendingIfAbsent(any(NotificationBundle.class)))
                .thenAnswer(inv -> "bob".equals(inv.getArgument(0, NotificationBundle.class).getRecipientId()));

        bundler.record(ACTOR, event("t1"), List.of("bob", "carol", "bob"));

        ArgumentCaptor<List<Notification>> notifications = ArgumentCaptor.forClass(List.class);
        verify(notificationRepository).batchInsert(notifications.capture());
        assertThat(notifications.getValue()).extracting(Notification::getRecipientId).containsExactly("bob", "carol");
        assertThat(notifications.getValue()).allSatisfy(n -> assertThat(n.getCreatedAt()).isEqualTo(NOW));

        verify(bundleRepository, times(2)).insertPendingIfAbsent(any(NotificationBundle.class));
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), eq(NOW.plus(Duration.ofMinutes(30))));
    }

    @Test
    @DisplayName("record - an event of another tenant is rejected")
    void recordRejectsForeignEvent() {
        assertThatThrownBy(() -> bundler.record(ACTOR, event("t2"), List.of("bob")))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(notificationRepository, bundleRepository);
    }

    @Test
    @DisplayName("record - no recipients means no writes")
    void recordWithoutRecipients() {
        bundler.record(ACTOR, event("t1"), List.of());

        verifyNoInteractions(notificationRepository, bundleRepository, taskScheduler);
    }

    @Test
    @DisplayName("deliver - pending bundle is sent once; a second call is a no-op")
    void deliverIsIdempotent() {
        when(bundleRepository.findById("nb1"))
                .thenReturn(Optional.of(bundle(BundleStatus.PENDING)))
                .thenReturn(Optional.of(bundle(BundleStatus.DELIVERED)));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(true);
        when(notificationRepository.findUndeliveredInWindow("t1", "bob", NOW.minus(Duration.ofMinutes(40)), NOW))
                .thenReturn(List.of(item("n1"), item("n2")));

        DeliveryOutcome first = bundler.deliver("nb1");
        DeliveryOutcome second = bundler.deliver("nb1");

        assertThat(first).isEqualTo(DeliveryOutcome.DELIVERED);
        assertThat(second).isEqualTo(DeliveryOutcome.SKIPPED);

        ArgumentCaptor<NotificationBatch> batch = ArgumentCaptor.forClass(NotificationBatch.class);
        verify(deliveryChannel, times(1)).deliver(eq("bob"), batch.capture());
        assertThat(batch.getValue().getItems()).extracting(NotificationBatch.Item::getNotificationId)
                .containsExactly("n1", "n2");
        verify(notificationRepository).markDelivered(List.of("n1", "n2"), "nb1", NOW);
        verify(bundleRepository).markDelivered("nb1", NOW);
        verify(bundleRepository, times(1)).claim(eq("nb1"), any(Instant.class));
    }

    @Test
    @DisplayName("deliver - a bundle claimed by another worker is skipped")
    void deliverLosesClaim() {
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(false);

        assertThat(bundler.deliver("nb1")).isEqualTo(DeliveryOutcome.SKIPPED);
        verifyNoInteractions(deliveryChannel);
    }

    @Test
    @DisplayName("deliver - unknown bundle is skipped")
    void deliverUnknownBundle() {
        when(bundleRepository.findById("nope")).thenReturn(Optional.empty());

        assertThat(bundler.deliver("nope")).isEqualTo(DeliveryOutcome.SKIPPED);
    }

    @Test
    @DisplayName("deliver - channel failure keeps the bundle for a retry with backoff")
    void deliverFailureSchedulesRetry() {
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(true);
        when(notificationRepository.findUndeliveredInWindow(eq("t1"), eq("bob"), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(item("n1")));
        doThrow(new DeliveryUnavailableException("broker down", null))
                .when(deliveryChannel).deliver(eq("bob"), any(NotificationBatch.class));

        assertThat(bundler.deliver("nb1")).isEqualTo(DeliveryOutcome.FAILED);

        ArgumentCaptor<Instant> retryAt = ArgumentCaptor.forClass(Instant.class);
        verify(bundleRepository).markFailed(eq("nb1"), eq(1), retryAt.capture());
        assertThat(retryAt.getValue()).isBetween(NOW.plusSeconds(30), NOW.plusSeconds(90));
        verify(bundleRepository, never()).markDelivered(anyString(), any(Instant.class));
        verify(notificationRepository, never()).markDelivered(anyList(), anyString(), any(Instant.class));
    }

    @Test
    @DisplayName("deliver - empty bundle is closed without calling the channel")
    void deliverEmptyBundle() {
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(true);
        when(notificationRepository.findUndeliveredInWindow(eq("t1"), eq("bob"), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of());

        assertThat(bundler.deliver("nb1")).isEqualTo(DeliveryOutcome.DELIVERED);
        verifyNoInteractions(deliveryChannel);
        verify(bundleRepository).markDelivered("nb1", NOW);
    }

    @Test
    @DisplayName("deliver - leftover notifications open a follow-up window at the earliest one")
    void deliverOpensFollowUpBundle() {
        Instant straggler = NOW.minus(Duration.ofMinutes(2));
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(true);
        when(notificationRepository.findUndeliveredInWindow(eq("t1"), eq("bob"), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(item("n1")));
        when(notificationRepository.findEarliestUndelivered("t1", "bob")).thenReturn(Optional.of(straggler));
        when(bundleRepository.insertPendingIfAbsent(any(NotificationBundle.class))).thenReturn(true);

        bundler.deliver("nb1");

        ArgumentCaptor<NotificationBundle> followUp = ArgumentCaptor.forClass(NotificationBundle.class);
        verify(bundleRepository).insertPendingIfAbsent(followUp.capture());
        assertThat(followUp.getValue().getWindowStart()).isEqualTo(straggler);
        assertThat(followUp.getValue().getWindowEnd()).isEqualTo(straggler.plus(Duration.ofMinutes(30)));
        verify(taskScheduler).schedule(any(Runnable.class), eq(straggler.plus(Duration.ofMinutes(30))));
    }

    @Test
    @DisplayName("deliver(ctx) - a bundle of another tenant is NotFound")
    void deliverForeignBundle() {
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));

        assertThatThrownBy(() -> bundler.deliver(new AccessContext("t2", "eve", Role.MEMBER), "nb1"))
                .isInstanceOf(NotFoundException.class);
        verify(bundleRepository, never()).claim(anyString(), any(Instant.class));
    }

    @Test
    @DisplayName("deliverOverdue - due pending and expired processing bundles are both delivered")
    void deliverOverdueCoversPendingAndRetries() {
        NotificationBundle retrying = NotificationBundle.builder().id("nb2").tenantId("t1").recipientId("carol")
                .windowStart(NOW.minus(Duration.ofHours(2))).windowEnd(NOW.minus(Duration.ofMinutes(90)))
                .status(BundleStatus.PROCESSING).attempts(2).claimedUntil(NOW.minusSeconds(1)).build();
        when(bundleRepository.findDuePending(eq(NOW), anyInt())).thenReturn(List.of("nb1"));
        when(bundleRepository.findExpiredProcessing(eq(NOW), anyInt())).thenReturn(List.of("nb2"));
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));
        when(bundleRepository.findById("nb2")).thenReturn(Optional.of(retrying));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(true);
        when(bundleRepository.reclaim(eq("nb2"), eq(NOW), any(Instant.class))).thenReturn(true);
        when(notificationRepository.findUndeliveredInWindow(anyString(), anyString(), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(item("n1")));

        int delivered = bundler.deliverOverdue();

        assertThat(delivered).isEqualTo(2);
        verify(deliveryChannel).deliver(eq("bob"), any(NotificationBatch.class));
        verify(deliveryChannel).deliver(eq("carol"), any(NotificationBatch.class));
    }

    @Test
    @DisplayName("deliverOverdue - one failing bundle does not stop the sweep")
    void deliverOverdueIsolatesFailures() {
        when(bundleRepository.findDuePending(eq(NOW), anyInt())).thenReturn(List.of("broken", "nb1"));
        when(bundleRepository.findExpiredProcessing(eq(NOW), anyInt())).thenReturn(List.of());
        when(bundleRepository.findById("broken")).thenThrow(new IllegalStateException("corrupt row"));
        when(bundleRepository.findById("nb1")).thenReturn(Optional.of(bundle(BundleStatus.PENDING)));
        when(bundleRepository.claim(eq("nb1"), any(Instant.class))).thenReturn(true);
        when(notificationRepository.findUndeliveredInWindow(eq("t1"), eq("bob"), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(item("n1")));

        assertThat(bundler.deliverOverdue()).isEqualTo(1);
    }

    @Test
    @DisplayName("deliverOverdue - a recipient left with old undelivered notifications and no bundle gets one reopened")
    void deliverOverdueReopensStrandedBacklog() {
        Instant earliest = NOW.minus(Duration.ofHours(2));
        when(bundleRepository.findDuePending(eq(NOW), anyInt())).thenReturn(List.of());
        when(bundleRepository.findExpiredProcessing(eq(NOW), anyInt())).thenReturn(List.of());
        when(notificationRepository.findRecipientsWithoutBundle(eq(NOW.minus(Duration.ofMinutes(30))), anyInt()))
                .thenReturn(List.of(UndeliveredBacklog.builder()
                        .tenantId("t1").recipientId("bob").earliest(earliest).build()));
        when(bundleRepository.insertPendingIfAbsent(any(NotificationBundle.class))).thenReturn(true);

        bundler.deliverOverdue();

        ArgumentCaptor<NotificationBundle> reopened = ArgumentCaptor.forClass(NotificationBundle.class);
        verify(bundleRepository).insertPendingIfAbsent(reopened.capture());
        assertThat(reopened.getValue().getTenantId()).isEqualTo("t1");
        assertThat(reopened.getValue().getRecipientId()).isEqualTo("bob");
        assertThat(reopened.getValue().getWindowStart()).isEqualTo(earliest);
        // Window already ended, so the callback is due immediately
        verify(taskScheduler).schedule(any(Runnable.class), eq(earliest.plus(Duration.ofMinutes(30))));
    }

    @Test
    @DisplayName("deliverOverdue - nothing is reopened when every recipient still has a bundle")
    void deliverOverdueLeavesCoveredRecipientsAlone() {
        when(bundleRepository.findDuePending(eq(NOW), anyInt())).thenReturn(List.of());
        when(bundleRepository.findExpiredProcessing(eq(NOW), anyInt())).thenReturn(List.of());
        when(notificationRepository.findRecipientsWithoutBundle(any(Instant.class), anyInt())).thenReturn(List.of());

        assertThat(bundler.deliverOverdue()).isZero();
        verify(bundleRepository, never()).insertPendingIfAbsent(any(NotificationBundle.class));
        verifyNoInteractions(taskScheduler, deliveryChannel);
    }
}
