package com.swab.backend.modules.scheduler.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.swab.backend.modules.scheduler.domain.DeliveryStatus;
import com.swab.backend.modules.scheduler.domain.NotificationDefinition;
import com.swab.backend.modules.scheduler.domain.ScheduledJob;
import com.swab.backend.modules.scheduler.domain.SchedulerState;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

@ExtendWith(MockitoExtension.class)
class NotificationSchedulerEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-05T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private NotificationStore notificationStore;

    @Mock
    private MessageSender messageSender;

    private final List<Runnable> scheduledTasks = new ArrayList<>();
    private final List<ScheduledFuture<?>> scheduledFutures = new ArrayList<>();

    private NotificationSchedulerEngine engine;

    @BeforeEach
    void setUp() {
        lenient().when(taskScheduler.schedule(any(Runnable.class), any(Trigger.class))).thenAnswer(invocation -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            scheduledTasks.add(invocation.getArgument(0));
            scheduledFutures.add(future);
            return future;
        });
        engine = new NotificationSchedulerEngine(taskScheduler, notificationStore, messageSender, ZoneOffset.UTC, CLOCK);
    }

    private static NotificationDefinition active(long id) {
        return new NotificationDefinition(id, "message " + id, 3, LocalTime.of(14, 5), true);
    }

    private static NotificationDefinition inactive(long id) {
        return new NotificationDefinition(id, "message " + id, 3, LocalTime.of(14, 5), false);
    }

    private DeliveryTask taskFor(long notificationId) {
        for (int i = scheduledTasks.size() - 1; i >= 0; i--) {
            DeliveryTask task = (DeliveryTask) scheduledTasks.get(i);
            if (task.notificationId() == notificationId) {
                return task;
            }
        }
        throw new AssertionError("no task scheduled for " + notificationId);
    }

    @Nested
    class Arming {

        @Test
        void initializeAllArmsOneTimerPerActiveDefinition() {
            when(notificationStore.listActive()).thenReturn(List.of(active(1), active(2), inactive(3)));

            int armed = engine.initializeAll();

            assertThat(armed).isEqualTo(2);
            assertThat(engine.armedIds()).containsExactlyInAnyOrder(1L, 2L);
            assertThat(engine.count()).isEqualTo(2);
            assertThat(engine.state()).isEqualTo(SchedulerState.ARMED);
            verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Trigger.class));
        }

        @Test
        void startsEmptyBeforeInitialization() {
            assertThat(engine.state()).isEqualTo(SchedulerState.EMPTY);
            assertThat(engine.count()).isZero();
            assertThat(engine.jobs()).isEmpty();
        }

        @Test
        void rearmAllTwiceKeepsIdsAndReplacesHandles() {
            when(notificationStore.listActive()).thenReturn(List.of(active(1), active(2)));

            engine.initializeAll();
            List<ScheduledFuture<?>> firstRound = List.copyOf(scheduledFutures);
            engine.rearmAll();

            assertThat(engine.armedIds()).containsExactlyInAnyOrder(1L, 2L);
            assertThat(scheduledFutures).hasSize(4);
            firstRound.forEach(future -> verify(future).cancel(false));
            scheduledFutures.subList(2, 4).forEach(future -> verify(future, never()).cancel(anyBoolean()));
        }

        @Test
        void toggledDefinitionsFollowTheStoreOnRearm() {
            when(notificationStore.listActive())
                    .thenReturn(List.of(active(1), active(2)))
                    .thenReturn(List.of(active(1)))
                    .thenReturn(List.of(active(1), active(2)));

            engine.initializeAll();
            engine.rearmAll();
            assertThat(engine.armedIds()).containsExactly(1L);

            engine.rearmAll();
            assertThat(engine.armedIds()).containsExactlyInAnyOrder(1L, 2L);
        }

        @Test
        void deletingOneOfThreeRemovesExactlyThatTimer() {
            when(notificationStore.listActive())
                    .thenReturn(List.of(active(1), active(2), active(3)))
                    .thenReturn(List.of(active(1), active(3)));

            engine.initializeAll();
            engine.rearmAll();

            assertThat(engine.armedIds()).containsExactlyInAnyOrder(1L, 3L);
        }

        @Test
        void skipsMalformedDefinitionsAndArmsTheRest() {
            NotificationDefinition broken = new NotificationDefinition(2, "broken", 9, LocalTime.NOON, true);
            when(notificationStore.listActive()).thenReturn(List.of(active(1), broken, active(3)));

            int armed = engine.initializeAll();

            assertThat(armed).isEqualTo(2);
            assertThat(engine.armedIds()).containsExactlyInAnyOrder(1L, 3L);
        }

        @Test
        void skipsDefinitionWhoseTriggerNeverFires() {
            when(notificationStore.listActive()).thenReturn(List.of(active(1)));
            doReturn(null).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

            assertThat(engine.initializeAll()).isZero();
            assertThat(engine.state()).isEqualTo(SchedulerState.ARMED);
        }

        @Test
        void armOneReplacesThePreviousTimer() {
            engine.armOne(active(1));
            ScheduledFuture<?> first = scheduledFutures.get(0);

            engine.armOne(new NotificationDefinition(1, "changed", 5, LocalTime.of(8, 0), true));

            verify(first).cancel(false);
            assertThat(engine.armedIds()).containsExactly(1L);
            assertThat(engine.jobs()).singleElement()
                    .satisfies(job -> assertThat(job.recurrence().toCronExpression()).isEqualTo("0 0 8 * * FRI"));
        }

        @Test
        void armOneWithInactiveDefinitionDisarms() {
            engine.armOne(active(1));

            engine.armOne(inactive(1));

            verify(scheduledFutures.get(0)).cancel(false);
            assertThat(engine.count()).isZero();
        }

        @Test
        void disarmAllCancelsEverything() {
            when(notificationStore.listActive()).thenReturn(List.of(active(1), active(2)));
            engine.initializeAll();

            engine.disarmAll();

            scheduledFutures.forEach(future -> verify(future).cancel(false));
            assertThat(engine.count()).isZero();
            assertThat(engine.state()).isEqualTo(SchedulerState.EMPTY);
        }

        @Test
        void jobsReportTheNextFireTimeInTheConfiguredZone() {
            when(notificationStore.listActive()).thenReturn(List.of(active(2), active(1)));
            engine.initializeAll();

            List<ScheduledJob> jobs = engine.jobs();

            assertThat(jobs).extracting(ScheduledJob::notificationId).containsExactly(1L, 2L);
            assertThat(jobs.get(0).nextFireTime()).isEqualTo(ZonedDateTime.parse("2025-01-08T14:05:00Z"));
        }
    }

    @Nested
    class StoreFailures {

        @Test
        void failedInitializationLeavesNoTimers() {
            when(notificationStore.listActive())
                    .thenThrow(new NotificationStoreException("down", new DataAccessResourceFailureException("down")));

            assertThatThrownBy(() -> engine.initializeAll()).isInstanceOf(NotificationStoreException.class);
            assertThat(engine.count()).isZero();
            assertThat(engine.state()).isEqualTo(SchedulerState.EMPTY);
            verifyNoInteractions(taskScheduler);
        }

        @Test
        void failedRearmCancelsPreviouslyArmedTimers() {
            when(notificationStore.listActive())
                    .thenReturn(List.of(active(1), active(2)))
                    .thenThrow(new NotificationStoreException("down", new DataAccessResourceFailureException("down")));
            engine.initializeAll();

            assertThatThrownBy(() -> engine.rearmAll()).isInstanceOf(NotificationStoreException.class);

            assertThat(engine.count()).isZero();
            assertThat(engine.state()).isEqualTo(SchedulerState.EMPTY);
            scheduledFutures.forEach(future -> verify(future).cancel(false));
        }

        @Test
        @DisplayName("a reload that started earlier never overwrites a newer one")
        void staleReloadIsDiscarded() throws Exception {
            CountDownLatch slowReadStarted = new CountDownLatch(1);
            CountDownLatch releaseSlowRead = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            when(notificationStore.listActive()).thenAnswer(invocation -> {
                if (calls.incrementAndGet() == 1) {
                    slowReadStarted.countDown();
                    releaseSlowRead.await(5, TimeUnit.SECONDS);
                    return List.of(active(1));
                }
                return List.of(active(2));
            });

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Integer> slow = executor.submit(() -> engine.rearmAll());
                assertThat(slowReadStarted.await(5, TimeUnit.SECONDS)).isTrue();

                engine.rearmAll();
                releaseSlowRead.countDown();
                slow.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            assertThat(engine.armedIds()).containsExactly(2L);
            assertThat(engine.state()).isEqualTo(SchedulerState.ARMED);
            verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
        }

        @Test
        void staleFailedReloadKeepsTheNewerTimers() throws Exception {
            CountDownLatch slowReadStarted = new CountDownLatch(1);
            CountDownLatch releaseSlowRead = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            when(notificationStore.listActive()).thenAnswer(invocation -> {
                if (calls.incrementAndGet() == 1) {
                    slowReadStarted.countDown();
                    releaseSlowRead.await(5, TimeUnit.SECONDS);
                    throw new NotificationStoreException("down", new DataAccessResourceFailureException("down"));
                }
                return List.of(active(2));
            });

            ExecutorService executor = Executors.newSingleThreadExecutor();
            Future<Integer> slow;
            try {
                slow = executor.submit(() -> engine.rearmAll());
                assertThat(slowReadStarted.await(5, TimeUnit.SECONDS)).isTrue();

                engine.rearmAll();
                releaseSlowRead.countDown();
                Future<Integer> finished = slow;
                assertThatThrownBy(() -> finished.get(5, TimeUnit.SECONDS))
                        .hasCauseInstanceOf(NotificationStoreException.class);
            } finally {
                executor.shutdownNow();
            }

            assertThat(engine.armedIds()).containsExactly(2L);
            assertThat(engine.state()).isEqualTo(SchedulerState.ARMED);
            scheduledFutures.forEach(future -> verify(future, never()).cancel(anyBoolean()));
        }

        @Test
        void armOneAfterFailedInitializationMarksTheEngineArmed() {
            when(notificationStore.listActive())
                    .thenThrow(new NotificationStoreException("down", new DataAccessResourceFailureException("down")));
            assertThatThrownBy(() -> engine.initializeAll()).isInstanceOf(NotificationStoreException.class);

            engine.armOne(active(1));

            assertThat(engine.count()).isEqualTo(1);
            assertThat(engine.state()).isEqualTo(SchedulerState.ARMED);
        }
    }

    @Nested
    class Firing {

        @BeforeEach
        void armOne() {
            when(notificationStore.listActive()).thenReturn(List.of(active(1)));
            engine.initializeAll();
        }

        @Test
        void successRecordsExactlyOneSentEntry() {
            when(messageSender.send("message 1")).thenReturn(SendResult.delivered());

            taskFor(1).run();

            verify(notificationStore, times(1)).recordDelivery(1L, DeliveryStatus.SENT, null);
            verify(notificationStore, times(1)).recordDelivery(anyLong(), any(), any());
        }

        @Test
        void failureRecordsOneFailedEntryAndKeepsTheTimer() {
            when(messageSender.send("message 1")).thenReturn(SendResult.failure("Slack responded 500: oops"));

            taskFor(1).run();

            verify(notificationStore, times(1)).recordDelivery(1L, DeliveryStatus.FAILED, "Slack responded 500: oops");
            verify(notificationStore, never()).recordDelivery(anyLong(), eq(DeliveryStatus.SENT), any());
            assertThat(engine.armedIds()).containsExactly(1L);
            verify(scheduledFutures.get(0), never()).cancel(anyBoolean());
        }

        @Test
        void blankFailureDetailBecomesUnknownError() {
            when(messageSender.send(anyString())).thenReturn(SendResult.failure(null));

            taskFor(1).run();

            verify(notificationStore).recordDelivery(1L, DeliveryStatus.FAILED, "unknown error");
        }

        @Test
        void longFailureDetailIsTruncated() {
            String detail = "x".repeat(DeliveryTask.ERROR_DETAIL_MAX_LENGTH + 500);
            when(messageSender.send(anyString())).thenReturn(SendResult.failure(detail));

            taskFor(1).run();

            verify(notificationStore).recordDelivery(
                    1L, DeliveryStatus.FAILED, "x".repeat(DeliveryTask.ERROR_DETAIL_MAX_LENGTH));
        }

        @Test
        void senderExceptionIsRecordedAsFailure() {
            when(messageSender.send(anyString())).thenThrow(new IllegalStateException("connection reset"));

            assertThatCode(() -> taskFor(1).run()).doesNotThrowAnyException();

            verify(notificationStore).recordDelivery(1L, DeliveryStatus.FAILED, "connection reset");
        }

        @Test
        void logWriteFailureIsNotPropagated() {
            when(messageSender.send(anyString())).thenReturn(SendResult.delivered());
            doThrow(new NotificationStoreException("down", new DataAccessResourceFailureException("down")))
                    .when(notificationStore).recordDelivery(anyLong(), any(), isNull());

            assertThatCode(() -> taskFor(1).run()).doesNotThrowAnyException();
            assertThat(engine.armedIds()).containsExactly(1L);
        }

        @Test
        void notificationIdIsInTheLoggingContextWhileSending() {
            AtomicReference<String> seen = new AtomicReference<>();
            when(messageSender.send(anyString())).thenAnswer(invocation -> {
                seen.set(MDC.get(DeliveryTask.NOTIFICATION_ID_MDC_KEY));
                return SendResult.delivered();
            });

            taskFor(1).run();

            assertThat(seen.get()).isEqualTo("1");
            assertThat(MDC.get(DeliveryTask.NOTIFICATION_ID_MDC_KEY)).isNull();
        }
    }

    @Nested
    class Probe {

        @Test
        void successfulProbeIsNotLogged() {
            when(messageSender.send("ping")).thenReturn(SendResult.delivered());

            engine.sendProbe("ping");

            verifyNoInteractions(notificationStore);
        }

        @Test
        void failedProbeThrowsWithTheReason() {
            when(messageSender.send("ping")).thenReturn(SendResult.failure("Slack responded 404: no_service"));

            assertThatThrownBy(() -> engine.sendProbe("ping"))
                    .isInstanceOf(MessageDeliveryException.class)
                    .hasMessage("Slack responded 404: no_service");
            verifyNoInteractions(notificationStore);
        }
    }
}
