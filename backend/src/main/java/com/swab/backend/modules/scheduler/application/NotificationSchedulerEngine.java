package com.swab.backend.modules.scheduler.application;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

import com.swab.backend.modules.scheduler.domain.NotificationDefinition;
import com.swab.backend.modules.scheduler.domain.ScheduledJob;
import com.swab.backend.modules.scheduler.domain.SchedulerState;
import com.swab.backend.modules.scheduler.domain.WeeklyRecurrence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Owns the live set of weekly timers, one per active notification id.
 * <p>
 * The id to timer mapping is an immutable snapshot replaced under {@link #monitor}; readers never
 * see a half-built set. Store reads and message sends always happen outside the monitor.
 * Cancelling a timer stops its future occurrences only, a firing already running completes.
 */
@Service
public class NotificationSchedulerEngine {

    private static final Logger log = LoggerFactory.getLogger(NotificationSchedulerEngine.class);

    private final TaskScheduler taskScheduler;
    private final NotificationStore notificationStore;
    private final MessageSender messageSender;
    private final ZoneId zone;
    private final Clock clock;

    private final Object monitor = new Object();
    private final AtomicLong rearmTickets = new AtomicLong();

    private volatile Map<Long, ArmedTimer> armed = Map.of();
    private volatile SchedulerState state = SchedulerState.EMPTY;

    // guarded by monitor
    private long appliedTicket;

    public NotificationSchedulerEngine(
            TaskScheduler notificationTaskScheduler,
            NotificationStore notificationStore,
            MessageSender messageSender,
            ZoneId applicationZone,
            Clock clock
    ) {
        this.taskScheduler = notificationTaskScheduler;
        this.notificationStore = notificationStore;
        this.messageSender = messageSender;
        this.zone = applicationZone;
        this.clock = clock;
    }

    /**
     * Loads every active definition and arms one timer each.
     *
     * @return number of armed timers
     * @throws NotificationStoreException when the definitions cannot be loaded; no timer is left armed
     */
    public int initializeAll() {
        log.info("initializing notification scheduler");
        return reload();
    }

    /**
     * Stops every timer and re-arms from the current store contents.
     *
     * @return number of armed timers
     * @throws NotificationStoreException when the definitions cannot be loaded; no timer is left armed
     */
    public int rearmAll() {
        log.info("refreshing notification scheduler");
        return reload();
    }

    /**
     * Arms (or re-arms) the timer for one definition. An inactive definition clears any existing timer.
     */
    public void armOne(NotificationDefinition definition) {
        if (!definition.active()) {
            disarmOne(definition.id());
            return;
        }
        synchronized (monitor) {
            ArmedTimer timer = arm(definition);
            Map<Long, ArmedTimer> next = new LinkedHashMap<>(armed);
            ArmedTimer previous = next.put(definition.id(), timer);
            if (previous != null) {
                previous.cancel();
            }
            armed = Collections.unmodifiableMap(next);
            state = SchedulerState.ARMED;
        }
    }

    public void disarmOne(long notificationId) {
        synchronized (monitor) {
            if (!armed.containsKey(notificationId)) {
                return;
            }
            Map<Long, ArmedTimer> next = new LinkedHashMap<>(armed);
            next.remove(notificationId).cancel();
            armed = Collections.unmodifiableMap(next);
        }
        log.info("unscheduled notification id={}", notificationId);
    }

    /**
     * Stops every timer. Used on shutdown.
     */
    public void disarmAll() {
        synchronized (monitor) {
            cancelAll(armed.values());
            armed = Map.of();
            state = SchedulerState.EMPTY;
        }
    }

    public int count() {
        return armed.size();
    }

    public SchedulerState state() {
        return state;
    }

    public Set<Long> armedIds() {
        return armed.keySet();
    }

    public List<ScheduledJob> jobs() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        return armed.values().stream()
                .sorted(Comparator.comparingLong(timer -> timer.definition().id()))
                .map(timer -> new ScheduledJob(
                        timer.definition().id(),
                        timer.recurrence(),
                        timer.recurrence().nextOccurrenceAfter(now)
                ))
                .toList();
    }

    /**
     * Sends one message immediately, outside any schedule. Nothing is logged to the store.
     *
     * @throws MessageDeliveryException when the sender reports a failure
     */
    public void sendProbe(String text) {
        SendResult result = messageSender.send(text);
        if (!result.success()) {
            log.warn("probe message failed detail={}", result.errorMessage());
            throw new MessageDeliveryException(result.errorMessage() != null ? result.errorMessage() : "unknown error");
        }
        log.info("probe message sent");
    }

    private int reload() {
        long ticket = rearmTickets.incrementAndGet();
        synchronized (monitor) {
            // a newer reload may already have been applied
            if (ticket > appliedTicket) {
                state = SchedulerState.LOADING;
            }
        }

        List<NotificationDefinition> definitions;
        try {
            definitions = notificationStore.listActive();
        } catch (NotificationStoreException ex) {
            boolean cleared = false;
            synchronized (monitor) {
                if (ticket > appliedTicket) {
                    appliedTicket = ticket;
                    cancelAll(armed.values());
                    armed = Map.of();
                    state = SchedulerState.EMPTY;
                    cleared = true;
                }
            }
            if (cleared) {
                log.error("[ALERT][Schedule] failed to load active notifications; all timers stopped", ex);
            } else {
                log.warn("stale reload ticket={} failed to load active notifications; newer timer set kept", ticket, ex);
            }
            throw ex;
        }

        synchronized (monitor) {
            if (ticket < appliedTicket) {
                log.info("discarding stale reload ticket={} applied={}", ticket, appliedTicket);
                return armed.size();
            }
            appliedTicket = ticket;
            cancelAll(armed.values());

            Map<Long, ArmedTimer> next = new LinkedHashMap<>();
            for (NotificationDefinition definition : definitions) {
                if (!definition.active() || next.containsKey(definition.id())) {
                    continue;
                }
                try {
                    next.put(definition.id(), arm(definition));
                } catch (IllegalArgumentException | IllegalStateException | TaskRejectedException ex) {
                    log.error("[ALERT][Schedule] could not schedule notification id={}", definition.id(), ex);
                }
            }
            armed = Collections.unmodifiableMap(next);
            state = SchedulerState.ARMED;
        }
        log.info("scheduled {} notifications", armed.size());
        return armed.size();
    }

    private ArmedTimer arm(NotificationDefinition definition) {
        WeeklyRecurrence recurrence = definition.recurrence();
        DeliveryTask task = new DeliveryTask(definition, messageSender, notificationStore);
        ScheduledFuture<?> future = taskScheduler.schedule(task, recurrence.toTrigger(zone));
        if (future == null) {
            throw new IllegalStateException("trigger produced no executions for " + recurrence.toCronExpression());
        }
        log.info("scheduled notification id={} for {}", definition.id(), recurrence.describe());
        return new ArmedTimer(definition, recurrence, future);
    }

    private static void cancelAll(Collection<ArmedTimer> timers) {
        timers.forEach(ArmedTimer::cancel);
    }

    private record ArmedTimer(NotificationDefinition definition, WeeklyRecurrence recurrence, ScheduledFuture<?> future) {

        void cancel() {
            future.cancel(false);
        }
    }
}
