package com.fintech.oracle.trigger;

import com.fintech.oracle.domain.AggregatedPrice;
import com.fintech.oracle.domain.PriceAlertCondition;
import com.fintech.oracle.domain.Trigger;
import com.fintech.oracle.domain.TriggerRequest;
import com.fintech.oracle.domain.TriggerType;
import com.fintech.oracle.exception.DuplicateTriggerException;
import com.fintech.oracle.exception.InvalidConditionException;
import com.fintech.oracle.exception.InvalidScheduleException;
import com.fintech.oracle.exception.TriggerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;

/**
 * Thread-safe store of triggers plus the price-alert index keyed by (symbol, owner).
 *
 * A single read-write lock covers both maps, so readers never see a trigger without its
 * index entry or the reverse. Empty owner and symbol buckets are pruned on delete.
 */
public class TriggerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TriggerRegistry.class);

    private final Map<String, Trigger> triggers = new LinkedHashMap<>();
    // symbol -> owner -> alerts
    private final Map<String, Map<String, List<PriceAlert>>> alertIndex = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Validates and registers a trigger. Nothing is stored if any check fails.
     *
     * @throws DuplicateTriggerException if the id is already registered
     * @throws InvalidScheduleException if a schedule trigger's cron expression does not parse
     * @throws InvalidConditionException if a price-alert condition does not parse
     */
    public Trigger create(TriggerRequest request) {
        if (request == null || request.id() == null || request.id().isBlank()) {
            throw new IllegalArgumentException("Trigger id cannot be blank");
        }
        if (request.type() == null) {
            throw new IllegalArgumentException("Trigger type cannot be null: " + request.id());
        }
        if (request.functionId() == null || request.functionId().isBlank()) {
            throw new IllegalArgumentException("Function id cannot be blank: " + request.id());
        }

        Trigger trigger = buildTrigger(request);

        lock.writeLock().lock();
        try {
            if (triggers.containsKey(trigger.id())) {
                throw new DuplicateTriggerException(trigger.id());
            }
            triggers.put(trigger.id(), trigger);
            if (trigger.type() == TriggerType.PRICE_ALERT) {
                alertIndex
                    .computeIfAbsent(trigger.condition().symbol(), s -> new HashMap<>())
                    .computeIfAbsent(trigger.ownerId(), o -> new ArrayList<>())
                    .add(new PriceAlert(trigger.id(), trigger.condition()));
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Trigger registered: id={}, type={}, owner={}, function={}",
                 trigger.id(), trigger.type(), trigger.ownerId(), trigger.functionId());
        return trigger;
    }

    /**
     * Removes a trigger and its alert-index entry.
     *
     * @return the removed trigger
     * @throws TriggerNotFoundException if no trigger has this id
     */
    public Trigger delete(String id) {
        Trigger removed;
        lock.writeLock().lock();
        try {
            removed = triggers.remove(id);
            if (removed == null) {
                throw new TriggerNotFoundException(id);
            }
            if (removed.type() == TriggerType.PRICE_ALERT) {
                removeAlert(removed);
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Trigger deleted: id={}, type={}", id, removed.type());
        return removed;
    }

    /**
     * @throws TriggerNotFoundException if no trigger has this id
     */
    public Trigger get(String id) {
        return find(id).orElseThrow(() -> new TriggerNotFoundException(id));
    }

    public Optional<Trigger> find(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(triggers.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Every trigger in registration order. */
    public List<Trigger> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(triggers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Trigger> listByOwner(String ownerId) {
        lock.readLock().lock();
        try {
            return triggers.values().stream()
                .filter(t -> ownerId != null && ownerId.equals(t.ownerId()))
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Trigger> listByType(TriggerType type) {
        lock.readLock().lock();
        try {
            return triggers.values().stream()
                .filter(t -> t.type() == type)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Alert-index entries for a symbol, across all owners. */
    public List<PriceAlertCondition> alertsFor(String symbol) {
        lock.readLock().lock();
        try {
            Map<String, List<PriceAlert>> owners = alertIndex.get(symbol);
            if (owners == null) {
                return List.of();
            }
            List<PriceAlertCondition> conditions = new ArrayList<>();
            owners.values().forEach(alerts -> alerts.forEach(a -> conditions.add(a.condition())));
            return conditions;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Evaluates every indexed alert against the given prices while holding the read lock.
     * The callback runs once per satisfied alert whose trigger is still registered; it must
     * not block and must not call back into write operations.
     *
     * @return number of matches
     */
    public int scanAlerts(Map<String, AggregatedPrice> prices, BiConsumer<Trigger, AggregatedPrice> onMatch) {
        int matches = 0;
        lock.readLock().lock();
        try {
            for (Map.Entry<String, AggregatedPrice> entry : prices.entrySet()) {
                Map<String, List<PriceAlert>> owners = alertIndex.get(entry.getKey());
                if (owners == null) {
                    continue;
                }
                AggregatedPrice price = entry.getValue();
                for (List<PriceAlert> alerts : owners.values()) {
                    for (PriceAlert alert : alerts) {
                        if (!alert.condition().matches(price.value())) {
                            continue;
                        }
                        Trigger trigger = triggers.get(alert.triggerId());
                        if (trigger == null) {
                            continue;
                        }
                        matches++;
                        onMatch.accept(trigger, price);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return matches;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return triggers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of symbols with at least one indexed alert. */
    public int indexedSymbolCount() {
        lock.readLock().lock();
        try {
            return alertIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Trigger buildTrigger(TriggerRequest request) {
        String schedule = null;
        PriceAlertCondition condition = null;

        switch (request.type()) {
            case SCHEDULE -> {
                try {
                    schedule = CronSchedules.normalize(request.schedule());
                } catch (IllegalArgumentException e) {
                    throw new InvalidScheduleException(request.id(),
                        "Invalid cron expression '" + request.schedule() + "': " + e.getMessage(), e);
                }
            }
            case PRICE_ALERT -> {
                try {
                    condition = PriceAlertCondition.parse(request.condition());
                } catch (IllegalArgumentException e) {
                    throw new InvalidConditionException(request.id(), e.getMessage(), e);
                }
            }
        }

        return new Trigger(request.id(), request.ownerId(), request.type(), schedule, condition,
                           request.functionId(), request.parameters(), Instant.now());
    }

    // Caller holds the write lock
    private void removeAlert(Trigger trigger) {
        String symbol = trigger.condition().symbol();
        Map<String, List<PriceAlert>> owners = alertIndex.get(symbol);
        if (owners == null) {
            return;
        }
        List<PriceAlert> alerts = owners.get(trigger.ownerId());
        if (alerts != null) {
            alerts.removeIf(a -> a.triggerId().equals(trigger.id()));
            if (alerts.isEmpty()) {
                owners.remove(trigger.ownerId());
            }
        }
        if (owners.isEmpty()) {
            alertIndex.remove(symbol);
        }
    }
}
