package com.agentmesh.engine.bus;

import com.agentmesh.core.exception.RecipientUnavailableException;
import com.agentmesh.core.model.DeliveryReceipt;
import com.agentmesh.core.model.Message;
import com.agentmesh.core.model.MessageType;
import com.agentmesh.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process communication bus with at-least-once, per-pair ordered delivery.
 *
 * Each sender/recipient pair is a FIFO channel with at most one message in flight. The next
 * message is released only when the in-flight one is acknowledged or dead-lettered, which is
 * what keeps a pair in sequence order across redeliveries. Unrelated pairs proceed in parallel
 * on the dispatcher pool.
 *
 * Endpoints that have ever sent a heartbeat (or been touched) are liveness-tracked: once silent
 * past the liveness window they are unreachable. Other endpoints are reachable while subscribed.
 */
public class InMemoryCommunicationBus implements CommunicationBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCommunicationBus.class);

    private final BusSettings settings;
    private final Clock clock;
    private final ExecutorService dispatcher;
    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Map<String, List<SubscriptionImpl>> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Instant> livenessSignals = new ConcurrentHashMap<>();
    private final Map<PairKey, PairChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, PairChannel> inFlightIndex = new ConcurrentHashMap<>();
    private final Map<PairKey, AtomicLong> broadcastSequences = new ConcurrentHashMap<>();
    private final Deque<DeadLetter> deadLetters = new ConcurrentLinkedDeque<>();
    private final List<Consumer<DeadLetter>> deadLetterListeners = new CopyOnWriteArrayList<>();

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong redeliveredCount = new AtomicLong();
    private final AtomicLong deadLetteredCount = new AtomicLong();

    public InMemoryCommunicationBus(BusSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.dispatcher = Executors.newFixedThreadPool(settings.dispatcherThreads(), namedThreads("agentmesh-bus"));
        this.sweeper = Executors.newSingleThreadScheduledExecutor(namedThreads("agentmesh-bus-sweeper"));
    }

    /**
     * Start the periodic redelivery sweep.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Communication bus already running");
            return;
        }
        long period = settings.sweepInterval().toMillis();
        sweeper.scheduleWithFixedDelay(this::sweepSafely, period, period, TimeUnit.MILLISECONDS);
        log.info("Communication bus started (ackTimeout={}, maxDeliveries={}, livenessWindow={})",
            settings.ackTimeout(), settings.maxDeliveries(), settings.livenessWindow());
    }

    /**
     * Stop the sweep and the dispatcher. Undelivered messages are dropped.
     */
    public void stop() {
        running.set(false);
        sweeper.shutdown();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(10, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Communication bus stopped");
    }

    @Override
    public DeliveryReceipt send(Message message) {
        Instant now = clock.instant();
        recordActivity(message.sender(), now);
        sentCount.incrementAndGet();

        if (message.type().isBroadcast()) {
            return broadcast(message, now);
        }

        String recipient = message.recipient();
        if (!hasSubscription(recipient)) {
            throw new RecipientUnavailableException(recipient, "no subscription");
        }
        if (!isLive(recipient, now)) {
            throw new RecipientUnavailableException(recipient,
                "no liveness signal within " + settings.livenessWindow());
        }

        PairChannel channel = channels.computeIfAbsent(new PairKey(message.sender(), recipient), PairChannel::new);
        Message stamped;
        Message released;
        synchronized (channel) {
            stamped = message.withSequence(++channel.lastSequence, now);
            channel.queue.add(stamped);
            released = channel.releaseNext(now);
        }
        log.debug("Accepted {} {} -> {} seq={}", stamped.type(), stamped.sender(), recipient,
            stamped.sequenceNumber());

        if (released != null) {
            deliver(released);
        }
        return DeliveryReceipt.of(stamped, now);
    }

    @Override
    public Subscription subscribe(String endpoint, Predicate<Message> filter, MessageHandler handler) {
        SubscriptionImpl subscription = new SubscriptionImpl(endpoint, filter, handler);
        subscriptions.compute(endpoint, (k, subs) -> {
            List<SubscriptionImpl> updated = subs != null ? subs : new CopyOnWriteArrayList<>();
            updated.add(subscription);
            return updated;
        });
        recordActivity(endpoint, clock.instant());
        log.info("Endpoint {} subscribed", endpoint);

        // a returning endpoint picks up whatever is already waiting for it
        redeliverPendingFor(endpoint);
        return subscription;
    }

    @Override
    public void ack(DeliveryReceipt receipt) {
        Instant now = clock.instant();
        recordActivity(receipt.recipient(), now);

        PairChannel channel = inFlightIndex.remove(receipt.messageId());
        if (channel == null) {
            log.debug("Ignoring ack for settled message {}", receipt.messageId());
            return;
        }

        Message released;
        synchronized (channel) {
            if (channel.inFlight == null || !channel.inFlight.messageId().equals(receipt.messageId())) {
                return;
            }
            channel.inFlight = null;
            channel.ackDeadline = null;
            released = channel.releaseNext(now);
        }
        if (released != null) {
            deliver(released);
        }
    }

    @Override
    public void touch(String endpoint) {
        livenessSignals.put(endpoint, clock.instant());
    }

    @Override
    public boolean isReachable(String endpoint) {
        return hasSubscription(endpoint) && isLive(endpoint, clock.instant());
    }

    @Override
    public List<DeadLetter> deadLetters() {
        return List.copyOf(deadLetters);
    }

    @Override
    public void onDeadLetter(Consumer<DeadLetter> listener) {
        deadLetterListeners.add(listener);
    }

    @Override
    public BusStats stats() {
        int inFlight = 0;
        int queued = 0;
        for (PairChannel channel : channels.values()) {
            synchronized (channel) {
                inFlight += channel.inFlight != null ? 1 : 0;
                queued += channel.queue.size();
            }
        }
        int subs = subscriptions.values().stream().mapToInt(List::size).sum();
        return new BusStats(sentCount.get(), deliveredCount.get(), redeliveredCount.get(),
            deadLetteredCount.get(), inFlight, queued, subs);
    }

    /**
     * Redeliver in-flight messages whose ack deadline passed, dead-letter those out of
     * deliveries, and dead-letter everything queued for endpoints that became unreachable.
     * Runs on the sweeper once started; tests may call it directly.
     *
     * @return number of messages redelivered or dead-lettered
     */
    public int redeliverExpired() {
        Instant now = clock.instant();
        List<Message> toDeliver = new ArrayList<>();
        List<DeadLetter> toDeadLetter = new ArrayList<>();

        for (PairChannel channel : channels.values()) {
            String recipient = channel.key.recipient();
            boolean reachable = hasSubscription(recipient) && isLive(recipient, now);
            synchronized (channel) {
                if (!reachable) {
                    if (channel.inFlight != null) {
                        toDeadLetter.add(channel.deadLetterInFlight(DeadLetter.Reason.RECIPIENT_UNAVAILABLE, now));
                    }
                    while (!channel.queue.isEmpty()) {
                        toDeadLetter.add(new DeadLetter(channel.queue.poll(),
                            DeadLetter.Reason.RECIPIENT_UNAVAILABLE, 0, now));
                    }
                } else if (channel.inFlight != null && !now.isBefore(channel.ackDeadline)) {
                    if (channel.inFlight.deliveryAttempt() >= settings.maxDeliveries()) {
                        toDeadLetter.add(channel.deadLetterInFlight(DeadLetter.Reason.MAX_DELIVERIES_EXCEEDED, now));
                        Message released = channel.releaseNext(now);
                        if (released != null) {
                            toDeliver.add(released);
                        }
                    } else {
                        channel.inFlight = channel.inFlight.withDeliveryAttempt(channel.inFlight.deliveryAttempt() + 1);
                        channel.ackDeadline = now.plus(settings.ackTimeout());
                        redeliveredCount.incrementAndGet();
                        toDeliver.add(channel.inFlight);
                    }
                }
            }
        }

        toDeadLetter.forEach(this::publishDeadLetter);
        toDeliver.forEach(this::deliver);
        return toDeliver.size() + toDeadLetter.size();
    }

    // ========== Internal Methods ==========

    private DeliveryReceipt broadcast(Message message, Instant now) {
        if (message.type() == MessageType.HEARTBEAT) {
            touch(message.sender());
        }
        long sequence = broadcastSequences
            .computeIfAbsent(new PairKey(message.sender(), message.recipient()), k -> new AtomicLong())
            .incrementAndGet();
        Message stamped = message.withSequence(sequence, now).withDeliveryAttempt(1);

        for (List<SubscriptionImpl> endpointSubs : subscriptions.values()) {
            for (SubscriptionImpl subscription : endpointSubs) {
                if (!subscription.endpoint.equals(message.sender()) && subscription.accepts(stamped)) {
                    execute(() -> invoke(subscription, stamped));
                }
            }
        }
        return DeliveryReceipt.of(stamped, now);
    }

    private void deliver(Message message) {
        execute(() -> {
            SubscriptionImpl subscription = findSubscription(message);
            if (subscription == null) {
                log.debug("No subscription of {} accepts message {}; left for the sweep",
                    message.recipient(), message.messageId());
                return;
            }
            invoke(subscription, message);
        });
    }

    private void invoke(SubscriptionImpl subscription, Message message) {
        try (LoggingContext ctx = LoggingContext.forMessage(message)) {
            deliveredCount.incrementAndGet();
            subscription.handler.onMessage(message, DeliveryReceipt.of(message, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Handler at {} failed on {} {} (delivery {}); it will be redelivered",
                subscription.endpoint, message.type(), message.messageId(), message.deliveryAttempt(), e);
        }
    }

    private void execute(Runnable runnable) {
        try {
            dispatcher.execute(runnable);
        } catch (RejectedExecutionException e) {
            log.debug("Bus dispatcher is shut down; dropping delivery");
        }
    }

    private SubscriptionImpl findSubscription(Message message) {
        for (SubscriptionImpl subscription : subscriptions.getOrDefault(message.recipient(), List.of())) {
            if (subscription.accepts(message)) {
                return subscription;
            }
        }
        return null;
    }

    private void redeliverPendingFor(String endpoint) {
        Instant now = clock.instant();
        List<Message> toDeliver = new ArrayList<>();
        for (PairChannel channel : channels.values()) {
            if (!channel.key.recipient().equals(endpoint)) {
                continue;
            }
            synchronized (channel) {
                if (channel.inFlight != null) {
                    channel.ackDeadline = now.plus(settings.ackTimeout());
                    toDeliver.add(channel.inFlight);
                } else {
                    Message released = channel.releaseNext(now);
                    if (released != null) {
                        toDeliver.add(released);
                    }
                }
            }
        }
        toDeliver.forEach(this::deliver);
    }

    private void publishDeadLetter(DeadLetter deadLetter) {
        deadLetters.addLast(deadLetter);
        while (deadLetters.size() > settings.deadLetterCapacity()) {
            deadLetters.pollFirst();
        }
        deadLetteredCount.incrementAndGet();
        log.warn("Dead-lettered {} {} -> {} after {} deliveries: {}",
            deadLetter.message().type(), deadLetter.message().sender(), deadLetter.message().recipient(),
            deadLetter.deliveries(), deadLetter.reason());

        for (Consumer<DeadLetter> listener : deadLetterListeners) {
            try {
                listener.accept(deadLetter);
            } catch (RuntimeException e) {
                log.error("Dead-letter listener failed for message {}", deadLetter.message().messageId(), e);
            }
        }
    }

    private boolean hasSubscription(String endpoint) {
        List<SubscriptionImpl> subs = subscriptions.get(endpoint);
        return subs != null && !subs.isEmpty();
    }

    private boolean isLive(String endpoint, Instant now) {
        Instant last = livenessSignals.get(endpoint);
        return last == null || !last.plus(settings.livenessWindow()).isBefore(now);
    }

    /**
     * Any traffic from a liveness-tracked endpoint counts as a signal.
     */
    private void recordActivity(String endpoint, Instant now) {
        livenessSignals.computeIfPresent(endpoint, (k, previous) -> now.isAfter(previous) ? now : previous);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void sweepSafely() {
        if (!running.get()) {
            return;
        }
        try {
            redeliverExpired();
        } catch (Exception e) {
            log.error("Redelivery sweep failed", e);
        }
    }

    private record PairKey(String sender, String recipient) {
    }

    /**
     * FIFO state of one sender/recipient pair. Guarded by its own monitor.
     */
    private final class PairChannel {
        private final PairKey key;
        private final Deque<Message> queue = new ArrayDeque<>();
        private long lastSequence;
        private Message inFlight;
        private Instant ackDeadline;

        private PairChannel(PairKey key) {
            this.key = key;
        }

        /**
         * Put the head of the queue in flight if nothing is. Caller holds the monitor.
         */
        private Message releaseNext(Instant now) {
            if (inFlight != null || queue.isEmpty()) {
                return null;
            }
            inFlight = queue.poll().withDeliveryAttempt(1);
            ackDeadline = now.plus(settings.ackTimeout());
            inFlightIndex.put(inFlight.messageId(), this);
            return inFlight;
        }

        /**
         * Caller holds the monitor.
         */
        private DeadLetter deadLetterInFlight(DeadLetter.Reason reason, Instant now) {
            DeadLetter deadLetter = new DeadLetter(inFlight, reason, inFlight.deliveryAttempt(), now);
            inFlightIndex.remove(inFlight.messageId());
            inFlight = null;
            ackDeadline = null;
            return deadLetter;
        }
    }

    private final class SubscriptionImpl implements Subscription {
        private final String endpoint;
        private final Predicate<Message> filter;
        private final MessageHandler handler;
        private volatile boolean active = true;

        private SubscriptionImpl(String endpoint, Predicate<Message> filter, MessageHandler handler) {
            this.endpoint = endpoint;
            this.filter = filter;
            this.handler = handler;
        }

        private boolean accepts(Message message) {
            return active && filter.test(message);
        }

        @Override
        public String endpoint() {
            return endpoint;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void unsubscribe() {
            if (!active) {
                return;
            }
            active = false;
            subscriptions.computeIfPresent(endpoint, (k, subs) -> {
                subs.remove(this);
                return subs.isEmpty() ? null : subs;
            });
            log.info("Endpoint {} unsubscribed", endpoint);
        }
    }
}
