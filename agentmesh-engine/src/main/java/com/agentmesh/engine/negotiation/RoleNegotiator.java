package com.agentmesh.engine.negotiation;

import com.agentmesh.core.exception.NoQualifiedAgentException;
import com.agentmesh.core.exception.RecipientUnavailableException;
import com.agentmesh.core.model.AgentAvailability;
import com.agentmesh.core.model.AgentDescriptor;
import com.agentmesh.core.model.Capability;
import com.agentmesh.core.model.DeliveryReceipt;
import com.agentmesh.core.model.Message;
import com.agentmesh.core.model.MessageType;
import com.agentmesh.core.model.TaskRef;
import com.agentmesh.core.protocol.Bid;
import com.agentmesh.core.protocol.BidRequest;
import com.agentmesh.core.protocol.Endpoints;
import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.bus.MessageFilters;
import com.agentmesh.engine.bus.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Staffs tasks with agents.
 *
 * <p>Candidates are the IDLE agents declaring the capability. None means
 * {@link NoQualifiedAgentException}, flagged as busy when live agents declare the capability
 * but are all working; exactly one is claimed directly; several are asked for bids
 * over the bus. The cheapest bid wins, ties going to the lexicographically smallest agent id.
 * Agents that do not answer before the deadline are treated as declining. If the winner was
 * claimed elsewhere in the meantime, the next bid is tried.</p>
 *
 * <p>Agents that already failed the task are only considered when nobody else qualifies.</p>
 */
public class RoleNegotiator {

    private static final Logger log = LoggerFactory.getLogger(RoleNegotiator.class);

    private static final Comparator<Bid> BID_ORDER = Comparator
        .comparingDouble(Bid::costEstimate)
        .thenComparing(Bid::agentId);

    private final AgentRegistry registry;
    private final CommunicationBus bus;
    private final AssignmentLedger ledger;
    private final NegotiationSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, BidRound> rounds = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public RoleNegotiator(
            AgentRegistry registry,
            CommunicationBus bus,
            AssignmentLedger ledger,
            NegotiationSettings settings,
            ObjectMapper objectMapper,
            Clock clock) {
        this.registry = registry;
        this.bus = bus;
        this.ledger = ledger;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Subscribe to bids and to agent heartbeats.
     */
    public void start() {
        subscriptions.add(bus.subscribe(Endpoints.NEGOTIATOR,
            MessageFilters.addressedTo(Endpoints.NEGOTIATOR).and(MessageFilters.ofType(MessageType.BID)),
            this::onBid));
        subscriptions.add(bus.subscribe(Endpoints.NEGOTIATOR,
            MessageFilters.topic(Endpoints.HEARTBEAT_TOPIC),
            this::onHeartbeat));
        log.info("Role negotiator started");
    }

    public void stop() {
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
        log.info("Role negotiator stopped");
    }

    /**
     * Pick and claim an agent for the task. Blocks for at most the bid timeout.
     *
     * @param excludedAgents agents that already failed this task
     * @throws NoQualifiedAgentException if nobody can be claimed
     */
    public Assignment negotiate(TaskRef task, String capability, Set<String> excludedAgents) {
        List<AgentDescriptor> candidates = registry.candidates(capability);
        if (candidates.isEmpty()) {
            if (registry.hasLiveAgent(capability)) {
                throw NoQualifiedAgentException.busy(capability, "every live agent is busy");
            }
            throw new NoQualifiedAgentException(capability);
        }

        List<AgentDescriptor> preferred = candidates.stream()
            .filter(a -> !excludedAgents.contains(a.agentId()))
            .collect(Collectors.toList());
        if (!preferred.isEmpty()) {
            candidates = preferred;
        } else {
            log.info("Only previously failing agents qualify for {} ({}); reusing them",
                task, capability);
        }

        if (candidates.size() == 1) {
            AgentDescriptor only = candidates.get(0);
            if (!registry.claim(only.agentId(), task)) {
                throw NoQualifiedAgentException.busy(capability,
                    "sole candidate " + only.agentId() + " was claimed concurrently");
            }
            double cost = only.capability(capability).map(Capability::costEstimate).orElse(0.0);
            return assigned(only.agentId(), task, capability, cost, 1, 0);
        }

        List<Bid> bids = runBidRound(task, capability, candidates);
        for (Bid bid : bids) {
            if (registry.claim(bid.agentId(), task)) {
                return assigned(bid.agentId(), task, capability, bid.costEstimate(), candidates.size(), bids.size());
            }
            log.debug("Winning bidder {} for {} was claimed elsewhere; trying next", bid.agentId(), task);
        }

        if (bids.isEmpty()) {
            throw new NoQualifiedAgentException(capability, "no candidate bid before the deadline");
        }
        throw NoQualifiedAgentException.busy(capability, "every bidder was claimed concurrently");
    }

    /**
     * Return an agent to IDLE and record how its assignment ended.
     */
    public void release(String agentId, TaskRef task, AssignmentOutcome outcome) {
        registry.release(agentId, task);
        ledger.recordOutcome(agentId, task, outcome);
    }

    /**
     * Re-establish an assignment that survived a restart.
     *
     * @return true if the agent is live and now (or still) BUSY with the task
     */
    public boolean reclaim(String agentId, TaskRef task) {
        if (!registry.isLive(agentId)) {
            return false;
        }
        AgentDescriptor agent = registry.get(agentId);
        if (agent.availability() == AgentAvailability.BUSY) {
            return task.equals(agent.currentAssignment());
        }
        return registry.claim(agentId, task);
    }

    // ========== Internal Methods ==========

    private Assignment assigned(String agentId, TaskRef task, String capability, double cost,
                                int candidates, int bids) {
        Assignment assignment = new Assignment(agentId, task, capability, cost, candidates, bids, clock.instant());
        ledger.recordAssignment(assignment);
        log.info("Assigned {} to agent {} (capability={}, cost={}, candidates={}, bids={})",
            task, agentId, capability, cost, candidates, bids);
        return assignment;
    }

    private List<Bid> runBidRound(TaskRef task, String capability, List<AgentDescriptor> candidates) {
        String roundId = UUID.randomUUID().toString();
        Set<String> invited = candidates.stream().map(AgentDescriptor::agentId).collect(Collectors.toSet());
        BidRound round = new BidRound(capability, invited);
        rounds.put(roundId, round);

        try {
            Instant replyBy = clock.instant().plus(settings.bidTimeout());
            for (String agentId : invited) {
                BidRequest request = new BidRequest(roundId, task.workflowId(), task.taskId(), capability, replyBy);
                Message message = Message.create(Endpoints.NEGOTIATOR, agentId, MessageType.BID_REQUEST,
                    objectMapper.valueToTree(request), roundId + ":" + agentId, roundId);
                try {
                    bus.send(message);
                } catch (RecipientUnavailableException e) {
                    log.debug("Candidate {} unreachable for bid round {}", agentId, roundId);
                    round.offer(agentId, null);
                }
            }

            round.await(settings.bidTimeout());
            List<Bid> bids = round.bids();
            bids.sort(BID_ORDER);
            log.debug("Bid round {} for {} closed with {} of {} bids", roundId, task, bids.size(), invited.size());
            return bids;
        } finally {
            rounds.remove(roundId);
        }
    }

    private void onBid(Message message, DeliveryReceipt receipt) {
        try {
            Bid bid = objectMapper.treeToValue(message.payload(), Bid.class);
            BidRound round = rounds.get(bid.roundId());
            if (round == null) {
                log.debug("Late bid from {} for closed round {}", message.sender(), bid.roundId());
            } else {
                round.offer(message.sender(), bid);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Discarding malformed bid from {}", message.sender(), e);
        } finally {
            bus.ack(receipt);
        }
    }

    private void onHeartbeat(Message message, DeliveryReceipt receipt) {
        registry.heartbeat(message.sender());
    }

    /**
     * Replies collected for one round. Each invited agent answers at most once.
     */
    private static final class BidRound {
        private final String capability;
        private final Set<String> invited;
        private final Set<String> answered = ConcurrentHashMap.newKeySet();
        private final Map<String, Bid> bids = new ConcurrentHashMap<>();
        private final CountDownLatch replies;

        private BidRound(String capability, Set<String> invited) {
            this.capability = capability;
            this.invited = invited;
            this.replies = new CountDownLatch(invited.size());
        }

        /**
         * Record a reply; a null bid is a decline.
         */
        private void offer(String agentId, Bid bid) {
            if (!invited.contains(agentId) || !answered.add(agentId)) {
                return;
            }
            if (bid != null && !bid.declined() && capability.equals(bid.capability())) {
                bids.put(agentId, new Bid(bid.roundId(), agentId, bid.capability(),
                    bid.costEstimate(), bid.qualityEstimate(), false));
            }
            replies.countDown();
        }

        private void await(Duration timeout) {
            try {
                replies.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private List<Bid> bids() {
            return new ArrayList<>(bids.values());
        }
    }
}
