package com.meshcall.client.negotiation;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshcall.client.media.MediaTrack;
import com.meshcall.client.media.RemoteMedia;
import com.meshcall.client.transport.IceCandidate;
import com.meshcall.client.transport.PeerConnectionState;
import com.meshcall.client.transport.PeerTransport;
import com.meshcall.client.transport.PeerTransportListener;
import com.meshcall.client.transport.SessionDescription;
import com.meshcall.protocol.AnswerMessage;
import com.meshcall.protocol.IceCandidateMessage;
import com.meshcall.protocol.OfferMessage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 상대 참가자 한 명과의 offer/answer 협상 상태 머신.
 * <p>
 * offer 생성, 수신 offer/answer/candidate 적용, 로컬 candidate 전송은 모두 하나의
 * {@link CompletableFuture} 체인에 순서대로 연결된다. 이전 작업이 끝나야 다음 작업이 시작되므로
 * 같은 피어에 대한 작업이 서로 끼어들지 않고, 다른 피어의 작업은 서로를 막지 않는다.
 * <p>
 * 연결 핸들을 새로 만들 때마다 세대 번호가 올라간다. 이전 세대 핸들이 뒤늦게 보낸 이벤트는 버린다.
 */
public class NegotiationController {

    private static final Logger log = LoggerFactory.getLogger(NegotiationController.class);

    private final String peerId;
    private final NegotiationContext context;
    private final NegotiationListener listener;

    private final Object queueLock = new Object();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    // 아래 필드는 this 로 보호한다.
    private final Deque<IceCandidate> pendingCandidates = new ArrayDeque<>();
    private NegotiationState state = NegotiationState.ABSENT;
    private PeerTransport transport;
    private boolean remoteDescriptionApplied;
    private int generation;
    private int offerAttempts;
    private ScheduledFuture<?> offerTimeout;

    public NegotiationController(String peerId, NegotiationContext context, NegotiationListener listener) {
        this.peerId = peerId;
        this.context = context;
        this.listener = listener;
    }

    public String getPeerId() {
        return peerId;
    }

    public synchronized NegotiationState getState() {
        return state;
    }

    synchronized int getPendingCandidateCount() {
        return pendingCandidates.size();
    }

    /**
     * 이전 핸들이 있으면 닫고 새 핸들로 offer 를 만든다.
     */
    public void startOffer() {
        enqueue("offer", () -> sendOffer(1));
    }

    /**
     * 수신한 offer 로 새 핸들을 만들고 answer 를 돌려보낸다. 기존 핸들은 교체된다.
     */
    public void handleOffer(JsonNode payload) {
        enqueue("answer", () -> answerOffer(payload));
    }

    /**
     * 현재 핸들에 answer 를 적용한다. 핸들이 없으면 버린다.
     */
    public void handleAnswer(JsonNode payload) {
        enqueue("apply-answer", () -> applyAnswer(payload));
    }

    /**
     * 원격 description 적용 전이면 버퍼에 쌓고, 이후에는 바로 적용한다. 핸들이 없으면 버린다.
     */
    public void handleCandidate(JsonNode payload) {
        enqueue("apply-candidate", () -> applyCandidate(payload));
    }

    /**
     * 핸들을 즉시 닫는다. 이미 체인에 올라간 작업은 이후 아무 일도 하지 않는다.
     */
    public void close() {
        synchronized (this) {
            if (state == NegotiationState.CLOSED) {
                return;
            }
            state = NegotiationState.CLOSED;
            releaseTransport();
        }
        log.debug("Closed negotiation with {}", peerId);
    }

    private void enqueue(String operation, Supplier<CompletionStage<Void>> step) {
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> previous;
        synchronized (queueLock) {
            previous = tail;
            tail = next;
        }
        previous
                .thenCompose(ignored -> isClosed() ? CompletableFuture.<Void>completedFuture(null) : step.get())
                .whenComplete((ignored, ex) -> {
                    try {
                        if (ex != null) {
                            handleFailure(operation, ex);
                        }
                    } finally {
                        next.complete(null);
                    }
                });
    }

    private CompletionStage<Void> sendOffer(int attempt) {
        PeerTransport created = openTransport(NegotiationState.OFFERING);
        if (created == null) {
            return CompletableFuture.completedFuture(null);
        }
        synchronized (this) {
            offerAttempts = attempt;
            scheduleOfferTimeout(generation);
        }
        listener.onStateChanged(peerId, NegotiationState.OFFERING);
        log.debug("Creating offer for {} (attempt {})", peerId, attempt);
        return created.createOffer()
                .thenCompose(offer -> created.setLocalDescription(offer).thenApply(ignored -> offer))
                .thenAccept(offer -> {
                    if (isCurrent(created)) {
                        context.getSignalSender().send(new OfferMessage(peerId, toJson(offer)));
                        log.info("Sent offer to {}", peerId);
                    }
                });
    }

    private CompletionStage<Void> answerOffer(JsonNode payload) {
        SessionDescription offer = readDescription(payload, SessionDescription.OFFER);
        PeerTransport created = openTransport(NegotiationState.ANSWERING);
        if (created == null) {
            return CompletableFuture.completedFuture(null);
        }
        listener.onStateChanged(peerId, NegotiationState.ANSWERING);
        log.debug("Answering offer from {}", peerId);
        return created.setRemoteDescription(offer)
                .thenCompose(ignored -> flushPendingCandidates(created))
                .thenCompose(ignored -> created.createAnswer())
                .thenCompose(answer -> created.setLocalDescription(answer).thenApply(ignored -> answer))
                .thenAccept(answer -> {
                    if (isCurrent(created)) {
                        context.getSignalSender().send(new AnswerMessage(peerId, toJson(answer)));
                        log.info("Sent answer to {}", peerId);
                        markConnected(created);
                    }
                });
    }

    private CompletionStage<Void> applyAnswer(JsonNode payload) {
        PeerTransport current;
        synchronized (this) {
            current = transport;
            if (current == null) {
                log.debug("Discarding answer from {}: no connection", peerId);
                return CompletableFuture.completedFuture(null);
            }
            if (state != NegotiationState.OFFERING) {
                log.debug("Discarding answer from {} in state {}", peerId, state);
                return CompletableFuture.completedFuture(null);
            }
        }
        SessionDescription answer = readDescription(payload, SessionDescription.ANSWER);
        return current.setRemoteDescription(answer)
                .thenCompose(ignored -> flushPendingCandidates(current))
                .thenRun(() -> {
                    log.info("Applied answer from {}", peerId);
                    markConnected(current);
                });
    }

    private CompletionStage<Void> applyCandidate(JsonNode payload) {
        IceCandidate candidate = readCandidate(payload);
        PeerTransport current;
        synchronized (this) {
            current = transport;
            if (current == null) {
                log.debug("Discarding candidate from {}: no connection", peerId);
                return CompletableFuture.completedFuture(null);
            }
            if (!remoteDescriptionApplied) {
                pendingCandidates.addLast(candidate);
                log.debug("Buffered early candidate from {} ({} pending)", peerId, pendingCandidates.size());
                return CompletableFuture.completedFuture(null);
            }
        }
        return current.addRemoteCandidate(candidate);
    }

    private CompletionStage<Void> flushPendingCandidates(PeerTransport target) {
        List<IceCandidate> queued;
        synchronized (this) {
            if (transport != target) {
                return CompletableFuture.completedFuture(null);
            }
            remoteDescriptionApplied = true;
            queued = new ArrayList<>(pendingCandidates);
            pendingCandidates.clear();
        }
        if (!queued.isEmpty()) {
            log.debug("Applying {} buffered candidates from {}", queued.size(), peerId);
        }
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (IceCandidate candidate : queued) {
            chain = chain.thenCompose(ignored -> target.addRemoteCandidate(candidate));
        }
        return chain;
    }

    private CompletionStage<Void> onOfferTimeout(int expectedGeneration) {
        int attempt;
        synchronized (this) {
            if (generation != expectedGeneration || state != NegotiationState.OFFERING) {
                return CompletableFuture.completedFuture(null);
            }
            attempt = offerAttempts;
        }
        NegotiationPolicy policy = context.getPolicy();
        if (attempt < policy.getMaxOfferAttempts()) {
            log.warn("Offer to {} not answered within {}, retrying ({}/{})",
                    peerId, policy.getOfferTimeout(), attempt + 1, policy.getMaxOfferAttempts());
            return sendOffer(attempt + 1);
        }
        log.warn("Giving up on {} after {} offer attempts", peerId, attempt);
        synchronized (this) {
            releaseTransport();
            state = NegotiationState.ABSENT;
        }
        listener.onNegotiationFailed(peerId,
                new NegotiationTimeoutException("No answer from " + peerId + " after " + attempt + " offers"));
        return CompletableFuture.completedFuture(null);
    }

    private void handleFailure(String operation, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        synchronized (this) {
            if (state == NegotiationState.CLOSED) {
                log.debug("Ignoring {} failure for closed negotiation with {}: {}", operation, peerId, cause.getMessage());
                return;
            }
            releaseTransport();
            state = NegotiationState.ABSENT;
        }
        log.warn("Negotiation step '{}' with {} failed: {}", operation, peerId, cause.getMessage(), cause);
        listener.onNegotiationFailed(peerId, cause);
    }

    /**
     * 기존 핸들을 닫고 새 핸들을 만든다. 닫힌 컨트롤러면 null.
     */
    private synchronized PeerTransport openTransport(NegotiationState nextState) {
        if (state == NegotiationState.CLOSED) {
            return null;
        }
        releaseTransport();
        state = NegotiationState.ABSENT;
        int nextGeneration = ++generation;
        PeerTransport created = context.getTransportFactory()
                .create(peerId, context.getRtcConfiguration(), new TransportEvents(nextGeneration));
        try {
            for (MediaTrack track : context.getLocalMedia().getTracks()) {
                created.addTrack(track);
            }
        } catch (RuntimeException ex) {
            try {
                created.close();
            } catch (RuntimeException closeFailure) {
                ex.addSuppressed(closeFailure);
            }
            throw ex;
        }
        transport = created;
        state = nextState;
        return created;
    }

    // this 잠금 안에서만 호출한다.
    private void releaseTransport() {
        cancelOfferTimeout();
        pendingCandidates.clear();
        remoteDescriptionApplied = false;
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close connection to {}", peerId, ex);
        }
        transport = null;
    }

    private void scheduleOfferTimeout(int expectedGeneration) {
        cancelOfferTimeout();
        NegotiationPolicy policy = context.getPolicy();
        if (!policy.hasOfferTimeout()) {
            return;
        }
        offerTimeout = context.getScheduler().schedule(
                () -> enqueue("offer-timeout", () -> onOfferTimeout(expectedGeneration)),
                policy.getOfferTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelOfferTimeout() {
        if (offerTimeout != null) {
            offerTimeout.cancel(false);
            offerTimeout = null;
        }
    }

    private void markConnected(PeerTransport source) {
        synchronized (this) {
            if (transport != source || state == NegotiationState.CLOSED || state == NegotiationState.CONNECTED) {
                return;
            }
            state = NegotiationState.CONNECTED;
            cancelOfferTimeout();
        }
        log.info("Connected to {}", peerId);
        listener.onStateChanged(peerId, NegotiationState.CONNECTED);
    }

    private synchronized boolean isCurrent(PeerTransport candidate) {
        return transport == candidate && state != NegotiationState.CLOSED;
    }

    private synchronized boolean isCurrentGeneration(int expected) {
        return generation == expected && transport != null && state != NegotiationState.CLOSED;
    }

    private synchronized boolean isClosed() {
        return state == NegotiationState.CLOSED;
    }

    private SessionDescription readDescription(JsonNode payload, String expectedType) {
        SessionDescription description = payload == null || payload.isNull()
                ? null
                : context.getObjectMapper().convertValue(payload, SessionDescription.class);
        if (description == null || description.getSdp() == null) {
            throw new IllegalArgumentException(expectedType + " from " + peerId + " carries no session description");
        }
        if (description.getType() == null) {
            description.setType(expectedType);
        }
        return description;
    }

    private IceCandidate readCandidate(JsonNode payload) {
        IceCandidate candidate = payload == null || payload.isNull()
                ? null
                : context.getObjectMapper().convertValue(payload, IceCandidate.class);
        if (candidate == null || candidate.getCandidate() == null) {
            throw new IllegalArgumentException("ice-candidate from " + peerId + " carries no candidate");
        }
        return candidate;
    }

    private JsonNode toJson(Object value) {
        return context.getObjectMapper().valueToTree(value);
    }

    /**
     * 핸들 이벤트를 체인 작업으로 바꾼다. 세대가 바뀐 뒤 도착한 이벤트는 버린다.
     */
    private class TransportEvents implements PeerTransportListener {

        private final int eventGeneration;

        TransportEvents(int eventGeneration) {
            this.eventGeneration = eventGeneration;
        }

        @Override
        public void onLocalCandidate(IceCandidate candidate) {
            enqueue("send-candidate", () -> {
                if (isCurrentGeneration(eventGeneration)) {
                    context.getSignalSender().send(new IceCandidateMessage(peerId, toJson(candidate)));
                    log.debug("Sent candidate to {}", peerId);
                }
                return CompletableFuture.completedFuture(null);
            });
        }

        @Override
        public void onRemoteMedia(RemoteMedia media) {
            enqueue("remote-media", () -> {
                PeerTransport current = currentTransportFor(eventGeneration);
                if (current != null) {
                    log.info("Received {} from {}", media, peerId);
                    markConnected(current);
                    listener.onRemoteMedia(peerId, media);
                }
                return CompletableFuture.completedFuture(null);
            });
        }

        @Override
        public void onConnectionStateChange(PeerConnectionState connectionState) {
            enqueue("connection-state", () -> {
                PeerTransport current = currentTransportFor(eventGeneration);
                if (current != null) {
                    log.debug("Connection to {} is {}", peerId, connectionState);
                    if (connectionState == PeerConnectionState.CONNECTED) {
                        markConnected(current);
                    }
                }
                return CompletableFuture.completedFuture(null);
            });
        }
    }

    private synchronized PeerTransport currentTransportFor(int expected) {
        return isCurrentGeneration(expected) ? transport : null;
    }
}
