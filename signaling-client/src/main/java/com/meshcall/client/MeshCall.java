package com.meshcall.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshcall.client.media.CaptureDevice;
import com.meshcall.client.media.LocalMedia;
import com.meshcall.client.media.MediaAcquisitionException;
import com.meshcall.client.negotiation.NegotiationContext;
import com.meshcall.client.negotiation.PeerSetManager;
import com.meshcall.client.negotiation.RemoteStream;
import com.meshcall.client.signaling.SignalSender;
import com.meshcall.client.signaling.SignalingChannel;
import com.meshcall.client.signaling.SignalingChannelException;
import com.meshcall.client.signaling.SignalingChannelListener;
import com.meshcall.client.signaling.SignalingConnector;
import com.meshcall.client.signaling.WebSocketSignalingConnector;
import com.meshcall.client.transport.PeerTransportFactory;
import com.meshcall.protocol.Identifiers;
import com.meshcall.protocol.JoinRoomMessage;
import com.meshcall.protocol.LeaveRoomMessage;
import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.protocol.SignalMessage;
import com.meshcall.protocol.SignalMessageCodec;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메시 통화 진입점.
 * <p>
 * {@link #join(String, String)} 은 로컬 장치를 열고 시그널링 서버에 연결한 뒤 방에 참여한다.
 * {@link #hangUp()} 과 서버 측 연결 종료는 같은 정리 경로(leave 전송, 피어 연결 종료,
 * 로컬 트랙 중지, 시그널링 연결 종료)를 거친다.
 */
public class MeshCall implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshCall.class);

    private final URI serverUri;
    private final CaptureDevice captureDevice;
    private final SignalingConnector connector;
    private final PeerTransportFactory transportFactory;
    private final CallListener listener;
    private final MeshCallOptions options;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;

    private CallSession session;
    private boolean closed;

    public MeshCall(URI serverUri,
                    CaptureDevice captureDevice,
                    SignalingConnector connector,
                    PeerTransportFactory transportFactory,
                    CallListener listener,
                    MeshCallOptions options) {
        this(serverUri, captureDevice, connector, transportFactory, listener, options, new ObjectMapper());
    }

    public MeshCall(URI serverUri,
                    CaptureDevice captureDevice,
                    SignalingConnector connector,
                    PeerTransportFactory transportFactory,
                    CallListener listener,
                    MeshCallOptions options,
                    ObjectMapper objectMapper) {
        this.serverUri = Objects.requireNonNull(serverUri, "serverUri must not be null");
        this.captureDevice = Objects.requireNonNull(captureDevice, "captureDevice must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory must not be null");
        this.listener = listener != null ? listener : new CallListener() {
        };
        this.options = options != null ? options : MeshCallOptions.defaults();
        this.objectMapper = objectMapper;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mesh-call-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * WebSocket 시그널링을 사용하는 통화를 만든다.
     */
    public static MeshCall overWebSocket(URI serverUri,
                                         CaptureDevice captureDevice,
                                         PeerTransportFactory transportFactory,
                                         CallListener listener) {
        ObjectMapper objectMapper = new ObjectMapper();
        SignalingConnector connector = new WebSocketSignalingConnector(new SignalMessageCodec(objectMapper));
        return new MeshCall(serverUri, captureDevice, connector, transportFactory, listener,
                MeshCallOptions.defaults(), objectMapper);
    }

    /**
     * 방에 참여한다. 다른 방에 참여 중이면 먼저 통화를 끊는다.
     *
     * @throws CallStartException 장치를 열 수 없거나 시그널링 서버에 연결할 수 없을 때
     */
    public synchronized void join(String roomId, String name) throws CallStartException {
        if (closed) {
            throw new IllegalStateException("MeshCall is closed");
        }
        String normalizedRoomId = Identifiers.normalizeRoomId(roomId);
        if (normalizedRoomId == null || normalizedRoomId.isEmpty()) {
            throw new IllegalArgumentException("roomId is required");
        }
        if (session != null) {
            if (session.roomId.equals(normalizedRoomId)) {
                log.debug("Already in room {}", normalizedRoomId);
                return;
            }
            endSession(session, "switching to room " + normalizedRoomId, true);
        }

        LocalMedia localMedia;
        try {
            localMedia = captureDevice.acquire(options.getMediaConstraints());
        } catch (MediaAcquisitionException ex) {
            log.warn("Could not access camera or microphone: {}", ex.getMessage());
            throw new CallStartException("Could not access camera or microphone: " + ex.getMessage(), ex);
        }

        String participantId = Identifiers.newParticipantId();
        String displayName = name == null || name.isBlank()
                ? Identifiers.defaultDisplayName(participantId)
                : name.trim();

        AtomicReference<SignalingChannel> channelRef = new AtomicReference<>();
        SignalSender sender = message -> {
            SignalingChannel channel = channelRef.get();
            if (channel == null) {
                throw new SignalingChannelException("Signaling connection is not open");
            }
            channel.send(message);
        };
        NegotiationContext context = new NegotiationContext(transportFactory, options.getRtcConfiguration(),
                localMedia, sender, options.getNegotiationPolicy(), scheduler, objectMapper);
        PeerSetManager manager = new PeerSetManager(participantId, context, options.getOfferPolicy(), listener);
        CallSession started = new CallSession(normalizedRoomId, participantId, localMedia, manager);

        SignalingChannel channel = connect(started, localMedia);
        channelRef.set(channel);
        started.channel = channel;
        session = started;

        try {
            channel.send(new JoinRoomMessage(normalizedRoomId, participantId, displayName));
        } catch (SignalingChannelException ex) {
            endSession(started, "join failed", false);
            throw new CallStartException("Could not send join request for room " + normalizedRoomId, ex);
        }
        log.info("Joining room {} as {} ({})", normalizedRoomId, participantId, displayName);
    }

    private SignalingChannel connect(CallSession target, LocalMedia localMedia) throws CallStartException {
        CompletableFuture<SignalingChannel> future = connector.connect(serverUri, new SessionEvents(target));
        try {
            return future.get(options.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandon(future, localMedia);
            throw new CallStartException("Interrupted while connecting to " + serverUri, ex);
        } catch (ExecutionException ex) {
            abandon(future, localMedia);
            log.warn("Could not connect to signaling server {}: {}", serverUri, ex.getCause().getMessage());
            throw new CallStartException("Could not connect to signaling server " + serverUri, ex.getCause());
        } catch (TimeoutException ex) {
            abandon(future, localMedia);
            log.warn("Timed out connecting to signaling server {}", serverUri);
            throw new CallStartException("Timed out connecting to signaling server " + serverUri, ex);
        }
    }

    private void abandon(CompletableFuture<SignalingChannel> future, LocalMedia localMedia) {
        localMedia.stop();
        future.thenAccept(SignalingChannel::close);
    }

    /**
     * 통화를 끊는다. 통화 중이 아니면 아무 일도 하지 않는다.
     */
    public synchronized void hangUp() {
        if (session != null) {
            endSession(session, "hang up", true);
        }
    }

    private synchronized void onChannelClosed(CallSession target, String reason) {
        if (session != target) {
            return;
        }
        log.info("Signaling connection closed by server: {}", reason);
        endSession(target, reason, false);
    }

    private void endSession(CallSession target, String reason, boolean sendLeave) {
        session = null;
        if (sendLeave && target.channel != null) {
            try {
                target.channel.send(new LeaveRoomMessage());
            } catch (SignalingChannelException ex) {
                log.debug("Could not send leave-room: {}", ex.getMessage());
            }
        }
        target.manager.closeAll();
        target.localMedia.stop();
        if (target.channel != null) {
            target.channel.close();
        }
        log.info("Left room {} ({})", target.roomId, reason);
        listener.onCallEnded(reason);
    }

    @Override
    public void close() {
        synchronized (this) {
            hangUp();
            closed = true;
        }
        scheduler.shutdownNow();
    }

    public synchronized boolean isInCall() {
        return session != null;
    }

    public synchronized boolean isConnected() {
        return session != null && session.channel != null && session.channel.isOpen();
    }

    public synchronized String getParticipantId() {
        return session != null ? session.participantId : null;
    }

    public synchronized String getRoomId() {
        return session != null ? session.roomId : null;
    }

    public List<ParticipantInfo> getRoster() {
        CallSession current = currentSession();
        return current != null ? current.manager.getRoster() : List.of();
    }

    public List<RemoteStream> getRemoteStreams() {
        CallSession current = currentSession();
        return current != null ? current.manager.getRemoteStreams() : List.of();
    }

    // 관리자 호출은 이 객체의 잠금 밖에서 한다.
    private synchronized CallSession currentSession() {
        return session;
    }

    private static final class CallSession {

        private final String roomId;
        private final String participantId;
        private final LocalMedia localMedia;
        private final PeerSetManager manager;
        private SignalingChannel channel;

        private CallSession(String roomId, String participantId, LocalMedia localMedia, PeerSetManager manager) {
            this.roomId = roomId;
            this.participantId = participantId;
            this.localMedia = localMedia;
            this.manager = manager;
        }
    }

    private class SessionEvents implements SignalingChannelListener {

        private final CallSession target;

        SessionEvents(CallSession target) {
            this.target = target;
        }

        @Override
        public void onMessage(SignalMessage message) {
            target.manager.handle(message);
        }

        @Override
        public void onClosed(String reason) {
            onChannelClosed(target, reason);
        }
    }
}
