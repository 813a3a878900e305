package com.meshcall.client.negotiation;

import com.meshcall.client.media.RemoteMedia;
import com.meshcall.protocol.ErrorMessage;
import com.meshcall.protocol.ExistingParticipantsMessage;
import com.meshcall.protocol.JoinedRoomMessage;
import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.protocol.ParticipantJoinedMessage;
import com.meshcall.protocol.ParticipantLeftMessage;
import com.meshcall.protocol.RelayMessage;
import com.meshcall.protocol.SignalMessage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 한 통화에서 상대 참가자별 협상 컨트롤러와 참가자 명단을 관리한다.
 * <p>
 * 서버 메시지는 모두 {@link #handle(SignalMessage)} 를 거쳐 들어오며, 컨트롤러 표와 명단은
 * 이 클래스만 변경한다. 리스너 호출은 잠금 안에서 순서대로 쌓아 두었다가 잠금을 놓은 뒤
 * 한 스레드가 꺼내 실행하므로, 리스너 안에서 이 객체나 통화 객체를 다시 불러도 된다.
 */
public class PeerSetManager {

    private static final Logger log = LoggerFactory.getLogger(PeerSetManager.class);

    private final String selfId;
    private final NegotiationContext context;
    private final OfferPolicy offerPolicy;
    private final PeerSetListener listener;

    private final Map<String, NegotiationController> controllers = new LinkedHashMap<>();
    private final Map<String, ParticipantInfo> roster = new LinkedHashMap<>();
    private final RemoteStreamTable remoteStreams = new RemoteStreamTable();
    private final NegotiationListener controllerEvents = new ControllerEvents();
    private final Deque<Runnable> notifications = new ArrayDeque<>();

    private String roomId;
    private boolean closed;
    private boolean dispatching;

    public PeerSetManager(String selfId, NegotiationContext context, OfferPolicy offerPolicy, PeerSetListener listener) {
        this.selfId = selfId;
        this.context = context;
        this.offerPolicy = offerPolicy;
        this.listener = listener;
    }

    public void handle(SignalMessage message) {
        synchronized (this) {
            if (closed) {
                log.debug("Ignoring {} after close", message.getType().toValue());
                return;
            }
            switch (message.getType()) {
                case JOINED_ROOM -> onJoinedRoom((JoinedRoomMessage) message);
                case EXISTING_PARTICIPANTS -> onExistingParticipants((ExistingParticipantsMessage) message);
                case PARTICIPANT_JOINED -> onParticipantJoined((ParticipantJoinedMessage) message);
                case PARTICIPANT_LEFT -> onParticipantLeft((ParticipantLeftMessage) message);
                case OFFER -> onOffer((RelayMessage) message);
                case ANSWER -> onAnswer((RelayMessage) message);
                case ICE_CANDIDATE -> onCandidate((RelayMessage) message);
                case ERROR -> onServerError((ErrorMessage) message);
                case JOIN_ROOM, LEAVE_ROOM -> log.warn("Ignoring client-only message {}", message.getType().toValue());
            }
        }
        dispatchNotifications();
    }

    private void onJoinedRoom(JoinedRoomMessage message) {
        roomId = message.getRoomId();
        log.info("Joined room {} as {} ({} participants)", roomId, selfId, message.getParticipantCount());
        String joinedRoomId = roomId;
        int participantCount = message.getParticipantCount();
        notifyListener(() -> listener.onJoined(joinedRoomId, selfId, participantCount));
    }

    private void onExistingParticipants(ExistingParticipantsMessage message) {
        for (ParticipantInfo participant : message.getParticipants()) {
            if (participant.getId() == null || selfId.equals(participant.getId())) {
                continue;
            }
            roster.put(participant.getId(), participant);
            if (offerPolicy.offersToExisting(selfId, participant.getId())) {
                offerTo(participant.getId());
            } else {
                log.debug("Waiting for offer from existing participant {}", participant.getId());
            }
        }
        publishRoster();
    }

    private void onParticipantJoined(ParticipantJoinedMessage message) {
        String peerId = message.getParticipantId();
        if (peerId == null || selfId.equals(peerId)) {
            return;
        }
        roster.put(peerId, new ParticipantInfo(peerId, message.getName()));
        log.info("Participant {} joined ({} in room)", peerId, message.getParticipantCount());
        if (offerPolicy.offersToNewcomer(selfId, peerId)) {
            offerTo(peerId);
        } else {
            log.debug("Waiting for offer from new participant {}", peerId);
        }
        publishRoster();
    }

    private void onParticipantLeft(ParticipantLeftMessage message) {
        String peerId = message.getParticipantId();
        NegotiationController controller = controllers.remove(peerId);
        if (controller != null) {
            controller.close();
        }
        boolean rosterChanged = roster.remove(peerId) != null;
        boolean streamRemoved = remoteStreams.remove(peerId);
        log.info("Participant {} left ({} in room)", peerId, message.getParticipantCount());
        if (rosterChanged) {
            publishRoster();
        }
        if (streamRemoved) {
            publishStreams();
        }
    }

    private void onOffer(RelayMessage message) {
        String peerId = message.getFromParticipantId();
        if (peerId == null) {
            log.warn("Ignoring offer without sender");
            return;
        }
        controllers.computeIfAbsent(peerId, this::newController).handleOffer(message.getPayload());
    }

    private void onAnswer(RelayMessage message) {
        NegotiationController controller = controllerFor(message);
        if (controller != null) {
            controller.handleAnswer(message.getPayload());
        }
    }

    private void onCandidate(RelayMessage message) {
        NegotiationController controller = controllerFor(message);
        if (controller != null) {
            controller.handleCandidate(message.getPayload());
        }
    }

    private void onServerError(ErrorMessage message) {
        log.warn("Signaling server reported: {}", message.getError());
        notifyListener(() -> listener.onError(message.getError()));
    }

    private NegotiationController controllerFor(RelayMessage message) {
        NegotiationController controller = controllers.get(message.getFromParticipantId());
        if (controller == null) {
            log.debug("Discarding {} from unknown peer {}", message.getType().toValue(), message.getFromParticipantId());
        }
        return controller;
    }

    private void offerTo(String peerId) {
        controllers.computeIfAbsent(peerId, this::newController).startOffer();
    }

    private NegotiationController newController(String peerId) {
        return new NegotiationController(peerId, context, controllerEvents);
    }

    private void publishRoster() {
        if (remoteStreams.reconcile(roster)) {
            publishStreams();
        }
        List<ParticipantInfo> snapshot = List.copyOf(new ArrayList<>(roster.values()));
        notifyListener(() -> listener.onRosterChanged(snapshot));
    }

    private void publishStreams() {
        List<RemoteStream> snapshot = remoteStreams.snapshot();
        notifyListener(() -> listener.onRemoteStreamsChanged(snapshot));
    }

    private synchronized void notifyListener(Runnable notification) {
        notifications.add(notification);
    }

    /**
     * 쌓인 리스너 호출을 잠금 밖에서 실행한다. 이미 다른 호출이 꺼내는 중이면 그쪽에 맡긴다.
     */
    private void dispatchNotifications() {
        if (Thread.holdsLock(this)) {
            return;
        }
        synchronized (this) {
            if (dispatching) {
                return;
            }
            dispatching = true;
        }
        while (true) {
            Runnable next;
            synchronized (this) {
                next = notifications.poll();
                if (next == null) {
                    dispatching = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException ex) {
                log.warn("Peer set listener failed", ex);
            }
        }
    }

    /**
     * 모든 컨트롤러를 닫고 표를 비운다. 이후 도착하는 메시지는 무시한다.
     */
    public void closeAll() {
        List<NegotiationController> toClose;
        synchronized (this) {
            closed = true;
            toClose = new ArrayList<>(controllers.values());
            controllers.clear();
            roster.clear();
            remoteStreams.clear();
        }
        for (NegotiationController controller : toClose) {
            controller.close();
        }
        dispatchNotifications();
        log.debug("Closed {} peer negotiations", toClose.size());
    }

    public String getSelfId() {
        return selfId;
    }

    public synchronized String getRoomId() {
        return roomId;
    }

    public synchronized List<ParticipantInfo> getRoster() {
        return List.copyOf(new ArrayList<>(roster.values()));
    }

    public List<RemoteStream> getRemoteStreams() {
        return remoteStreams.snapshot();
    }

    public synchronized Optional<NegotiationState> getPeerState(String peerId) {
        NegotiationController controller = controllers.get(peerId);
        return controller == null ? Optional.empty() : Optional.of(controller.getState());
    }

    public synchronized int getPeerCount() {
        return controllers.size();
    }

    private class ControllerEvents implements NegotiationListener {

        @Override
        public void onRemoteMedia(String peerId, RemoteMedia media) {
            synchronized (PeerSetManager.this) {
                if (closed || !controllers.containsKey(peerId)) {
                    log.debug("Dropping media from departed peer {}", peerId);
                    return;
                }
                ParticipantInfo info = roster.get(peerId);
                remoteStreams.upsert(peerId, media, info == null ? null : info.getName());
                publishStreams();
            }
            dispatchNotifications();
        }

        @Override
        public void onStateChanged(String peerId, NegotiationState state) {
            notifyListener(() -> listener.onPeerStateChanged(peerId, state));
            dispatchNotifications();
        }

        @Override
        public void onNegotiationFailed(String peerId, Throwable cause) {
            synchronized (PeerSetManager.this) {
                if (closed) {
                    return;
                }
                if (remoteStreams.remove(peerId)) {
                    publishStreams();
                }
                String error = "Connection to " + displayName(peerId) + " failed: " + cause.getMessage();
                notifyListener(() -> listener.onPeerStateChanged(peerId, NegotiationState.ABSENT));
                notifyListener(() -> listener.onError(error));
            }
            dispatchNotifications();
        }
    }

    private String displayName(String peerId) {
        ParticipantInfo info = roster.get(peerId);
        return info != null && info.getName() != null ? info.getName() : peerId;
    }
}
