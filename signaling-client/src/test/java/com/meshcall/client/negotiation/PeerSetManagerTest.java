package com.meshcall.client.negotiation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshcall.client.media.LocalMedia;
import com.meshcall.client.support.FakePeerTransport;
import com.meshcall.client.support.FakePeerTransportFactory;
import com.meshcall.client.support.RecordingCallListener;
import com.meshcall.client.transport.RtcConfiguration;
import com.meshcall.client.transport.SessionDescription;
import com.meshcall.protocol.AnswerMessage;
import com.meshcall.protocol.ErrorMessage;
import com.meshcall.protocol.ExistingParticipantsMessage;
import com.meshcall.protocol.JoinedRoomMessage;
import com.meshcall.protocol.MessageType;
import com.meshcall.protocol.OfferMessage;
import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.protocol.ParticipantJoinedMessage;
import com.meshcall.protocol.ParticipantLeftMessage;
import com.meshcall.protocol.RelayMessage;
import com.meshcall.protocol.SignalMessage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class PeerSetManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Peer> peers = new HashMap<>();
    private final Deque<Runnable> network = new ArrayDeque<>();

    /**
     * 릴레이 메시지를 서버처럼 대상 참가자에게 전달하는 테스트용 참가자.
     */
    private class Peer {

        private final String id;
        private final FakePeerTransportFactory factory = new FakePeerTransportFactory();
        private final RecordingCallListener listener = new RecordingCallListener();
        private final List<SignalMessage> outbound = new ArrayList<>();
        private final PeerSetManager manager;

        Peer(String id, OfferPolicy policy) {
            this.id = id;
            NegotiationContext context = new NegotiationContext(factory, RtcConfiguration.defaults(),
                    new LocalMedia(List.of()), this::send, NegotiationPolicy.withoutTimeout(),
                    mock(ScheduledExecutorService.class), objectMapper);
            this.manager = new PeerSetManager(id, context, policy, listener);
        }

        private void send(SignalMessage message) {
            outbound.add(message);
            if (message instanceof RelayMessage) {
                RelayMessage relay = (RelayMessage) message;
                Peer target = peers.get(relay.getTargetParticipantId());
                if (target != null) {
                    network.add(() -> target.manager.handle(relay.forwardFrom(id)));
                }
            }
        }

        void receive(SignalMessage message) {
            manager.handle(message);
        }

        long sentCount(MessageType type) {
            return outbound.stream().filter(message -> message.getType() == type).count();
        }

        Optional<NegotiationState> stateOf(String peerId) {
            return manager.getPeerState(peerId);
        }
    }

    private Peer peer(String id, OfferPolicy policy) {
        Peer peer = new Peer(id, policy);
        peers.put(id, peer);
        return peer;
    }

    private void deliverAll() {
        while (!network.isEmpty()) {
            network.poll().run();
        }
    }

    private JsonNode offerPayload(String sdp) {
        return objectMapper.valueToTree(SessionDescription.offer(sdp));
    }

    private void joinPair(Peer first, Peer second) {
        first.receive(new JoinedRoomMessage("R1", first.id, 1));
        first.receive(new ExistingParticipantsMessage(List.of()));
        second.receive(new JoinedRoomMessage("R1", second.id, 2));
        second.receive(new ExistingParticipantsMessage(List.of(new ParticipantInfo(first.id, "Alice"))));
        first.receive(new ParticipantJoinedMessage(second.id, "Bob", 2));
        deliverAll();
    }

    @Test
    void lowerIdSendsTheOnlyOfferAndBothSidesConnect() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        Peer p2 = peer("p2", OfferPolicy.ID_ORDERED);

        joinPair(p1, p2);

        assertThat(p1.sentCount(MessageType.OFFER)).isEqualTo(1);
        assertThat(p2.sentCount(MessageType.OFFER)).isZero();
        assertThat(p2.sentCount(MessageType.ANSWER)).isEqualTo(1);
        assertThat(p1.stateOf("p2")).contains(NegotiationState.CONNECTED);
        assertThat(p2.stateOf("p1")).contains(NegotiationState.CONNECTED);
        assertThat(p1.listener.getJoinedRoomId()).isEqualTo("R1");
        assertThat(p2.listener.getRoster()).containsExactly(new ParticipantInfo("p1", "Alice"));
    }

    @Test
    void idOrderingHoldsRegardlessOfJoinOrder() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        Peer p2 = peer("p2", OfferPolicy.ID_ORDERED);

        joinPair(p2, p1);

        assertThat(p1.sentCount(MessageType.OFFER)).isEqualTo(1);
        assertThat(p2.sentCount(MessageType.OFFER)).isZero();
        assertThat(p2.stateOf("p1")).contains(NegotiationState.CONNECTED);
    }

    @Test
    void joinerOffersPolicyLetsNewcomerDriveNegotiation() {
        Peer p1 = peer("p1", OfferPolicy.JOINER_OFFERS);
        Peer p2 = peer("p2", OfferPolicy.JOINER_OFFERS);

        joinPair(p1, p2);

        assertThat(p2.sentCount(MessageType.OFFER)).isEqualTo(1);
        assertThat(p1.sentCount(MessageType.OFFER)).isZero();
        assertThat(p1.stateOf("p2")).contains(NegotiationState.CONNECTED);
        assertThat(p2.stateOf("p1")).contains(NegotiationState.CONNECTED);
    }

    @Test
    void localCandidatesReachTheRemoteConnection() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        Peer p2 = peer("p2", OfferPolicy.ID_ORDERED);
        joinPair(p1, p2);

        p1.factory.latest("p2").emitLocalCandidate("candidate:1");
        deliverAll();

        assertThat(p2.factory.latest("p1").getRemoteCandidates()).containsExactly("candidate:1");
    }

    @Test
    void participantLeftClearsControllerRosterAndStream() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        Peer p2 = peer("p2", OfferPolicy.ID_ORDERED);
        joinPair(p1, p2);
        FakePeerTransport transport = p1.factory.latest("p2");
        transport.emitRemoteMedia("stream-p2");
        assertThat(p1.listener.getStreams()).extracting(RemoteStream::getName).containsExactly("Bob");

        p1.receive(new ParticipantLeftMessage("p2", 1));

        assertThat(transport.isClosed()).isTrue();
        assertThat(p1.stateOf("p2")).isEmpty();
        assertThat(p1.manager.getRoster()).isEmpty();
        assertThat(p1.manager.getRemoteStreams()).isEmpty();
        assertThat(p1.listener.getStreams()).isEmpty();
        assertThat(p1.listener.getRoster()).isEmpty();
    }

    @Test
    void mediaFromDepartedPeerIsNotShown() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        Peer p2 = peer("p2", OfferPolicy.ID_ORDERED);
        joinPair(p1, p2);
        FakePeerTransport transport = p1.factory.latest("p2");

        p1.receive(new ParticipantLeftMessage("p2", 1));
        transport.emitRemoteMedia("late");

        assertThat(p1.manager.getRemoteStreams()).isEmpty();
    }

    @Test
    void nameArrivingAfterMediaIsAttachedToStream() {
        Peer p1 = peer("p1", OfferPolicy.JOINER_OFFERS);
        p1.receive(new JoinedRoomMessage("R1", "p1", 1));

        p1.receive(new OfferMessage("p1", offerPayload("v=0 from p3")).forwardFrom("p3"));
        p1.factory.latest("p3").emitRemoteMedia("stream-p3");

        assertThat(p1.manager.getRemoteStreams()).extracting(RemoteStream::getName).containsExactly((String) null);

        p1.receive(new ParticipantJoinedMessage("p3", "Carol", 2));

        assertThat(p1.manager.getRemoteStreams()).extracting(RemoteStream::getName).containsExactly("Carol");
        assertThat(p1.listener.getStreams()).extracting(RemoteStream::getName).containsExactly("Carol");
        assertThat(p1.factory.createdFor("p3")).hasSize(1);
    }

    @Test
    void repeatedParticipantJoinedReplacesPreviousConnection() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        p1.receive(new ParticipantJoinedMessage("p2", "Bob", 2));
        p1.receive(new ParticipantJoinedMessage("p2", "Bob", 2));

        List<FakePeerTransport> created = p1.factory.createdFor("p2");
        assertThat(created).hasSize(2);
        assertThat(created.get(0).isClosed()).isTrue();
        assertThat(created.get(1).isClosed()).isFalse();
        assertThat(p1.manager.getPeerCount()).isEqualTo(1);
    }

    @Test
    void answerFromUnknownPeerIsDiscarded() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);

        p1.receive(new AnswerMessage("p1", objectMapper.valueToTree(SessionDescription.answer("v=0"))).forwardFrom("ghost"));

        assertThat(p1.stateOf("ghost")).isEmpty();
        assertThat(p1.factory.getCreated()).isEmpty();
        assertThat(p1.listener.getErrors()).isEmpty();
    }

    @Test
    void ownIdInExistingParticipantsIsIgnored() {
        Peer p1 = peer("p1", OfferPolicy.JOINER_OFFERS);

        p1.receive(new ExistingParticipantsMessage(List.of(new ParticipantInfo("p1", "Me"))));

        assertThat(p1.factory.getCreated()).isEmpty();
        assertThat(p1.manager.getRoster()).isEmpty();
    }

    @Test
    void serverErrorIsForwardedToListener() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);

        p1.receive(new ErrorMessage("Target participant not found"));

        assertThat(p1.listener.getErrors()).containsExactly("Target participant not found");
    }

    @Test
    void failedNegotiationLeavesPeerAbsentWithOneNotification() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        p1.factory.customize(transport -> transport.failOffersWith(new IllegalStateException("no codecs")));

        p1.receive(new ParticipantJoinedMessage("p2", "Bob", 2));

        assertThat(p1.stateOf("p2")).contains(NegotiationState.ABSENT);
        assertThat(p1.listener.getErrors()).containsExactly("Connection to Bob failed: no codecs");
        assertThat(p1.listener.getStateChanges()).endsWith("p2:ABSENT");
        assertThat(p1.manager.getRemoteStreams()).isEmpty();
    }

    @Test
    void closeAllReleasesEveryConnectionAndIgnoresLaterMessages() {
        Peer p1 = peer("p1", OfferPolicy.ID_ORDERED);
        Peer p2 = peer("p2", OfferPolicy.ID_ORDERED);
        joinPair(p1, p2);

        p1.manager.closeAll();
        p1.receive(new ParticipantJoinedMessage("p3", "Carol", 3));

        assertThat(p1.factory.getCreated()).allMatch(FakePeerTransport::isClosed);
        assertThat(p1.factory.createdFor("p3")).isEmpty();
        assertThat(p1.manager.getPeerCount()).isZero();
    }

    @Test
    void rosterEntryStaysUntilParticipantLeft() {
        Peer p1 = peer("p1", OfferPolicy.JOINER_OFFERS);
        p1.receive(new JoinedRoomMessage("R1", "p1", 3));
        p1.receive(new ExistingParticipantsMessage(List.of(
                new ParticipantInfo("p2", "Bob"), new ParticipantInfo("p3", "Carol"))));

        p1.receive(new ParticipantLeftMessage("p9", 3));
        p1.receive(new AnswerMessage("p1", objectMapper.valueToTree(SessionDescription.answer("v=0"))).forwardFrom("p2"));

        assertThat(p1.manager.getRoster()).extracting(ParticipantInfo::getId).containsExactly("p2", "p3");

        p1.receive(new ParticipantLeftMessage("p2", 2));

        assertThat(p1.manager.getRoster()).containsExactly(new ParticipantInfo("p3", "Carol"));
        assertThat(p1.listener.getRoster()).containsExactly(new ParticipantInfo("p3", "Carol"));
        assertThat(p1.stateOf("p2")).isEmpty();
    }

    @Test
    void listenerCallbacksRunOutsideManagerLock() {
        FakePeerTransportFactory factory = new FakePeerTransportFactory();
        AtomicReference<PeerSetManager> managerRef = new AtomicReference<>();
        List<Boolean> lockHeld = new ArrayList<>();
        NegotiationContext context = new NegotiationContext(factory, RtcConfiguration.defaults(),
                new LocalMedia(List.of()), message -> { }, NegotiationPolicy.withoutTimeout(),
                mock(ScheduledExecutorService.class), objectMapper);
        PeerSetManager manager = new PeerSetManager("p1", context, OfferPolicy.ID_ORDERED, new PeerSetListener() {
            @Override
            public void onRosterChanged(List<ParticipantInfo> roster) {
                lockHeld.add(Thread.holdsLock(managerRef.get()));
            }

            @Override
            public void onPeerStateChanged(String participantId, NegotiationState state) {
                lockHeld.add(Thread.holdsLock(managerRef.get()));
            }
        });
        managerRef.set(manager);

        manager.handle(new ParticipantJoinedMessage("p2", "Bob", 2));

        assertThat(lockHeld).isNotEmpty().containsOnly(false);
        assertThat(manager.getPeerState("p2")).contains(NegotiationState.OFFERING);
    }
}
