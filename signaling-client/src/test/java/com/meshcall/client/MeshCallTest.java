package com.meshcall.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.meshcall.client.media.MediaAcquisitionException;
import com.meshcall.client.negotiation.NegotiationPolicy;
import com.meshcall.client.support.FakeCaptureDevice;
import com.meshcall.client.support.FakePeerTransport;
import com.meshcall.client.support.FakePeerTransportFactory;
import com.meshcall.client.support.FakeSignalingConnector;
import com.meshcall.client.support.FakeSignalingConnector.FakeChannel;
import com.meshcall.client.support.FakeTrack;
import com.meshcall.client.support.RecordingCallListener;
import com.meshcall.protocol.ExistingParticipantsMessage;
import com.meshcall.protocol.JoinRoomMessage;
import com.meshcall.protocol.JoinedRoomMessage;
import com.meshcall.protocol.MessageType;
import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.protocol.ParticipantJoinedMessage;
import com.meshcall.protocol.SignalMessage;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MeshCallTest {

    private final FakeCaptureDevice captureDevice = new FakeCaptureDevice();
    private final FakeSignalingConnector connector = new FakeSignalingConnector();
    private final FakePeerTransportFactory transportFactory = new FakePeerTransportFactory();
    private final RecordingCallListener listener = new RecordingCallListener();

    private MeshCall call;

    @BeforeEach
    void setUp() {
        MeshCallOptions options = MeshCallOptions.defaults();
        options.setNegotiationPolicy(NegotiationPolicy.withoutTimeout());
        call = new MeshCall(URI.create("ws://localhost:8080/ws"), captureDevice, connector, transportFactory,
                listener, options);
    }

    @AfterEach
    void tearDown() {
        call.close();
    }

    @Test
    void joinSendsNormalizedRoomAndFreshIdentity() throws Exception {
        call.join("  room-a ", "Alice");

        JoinRoomMessage join = (JoinRoomMessage) connector.latest().getSent().get(0);
        assertThat(join.getRoomId()).isEqualTo("ROOM-A");
        assertThat(join.getName()).isEqualTo("Alice");
        assertThat(join.getParticipantId()).hasSize(8).isEqualTo(call.getParticipantId());
        assertThat(call.getRoomId()).isEqualTo("ROOM-A");
        assertThat(call.isConnected()).isTrue();
        assertThat(captureDevice.getLastConstraints().getWidth()).isEqualTo(640);
    }

    @Test
    void blankNameFallsBackToDefaultDisplayName() throws Exception {
        call.join("r1", " ");

        JoinRoomMessage join = (JoinRoomMessage) connector.latest().getSent().get(0);
        assertThat(join.getName()).isEqualTo("User " + join.getParticipantId().substring(0, 4));
    }

    @Test
    void mediaFailureAbortsJoinWithoutConnecting() {
        captureDevice.failWith(new MediaAcquisitionException("Permission denied"));

        assertThatThrownBy(() -> call.join("r1", "Alice"))
                .isInstanceOf(CallStartException.class)
                .hasCauseInstanceOf(MediaAcquisitionException.class)
                .hasMessageContaining("Permission denied");
        assertThat(connector.getChannels()).isEmpty();
        assertThat(call.isInCall()).isFalse();
    }

    @Test
    void connectionFailureReleasesLocalMedia() {
        connector.failWith(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> call.join("r1", "Alice"))
                .isInstanceOf(CallStartException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(captureDevice.getIssuedTracks()).allMatch(FakeTrack::isStopped);
        assertThat(call.isInCall()).isFalse();
    }

    @Test
    void hangUpReleasesEverythingOnce() throws Exception {
        call.join("r1", "Alice");
        FakeChannel channel = connector.latest();
        String self = call.getParticipantId();
        String peer = "~" + self;
        channel.deliver(new JoinedRoomMessage("R1", self, 1));
        channel.deliver(new ParticipantJoinedMessage(peer, "Bob", 2));
        channel.deliver(new ExistingParticipantsMessage(List.of()));

        call.hangUp();
        call.hangUp();

        assertThat(channel.getSent()).extracting(SignalMessage::getType)
                .containsExactly(MessageType.JOIN_ROOM, MessageType.OFFER, MessageType.LEAVE_ROOM);
        assertThat(channel.isOpen()).isFalse();
        assertThat(transportFactory.getCreated()).allMatch(FakePeerTransport::isClosed);
        assertThat(captureDevice.getIssuedTracks()).allMatch(FakeTrack::isStopped);
        assertThat(listener.getEndReasons()).containsExactly("hang up");
        assertThat(call.isInCall()).isFalse();
        assertThat(call.getRoster()).isEmpty();
    }

    @Test
    void serverCloseRunsSameCleanupWithoutLeaveMessage() throws Exception {
        call.join("r1", "Alice");
        FakeChannel channel = connector.latest();

        channel.closeFromServer("server shutdown");

        assertThat(channel.getSent()).extracting(SignalMessage::getType).containsExactly(MessageType.JOIN_ROOM);
        assertThat(captureDevice.getIssuedTracks()).allMatch(FakeTrack::isStopped);
        assertThat(listener.getEndReasons()).containsExactly("server shutdown");
        assertThat(call.isInCall()).isFalse();
    }

    @Test
    void joiningAnotherRoomHangsUpFirst() throws Exception {
        call.join("r1", "Alice");
        FakeChannel first = connector.latest();
        String firstId = call.getParticipantId();

        call.join("r2", "Alice");

        assertThat(first.isOpen()).isFalse();
        assertThat(first.getSent()).extracting(SignalMessage::getType)
                .containsExactly(MessageType.JOIN_ROOM, MessageType.LEAVE_ROOM);
        assertThat(connector.getChannels()).hasSize(2);
        assertThat(call.getRoomId()).isEqualTo("R2");
        assertThat(call.getParticipantId()).isNotEqualTo(firstId);
        assertThat(captureDevice.getIssuedTracks().subList(0, 2)).allMatch(FakeTrack::isStopped);
        assertThat(captureDevice.getIssuedTracks().subList(2, 4)).noneMatch(FakeTrack::isStopped);
    }

    @Test
    void rosterIsExposedWhileInCall() throws Exception {
        call.join("r1", "Alice");
        connector.latest().deliver(new ExistingParticipantsMessage(List.of(new ParticipantInfo("zzzzzzzz", "Bob"))));

        assertThat(call.getRoster()).containsExactly(new ParticipantInfo("zzzzzzzz", "Bob"));
        assertThat(listener.getRoster()).containsExactly(new ParticipantInfo("zzzzzzzz", "Bob"));
    }

    @Test
    void listenerMayQueryCallWhileAnotherThreadReadsRoster() throws Exception {
        CountDownLatch inCallback = new CountDownLatch(1);
        CountDownLatch readerDone = new CountDownLatch(1);
        AtomicReference<MeshCall> callRef = new AtomicReference<>();
        AtomicBoolean readerFinishedFirst = new AtomicBoolean();
        AtomicBoolean inCallSeen = new AtomicBoolean();
        RecordingCallListener querying = new RecordingCallListener() {
            @Override
            public void onRosterChanged(List<ParticipantInfo> roster) {
                super.onRosterChanged(roster);
                if (inCallback.getCount() == 0) {
                    return;
                }
                inCallback.countDown();
                try {
                    readerFinishedFirst.set(readerDone.await(5, TimeUnit.SECONDS));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                inCallSeen.set(callRef.get().isInCall());
            }
        };
        MeshCallOptions options = MeshCallOptions.defaults();
        options.setNegotiationPolicy(NegotiationPolicy.withoutTimeout());
        MeshCall guarded = new MeshCall(URI.create("ws://localhost:8080/ws"), captureDevice, connector,
                transportFactory, querying, options);
        callRef.set(guarded);
        guarded.join("r1", "Alice");
        FakeChannel channel = connector.latest();

        Thread delivery = new Thread(() -> channel.deliver(
                new ExistingParticipantsMessage(List.of(new ParticipantInfo("zzzzzzzz", "Bob")))));
        delivery.setDaemon(true);
        delivery.start();
        assertThat(inCallback.await(5, TimeUnit.SECONDS)).isTrue();

        Thread reader = new Thread(() -> {
            guarded.getRoster();
            readerDone.countDown();
        });
        reader.setDaemon(true);
        reader.start();

        delivery.join(10_000);
        reader.join(10_000);
        assertThat(delivery.isAlive()).isFalse();
        assertThat(reader.isAlive()).isFalse();
        assertThat(readerFinishedFirst).isTrue();
        assertThat(inCallSeen).isTrue();
        assertThat(guarded.getRoster()).containsExactly(new ParticipantInfo("zzzzzzzz", "Bob"));
        guarded.close();
    }
}
