package com.meshcall.signaling.websocket;

import com.meshcall.protocol.ErrorMessage;
import com.meshcall.protocol.Identifiers;
import com.meshcall.protocol.JoinRoomMessage;
import com.meshcall.protocol.MalformedMessageException;
import com.meshcall.protocol.RelayMessage;
import com.meshcall.protocol.SignalMessage;
import com.meshcall.protocol.SignalMessageCodec;
import com.meshcall.protocol.UnknownMessageTypeException;
import com.meshcall.signaling.config.WebSocketProperties;
import com.meshcall.signaling.service.RelayException;
import com.meshcall.signaling.service.RoomRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 브라우저와의 WebSocket 시그널링 메시지를 받아 RoomRegistry 작업으로 라우팅한다.
 * SDP/ICE 내용은 해석하지 않고 대상 참가자에게 그대로 넘긴다.
 */
@Component
public class SignalingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    private final SignalMessageCodec codec;
    private final RoomRegistry roomRegistry;
    private final Validator validator;
    private final WebSocketProperties properties;

    private final Map<String, ParticipantTransport> transports = new ConcurrentHashMap<>(); // 세션 ID -> 전송 채널

    public SignalingWebSocketHandler(SignalMessageCodec codec, RoomRegistry roomRegistry, Validator validator,
            WebSocketProperties properties) {
        this.codec = codec;
        this.roomRegistry = roomRegistry;
        this.validator = validator;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        transports.put(session.getId(), new WebSocketParticipantTransport(session, codec,
                properties.getSendTimeLimitMillis(), properties.getSendBufferSizeLimit()));
        log.debug("WebSocket connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ParticipantTransport transport = transportFor(session);
        SignalMessage signal;
        try {
            signal = codec.decode(message.getPayload());
        } catch (UnknownMessageTypeException ex) {
            log.warn("Unknown message type {} from session {}", ex.getTypeId(), session.getId());
            sendError(transport, ex.getMessage());
            return;
        } catch (MalformedMessageException ex) {
            log.warn("Unparseable message from session {}: {}", session.getId(), ex.getMessage());
            sendError(transport, ex.getMessage());
            return;
        }

        String type = signal.getType().toValue();
        log.debug("Incoming {} from session {}", type, session.getId());
        try {
            validate(signal);
            switch (signal.getType()) {
                case JOIN_ROOM -> handleJoinRoom(transport, (JoinRoomMessage) signal);
                case OFFER, ANSWER, ICE_CANDIDATE -> roomRegistry.relay(transport, (RelayMessage) signal);
                case LEAVE_ROOM -> roomRegistry.leave(transport);
                // 서버가 보내는 종류를 클라이언트가 보낸 경우
                case JOINED_ROOM, EXISTING_PARTICIPANTS, PARTICIPANT_JOINED, PARTICIPANT_LEFT, ERROR ->
                        throw new IllegalArgumentException("Unexpected message type: " + type);
            }
        } catch (IllegalArgumentException | RelayException ex) {
            log.warn("Message {} from session {} rejected: {}", type, session.getId(), ex.getMessage());
            sendError(transport, ex.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        disconnect(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket closed: {} ({})", session.getId(), status);
        disconnect(session);
    }

    private void handleJoinRoom(ParticipantTransport transport, JoinRoomMessage message) {
        String roomId = Identifiers.normalizeRoomId(message.getRoomId());
        roomRegistry.join(roomId, message.getParticipantId(), message.getName(), transport);
    }

    private void disconnect(WebSocketSession session) {
        // 연결이 끊어지면 참가자를 방에서 정리한다. 두 번 호출되어도 안전하다.
        ParticipantTransport transport = transports.remove(session.getId());
        if (transport != null) {
            roomRegistry.leave(transport);
        }
    }

    private ParticipantTransport transportFor(WebSocketSession session) {
        return transports.computeIfAbsent(session.getId(), id -> new WebSocketParticipantTransport(session, codec,
                properties.getSendTimeLimitMillis(), properties.getSendBufferSizeLimit()));
    }

    private void validate(SignalMessage signal) {
        Set<ConstraintViolation<SignalMessage>> violations = validator.validate(signal);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException(message);
        }
    }

    private void sendError(ParticipantTransport transport, String message) {
        transport.send(new ErrorMessage(message));
    }
}
