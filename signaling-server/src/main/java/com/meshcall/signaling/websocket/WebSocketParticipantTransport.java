package com.meshcall.signaling.websocket;

import com.meshcall.protocol.SignalMessage;
import com.meshcall.protocol.SignalMessageCodec;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * Spring WebSocket 세션 위의 {@link ParticipantTransport}.
 * 여러 방 이벤트가 동시에 같은 세션으로 나갈 수 있으므로 세션을 동시 전송 데코레이터로 감싼다.
 */
public class WebSocketParticipantTransport implements ParticipantTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketParticipantTransport.class);

    private final WebSocketSession session;
    private final SignalMessageCodec codec;

    public WebSocketParticipantTransport(WebSocketSession session, SignalMessageCodec codec,
            int sendTimeLimitMillis, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, sendBufferSizeLimit);
        this.codec = codec;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(SignalMessage message) {
        if (!session.isOpen()) {
            log.debug("Dropping {} for closed session {}", message.getType().toValue(), session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException | SessionLimitExceededException ex) {
            log.error("Failed to send {} to session {}", message.getType().toValue(), session.getId(), ex);
        }
    }
}
