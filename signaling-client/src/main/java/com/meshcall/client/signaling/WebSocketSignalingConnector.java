package com.meshcall.client.signaling;

import com.meshcall.protocol.SignalCodecException;
import com.meshcall.protocol.SignalMessage;
import com.meshcall.protocol.SignalMessageCodec;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Spring WebSocket 클라이언트로 시그널링 서버에 연결한다.
 */
public class WebSocketSignalingConnector implements SignalingConnector {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSignalingConnector.class);

    private static final int SEND_TIME_LIMIT_MILLIS = 10_000;
    private static final int SEND_BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketClient client;
    private final SignalMessageCodec codec;

    public WebSocketSignalingConnector(SignalMessageCodec codec) {
        this(new StandardWebSocketClient(), codec);
    }

    public WebSocketSignalingConnector(WebSocketClient client, SignalMessageCodec codec) {
        this.client = client;
        this.codec = codec;
    }

    @Override
    public CompletableFuture<SignalingChannel> connect(URI serverUri, SignalingChannelListener listener) {
        log.info("Connecting to signaling server {}", serverUri);
        return client.execute(new ChannelHandler(listener), new WebSocketHttpHeaders(), serverUri)
                .thenApply(session -> {
                    log.info("Signaling connection established: {}", session.getId());
                    return new WebSocketSignalingChannel(session);
                });
    }

    private class ChannelHandler extends TextWebSocketHandler {

        private final SignalingChannelListener listener;

        ChannelHandler(SignalingChannelListener listener) {
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            SignalMessage decoded;
            try {
                decoded = codec.decode(message.getPayload());
            } catch (SignalCodecException ex) {
                log.warn("Ignoring undecodable server message: {}", ex.getMessage());
                return;
            }
            log.debug("Received {}", decoded.getType().toValue());
            listener.onMessage(decoded);
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.error("Signaling transport error on {}", session.getId(), exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            log.info("Signaling connection closed: {} ({})", session.getId(), status);
            listener.onClosed(status.getReason() != null ? status.getReason() : "closed with code " + status.getCode());
        }
    }

    private class WebSocketSignalingChannel implements SignalingChannel {

        private final WebSocketSession session;

        WebSocketSignalingChannel(WebSocketSession session) {
            this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MILLIS, SEND_BUFFER_SIZE_LIMIT);
        }

        @Override
        public void send(SignalMessage message) {
            if (!session.isOpen()) {
                throw new SignalingChannelException("Signaling connection is closed");
            }
            try {
                session.sendMessage(new TextMessage(codec.encode(message)));
            } catch (IOException | SessionLimitExceededException ex) {
                throw new SignalingChannelException("Failed to send " + message.getType().toValue(), ex);
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void close() {
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException ex) {
                log.warn("Failed to close signaling connection {}", session.getId(), ex);
            }
        }
    }
}
