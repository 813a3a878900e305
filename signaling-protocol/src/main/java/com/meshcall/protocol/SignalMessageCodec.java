package com.meshcall.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import java.util.Objects;

/**
 * 텍스트 프레임과 {@link SignalMessage} 사이의 변환을 담당한다.
 * 서버와 클라이언트가 같은 규칙으로 메시지를 읽고 쓰도록 한 곳에 모아 둔다.
 */
public class SignalMessageCodec {

    private final ObjectMapper objectMapper;

    public SignalMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * 수신한 텍스트를 메시지로 변환한다.
     *
     * @throws UnknownMessageTypeException type이 없거나 등록되지 않은 값일 때
     * @throws MalformedMessageException JSON 자체가 깨졌거나 필드 형식이 맞지 않을 때
     */
    public SignalMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedMessageException("Invalid JSON message", null);
        }
        try {
            return objectMapper.readValue(text, SignalMessage.class);
        } catch (InvalidTypeIdException ex) {
            throw new UnknownMessageTypeException(ex.getTypeId(), ex);
        } catch (JsonProcessingException ex) {
            throw new MalformedMessageException("Invalid JSON message", ex);
        }
    }

    public String encode(SignalMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new SignalCodecException("Failed to encode " + message.getType().toValue() + " message", ex);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
