package com.meshcall.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 클라이언트와 시그널링 서버가 주고받는 모든 메시지의 공통 상위 타입.
 * JSON의 {@code type} 속성으로 구체 타입을 구분한다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinRoomMessage.class, name = "join-room"),
        @JsonSubTypes.Type(value = JoinedRoomMessage.class, name = "joined-room"),
        @JsonSubTypes.Type(value = ExistingParticipantsMessage.class, name = "existing-participants"),
        @JsonSubTypes.Type(value = ParticipantJoinedMessage.class, name = "participant-joined"),
        @JsonSubTypes.Type(value = ParticipantLeftMessage.class, name = "participant-left"),
        @JsonSubTypes.Type(value = OfferMessage.class, name = "offer"),
        @JsonSubTypes.Type(value = AnswerMessage.class, name = "answer"),
        @JsonSubTypes.Type(value = IceCandidateMessage.class, name = "ice-candidate"),
        @JsonSubTypes.Type(value = LeaveRoomMessage.class, name = "leave-room"),
        @JsonSubTypes.Type(value = ErrorMessage.class, name = "error")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class SignalMessage {

    /**
     * 메시지 종류. 직렬화 시 {@code type} 속성은 타입 정보로 기록되므로 여기서는 제외한다.
     */
    @JsonIgnore
    public abstract MessageType getType();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getType().toValue() + "]";
    }
}
