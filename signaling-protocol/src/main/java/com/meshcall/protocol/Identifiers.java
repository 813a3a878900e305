package com.meshcall.protocol;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * 방/참가자 식별자 관련 규칙.
 */
public final class Identifiers {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int PARTICIPANT_ID_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private Identifiers() {
    }

    /**
     * 방 ID는 대소문자를 구분하지 않는다. 앞뒤 공백을 제거하고 대문자로 맞춘다.
     */
    public static String normalizeRoomId(String roomId) {
        if (roomId == null) {
            return null;
        }
        return roomId.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * 연결(세션)마다 새로 발급하는 참가자 ID. 재참여 시에도 새 값을 쓴다.
     */
    public static String newParticipantId() {
        StringBuilder builder = new StringBuilder(PARTICIPANT_ID_LENGTH);
        for (int i = 0; i < PARTICIPANT_ID_LENGTH; i++) {
            builder.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }

    public static String defaultDisplayName(String participantId) {
        String prefix = participantId.length() > 4 ? participantId.substring(0, 4) : participantId;
        return "User " + prefix;
    }
}
