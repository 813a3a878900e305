package com.meshcall.protocol;

/**
 * 서버가 요청 처리에 실패했을 때 보내는 응답.
 */
public class ErrorMessage extends SignalMessage {

    private String error;

    public ErrorMessage() {
    }

    public ErrorMessage(String error) {
        this.error = error;
    }

    @Override
    public MessageType getType() {
        return MessageType.ERROR;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
