package com.example.roomchat.call;

public enum CallEventType {
    CALL_STARTED("call_started"),
    EXISTING_PEERS("existing_peers"),
    USER_JOINED_CALL("user_joined_call"),
    USER_LEFT_CALL("user_left_call"),
    CALL_ENDED("call_ended");

    private final String eventName;

    CallEventType(String eventName) {
        this.eventName = eventName;
    }

    /** Socket.IO event name delivered to clients. */
    public String eventName() {
        return eventName;
    }
}
