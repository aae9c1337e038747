package com.example.roomchat.call;

public interface CallEventListener {

    void onCallEvent(CallEvent event);
}
