package com.example.roomchat.call;

import lombok.Value;

@Value
public class CallPeer {
    String peerId;
    String name;
}
