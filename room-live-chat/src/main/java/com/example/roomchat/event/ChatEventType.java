package com.example.roomchat.event;

public enum ChatEventType {
    ROOM_CREATED,
    ROOM_RENAMED,
    ROOM_DELETED,
    ROOM_EXPIRED,
    ROOM_AI_TOGGLED,
    MEMBER_JOINED,
    MESSAGE_DELETED,
    AUTHORIZATION_DENIED
}
