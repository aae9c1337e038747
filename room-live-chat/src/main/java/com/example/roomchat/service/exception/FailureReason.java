package com.example.roomchat.service.exception;

/**
 * Machine readable reason codes reported back to the originating connection.
 */
public enum FailureReason {
    VALIDATION_ERROR,
    MISSING_DATA,
    MISSING_OWNER,
    NOT_OWNER,
    NOT_AUTHORIZED,
    ROOM_NOT_FOUND,
    MESSAGE_NOT_FOUND,
    LIMIT_REACHED,
    SERVER_ERROR
}
