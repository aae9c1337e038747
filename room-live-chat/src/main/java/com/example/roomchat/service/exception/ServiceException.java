package com.example.roomchat.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final FailureReason reason;

    public ServiceException(HttpStatus status, String message, FailureReason reason) {
        this(status, message, reason, null);
    }

    public ServiceException(HttpStatus status, String message, FailureReason reason, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.reason = reason;
    }

    public static ServiceException roomNotFound() {
        return new ServiceException(HttpStatus.NOT_FOUND, "Room not found.", FailureReason.ROOM_NOT_FOUND);
    }

    public static ServiceException messageNotFound() {
        return new ServiceException(HttpStatus.NOT_FOUND, "Message not found.", FailureReason.MESSAGE_NOT_FOUND);
    }

    public static ServiceException serverError(String message, Throwable cause) {
        return new ServiceException(HttpStatus.INTERNAL_SERVER_ERROR, message, FailureReason.SERVER_ERROR, cause);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public FailureReason getReason() {
        return reason;
    }
}
