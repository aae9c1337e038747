package com.example.roomchat.controller;

import com.example.roomchat.domain.Room;
import com.example.roomchat.dto.JoinRoomRequest;
import com.example.roomchat.dto.MessagePayload;
import com.example.roomchat.service.MessageCoordinator;
import com.example.roomchat.service.RoomMutationCoordinator;
import com.example.roomchat.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomMutationCoordinator roomMutationCoordinator;
    private final MessageCoordinator messageCoordinator;

    public RoomController(RoomMutationCoordinator roomMutationCoordinator, MessageCoordinator messageCoordinator) {
        this.roomMutationCoordinator = roomMutationCoordinator;
        this.messageCoordinator = messageCoordinator;
    }

    @PostMapping("/join")
    public ResponseEntity<Room> join(@Valid @RequestBody JoinRoomRequest request) {
        return ResponseEntity.ok(roomMutationCoordinator.joinAsMember(request));
    }

    @GetMapping("/{roomId}/messages")
    public ResponseEntity<List<MessagePayload>> getMessages(
            @PathVariable String roomId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(messageCoordinator.history(roomId, limit));
    }

    @GetMapping("/code/{code}")
    public ResponseEntity<Room> getByCode(@PathVariable String code) {
        Room room = roomMutationCoordinator.verifyCode(code).orElseThrow(ServiceException::roomNotFound);
        return ResponseEntity.ok(room);
    }
}
