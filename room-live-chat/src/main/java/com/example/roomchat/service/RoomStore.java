package com.example.roomchat.service;

import com.example.roomchat.domain.Room;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Document-style access to persisted rooms. Updates replace the whole room (last write wins).
 */
public interface RoomStore {

    /** All rooms, newest first. */
    List<Room> findAll();

    Optional<Room> findById(String roomId);

    Optional<Room> findByCode(String code);

    long countByOwner(String ownerId);

    List<Room> findCreatedBefore(Instant cutoff);

    Room create(Room room);

    Room update(Room room);

    void delete(String roomId);
}
