package com.example.roomchat.persistence;

import com.example.roomchat.domain.Room;
import com.example.roomchat.service.RoomStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaRoomStore implements RoomStore {

    private final RoomJpaRepository roomJpaRepository;
    private final RoomEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<Room> findAll() {
        return roomJpaRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(mapper::toRoom)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Room> findById(String roomId) {
        if (!StringUtils.hasText(roomId)) {
            return Optional.empty();
        }
        return roomJpaRepository.findById(roomId).map(mapper::toRoom);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Room> findByCode(String code) {
        if (!StringUtils.hasText(code)) {
            return Optional.empty();
        }
        return roomJpaRepository.findByCode(code.trim()).map(mapper::toRoom);
    }

    @Override
    @Transactional(readOnly = true)
    public long countByOwner(String ownerId) {
        return roomJpaRepository.countByOwnerId(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Room> findCreatedBefore(Instant cutoff) {
        return roomJpaRepository.findByCreatedAtBefore(cutoff).stream()
                .map(mapper::toRoom)
                .toList();
    }

    @Override
    @Transactional
    public Room create(Room room) {
        Instant now = Instant.now();
        if (!StringUtils.hasText(room.getId())) {
            room.setId(UUID.randomUUID().toString());
        }
        if (room.getCreatedAt() == null) {
            room.setCreatedAt(now);
        }
        room.setUpdatedAt(now);
        roomJpaRepository.save(mapper.toEntity(room));
        return room;
    }

    @Override
    @Transactional
    public Room update(Room room) {
        room.setUpdatedAt(Instant.now());
        roomJpaRepository.save(mapper.toEntity(room));
        return room;
    }

    @Override
    @Transactional
    public void delete(String roomId) {
        if (StringUtils.hasText(roomId) && roomJpaRepository.existsById(roomId)) {
            roomJpaRepository.deleteById(roomId);
        }
    }
}
