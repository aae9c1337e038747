package com.example.roomchat.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoomJpaRepository extends JpaRepository<RoomEntity, String> {

    Optional<RoomEntity> findByCode(String code);

    long countByOwnerId(String ownerId);

    List<RoomEntity> findAllByOrderByCreatedAtDesc();

    List<RoomEntity> findByCreatedAtBefore(Instant cutoff);
}
