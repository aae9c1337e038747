package com.example.roomchat.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, String> {

    List<MessageEntity> findByRoomIdOrderByCreatedAtAsc(String roomId, Pageable pageable);

    @Modifying
    @Query("delete from MessageEntity m where m.roomId = :roomId")
    int deleteByRoomId(@Param("roomId") String roomId);
}
