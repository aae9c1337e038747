package com.example.roomchat.persistence;

import com.example.roomchat.domain.Room;
import com.example.roomchat.domain.RoomMember;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class RoomEntityMapper {

    private static final TypeReference<List<RoomMember>> MEMBER_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RoomEntity toEntity(Room room) {
        RoomEntity entity = new RoomEntity();
        entity.setId(room.getId());
        entity.setName(room.getName());
        entity.setOwnerId(room.getOwnerId());
        entity.setCode(room.getCode());
        entity.setInviteLinkId(room.getInviteLinkId());
        entity.setAllowAi(room.isAllowAI());
        entity.setMembers(writeJson(room.getMembers() == null ? List.of() : room.getMembers()));
        entity.setTheme(StringUtils.hasText(room.getTheme()) ? room.getTheme() : Room.DEFAULT_THEME);
        entity.setCreatedAt(room.getCreatedAt());
        entity.setUpdatedAt(room.getUpdatedAt());
        return entity;
    }

    public Room toRoom(RoomEntity entity) {
        return Room.builder()
                .id(entity.getId())
                .name(entity.getName())
                .ownerId(entity.getOwnerId())
                .code(entity.getCode())
                .inviteLinkId(entity.getInviteLinkId())
                .allowAI(entity.isAllowAi())
                .members(readMembers(entity.getMembers()))
                .theme(StringUtils.hasText(entity.getTheme()) ? entity.getTheme() : Room.DEFAULT_THEME)
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private List<RoomMember> readMembers(String json) {
        if (!StringUtils.hasText(json)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, MEMBER_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize room members", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize room members", e);
        }
    }
}
