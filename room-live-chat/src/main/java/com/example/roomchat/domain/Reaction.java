package com.example.roomchat.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reaction implements Serializable {

    private String emoji;

    /** Registered user id or guest id. */
    private String userId;

    private String displayName;
}
