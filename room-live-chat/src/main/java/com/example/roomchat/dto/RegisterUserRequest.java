package com.example.roomchat.dto;

import lombok.Data;

@Data
public class RegisterUserRequest {

    private String userId;

    private String email;
}
