package com.pulsefocus.backend.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One OAuth credential per user, keyed by user id so every save is an upsert.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "oura_connections")
public class OuraCredential {

    @Id
    private String userId;

    @ToString.Exclude
    @Field("access_token")
    private String accessToken;

    @ToString.Exclude
    @Field("refresh_token")
    private String refreshToken;

    @Field("token_type")
    private String tokenType;

    @Field("scope")
    private String grantedScope;

    @Field("expires_at")
    private Instant expiresAt;

    @Field("updated_at")
    private Instant updatedAt;
}
