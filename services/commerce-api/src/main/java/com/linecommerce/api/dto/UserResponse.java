package com.linecommerce.api.dto;

import com.linecommerce.api.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * UserResponse - Public view of an account.
 *
 * Never carries the password credential or the provider subject id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private UUID id;

    private String email;

    private String displayName;

    private String avatarUrl;

    /**
     * Linked identity provider ("google", "apple"), or null for password-only accounts.
     */
    private String oauthProvider;

    private boolean active;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .displayName(user.getDisplayName())
                .avatarUrl(user.getAvatarUrl())
                .oauthProvider(user.getOauthProvider())
                .active(user.isActive())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
