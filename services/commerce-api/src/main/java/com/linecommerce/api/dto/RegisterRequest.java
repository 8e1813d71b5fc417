package com.linecommerce.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RegisterRequest - Payload for creating a password-based account.
 *
 * <pre>
 * POST /api/auth/register
 *
 * {
 *   "email": "user@example.com",
 *   "password": "securePassword123",
 *   "displayName": "Jane"
 * }
 * </pre>
 *
 * Registration does not sign the user in; a separate login call issues the token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    @NotBlank
    @Size(min = 8, max = 100)
    private String password;

    @Size(max = 255)
    private String displayName;
}
