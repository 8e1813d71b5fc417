package com.linecommerce.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - Data Transfer Object for email/password login requests.
 *
 * Validation:
 * - email: Must be non-blank and valid email format
 * - password: 8 to 100 characters
 *
 * Usage:
 * <pre>
 * POST /api/auth/login
 * Content-Type: application/json
 *
 * {
 *   "email": "user@example.com",
 *   "password": "securePassword123"
 * }
 * </pre>
 *
 * Security Note:
 * Password should be transmitted over HTTPS only.
 * Never log or persist the password field.
 *
 * @see com.linecommerce.api.controller.AuthController#login for endpoint handling
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    @Email
    private String email;

    @NotBlank
    @Size(min = 8, max = 100)
    private String password;
}
