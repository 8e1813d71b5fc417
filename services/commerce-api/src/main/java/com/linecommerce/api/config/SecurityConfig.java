package com.linecommerce.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linecommerce.api.dto.ErrorResponse;
import com.linecommerce.api.exception.AuthErrorKind;
import com.linecommerce.api.security.JwtAuthenticationFilter;
import com.linecommerce.api.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * SecurityConfig - Stateless HTTP security for the API.
 *
 * Public:
 * - GET /healthz
 * - POST /api/auth/register, /login, /logout, /apple/callback
 * - GET /api/auth/google, /google/callback, /apple
 * - GET /api/items, /api/items/{id}
 *
 * Everything else requires a valid session token, checked by
 * {@link JwtAuthenticationFilter}. No HTTP session is ever created and CSRF
 * protection is off because authentication does not rely on ambient browser
 * state beyond the SameSite cookie.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final AuthService authService;

    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/healthz", "/error").permitAll()
                        .requestMatchers(HttpMethod.POST,
                                "/api/auth/register", "/api/auth/login", "/api/auth/logout", "/api/auth/apple/callback")
                        .permitAll()
                        .requestMatchers(HttpMethod.GET,
                                "/api/auth/google", "/api/auth/google/callback", "/api/auth/apple")
                        .permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/items", "/api/items/*").permitAll()
                        .anyRequest().authenticated())
                .exceptionHandling(handling -> handling.authenticationEntryPoint(unauthorizedEntryPoint()))
                .addFilterBefore(new JwtAuthenticationFilter(authService), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    private AuthenticationEntryPoint unauthorizedEntryPoint() {
        return (request, response, exception) -> {
            AuthErrorKind kind = AuthErrorKind.TOKEN_INVALID;
            response.setStatus(kind.getStatus().value());
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), ErrorResponse.builder()
                    .error(kind.getCode())
                    .detail(kind.getMessage())
                    .build());
        };
    }
}
