package com.linecommerce.api.security;

import com.linecommerce.api.dto.UserResponse;
import com.linecommerce.api.exception.AuthException;
import com.linecommerce.api.service.AuthService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * JwtAuthenticationFilter - Authenticates requests that carry a session token.
 *
 * Token sources, in order:
 * 1. "Authorization: Bearer &lt;token&gt;" header
 * 2. "access_token" HTTP-only cookie set at login
 *
 * A valid token whose subject is still an active account populates the
 * security context with the user id as principal name. Anything else leaves
 * the request anonymous; protected endpoints then answer 401 through the
 * configured entry point, without saying why. That includes a store outage
 * while looking up the account: public endpoints keep working and protected
 * ones answer 401 instead of 500.
 *
 * Not a Spring bean on purpose: it is only added to the security filter chain.
 *
 * @see com.linecommerce.api.config.SecurityConfig
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String token = resolveToken(request);

        if (token != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                UserResponse user = authService.verify(token);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(user.getId().toString(), null, List.of());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (AuthException e) {
                log.debug("Request left unauthenticated: {}", e.getKind().getCode());
            } catch (DataAccessException e) {
                log.warn("Account lookup failed, request left unauthenticated: {}", e.getClass().getSimpleName());
            }
        }

        chain.doFilter(request, response);
    }

    static String resolveToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }

        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (ACCESS_TOKEN_COOKIE.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                    return cookie.getValue();
                }
            }
        }
        return null;
    }
}
