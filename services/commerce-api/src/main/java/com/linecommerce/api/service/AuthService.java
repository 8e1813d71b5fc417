package com.linecommerce.api.service;

import com.linecommerce.api.dto.LoginResponse;
import com.linecommerce.api.dto.OAuthAuthorizationResponse;
import com.linecommerce.api.dto.UserResponse;
import com.linecommerce.api.entity.User;
import com.linecommerce.api.exception.AuthErrorKind;
import com.linecommerce.api.exception.AuthException;
import com.linecommerce.api.security.IssuedToken;
import com.linecommerce.api.security.JwtUtil;
import com.linecommerce.api.security.PasswordHasher;
import com.linecommerce.api.security.TokenClaim;
import com.linecommerce.api.security.oauth.OAuthProvider;
import com.linecommerce.api.security.oauth.OAuthProviderClient;
import com.linecommerce.api.security.oauth.OAuthUserInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * AuthService - Orchestrates the public authentication flows.
 *
 * Flows:
 * - register: create a password account (no token issued)
 * - login: verify email and password, issue a session token
 * - oauthLogin: exchange an authorization code with Google or Apple, resolve
 *   or link the account, issue a session token
 * - verify: authenticate an inbound request from its session token
 *
 * Each call is a self-contained unit of work:
 * UNAUTHENTICATED -> credential check -> AUTHENTICATED (token issued), or
 * UNAUTHENTICATED -> REJECTED. Nothing is kept between requests and nothing is
 * retried; every failure is terminal and reported as an {@link AuthException}.
 *
 * Error Collapsing:
 * - Unknown email, missing password and wrong password are all INVALID_CREDENTIALS
 * - Every OAuth failure (network, decode, missing email, store conflict) is OAUTH_FAILED
 * - Bad signature, malformed and expired tokens are all TOKEN_INVALID
 * Callers cannot use the error to learn which accounts exist.
 *
 * Collaborator exceptions are caught here and mapped to an {@link AuthErrorKind};
 * their detail is logged, never returned.
 *
 * @see AccountResolver for account lookup, creation and linking
 * @see JwtUtil for token operations
 * @see PasswordHasher for credential checks
 */
@Slf4j
@Service
public class AuthService {

    private static final SecureRandom STATE_RANDOM = new SecureRandom();

    private static final int STATE_BYTES = 32;

    private final AccountResolver accountResolver;

    private final PasswordHasher passwordHasher;

    private final JwtUtil jwtUtil;

    private final List<OAuthProviderClient> oauthClients;

    /**
     * Credential checked when the email is unknown, so a miss costs as much as a wrong password.
     */
    private final String timingCredential;

    public AuthService(AccountResolver accountResolver,
                       PasswordHasher passwordHasher,
                       JwtUtil jwtUtil,
                       List<OAuthProviderClient> oauthClients) {
        this.accountResolver = accountResolver;
        this.passwordHasher = passwordHasher;
        this.jwtUtil = jwtUtil;
        this.oauthClients = oauthClients;
        this.timingCredential = passwordHasher.hash(UUID.randomUUID().toString());
    }

    /**
     * Register a new account with email and password.
     *
     * @param email email address, unique among active accounts
     * @param password plaintext password, hashed before storage
     * @param displayName optional display name
     * @return public view of the created account
     * @throws AuthException DUPLICATE_ACCOUNT if an active account already uses the email
     */
    public UserResponse register(String email, String password, String displayName) {
        if (accountResolver.findActiveByEmail(email).isPresent()) {
            log.info("Registration rejected: email already registered");
            throw new AuthException(AuthErrorKind.DUPLICATE_ACCOUNT);
        }

        String credential = passwordHasher.hash(password);
        try {
            User user = accountResolver.createPasswordAccount(email, credential, displayName);
            log.info("Registered account {}", user.getId());
            return UserResponse.from(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration for the same email
            log.warn("Registration rejected by unique constraint");
            throw new AuthException(AuthErrorKind.DUPLICATE_ACCOUNT, e);
        }
    }

    /**
     * Authenticate with email and password and issue a session token.
     *
     * @return token, expiry and the public view of the account
     * @throws AuthException INVALID_CREDENTIALS or ACCOUNT_DISABLED
     */
    public LoginResponse login(String email, String password) {
        Optional<User> found = accountResolver.findActiveByEmail(email);

        if (found.isEmpty() || !found.get().hasPassword()) {
            passwordHasher.verify(password, timingCredential);
            log.info("Password login rejected");
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            log.info("Password login rejected");
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }
        if (!user.isActive()) {
            log.warn("Password login for disabled account {}", user.getId());
            throw new AuthException(AuthErrorKind.ACCOUNT_DISABLED);
        }

        log.info("User authenticated successfully: {}", user.getId());
        return issueSession(user);
    }

    /**
     * Start an OAuth sign-in: build the provider's authorization URL with a fresh state.
     *
     * @throws AuthException OAUTH_NOT_CONFIGURED if the provider has no client credentials
     */
    public OAuthAuthorizationResponse getAuthorizationUrl(OAuthProvider provider) {
        OAuthProviderClient client = configuredClient(provider);
        String state = newState();

        return OAuthAuthorizationResponse.builder()
                .authorizationUrl(client.buildAuthorizationUrl(state))
                .state(state)
                .build();
    }

    /**
     * Complete an OAuth sign-in.
     *
     * The code is exchanged once; the reported identity is resolved to an
     * account (existing link, link by email, or new account) and a session
     * token is issued. No account is written unless the provider exchange
     * succeeded completely.
     *
     * @param provider which provider issued the code
     * @param code authorization code from the callback
     * @param state state echoed by the provider, checked by the client that initiated the flow
     * @return token, expiry and the public view of the account
     * @throws AuthException OAUTH_NOT_CONFIGURED or OAUTH_FAILED
     */
    public LoginResponse oauthLogin(OAuthProvider provider, String code, String state) {
        OAuthProviderClient client = configuredClient(provider);
        if (code == null || code.isBlank()) {
            throw new AuthException(AuthErrorKind.OAUTH_FAILED);
        }

        OAuthUserInfo identity;
        try {
            identity = client.fetchUserInfo(code);
            if (identity == null || isBlank(identity.getId()) || isBlank(identity.getEmail())) {
                log.warn("{} sign-in failed: identity without subject or email", provider.getDisplayName());
                throw new AuthException(AuthErrorKind.OAUTH_FAILED);
            }
        } catch (AuthException e) {
            throw e;
        } catch (RuntimeException e) {
            // provider transport errors and malformed identities alike
            log.warn("{} sign-in failed during provider exchange: {}", provider.getDisplayName(), e.getClass().getSimpleName());
            throw new AuthException(AuthErrorKind.OAUTH_FAILED, e);
        }

        User user;
        try {
            user = accountResolver.resolveOAuthIdentity(identity);
        } catch (AuthException e) {
            throw e;
        } catch (RuntimeException e) {
            // includes DataIntegrityViolationException from a concurrent link or sign-up
            log.warn("{} sign-in failed while resolving account: {}", provider.getDisplayName(), e.getClass().getSimpleName());
            throw new AuthException(AuthErrorKind.OAUTH_FAILED, e);
        }

        log.info("User authenticated via {}: {}", provider.getId(), user.getId());
        return issueSession(user);
    }

    /**
     * Authenticate an inbound request from its session token.
     *
     * @param token compact JWS from the Authorization header or cookie
     * @return the account the token was issued to
     * @throws AuthException TOKEN_INVALID if the token fails verification,
     *                       NOT_FOUND if its subject is unknown or deactivated
     */
    public UserResponse verify(String token) {
        TokenClaim claim = jwtUtil.verifyToken(token)
                .orElseThrow(() -> new AuthException(AuthErrorKind.TOKEN_INVALID));

        return accountResolver.findActiveById(claim.getSubjectId())
                .map(UserResponse::from)
                .orElseThrow(() -> new AuthException(AuthErrorKind.NOT_FOUND));
    }

    /**
     * Current state of an authenticated account.
     *
     * @throws AuthException NOT_FOUND if the account no longer exists or was deactivated
     */
    public UserResponse getCurrentUser(UUID userId) {
        return accountResolver.findActiveById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new AuthException(AuthErrorKind.NOT_FOUND));
    }

    private LoginResponse issueSession(User user) {
        IssuedToken token = jwtUtil.issueToken(user.getId(), user.getEmail());

        return LoginResponse.builder()
                .accessToken(token.getValue())
                .expiresAt(token.getExpiresAt())
                .user(UserResponse.from(user))
                .build();
    }

    private OAuthProviderClient configuredClient(OAuthProvider provider) {
        OAuthProviderClient client = oauthClients.stream()
                .filter(candidate -> candidate.getProvider() == provider)
                .findFirst()
                .orElseThrow(() -> new AuthException(AuthErrorKind.OAUTH_NOT_CONFIGURED));
        if (!client.isConfigured()) {
            log.debug("{} OAuth requested but not configured", provider.getDisplayName());
            throw new AuthException(AuthErrorKind.OAUTH_NOT_CONFIGURED);
        }
        return client;
    }

    private static String newState() {
        byte[] bytes = new byte[STATE_BYTES];
        STATE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
