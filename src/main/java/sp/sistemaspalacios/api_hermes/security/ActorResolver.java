package sp.sistemaspalacios.api_hermes.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_hermes.exception.ForbiddenException;
import sp.sistemaspalacios.api_hermes.exception.UnauthorizedException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Resuelve el {@link Actor} de una petición HTTP:
 * token de administrador en {@code x-admin-token} (o {@code Authorization: Bearer}),
 * si no, el empleado de {@code x-user-id}.
 */
@Component
public class ActorResolver {

    public static final String ADMIN_TOKEN_HEADER = "x-admin-token";
    public static final String USER_ID_HEADER = "x-user-id";
    public static final String ADMIN_USERNAME_HEADER = "x-admin-user";

    private final String adminToken;

    public ActorResolver(@Value("${hermes.admin-token:}") String adminToken) {
        this.adminToken = adminToken;
    }

    public Optional<Actor> resolve(HttpServletRequest request) {
        String token = request.getHeader(ADMIN_TOKEN_HEADER);
        if (token == null) {
            String auth = request.getHeader("Authorization");
            if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
                token = auth.substring(7).trim();
            }
        }
        if (token != null && isAdminToken(token)) {
            String username = request.getHeader(ADMIN_USERNAME_HEADER);
            return Optional.of(Actor.admin(username == null || username.isBlank() ? "admin" : username.trim()));
        }

        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            return Optional.of(Actor.employee(userId));
        }
        return Optional.empty();
    }

    public Actor requireActor(HttpServletRequest request) {
        return resolve(request).orElseThrow(() -> new UnauthorizedException("Unauthorized"));
    }

    public Actor requireAdmin(HttpServletRequest request) {
        Actor actor = requireActor(request);
        if (!actor.isAdmin()) {
            throw new ForbiddenException("Forbidden");
        }
        return actor;
    }

    public Actor requireEmployee(HttpServletRequest request) {
        Actor actor = requireActor(request);
        if (!actor.isEmployee()) {
            throw new IllegalArgumentException("Falta el empleado (" + USER_ID_HEADER + ")");
        }
        return actor;
    }

    public boolean isAdminToken(String candidate) {
        if (adminToken == null || adminToken.isBlank() || candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(
                adminToken.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }

    public boolean hasAdminToken() {
        return adminToken != null && !adminToken.isBlank();
    }
}
