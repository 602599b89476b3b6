package sp.sistemaspalacios.api_hermes.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_hermes.exception.UnauthorizedException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Autentica las llamadas del despachador cron (tick y barridos diarios).
 *
 * <p>Exige el token de administrador reenviado en {@code x-admin-token} y, si hay
 * claves de firma configuradas, un JWT HS256 válido en {@code Upstash-Signature}
 * firmado con la clave actual o la siguiente. El claim {@code body} debe ser el
 * SHA-256 en base64url del cuerpo recibido. Sin token ni claves configuradas
 * se rechaza toda llamada.</p>
 */
@Slf4j
@Component
public class DispatcherCallbackVerifier {

    public static final String SIGNATURE_HEADER = "Upstash-Signature";

    private final ActorResolver actorResolver;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final List<String> signingKeys = new ArrayList<>();

    public DispatcherCallbackVerifier(
            ActorResolver actorResolver,
            ObjectMapper mapper,
            Clock clock,
            @Value("${hermes.dispatcher.current-signing-key:}") String currentSigningKey,
            @Value("${hermes.dispatcher.next-signing-key:}") String nextSigningKey
    ) {
        this.actorResolver = actorResolver;
        this.mapper = mapper;
        this.clock = clock;
        if (currentSigningKey != null && !currentSigningKey.isBlank()) signingKeys.add(currentSigningKey);
        if (nextSigningKey != null && !nextSigningKey.isBlank()) signingKeys.add(nextSigningKey);
    }

    public void verify(String forwardedAdminToken, String signature, String rawBody) {
        if (!actorResolver.hasAdminToken() && signingKeys.isEmpty()) {
            log.error("❌ Callback del despachador rechazado: no hay token de administrador ni claves de firma configuradas");
            throw new UnauthorizedException("Unauthorized (callback auth not configured)");
        }
        if (actorResolver.hasAdminToken() && !actorResolver.isAdminToken(forwardedAdminToken)) {
            log.warn("⚠️ Callback del despachador con token de administrador inválido");
            throw new UnauthorizedException("Unauthorized (admin)");
        }
        if (signingKeys.isEmpty()) {
            return;
        }
        if (signature == null || signature.isBlank()) {
            log.warn("⚠️ Callback del despachador sin firma");
            throw new UnauthorizedException("Missing signature");
        }
        for (String key : signingKeys) {
            if (isValid(signature.trim(), key, rawBody == null ? "" : rawBody)) {
                return;
            }
        }
        log.warn("⚠️ Firma del despachador inválida");
        throw new UnauthorizedException("Invalid signature");
    }

    private boolean isValid(String token, String key, String rawBody) {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            return false;
        }
        String expected = hmac(parts[0] + "." + parts[1], key);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                stripPadding(parts[2]).getBytes(StandardCharsets.UTF_8))) {
            return false;
        }
        try {
            JsonNode claims = mapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            long nowSeconds = clock.instant().getEpochSecond();
            if (claims.hasNonNull("exp") && nowSeconds > claims.get("exp").asLong()) {
                log.debug("Firma expirada");
                return false;
            }
            if (claims.hasNonNull("nbf") && nowSeconds < claims.get("nbf").asLong()) {
                log.debug("Firma aún no válida");
                return false;
            }
            String bodyHash = claims.path("body").asText("");
            return stripPadding(bodyHash).equals(sha256(rawBody));
        } catch (Exception e) {
            log.debug("Claims de firma ilegibles: {}", e.getMessage());
            return false;
        }
    }

    static String hmac(String data, String key) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("No se pudo calcular HMAC", e);
        }
    }

    static String sha256(String body) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(body.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible", e);
        }
    }

    private static String stripPadding(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '=') end--;
        return value.substring(0, end);
    }
}
