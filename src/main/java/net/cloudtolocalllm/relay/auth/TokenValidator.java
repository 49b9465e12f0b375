package net.cloudtolocalllm.relay.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Verifies RS256 bearer tokens issued by the identity provider.
 * <p>
 * The signature is checked before any claim, so a forged token never reports a claim-level error.
 * Expiry is strict; the configured skew only relaxes {@code nbf} and {@code iat}.
 */
public final class TokenValidator {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ALGORITHM = "RS256";
    private static final String JCA_ALGORITHM = "SHA256withRSA";

    private final JwksKeyCache keys;
    private final AuthSettings settings;
    private final Clock clock;

    public TokenValidator(JwksKeyCache keys, AuthSettings settings, Clock clock) {
        this.keys = Objects.requireNonNull(keys, "keys");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TokenValidation validate(String token) {
        if (token == null || token.isBlank()) {
            return TokenValidation.error(AuthError.MALFORMED, "token is missing");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            return TokenValidation.error(AuthError.MALFORMED, "token must have three segments");
        }
        JsonNode header;
        JsonNode payload;
        byte[] signature;
        try {
            header = decodeJson(parts[0]);
            payload = decodeJson(parts[1]);
            signature = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IOException | IllegalArgumentException e) {
            return TokenValidation.error(AuthError.MALFORMED, "token segments are not base64url JSON");
        }
        if (!ALGORITHM.equals(header.path("alg").asText())) {
            return TokenValidation.error(AuthError.BAD_SIGNATURE, "unsupported algorithm: " + header.path("alg").asText());
        }
        byte[] signedContent = (parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        String kid = header.hasNonNull("kid") ? header.get("kid").asText() : null;
        List<PublicKey> candidates = keys.candidates(kid);
        if (candidates.isEmpty()) {
            return TokenValidation.error(AuthError.BAD_SIGNATURE, "no signing keys available");
        }
        if (!verifiesWithAny(candidates, signedContent, signature)) {
            return TokenValidation.error(AuthError.BAD_SIGNATURE, "signature does not verify");
        }
        return checkClaims(payload);
    }

    private TokenValidation checkClaims(JsonNode payload) {
        String subject = payload.path("sub").asText("");
        if (subject.isBlank()) {
            return TokenValidation.error(AuthError.MALFORMED, "token has no subject");
        }
        if (!payload.path("exp").isNumber()) {
            return TokenValidation.error(AuthError.MALFORMED, "token has no numeric exp");
        }
        String issuer = payload.hasNonNull("iss") ? payload.get("iss").asText() : null;
        if (settings.issuer() != null && !sameIssuer(settings.issuer(), issuer)) {
            return TokenValidation.error(AuthError.WRONG_ISSUER, "unexpected issuer: " + issuer);
        }
        List<String> audience = stringList(payload.get("aud"));
        if (!audience.contains(settings.audience())) {
            return TokenValidation.error(AuthError.WRONG_AUDIENCE, "token is not issued for " + settings.audience());
        }
        Instant now = clock.instant();
        Instant expiresAt = Instant.ofEpochSecond(payload.get("exp").asLong());
        if (!expiresAt.isAfter(now)) {
            return TokenValidation.error(AuthError.EXPIRED, "token expired at " + expiresAt);
        }
        Instant latestAcceptable = now.plus(settings.clockSkew());
        if (payload.path("nbf").isNumber()
                && Instant.ofEpochSecond(payload.get("nbf").asLong()).isAfter(latestAcceptable)) {
            return TokenValidation.error(AuthError.NOT_YET_VALID, "token is not valid yet");
        }
        Instant issuedAt = payload.path("iat").isNumber() ? Instant.ofEpochSecond(payload.get("iat").asLong()) : null;
        if (issuedAt != null && issuedAt.isAfter(latestAcceptable)) {
            return TokenValidation.error(AuthError.NOT_YET_VALID, "token issued in the future");
        }
        Set<String> scopes = scopes(payload);
        for (String required : settings.requiredScopes()) {
            if (!scopes.contains(required)) {
                return TokenValidation.error(AuthError.MISSING_SCOPE, "missing scope: " + required);
            }
        }
        return TokenValidation.ok(new Claims(subject, issuer, List.copyOf(audience), expiresAt, issuedAt, Set.copyOf(scopes)));
    }

    private static boolean verifiesWithAny(List<PublicKey> candidates, byte[] content, byte[] signature) {
        for (PublicKey key : candidates) {
            try {
                Signature verifier = Signature.getInstance(JCA_ALGORITHM);
                verifier.initVerify(key);
                verifier.update(content);
                if (verifier.verify(signature)) {
                    return true;
                }
            } catch (GeneralSecurityException e) {
                System.err.println("Signature check failed with a cached key: " + e.getMessage());
            }
        }
        return false;
    }

    private static JsonNode decodeJson(String segment) throws IOException {
        JsonNode node = MAPPER.readTree(Base64.getUrlDecoder().decode(segment));
        if (node == null || !node.isObject()) {
            throw new IOException("segment is not a JSON object");
        }
        return node;
    }

    private static boolean sameIssuer(String expected, String actual) {
        return actual != null && stripSlash(expected).equals(stripSlash(actual));
    }

    private static String stripSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                values.add(item.asText());
            }
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private static Set<String> scopes(JsonNode payload) {
        Set<String> scopes = new LinkedHashSet<>();
        String scope = payload.path("scope").asText("");
        for (String entry : scope.split(" ")) {
            if (!entry.isBlank()) {
                scopes.add(entry);
            }
        }
        scopes.addAll(stringList(payload.get("scp")));
        scopes.addAll(stringList(payload.get("permissions")));
        return scopes;
    }
}
