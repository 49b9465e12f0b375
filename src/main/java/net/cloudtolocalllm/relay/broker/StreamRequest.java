package net.cloudtolocalllm.relay.broker;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.auth.Claims;

/**
 * One chat turn to stream.
 * <p>
 * {@code token} and {@code claims} are both null for an anonymous request, which can only be served
 * by the local endpoint.
 */
@Value
@Accessors(fluent = true)
public class StreamRequest {
    @NonNull
    String userId;
    String token;
    Claims claims;
    @NonNull
    String model;
    @NonNull
    String message;

    public static StreamRequest anonymous(String userId, String model, String message) {
        return new StreamRequest(userId, null, null, model, message);
    }

    public static StreamRequest authenticated(String token, Claims claims, String model, String message) {
        return new StreamRequest(claims.userId(), token, claims, model, message);
    }

    public boolean isAuthenticated() {
        return claims != null;
    }

    @Override
    public String toString() {
        return "StreamRequest(user=" + userId + ", model=" + model + ", authenticated=" + isAuthenticated() + ")";
    }
}
