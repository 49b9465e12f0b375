package net.cloudtolocalllm.relay.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON error body of the gateway API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class GatewayResponse {
    public final String error;
    public final String code;

    public static GatewayResponse error(String code, String message) {
        return new GatewayResponse(message == null ? code : message, code);
    }
}
