package com.codev.tunnel.handshake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Relay answer to an {@link AuthFrame}: {@code auth_ok} with the confirmed tower id,
 * or {@code auth_error} with a reason tag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(String type, String towerId, String reason) {

    public static final String TYPE_OK = "auth_ok";
    public static final String TYPE_ERROR = "auth_error";

    public static AuthResponse ok(String towerId) {
        return new AuthResponse(TYPE_OK, towerId, null);
    }

    public static AuthResponse error(AuthErrorReason reason) {
        return new AuthResponse(TYPE_ERROR, null, reason.wireName());
    }

    public boolean isOk() {
        return TYPE_OK.equals(type);
    }

    public boolean isError() {
        return TYPE_ERROR.equals(type);
    }
}
