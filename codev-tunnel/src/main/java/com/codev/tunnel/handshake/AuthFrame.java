package com.codev.tunnel.handshake;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * First line the tower sends after the transport connects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthFrame(String type, String apiKey, String towerId) {

    public static final String TYPE = "auth";

    public static AuthFrame of(String apiKey, String towerId) {
        return new AuthFrame(TYPE, apiKey, towerId);
    }
}
