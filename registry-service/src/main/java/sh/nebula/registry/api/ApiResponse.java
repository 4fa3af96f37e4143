package sh.nebula.registry.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * HTTP-style status plus JSON body produced by {@link RegistryApiHandler}.
 */
public record ApiResponse(int status, ObjectNode body) {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int UNAVAILABLE = 503;

    public boolean success() {
        return body.path("success").asBoolean(false);
    }
}
