package sh.nebula.registry.peer;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Protocol, host and port of a peer endpoint.
 */
public record EndpointAddress(String protocol, String host, int port) {

    private static final Pattern ENDPOINT = Pattern.compile("^(?:(https?)://)?([^:/]+)(?::(\\d+))?");
    private static final int DEFAULT_PORT = 80;

    public EndpointAddress {
        protocol = protocol == null || protocol.isBlank() ? "http" : protocol;
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
    }

    public static EndpointAddress http(String host, int port) {
        return new EndpointAddress("http", host, port);
    }

    /**
     * Parses {@code [http[s]://]host[:port]}; a missing port means 80.
     */
    public static Optional<EndpointAddress> parse(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = ENDPOINT.matcher(endpoint.trim());
        if (!matcher.find()) {
            return Optional.empty();
        }
        int port = matcher.group(3) == null ? DEFAULT_PORT : Integer.parseInt(matcher.group(3));
        return Optional.of(new EndpointAddress(matcher.group(1), matcher.group(2), port));
    }

    public String toUrl() {
        return protocol + "://" + host + ":" + port;
    }
}
