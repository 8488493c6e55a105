package in.pricehub.infrastructure.upstream;

/**
 * Exception thrown when the upstream feed cannot be reached, authenticated or written to.
 */
public class UpstreamConnectionException extends RuntimeException {

    private final String endpoint;

    public UpstreamConnectionException(String endpoint, String message) {
        super(String.format("[%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public UpstreamConnectionException(String endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
