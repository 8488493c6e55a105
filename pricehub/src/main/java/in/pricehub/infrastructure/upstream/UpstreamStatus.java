package in.pricehub.infrastructure.upstream;

/**
 * Control event from the upstream feed ("connected", "auth_success", "auth_failed", ...).
 */
public record UpstreamStatus(String status, String message) {

    public boolean isAuthSuccess() {
        return "auth_success".equals(status);
    }

    public boolean isAuthFailure() {
        return "auth_failed".equals(status);
    }
}
