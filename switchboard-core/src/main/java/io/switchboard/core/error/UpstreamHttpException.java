package io.switchboard.core.error;

/**
 * Non-2xx answer from an upstream provider. The status and body drive key rotation.
 */
public final class UpstreamHttpException extends GatewayException {
    private final int status;
    private final String body;

    public UpstreamHttpException(int status, String body) {
        super(ErrorCategory.UPSTREAM, "Upstream returned HTTP " + status + ": " + truncate(body, 300));
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
