package dev.catananti.publisher.service.transport;

/**
 * A platform call that did not produce a 2xx response.
 * {@code status} is 0 when no HTTP response was received.
 */
public class TransportException extends RuntimeException {

    private final Endpoint endpoint;
    private final String path;
    private final int status;
    private final String responseBody;

    public TransportException(Endpoint endpoint, String path, int status, String responseBody) {
        super(endpoint + " " + path + " responded " + status + (responseBody == null || responseBody.isBlank() ? "" : ": " + abbreviate(responseBody)));
        this.endpoint = endpoint;
        this.path = path;
        this.status = status;
        this.responseBody = responseBody;
    }

    public TransportException(Endpoint endpoint, String path, Throwable cause) {
        super(endpoint + " " + path + " failed: " + cause.getMessage(), cause);
        this.endpoint = endpoint;
        this.path = path;
        this.status = 0;
        this.responseBody = null;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public String getPath() {
        return path;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isServerSide() {
        return status == 0 || status >= 500;
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
