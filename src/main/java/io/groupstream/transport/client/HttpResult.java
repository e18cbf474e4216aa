package io.groupstream.transport.client;

/**
 * A fully received HTTP response.
 */
public record HttpResult(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
