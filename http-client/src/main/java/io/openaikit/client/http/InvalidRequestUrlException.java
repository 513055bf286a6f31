package io.openaikit.client.http;

/**
 * Thrown when the base URL and a request path do not form a valid URL. Other
 * {@link IllegalArgumentException}s raised while building a request, such as a rejected
 * header, are not URL problems.
 */
public class InvalidRequestUrlException extends IllegalArgumentException {

    private final String url;

    public InvalidRequestUrlException(String url, Throwable cause) {
        super("URI [" + url + "] is not valid", cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
