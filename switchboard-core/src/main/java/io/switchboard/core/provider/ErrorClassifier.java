package io.switchboard.core.provider;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

public final class ErrorClassifier {
    private static final int MAX_BODY_CHARS = 300;

    private ErrorClassifier() {
    }

    public static GatewayError fromStatus(int status, String body) {
        String detail = "HTTP " + status + " " + truncate(body);
        ErrorKind kind;
        if (status == 401 || status == 403) {
            kind = ErrorKind.AUTHENTICATION_ERROR;
        } else if (status == 429) {
            kind = ErrorKind.RATE_LIMIT_ERROR;
        } else if (status == 400 || status == 404 || status == 413 || status == 422) {
            kind = ErrorKind.INVALID_REQUEST_ERROR;
        } else {
            kind = ErrorKind.API_ERROR;
        }
        return new GatewayError(kind, detail.trim(), status);
    }

    public static GatewayError fromException(IOException e) {
        if (e instanceof SocketTimeoutException || e instanceof InterruptedIOException) {
            return GatewayError.of(ErrorKind.NETWORK_ERROR, "timeout: " + messageOf(e));
        }
        return GatewayError.of(ErrorKind.NETWORK_ERROR, messageOf(e));
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        String flattened = value.replaceAll("\\s+", " ").trim();
        if (flattened.length() <= MAX_BODY_CHARS) {
            return flattened;
        }
        return flattened.substring(0, MAX_BODY_CHARS) + "...";
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
