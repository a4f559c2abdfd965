package com.tidefeed.feeds.schedule;

import com.tidefeed.core.model.ErrorKind;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

final class FailureClassifier {
    private FailureClassifier() {
    }

    static ErrorKind classify(Throwable error) {
        Throwable unwrapped = unwrap(error);
        if (unwrapped instanceof TimeoutException
                || unwrapped instanceof HttpTimeoutException
                || unwrapped instanceof CancellationException) {
            return ErrorKind.TIMEOUT;
        }
        String lowered = describe(unwrapped).toLowerCase(Locale.ROOT);
        if (lowered.contains("timed out")) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.NETWORK_ERROR;
    }

    static String message(String url, Throwable error) {
        Throwable unwrapped = unwrap(error);
        Throwable root = rootCause(unwrapped);
        String rootText = describe(root);
        if (root instanceof UnknownHostException) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (root instanceof ConnectException) {
            return "Connection failed while fetching " + url + ": " + rootText;
        }
        if (root instanceof SSLException) {
            return "TLS failure while fetching " + url + ": " + rootText;
        }
        if (classify(unwrapped) == ErrorKind.TIMEOUT) {
            return "Request timed out while fetching " + url;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }

    static boolean retryable(ErrorKind kind, int statusCode) {
        if (kind == ErrorKind.NETWORK_ERROR) {
            return true;
        }
        return kind == ErrorKind.HTTP_ERROR && (statusCode >= 500 || statusCode == 429);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable throwable) {
        return throwable.getMessage() == null ? throwable.getClass().getSimpleName() : throwable.getMessage();
    }
}
