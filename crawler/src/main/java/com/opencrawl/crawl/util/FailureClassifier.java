package com.opencrawl.crawl.util;

import com.opencrawl.crawl.model.FailureKind;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;

/**
 * Maps exceptions and statuses raised during one exchange onto {@link FailureKind}.
 */
public final class FailureClassifier {
    private FailureClassifier() {
    }

    public static FailureKind fromException(Throwable error, boolean viaProxy) {
        Throwable cause = rootOf(error);
        if (error instanceof HttpConnectTimeoutException || cause instanceof HttpConnectTimeoutException) {
            return viaProxy ? FailureKind.PROXY_FAILURE : FailureKind.TIMEOUT;
        }
        if (error instanceof HttpTimeoutException || cause instanceof HttpTimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (hasCause(error, SSLException.class)) {
            return FailureKind.SSL_VERIFICATION;
        }
        if (hasCause(error, UnknownHostException.class) || hasCause(error, UnresolvedAddressException.class)) {
            return viaProxy ? FailureKind.PROXY_FAILURE : FailureKind.DNS_FAILURE;
        }
        String message = messageOf(error);
        if (viaProxy && (message.contains("tunnel") || message.contains("proxy"))) {
            return FailureKind.PROXY_FAILURE;
        }
        if (hasCause(error, ConnectException.class)
            || hasCause(error, NoRouteToHostException.class)
            || hasCause(error, SocketException.class)) {
            return viaProxy ? FailureKind.PROXY_FAILURE : FailureKind.CONNECTION_FAILURE;
        }
        if (message.contains("unknownhost")
            || message.contains("name or service not known")
            || message.contains("no such host")) {
            return viaProxy ? FailureKind.PROXY_FAILURE : FailureKind.DNS_FAILURE;
        }
        if (message.contains("ssl") || message.contains("handshake") || message.contains("certificate")) {
            return FailureKind.SSL_VERIFICATION;
        }
        return viaProxy ? FailureKind.PROXY_FAILURE : FailureKind.CONNECTION_FAILURE;
    }

    public static FailureKind fromHttpStatus(int status, boolean viaProxy) {
        if (status == 407 && viaProxy) {
            return FailureKind.PROXY_FAILURE;
        }
        return FailureKind.HTTP_STATUS;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static Throwable rootOf(Throwable error) {
        Throwable current = error;
        while (current != null && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        StringBuilder out = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            out.append(current.getClass().getSimpleName()).append(' ');
            if (current.getMessage() != null) {
                out.append(current.getMessage()).append(' ');
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return out.toString().toLowerCase(Locale.ROOT);
    }
}
