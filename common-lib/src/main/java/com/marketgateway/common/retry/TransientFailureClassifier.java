package com.marketgateway.common.retry;

import com.marketgateway.common.exception.MarketDataException;
import com.marketgateway.common.exception.UpstreamCallException;

import java.io.InterruptedIOException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed upstream call is worth retrying.
 *
 * <p>Transient: HTTP 429, HTTP 5xx, and network-level faults (connect refused or reset,
 * socket and reactive timeouts, DNS failures, closed channels). Everything else, including
 * other 4xx statuses, malformed responses and already-classified errors, is terminal.
 */
public class TransientFailureClassifier {

    public boolean isTransient(Throwable error) {
        if (error instanceof MarketDataException) {
            return false;
        }
        if (error instanceof UpstreamCallException upstream) {
            switch (upstream.getKind()) {
                case HTTP:
                    int status = upstream.getStatus();
                    return status == 429 || status >= 500;
                case NETWORK:
                    return true;
                default:
                    return false;
            }
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (isNetworkFault(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    protected boolean isNetworkFault(Throwable t) {
        return t instanceof SocketException
            || t instanceof InterruptedIOException
            || t instanceof UnknownHostException
            || t instanceof ClosedChannelException
            || t instanceof TimeoutException;
    }
}
