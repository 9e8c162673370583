package com.marketgateway.marketdata.client;

import com.marketgateway.common.retry.TransientFailureClassifier;
import io.netty.channel.ChannelException;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.client.PrematureCloseException;

/**
 * Adds the Reactor Netty transport faults to the network faults recognized by
 * {@link TransientFailureClassifier}: a connection closed before the response completed,
 * a connection aborted mid-exchange, and Netty channel errors such as read/write timeouts.
 */
public class NettyTransportFailureClassifier extends TransientFailureClassifier {

    @Override
    protected boolean isNetworkFault(Throwable t) {
        return super.isNetworkFault(t)
            || t instanceof PrematureCloseException
            || t instanceof AbortedException
            || t instanceof ChannelException;
    }
}
