package com.marketgateway.common.exception;

/**
 * Maps whatever is left after retries into the caller-facing taxonomy.
 *
 * <ul>
 *   <li>already-classified {@link MarketDataException} → unchanged</li>
 *   <li>HTTP 429 → {@link ProviderThrottledException}</li>
 *   <li>any other HTTP status → {@link ProviderException}</li>
 *   <li>everything else → {@link UnavailableException}</li>
 * </ul>
 */
public final class UpstreamErrorTranslator {

    private UpstreamErrorTranslator() {}

    public static MarketDataException translate(Throwable error) {
        if (error instanceof MarketDataException classified) {
            return classified;
        }
        if (error instanceof UpstreamCallException upstream && upstream.getKind() == UpstreamCallException.Kind.HTTP) {
            if (upstream.getStatus() == 429) {
                return new ProviderThrottledException(
                    "Data provider rate limit exceeded. Consider caching responses or upgrading the provider plan.",
                    error);
            }
            return new ProviderException("Data provider is temporarily unavailable", error);
        }
        return new UnavailableException("Market data is currently unavailable", error);
    }
}
