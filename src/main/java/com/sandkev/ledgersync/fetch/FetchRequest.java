package com.sandkev.ledgersync.fetch;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One page request to a fetch collaborator.
 *
 * @param account  account reference or on-chain address
 * @param params   source-specific parameters (chain id, currency, ...)
 * @param since    lower bound of "new" data, inclusive
 * @param pageSize maximum rows per page
 * @param cursor   opaque continuation token from the previous page, null for the first page
 */
public record FetchRequest(String account, Map<String, String> params, Instant since, int pageSize, String cursor) {

    public FetchRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public FetchRequest withCursor(String next) {
        return new FetchRequest(account, params, since, pageSize, next);
    }

    public FetchRequest withParam(String key, String value) {
        var p = new LinkedHashMap<>(params);
        p.put(key, value);
        return new FetchRequest(account, p, since, pageSize, cursor);
    }

    public String param(String key) {
        return params.get(key);
    }
}
