package com.sandkev.ledgersync.domain;

import java.util.Locale;
import java.util.Set;

/**
 * Identity of one ingested stream, carried with every batch: which source, which entity,
 * which account or address, and (on-chain) which chain.
 *
 * @param venue    exchange name, or {@code <provider>_<chain>} on-chain; what a caller selects by
 * @param sourceId value stored in the {@code source} column. Exchange streams qualify it with the
 *                 entity ({@code binance_trades}) because trades, deposits and withdrawals share
 *                 one staged table and their upstream ids are not unique across entities.
 */
public record SourceStream(
        String venue,
        String sourceId,
        EntityKind entity,
        String account,
        String chain,
        Set<String> ownedAddresses
) {

    public SourceStream {
        ownedAddresses = ownedAddresses == null ? Set.of() : Set.copyOf(ownedAddresses);
    }

    public static SourceStream exchange(String exchange, EntityKind entity, String account) {
        String venue = exchange.toLowerCase(Locale.ROOT);
        return new SourceStream(venue, venue + "_" + entity.code(), entity, account, null, Set.of());
    }

    public static SourceStream onchain(String provider, String chain, String address, Set<String> ownedAddresses) {
        String c = chain.toLowerCase(Locale.ROOT);
        String venue = provider.toLowerCase(Locale.ROOT) + "_" + c;
        return new SourceStream(venue, venue, EntityKind.TRANSFERS, address.toLowerCase(Locale.ROOT), c, ownedAddresses);
    }

    public Domain domain() { return entity.domain(); }

    /** Key of this stream's sync watermark row. */
    public String watermarkKey() {
        return venue + ":" + entity.code() + ":" + account;
    }

    public boolean owns(String address) {
        return address != null && ownedAddresses.contains(address.toLowerCase(Locale.ROOT));
    }
}
