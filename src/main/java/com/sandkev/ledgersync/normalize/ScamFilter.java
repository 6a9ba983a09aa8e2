package com.sandkev.ledgersync.normalize;

import com.sandkev.ledgersync.config.ScamFilterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops on-chain records that the provider flags as spam or that touch a blocklisted
 * address. Exchange records always pass. Disabled filters pass everything.
 */
@Slf4j
@Component
public class ScamFilter {

    private final boolean enabled;
    private final Set<String> blocklist;

    public ScamFilter(ScamFilterProperties props) {
        this.enabled = props.enabled();
        this.blocklist = props.blocklist().stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isEnabled() { return enabled; }

    public boolean isScam(RawRecord raw) {
        if (!enabled) return false;
        if (raw instanceof RawOnchainTx tx) {
            if (tx.scam()) {
                log.debug("Scam filter: dropping {} on {} (flagged by provider)", tx.id(), tx.chain());
                return true;
            }
            return touchesBlocklist(raw.sourceRef(), addresses(tx));
        }
        if (raw instanceof RawTokenTransferLog transfer) {
            return touchesBlocklist(raw.sourceRef(), List.of(nz(transfer.contractAddress()), nz(transfer.from()), nz(transfer.to())));
        }
        return false;
    }

    private boolean touchesBlocklist(String ref, List<String> addresses) {
        if (blocklist.isEmpty()) return false;
        for (String a : addresses) {
            if (!a.isBlank() && blocklist.contains(a.strip().toLowerCase(Locale.ROOT))) {
                log.debug("Scam filter: dropping {} (blocklisted address {})", ref, a);
                return true;
            }
        }
        return false;
    }

    private static List<String> addresses(RawOnchainTx tx) {
        List<String> out = new ArrayList<>();
        out.add(nz(tx.fromAddr()));
        out.add(nz(tx.toAddr()));
        tx.sends().forEach(l -> { out.add(nz(l.counterparty())); out.add(nz(l.tokenId())); });
        tx.receives().forEach(l -> { out.add(nz(l.counterparty())); out.add(nz(l.tokenId())); });
        if (tx.approval() != null) {
            out.add(nz(tx.approval().spender()));
            out.add(nz(tx.approval().tokenId()));
        }
        return out;
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
