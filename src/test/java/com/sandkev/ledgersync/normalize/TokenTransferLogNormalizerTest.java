package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.domain.TxAction;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenTransferLogNormalizerTest {

    private static final String OWNER = "0x1111";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    private final TokenTransferLogNormalizer normalizer = new TokenTransferLogNormalizer(new ObjectMapper());
    private final SourceStream stream = SourceStream.onchain("etherscan", "eth", OWNER, Set.of(OWNER, "0x2222"));

    @Test
    void scalesRawValueByWellKnownDecimals() {
        var log = new RawTokenTransferLog("0xhash", 7, USDC, OWNER, "0x9999",
                new BigInteger("2500000"), 19_000_000L, 1710500000L);

        var tx = normalizer.normalize(log, stream, RunContext.create(TokenMetadataResolver.none())).tx();

        assertThat(tx.action()).isEqualTo(TxAction.SEND);
        assertThat(tx.baseAsset()).isEqualTo("USDC");
        assertThat(tx.amount()).isEqualByComparingTo("2.5");
        assertThat(tx.logIndex()).isEqualTo(7);
        assertThat(tx.externalId()).isEqualTo("0xhash");
    }

    @Test
    void resolvedMetadataDrivesSymbolAndDecimals() {
        var run = RunContext.create((chain, id) -> Optional.of(TokenMeta.of("FOO", 8)));
        var log = new RawTokenTransferLog("0xhash", 0, "0xfoo", "0x9999", OWNER,
                new BigInteger("150000000"), 1L, 1710500000L);

        var tx = normalizer.normalize(log, stream, run).tx();

        assertThat(tx.action()).isEqualTo(TxAction.RECEIVE);
        assertThat(tx.baseAsset()).isEqualTo("FOO");
        assertThat(tx.amount()).isEqualByComparingTo("1.5");
    }

    @Test
    void directionFollowsOwnership() {
        var run = RunContext.create(TokenMetadataResolver.none());
        var internal = new RawTokenTransferLog("0xa", 1, USDC, OWNER, "0x2222", BigInteger.ONE, 1L, 1710500000L);
        var unrelated = new RawTokenTransferLog("0xb", 1, USDC, "0x7777", "0x8888", BigInteger.ONE, 1L, 1710500000L);

        assertThat(normalizer.normalize(internal, stream, run).tx().action()).isEqualTo(TxAction.TRANSFER_OUT);
        assertThat(normalizer.normalize(unrelated, stream, run).tx().action()).isEqualTo(TxAction.UNKNOWN);
    }

    @Test
    void missingValueIsDropped() {
        var log = new RawTokenTransferLog("0xhash", 0, USDC, OWNER, "0x9", null, 1L, 1710500000L);

        assertThat(normalizer.normalize(log, stream, RunContext.create(TokenMetadataResolver.none())).isMapped()).isFalse();
    }
}
