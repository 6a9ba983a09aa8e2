package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.domain.TxAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OnchainTxNormalizerTest {

    private static final String OWNER = "0x1111";
    private static final String OTHER_OWNED = "0x2222";
    private static final String STRANGER = "0x9999";

    private final OnchainTxNormalizer normalizer = new OnchainTxNormalizer(new ObjectMapper());
    private final SourceStream stream = SourceStream.onchain("debank", "eth", OWNER, Set.of(OWNER, OTHER_OWNED));
    private RunContext run;

    @BeforeEach
    void setUp() {
        run = RunContext.create(TokenMetadataResolver.none());
    }

    @Test
    void singleSendBecomesSend() {
        var raw = tx("0xs", List.of(new TokenLeg("X", new BigDecimal("5"), STRANGER)), List.of(), null);

        CanonicalTx out = normalizer.normalize(raw, stream, run).tx();

        assertThat(out.action()).isEqualTo(TxAction.SEND);
        assertThat(out.amount()).isEqualByComparingTo("5");
        assertThat(out.baseAsset()).isEqualTo("X");
        assertThat(out.quoteAsset()).isEmpty();
        assertThat(out.domain()).isEqualTo(Domain.ONCHAIN);
        assertThat(out.chain()).isEqualTo("eth");
        assertThat(out.source()).isEqualTo("debank_eth");
        assertThat(out.counterpartyFrom()).isEqualTo(OWNER);
        assertThat(out.counterpartyTo()).isEqualTo(STRANGER);
        assertThat(out.occurredAt()).isEqualTo(Instant.ofEpochSecond(1710500000L));
    }

    @Test
    void legsInDifferentAssetsBecomeSwapKeyedOnTheFirstSend() {
        var raw = tx("0xswap",
                List.of(new TokenLeg("X", new BigDecimal("-3"), STRANGER), new TokenLeg("Z", BigDecimal.ONE, STRANGER)),
                List.of(new TokenLeg("Y", new BigDecimal("7"), STRANGER)),
                null);

        CanonicalTx out = normalizer.normalize(raw, stream, run).tx();

        assertThat(out.action()).isEqualTo(TxAction.SWAP);
        assertThat(out.baseAsset()).isEqualTo("X");
        assertThat(out.quoteAsset()).isEqualTo("Y");
        assertThat(out.amount()).isEqualByComparingTo("3");
    }

    @Test
    void swapWithoutAReceiveInAnotherTokenLeavesQuoteEmpty() {
        var raw = tx("0xpartial",
                List.of(new TokenLeg("X", new BigDecimal("2"), STRANGER), new TokenLeg("Z", BigDecimal.ONE, STRANGER)),
                List.of(new TokenLeg("X", new BigDecimal("1"), STRANGER)),
                null);

        CanonicalTx out = normalizer.normalize(raw, stream, run).tx();

        assertThat(out.action()).isEqualTo(TxAction.SWAP);
        assertThat(out.baseAsset()).isEqualTo("X");
        assertThat(out.quoteAsset()).isEmpty();
    }

    @Test
    void sameAssetOnBothSidesIsNotASwap() {
        var raw = tx("0xloop",
                List.of(new TokenLeg("X", new BigDecimal("2"), STRANGER)),
                List.of(new TokenLeg("X", new BigDecimal("1"), STRANGER)),
                null);

        assertThat(normalizer.normalize(raw, stream, run).tx().action()).isEqualTo(TxAction.SEND);
    }

    @Test
    void approvalRecordsGrantedQuantityAndSpender() {
        var raw = tx("0xappr", List.of(), List.of(), new TokenApproval("X", new BigDecimal("1000"), "0xrouter"));

        CanonicalTx out = normalizer.normalize(raw, stream, run).tx();

        assertThat(out.action()).isEqualTo(TxAction.APPROVE);
        assertThat(out.amount()).isEqualByComparingTo("1000");
        assertThat(out.counterpartyTo()).isEqualTo("0xrouter");
    }

    @Test
    void incomingLegBecomesReceive() {
        var raw = tx("0xr", List.of(), List.of(new TokenLeg("eth", new BigDecimal("1.5"), STRANGER)), null);

        CanonicalTx out = normalizer.normalize(raw, stream, run).tx();

        assertThat(out.action()).isEqualTo(TxAction.RECEIVE);
        assertThat(out.baseAsset()).isEqualTo("ETH");
        assertThat(out.counterpartyFrom()).isEqualTo(STRANGER);
        assertThat(out.counterpartyTo()).isEqualTo(OWNER);
    }

    @Test
    void movementBetweenOwnedAddressesIsAnInternalTransfer() {
        var out = tx("0xint", List.of(new TokenLeg("X", BigDecimal.TEN, OTHER_OWNED)), List.of(), null);
        var in = tx("0xint2", List.of(), List.of(new TokenLeg("X", BigDecimal.TEN, OTHER_OWNED)), null);

        assertThat(normalizer.normalize(out, stream, run).tx().action()).isEqualTo(TxAction.TRANSFER_OUT);
        assertThat(normalizer.normalize(in, stream, run).tx().action()).isEqualTo(TxAction.TRANSFER_IN);
    }

    @Test
    void depositHintOverridesSend() {
        var raw = new RawOnchainTx("0xdep", 1710500000L, "eth", "deposit", false,
                List.of(new TokenLeg("X", BigDecimal.ONE, STRANGER)), List.of(), null, OWNER, STRANGER, null);

        assertThat(normalizer.normalize(raw, stream, run).tx().action()).isEqualTo(TxAction.DEPOSIT);
    }

    @Test
    void noLegsIsKeptAsUnknownWithZeroAmount() {
        var raw = tx("0xcall", List.of(), List.of(), null);

        var outcome = normalizer.normalize(raw, stream, run);

        assertThat(outcome.isMapped()).isTrue();
        assertThat(outcome.tx().action()).isEqualTo(TxAction.UNKNOWN);
        assertThat(outcome.tx().amount()).isEqualByComparingTo("0");
    }

    @Test
    void gasFeeIsChargedInNativeAssetOnlyWhenOwnerPaid() {
        var paid = tx("0xs", List.of(new TokenLeg("X", BigDecimal.ONE, STRANGER)), List.of(), null);
        var notPaid = new RawOnchainTx("0xr", 1710500000L, "bsc", null, false,
                List.of(), List.of(new TokenLeg("bsc", BigDecimal.ONE, STRANGER)), null, STRANGER, OWNER, new BigDecimal("0.01"));

        CanonicalTx a = normalizer.normalize(paid, stream, run).tx();
        CanonicalTx b = normalizer.normalize(notPaid, stream, run).tx();

        assertThat(a.feeAsset()).isEqualTo("ETH");
        assertThat(a.feeAmount()).isEqualByComparingTo("0.0012");
        assertThat(b.feeAsset()).isNull();
        assertThat(b.feeAmount()).isNull();
    }

    @Test
    void unknownTokenGetsPlaceholderSymbol() {
        var raw = tx("0xs", List.of(new TokenLeg("0xabcdef0123456789", BigDecimal.ONE, STRANGER)), List.of(), null);

        assertThat(normalizer.normalize(raw, stream, run).tx().baseAsset()).isEqualTo("0xabcdef");
    }

    @Test
    void missingHashOrTimeIsDropped() {
        var noId = new RawOnchainTx(" ", 1710500000L, "eth", null, false, List.of(), List.of(), null, OWNER, null, null);
        var noTime = new RawOnchainTx("0x1", null, "eth", null, false, List.of(), List.of(), null, OWNER, null, null);

        assertThat(normalizer.normalize(noId, stream, run).dropReason()).contains("hash");
        assertThat(normalizer.normalize(noTime, stream, run).isMapped()).isFalse();
    }

    private static RawOnchainTx tx(String id, List<TokenLeg> sends, List<TokenLeg> receives, TokenApproval approval) {
        return new RawOnchainTx(id, 1710500000L, "eth", null, false, sends, receives, approval,
                OWNER, STRANGER, new BigDecimal("0.0012"));
    }
}
