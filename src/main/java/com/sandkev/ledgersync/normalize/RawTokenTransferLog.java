package com.sandkev.ledgersync.normalize;

import java.math.BigInteger;

/** Single ERC-20 Transfer log; {@code value} is the raw integer amount in base units. */
public record RawTokenTransferLog(
        String txHash,
        Integer logIndex,           // null means 0
        String contractAddress,
        String from,
        String to,
        BigInteger value,
        Long blockNumber,
        Object blockTimestamp
) implements RawRecord {

    @Override
    public String sourceRef() { return txHash + "#" + (logIndex == null ? 0 : logIndex); }
}
