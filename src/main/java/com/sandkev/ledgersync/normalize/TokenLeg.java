package com.sandkev.ledgersync.normalize;

import java.math.BigDecimal;

/** One asset movement inside an on-chain transaction; counterparty is the other end of the leg. */
public record TokenLeg(String tokenId, BigDecimal amount, String counterparty) {}
