package com.sandkev.ledgersync.normalize;

import java.math.BigDecimal;

public record TokenApproval(String tokenId, BigDecimal value, String spender) {}
