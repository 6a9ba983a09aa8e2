package com.sandkev.ledgersync.unified;

import java.math.BigDecimal;

public record MonthlySummary(int year, int month, String domain, String source, long txCount, BigDecimal totalAmount) {}
