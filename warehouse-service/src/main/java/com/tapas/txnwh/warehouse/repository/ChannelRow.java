package com.tapas.txnwh.warehouse.repository;

import java.math.BigDecimal;

public record ChannelRow(
        String channelName,
        BigDecimal feePercent) {
}
