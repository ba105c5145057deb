package com.tapas.txnwh.transformation.service;

import com.tapas.txnwh.common.domain.ProcessedTransaction;
import com.tapas.txnwh.common.error.InvalidConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;
import java.util.Optional;

/**
 * Static channel reference data used to enrich transactions with their fee percent.
 */
public class ChannelFeeTable {

    private final Map<String, BigDecimal> feePercentByChannel;

    public ChannelFeeTable(Map<String, BigDecimal> feePercentByChannel) {
        if (feePercentByChannel == null || feePercentByChannel.isEmpty()) {
            throw new InvalidConfigurationException("pipeline.transformation.channel-fees must not be empty");
        }
        feePercentByChannel.forEach((channel, fee) -> {
            if (fee == null || fee.signum() < 0) {
                throw new InvalidConfigurationException("Invalid fee percent for channel " + channel + ": " + fee);
            }
        });
        Map<String, BigDecimal> scaled = new TreeMap<>();
        feePercentByChannel.forEach((channel, fee) ->
                scaled.put(channel, fee.setScale(ProcessedTransaction.FEE_PERCENT_SCALE, RoundingMode.HALF_UP)));
        this.feePercentByChannel = Map.copyOf(scaled);
    }

    public Optional<BigDecimal> feePercent(String channel) {
        return channel == null ? Optional.empty() : Optional.ofNullable(feePercentByChannel.get(channel));
    }
}
