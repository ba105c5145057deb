package com.tapas.txnwh.warehouse.repository;

import java.time.LocalDate;

public record CustomerRow(
        String customerId,
        String segment,
        LocalDate signupDate) {
}
