package com.tapas.txnwh.warehouse.service;

import com.tapas.txnwh.warehouse.repository.CustomerRow;

import java.time.LocalDate;
import java.util.List;
import java.util.Random;

/**
 * Customer attributes for {@code dim_customer}. Derived from the customer id alone so a
 * reload always writes the same values.
 */
public final class CustomerProfiles {

    private static final List<String> SEGMENTS = List.of("Retail", "Corporate", "SMB", "Enterprise");
    private static final LocalDate SIGNUP_WINDOW_END = LocalDate.of(2024, 1, 1);
    private static final int SIGNUP_WINDOW_DAYS = 5 * 365;

    private CustomerProfiles() {
    }

    public static CustomerRow profileFor(String customerId) {
        Random random = new Random(customerId.hashCode());
        return new CustomerRow(
                customerId,
                SEGMENTS.get(random.nextInt(SEGMENTS.size())),
                SIGNUP_WINDOW_END.minusDays(random.nextInt(SIGNUP_WINDOW_DAYS)));
    }
}
