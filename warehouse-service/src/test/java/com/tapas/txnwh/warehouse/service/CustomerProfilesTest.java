package com.tapas.txnwh.warehouse.service;

import com.tapas.txnwh.warehouse.repository.CustomerRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerProfilesTest {

    @Test
    void profileIsStableForACustomer() {
        assertThat(CustomerProfiles.profileFor("CUST-000042")).isEqualTo(CustomerProfiles.profileFor("CUST-000042"));
    }

    @Test
    void profileValuesStayWithinTheirDomains() {
        for (int i = 1; i <= 200; i++) {
            CustomerRow row = CustomerProfiles.profileFor(String.format("CUST-%06d", i));
            assertThat(row.segment()).isIn("Retail", "Corporate", "SMB", "Enterprise");
            assertThat(row.signupDate()).isBetween(LocalDate.of(2019, 1, 1), LocalDate.of(2024, 1, 1));
        }
    }
}
