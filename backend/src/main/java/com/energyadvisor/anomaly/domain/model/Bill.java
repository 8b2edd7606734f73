package com.energyadvisor.anomaly.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Annual energy bill as extracted and verified upstream.
 *
 * Owned by the caller. The engine only reads it; field constraints are checked
 * by {@link com.energyadvisor.anomaly.domain.validation.BillValidator} before detection.
 */
@Builder(toBuilder = true)
public record Bill(
        String billId,
        String userId,
        int year,
        double consumptionKwh,
        BigDecimal totalCostEuros,
        LocalDate billingStartDate,
        LocalDate billingEndDate,
        String postalCode,
        int householdSize,
        PropertyType propertyType,
        BigDecimal tariffRate      // EUR per kWh
) {}
