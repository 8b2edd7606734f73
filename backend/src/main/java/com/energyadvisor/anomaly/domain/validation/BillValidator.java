package com.energyadvisor.anomaly.domain.validation;

import com.energyadvisor.anomaly.domain.model.Bill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Rejects malformed bills before any detector runs.
 *
 * All violations are collected so the caller sees every problem of a bill at once.
 */
@Component
@Slf4j
public class BillValidator {

    private static final int MIN_YEAR = 1900;

    public void validate(Bill bill) {
        if (bill == null) {
            throw new InvalidBillException(null, List.of("bill is required"));
        }
        List<String> violations = violations(bill);
        if (!violations.isEmpty()) {
            log.debug("Rejected bill {}: {}", bill.billId(), violations);
            throw new InvalidBillException(bill.billId(), violations);
        }
    }

    /**
     * Validate the prior bills supplied as history for {@code bill}.
     * Every history entry must be a well-formed bill of the same user.
     */
    public void validateHistory(Bill bill, List<Bill> history) {
        if (history == null) {
            return;
        }
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            Bill prior = history.get(i);
            if (prior == null) {
                violations.add("history[" + i + "] is null");
                continue;
            }
            if (prior.userId() == null || !prior.userId().equals(bill.userId())) {
                violations.add("history[" + i + "] belongs to another user");
            }
            if (!(prior.consumptionKwh() > 0) || !Double.isFinite(prior.consumptionKwh())) {
                violations.add("history[" + i + "] consumptionKwh must be positive");
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidBillException(bill.billId(), violations);
        }
    }

    private List<String> violations(Bill bill) {
        List<String> violations = new ArrayList<>();
        if (isBlank(bill.billId())) {
            violations.add("billId is required");
        }
        if (isBlank(bill.userId())) {
            violations.add("userId is required");
        }
        if (bill.year() < MIN_YEAR) {
            violations.add("year must be at least " + MIN_YEAR);
        }
        if (!(bill.consumptionKwh() > 0) || !Double.isFinite(bill.consumptionKwh())) {
            violations.add("consumptionKwh must be positive");
        }
        if (bill.totalCostEuros() == null || bill.totalCostEuros().signum() < 0) {
            violations.add("totalCostEuros must be zero or positive");
        }
        if (bill.billingStartDate() == null || bill.billingEndDate() == null) {
            violations.add("billing period dates are required");
        } else if (!bill.billingStartDate().isBefore(bill.billingEndDate())) {
            violations.add("billingStartDate must be before billingEndDate");
        }
        if (isBlank(bill.postalCode())) {
            violations.add("postalCode is required");
        }
        if (bill.householdSize() <= 0) {
            violations.add("householdSize must be positive");
        }
        if (bill.propertyType() == null) {
            violations.add("propertyType is required");
        }
        if (bill.tariffRate() == null || bill.tariffRate().compareTo(BigDecimal.ZERO) <= 0) {
            violations.add("tariffRate must be positive");
        }
        return violations;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
