package com.energyadvisor.anomaly.domain.validation;

import java.util.List;

/**
 * A bill (or a bill of its history) is malformed and cannot be scored.
 */
public class InvalidBillException extends RuntimeException {

    private final String billId;
    private final List<String> violations;

    public InvalidBillException(String billId, List<String> violations) {
        super("Invalid bill " + (billId != null ? billId : "<no id>") + ": " + String.join("; ", violations));
        this.billId = billId;
        this.violations = List.copyOf(violations);
    }

    public String getBillId() {
        return billId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
