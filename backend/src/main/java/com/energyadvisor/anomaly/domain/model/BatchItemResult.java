package com.energyadvisor.anomaly.domain.model;

/**
 * One entry of a batch run: either a result or the reason the bill could not be processed.
 */
public record BatchItemResult(
        int index,
        String billId,
        AnomalyResult result,
        String error
) {

    public boolean isSuccess() {
        return result != null;
    }

    public static BatchItemResult success(int index, AnomalyResult result) {
        return new BatchItemResult(index, result.billId(), result, null);
    }

    public static BatchItemResult failure(int index, String billId, String error) {
        return new BatchItemResult(index, billId, null, error);
    }
}
