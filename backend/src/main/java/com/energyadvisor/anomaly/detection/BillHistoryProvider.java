package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.domain.model.Bill;

import java.util.List;

/**
 * Port to the store of a household's earlier bills, used by batch detection.
 */
@FunctionalInterface
public interface BillHistoryProvider {

    /**
     * Earlier bills of the bill's household. May include bills that are not prior
     * years; they are ignored when the baseline is derived.
     */
    List<Bill> priorBills(Bill bill);
}
