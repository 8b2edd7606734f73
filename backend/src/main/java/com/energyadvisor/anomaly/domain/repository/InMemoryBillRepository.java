package com.energyadvisor.anomaly.domain.repository;

import com.energyadvisor.anomaly.detection.BillHistoryProvider;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.PeerGroupKey;
import com.energyadvisor.anomaly.peer.PeerCohortAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bill store for callers that hold their bills in memory.
 *
 * Serves both detection ports: prior bills of a household and peer candidates of a
 * cohort year. Peer candidates are narrowed to the exact cohort by the peer statistics.
 */
@Repository
@Slf4j
public class InMemoryBillRepository implements BillHistoryProvider, PeerCohortAccessor {

    private final Map<String, Bill> bills = new ConcurrentHashMap<>();

    public Bill save(Bill bill) {
        bills.put(bill.billId(), bill);
        return bill;
    }

    public void saveAll(Collection<Bill> toSave) {
        toSave.forEach(this::save);
        log.debug("Stored {} bills, {} in total", toSave.size(), bills.size());
    }

    public Optional<Bill> findById(String billId) {
        return Optional.ofNullable(bills.get(billId));
    }

    public List<Bill> findByUserId(String userId) {
        return bills.values().stream()
                .filter(bill -> Objects.equals(bill.userId(), userId))
                .sorted(Comparator.comparingInt(Bill::year).thenComparing(Bill::billId))
                .toList();
    }

    public List<Bill> findByYear(int year) {
        return bills.values().stream()
                .filter(bill -> bill.year() == year)
                .sorted(Comparator.comparing(Bill::billId))
                .toList();
    }

    public boolean deleteById(String billId) {
        return bills.remove(billId) != null;
    }

    public int count() {
        return bills.size();
    }

    @Override
    public List<Bill> priorBills(Bill bill) {
        return findByUserId(bill.userId()).stream()
                .filter(prior -> prior.year() < bill.year())
                .toList();
    }

    @Override
    public Collection<Bill> candidates(PeerGroupKey key) {
        return findByYear(key.year());
    }
}
