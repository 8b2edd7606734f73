package com.energyadvisor.anomaly.detection;

import com.energyadvisor.anomaly.domain.model.AnomalyResult;
import com.energyadvisor.anomaly.domain.model.BatchItemResult;
import com.energyadvisor.anomaly.domain.model.Bill;
import com.energyadvisor.anomaly.domain.model.DetectorScore;
import com.energyadvisor.anomaly.domain.model.DetectorType;
import com.energyadvisor.anomaly.domain.validation.BillValidator;
import com.energyadvisor.anomaly.domain.validation.InvalidBillException;
import com.energyadvisor.anomaly.peer.PeerCohortAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point of anomaly detection.
 *
 * DETECTION FLOW:
 * 1. Validate the bill and its history; malformed input fails fast
 * 2. Derive the historical baseline from the history
 * 3. Run every registered detector
 * 4. Merge the detector scores into one verdict
 *
 * BATCHES:
 * Bills are processed concurrently on the detection executor. The result list has one
 * entry per input bill, in input order; a failing bill becomes an error entry and never
 * affects the others.
 */
@Service
@Slf4j
public class AnomalyDetectionEngine {

    private final BillValidator validator;
    private final List<AnomalyDetector> detectors;
    private final CombinedScorer combinedScorer;
    private final Executor executor;

    public AnomalyDetectionEngine(
            BillValidator validator,
            List<AnomalyDetector> detectors,
            CombinedScorer combinedScorer,
            @Qualifier("detectionExecutor") Executor executor
    ) {
        this.validator = validator;
        this.detectors = List.copyOf(detectors);
        this.combinedScorer = combinedScorer;
        this.executor = executor;
    }

    /**
     * Detect anomalies in a single bill.
     *
     * @param history earlier bills of the same household; may be empty
     * @param peerCohort source of peer bills; {@code null} disables the peer comparison
     * @throws InvalidBillException when the bill or a history entry is malformed
     */
    public AnomalyResult detect(Bill bill, List<Bill> history, PeerCohortAccessor peerCohort) {
        validator.validate(bill);
        List<Bill> priorBills = history != null ? history : List.of();
        validator.validateHistory(bill, priorBills);

        log.debug("Detecting anomalies for bill {} (user {}, year {})", bill.billId(), bill.userId(), bill.year());

        DetectionContext context = DetectionContext.of(bill, priorBills, peerCohort);
        Map<DetectorType, DetectorScore> scores = new EnumMap<>(DetectorType.class);
        for (AnomalyDetector detector : detectors) {
            DetectorScore score = detector.score(bill, context);
            scores.put(detector.getType(), score);
            if (score.isApplicable()) {
                log.debug("{} detector scored bill {}: {}", detector.getType().getKey(), bill.billId(), score.score());
            } else {
                log.debug("{} detector not applicable for bill {}: {}",
                        detector.getType().getKey(), bill.billId(), score.notApplicableReason());
            }
        }

        return combinedScorer.combine(bill, scores);
    }

    /**
     * Detect anomalies in many bills concurrently.
     *
     * @return one result per input bill, in input order
     */
    public List<BatchItemResult> batchDetect(List<Bill> bills, BillHistoryProvider historyProvider,
                                             PeerCohortAccessor peerCohort) {
        if (bills == null || bills.isEmpty()) {
            return List.of();
        }
        log.info("Starting batch detection for {} bills", bills.size());

        List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>(bills.size());
        for (int i = 0; i < bills.size(); i++) {
            int index = i;
            Bill bill = bills.get(i);
            futures.add(CompletableFuture
                    .supplyAsync(() -> detectItem(index, bill, historyProvider, peerCohort), executor)
                    .exceptionally(e -> failure(index, bill, unwrap(e))));
        }

        List<BatchItemResult> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        long failed = results.stream().filter(result -> !result.isSuccess()).count();
        long anomalies = results.stream()
                .filter(BatchItemResult::isSuccess)
                .filter(result -> result.result().hasAnomaly())
                .count();
        log.info("Batch detection complete: {} bills, {} anomalies, {} failed", results.size(), anomalies, failed);
        return results;
    }

    private BatchItemResult detectItem(int index, Bill bill, BillHistoryProvider historyProvider,
                                       PeerCohortAccessor peerCohort) {
        try {
            if (bill == null) {
                throw new InvalidBillException(null, List.of("bill is required"));
            }
            List<Bill> history = historyProvider != null ? historyProvider.priorBills(bill) : List.of();
            return BatchItemResult.success(index, detect(bill, history, peerCohort));
        } catch (InvalidBillException e) {
            log.warn("Skipping invalid bill at position {}: {}", index, e.getMessage());
            return BatchItemResult.failure(index, e.getBillId(), e.getMessage());
        } catch (RuntimeException e) {
            return failure(index, bill, e);
        }
    }

    private BatchItemResult failure(int index, Bill bill, Throwable error) {
        String billId = bill != null ? bill.billId() : null;
        log.error("Detection failed for bill {} at position {}", billId, index, error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return BatchItemResult.failure(index, billId, message);
    }

    private Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
