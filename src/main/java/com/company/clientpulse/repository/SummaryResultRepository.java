package com.company.clientpulse.repository;

import com.company.clientpulse.domain.SummaryResult;
import com.company.clientpulse.exception.InsufficientHistoryException;
import com.company.clientpulse.exception.StoreException;
import com.company.clientpulse.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Daily test summaries per network at {@code <prefix>/networks/<network>/hive_summary/results/<YYYY-MM-DD>.json}.
 * A second run on the same day replaces that day's snapshot.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class SummaryResultRepository {

    private static final String REPOSITORY = "summary";

    private final S3ObjectStore store;

    public void storeResult(SummaryResult result) {
        LocalDate date = TimeUtils.snapshotDate(result.getTimestamp());
        store.write(key(result.getNetwork(), date), result, REPOSITORY);
        log.info("Stored test summary for {} dated {}", result.getNetwork(), date);
    }

    /**
     * The second-most-recent snapshot, i.e. the one before the latest.
     *
     * @throws InsufficientHistoryException when fewer than two snapshots exist
     */
    public SummaryResult getPrevious(String network) {
        List<LocalDate> dates = listDates(network);
        if (dates.size() < 2) {
            throw new InsufficientHistoryException(network, dates.size());
        }

        LocalDate previous = dates.get(1);
        return store.read(key(network, previous), SummaryResult.class, REPOSITORY)
                .orElseThrow(() -> new StoreException("Snapshot " + previous + " for " + network + " disappeared", null));
    }

    public Optional<SummaryResult> getLatest(String network) {
        List<LocalDate> dates = listDates(network);
        if (dates.isEmpty()) {
            return Optional.empty();
        }
        return store.read(key(network, dates.get(0)), SummaryResult.class, REPOSITORY);
    }

    /**
     * Snapshot dates, newest first. Keys without a parseable date are ignored.
     */
    public List<LocalDate> listDates(String network) {
        return store.listKeys(prefix(network), REPOSITORY).stream()
                .map(TimeUtils::dateFromKey)
                .flatMap(Optional::stream)
                .distinct()
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
    }

    String key(String network, LocalDate date) {
        return prefix(network) + date + ".json";
    }

    private String prefix(String network) {
        return store.key(String.format("networks/%s/hive_summary/results/", network));
    }
}
