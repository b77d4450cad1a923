package com.example.records.service;

import com.example.records.entities.OperationResult;
import com.example.records.entities.Session;
import com.example.records.entities.StatisticsSummary;
import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Permission;
import com.example.records.exceptions.RecordsException;
import com.example.records.repository.StudentRecordRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class StatisticsService {

    public static final double PASS_PERCENTAGE = 50.0;

    private final Logger log = LoggerFactory.getLogger(StatisticsService.class);

    private final StudentRecordRepository studentRepository;
    private final AccessPolicy accessPolicy;

    public OperationResult<StatisticsSummary> summarize(Session session) {
        try {
            accessPolicy.check(session, Permission.VIEW_STATISTICS);
            StatisticsSummary summary = compute(studentRepository.loadAll());
            return OperationResult.ok(summary, "Statistics over " + summary.getCount() + " records");
        } catch (RecordsException ex) {
            log.warn("Statistics not available: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * Single pass over {@code snapshot}. Highest and lowest are the first
     * records reaching the extreme percentage.
     *
     * @throws RecordsException with {@link ErrorKind#EMPTY_STORE} if the snapshot is empty
     */
    public StatisticsSummary compute(List<StudentRecord> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            throw new RecordsException(ErrorKind.EMPTY_STORE, "No records.");
        }
        double sum = 0.0;
        int pass = 0;
        StudentRecord highest = snapshot.get(0);
        StudentRecord lowest = snapshot.get(0);
        for (StudentRecord r : snapshot) {
            sum += r.getPercentage();
            if (r.getPercentage() > highest.getPercentage()) highest = r;
            if (r.getPercentage() < lowest.getPercentage()) lowest = r;
            if (r.getPercentage() >= PASS_PERCENTAGE) pass++;
        }
        int n = snapshot.size();
        return StatisticsSummary.builder()
                .count(n)
                .meanPercentage(sum / n)
                .highest(highest)
                .lowest(lowest)
                .passCount(pass)
                .failCount(n - pass)
                .build();
    }
}
