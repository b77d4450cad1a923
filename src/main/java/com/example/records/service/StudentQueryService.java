package com.example.records.service;

import com.example.records.entities.OperationResult;
import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Grade;
import com.example.records.enums.SortOrder;
import com.example.records.exceptions.RecordsException;
import com.example.records.repository.StudentRecordRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Searches and sorts over a snapshot of the student file.
 * The {@code filter*}/{@code sorted} methods work on a caller-supplied snapshot;
 * the {@code search*}/{@code sort} methods take a fresh one first and report
 * read failures as a failed {@link OperationResult}.
 * Nothing here writes to the store.
 */
@Service
@RequiredArgsConstructor
public class StudentQueryService {

    private final Logger log = LoggerFactory.getLogger(StudentQueryService.class);

    private final StudentRecordRepository studentRepository;

    public OperationResult<List<StudentRecord>> searchByName(String query) {
        return withSnapshot("Search by name", snapshot -> filterByName(snapshot, query));
    }

    public OperationResult<StudentRecord> searchById(int id) {
        try {
            return filterById(studentRepository.loadAll(), id)
                    .map(r -> OperationResult.ok(r, "Record found."))
                    .orElseGet(() -> OperationResult.<StudentRecord>failure(ErrorKind.NOT_FOUND, "Record not found: " + id));
        } catch (RecordsException ex) {
            log.warn("Search by id {} failed: {}", id, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<List<StudentRecord>> searchByPercentageRange(double lo, double hi) {
        return withSnapshot("Search by percentage", snapshot -> filterByPercentageRange(snapshot, lo, hi));
    }

    public OperationResult<List<StudentRecord>> searchByGrade(String grade) {
        return withSnapshot("Search by grade", snapshot -> filterByGrade(snapshot, grade));
    }

    public OperationResult<List<StudentRecord>> sort(SortOrder order) {
        return withSnapshot("Sort", snapshot -> sorted(snapshot, order));
    }

    /**
     * Case-insensitive substring match; an empty or null query matches every record.
     */
    public List<StudentRecord> filterByName(List<StudentRecord> snapshot, String query) {
        if (query == null || query.isEmpty()) return new ArrayList<>(snapshot);
        String q = query.toLowerCase(Locale.ROOT);
        return snapshot.stream()
                .filter(r -> r.getName() != null && r.getName().toLowerCase(Locale.ROOT).contains(q))
                .collect(Collectors.toList());
    }

    public Optional<StudentRecord> filterById(List<StudentRecord> snapshot, int id) {
        return snapshot.stream().filter(r -> r.getId() == id).findFirst();
    }

    /**
     * Inclusive on both ends. Bounds are not checked: {@code lo > hi} simply matches nothing.
     */
    public List<StudentRecord> filterByPercentageRange(List<StudentRecord> snapshot, double lo, double hi) {
        if (lo > hi) {
            log.debug("Percentage range [{}, {}] is empty", lo, hi);
        }
        return snapshot.stream()
                .filter(r -> r.getPercentage() >= lo && r.getPercentage() <= hi)
                .collect(Collectors.toList());
    }

    /**
     * Case-insensitive match on the grade label; an unknown label matches nothing.
     */
    public List<StudentRecord> filterByGrade(List<StudentRecord> snapshot, String grade) {
        Optional<Grade> wanted = Grade.fromLabel(grade);
        if (wanted.isEmpty()) return new ArrayList<>();
        return snapshot.stream()
                .filter(r -> r.getGrade() == wanted.get())
                .collect(Collectors.toList());
    }

    /**
     * Returns a sorted copy; the sort is stable, so equal keys keep their snapshot order.
     */
    public List<StudentRecord> sorted(List<StudentRecord> snapshot, SortOrder order) {
        List<StudentRecord> copy = new ArrayList<>(snapshot);
        copy.sort(comparatorFor(order));
        return copy;
    }

    private OperationResult<List<StudentRecord>> withSnapshot(String description,
                                                              Function<List<StudentRecord>, List<StudentRecord>> filter) {
        try {
            List<StudentRecord> found = filter.apply(studentRepository.loadAll());
            return OperationResult.ok(found, found.size() + " record(s).");
        } catch (RecordsException ex) {
            log.warn("{} failed: {}", description, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    static Comparator<StudentRecord> comparatorFor(SortOrder order) {
        return switch (order) {
            case ID_ASC -> Comparator.comparingInt(StudentRecord::getId);
            case ID_DESC -> Comparator.comparingInt(StudentRecord::getId).reversed();
            case NAME -> Comparator.comparing(StudentRecord::getName, String.CASE_INSENSITIVE_ORDER);
            case TOTAL_DESC -> Comparator.comparingDouble(StudentRecord::getTotal).reversed();
        };
    }
}
