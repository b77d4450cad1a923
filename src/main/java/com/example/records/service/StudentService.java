package com.example.records.service;

import com.example.records.entities.OperationResult;
import com.example.records.entities.Session;
import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Permission;
import com.example.records.enums.Subject;
import com.example.records.exceptions.RecordsException;
import com.example.records.repository.StudentLineCodec;
import com.example.records.repository.StudentRecordRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Record mutations for the menu layer. Each call reads the current file,
 * applies the change in memory and writes the file back. Failures come back
 * as an {@link OperationResult}, never as an exception.
 */
@Service
@RequiredArgsConstructor
public class StudentService {

    /** Pass as a mark to {@link #updateStudent} to keep the current value. */
    public static final double KEEP_MARK = -1.0;

    public static final int MAX_NAME_LENGTH = 99;

    private final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRecordRepository studentRepository;
    private final AccessPolicy accessPolicy;

    public OperationResult<List<StudentRecord>> findAll() {
        try {
            List<StudentRecord> records = studentRepository.loadAll();
            return OperationResult.ok(records, records.size() + " record(s).");
        } catch (RecordsException ex) {
            log.warn("Loading records failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<StudentRecord> findById(int id) {
        try {
            return studentRepository.findById(id)
                    .map(r -> OperationResult.ok(r, "Record found."))
                    .orElseGet(() -> OperationResult.<StudentRecord>failure(ErrorKind.NOT_FOUND, "Record not found: " + id));
        } catch (RecordsException ex) {
            log.warn("Loading record {} failed: {}", id, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<StudentRecord> addStudent(Session session, int id, String name, double... marks) {
        try {
            accessPolicy.check(session, Permission.ADD_STUDENT);
            String cleanName = validateName(name);
            if (marks == null || marks.length != Subject.count()) {
                throw new RecordsException(ErrorKind.INVALID_INPUT,
                        "Expected " + Subject.count() + " marks, got " + (marks == null ? 0 : marks.length));
            }
            for (Subject subject : Subject.values()) {
                if (!MarksCalculator.isValidMark(marks[subject.ordinal()])) {
                    throw new RecordsException(ErrorKind.INVALID_INPUT, "Marks must be 0-100 (" + subject.getDisplayName() + ")");
                }
            }
            if (studentRepository.exists(id)) {
                throw new RecordsException(ErrorKind.DUPLICATE_ID, "Roll number already exists: " + id);
            }

            StudentRecord record = StudentRecord.builder()
                    .id(id)
                    .name(cleanName)
                    .marks(marks.clone())
                    .build();
            MarksCalculator.recompute(record);
            studentRepository.append(record);
            log.info("Added student id={} name={} grade={}", id, cleanName, record.getGrade());
            return OperationResult.ok(record, "Student added successfully!");
        } catch (RecordsException ex) {
            log.warn("Add student id={} failed: {}", id, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * Changes the name and/or marks of a record. A null or blank {@code newName}
     * keeps the name; a mark outside 0-100 (such as {@link #KEEP_MARK}) keeps
     * that subject's mark. {@code newMarks} may be null or shorter than the subject list.
     */
    public OperationResult<StudentRecord> updateStudent(Session session, int id, String newName, double... newMarks) {
        try {
            accessPolicy.check(session, Permission.UPDATE_STUDENT);
            List<StudentRecord> records = studentRepository.loadAll();
            StudentRecord target = records.stream()
                    .filter(r -> r.getId() == id)
                    .findFirst()
                    .orElseThrow(() -> new RecordsException(ErrorKind.NOT_FOUND, "Roll not found: " + id));

            if (newName != null && !newName.isBlank()) {
                target.setName(validateName(newName));
            }
            if (newMarks != null) {
                for (int i = 0; i < newMarks.length && i < Subject.count(); i++) {
                    if (MarksCalculator.isValidMark(newMarks[i])) {
                        target.getMarks()[i] = newMarks[i];
                    }
                }
            }
            MarksCalculator.recompute(target);
            studentRepository.overwriteAll(records);
            log.info("Updated student id={}", id);
            return OperationResult.ok(target, "Record updated.");
        } catch (RecordsException ex) {
            log.warn("Update student id={} failed: {}", id, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<Void> deleteStudent(Session session, int id) {
        try {
            accessPolicy.check(session, Permission.DELETE_STUDENT);
            List<StudentRecord> records = studentRepository.loadAll();
            int idx = -1;
            for (int i = 0; i < records.size(); i++) {
                if (records.get(i).getId() == id) {
                    idx = i;
                    break;
                }
            }
            if (idx < 0) {
                throw new RecordsException(ErrorKind.NOT_FOUND, "Roll not found: " + id);
            }
            records.remove(idx);
            studentRepository.overwriteAll(records);
            log.info("Deleted student with id={}", id);
            return OperationResult.ok("Deleted successfully.");
        } catch (RecordsException ex) {
            log.warn("Delete student id={} failed: {}", id, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<Void> deleteAll(Session session, boolean confirmed) {
        try {
            accessPolicy.check(session, Permission.DELETE_ALL);
            if (!confirmed) {
                return OperationResult.failure(ErrorKind.CANCELLED, "Operation cancelled.");
            }
            studentRepository.clear();
            log.info("All student records deleted by {}", session.getUsername());
            return OperationResult.ok("All records deleted.");
        } catch (RecordsException ex) {
            log.warn("Delete all failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * Writes {@code ordered} back as the new file content, typically the
     * result of {@link StudentQueryService#sorted} once the user confirmed it.
     */
    public OperationResult<Void> persistOrder(Session session, List<StudentRecord> ordered) {
        try {
            accessPolicy.check(session, Permission.PERSIST_SORT);
            studentRepository.overwriteAll(new ArrayList<>(ordered));
            log.info("Persisted new order of {} records", ordered.size());
            return OperationResult.ok("Saved.");
        } catch (RecordsException ex) {
            log.warn("Persisting sort order failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * The record of a STUDENT session: an all-digit username is taken as a
     * roll number, anything else is compared with record names ignoring case.
     */
    public OperationResult<StudentRecord> findOwnRecord(Session session) {
        try {
            accessPolicy.check(session, Permission.VIEW_OWN_RECORD);
            String username = session.getUsername();
            List<StudentRecord> records = studentRepository.loadAll();
            Optional<StudentRecord> own;
            if (isNumeric(username)) {
                int roll = Integer.parseInt(username);
                own = records.stream().filter(r -> r.getId() == roll).findFirst();
            } else {
                own = records.stream().filter(r -> r.getName().equalsIgnoreCase(username)).findFirst();
            }
            return own.map(r -> OperationResult.ok(r, "Record found."))
                    .orElseGet(() -> OperationResult.failure(ErrorKind.NOT_FOUND, "No record found for you."));
        } catch (RecordsException ex) {
            log.warn("Own record lookup failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    private String validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new RecordsException(ErrorKind.INVALID_INPUT, "Invalid name.");
        }
        String t = name.trim();
        if (t.length() > MAX_NAME_LENGTH) {
            throw new RecordsException(ErrorKind.INVALID_INPUT, "Name longer than " + MAX_NAME_LENGTH + " characters.");
        }
        if (t.indexOf(StudentLineCodec.DELIMITER) >= 0) {
            throw new RecordsException(ErrorKind.INVALID_INPUT, "Name must not contain '" + StudentLineCodec.DELIMITER + "'.");
        }
        return t;
    }

    private static boolean isNumeric(String s) {
        if (s == null || s.isEmpty() || s.length() > 9) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
