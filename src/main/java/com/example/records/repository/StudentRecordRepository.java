package com.example.records.repository;

import com.example.records.config.RecordsProperties;
import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.exceptions.RecordsException;
import com.example.records.service.MarksCalculator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The student file. Nothing is cached: every call reads or writes the file
 * again, so callers always see what is on disk. Id uniqueness is the caller's
 * job (check {@link #exists(int)} before {@link #append(StudentRecord)}).
 */
@Repository
@RequiredArgsConstructor
public class StudentRecordRepository {

    private final Logger log = LoggerFactory.getLogger(StudentRecordRepository.class);

    private final RecordsProperties properties;
    private final StudentLineCodec codec;
    private final FileRewriter fileRewriter;

    public Path path() {
        return properties.studentFilePath();
    }

    /**
     * Snapshot of all decodable records in file order. Lines that fail to
     * decode are skipped. A missing file is an empty store.
     */
    public List<StudentRecord> loadAll() {
        List<String> lines;
        try {
            lines = fileRewriter.readLines(path());
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not read " + path() + ": " + ex.getMessage(), ex);
        }

        List<StudentRecord> records = new ArrayList<>(lines.size());
        int skipped = 0;
        for (String line : lines) {
            if (line.isEmpty()) continue;
            try {
                records.add(codec.decode(line));
            } catch (RecordsException ex) {
                skipped++;
                log.debug("Skipping line: {}", ex.getMessage());
            }
        }
        if (skipped > 0) {
            log.debug("Loaded {} records from {}, skipped {} malformed lines", records.size(), path(), skipped);
        }
        return records;
    }

    public boolean exists(int id) {
        return findById(id).isPresent();
    }

    public Optional<StudentRecord> findById(int id) {
        return loadAll().stream().filter(r -> r.getId() == id).findFirst();
    }

    public long count() {
        return loadAll().size();
    }

    public void append(StudentRecord record) {
        MarksCalculator.recompute(record);
        try {
            fileRewriter.appendLine(path(), codec.encode(record));
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not append to " + path() + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Replaces the file with {@code records}, in the given order.
     */
    public void overwriteAll(List<StudentRecord> records) {
        List<String> lines = new ArrayList<>(records.size());
        for (StudentRecord r : records) {
            lines.add(codec.encode(MarksCalculator.recompute(r)));
        }
        try {
            fileRewriter.replace(path(), lines);
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not write " + path() + ": " + ex.getMessage(), ex);
        }
    }

    public void clear() {
        overwriteAll(List.of());
    }
}
