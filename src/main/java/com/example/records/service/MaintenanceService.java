package com.example.records.service;

import com.example.records.config.RecordsProperties;
import com.example.records.entities.OperationResult;
import com.example.records.entities.Session;
import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Permission;
import com.example.records.enums.Subject;
import com.example.records.exceptions.RecordsException;
import com.example.records.repository.StudentRecordRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Backup, restore, export and obfuscation of the student file.
 */
@Service
@RequiredArgsConstructor
public class MaintenanceService {

    static final DateTimeFormatter REPORT_TIMESTAMP =
            DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.ENGLISH);

    static final String REPORT_SEPARATOR = "-----------------";

    private final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final RecordsProperties properties;
    private final StudentRecordRepository studentRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    /**
     * Byte copy of the student file to the backup path, replacing an older backup.
     */
    public OperationResult<Void> backup(Session session) {
        Path source = properties.studentFilePath();
        Path target = properties.backupFilePath();
        try {
            accessPolicy.check(session, Permission.MAINTENANCE);
            if (!Files.exists(source)) {
                throw new RecordsException(ErrorKind.NOT_FOUND, "No data to backup.");
            }
            copy(source, target);
            log.info("Backup of {} saved to {}", source, target);
            return OperationResult.ok("Backup saved to " + target);
        } catch (RecordsException ex) {
            log.warn("Backup failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * Overwrites the student file with the backup. Does nothing unless {@code confirmed}.
     */
    public OperationResult<Void> restore(Session session, boolean confirmed) {
        Path source = properties.backupFilePath();
        Path target = properties.studentFilePath();
        try {
            accessPolicy.check(session, Permission.MAINTENANCE);
            if (!confirmed) {
                return OperationResult.failure(ErrorKind.CANCELLED, "Restore cancelled.");
            }
            if (!Files.exists(source)) {
                throw new RecordsException(ErrorKind.NOT_FOUND, "Backup file not found.");
            }
            copy(source, target);
            log.info("Restored {} from {}", target, source);
            return OperationResult.ok("Restore complete.");
        } catch (RecordsException ex) {
            log.warn("Restore failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * Writes the CSV table and the text report for the current records to the configured paths.
     */
    public OperationResult<Void> export(Session session) {
        try {
            accessPolicy.check(session, Permission.MAINTENANCE);
            return exportSnapshot(studentRepository.loadAll(), properties.csvFilePath(), properties.reportFilePath());
        } catch (RecordsException ex) {
            log.warn("Export failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<Void> exportSnapshot(List<StudentRecord> snapshot, Path csvFile, Path reportFile) {
        if (snapshot.isEmpty()) {
            return OperationResult.failure(ErrorKind.EMPTY_STORE, "No records to export.");
        }
        try {
            writeString(csvFile, toCsv(snapshot));
            writeString(reportFile, toReport(snapshot, LocalDateTime.now(clock)));
        } catch (IOException ex) {
            log.error("Error creating export files {} and {}", csvFile, reportFile, ex);
            return OperationResult.failure(ErrorKind.IO_ERROR, "Error creating export files: " + ex.getMessage());
        }
        log.info("Exported {} records to {} and {}", snapshot.size(), csvFile, reportFile);
        return OperationResult.ok("Exported to " + csvFile + " and " + reportFile);
    }

    public String toCsv(List<StudentRecord> snapshot) {
        StringBuilder sb = new StringBuilder("Roll,Name");
        for (Subject s : Subject.values()) {
            sb.append(',').append(s.getDisplayName());
        }
        sb.append(",Total,Percentage,Grade\n");
        for (StudentRecord r : snapshot) {
            sb.append(r.getId()).append(",\"").append(r.getName()).append('"');
            for (Subject s : Subject.values()) {
                sb.append(',').append(twoDecimals(r.getMark(s)));
            }
            sb.append(',').append(twoDecimals(r.getTotal()))
                    .append(',').append(twoDecimals(r.getPercentage()))
                    .append(',').append(r.getGrade().getLabel())
                    .append('\n');
        }
        return sb.toString();
    }

    public String toReport(List<StudentRecord> snapshot, LocalDateTime generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("Student Report Generated on ").append(REPORT_TIMESTAMP.format(generatedAt)).append("\n\n");
        for (StudentRecord r : snapshot) {
            sb.append("Roll: ").append(r.getId()).append('\n');
            sb.append("Name: ").append(r.getName()).append('\n');
            for (Subject s : Subject.values()) {
                sb.append(s.getDisplayName()).append(": ").append(twoDecimals(r.getMark(s))).append('\n');
            }
            sb.append("Total: ").append(twoDecimals(r.getTotal())).append('\n');
            sb.append("Percentage: ").append(twoDecimals(r.getPercentage())).append('\n');
            sb.append("Grade: ").append(r.getGrade().getLabel()).append('\n');
            sb.append(REPORT_SEPARATOR).append('\n');
        }
        return sb.toString();
    }

    /**
     * XORs every byte of the student file with {@code key}, in place. Running it
     * again with the same key restores the file. Whether the file is currently
     * obfuscated is not tracked. Does nothing unless {@code confirmed}.
     */
    public OperationResult<Void> toggleObfuscation(Session session, char key, boolean confirmed) {
        Path file = properties.studentFilePath();
        try {
            accessPolicy.check(session, Permission.TOGGLE_OBFUSCATION);
            if (!confirmed) {
                return OperationResult.failure(ErrorKind.CANCELLED, "Encryption toggle cancelled.");
            }
            if (!Files.exists(file)) {
                throw new RecordsException(ErrorKind.NOT_FOUND, "Student file not found: " + file);
            }
            long bytes = xorFile(file, (byte) key, properties.getChunkSize());
            log.info("XOR applied to {} ({} bytes)", file, bytes);
            return OperationResult.ok("XOR applied with key '" + key + "'. (Run again with same key to decrypt)");
        } catch (RecordsException ex) {
            log.warn("Obfuscation toggle failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    /**
     * @return number of bytes transformed
     */
    static long xorFile(Path file, byte key, int chunkSize) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.allocate(Math.max(1, chunkSize));
            long position = 0;
            int read;
            while ((read = channel.read(buffer, position)) > 0) {
                buffer.flip();
                for (int i = 0; i < read; i++) {
                    buffer.put(i, (byte) (buffer.get(i) ^ key));
                }
                int written = 0;
                while (buffer.hasRemaining()) {
                    written += channel.write(buffer, position + written);
                }
                position += read;
                buffer.clear();
            }
            return position;
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not transform " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static void copy(Path from, Path to) {
        try {
            Path parent = to.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not copy " + from + " to " + to + ": " + ex.getMessage(), ex);
        }
    }

    private static void writeString(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
