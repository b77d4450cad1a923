package com.example.records.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Locations of the files the engine owns, bound from {@code records.*}.
 * Relative file names are resolved against {@code dataDir}.
 */
@Data
@ConfigurationProperties(prefix = "records")
public class RecordsProperties {

    private String dataDir = ".";

    private String studentFile = "students.txt";

    private String credentialFile = "credentials.txt";

    private String backupFile = "students_backup.txt";

    private String csvFile = "students.csv";

    private String reportFile = "report.txt";

    // write to a temp file and rename over the target when rewriting a whole file
    private boolean atomicWrites = true;

    // buffer size used by the obfuscation pass
    private int chunkSize = 4096;

    public Path studentFilePath() {
        return resolve(studentFile);
    }

    public Path credentialFilePath() {
        return resolve(credentialFile);
    }

    public Path backupFilePath() {
        return resolve(backupFile);
    }

    public Path csvFilePath() {
        return resolve(csvFile);
    }

    public Path reportFilePath() {
        return resolve(reportFile);
    }

    private Path resolve(String file) {
        return Path.of(dataDir).resolve(file);
    }
}
