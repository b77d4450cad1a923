package com.example.records.repository;

import com.example.records.config.RecordsProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented file access shared by the record and credential stores.
 * Lines are always terminated with {@code \n}.
 */
@Component
@RequiredArgsConstructor
public class FileRewriter {

    private final Logger log = LoggerFactory.getLogger(FileRewriter.class);

    private final RecordsProperties properties;

    /**
     * Reads all lines, or returns an empty list if the file does not exist.
     * Bytes that are not valid UTF-8 are replaced rather than rejected, so an
     * obfuscated file reads as garbage lines instead of failing.
     */
    public List<String> readLines(Path file) throws IOException {
        if (!Files.exists(file)) return new ArrayList<>();
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    public void appendLine(Path file, String line) throws IOException {
        createParent(file);
        write(file, List.of(line), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Replaces the whole content of {@code file} with {@code lines}.
     * With atomic writes enabled the lines go to a sibling temp file which is
     * then moved over the target, so a crash leaves either the old or the new content.
     */
    public void replace(Path file, List<String> lines) throws IOException {
        createParent(file);
        if (!properties.isAtomicWrites()) {
            write(file, lines, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path dir = file.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, file.getFileName().toString() + ".", ".tmp");
        try {
            write(tmp, lines, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                log.debug("Atomic move not supported for {}, falling back to plain replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void write(Path file, List<String> lines, OpenOption... options) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(Files.newOutputStream(file, options), StandardCharsets.UTF_8))) {
            for (String line : lines) {
                writer.write(line);
                writer.write('\n');
            }
        }
    }

    private void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
