package com.example.records.repository;

import com.example.records.config.RecordsProperties;
import com.example.records.entities.CredentialEntry;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.UserRole;
import com.example.records.exceptions.RecordsException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The credential file, one {@code username password ROLE} entry per line.
 *
 * Usernames are not unique: lookups return the first matching line while
 * password updates and deletes touch every matching line. Lines that do not
 * parse (too few tokens or an unknown role) never match a username: they are
 * skipped on read and kept verbatim when the file is rewritten.
 */
@Repository
@RequiredArgsConstructor
public class CredentialRepository {

    private final Logger log = LoggerFactory.getLogger(CredentialRepository.class);

    private final RecordsProperties properties;
    private final FileRewriter fileRewriter;

    public Path path() {
        return properties.credentialFilePath();
    }

    public boolean fileExists() {
        return Files.exists(path());
    }

    public List<CredentialEntry> findAll() {
        List<CredentialEntry> entries = new ArrayList<>();
        for (String line : readLines()) {
            parse(line).ifPresent(entries::add);
        }
        return entries;
    }

    public Optional<CredentialEntry> findFirstByUsername(String username) {
        return findAll().stream().filter(e -> e.getUsername().equals(username)).findFirst();
    }

    public Optional<CredentialEntry> findFirstByUsernameAndPassword(String username, String password) {
        return findAll().stream()
                .filter(e -> e.getUsername().equals(username) && e.getPassword().equals(password))
                .findFirst();
    }

    public void append(CredentialEntry entry) {
        try {
            fileRewriter.appendLine(path(), entry.toLine());
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not append to " + path() + ": " + ex.getMessage(), ex);
        }
    }

    public void saveAll(List<CredentialEntry> entries) {
        List<String> lines = new ArrayList<>(entries.size());
        for (CredentialEntry e : entries) {
            lines.add(e.toLine());
        }
        replaceLines(lines);
    }

    /**
     * Sets {@code newPassword} on every line for {@code username}. The file is
     * only rewritten when at least one line matched.
     *
     * @return number of lines updated
     */
    public int updatePassword(String username, String newPassword) {
        List<String> lines = readLines();
        List<String> out = new ArrayList<>(lines.size());
        int updated = 0;
        for (String line : lines) {
            if (isEntryFor(line, username)) {
                String[] tokens = tokens(line);
                out.add(tokens[0] + " " + newPassword + " " + tokens[2]);
                updated++;
            } else {
                out.add(line);
            }
        }
        if (updated > 0) {
            replaceLines(out);
        }
        return updated;
    }

    /**
     * Drops every line for {@code username}. The file is only rewritten when
     * at least one line matched.
     *
     * @return number of lines removed
     */
    public int deleteByUsername(String username) {
        List<String> lines = readLines();
        List<String> out = new ArrayList<>(lines.size());
        int removed = 0;
        for (String line : lines) {
            if (isEntryFor(line, username)) {
                removed++;
            } else {
                out.add(line);
            }
        }
        if (removed > 0) {
            replaceLines(out);
        }
        return removed;
    }

    private boolean isEntryFor(String line, String username) {
        return parse(line).filter(e -> e.getUsername().equals(username)).isPresent();
    }

    private Optional<CredentialEntry> parse(String line) {
        String[] tokens = tokens(line);
        if (tokens.length < 3) {
            if (!line.isBlank()) log.debug("Skipping credential line with {} tokens", tokens.length);
            return Optional.empty();
        }
        Optional<UserRole> role = UserRole.parse(tokens[2]);
        if (role.isEmpty()) {
            log.debug("Skipping credential line for {} with unknown role {}", tokens[0], tokens[2]);
            return Optional.empty();
        }
        return Optional.of(new CredentialEntry(tokens[0], tokens[1], role.get()));
    }

    private static String[] tokens(String line) {
        String t = line.trim();
        if (t.isEmpty()) return new String[0];
        return t.split("\\s+");
    }

    private List<String> readLines() {
        try {
            return fileRewriter.readLines(path());
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not read " + path() + ": " + ex.getMessage(), ex);
        }
    }

    private void replaceLines(List<String> lines) {
        try {
            fileRewriter.replace(path(), lines);
        } catch (IOException ex) {
            throw new RecordsException(ErrorKind.IO_ERROR, "Could not write " + path() + ": " + ex.getMessage(), ex);
        }
    }
}
