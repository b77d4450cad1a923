package com.example.records.service;

import com.example.records.entities.CredentialEntry;
import com.example.records.entities.OperationResult;
import com.example.records.entities.Session;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Permission;
import com.example.records.enums.UserRole;
import com.example.records.exceptions.RecordsException;
import com.example.records.repository.CredentialRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Login and user administration over the credential file.
 *
 * Duplicate usernames are allowed. {@link #check} honours the first matching
 * line only, while {@link #resetPassword} and {@link #remove} apply to every
 * line with that username.
 */
@Service
@RequiredArgsConstructor
public class CredentialService {

    private final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final CredentialRepository credentialRepository;
    private final AccessPolicy accessPolicy;

    static final List<CredentialEntry> DEFAULT_USERS = List.of(
            new CredentialEntry("admin", "admin", UserRole.ADMIN),
            new CredentialEntry("staff", "staff", UserRole.STAFF),
            new CredentialEntry("guest", "guest", UserRole.GUEST),
            new CredentialEntry("principal", "principal", UserRole.PRINCIPAL),
            new CredentialEntry("student", "student", UserRole.STUDENT));

    /**
     * Writes the default users if the credential file does not exist yet.
     */
    public OperationResult<Void> ensureDefaults() {
        try {
            if (credentialRepository.fileExists()) {
                return OperationResult.ok("Credential file already exists");
            }
            credentialRepository.saveAll(DEFAULT_USERS);
            log.info("Created credential file {} with {} default users", credentialRepository.path(), DEFAULT_USERS.size());
            return OperationResult.ok("Default credentials created");
        } catch (RecordsException ex) {
            log.error("Could not create default credentials", ex);
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<UserRole> check(String username, String password) {
        try {
            return credentialRepository.findFirstByUsernameAndPassword(username, password)
                    .map(e -> OperationResult.ok(e.getRole(), "Valid credentials"))
                    .orElseGet(() -> OperationResult.failure(ErrorKind.INVALID_CREDENTIALS, "Invalid credentials."));
        } catch (RecordsException ex) {
            log.error("Credential check for {} failed: {}", username, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<Session> login(String username, String password) {
        OperationResult<UserRole> role = check(username, password);
        if (!role.isSuccess()) {
            log.warn("Login failed for username={}", username);
            return OperationResult.failure(role.getErrorKind(), role.getMessage());
        }
        Session session = Session.of(username, role.getValue().orElseThrow());
        log.info("Login successful for {} [{}]", username, session.getRole());
        return OperationResult.ok(session, "Login successful. Welcome " + username + " [" + session.getRole() + "]");
    }

    /**
     * Appends a user. The role is accepted in any case and stored upper case.
     * An existing username is not replaced; the older line keeps winning on login.
     */
    public OperationResult<Void> add(Session session, String username, String password, String role) {
        try {
            accessPolicy.check(session, Permission.MANAGE_CREDENTIALS);
            requireToken(username, "Username");
            requireToken(password, "Password");
            UserRole parsed = UserRole.parse(role)
                    .orElseThrow(() -> new RecordsException(ErrorKind.INVALID_INPUT, "Unknown role: " + role));
            if (credentialRepository.findFirstByUsername(username).isPresent()) {
                log.warn("Adding second credential line for existing username={}", username);
            }
            credentialRepository.append(new CredentialEntry(username, password, parsed));
            log.info("Added user {} [{}]", username, parsed);
            return OperationResult.ok("User added.");
        } catch (RecordsException ex) {
            log.warn("Add user {} failed: {}", username, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<Void> resetPassword(Session session, String username, String newPassword) {
        try {
            accessPolicy.check(session, Permission.MANAGE_CREDENTIALS);
            requireToken(newPassword, "Password");
            int updated = credentialRepository.updatePassword(username, newPassword);
            if (updated == 0) {
                throw new RecordsException(ErrorKind.NOT_FOUND, "User not found: " + username);
            }
            log.info("Password reset for {} ({} entries)", username, updated);
            return OperationResult.ok("Password reset.");
        } catch (RecordsException ex) {
            log.warn("Password reset for {} failed: {}", username, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<Void> remove(Session session, String username) {
        try {
            accessPolicy.check(session, Permission.MANAGE_CREDENTIALS);
            int removed = credentialRepository.deleteByUsername(username);
            if (removed == 0) {
                throw new RecordsException(ErrorKind.NOT_FOUND, "User not found: " + username);
            }
            log.info("Removed user {} ({} entries)", username, removed);
            return OperationResult.ok("User removed.");
        } catch (RecordsException ex) {
            log.warn("Remove user {} failed: {}", username, ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    public OperationResult<List<CredentialEntry>> findAll() {
        try {
            List<CredentialEntry> entries = credentialRepository.findAll();
            return OperationResult.ok(entries, entries.size() + " user(s).");
        } catch (RecordsException ex) {
            log.warn("Loading users failed: {}", ex.getMessage());
            return OperationResult.failure(ex);
        }
    }

    private static void requireToken(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new RecordsException(ErrorKind.INVALID_INPUT, field + " must not be empty.");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                throw new RecordsException(ErrorKind.INVALID_INPUT, field + " must not contain whitespace.");
            }
        }
    }
}
