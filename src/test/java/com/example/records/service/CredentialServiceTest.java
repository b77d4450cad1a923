package com.example.records.service;

import com.example.records.StoreFixture;
import com.example.records.entities.CredentialEntry;
import com.example.records.entities.OperationResult;
import com.example.records.entities.Session;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.example.records.StoreFixture.ADMIN;
import static com.example.records.StoreFixture.STAFF;
import static org.junit.jupiter.api.Assertions.*;

class CredentialServiceTest {

    @TempDir
    Path tempDir;

    private StoreFixture fixture;
    private CredentialService service;

    @BeforeEach
    void setUp() {
        fixture = new StoreFixture(tempDir);
        service = fixture.credentialService;
    }

    @Test
    void firstRunWritesDefaultUsers() throws IOException {
        assertTrue(service.ensureDefaults().isSuccess());

        assertEquals(List.of(
                "admin admin ADMIN",
                "staff staff STAFF",
                "guest guest GUEST",
                "principal principal PRINCIPAL",
                "student student STUDENT"), Files.readAllLines(fixture.credentialRepository.path()));
        assertEquals(UserRole.PRINCIPAL, service.check("principal", "principal").getValue().orElseThrow());
    }

    @Test
    void existingFileIsNotReseeded() throws IOException {
        Files.writeString(fixture.credentialRepository.path(), "root toor ADMIN\n");
        service.ensureDefaults();
        assertEquals(List.of("root toor ADMIN"), Files.readAllLines(fixture.credentialRepository.path()));
    }

    @Test
    void checkRejectsWrongPassword() {
        service.ensureDefaults();
        OperationResult<UserRole> result = service.check("admin", "nope");
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.INVALID_CREDENTIALS, result.getErrorKind());
    }

    @Test
    void loginReturnsSession() {
        service.ensureDefaults();
        Session session = service.login("staff", "staff").getValue().orElseThrow();
        assertEquals(Session.of("staff", UserRole.STAFF), session);
        assertFalse(service.login("staff", "wrong").isSuccess());
    }

    @Test
    void addNormalisesRoleAndAllowsDuplicates() {
        assertTrue(service.add(ADMIN, "bob", "first", "staff").isSuccess());
        assertTrue(service.add(ADMIN, "bob", "second", "Guest").isSuccess());

        assertEquals(List.of(
                new CredentialEntry("bob", "first", UserRole.STAFF),
                new CredentialEntry("bob", "second", UserRole.GUEST)), service.findAll().getValue().orElseThrow());
        assertEquals(UserRole.GUEST, service.check("bob", "second").getValue().orElseThrow());
    }

    @Test
    void addRejectsBadInput() {
        assertEquals(ErrorKind.INVALID_INPUT, service.add(ADMIN, "bo b", "pw", "STAFF").getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, service.add(ADMIN, "bob", "", "STAFF").getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, service.add(ADMIN, "bob", "pw", "WIZARD").getErrorKind());
        assertFalse(fixture.credentialRepository.fileExists());
    }

    @Test
    void resetUpdatesEveryMatchingLine() {
        service.add(ADMIN, "bob", "one", "STAFF");
        service.add(ADMIN, "alice", "pw", "GUEST");
        service.add(ADMIN, "bob", "two", "GUEST");

        assertTrue(service.resetPassword(ADMIN, "bob", "fresh").isSuccess());

        assertEquals(List.of(
                new CredentialEntry("bob", "fresh", UserRole.STAFF),
                new CredentialEntry("alice", "pw", UserRole.GUEST),
                new CredentialEntry("bob", "fresh", UserRole.GUEST)), service.findAll().getValue().orElseThrow());
        assertEquals(UserRole.STAFF, service.check("bob", "fresh").getValue().orElseThrow());
    }

    @Test
    void resetOfUnknownUserFailsAndLeavesFileUnchanged() throws IOException {
        service.ensureDefaults();
        Path file = fixture.credentialRepository.path();
        byte[] before = Files.readAllBytes(file);

        OperationResult<Void> result = service.resetPassword(ADMIN, "ghost", "x");

        assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void resetSkipsUserWhoCannotLogIn() throws IOException {
        Files.writeString(fixture.credentialRepository.path(), "carol pw WIZARD\n");

        assertEquals(ErrorKind.NOT_FOUND, service.resetPassword(ADMIN, "carol", "x").getErrorKind());
        assertEquals(ErrorKind.INVALID_CREDENTIALS, service.check("carol", "pw").getErrorKind());
    }

    @Test
    void unreadableFileIsReportedNotThrown() throws IOException {
        Files.createDirectories(fixture.credentialRepository.path());

        assertEquals(ErrorKind.IO_ERROR, service.findAll().getErrorKind());
        assertEquals(ErrorKind.IO_ERROR, service.check("admin", "admin").getErrorKind());
    }

    @Test
    void removeDropsAllLinesForUser() {
        service.add(ADMIN, "bob", "one", "STAFF");
        service.add(ADMIN, "alice", "pw", "GUEST");
        service.add(ADMIN, "bob", "two", "GUEST");

        assertTrue(service.remove(ADMIN, "bob").isSuccess());
        assertEquals(List.of(new CredentialEntry("alice", "pw", UserRole.GUEST)), service.findAll().getValue().orElseThrow());
        assertEquals(ErrorKind.NOT_FOUND, service.remove(ADMIN, "bob").getErrorKind());
    }

    @Test
    void onlyAdminManagesUsers() {
        assertEquals(ErrorKind.PERMISSION_DENIED, service.add(STAFF, "eve", "pw", "ADMIN").getErrorKind());
        assertEquals(ErrorKind.PERMISSION_DENIED, service.remove(null, "admin").getErrorKind());
    }
}
