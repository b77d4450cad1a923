package com.example.records;

import com.example.records.config.RecordsProperties;
import com.example.records.entities.Session;
import com.example.records.entities.StudentRecord;
import com.example.records.enums.UserRole;
import com.example.records.repository.CredentialRepository;
import com.example.records.repository.FileRewriter;
import com.example.records.repository.StudentLineCodec;
import com.example.records.repository.StudentRecordRepository;
import com.example.records.service.AccessPolicy;
import com.example.records.service.CredentialService;
import com.example.records.service.MaintenanceService;
import com.example.records.service.MarksCalculator;
import com.example.records.service.StatisticsService;
import com.example.records.service.StudentQueryService;
import com.example.records.service.StudentService;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires the stores and services by hand against a temporary data directory.
 */
public class StoreFixture {

    public static final Session ADMIN = Session.of("admin", UserRole.ADMIN);
    public static final Session STAFF = Session.of("staff", UserRole.STAFF);
    public static final Session PRINCIPAL = Session.of("principal", UserRole.PRINCIPAL);
    public static final Session GUEST = Session.of("guest", UserRole.GUEST);

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-05T09:07:03Z"), ZoneOffset.UTC);

    public final RecordsProperties properties;
    public final StudentLineCodec codec = new StudentLineCodec();
    public final FileRewriter fileRewriter;
    public final StudentRecordRepository studentRepository;
    public final CredentialRepository credentialRepository;
    public final AccessPolicy accessPolicy = new AccessPolicy();
    public final StudentService studentService;
    public final StudentQueryService queryService;
    public final StatisticsService statisticsService;
    public final CredentialService credentialService;
    public final MaintenanceService maintenanceService;

    public StoreFixture(Path dataDir) {
        this(dataDir, true);
    }

    public StoreFixture(Path dataDir, boolean atomicWrites) {
        properties = new RecordsProperties();
        properties.setDataDir(dataDir.toString());
        properties.setAtomicWrites(atomicWrites);
        fileRewriter = new FileRewriter(properties);
        studentRepository = new StudentRecordRepository(properties, codec, fileRewriter);
        credentialRepository = new CredentialRepository(properties, fileRewriter);
        studentService = new StudentService(studentRepository, accessPolicy);
        queryService = new StudentQueryService(studentRepository);
        statisticsService = new StatisticsService(studentRepository, accessPolicy);
        credentialService = new CredentialService(credentialRepository, accessPolicy);
        maintenanceService = new MaintenanceService(properties, studentRepository, accessPolicy, FIXED_CLOCK);
    }

    public static StudentRecord record(int id, String name, double m1, double m2, double m3) {
        StudentRecord r = StudentRecord.builder()
                .id(id)
                .name(name)
                .marks(new double[]{m1, m2, m3})
                .build();
        return MarksCalculator.recompute(r);
    }

    /**
     * A record whose marks are all {@code pct}, so its percentage is {@code pct}.
     */
    public static StudentRecord withPercentage(int id, String name, double pct) {
        return record(id, name, pct, pct, pct);
    }
}
