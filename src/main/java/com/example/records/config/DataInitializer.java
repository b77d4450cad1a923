package com.example.records.config;

import com.example.records.entities.OperationResult;
import com.example.records.service.CredentialService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the credential file with the default users on first start.
 * An existing file is left untouched, even if it lacks some of the defaults.
 */
@Component
@RequiredArgsConstructor
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final CredentialService credentialService;
    private final RecordsProperties properties;

    @PostConstruct
    public void init() {
        log.info("DataInitializer started, data dir={}", properties.getDataDir());
        OperationResult<Void> result = credentialService.ensureDefaults();
        if (result.isSuccess()) {
            log.info(result.getMessage());
        } else {
            log.error("Could not create default credentials: {}", result.getMessage());
        }
    }
}
