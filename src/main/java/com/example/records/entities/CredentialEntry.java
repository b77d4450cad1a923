package com.example.records.entities;

import com.example.records.enums.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One line of the credential file: {@code username password ROLE}.
 */
@Value
@Builder
@AllArgsConstructor
public class CredentialEntry {
    String username;
    String password;
    UserRole role;

    public String toLine() {
        return username + " " + password + " " + role.name();
    }
}
