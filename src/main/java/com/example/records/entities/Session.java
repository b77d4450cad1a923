package com.example.records.entities;

import com.example.records.enums.UserRole;
import lombok.Value;

/**
 * The logged-in user. Passed explicitly into every operation that needs authorization.
 */
@Value(staticConstructor = "of")
public class Session {
    String username;
    UserRole role;
}
