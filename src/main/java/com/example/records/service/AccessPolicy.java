package com.example.records.service;

import com.example.records.entities.Session;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Permission;
import com.example.records.enums.UserRole;
import com.example.records.exceptions.RecordsException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.example.records.enums.UserRole.*;

/**
 * Which roles may perform which operation.
 */
@Component
public class AccessPolicy {

    private static final Map<Permission, Set<UserRole>> RULES = new EnumMap<>(Permission.class);

    static {
        RULES.put(Permission.ADD_STUDENT, EnumSet.of(ADMIN, STAFF));
        RULES.put(Permission.UPDATE_STUDENT, EnumSet.of(ADMIN, STAFF));
        RULES.put(Permission.DELETE_STUDENT, EnumSet.of(ADMIN, STAFF));
        RULES.put(Permission.PERSIST_SORT, EnumSet.of(ADMIN, STAFF));
        RULES.put(Permission.DELETE_ALL, EnumSet.of(ADMIN));
        RULES.put(Permission.MANAGE_CREDENTIALS, EnumSet.of(ADMIN));
        RULES.put(Permission.TOGGLE_OBFUSCATION, EnumSet.of(ADMIN));
        RULES.put(Permission.VIEW_STATISTICS, EnumSet.of(ADMIN, STAFF, PRINCIPAL));
        RULES.put(Permission.MAINTENANCE, EnumSet.of(ADMIN, STAFF, PRINCIPAL, GUEST));
        RULES.put(Permission.VIEW_OWN_RECORD, EnumSet.of(STUDENT));
    }

    public boolean isAllowed(Session session, Permission permission) {
        return session != null && session.getRole() != null
                && allowedRoles(permission).contains(session.getRole());
    }

    /**
     * @throws RecordsException with {@link ErrorKind#PERMISSION_DENIED} if the session may not perform the operation
     */
    public void check(Session session, Permission permission) {
        if (session == null) {
            throw new RecordsException(ErrorKind.PERMISSION_DENIED, "Permission denied: not logged in");
        }
        if (!isAllowed(session, permission)) {
            throw new RecordsException(ErrorKind.PERMISSION_DENIED,
                    "Permission denied: " + permission + " requires one of " + allowedRoles(permission));
        }
    }

    public Set<UserRole> allowedRoles(Permission permission) {
        return Collections.unmodifiableSet(RULES.getOrDefault(permission, EnumSet.noneOf(UserRole.class)));
    }
}
