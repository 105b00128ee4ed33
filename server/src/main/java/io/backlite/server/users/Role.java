// file: server/src/main/java/io/backlite/server/users/Role.java
package io.backlite.server.users;

import java.util.Locale;

public enum Role {
    ADMIN,
    EMPLOYEE;

    /** @throws IllegalArgumentException for anything but ADMIN / EMPLOYEE (case-insensitive) */
    public static Role parse(String value) {
        if (value == null) throw new IllegalArgumentException("role must be one of: ADMIN, EMPLOYEE");
        try {
            return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("role must be one of: ADMIN, EMPLOYEE (got '" + value + "')", e);
        }
    }
}
