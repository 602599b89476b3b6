package sp.sistemaspalacios.api_hermes.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Quién hace la petición. Se resuelve una vez en el controlador y se pasa
 * explícitamente a los servicios.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Actor {

    public enum Kind { ADMIN, EMPLOYEE }

    private final Kind kind;
    private final String employeeId;
    private final String username;

    public static Actor admin(String username) {
        return new Actor(Kind.ADMIN, null, username);
    }

    public static Actor employee(String employeeId) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("employeeId requerido");
        }
        return new Actor(Kind.EMPLOYEE, employeeId.trim(), null);
    }

    public boolean isAdmin() {
        return kind == Kind.ADMIN;
    }

    public boolean isEmployee() {
        return kind == Kind.EMPLOYEE;
    }

    @Override
    public String toString() {
        return isAdmin() ? "Actor{admin " + username + "}" : "Actor{employee " + employeeId + "}";
    }
}
