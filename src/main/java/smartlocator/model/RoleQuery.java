package smartlocator.model;

import java.util.Objects;

/** ARIA role plus accessible name, the payload of a role selector. */
public record RoleQuery(String role, String name) {

    public RoleQuery {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(name, "name");
    }

    /** Key value counted by the frequency pass, e.g. {@code button|Save}. */
    public String frequencyValue() {
        return role + "|" + name;
    }
}
