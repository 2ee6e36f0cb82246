package org.sessionsync.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Session role of a participant. The three well-known roles are constants;
 * any other non-blank name is accepted so deployments can add their own.
 * Only {@link #EDITOR} has special meaning for conflict resolution.
 */
public final class Role {

    public static final Role EDITOR = new Role("editor");
    public static final Role VIEWER = new Role("viewer");
    public static final Role PARTICIPANT = new Role("participant");

    private final String name;

    private Role(String name) {
        this.name = name;
    }

    /**
     * @param name role name, case-insensitive
     * @throws IllegalArgumentException if blank
     */
    public static Role of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("role name must not be blank");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        switch (n) {
            case "editor":
                return EDITOR;
            case "viewer":
                return VIEWER;
            case "participant":
                return PARTICIPANT;
            default:
                return new Role(n);
        }
    }

    public String name() {
        return name;
    }

    public boolean isEditor() {
        return EDITOR.name.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Role)) {
            return false;
        }
        return name.equals(((Role) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
