package de.bsommerfeld.feedscout.core.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * The logical scope of one discovery run: either a profile handle or a
 * topic category. The entity is also the namespace of the deduplication
 * store, so two runs against the same entity share their memory of
 * previously admitted items while different entities never do.
 *
 * @param kind whether {@code name} is a profile handle or a category
 * @param name the handle (without {@code @}) or the category identifier
 */
public record SourceEntity(Kind kind, String name) {

    public enum Kind {
        HANDLE,
        CATEGORY
    }

    public SourceEntity {
        Objects.requireNonNull(kind, "kind");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source entity name must not be blank");
        }
        name = name.strip();
    }

    public static SourceEntity handle(String handle) {
        String stripped = handle == null ? null : handle.strip();
        if (stripped != null && stripped.startsWith("@")) {
            stripped = stripped.substring(1);
        }
        return new SourceEntity(Kind.HANDLE, stripped);
    }

    public static SourceEntity category(String category) {
        return new SourceEntity(Kind.CATEGORY, category == null ? null : category.toLowerCase(Locale.ROOT));
    }

    /**
     * Stable namespace key used by the deduplication store, e.g.
     * {@code handle:somebakery} or {@code category:restaurant}.
     */
    public String key() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + name;
    }

    @Override
    public String toString() {
        return key();
    }
}
