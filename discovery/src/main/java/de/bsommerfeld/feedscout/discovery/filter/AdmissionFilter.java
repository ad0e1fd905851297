package de.bsommerfeld.feedscout.discovery.filter;

import de.bsommerfeld.feedscout.core.domain.ContentRecord;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Mode-specific rule deciding whether a normalized record may be ranked.
 */
@FunctionalInterface
public interface AdmissionFilter {

    boolean admits(ContentRecord record);

    /** Returns the admitted records in their original order. */
    default List<ContentRecord> apply(List<ContentRecord> records) {
        return records.stream().filter(this::admits).collect(Collectors.toList());
    }
}
