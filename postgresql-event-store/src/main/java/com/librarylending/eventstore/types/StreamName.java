package com.librarylending.eventstore.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Name of an event stream. Aggregate streams are named <code>{category}-{id}</code>, e.g. <code>book-42</code>
 */
public final class StreamName extends CharSequenceType<StreamName> {
    public static final String CATEGORY_SEPARATOR = "-";

    public StreamName(CharSequence value) {
        super(value);
    }

    public static StreamName of(CharSequence value) {
        return new StreamName(value);
    }

    public static StreamName of(String category, Object id) {
        requireNonNull(category, "No category provided");
        requireTrue(!category.isBlank(), "No category provided");
        requireNonNull(id, "No id provided");
        requireTrue(!category.contains(CATEGORY_SEPARATOR), msg("Category '{}' must not contain '{}'", category, CATEGORY_SEPARATOR));
        return new StreamName(category + CATEGORY_SEPARATOR + id);
    }

    /**
     * @return the part before the first {@link #CATEGORY_SEPARATOR}, or the full name if there is no separator
     */
    public String category() {
        var separatorIndex = value().indexOf(CATEGORY_SEPARATOR);
        return separatorIndex < 0 ? value() : value().substring(0, separatorIndex);
    }

    /**
     * @return the part after the first {@link #CATEGORY_SEPARATOR}, or the full name if there is no separator
     */
    public String id() {
        var separatorIndex = value().indexOf(CATEGORY_SEPARATOR);
        return separatorIndex < 0 ? value() : value().substring(separatorIndex + 1);
    }

    public boolean hasPrefix(String prefix) {
        return value().startsWith(prefix);
    }
}
