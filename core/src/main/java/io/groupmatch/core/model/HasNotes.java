package io.groupmatch.core.model;

import java.util.List;

/**
 * Implemented by exceptions that carry free-form notes. Notes are appended to the exception message,
 * one per line, when a {@code match} pattern is searched.
 */
public interface HasNotes {

    /** The attached notes in insertion order, never null. */
    List<String> notes();
}
