package dev.devbase.manifest.api;

/**
 * How entries that appear in more than one scope are emitted.
 */
public enum DuplicatePolicy {
    /** Every occurrence is emitted, in scope order. */
    KEEP_ALL,
    /** Only the first occurrence of an output key is emitted; core outranks packs. */
    FIRST_WINS
}
