package com.example.txanalyzer.domain.model;

/**
 * Ordered processing status of a {@link TransactionSet}.
 * Each pipeline stage checks the tag on entry so a skipped prerequisite fails fast instead of
 * producing summaries over unparsed values.
 */
public enum PipelineStage {
    RAW,
    CLEANED,
    CATEGORIZED;

    /**
     * @param other stage to compare against
     * @return {@code true} when this stage is {@code other} or comes after it
     */
    public boolean isAtLeast(PipelineStage other) {
        return ordinal() >= other.ordinal();
    }
}
