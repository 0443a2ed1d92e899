package com.example.txanalyzer.domain.model;

import com.example.txanalyzer.domain.exception.PipelineStateException;

import java.util.List;

/**
 * In-memory record set flowing through the pipeline, tagged with the last stage it completed.
 * Raw rows are only available while the set is {@link PipelineStage#RAW}; typed records only afterwards.
 * Instances are immutable: every stage returns a new set.
 */
public final class TransactionSet {

    private final PipelineStage stage;
    private final List<String> columns;
    private final List<RawRecord> rawRecords;
    private final List<TransactionRecord> records;

    private TransactionSet(PipelineStage stage,
                           List<String> columns,
                           List<RawRecord> rawRecords,
                           List<TransactionRecord> records) {
        this.stage = stage;
        this.columns = List.copyOf(columns);
        this.rawRecords = List.copyOf(rawRecords);
        this.records = List.copyOf(records);
    }

    public static TransactionSet raw(List<String> columns, List<RawRecord> rawRecords) {
        return new TransactionSet(PipelineStage.RAW, columns, rawRecords, List.of());
    }

    public static TransactionSet cleaned(List<String> columns, List<TransactionRecord> records) {
        return new TransactionSet(PipelineStage.CLEANED, columns, List.of(), records);
    }

	/**
	 * Builds a categorized set. Every record must already carry a category.
	 *
	 * @param columns source column names
	 * @param records categorized records in ingestion order
	 * @return set tagged {@link PipelineStage#CATEGORIZED}
	 */
    public static TransactionSet categorized(List<String> columns, List<TransactionRecord> records) {
        for (TransactionRecord record : records) {
            if (record.category() == null) {
                throw new IllegalArgumentException("Categorized sets cannot contain uncategorized records.");
            }
        }
        return new TransactionSet(PipelineStage.CATEGORIZED, columns, List.of(), records);
    }

    public PipelineStage stage() {
        return stage;
    }

    public List<String> columns() {
        return columns;
    }

    public List<RawRecord> rawRecords() {
        if (stage != PipelineStage.RAW) {
            throw new IllegalStateException("Raw rows are only kept for RAW record sets.");
        }
        return rawRecords;
    }

	/**
	 * @return typed records in ingestion order
	 * @throws PipelineStateException when the set has not been cleaned yet
	 */
    public List<TransactionRecord> records() {
        requireAtLeast(PipelineStage.CLEANED, "Reading typed records");
        return records;
    }

    public int size() {
        return stage == PipelineStage.RAW ? rawRecords.size() : records.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

	/**
	 * Guards the entry of a pipeline stage.
	 *
	 * @param required  minimum stage the caller accepts
	 * @param operation operation name used in the error message
	 * @throws PipelineStateException when this set is behind {@code required}
	 */
    public void requireAtLeast(PipelineStage required, String operation) {
        if (!stage.isAtLeast(required)) {
            throw new PipelineStateException(operation, required, stage);
        }
    }
}
