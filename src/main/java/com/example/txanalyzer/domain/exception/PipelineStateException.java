package com.example.txanalyzer.domain.exception;

import com.example.txanalyzer.domain.model.PipelineStage;

/**
 * Raised when a pipeline stage receives a record set that has not been through its prerequisite stage,
 * for example categorizing rows that were never cleaned.
 */
public class PipelineStateException extends DomainException {

    private final PipelineStage required;
    private final PipelineStage actual;

	/**
	 * Creates the exception describing the expected and the observed stage.
	 *
	 * @param operation name of the operation that was refused
	 * @param required  minimum stage the operation accepts
	 * @param actual    stage the record set is currently in
	 */
    public PipelineStateException(String operation, PipelineStage required, PipelineStage actual) {
        super(operation + " requires a " + required + " record set but received " + actual + ".");
        this.required = required;
        this.actual = actual;
    }

    public PipelineStage getRequired() {
        return required;
    }

    public PipelineStage getActual() {
        return actual;
    }
}
