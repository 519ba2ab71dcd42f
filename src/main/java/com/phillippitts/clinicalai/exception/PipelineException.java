package com.phillippitts.clinicalai.exception;

/**
 * Thrown when a pipeline run cannot produce a well-formed result at all.
 * Halted runs and individual step errors are not exceptions; they are reported in the result.
 */
public class PipelineException extends ClinicalAiException {

    private final String pipelineId;

    public PipelineException(String message, String pipelineId, Throwable cause) {
        super(message + " (pipeline: " + pipelineId + ")", cause);
        this.pipelineId = pipelineId;
    }

    public String getPipelineId() {
        return pipelineId;
    }
}
