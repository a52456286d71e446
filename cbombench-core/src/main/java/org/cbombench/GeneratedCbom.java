package org.cbombench;

/**
 * Raw output of one successful adapter call.
 *
 * <p>
 * The document is kept as text: parsing happens at the orchestrator boundary so that
 * unusable output is recorded instead of lost.
 *
 * @param document document text as returned by the tool
 * @param durationSeconds time the tool spent generating the document
 */
public record GeneratedCbom(String document, double durationSeconds) {
}
