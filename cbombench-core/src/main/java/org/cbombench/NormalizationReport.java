package org.cbombench;

/**
 * Accounting of one normalization pass, so that loss is visible rather than silent.
 *
 * @param entriesSeen entries found in the document's asset container
 * @param extracted entries that became assets before de-duplication
 * @param dropped cryptographic entries that failed required-field extraction
 * @param ignored entries that are not cryptographic assets (libraries, files)
 * @param duplicatesMerged extracted entries merged into an asset with the same key
 * @param containerFound whether the document had a recognizable asset container
 */
public record NormalizationReport(int entriesSeen, int extracted, int dropped, int ignored, int duplicatesMerged,
		boolean containerFound) {

	public static final NormalizationReport NONE = new NormalizationReport(0, 0, 0, 0, 0, false);

}
