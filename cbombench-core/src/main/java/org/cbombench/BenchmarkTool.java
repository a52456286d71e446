package org.cbombench;

/**
 * A tool taking part in a benchmark: the id under which its results are recorded, the
 * family that decides how its documents are normalized, and the adapter that runs it.
 *
 * @param toolId stable tool id used in run, comparison and metric records
 * @param family tool family, selects the extraction strategy
 * @param adapter adapter invoking the tool
 */
public record BenchmarkTool(String toolId, ToolFamily family, CbomAdapter adapter) {

	public BenchmarkTool {
		if (toolId.isBlank()) {
			throw new IllegalArgumentException("Tool id must not be blank");
		}
	}

	/**
	 * Create a tool recorded under the family's default id.
	 */
	public static BenchmarkTool of(ToolFamily family, CbomAdapter adapter) {
		return new BenchmarkTool(family.defaultToolId(), family, adapter);
	}

}
