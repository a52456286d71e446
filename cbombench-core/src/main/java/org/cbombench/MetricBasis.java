package org.cbombench;

/**
 * What a comparison or metric value is measured against. No ground-truth CBOM exists, so
 * every value is agreement between tools, never precision or recall.
 */
public enum MetricBasis {

	CROSS_TOOL_AGREEMENT

}
