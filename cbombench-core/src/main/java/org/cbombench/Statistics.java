package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;

/**
 * Descriptive statistics over small samples. Every method returns {@code null} when the
 * sample is too small for the statistic to be defined.
 */
final class Statistics {

	private Statistics() {
	}

	static @Nullable Double mean(Collection<Double> values) {
		if (values.isEmpty()) {
			return null;
		}
		double sum = 0;
		for (double value : values) {
			sum += value;
		}
		return sum / values.size();
	}

	static @Nullable Double median(Collection<Double> values) {
		if (values.isEmpty()) {
			return null;
		}
		double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
		Arrays.sort(sorted);
		int middle = sorted.length / 2;
		return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2;
	}

	/**
	 * Sample standard deviation (n - 1 denominator).
	 */
	static @Nullable Double standardDeviation(Collection<Double> values) {
		if (values.size() < 2) {
			return null;
		}
		Double mean = mean(values);
		double squares = 0;
		for (double value : values) {
			squares += (value - mean) * (value - mean);
		}
		return Math.sqrt(squares / (values.size() - 1));
	}

}
