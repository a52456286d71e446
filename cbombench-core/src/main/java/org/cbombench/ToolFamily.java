package org.cbombench;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of supported CBOM tool families.
 *
 * <p>
 * Each family has exactly one {@link CbomAdapter} implementation and one
 * {@link AssetExtractor} that knows the shape of the documents it produces. Supporting a
 * new tool means adding a constant here, an adapter and an extractor; existing families
 * are left untouched.
 */
public enum ToolFamily {

	/** Containerized scanner driven over a WebSocket. */
	CBOMKIT,

	/** Command-line generator run against a local clone. */
	CDXGEN,

	/** Language-model based generator behind a chat-completions API. */
	DEEPSEEK;

	/**
	 * Default tool id used in records for this family.
	 */
	public String defaultToolId() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Look up a family by name, ignoring case.
	 * @param name tool name such as {@code "cbomkit"}
	 * @return the family, or empty if the name is not a supported tool
	 */
	public static Optional<ToolFamily> fromName(String name) {
		for (ToolFamily family : values()) {
			if (family.name().equalsIgnoreCase(name.trim())) {
				return Optional.of(family);
			}
		}
		return Optional.empty();
	}

}
