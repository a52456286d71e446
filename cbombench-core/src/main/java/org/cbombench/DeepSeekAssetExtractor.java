package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Extracts assets from language-model output. The model is asked for CycloneDX but its
 * field naming drifts, so components are also accepted when they only carry flat
 * {@code algorithm} or {@code primitive} fields, and a bare array of components is
 * treated as the component list.
 */
public class DeepSeekAssetExtractor extends CycloneDxAssetExtractor {

	public DeepSeekAssetExtractor(JsonNodeUtils jsonNodeUtils) {
		super(jsonNodeUtils);
	}

	@Override
	public ToolFamily family() {
		return ToolFamily.DEEPSEEK;
	}

	@Override
	protected Optional<List<JsonNode>> locateComponents(JsonNode document) {
		if (document.isArray()) {
			return Optional.of(jsonNodeUtils.getArray(document));
		}
		if (document.path("components").isArray()) {
			return Optional.of(jsonNodeUtils.getArray(document, "components"));
		}
		return Optional.empty();
	}

	@Override
	protected boolean isCryptographic(JsonNode component) {
		return super.isCryptographic(component) || component.has("algorithm") || component.has("primitive");
	}

	@Override
	protected @Nullable String primitive(JsonNode component) {
		String primitive = super.primitive(component);
		return primitive != null ? primitive : jsonNodeUtils.getText(component, "primitive").orElse(null);
	}

}
