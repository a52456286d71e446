package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base class for extractors of CycloneDX 1.6 style documents.
 *
 * <p>
 * Subclasses locate the component container of their tool's document shape; the field
 * mapping follows the shared CycloneDX {@code cryptoProperties} conventions. Nested
 * {@code components} are flattened depth first.
 */
public abstract class CycloneDxAssetExtractor implements AssetExtractor {

	private static final Logger logger = LoggerFactory.getLogger(CycloneDxAssetExtractor.class);

	private static final String CRYPTOGRAPHIC_ASSET = "cryptographic-asset";

	protected final JsonNodeUtils jsonNodeUtils;

	protected CycloneDxAssetExtractor(JsonNodeUtils jsonNodeUtils) {
		this.jsonNodeUtils = jsonNodeUtils;
	}

	/**
	 * Find the top-level component list of a document.
	 * @return the components, or empty if the document has no recognizable container
	 */
	protected abstract Optional<List<JsonNode>> locateComponents(JsonNode document);

	@Override
	public Extraction extract(JsonNode document) {
		Optional<List<JsonNode>> container = locateComponents(document);
		if (container.isEmpty()) {
			logger.debug("No component container found in {} document", family());
			return Extraction.noContainer();
		}

		List<JsonNode> components = new ArrayList<>();
		flatten(container.get(), components);

		List<Candidate> candidates = new ArrayList<>();
		int dropped = 0;
		int ignored = 0;
		for (JsonNode component : components) {
			if (!component.isObject()) {
				dropped++;
				continue;
			}
			if (!isCryptographic(component)) {
				ignored++;
				continue;
			}
			try {
				Optional<Candidate> candidate = toCandidate(component);
				if (candidate.isPresent()) {
					candidates.add(candidate.get());
				}
				else {
					dropped++;
				}
			}
			catch (RuntimeException e) {
				logger.debug("Dropping {} component that could not be read: {}", family(), e.getMessage());
				dropped++;
			}
		}
		return new Extraction(candidates, components.size(), dropped, ignored, true);
	}

	/**
	 * Whether a component describes a cryptographic asset.
	 */
	protected boolean isCryptographic(JsonNode component) {
		return component.has("cryptoProperties")
				|| jsonNodeUtils.getText(component, "type").filter(CRYPTOGRAPHIC_ASSET::equalsIgnoreCase).isPresent();
	}

	protected Optional<Candidate> toCandidate(JsonNode component) {
		Optional<String> name = name(component);
		if (name.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new Candidate(name.get(), primitive(component), keySize(component), location(component),
				confidence(component)));
	}

	protected Optional<String> name(JsonNode component) {
		return jsonNodeUtils.getText(component, "name")
			.or(() -> jsonNodeUtils.getText(component, "cryptoProperties", "algorithmProperties", "algorithm"))
			.or(() -> jsonNodeUtils.getText(component, "algorithm"));
	}

	protected @Nullable String primitive(JsonNode component) {
		Optional<String> primitive = jsonNodeUtils.getText(component, "cryptoProperties", "algorithmProperties",
				"primitive");
		if (primitive.isPresent()) {
			return primitive.get();
		}
		return jsonNodeUtils.getText(component, "cryptoProperties", "assetType")
			.filter(assetType -> !assetType.equalsIgnoreCase("algorithm"))
			.orElse(null);
	}

	protected @Nullable Integer keySize(JsonNode component) {
		return jsonNodeUtils.getLenientInt(component, "cryptoProperties", "algorithmProperties", "keySize")
			.or(() -> jsonNodeUtils.getLenientInt(component, "cryptoProperties", "algorithmProperties",
					"parameterSetIdentifier"))
			.or(() -> jsonNodeUtils.getLenientInt(component, "cryptoProperties", "relatedCryptoMaterialProperties",
					"size"))
			.or(() -> jsonNodeUtils.getLenientInt(component, "keySize"))
			.or(() -> jsonNodeUtils.getLenientInt(component, "key_size"))
			.orElse(null);
	}

	protected @Nullable String location(JsonNode component) {
		List<JsonNode> occurrences = jsonNodeUtils.getArray(component, "evidence", "occurrences");
		if (occurrences.isEmpty()) {
			return null;
		}
		JsonNode first = occurrences.get(0);
		Optional<String> location = jsonNodeUtils.getText(first, "location");
		if (location.isEmpty()) {
			return null;
		}
		return jsonNodeUtils.getLenientInt(first, "line")
			.map(line -> location.get() + ":" + line)
			.orElse(location.get());
	}

	protected @Nullable Double confidence(JsonNode component) {
		Optional<Double> confidence = jsonNodeUtils.getDouble(component, "evidence", "identity", "confidence");
		if (confidence.isEmpty()) {
			List<JsonNode> identities = jsonNodeUtils.getArray(component, "evidence", "identity");
			if (!identities.isEmpty()) {
				confidence = jsonNodeUtils.getDouble(identities.get(0), "confidence");
			}
		}
		return confidence.or(() -> jsonNodeUtils.getDouble(component, "confidence")).orElse(null);
	}

	private void flatten(List<JsonNode> components, List<JsonNode> into) {
		for (JsonNode component : components) {
			into.add(component);
			List<JsonNode> nested = jsonNodeUtils.getArray(component, "components");
			if (!nested.isEmpty()) {
				flatten(nested, into);
			}
		}
	}

}
