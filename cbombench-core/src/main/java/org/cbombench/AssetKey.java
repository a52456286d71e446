package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.util.Comparator;

/**
 * Canonical identity of an {@link Asset}: lower-cased, alias-resolved algorithm family,
 * primitive kind and optional key size.
 *
 * <p>
 * An absent key size is a state of its own: {@code rsa/pke} and {@code rsa/pke/2048} are
 * different keys.
 *
 * @param algorithmFamily canonical algorithm family, e.g. {@code aes}
 * @param primitiveKind canonical primitive, e.g. {@code block-cipher}
 * @param keySize key size in bits, if known
 */
public record AssetKey(String algorithmFamily, String primitiveKind,
		@Nullable Integer keySize) implements Comparable<AssetKey> {

	private static final Comparator<AssetKey> ORDER = Comparator.comparing(AssetKey::algorithmFamily)
		.thenComparing(AssetKey::primitiveKind)
		.thenComparing(AssetKey::keySize, Comparator.nullsFirst(Comparator.naturalOrder()));

	public AssetKey {
		if (algorithmFamily.isBlank()) {
			throw new IllegalArgumentException("Algorithm family must not be blank");
		}
		if (primitiveKind.isBlank()) {
			throw new IllegalArgumentException("Primitive kind must not be blank");
		}
		if (keySize != null && keySize <= 0) {
			throw new IllegalArgumentException("Key size must be positive: " + keySize);
		}
	}

	@Override
	public int compareTo(AssetKey other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return algorithmFamily + "/" + primitiveKind + (keySize != null ? "/" + keySize : "");
	}

}
