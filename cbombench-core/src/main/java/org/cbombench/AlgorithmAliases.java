package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed alias table that resolves the naming variance between tools.
 *
 * <p>
 * {@code AES128}, {@code aes-128} and {@code AES} with a separate key size of 128 all
 * resolve to family {@code aes}; {@code SHA256} and {@code SHA-256} both resolve to
 * {@code sha-256}; curve names resolve to {@code ec} plus the curve size. Java cipher
 * transformations such as {@code AES/GCM/NoPadding} resolve on their algorithm segment.
 * Names that cannot be resolved pass through lower-cased and are flagged as unrecognized.
 */
public final class AlgorithmAliases {

	/** Primitive used when neither the tool nor the alias table supplies one. */
	public static final String UNKNOWN_PRIMITIVE = "unknown";

	private static final Pattern SIZED_NAME = Pattern.compile("^([a-z][a-z0-9]*?[a-z])[-_ ]?(\\d{2,5})$");

	private static final Pattern SEPARATORS = Pattern.compile("[-_ ]+");

	private static final Pattern DIGITS = Pattern.compile("\\d{2,5}");

	private static final Map<String, Family> FAMILIES = new HashMap<>();

	private static final Map<String, Integer> CURVES = new HashMap<>();

	private static final Map<String, String> PRIMITIVES = new HashMap<>();

	static {
		family("aes", "block-cipher", true, "aes", "rijndael");
		family("des", "block-cipher", true, "des");
		family("3des", "block-cipher", true, "3des", "desede", "tripledes", "triple-des", "tdea", "des-ede3");
		family("blowfish", "block-cipher", true, "blowfish");
		family("twofish", "block-cipher", true, "twofish");
		family("camellia", "block-cipher", true, "camellia");
		family("idea", "block-cipher", true, "idea");
		family("rc2", "block-cipher", true, "rc2");
		family("rc4", "stream-cipher", true, "rc4", "arcfour");
		family("chacha20", "stream-cipher", true, "chacha20", "chacha");
		family("chacha20-poly1305", "ae", true, "chacha20-poly1305", "chacha20poly1305");
		family("rsa", "pke", true, "rsa");
		family("rsa", "signature", true, "sha1withrsa", "sha256withrsa", "sha384withrsa", "sha512withrsa", "rsassa-pss");
		family("dsa", "signature", true, "dsa");
		family("ecdsa", "signature", true, "ecdsa", "sha256withecdsa");
		family("ed25519", "signature", false, "ed25519", "eddsa");
		family("ed448", "signature", false, "ed448");
		family("ec", null, true, "ec", "ecc", "elliptic-curve");
		family("ecdh", "key-agree", true, "ecdh");
		family("dh", "key-agree", true, "dh", "diffie-hellman", "diffiehellman");
		family("x25519", "key-agree", false, "x25519");
		family("x448", "key-agree", false, "x448");
		family("md2", "hash", false, "md2");
		family("md4", "hash", false, "md4");
		family("md5", "hash", false, "md5");
		family("sha-1", "hash", false, "sha-1", "sha1");
		family("sha-224", "hash", false, "sha-224", "sha224");
		family("sha-256", "hash", false, "sha-256", "sha256");
		family("sha-384", "hash", false, "sha-384", "sha384");
		family("sha-512", "hash", false, "sha-512", "sha512");
		family("sha3-256", "hash", false, "sha3-256", "sha3256");
		family("sha3-384", "hash", false, "sha3-384", "sha3384");
		family("sha3-512", "hash", false, "sha3-512", "sha3512");
		family("ripemd160", "hash", false, "ripemd160", "ripemd-160");
		family("blake2b", "hash", false, "blake2b");
		family("hmac-sha-1", "mac", false, "hmac-sha-1", "hmacsha1", "hmac-sha1");
		family("hmac-sha-256", "mac", false, "hmac-sha-256", "hmacsha256", "hmac-sha256");
		family("hmac-sha-384", "mac", false, "hmac-sha-384", "hmacsha384", "hmac-sha384");
		family("hmac-sha-512", "mac", false, "hmac-sha-512", "hmacsha512", "hmac-sha512");
		family("hmac-md5", "mac", false, "hmac-md5", "hmacmd5");
		family("hmac", "mac", false, "hmac");
		family("pbkdf2", "kdf", false, "pbkdf2", "pbkdf2withhmacsha256", "pbkdf2withhmacsha1");
		family("hkdf", "kdf", false, "hkdf");
		family("bcrypt", "kdf", false, "bcrypt");
		family("scrypt", "kdf", false, "scrypt");
		family("argon2", "kdf", false, "argon2", "argon2id");
		family("sha1prng", "drbg", false, "sha1prng");
		family("tls", "protocol", false, "tls", "ssl");
		family("x509", "certificate", false, "x509", "x.509");

		curve(256, "secp256r1", "prime256v1", "p-256", "p256", "nist-p-256", "secp256k1");
		curve(384, "secp384r1", "p-384", "p384", "nist-p-384");
		curve(521, "secp521r1", "p-521", "p521", "nist-p-521");
		curve(224, "secp224r1", "p-224", "p224");

		primitive("block-cipher", "block-cipher", "blockcipher", "block cipher", "block");
		primitive("stream-cipher", "stream-cipher", "streamcipher", "stream cipher");
		primitive("ae", "ae", "aead", "authenticated-encryption", "authenticated encryption");
		primitive("pke", "pke", "public-key-encryption", "public key encryption", "asymmetric", "asymmetric-cipher");
		primitive("signature", "signature", "sign", "digital-signature", "digital signature");
		primitive("hash", "hash", "digest", "message-digest", "message digest", "hash-function");
		primitive("mac", "mac", "hmac", "message-authentication-code");
		primitive("kdf", "kdf", "key-derivation", "key derivation", "password-hash");
		primitive("key-agree", "key-agree", "keyagree", "key-agreement", "key agreement", "key-exchange");
		primitive("kem", "kem", "key-encapsulation");
		primitive("drbg", "drbg", "prng", "rng", "random", "csprng");
		primitive("xof", "xof");
		primitive("combiner", "combiner");
		primitive("certificate", "certificate", "cert");
		primitive("protocol", "protocol");
		primitive("related-crypto-material", "related-crypto-material", "key", "secret-key", "public-key",
				"private-key");
		primitive("other", "other");
	}

	private AlgorithmAliases() {
	}

	/**
	 * Resolve an algorithm name as written by a tool.
	 * @param name algorithm name, e.g. {@code RSA-2048} or {@code AES/GCM/NoPadding}
	 * @return the resolution, never {@code null}
	 */
	public static Resolution resolve(String name) {
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		int slash = normalized.indexOf('/');
		String algorithm = (slash > 0 ? normalized.substring(0, slash) : normalized).trim();

		Resolution direct = lookup(algorithm);
		if (direct != null) {
			return direct;
		}

		String[] tokens = SEPARATORS.split(algorithm);
		if (tokens.length > 1) {
			Resolution head = lookup(tokens[0]);
			if (head != null) {
				return head.keySize() != null || !head.sized() ? head : head.withKeySize(firstSize(tokens));
			}
		}

		return new Resolution(algorithm, null, null, false, false);
	}

	/**
	 * Canonical form of a tool-supplied primitive name.
	 * @param primitive primitive as written by a tool
	 * @return the canonical primitive, or the lower-cased input if it is not in the table
	 */
	public static String canonicalPrimitive(String primitive) {
		String normalized = primitive.trim().toLowerCase(Locale.ROOT);
		String canonical = PRIMITIVES.get(normalized);
		return canonical != null ? canonical : SEPARATORS.matcher(normalized).replaceAll("-");
	}

	private static @Nullable Resolution lookup(String algorithm) {
		Integer curveSize = CURVES.get(algorithm);
		if (curveSize != null) {
			return new Resolution("ec", curveSize, null, true, true);
		}

		Family family = FAMILIES.get(algorithm);
		if (family != null) {
			return new Resolution(family.canonical, null, family.primitive, true, family.sized);
		}

		Matcher matcher = SIZED_NAME.matcher(algorithm);
		if (matcher.matches()) {
			Family base = FAMILIES.get(matcher.group(1));
			if (base != null && base.sized) {
				return new Resolution(base.canonical, Integer.parseInt(matcher.group(2)), base.primitive, true, true);
			}
		}
		return null;
	}

	private static @Nullable Integer firstSize(String[] tokens) {
		for (int i = 1; i < tokens.length; i++) {
			if (DIGITS.matcher(tokens[i]).matches()) {
				return Integer.parseInt(tokens[i]);
			}
		}
		return null;
	}

	private static void family(String canonical, @Nullable String primitive, boolean sized, String... aliases) {
		Family family = new Family(canonical, primitive, sized);
		for (String alias : aliases) {
			FAMILIES.put(alias, family);
		}
	}

	private static void curve(int size, String... names) {
		for (String name : names) {
			CURVES.put(name, size);
		}
	}

	private static void primitive(String canonical, String... aliases) {
		for (String alias : aliases) {
			PRIMITIVES.put(alias, canonical);
		}
	}

	private record Family(String canonical, @Nullable String primitive, boolean sized) {
	}

	/**
	 * Result of resolving an algorithm name.
	 *
	 * @param algorithmFamily canonical family, or the lower-cased name when unrecognized
	 * @param keySize key size embedded in the name, if any
	 * @param defaultPrimitive primitive implied by the family, if any
	 * @param recognized whether the name was found in the table
	 * @param sized whether key sizes are meaningful for the family
	 */
	public record Resolution(String algorithmFamily, @Nullable Integer keySize, @Nullable String defaultPrimitive,
			boolean recognized, boolean sized) {

		Resolution withKeySize(@Nullable Integer size) {
			return new Resolution(algorithmFamily, size, defaultPrimitive, recognized, sized);
		}

	}

}
