package org.cbombench;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves credentials and settings from a {@code .env} file or the process environment.
 * The {@code .env} files are loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	public static final String DEEPSEEK_API_KEY = "DEEPSEEK_API_KEY";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

	/**
	 * Get a variable that a component cannot work without.
	 * @param name the variable name
	 * @param purpose what the value is needed for, used in the error message
	 * @return the value
	 * @throws IllegalStateException if the variable is not set
	 */
	public static String require(String name, String purpose) {
		String value = get(name);
		if (value == null) {
			throw new IllegalStateException(name + " environment variable is required " + purpose
					+ ". Set it in the environment or in a .env file: export " + name + "=...");
		}
		return value;
	}

}
