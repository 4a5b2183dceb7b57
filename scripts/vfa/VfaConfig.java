package vfa;

/**
 * Analysis configuration.
 */
public class VfaConfig {
	/** Minimum level of log messages to print. */
	public static final String LOG_LEVEL = stringEnv("VFA_LOG_LEVEL", "INFO");

	/**
	 * Get a string value from the environment.
	 */
	private static String stringEnv(String var, String def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return value;
		} else {
			return def;
		}
	}
}
