package vfa;

import java.util.Map;

/**
 * Utilities for TTY formatting.
 */
public class Tty {
	/** Whether standard output is a TTY. */
	public static final boolean IS_A_TTY = System.console() != null;

	private static final Map<String, String> COLORS = Map.ofEntries(
		Map.entry("<b>", "\033[1m"),
		Map.entry("</b>", "\033[22m"),

		Map.entry("<i>", "\033[3m"),
		Map.entry("</i>", "\033[23m"),

		Map.entry("<fg=red>", "\033[31m"),
		Map.entry("<fg=yellow>", "\033[33m"),
		Map.entry("<fg=cyan>", "\033[36m"),
		Map.entry("<fg=gray>", "\033[90m"),
		Map.entry("</fg>", "\033[39m")
	);

	private Tty() {
	}

	/**
	 * @return The format string with markup tags replaced by escape codes, or
	 *         stripped if output is not a TTY.
	 */
	public static String format(String format, Object... args) {
		for (var color : COLORS.entrySet()) {
			var key = color.getKey();
			var value = IS_A_TTY ? color.getValue() : "";
			format = format.replace(key, value);
		}
		return String.format(format, args);
	}

	public static void print(String format, Object... args) {
		System.out.print(format(format, args));
	}
}
