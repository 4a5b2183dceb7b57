package vfa.util;

import vfa.VfaConfig;

import com.google.common.base.Throwables;

import java.util.Locale;

/**
 * Simple logging class with formatting support.
 */
public final class Log {
	/**
	 * Available log levels.
	 */
	public enum Level {
		TRACE,
		DEBUG,
		INFO,
		WARN,
		ERROR;

		/**
		 * @return Whether this log level is enabled.
		 */
		public boolean isEnabled() {
			return LOGGER.isEnabled(this);
		}
	}

	/** The current log level (from $VFA_LOG_LEVEL). */
	public static final Level LEVEL = parseLevel(VfaConfig.LOG_LEVEL);

	private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
	private static final TtyLogger LOGGER = new TtyLogger(System.out, LEVEL);

	private Log() {
	}

	/**
	 * Parse a level name, falling back to INFO for unknown names.
	 */
	static Level parseLevel(String level) {
		try {
			return Level.valueOf(level.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			System.err.format("Unknown log level '%s', using INFO: %s%n", level, e.getMessage());
			return Level.INFO;
		}
	}

	private static String getMessage(Throwable e) {
		return Throwables.getRootCause(e).getMessage();
	}

	public static void trace(String format, Object... args) {
		if (Level.TRACE.isEnabled()) {
			LOGGER.log(Level.TRACE, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void trace(Throwable e) {
		LOGGER.log(Level.TRACE, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void debug(String format, Object... args) {
		if (Level.DEBUG.isEnabled()) {
			LOGGER.log(Level.DEBUG, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void debug(Throwable e) {
		LOGGER.log(Level.DEBUG, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void info(String format, Object... args) {
		LOGGER.log(Level.INFO, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void info(Throwable e) {
		LOGGER.log(Level.INFO, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void warn(String format, Object... args) {
		LOGGER.log(Level.WARN, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void warn(Throwable e) {
		LOGGER.log(Level.WARN, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void error(String format, Object... args) {
		LOGGER.log(Level.ERROR, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void error(Throwable e) {
		LOGGER.log(Level.ERROR, WALKER.getCallerClass(), getMessage(e), e);
	}
}
