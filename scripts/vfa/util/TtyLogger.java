package vfa.util;

import vfa.Tty;
import vfa.util.Log.Level;

import com.google.common.base.Throwables;

import java.io.PrintStream;

/**
 * Logging backend with colors.
 */
public final class TtyLogger {
	private final PrintStream out;
	private final Level threshold;

	TtyLogger(PrintStream out, Level threshold) {
		this.out = out;
		this.threshold = threshold;
	}

	private void print(String format, Object... args) {
		this.out.print(Tty.format(format, args));
	}

	private void header(Level level, String tag, String line) {
		switch (level) {
		case INFO:
			print("<fg=cyan><b>%-5s</b> <i>%-20s</i></fg> %s\n", level, tag, line);
			break;
		case WARN:
			print("<fg=yellow><b>%-5s</b> <i>%-20s</i> <b>%s</b></fg>\n", level, tag, line);
			break;
		case ERROR:
			print("<fg=red><b>%-5s</b> <i>%-20s</i> <b>%s</b></fg>\n", level, tag, line);
			break;
		default:
			print("<fg=gray><b>%-5s</b> <i>%-20s</i> %s</fg>\n", level, tag, line);
			break;
		}
	}

	private void trailer(Level level, String line) {
		switch (level) {
		case INFO:
			print("%s\n", line);
			break;
		case WARN:
			print("<fg=yellow><b>%s</b></fg>\n", line);
			break;
		case ERROR:
			print("<fg=red><b>%s</b></fg>\n", line);
			break;
		default:
			print("<fg=gray>%s</fg>\n", line);
			break;
		}
	}

	private void stackTrace(Level level, String line) {
		switch (level) {
		case WARN:
			print("<fg=yellow>%s</fg>\n", line);
			break;
		case ERROR:
			print("<fg=red>%s</fg>\n", line);
			break;
		default:
			print("<fg=gray>%s</fg>\n", line);
			break;
		}
	}

	/**
	 * @return Whether messages at the given level are printed.
	 */
	public boolean isEnabled(Level level) {
		return level.compareTo(this.threshold) >= 0;
	}

	void log(Level level, Object src, Object msg, Throwable e) {
		if (!isEnabled(level)) {
			return;
		}

		// Avoid interleaved lines
		synchronized (this) {
			String tag;
			if (src instanceof String s) {
				tag = s;
			} else if (src instanceof Class<?> c) {
				tag = c.getSimpleName();
			} else {
				tag = src.getClass().getSimpleName();
			}

			var str = String.valueOf(msg);
			if (str.contains("\n")) {
				header(level, tag, "");
				str.lines()
					.forEach(line -> trailer(level, line));
			} else {
				header(level, tag, str);
			}

			if (e != null) {
				Throwables.getStackTraceAsString(e)
					.lines()
					.forEach(line -> stackTrace(level, line));
			}
		}
	}
}
