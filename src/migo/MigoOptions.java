package migo;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

// Options controlling how a Program is simplified and emitted.
//
// All fields are optional in the JSON configuration; a missing field takes
// its default value. A field holding a value of the wrong type is an error,
// reported as a MigoOptionException.
public class MigoOptions {
	public static final String ROOT_FIELD = "root";
	public static final String EXCLUDED_PREFIXES_FIELD = "excludedPrefixes";
	public static final String SIMPLIFY_FIELD = "simplify";
	public static final String LOGGING_FIELD = "logging";

	// parent of every logger in the library, carrying the configured level
	public static final String LOGGER_NAME = "migo";

	private static final Logger libraryLogger = Logger.getLogger(LOGGER_NAME);
	private static final ConsoleHandler consoleHandler = new ConsoleHandler();

	static {
		consoleHandler.setLevel(Level.ALL);
		libraryLogger.addHandler(consoleHandler);
		libraryLogger.setUseParentHandlers(false);
	}

	public static final String LOGGING_QUIET = "quiet";
	public static final String LOGGING_NORMAL = "normal";
	public static final String LOGGING_VERBOSE = "verbose";

	// entry point of programs extracted from Go sources
	public static final String DEFAULT_ROOT = "\"main\".main";

	// runtime and library internals that mean nothing to the model checker
	public static final List<String> DEFAULT_EXCLUDED_PREFIXES = Collections.unmodifiableList(
			Arrays.asList("os", "syscall", "internal_poll", "sync.o"));

	private final String root;
	private final List<String> excludedPrefixes;
	private final boolean simplify;
	private final String logging;

	private MigoOptions(String root, List<String> excludedPrefixes, boolean simplify, String logging) {
		this.root = root;
		this.excludedPrefixes = excludedPrefixes;
		this.simplify = simplify;
		this.logging = logging;
	}

	public static MigoOptions defaults() {
		return new MigoOptions(DEFAULT_ROOT, DEFAULT_EXCLUDED_PREFIXES, true, LOGGING_NORMAL);
	}

	public static MigoOptions fromFile(Path configFile) throws MigoOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(configFile.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new MigoOptionException("Error reading configuration file: " + e.getMessage(), e);
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new MigoOptionException(configFile + ": parsing error: " + e.getMessage(), e);
		}
		return fromJSON(config);
	}

	public static MigoOptions fromJSON(JSONObject config) throws MigoOptionException {
		try {
			String root = config.has(ROOT_FIELD) ? config.getString(ROOT_FIELD) : DEFAULT_ROOT;
			if (root.isEmpty()) {
				throw new MigoOptionException("root function name must not be empty");
			}

			List<String> excludedPrefixes = DEFAULT_EXCLUDED_PREFIXES;
			if (config.has(EXCLUDED_PREFIXES_FIELD)) {
				JSONArray prefixes = config.getJSONArray(EXCLUDED_PREFIXES_FIELD);
				List<String> parsed = new ArrayList<>();
				for (int i = 0; i < prefixes.length(); i++) {
					parsed.add(prefixes.getString(i));
				}
				excludedPrefixes = Collections.unmodifiableList(parsed);
			}

			boolean simplify = !config.has(SIMPLIFY_FIELD) || config.getBoolean(SIMPLIFY_FIELD);

			String logging = config.has(LOGGING_FIELD) ? config.getString(LOGGING_FIELD) : LOGGING_NORMAL;
			switch (logging) {
				case LOGGING_QUIET:
				case LOGGING_NORMAL:
				case LOGGING_VERBOSE:
					break;
				default:
					throw new MigoOptionException("unknown logging level " + logging);
			}

			return new MigoOptions(root, excludedPrefixes, simplify, logging);
		} catch (JSONException e) {
			throw new MigoOptionException("invalid configuration: " + e.getMessage(), e);
		}
	}

	public String getRoot() {
		return root;
	}

	public List<String> getExcludedPrefixes() {
		return excludedPrefixes;
	}

	public boolean shouldSimplify() {
		return simplify;
	}

	public String getLogging() {
		return logging;
	}

	public Level getLogLevel() {
		switch (logging) {
			case LOGGING_QUIET:
				return Level.WARNING;
			case LOGGING_VERBOSE:
				return Level.FINE;
			default:
				return Level.INFO;
		}
	}

	/**
	 * Applies the logging level to the library logger, and so to every
	 * logger named below it.
	 */
	public void configure() {
		libraryLogger.setLevel(getLogLevel());
	}
}
