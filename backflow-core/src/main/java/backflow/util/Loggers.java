/*
 * Copyright (c) 2024-Present VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package backflow.util;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;

import backflow.util.annotation.Nullable;

/**
 * Expose static methods to get a logger depending on the environment. If SLF4J is on the
 * classpath it is used. Otherwise the {@value #FALLBACK_PROPERTY} system property picks
 * between a {@link java.util.logging} logger ({@code "JDK"}) and a console one (any
 * other value, the default).
 * <p>
 * The implementation can also be forced with the {@code useXXX} methods, which is mostly
 * useful in tests.
 */
public abstract class Loggers {

	/**
	 * The system property that determines which fallback implementation to use for
	 * loggers when SLF4J isn't available.
	 */
	public static final String FALLBACK_PROPERTY = "backflow.logging.fallback";

	private static Function<String, ? extends Logger> LOGGER_FACTORY;

	static {
		resetLoggerFactory();
	}

	/**
	 * Reset the logger factory to the one picked by looking at the classpath and the
	 * {@value #FALLBACK_PROPERTY} system property.
	 */
	public static void resetLoggerFactory() {
		try {
			useSl4jLoggers();
		}
		catch (Throwable t) {
			if (isFallbackToJdk()) {
				useJdkLoggers();
			}
			else {
				useConsoleLoggers();
			}
		}
	}

	static boolean isFallbackToJdk() {
		return "JDK".equalsIgnoreCase(System.getProperty(FALLBACK_PROPERTY));
	}

	/**
	 * Force the usage of console loggers that write INFO and below to {@link System#out}
	 * and WARN and above to {@link System#err}. DEBUG and TRACE are discarded.
	 */
	public static void useConsoleLoggers() {
		LOGGER_FACTORY = name -> new ConsoleLogger(name, false);
		LOGGER_FACTORY.apply(Loggers.class.getName()).debug("Using Console logging");
	}

	/**
	 * Same as {@link #useConsoleLoggers()} but also logs DEBUG and TRACE.
	 */
	public static void useVerboseConsoleLoggers() {
		LOGGER_FACTORY = name -> new ConsoleLogger(name, true);
		LOGGER_FACTORY.apply(Loggers.class.getName()).debug("Using Verbose Console logging");
	}

	/**
	 * Use a custom type of {@link Logger} created through the provided {@link Function},
	 * which takes a logger name as input.
	 *
	 * @param loggerFactory the {@link Function} that provides a (possibly cached) {@link Logger}
	 * given a name.
	 */
	public static void useCustomLoggers(final Function<String, ? extends Logger> loggerFactory) {
		LOGGER_FACTORY = Objects.requireNonNull(loggerFactory, "loggerFactory");
		LOGGER_FACTORY.apply(Loggers.class.getName()).debug("Using custom logging");
	}

	/**
	 * Force the usage of JDK-based loggers, even if SLF4J is available on the classpath.
	 */
	public static void useJdkLoggers() {
		LOGGER_FACTORY = JdkLogger::new;
		LOGGER_FACTORY.apply(Loggers.class.getName()).debug("Using JDK logging framework");
	}

	/**
	 * Force the usage of SLF4J-based loggers, throwing an exception if SLF4J isn't
	 * available on the classpath.
	 */
	public static void useSl4jLoggers() {
		Function<String, Logger> factory = new Slf4JLoggerFactory();
		factory.apply(Loggers.class.getName()).debug("Using Slf4j logging framework");
		LOGGER_FACTORY = factory;
	}

	/**
	 * Get a {@link Logger}.
	 *
	 * @param name the category or logger name to use
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(String name) {
		return LOGGER_FACTORY.apply(name);
	}

	/**
	 * Get a {@link Logger} named after the given class.
	 *
	 * @param cls the source {@link Class} to derive the logger name from
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(Class<?> cls) {
		return getLogger(cls.getName());
	}

	/**
	 * Substitute each {@code {}} placeholder of the format with the matching argument.
	 * A trailing {@link Throwable} argument that has no placeholder is returned through
	 * the second slot of the result.
	 */
	static Object[] format(@Nullable String format, @Nullable Object... arguments) {
		if (format == null) {
			return new Object[]{"null", null};
		}
		if (arguments == null || arguments.length == 0) {
			return new Object[]{format, null};
		}
		StringBuilder sb = new StringBuilder(format.length() + 16);
		int from = 0;
		int argIndex = 0;
		int placeholder;
		while (argIndex < arguments.length && (placeholder = format.indexOf("{}", from)) >= 0) {
			sb.append(format, from, placeholder)
			  .append(arguments[argIndex++]);
			from = placeholder + 2;
		}
		sb.append(format.substring(from));
		Throwable trailing = null;
		if (argIndex < arguments.length && arguments[arguments.length - 1] instanceof Throwable) {
			trailing = (Throwable) arguments[arguments.length - 1];
		}
		return new Object[]{sb.toString(), trailing};
	}

	private static final class Slf4JLoggerFactory implements Function<String, Logger> {

		@Override
		public Logger apply(String name) {
			return new Slf4JLogger(org.slf4j.LoggerFactory.getLogger(name));
		}
	}

	/**
	 * Delegates every call to an SLF4J logger, which already understands the
	 * {@code {}} placeholder syntax.
	 */
	static final class Slf4JLogger implements Logger {

		private final org.slf4j.Logger logger;

		Slf4JLogger(org.slf4j.Logger logger) {
			this.logger = logger;
		}

		@Override
		public String getName() {
			return logger.getName();
		}

		@Override
		public boolean isTraceEnabled() {
			return logger.isTraceEnabled();
		}

		@Override
		public void trace(String msg) {
			logger.trace(msg);
		}

		@Override
		public void trace(String format, Object... arguments) {
			logger.trace(format, arguments);
		}

		@Override
		public void trace(String msg, Throwable t) {
			logger.trace(msg, t);
		}

		@Override
		public boolean isDebugEnabled() {
			return logger.isDebugEnabled();
		}

		@Override
		public void debug(String msg) {
			logger.debug(msg);
		}

		@Override
		public void debug(String format, Object... arguments) {
			logger.debug(format, arguments);
		}

		@Override
		public void debug(String msg, Throwable t) {
			logger.debug(msg, t);
		}

		@Override
		public boolean isInfoEnabled() {
			return logger.isInfoEnabled();
		}

		@Override
		public void info(String msg) {
			logger.info(msg);
		}

		@Override
		public void info(String format, Object... arguments) {
			logger.info(format, arguments);
		}

		@Override
		public void info(String msg, Throwable t) {
			logger.info(msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return logger.isWarnEnabled();
		}

		@Override
		public void warn(String msg) {
			logger.warn(msg);
		}

		@Override
		public void warn(String format, Object... arguments) {
			logger.warn(format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logger.warn(msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return logger.isErrorEnabled();
		}

		@Override
		public void error(String msg) {
			logger.error(msg);
		}

		@Override
		public void error(String format, Object... arguments) {
			logger.error(format, arguments);
		}

		@Override
		public void error(String msg, Throwable t) {
			logger.error(msg, t);
		}
	}

	/**
	 * Base for the fallback loggers: every level funnels into a single
	 * {@link #log(Level, String, Throwable)} call once the format has been resolved.
	 */
	abstract static class FormattingLogger implements Logger {

		final String name;

		FormattingLogger(String name) {
			this.name = name;
		}

		abstract boolean isEnabled(Level level);

		abstract void log(Level level, String message, @Nullable Throwable t);

		private void logFormatted(Level level, String format, Object... arguments) {
			if (isEnabled(level)) {
				Object[] resolved = format(format, arguments);
				log(level, (String) resolved[0], (Throwable) resolved[1]);
			}
		}

		private void logPlain(Level level, String msg, @Nullable Throwable t) {
			if (isEnabled(level)) {
				log(level, msg, t);
			}
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public boolean isTraceEnabled() {
			return isEnabled(Level.FINEST);
		}

		@Override
		public void trace(String msg) {
			logPlain(Level.FINEST, msg, null);
		}

		@Override
		public void trace(String format, Object... arguments) {
			logFormatted(Level.FINEST, format, arguments);
		}

		@Override
		public void trace(String msg, Throwable t) {
			logPlain(Level.FINEST, msg, t);
		}

		@Override
		public boolean isDebugEnabled() {
			return isEnabled(Level.FINE);
		}

		@Override
		public void debug(String msg) {
			logPlain(Level.FINE, msg, null);
		}

		@Override
		public void debug(String format, Object... arguments) {
			logFormatted(Level.FINE, format, arguments);
		}

		@Override
		public void debug(String msg, Throwable t) {
			logPlain(Level.FINE, msg, t);
		}

		@Override
		public boolean isInfoEnabled() {
			return isEnabled(Level.INFO);
		}

		@Override
		public void info(String msg) {
			logPlain(Level.INFO, msg, null);
		}

		@Override
		public void info(String format, Object... arguments) {
			logFormatted(Level.INFO, format, arguments);
		}

		@Override
		public void info(String msg, Throwable t) {
			logPlain(Level.INFO, msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return isEnabled(Level.WARNING);
		}

		@Override
		public void warn(String msg) {
			logPlain(Level.WARNING, msg, null);
		}

		@Override
		public void warn(String format, Object... arguments) {
			logFormatted(Level.WARNING, format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logPlain(Level.WARNING, msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return isEnabled(Level.SEVERE);
		}

		@Override
		public void error(String msg) {
			logPlain(Level.SEVERE, msg, null);
		}

		@Override
		public void error(String format, Object... arguments) {
			logFormatted(Level.SEVERE, format, arguments);
		}

		@Override
		public void error(String msg, Throwable t) {
			logPlain(Level.SEVERE, msg, t);
		}
	}

	static final class JdkLogger extends FormattingLogger {

		private final java.util.logging.Logger logger;

		JdkLogger(String name) {
			super(name);
			this.logger = java.util.logging.Logger.getLogger(name);
		}

		@Override
		boolean isEnabled(Level level) {
			return logger.isLoggable(level);
		}

		@Override
		void log(Level level, String message, @Nullable Throwable t) {
			if (t == null) {
				logger.log(level, message);
			}
			else {
				logger.log(level, message, t);
			}
		}
	}

	static final class ConsoleLogger extends FormattingLogger {

		private final boolean verbose;

		ConsoleLogger(String name, boolean verbose) {
			super(name);
			this.verbose = verbose;
		}

		@Override
		boolean isEnabled(Level level) {
			return verbose || level.intValue() >= Level.INFO.intValue();
		}

		@Override
		void log(Level level, String message, @Nullable Throwable t) {
			PrintStream stream = level.intValue() >= Level.WARNING.intValue() ? System.err : System.out;
			synchronized (stream) {
				stream.format("[%s] (%s) %s\n", label(level), Thread.currentThread().getName(), message);
				if (t != null) {
					t.printStackTrace(stream);
				}
			}
		}

		private static String label(Level level) {
			if (level == Level.SEVERE) {
				return "ERROR";
			}
			if (level == Level.WARNING) {
				return " WARN";
			}
			if (level == Level.INFO) {
				return " INFO";
			}
			if (level == Level.FINE) {
				return "DEBUG";
			}
			return "TRACE";
		}
	}

	Loggers() {
	}
}
