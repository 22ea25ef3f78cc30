package org.javai.springai.weave.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Records what one engine class logs at or above a level, for assertions on
 * retry warnings and loop caps.
 *
 * <pre>
 * try (LogCaptor logs = LogCaptor.forClass(Retrier.class, Level.WARN)) {
 *     retrier.withRetry(call, policy);
 *     assertThat(logs.messagesAt(Level.WARN)).hasSize(2);
 * }
 * </pre>
 */
public final class LogCaptor implements AutoCloseable {

	public record Captured(Level level, String message) {
	}

	private final String loggerName;
	private final Level previousLevel;
	private final Recorder recorder;

	private LogCaptor(String loggerName, Level previousLevel, Recorder recorder) {
		this.loggerName = loggerName;
		this.previousLevel = previousLevel;
		this.recorder = recorder;
	}

	public static LogCaptor forClass(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Level previousLevel = context.getLogger(loggerName).getLevel();

		// gives the class its own logger config so the appender sees nothing else
		Configurator.setLevel(loggerName, level);
		LoggerConfig config = context.getConfiguration().getLoggerConfig(loggerName);
		Recorder recorder = new Recorder(loggerName);
		recorder.start();
		config.addAppender(recorder, level, null);
		context.updateLoggers();
		return new LogCaptor(loggerName, previousLevel, recorder);
	}

	public List<Captured> events() {
		return List.copyOf(recorder.captured);
	}

	public List<String> messages() {
		return recorder.captured.stream().map(Captured::message).toList();
	}

	public List<String> messagesAt(Level level) {
		return recorder.captured.stream()
				.filter(captured -> captured.level() == level)
				.map(Captured::message)
				.toList();
	}

	@Override
	public void close() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		context.getConfiguration().getLoggerConfig(loggerName).removeAppender(recorder.getName());
		recorder.stop();
		Configurator.setLevel(loggerName, previousLevel);
	}

	private static final class Recorder extends AbstractAppender {

		private final List<Captured> captured = new CopyOnWriteArrayList<>();

		Recorder(String loggerName) {
			super("capture:" + loggerName + "@" + System.nanoTime(), null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			captured.add(new Captured(event.getLevel(), event.getMessage().getFormattedMessage()));
		}
	}
}
