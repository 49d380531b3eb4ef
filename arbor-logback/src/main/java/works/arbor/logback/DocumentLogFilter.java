package works.arbor.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.arbor.DocumentModel;
import works.arbor.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.arbor.logging.MdcKeys.DOCUMENT_INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-document logging control.
 * Intended to suppress expected warnings and errors during testing.
 * <p>
 * A {@link DocumentModel} passed to {@link #register} along with a {@link LogController}
 * will have its log levels set by {@link LogController#setLogging}
 * without affecting other documents' logs.
 * <p>
 * This class infers that a log message is associated with a particular document
 * by checking the MDC for the key {@link MdcKeys#DOCUMENT_INSTANCE_ID},
 * which {@link DocumentModel} sets around each of its operations using
 * {@link works.arbor.logging.MappedDiagnosticContext#setupMDC setupMDC}.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message belongs to a registered document whose
 *         controller has an override for that logger or the nearest of its ancestors,
 *         messages below the override's level are dropped;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply, which means
 *         that the logger inherits the level from its ancestors.
 *     </li>
 * </ol>
 * Install it in <code>logback-test.xml</code> with
 * <code>&lt;turboFilter class="works.arbor.logback.DocumentLogFilter"/&gt;</code>.
 */
public class DocumentLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByDocumentID = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// We'd like to use SLF4J's "Level" but that doesn't support OFF
		public void setLogging(Level level, Class<?>... loggers) {
			// Put them all in one atomic operation
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), n -> level)));
		}

		/**
		 * @return the override for <code>loggerName</code> or its nearest overridden ancestor,
		 * or null if there is none
		 */
		Level overrideFor(String loggerName) {
			String name = loggerName;
			while (true) {
				Level level = overrides.get(name);
				if (level != null) {
					return level;
				}
				int dot = name.lastIndexOf('.');
				if (dot < 0) {
					return null;
				}
				name = name.substring(0, dot);
			}
		}
	}

	/**
	 * Causes the given <code>controller</code> to control logs emitted for <code>document</code>.
	 *
	 * @throws IllegalStateException if the document already has a controller
	 */
	public static void register(DocumentModel document, LogController controller) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Registering controller {} for document {} \"{}\"", System.identityHashCode(controller), document.instanceID(), document.name());
		}
		LogController old = controllersByDocumentID.putIfAbsent(document.instanceID(), controller);
		if (old != null) {
			throw new IllegalStateException("Must not create two log controllers for the same document. name:\"" + document.name() + "\" id:\"" + document.instanceID() + "\"");
		}
	}

	public static void unregister(DocumentModel document) {
		controllersByDocumentID.remove(document.instanceID());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Respect user-supplied log levels
			return NEUTRAL;
		}
		String documentID = MDC.get(DOCUMENT_INSTANCE_ID);
		if (documentID == null) {
			return NEUTRAL;
		}
		LogController controller = controllersByDocumentID.get(documentID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrideFor(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}

		// There is an override. Deny if the message's level is too low.
		if (messageLevel.toInt() < overrideLevel.toInt()) {
			return DENY;
		} else {
			return NEUTRAL;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(DocumentLogFilter.class);
}
