package works.arbor;

import works.arbor.exceptions.DocumentParseException;

import static java.util.Objects.requireNonNull;

/**
 * Holds the {@link HandlerSettings} shared by the standard handlers
 * and the depth bookkeeping they all need.
 */
public abstract class AbstractFormatHandler implements FormatHandler {
	protected final HandlerSettings settings;

	protected AbstractFormatHandler(HandlerSettings settings) {
		this.settings = requireNonNull(settings);
	}

	public HandlerSettings settings() {
		return settings;
	}

	protected TraversalGuard newGuard() {
		return new TraversalGuard(settings.maxDepth());
	}

	/**
	 * @throws DocumentParseException if <code>depth</code> exceeds {@link HandlerSettings#maxDepth()}
	 */
	protected void checkParseDepth(int depth) {
		if (depth > settings.maxDepth()) {
			throw new DocumentParseException("Maximum depth " + settings.maxDepth() + " exceeded");
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + formatName() + ")";
	}
}
