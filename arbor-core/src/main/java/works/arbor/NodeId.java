package works.arbor;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Identifies a {@link Node} within one tree.
 * Ids are stable across mutations, unlike paths.
 */
public final class NodeId {
	@NotNull
	final String value;

	private NodeId(@NotNull String value) {
		this.value = value;
	}

	public static NodeId from(String value) {
		if (value.isEmpty()) {
			throw new IllegalArgumentException("NodeId can't be empty");
		}
		return new NodeId(value);
	}

	public static synchronized NodeId unique(String prefix) {
		return new NodeId(prefix + "-" + (++uniqueIdCounter));
	}

	private static long uniqueIdCounter = 1000;

	@Override
	public String toString() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		NodeId that = (NodeId) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}
}
