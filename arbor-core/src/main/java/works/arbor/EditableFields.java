package works.arbor;

/**
 * Which aspects of a node an editor may change for a given format.
 *
 * @param keyEditable names can be changed
 * @param valueEditable scalar values can be changed
 * @param typeChangeable a value may change between types, such as string to number
 * @param structureEditable nodes may be added, removed, and moved
 */
public record EditableFields(
	boolean keyEditable,
	boolean valueEditable,
	boolean typeChangeable,
	boolean structureEditable
) {
	public static final EditableFields ALL = new EditableFields(true, true, true, true);
}
