package works.jsonv.schema;

/**
 * Identifies the location of a value within a JSON document.
 * <p>
 * The root is {@code /}. An object member appends its name, preceded by a {@code /}
 * unless the path already ends with one: {@code /a}, {@code /a/b}.
 * An array element appends its zero-based index followed by {@code /}, again preceded by a {@code /}
 * if needed: {@code /a/0/}.
 * So the {@code name} member of the first element of a top-level array is {@code /0/name}.
 * <p>
 * Paths are cheap to extend and are only rendered as text when {@link #toString()} is called,
 * which normally happens only if a validation error must be reported.
 */
public final class JsonPath {
	public static final JsonPath ROOT = new JsonPath(null, null, -1);

	private final JsonPath parent;
	private final String memberName;
	private final int index;

	private JsonPath(JsonPath parent, String memberName, int index) {
		this.parent = parent;
		this.memberName = memberName;
		this.index = index;
	}

	public JsonPath member(String name) {
		return new JsonPath(this, name, -1);
	}

	public JsonPath element(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Negative index: " + index);
		}
		return new JsonPath(this, null, index);
	}

	public boolean isRoot() {
		return parent == null;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return sb.toString();
	}

	private void appendTo(StringBuilder sb) {
		if (parent == null) {
			sb.append('/');
			return;
		}
		parent.appendTo(sb);
		if (sb.charAt(sb.length() - 1) != '/') {
			sb.append('/');
		}
		if (memberName == null) {
			sb.append(index).append('/');
		} else {
			sb.append(memberName);
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof JsonPath other && this.toString().equals(other.toString());
	}

	@Override
	public int hashCode() {
		return toString().hashCode();
	}
}
