package works.jsonv.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@link InvalidData} records accumulated while parsing one document,
 * in the order they were found.
 * <p>
 * Schema nodes add to this as they go and keep parsing;
 * only fatal problems abort a parse.
 */
public final class ValidationErrors implements Iterable<InvalidData> {
	private final List<InvalidData> records = new ArrayList<>();

	public ValidationErrors add(String path, String message) {
		records.add(new InvalidData(path, message));
		return this;
	}

	public ValidationErrors addAll(ValidationErrors other) {
		records.addAll(other.records);
		return this;
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}

	public int size() {
		return records.size();
	}

	/**
	 * @return an unmodifiable view of the records
	 */
	public List<InvalidData> records() {
		return Collections.unmodifiableList(records);
	}

	@Override
	public Iterator<InvalidData> iterator() {
		return records().iterator();
	}

	public static ValidationErrors of(InvalidData... records) {
		ValidationErrors result = new ValidationErrors();
		result.records.addAll(List.of(records));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ValidationErrors other && records.equals(other.records);
	}

	@Override
	public int hashCode() {
		return records.hashCode();
	}

	@Override
	public String toString() {
		return records.stream()
			.map(InvalidData::toString)
			.collect(Collectors.joining("; ", "ValidationErrors[", "]"));
	}
}
