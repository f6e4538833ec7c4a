package works.jsonv.schema;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.jsonv.exceptions.InvalidTypeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldResolverTest {

	static class Parent {
		String shared;
		String inherited;
	}

	static class Child extends Parent {
		String shared;
		static String ignoredStatic;
		transient String ignoredTransient;
	}

	static class Left {
		String clash;
		String tie;
	}

	static class Right {
		@JsonName("clash") String winner;
		String tie;
	}

	static class Both {
		@Embedded Left left;
		@Embedded Right right;
	}

	static class Loop {
		@Embedded Loop again;
	}

	static class BadEmbed {
		@Embedded int number;
	}

	@Test
	void shallowerFieldWins() throws InvalidTypeException {
		Map<String, FieldResolver.ResolvedField> fields = FieldResolver.resolve(Child.class);
		assertEquals(Child.class, fields.get("shared").field().getDeclaringClass());
		assertEquals(0, fields.get("shared").depth());
		assertEquals(Parent.class, fields.get("inherited").field().getDeclaringClass());
		assertEquals(1, fields.get("inherited").depth());
		assertFalse(fields.containsKey("ignoredStatic"));
		assertFalse(fields.containsKey("ignoredTransient"));
	}

	@Test
	void namedFieldBreaksTie() throws Exception {
		Map<String, FieldResolver.ResolvedField> fields = FieldResolver.resolve(Both.class);
		FieldResolver.ResolvedField clash = fields.get("clash");
		assertEquals(Right.class.getDeclaredField("winner"), clash.field());
		assertTrue(clash.named());
		assertEquals(List.of(Both.class.getDeclaredField("right")), clash.embeddingPath());
		assertFalse(fields.containsKey("tie"));
		assertFalse(fields.containsKey("left"));
	}

	@Test
	void embeddingCycle() {
		assertThrows(InvalidTypeException.class, () -> FieldResolver.resolve(Loop.class));
	}

	@Test
	void embeddedPrimitive() {
		assertThrows(InvalidTypeException.class, () -> FieldResolver.resolve(BadEmbed.class));
	}
}
