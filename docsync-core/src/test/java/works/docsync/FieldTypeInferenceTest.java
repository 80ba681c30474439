package works.docsync;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class FieldTypeInferenceTest {

	static Stream<Arguments> singleKinds() {
		return Stream.of(
			arguments(ValueKind.INTEGER, FieldType.INTEGER),
			arguments(ValueKind.FLOATING, FieldType.DOUBLE),
			arguments(ValueKind.BOOLEAN, FieldType.BOOLEAN),
			arguments(ValueKind.STRUCTURED, FieldType.JSON),
			arguments(ValueKind.STRING, FieldType.STRING),
			arguments(ValueKind.OTHER, FieldType.STRING)
		);
	}

	@ParameterizedTest
	@MethodSource("singleKinds")
	void singleKind_mapsDeterministically(ValueKind kind, FieldType expected) {
		assertEquals(expected, FieldTypeInference.infer(EnumSet.of(kind)));
	}

	@Test
	void noKinds_isString() {
		assertEquals(FieldType.STRING, FieldTypeInference.infer(Set.of()));
	}

	@Test
	void mixedKinds_isString() {
		assertEquals(FieldType.STRING, FieldTypeInference.infer(EnumSet.of(ValueKind.INTEGER, ValueKind.STRING)));
		assertEquals(FieldType.STRING, FieldTypeInference.infer(EnumSet.of(ValueKind.INTEGER, ValueKind.FLOATING)));
	}

	@Test
	void valueKinds() {
		assertEquals(ValueKind.INTEGER, ValueKind.of(3));
		assertEquals(ValueKind.INTEGER, ValueKind.of(3L));
		assertEquals(ValueKind.INTEGER, ValueKind.of(BigInteger.TEN));
		assertEquals(ValueKind.INTEGER, ValueKind.of(BigInteger.valueOf(Long.MIN_VALUE)));
		assertEquals(ValueKind.OTHER, ValueKind.of(BigInteger.TWO.pow(64).add(BigInteger.valueOf(5))));
		assertEquals(ValueKind.FLOATING, ValueKind.of(1.5));
		assertEquals(ValueKind.FLOATING, ValueKind.of(new BigDecimal("1.5")));
		assertEquals(ValueKind.BOOLEAN, ValueKind.of(true));
		assertEquals(ValueKind.STRUCTURED, ValueKind.of(Map.of("a", 1)));
		assertEquals(ValueKind.STRUCTURED, ValueKind.of(List.of(1, 2)));
		assertEquals(ValueKind.STRING, ValueKind.of("x"));
		assertEquals(ValueKind.OTHER, ValueKind.of(new Object()));
	}
}
