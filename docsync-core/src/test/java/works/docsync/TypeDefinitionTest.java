package works.docsync;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.docsync.exceptions.TemporalParseException;
import works.docsync.exceptions.UnknownTypeException;
import works.docsync.storage.InMemoryStorage;
import works.docsync.temporal.TemporalParseOptions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.docsync.FieldDescriptor.of;

class TypeDefinitionTest {
	CountingStorage storage;
	TypeRegistry registry;
	TypeDefinition person;

	@BeforeEach
	void setup() {
		storage = new CountingStorage(new InMemoryStorage());
		registry = new TypeRegistry("test", storage);
		person = registry.defineType("Person", of("name"), of("age", "integer"));
		registry.applyAllSchemas();
		storage.reset();
	}

	@Test
	void newField_extendsSchema() {
		Row row = person.sync(doc("name", "Ann", "age", 30, "nickname", "A"));
		long id = (Long) row.get("id");

		assertTrue(storage.columns("Person").contains("nickname"));
		assertEquals(List.of(new CatalogEntry("Person", "nickname", "nickname", FieldType.STRING)),
			registry.catalog().entriesFor("Person"));
		assertEquals(Map.of("id", id, "name", "Ann", "age", 30L, "nickname", "A"),
			stored("Person", id).asMap());
	}

	@Test
	void sameDocumentTwice_updatesSecondTime() {
		Map<String, Object> document = doc("id", 7, "name", "Ann", "age", 30);
		Row first = person.sync(document);
		Row storedFirst = stored("Person", 7);
		Row second = person.sync(document);

		assertEquals(first, second);
		assertEquals(storedFirst, stored("Person", 7));
		assertEquals(List.of("insert Person", "update Person 7"), storage.writes);
	}

	@Test
	void repeatedNewField_isCatalogedOnce() {
		person.sync(doc("name", "Ann", "color", "red"));
		person.sync(doc("name", "Bob", "color", "blue"));
		person.bulkSync(List.of(doc("name", "Cat", "color", "green"), doc("name", "Dan", "color", "gold")));

		assertEquals(1, registry.catalog().entriesFor("Person").size());
		assertEquals(1, storage.count("bulkInsert " + KnownFieldsCatalog.TABLE));
		assertEquals(1, storage.count("redefine Person"));
		assertTrue(storage.columns("Person").contains("color"));
	}

	@Test
	void bulkSync_infersTypesFromWholeBatch() {
		person.bulkSync(List.of(
			doc("mixed", 3, "count", 1, "ratio", 1.5, "flag", true, "tags", List.of("x"), "empty", null),
			doc("mixed", "x", "count", 2, "tags", doc("a", 1))));

		Map<String, FieldType> inferred = registry.catalog().entriesFor("Person").stream()
			.collect(Collectors.toMap(CatalogEntry::fieldname, CatalogEntry::dbType));
		assertEquals(Map.of(
			"mixed", FieldType.STRING,
			"count", FieldType.INTEGER,
			"ratio", FieldType.DOUBLE,
			"flag", FieldType.BOOLEAN,
			"tags", FieldType.JSON
		), inferred);
		assertFalse(storage.columns("Person").contains("empty"));
	}

	@Test
	void fullSync_clearsMissingFields() {
		person.sync(doc("id", 1, "name", "Ann", "age", 30, "nickname", "A"));
		person.sync(doc("id", 1, "name", "Ann"));

		Row row = stored("Person", 1);
		assertEquals("Ann", row.get("name"));
		assertNull(row.get("age"));
		assertNull(row.get("nickname"));
	}

	@Test
	void partialSync_leavesMissingFields() {
		person.sync(doc("id", 1, "name", "Ann", "age", 30, "nickname", "A"));
		person.sync(doc("id", 1, "name", "Bob"), true);

		Row row = stored("Person", 1);
		assertEquals("Bob", row.get("name"));
		assertEquals(30L, row.get("age"));
		assertEquals("A", row.get("nickname"));
	}

	@Test
	void explicitNull_isStoredEvenWhenPartial() {
		person.sync(doc("id", 1, "name", "Ann", "age", 30, "nickname", "A"));
		person.sync(doc("id", 1, "age", null, "nickname", null), true);

		Row row = stored("Person", 1);
		assertEquals("Ann", row.get("name"));
		assertNull(row.get("age"));
		assertNull(row.get("nickname"));
	}

	@Test
	void keepMissingFields_leavesUndeclaredColumns() {
		TypeDefinition lenient = registry.defineType("Lenient",
			TypeSettings.builder().removeMissingFields(false).build(),
			of("name"));
		lenient.sync(doc("id", 1, "name", "Ann", "nickname", "A"));
		lenient.sync(doc("id", 1, "name", "Bob"));

		Row row = stored("Lenient", 1);
		assertEquals("Bob", row.get("name"));
		assertEquals("A", row.get("nickname"));
	}

	@Test
	void nestedReference_isSyncedFirst() {
		registry.defineType("Address", of("city"));
		TypeDefinition customer = registry.defineType("Customer", of("name"), of("address", "reference Address"));
		registry.applyAllSchemas();
		storage.reset();

		Row row = customer.sync(doc("name", "Ann", "address", doc("city", "Oslo")));

		assertEquals(List.of("insert Address", "insert Customer"), storage.writes);
		long addressID = (Long) row.get("address");
		assertEquals("Oslo", stored("Address", addressID).get("city"));
		assertEquals(addressID, stored("Customer", (Long) row.get("id")).get("address"));
	}

	@Test
	void integerReference_isPassedThrough() {
		registry.defineType("Address", of("city"));
		TypeDefinition customer = registry.defineType("Customer", of("name"), of("address", "reference Address"));
		registry.applyAllSchemas();
		storage.reset();

		Row row = customer.sync(doc("name", "Bob", "address", 42));

		assertEquals(42L, row.get("address"));
		assertEquals(List.of("insert Customer"), storage.writes);
	}

	@Test
	void nestedReferenceWithKey_updatesExistingRow() {
		TypeDefinition address = registry.defineType("Address", of("city"));
		TypeDefinition customer = registry.defineType("Customer", of("name"), of("address", "reference Address"));
		registry.applyAllSchemas();
		long addressID = (Long) address.sync(doc("city", "Oslo")).get("id");
		storage.reset();

		customer.sync(doc("name", "Ann", "address", doc("id", addressID, "city", "Bergen")));

		assertEquals(List.of("update Address " + addressID, "insert Customer"), storage.writes);
		assertEquals("Bergen", stored("Address", addressID).get("city"));
	}

	@Test
	void integerWiderThanLong_isStoredAsString() {
		BigInteger wide = BigInteger.TWO.pow(64).add(BigInteger.valueOf(5));
		long id = (Long) person.sync(doc("name", "Ann", "serial", wide)).get("id");

		assertEquals(List.of(new CatalogEntry("Person", "serial", "serial", FieldType.STRING)),
			registry.catalog().entriesFor("Person"));
		assertEquals(wide, stored("Person", id).get("serial"));
	}

	@Test
	void referenceWiderThanLong_throws() {
		registry.defineType("Address", of("city"));
		TypeDefinition customer = registry.defineType("Customer", of("name"), of("address", "reference Address"));
		registry.applyAllSchemas();
		BigInteger wide = BigInteger.TWO.pow(64).add(BigInteger.valueOf(5));
		assertThrows(IllegalArgumentException.class, () -> customer.sync(doc("name", "Ann", "address", wide)));
	}

	@Test
	void referenceToScalar_throws() {
		registry.defineType("Address", of("city"));
		TypeDefinition customer = registry.defineType("Customer", of("name"), of("address", "reference Address"));
		assertThrows(IllegalArgumentException.class, () -> customer.sync(doc("name", "Ann", "address", "Oslo")));
	}

	@Test
	void listReference_preservesOrder() {
		registry.defineType("Tag", of("name"));
		TypeDefinition post = registry.defineType("Post", of("title"), of("tags", "list:reference Tag"));
		registry.applyAllSchemas();
		storage.reset();

		Row row = post.sync(doc("title", "Hello", "tags", List.<Object>of(5, doc("name", "a"), 7, doc("name", "b"))));

		long idA = tagID("a");
		long idB = tagID("b");
		assertEquals(List.of(5L, idA, 7L, idB), row.get("tags"));
		assertEquals(List.of(5L, idA, 7L, idB), stored("Post", (Long) row.get("id")).get("tags"));
		assertEquals(List.of("bulkInsert Tag 2", "insert Post"), storage.writes);
	}

	@Test
	void listReference_scalarIsOneElementList() {
		registry.defineType("Tag", of("name"));
		TypeDefinition post = registry.defineType("Post", of("title"), of("tags", "list:reference Tag"));

		Row one = post.sync(doc("title", "One", "tags", doc("name", "c")));
		assertEquals(List.of(tagID("c")), one.get("tags"));

		Row two = post.sync(doc("title", "Two", "tags", 3));
		assertEquals(List.of(3L), two.get("tags"));
	}

	@Test
	void listReference_allIntegers_syncsNothing() {
		registry.defineType("Tag", of("name"));
		TypeDefinition post = registry.defineType("Post", of("title"), of("tags", "list:reference Tag"));
		registry.applyAllSchemas();
		storage.reset();

		post.sync(doc("title", "Hello", "tags", List.of(1, 2, 3)));

		assertEquals(List.of("insert Post"), storage.writes);
	}

	@Test
	void bulkSync_updatesExistingAndInsertsRestTogether() {
		person.sync(doc("id", 1, "name", "Ann"));
		person.sync(doc("id", 2, "name", "Bob"));
		storage.reset();

		List<Row> rows = person.bulkSync(List.of(
			doc("name", "Cat"),
			doc("id", 1, "name", "Ann2"),
			doc("id", 10, "name", "Dan"),
			doc("id", 2, "name", "Bob2"),
			doc("name", "Eve")));

		assertEquals(List.of("update Person 1", "update Person 2", "bulkInsert Person 3"), storage.writes);
		assertEquals(List.of("Cat", "Dan", "Eve"), storage.bulkInsertions.get(0).stream()
			.map(r -> r.get("name"))
			.collect(Collectors.toList()));
		assertEquals(List.of("Cat", "Ann2", "Dan", "Bob2", "Eve"), rows.stream()
			.map(r -> r.get("name"))
			.collect(Collectors.toList()));
		assertEquals(10L, rows.get(2).get("id"));
		for (Row row: rows) {
			assertEquals(row.get("name"), stored("Person", (Long) row.get("id")).get("name"));
		}
	}

	@Test
	void bulkSync_empty_writesNothing() {
		assertEquals(List.of(), person.bulkSync(List.of()));
		assertEquals(List.of(), storage.writes);
	}

	@Test
	void computedField_ignoresDocument() {
		TypeDefinition named = registry.defineType("Named",
			of("first"),
			of("last"),
			FieldDescriptor.builder("full")
				.compute((row, context) -> row.get("first") + " " + row.get("last"))
				.build());

		Row row = named.sync(doc("first", "Ann", "last", "Lee", "full", "ignored"));

		assertEquals("Ann Lee", row.get("full"));
		assertEquals("Ann Lee", stored("Named", (Long) row.get("id")).get("full"));
	}

	@Test
	void columnName_differsFromFieldname() {
		TypeDefinition renamed = registry.defineType("Renamed",
			FieldDescriptor.builder("firstName").columnName("first_name").build());

		Row row = renamed.sync(doc("firstName", "Ann"));

		assertEquals("Ann", stored("Renamed", (Long) row.get("id")).get("first_name"));
		assertFalse(storage.columns("Renamed").contains("firstName"));
	}

	@Test
	void temporalFields_areParsedAndNormalized() {
		TemporalParseOptions utc = TemporalParseOptions.builder().zone(ZoneOffset.UTC).build();
		TypeDefinition event = registry.defineType("Event",
			FieldDescriptor.builder("at", "datetime").parseOptions(utc).build(),
			FieldDescriptor.builder("day", "date").dateFormat("dd.MM.yyyy").build(),
			FieldDescriptor.builder("start", "time").parseOptions(utc).build());

		Row row = event.sync(doc("at", "2024-03-05T10:15:30+02:00", "day", "05.03.2024", "start", "09:30"));

		assertEquals(LocalDateTime.of(2024, 3, 5, 8, 15, 30), row.get("at"));
		assertEquals(LocalDate.of(2024, 3, 5), row.get("day"));
		assertEquals(LocalTime.of(9, 30), row.get("start"));
	}

	@Test
	void unparseableTemporal_throwsWithRawValue() {
		TypeDefinition event = registry.defineType("Event", of("at", "datetime"));
		event.sync(doc("at", "2024-03-05"));
		storage.reset();

		TemporalParseException e = assertThrows(TemporalParseException.class, () -> event.sync(doc("at", "soon")));

		assertEquals("Event", e.typeName());
		assertEquals("at", e.fieldname());
		assertEquals("soon", e.rawValue());
		assertEquals(List.of(), storage.writes);
	}

	@Test
	void unknownReferencedType_throws() {
		TypeDefinition broken = registry.defineType("Broken", of("ref", "reference Missing"));
		assertThrows(UnknownTypeException.class, () -> broken.sync(doc("ref", doc("x", 1))));
	}

	@Test
	void undefinedTable_isCreatedOnFirstSync() {
		TypeDefinition late = registry.defineType("Late", of("name"));
		assertFalse(storage.hasTable("Late"));

		Row row = late.sync(doc("name", "Ann"));

		assertEquals("Ann", stored("Late", (Long) row.get("id")).get("name"));
	}

	@Test
	void nullForUnknownColumn_isDropped() {
		Row row = person.sync(doc("name", "Ann", "unheardOf", null));
		assertFalse(row.containsColumn("unheardOf"));
		assertFalse(storage.columns("Person").contains("unheardOf"));
	}

	private long tagID(String name) {
		List<Row> rows = storage.query("Tag", Map.of("name", name));
		assertEquals(1, rows.size());
		return (Long) rows.get(0).get("id");
	}

	private Row stored(String table, long id) {
		return storage.lookupRow(table, id).orElseThrow();
	}

	static Map<String, Object> doc(Object... keysAndValues) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			result.put((String) keysAndValues[i], keysAndValues[i + 1]);
		}
		return result;
	}
}
