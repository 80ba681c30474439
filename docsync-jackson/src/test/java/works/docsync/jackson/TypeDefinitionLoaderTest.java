package works.docsync.jackson;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.docsync.FieldDescriptor;
import works.docsync.FieldType;
import works.docsync.TypeDefinition;
import works.docsync.TypeRegistry;
import works.docsync.exceptions.DefinitionException;
import works.docsync.storage.InMemoryStorage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeDefinitionLoaderTest {
	TypeDefinitionLoader loader;
	TypeRegistry registry;

	@BeforeEach
	void setup() {
		loader = new TypeDefinitionLoader();
		registry = new TypeRegistry("loader", new InMemoryStorage());
	}

	@Test
	void loadsTypesFromResource() throws Exception {
		List<TypeDefinition> types;
		try (InputStream in = getClass().getResourceAsStream("/types.json")) {
			types = loader.load(registry, in);
		}
		assertEquals(List.of("Company", "Person"), types.stream().map(TypeDefinition::name).toList());

		TypeDefinition person = registry.type("Person");
		assertEquals("people", person.tableName());
		assertFalse(person.removeMissingFields());

		FieldDescriptor name = person.field("name").orElseThrow();
		assertEquals(FieldType.STRING, name.type());

		FieldDescriptor born = person.field("born").orElseThrow();
		assertEquals(FieldType.DATE, born.type());
		assertEquals("dd.MM.yyyy", born.dateFormat());

		FieldDescriptor employer = person.field("employer").orElseThrow();
		assertEquals(FieldType.reference("Company"), employer.type());
		assertEquals("employer_id", employer.columnName());
		assertTrue(employer.notNull());

		registry.applyAllSchemas();
		assertTrue(registry.storage().columns("people").contains("employer_id"));
	}

	@Test
	void unknownTypeOption_throws() {
		assertThrows(DefinitionException.class, () -> loader.load(registry,
			"{\"types\": [{\"name\": \"T\", \"options\": {\"migrate\": true}}]}"));
	}

	@Test
	void unknownFieldAttribute_throws() {
		assertThrows(DefinitionException.class, () -> loader.load(registry,
			"{\"types\": [{\"name\": \"T\", \"fields\": [{\"fieldname\": \"x\", \"length\": 10}]}]}"));
	}

	@Test
	void invalidFieldType_throws() {
		assertThrows(DefinitionException.class, () -> loader.load(registry,
			"{\"types\": [{\"name\": \"T\", \"fields\": [{\"fieldname\": \"x\", \"type\": \"varchar\"}]}]}"));
	}

	@Test
	void missingNames_throw() {
		assertThrows(DefinitionException.class, () -> loader.load(registry, "{\"types\": [{\"fields\": []}]}"));
		assertThrows(DefinitionException.class, () -> loader.load(registry,
			"{\"types\": [{\"name\": \"T\", \"fields\": [{\"type\": \"integer\"}]}]}"));
		assertThrows(DefinitionException.class, () -> loader.load(registry, "{}"));
	}

	@Test
	void malformedJson_throws() {
		assertThrows(DefinitionException.class, () -> loader.load(registry, "{\"types\": ["));
	}

	@Test
	void malformedJsonStream_throws() {
		InputStream in = new ByteArrayInputStream("{\"types\": [".getBytes(StandardCharsets.UTF_8));
		DefinitionException e = assertThrows(DefinitionException.class, () -> loader.load(registry, in));
		assertTrue(e.getMessage().startsWith("Invalid type configuration: "));
		assertEquals(List.of(), registry.types());
	}
}
