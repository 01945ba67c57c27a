package works.tether.jackson;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.core.JacksonException;
import works.tether.Generator;
import works.tether.config.GeneratorConfig;
import works.tether.ir.Attributes;
import works.tether.ir.FallibleRef;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.Registry;
import works.tether.ir.SelfKind;
import works.tether.ir.SliceRef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.WriteableRef;
import works.tether.java.JavaBackend;
import works.tether.report.ErrorKind;
import works.tether.report.GenerationResult;
import works.tether.testing.SampleRegistries;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.tether.ir.UnitRef.UNIT;

class IrDocumentReaderTest {
	static final GeneratorConfig CONFIG = GeneratorConfig.builder(JavaBackend.ID)
		.hostPackage("demo.bindings")
		.build();

	final IrDocumentReader reader = new IrDocumentReader();

	@Test
	void demoDocument_matchesSampleRegistry() throws IOException {
		assertEquals(SampleRegistries.demo().allTypes(), readDemo().build().allTypes());
	}

	@Test
	void demoDocument_generatesSameOutput() throws IOException {
		GenerationResult fromJson = Generator.generate(new JavaBackend(), readDemo(), CONFIG);
		GenerationResult fromJava = Generator.generate(new JavaBackend(), SampleRegistries.demo(), CONFIG);
		assertTrue(fromJson.isSuccess(), fromJson::summary);
		assertEquals(fromJava, fromJson);
	}

	@Test
	void defaults() {
		Registry registry = reader.read("""
			{ "types": [
				{ "kind": "opaque", "name": "Widget", "methods": [ { "name": "reset" } ] }
			] }
			""").build();
		OpaqueDef widget = (OpaqueDef) registry.resolve(TypeId.of("Widget"));
		assertEquals("", widget.docs());
		assertEquals(Attributes.NONE, widget.attributes());
		assertEquals(new MethodDef("reset", SelfKind.NONE, List.of(), UNIT, "", Attributes.NONE), widget.methods().get(0));
	}

	@Test
	void explicitIdAndAttributes() {
		Registry registry = reader.read("""
			{ "types": [
				{ "kind": "opaque", "id": "widget#1", "name": "Widget",
					"attributes": { "disabledBackends": ["c"], "requiredFeatures": ["gui", "gui"], "rename": "Gizmo" },
					"methods": [
						{ "name": "peer", "self": "borrowed", "returns": { "opaque": "widget#1" },
							"attributes": { "onlyBackends": ["java"], "excludedFeatures": ["headless"] } }
					] }
			] }
			""").build();
		TypeDef widget = registry.resolve(TypeId.of("widget#1"));
		assertEquals("Widget", widget.name());
		assertEquals(new Attributes(Set.of("c"), Set.of(), Set.of("gui"), Set.of(), "Gizmo"), widget.attributes());
		MethodDef peer = widget.methods().get(0);
		assertEquals(OpaqueRef.borrowed(TypeId.of("widget#1")), peer.returnType());
		assertEquals(new Attributes(Set.of(), Set.of("java"), Set.of(), Set.of("headless"), null), peer.attributes());
	}

	@Test
	void typeSyntax() {
		Registry registry = reader.read("""
			{ "types": [
				{ "kind": "struct", "name": "Pair", "fields": [ { "name": "a", "type": "u16" } ] },
				{ "kind": "opaque", "name": "Widget", "methods": [
					{ "name": "pairs", "params": [
						{ "name": "by_ref", "type": { "struct": "Pair", "byReference": true } },
						{ "name": "wide", "type": { "slice": "utf16" } },
						{ "name": "sizes", "type": { "slice": "primitive", "element": "usize" } }
					], "returns": { "fallible": { "ok": "writeable", "err": "char" } } }
				] }
			] }
			""").build();
		MethodDef pairs = registry.resolve(TypeId.of("Widget")).methods().get(0);
		assertEquals(StructRef.byReference(TypeId.of("Pair")), pairs.params().get(0).type());
		assertEquals(SliceRef.UTF16, pairs.params().get(1).type());
		assertEquals(SliceRef.of(PrimitiveKind.USIZE), pairs.params().get(2).type());
		assertEquals(FallibleRef.of(WriteableRef.WRITEABLE, PrimitiveRef.of(PrimitiveKind.CHAR)), pairs.returnType());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{}",
		"{ \"types\": [ { \"name\": \"Widget\" } ] }",
		"{ \"types\": [ { \"kind\": \"class\", \"name\": \"Widget\" } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\" } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"Widget\", \"colour\": \"red\" } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"Widget\", \"fields\": [] } ] }",
		"{ \"types\": [ { \"kind\": \"primitive\", \"name\": \"Handle\", \"primitive\": \"u128\" } ] }",
		"{ \"types\": [ { \"kind\": \"primitive\", \"name\": \"Handle\" } ] }",
		"{ \"types\": [ { \"kind\": \"enum\", \"name\": \"Mode\", \"variants\": [ { \"name\": \"On\" } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"self\": \"mut\" } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": 5 } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": { \"list\": \"i32\" } } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": { \"enum\": \"E\", \"struct\": \"S\" } } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": { \"opaque\": \"W\", \"owned\": \"yes\" } } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": { \"slice\": \"primitive\" } } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": { \"slice\": \"utf8\", \"element\": \"u8\" } } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"returns\": { \"fallible\": \"i32\" } } ] } ] }",
		"{ \"types\": [ { \"kind\": \"opaque\", \"name\": \"W\", \"methods\": [ { \"name\": \"m\", \"params\": [ { \"name\": \"p\" } ] } ] } ] }",
	})
	void malformed(String json) {
		assertThrows(IrFormatException.class, () -> reader.read(json));
	}

	@Test
	void invalidJson_keepsCause() {
		IrFormatException e = assertThrows(IrFormatException.class, () -> reader.read("{ \"types\": [ "));
		assertInstanceOf(JacksonException.class, e.getCause());
	}

	@Test
	void danglingReference_isLoweringError() {
		Registry.Builder builder = reader.read("""
			{ "types": [
				{ "kind": "opaque", "name": "Widget", "methods": [ { "name": "peer", "returns": { "opaque": "Gadget" } } ] }
			] }
			""");
		GenerationResult result = Generator.generate(new JavaBackend(), builder, CONFIG);
		assertFalse(result.isSuccess());
		assertEquals(1, result.diagnosticsOfKind(ErrorKind.LOWERING_ERROR).size(), result::summary);
		assertTrue(result.artifacts().isEmpty());
	}

	private Registry.Builder readDemo() throws IOException {
		try (Reader demo = new InputStreamReader(getClass().getResourceAsStream("/demo-ir.json"), UTF_8)) {
			return reader.read(demo);
		}
	}
}
