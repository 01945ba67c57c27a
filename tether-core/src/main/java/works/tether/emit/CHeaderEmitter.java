package works.tether.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import works.tether.abi.AbiSignature;
import works.tether.abi.AbiType;
import works.tether.abi.CTypes;
import works.tether.ir.EnumDef;
import works.tether.ir.EnumVariant;
import works.tether.ir.OpaqueDef;
import works.tether.ir.PrimitiveDef;
import works.tether.ir.StructDef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRegistry;

/**
 * Writes the native side of the boundary: one C header per type, plus the shared runtime header.
 * <p>
 * The native library implements the prototypes declared here.
 * Value types are included before they're used by value;
 * opaque types are only ever forward-declared, which keeps mutually-referencing headers legal.
 */
public final class CHeaderEmitter {
	public static final String INCLUDE_DIR = "include";
	public static final String RUNTIME_HEADER = "tether_runtime.h";

	private CHeaderEmitter() { }

	public static String headerName(TypeDef def) {
		return def.name() + ".h";
	}

	public static String headerPath(TypeDef def) {
		return INCLUDE_DIR + "/" + headerName(def);
	}

	public static Artifact runtimeHeader() {
		SourceWriter w = new SourceWriter()
			.line("#ifndef TETHER_RUNTIME_H")
			.line("#define TETHER_RUNTIME_H")
			.line()
			.line("#include <stdbool.h>")
			.line("#include <stddef.h>")
			.line("#include <stdint.h>")
			.line()
			.docComment("A borrowed run of elements. A null data pointer means absent.")
			.open("typedef struct " + CTypes.SLICE_TYPE)
			.line("const void* data;")
			.line("size_t len;")
			.close(" " + CTypes.SLICE_TYPE + ";")
			.line()
			.docComment("One UTF-8 string inside a slice of strings.")
			.open("typedef struct " + CTypes.STRING_VIEW_TYPE)
			.line("const uint8_t* data;")
			.line("size_t len;")
			.close(" " + CTypes.STRING_VIEW_TYPE + ";")
			.line()
			.docComment("""
				A caller-owned, growable UTF-8 buffer.
				Native code appends at buf[len], calls grow when it needs more than cap bytes,
				and calls flush once when it's done writing.
				If grow fails, it sets grow_failed and native code stops writing.""")
			.open("typedef struct " + CTypes.WRITE_TYPE)
			.line("void* context;")
			.line("char* buf;")
			.line("size_t len;")
			.line("size_t cap;")
			.line("bool grow_failed;")
			.line("void (*flush)(struct " + CTypes.WRITE_TYPE + "*);")
			.line("bool (*grow)(struct " + CTypes.WRITE_TYPE + "*, size_t);")
			.close(" " + CTypes.WRITE_TYPE + ";")
			.line()
			.line("#endif");
		return new Artifact(INCLUDE_DIR + "/" + RUNTIME_HEADER, w.toString());
	}

	public static Artifact header(TypeUnit<?> unit, EmissionContext context) {
		TypeDef def = unit.def();
		TypeRegistry registry = context.surface().registry();
		CTypes c = context.cTypes();
		String guard = "TETHER_" + def.name().toUpperCase() + "_H";

		Dependencies fieldDeps = new Dependencies(def.id());
		unit.fields().forEach(f -> f.abi().accept(fieldDeps));
		Dependencies methodDeps = new Dependencies(def.id());
		for (AbiSignature signature: signatures(unit)) {
			signature.params().forEach(p -> p.type().accept(methodDeps));
			signature.returnType().accept(methodDeps);
		}
		methodDeps.includes.removeAll(fieldDeps.includes);
		Set<TypeId> forward = new TreeSet<>(fieldDeps.forward);
		forward.addAll(methodDeps.forward);

		SourceWriter w = new SourceWriter()
			.line("#ifndef " + guard)
			.line("#define " + guard)
			.line()
			.line("#include \"" + RUNTIME_HEADER + "\"");
		includes(w, fieldDeps.includes, registry);
		w.line();
		for (TypeId id: forward) {
			String name = registry.resolve(id).name();
			w.line("typedef struct " + name + " " + name + ";");
		}
		if (!forward.isEmpty()) {
			w.line();
		}

		w.docComment(def.docs());
		def.accept(new TypeDef.Visitor<Void>() {
			@Override
			public Void visitOpaque(OpaqueDef opaque) {
				w.line("typedef struct " + opaque.name() + " " + opaque.name() + ";");
				return null;
			}

			@Override
			public Void visitStruct(StructDef struct) {
				w.open("typedef struct " + struct.name());
				for (FieldPlan<?> field: unit.fields()) {
					w.docComment(field.field().docs());
					w.line(c.typeName(field.abi()) + " " + field.name() + ";");
				}
				w.close(" " + struct.name() + ";");
				return null;
			}

			@Override
			public Void visitEnum(EnumDef e) {
				w.open("typedef enum " + e.name());
				for (EnumVariant variant: e.variants()) {
					w.docComment(variant.docs());
					w.line(e.name() + "_" + variant.name() + " = " + variant.discriminant() + ",");
				}
				w.close(" " + e.name() + ";");
				return null;
			}

			@Override
			public Void visitPrimitive(PrimitiveDef primitive) {
				w.line("typedef " + CTypes.primitive(primitive.kind()) + " " + primitive.name() + ";");
				return null;
			}
		});

		if (!methodDeps.includes.isEmpty()) {
			w.line();
			includes(w, methodDeps.includes, registry);
		}
		for (MethodPlan<?> method: unit.methods()) {
			w.line();
			w.docComment(method.method().docs());
			w.line(c.prototype(method.signature()) + ";");
		}
		unit.destructorSignature().ifPresent(signature -> w
			.line()
			.line(c.prototype(signature) + ";"));
		w.line()
			.line("#endif");
		return new Artifact(headerPath(def), w.toString());
	}

	private static List<AbiSignature> signatures(TypeUnit<?> unit) {
		List<AbiSignature> result = new ArrayList<>();
		unit.methods().forEach(m -> result.add(m.signature()));
		unit.destructorSignature().ifPresent(result::add);
		return result;
	}

	private static void includes(SourceWriter w, Set<TypeId> ids, TypeRegistry registry) {
		ids.stream()
			.map(id -> headerName(registry.resolve(id)))
			.sorted()
			.forEach(h -> w.line("#include \"" + h + "\""));
	}

	/**
	 * Collects the other types a header mentions:
	 * value types need their definitions, opaque types only a name.
	 */
	private static final class Dependencies implements AbiType.Visitor<Void> {
		final TypeId self;
		final Set<TypeId> includes = new TreeSet<>();
		final Set<TypeId> forward = new TreeSet<>();

		Dependencies(TypeId self) {
			this.self = self;
		}

		private void include(TypeId id) {
			if (!id.equals(self)) {
				includes.add(id);
			}
		}

		@Override public Void visitScalar(AbiType.Scalar type) { return null; }
		@Override public Void visitEnumValue(AbiType.EnumValue type) { include(type.target()); return null; }

		@Override
		public Void visitOpaquePointer(AbiType.OpaquePointer type) {
			if (!type.target().equals(self)) {
				forward.add(type.target());
			}
			return null;
		}

		@Override public Void visitStructValue(AbiType.StructValue type) { include(type.target()); return null; }
		@Override public Void visitStructPointer(AbiType.StructPointer type) { include(type.target()); return null; }
		@Override public Void visitSliceData(AbiType.SliceData type) { return null; }
		@Override public Void visitLength(AbiType.Length type) { return null; }
		@Override public Void visitFlag(AbiType.Flag type) { return null; }
		@Override public Void visitSliceView(AbiType.SliceView type) { return null; }
		@Override public Void visitWriteable(AbiType.Writeable type) { return null; }
		@Override public Void visitOutPointer(AbiType.OutPointer type) { return type.pointee().accept(this); }
		@Override public Void visitVoid(AbiType.VoidType type) { return null; }
	}
}
