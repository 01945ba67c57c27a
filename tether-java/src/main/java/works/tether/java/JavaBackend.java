package works.tether.java;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tether.config.BackendId;
import works.tether.emit.Artifact;
import works.tether.emit.Backend;
import works.tether.emit.EmissionContext;
import works.tether.emit.SourceWriter;
import works.tether.emit.TypeUnit;
import works.tether.ir.EnumDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.PrimitiveDef;
import works.tether.ir.StructDef;
import works.tether.ir.TypeDef;
import works.tether.mapping.TypeMapper;

/**
 * Generates Java bindings that call the native library through JNA.
 * <p>
 * Each opaque, struct and enum type becomes one public Java type in the configured package,
 * under {@value #SOURCE_DIRECTORY}/. Primitive aliases have no Java counterpart;
 * uses of them are just the primitive.
 */
public final class JavaBackend implements Backend<JavaType> {
	public static final BackendId ID = BackendId.of("java");
	public static final String SOURCE_DIRECTORY = "java";

	private final JavaTypeMapper typeMapper = new JavaTypeMapper();

	@Override
	public BackendId id() {
		return ID;
	}

	@Override
	public TypeMapper<JavaType> typeMapper() {
		return typeMapper;
	}

	@Override
	public List<Artifact> emitUnit(TypeUnit<JavaType> unit, EmissionContext context) {
		String packageName = checkedPackage(context);
		UnitWriter writer = unit.def().accept(new TypeDef.Visitor<UnitWriter>() {
			@Override
			public UnitWriter visitOpaque(OpaqueDef def) {
				return new OpaqueClassWriter(unit, context);
			}

			@Override
			public UnitWriter visitStruct(StructDef def) {
				return new StructRecordWriter(unit, context);
			}

			@Override
			public UnitWriter visitEnum(EnumDef def) {
				return new EnumWriter(unit, context);
			}

			@Override
			public UnitWriter visitPrimitive(PrimitiveDef def) {
				return null;
			}
		});
		if (writer == null) {
			LOGGER.debug("No Java unit for primitive alias {}", unit.def().name());
			return List.of();
		}
		JavaNames.checkTypeName(unit.hostName());
		LOGGER.debug("Writing {} {} as {}.{}", unit.def().kindName(), unit.def().name(), packageName, unit.hostName());
		return List.of(new Artifact(sourcePath(packageName, unit.hostName()), writer.write()));
	}

	@Override
	public List<Artifact> emitLibrary(EmissionContext context) {
		String packageName = checkedPackage(context);
		SourceWriter out = new SourceWriter()
			.line("// Generated by tether. Do not edit.")
			.docComment("Bindings for the native library {@code " + context.config().libraryName() + "}.")
			.line("package " + packageName + ";");
		return List.of(new Artifact(sourcePath(packageName, "package-info"), out.toString()));
	}

	public static String sourcePath(String packageName, String simpleName) {
		return SOURCE_DIRECTORY + "/" + packageName.replace('.', '/') + "/" + simpleName + ".java";
	}

	/**
	 * @throws IllegalArgumentException if the configured package isn't a valid Java package name
	 */
	private static String checkedPackage(EmissionContext context) {
		String packageName = context.config().hostPackage();
		for (String segment: packageName.split("\\.", -1)) {
			if (segment.isEmpty()
				|| JavaNames.KEYWORDS.contains(segment)
				|| !Character.isJavaIdentifierStart(segment.charAt(0))
				|| !segment.chars().allMatch(Character::isJavaIdentifierPart)) {
				throw new IllegalArgumentException("Not a valid Java package name: \"" + packageName + "\"");
			}
		}
		return packageName;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JavaBackend.class);
}
