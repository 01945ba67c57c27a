package works.tether.java;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;
import works.tether.emit.SourceWriter;

/**
 * The imports of one generated compilation unit.
 */
final class Imports {
	private final String packageName;
	private final SortedSet<String> names = new TreeSet<>();

	Imports(String packageName) {
		this.packageName = packageName;
	}

	/**
	 * @return the simple name by which generated code refers to {@code qualifiedName}
	 */
	String use(String qualifiedName) {
		names.add(qualifiedName);
		return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
	}

	void addAll(Collection<String> qualifiedNames) {
		names.addAll(qualifiedNames);
	}

	void writeTo(SourceWriter out) {
		boolean any = false;
		for (String name: names) {
			String owner = name.substring(0, name.lastIndexOf('.'));
			if (owner.equals("java.lang") || owner.equals(packageName)) {
				continue;
			}
			out.line("import " + name + ";");
			any = true;
		}
		if (any) {
			out.line();
		}
	}
}
