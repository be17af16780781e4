package org.javai.twf.ast;

import java.util.List;
import java.util.Optional;

/**
 * The root of a parsed TWF source: its top-level definitions in source order.
 */
public record TwfFile(List<Definition> definitions) {

	public TwfFile {
		definitions = definitions != null ? List.copyOf(definitions) : List.of();
	}

	public List<WorkflowDef> workflows() {
		return definitions.stream()
				.filter(WorkflowDef.class::isInstance)
				.map(WorkflowDef.class::cast)
				.toList();
	}

	public List<ActivityDef> activities() {
		return definitions.stream()
				.filter(ActivityDef.class::isInstance)
				.map(ActivityDef.class::cast)
				.toList();
	}

	/**
	 * Finds the first workflow with the given name.
	 */
	public Optional<WorkflowDef> workflow(String name) {
		return workflows().stream().filter(w -> w.name().equals(name)).findFirst();
	}

	/**
	 * Finds the first activity with the given name.
	 */
	public Optional<ActivityDef> activity(String name) {
		return activities().stream().filter(a -> a.name().equals(name)).findFirst();
	}
}
