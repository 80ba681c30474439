package works.docsync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Tracks where a sync call is within the document graph.
 * <p>
 * A root context is created for each top-level {@link TypeDefinition#sync sync} or
 * {@link TypeDefinition#bulkSync bulkSync} call, and a child context for each
 * reference (one document) or list reference (one batch) resolved beneath it.
 * Children inherit {@link #partial()} from their parent.
 * <p>
 * During a bulk sync, {@link #document()} and {@link #index()} move through the batch;
 * outside of that, {@link #index()} is -1.
 * <p>
 * Contexts live only for the duration of the call that created them.
 */
public final class TraversalContext {
	private final @Nullable TraversalContext parentContext;
	private final TypeDefinition type;
	private final @Nullable List<Map<String, Object>> batch;
	private final boolean partial;
	private final List<Map<String, Object>> parents;
	private final List<TraversalContext> parentContexts;
	private final Map<String, Object> root;
	private final TraversalContext rootContext;

	private Map<String, Object> document;
	private int index = -1;

	private TraversalContext(
		@Nullable TraversalContext parentContext,
		TypeDefinition type,
		@Nullable Map<String, Object> document,
		@Nullable List<Map<String, Object>> batch,
		boolean partial
	) {
		this.parentContext = parentContext;
		this.type = requireNonNull(type);
		this.document = document;
		this.batch = batch;
		this.partial = partial;
		if (parentContext == null) {
			this.parents = List.of();
			this.parentContexts = List.of();
			this.root = document;
			this.rootContext = this;
		} else {
			List<Map<String, Object>> p = new ArrayList<>();
			p.add(parentContext.document);
			p.addAll(parentContext.parents);
			this.parents = Collections.unmodifiableList(p);
			List<TraversalContext> pc = new ArrayList<>();
			pc.add(parentContext);
			pc.addAll(parentContext.parentContexts);
			this.parentContexts = Collections.unmodifiableList(pc);
			this.root = parentContext.root;
			this.rootContext = parentContext.rootContext;
		}
	}

	static TraversalContext forDocument(TypeDefinition type, Map<String, Object> document, boolean partial) {
		return new TraversalContext(null, type, requireNonNull(document), null, partial);
	}

	static TraversalContext forBatch(TypeDefinition type, List<Map<String, Object>> batch, boolean partial) {
		return new TraversalContext(null, type, null, requireNonNull(batch), partial);
	}

	TraversalContext childForDocument(TypeDefinition childType, Map<String, Object> childDocument) {
		return new TraversalContext(this, childType, requireNonNull(childDocument), null, partial);
	}

	TraversalContext childForBatch(TypeDefinition childType, List<Map<String, Object>> childBatch) {
		return new TraversalContext(this, childType, null, requireNonNull(childBatch), partial);
	}

	/**
	 * Moves a batch context to the element at <code>newIndex</code>.
	 */
	void moveTo(int newIndex) {
		this.index = newIndex;
		this.document = requireNonNull(batch).get(newIndex);
	}

	public @Nullable TraversalContext parentContext() {
		return parentContext;
	}

	public TypeDefinition type() {
		return type;
	}

	/**
	 * @return the document currently being synced; null for a batch context
	 * whose iteration hasn't started
	 */
	public @Nullable Map<String, Object> document() {
		return document;
	}

	public @Nullable List<Map<String, Object>> batch() {
		return batch;
	}

	public int index() {
		return index;
	}

	public boolean partial() {
		return partial;
	}

	/**
	 * @return the documents of the enclosing contexts, nearest first
	 */
	public List<Map<String, Object>> parents() {
		return parents;
	}

	/**
	 * @return the enclosing contexts, nearest first
	 */
	public List<TraversalContext> parentContexts() {
		return parentContexts;
	}

	/**
	 * @return the document of the root context; null if the root is a batch
	 */
	public @Nullable Map<String, Object> root() {
		return root;
	}

	public TraversalContext rootContext() {
		return rootContext;
	}

	public boolean isRoot() {
		return parentContext == null;
	}

	@Override
	public String toString() {
		return "TraversalContext{" +
			"type=" + type.name() +
			", depth=" + parentContexts.size() +
			", index=" + index +
			", partial=" + partial +
			'}';
	}
}
