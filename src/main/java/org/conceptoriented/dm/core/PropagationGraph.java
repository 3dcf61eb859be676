package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays interactions across the snapshots of one lineage tree.
 *
 * The interacted rows are translated into a filter of the root. Each reachable snapshot is then re-derived from the filtered root
 * by replaying the derivations on its path, and its propagation listeners are notified.
 */
public class PropagationGraph {
	private static final Logger logger = LoggerFactory.getLogger(PropagationGraph.class);

	//
	// Navigation
	//

	public static Snapshot getRoot(Snapshot snapshot) {
		Snapshot root = snapshot;
		while(root.getParent() != null) {
			root = root.getParent();
		}
		return root;
	}

	/**
	 * Nearest snapshot produced by a group-by, starting from the snapshot itself and moving to the root. Null if there is none.
	 */
	public static Snapshot getRootGroupBy(Snapshot snapshot) {
		for(Snapshot s = snapshot; s != null; s = s.getParent()) {
			if(getGroupBy(s) != null) return s;
		}
		return null;
	}
	private static Derivation.GroupBy getGroupBy(Snapshot snapshot) {
		Derivation.GroupBy ret = null;
		for(Derivation d : snapshot.getDerivations()) {
			if(d instanceof Derivation.GroupBy) ret = (Derivation.GroupBy) d;
		}
		return ret;
	}

	/**
	 * All snapshots of the tree, level by level from the root. Disposed snapshots are not reachable.
	 */
	public static List<Snapshot> getReachable(Snapshot root) {
		List<Snapshot> ret = new ArrayList<Snapshot>();
		if(root.isDisposed()) return ret;
		ret.add(root);
		for(int i=0; i<ret.size(); i++) {
			for(Snapshot child : ret.get(i).getChildren()) {
				if(!child.isDisposed() && !ret.contains(child)) ret.add(child);
			}
		}
		return ret;
	}

	/**
	 * Snapshots from the root to the target (both inclusive).
	 */
	public static List<Snapshot> getPath(Snapshot root, Snapshot target) {
		List<Snapshot> path = new ArrayList<Snapshot>();
		for(Snapshot s = target; s != null; s = s.getParent()) {
			path.add(s);
			if(s == root) break;
		}
		Collections.reverse(path);
		return path;
	}

	/**
	 * Apply the derivations which produced the target from the root to another version of the root.
	 */
	public static Snapshot replayPath(Snapshot target, Snapshot root, Snapshot replacedRoot) throws DmError {
		Snapshot current = replacedRoot;
		List<Snapshot> path = getPath(root, target);
		for(int i=1; i<path.size(); i++) {
			for(Derivation d : path.get(i).getDerivations()) {
				current = d.replay(current);
			}
		}
		return current;
	}

	//
	// Identifier translation
	//

	/**
	 * Describe the identifiers only by fields the root knows.
	 * If the source is a result of grouping then only its key fields identify rows.
	 */
	public static Identifiers translate(Snapshot source, Snapshot root, Identifiers identifiers) {
		Set<String> usable = new LinkedHashSet<String>(root.getFieldSpace().getColumnNames());
		Snapshot groupBySnapshot = getRootGroupBy(source);
		if(groupBySnapshot != null) {
			usable.retainAll(getGroupBy(groupBySnapshot).getDimensionNames());
		}
		return identifiers.restrictTo(usable);
	}

	/**
	 * Root restricted to the rows satisfying all active mutable interactions.
	 */
	public static Snapshot filterRoot(Snapshot root, PropagationNamespace namespace) throws DmError {
		List<RowPredicate> predicates = new ArrayList<RowPredicate>();
		namespace.getMutableActions().values().forEach(x -> predicates.add(x.toPredicate()));

		RowPredicate all = (row, index) -> {
			for(RowPredicate p : predicates) {
				if(!p.test(row, index)) return false;
			}
			return true;
		};
		return root.select(all, FilteringMode.NORMAL, false);
	}

	//
	// Propagation
	//

	public static void propagate(Snapshot source, Identifiers identifiers, PropagationConfig config) throws DmError {
		if(source.isDisposed()) {
			logger.debug("Propagation from disposed snapshot {} ignored", source);
			return;
		}

		Snapshot root = getRoot(source);
		PropagationContext context = source.getPropagationContext();
		PropagationNamespace namespace = context.getNamespace(root);

		String sourceId = config.getSourceId() != null ? config.getSourceId() : source.getId().toString();
		String actionKey = config.getAction() + "-" + sourceId;

		if(namespace.isActive(sourceId)) {
			logger.trace("Re-entrant propagation of {} ignored", actionKey);
			return;
		}

		context.enterPropagation();
		namespace.enter(sourceId);
		try {
			Identifiers translated = identifiers != null ? translate(source, root, identifiers) : null;

			if(config.isMutableAction()) {
				String identifiersKey = translated != null ? translated.getKey() : "null";
				if(!namespace.markApplied(actionKey, identifiersKey, context.getTick())) {
					logger.debug("Action {} already applied in tick {}", actionKey, context.getTick());
					return;
				}
			}
			namespace.setAction(actionKey, translated, config.isMutableAction());

			List<Snapshot> reachable = getReachable(root);
			logger.debug("Propagating {} from {} to {} snapshots", actionKey, source, reachable.size() - 1);

			//
			// Re-derive views from the filtered root
			//
			if(config.isMutableAction()) {
				Snapshot filteredRoot = namespace.hasMutableActions() ? filterRoot(root, namespace) : null;
				for(Snapshot target : reachable) {
					if(target == source) continue;
					target.setInteractionView(filteredRoot != null ? replayPath(target, root, filteredRoot) : null);
				}
			}

			//
			// Notify listeners
			//
			Snapshot interactedRoot = null;
			if(translated != null) {
				interactedRoot = root.select(translated.toPredicate(), FilteringMode.NORMAL, false);
			}
			for(Snapshot target : reachable) {
				if(target == source && !config.isApplyOnSource()) continue;
				if(!target.hasListeners(Snapshot.PROPAGATION)) continue;
				if(target.isDisposed()) continue; // A listener might have disposed it

				Snapshot view = interactedRoot != null ? replayPath(target, root, interactedRoot) : null;
				logger.debug("Notifying {} ({} rows)", target, view != null ? view.getRowCount() : 0);
				target.handlePropagation(new PropagationEvent(identifiers, view, config.getPayload(), sourceId, config.isMutableAction()));
			}
		}
		finally {
			namespace.exit(sourceId);
			context.exitPropagation();
		}
	}
}
