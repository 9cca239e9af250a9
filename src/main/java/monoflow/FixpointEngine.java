/**
 * Copyright (C) 2013 Rohan Padhye
 * 
 * This library is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as 
 * published by the Free Software Foundation, either version 2.1 of the 
 * License, or (at your option) any later version.
 * 
 * This library is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 * 
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 * 
 */
package monoflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * A round-based fixpoint engine for monotone data flow problems whose values
 * are sets of data items.
 *
 * <p>
 * The engine owns four maps from nodes to sets of data items: IN and OUT
 * (the values at the entry and exit of each node) and GEN and CUT (the
 * local effect of each node). One engine serves both directions of
 * analysis: the {@link Direction} selects which of IN and OUT is
 * <em>propagated</em> from the graph neighbours returned by the
 * {@link FlowEdges}, and which is <em>transferred</em> from the propagated
 * value as <tt>(propagated \ CUT) &cup; GEN</tt>.
 * </p>
 *
 * <p>
 * Every round refreshes the GEN and CUT sets of all nodes through the
 * {@link FlowProblem}, then propagates and then transfers, each phase
 * over all nodes. There is no work-list: every round visits every node.
 * A phase reports a change if the total number of elements in the map it
 * recomputes differs from before, which under monotone updates is
 * equivalent to a change of any set. The analysis stops after the first
 * round in which neither phase changes anything.
 * </p>
 *
 * <p>
 * A node may be seeded with a boundary value (e.g. the IN of the entry node
 * of a forward analysis). The seeded node is pinned: its propagated value is
 * never recomputed, so the boundary value holds for the whole run even if
 * the node has neighbours of its own.
 * </p>
 *
 * <p>
 * An engine instance is not thread-safe. {@link #initialize(Collection)}
 * discards all state of a previous run.
 * </p>
 *
 * @param <N> the type of a node in the CFG
 * @param <D> the type of a data item tracked per node
 */
public class FixpointEngine<N,D> {

	private static final Logger logger = LoggerFactory.getLogger(FixpointEngine.class);

	/** The direction of analysis. */
	private final Direction direction;

	/** Supplies the meet operator and the local gen/cut sets. */
	private final FlowProblem<N,D> problem;

	/** Supplies the neighbours whose values flow into a node. */
	private final FlowEdges<N> edges;

	/** Creates every set stored in the four maps. */
	private final SetFactory<D> setFactory;

	/** The maximum number of rounds of a run, or <tt>0</tt> for no limit. */
	private int maxRounds;

	/** Whether to log every round at INFO instead of DEBUG level. */
	private boolean verbose;

	/** The distinct nodes of the current run, in the order they were given. */
	private List<N> nodes;

	/** The data flow values at the entry of each node. */
	private final Map<N,Set<D>> inValues;

	/** The data flow values at the exit of each node. */
	private final Map<N,Set<D>> outValues;

	/** The data items generated by each node. */
	private final Map<N,Set<D>> genValues;

	/** The data items destroyed by each node. */
	private final Map<N,Set<D>> cutValues;

	/** The node holding the boundary value, if any. */
	private N seededNode;

	/** Whether a boundary value has been set in this run. */
	private boolean seeded;

	/** The number of rounds performed by the last call to {@link #runToFixpoint()}. */
	private int rounds;

	/**
	 * Constructs an engine whose per-node sets are hash sets.
	 *
	 * @param direction the direction of analysis
	 * @param problem the meet operator and local gen/cut sets
	 * @param edges the predecessors (forward) or successors (backward) of each node
	 */
	public FixpointEngine(Direction direction, FlowProblem<N,D> problem, FlowEdges<N> edges) {
		this(direction, problem, edges, SetFactory.<D>hashed());
	}

	/**
	 * Constructs an engine.
	 *
	 * @param direction the direction of analysis
	 * @param problem the meet operator and local gen/cut sets
	 * @param edges the predecessors (forward) or successors (backward) of each node
	 * @param setFactory creates the per-node sets, and so fixes the equality of data items
	 */
	public FixpointEngine(Direction direction, FlowProblem<N,D> problem, FlowEdges<N> edges, SetFactory<D> setFactory) {
		this.direction = Preconditions.checkNotNull(direction, "direction");
		this.problem = Preconditions.checkNotNull(problem, "problem");
		this.edges = Preconditions.checkNotNull(edges, "edges");
		this.setFactory = Preconditions.checkNotNull(setFactory, "setFactory");
		this.nodes = new ArrayList<N>();
		this.inValues = new LinkedHashMap<N,Set<D>>();
		this.outValues = new LinkedHashMap<N,Set<D>>();
		this.genValues = new LinkedHashMap<N,Set<D>>();
		this.cutValues = new LinkedHashMap<N,Set<D>>();
	}

	/**
	 * Starts a new run over the given nodes: all four maps are reset to map
	 * every node to an empty set, and any previous boundary value is dropped.
	 *
	 * @param nodes the nodes to analyse; duplicates are ignored
	 */
	public void initialize(Collection<? extends N> nodes) {
		Preconditions.checkNotNull(nodes, "nodes");
		this.nodes = new ArrayList<N>(new LinkedHashSet<N>(nodes));
		inValues.clear();
		outValues.clear();
		genValues.clear();
		cutValues.clear();
		for (N node : this.nodes) {
			Preconditions.checkNotNull(node, "null node in %s", nodes);
			inValues.put(node, setFactory.newSet());
			outValues.put(node, setFactory.newSet());
			genValues.put(node, setFactory.newSet());
			cutValues.put(node, setFactory.newSet());
		}
		seededNode = null;
		seeded = false;
		rounds = 0;
	}

	/**
	 * Sets the boundary value: the IN of <tt>node</tt> for a forward analysis,
	 * or its OUT for a backward analysis. The value is copied, and the node is
	 * excluded from propagation for the rest of the run.
	 *
	 * @param node a node of the current run
	 * @param value the boundary value
	 * @throws IllegalArgumentException if <tt>node</tt> is not part of the current run
	 */
	public void seed(N node, Set<D> value) {
		Preconditions.checkArgument(inValues.containsKey(node), "Node %s is not part of the analysed nodes", node);
		Preconditions.checkNotNull(value, "value");
		propagatedValues().put(node, setFactory.copyOf(value));
		seededNode = node;
		seeded = true;
	}

	/**
	 * Lets the flow problem update the GEN and CUT sets of one node.
	 *
	 * @param node a node of the current run
	 */
	public void refreshLocal(N node) {
		Preconditions.checkArgument(genValues.containsKey(node), "Node %s is not part of the analysed nodes", node);
		problem.updateGen(node, genValues.get(node));
		problem.updateCut(node, cutValues.get(node));
	}

	/**
	 * Recomputes the propagated value of every node except the seeded one as
	 * the meet over the transferred values of its neighbours.
	 *
	 * <p>A node without neighbours gets the empty set. Otherwise the meet is
	 * folded starting from the first neighbour's value rather than from the
	 * empty set, which would make every intersection empty.</p>
	 *
	 * @return <tt>true</tt> if the total size of the propagated values changed
	 */
	public boolean propagate() {
		Map<N,Set<D>> target = propagatedValues();
		Map<N,Set<D>> source = transferredValues();
		int before = FlowMaps.totalSize(target);
		for (N node : nodes) {
			if (seeded && node.equals(seededNode)) {
				continue;
			}
			List<N> neighbours = edges.sourcesOf(node);
			Set<D> value;
			if (neighbours == null || neighbours.isEmpty()) {
				value = setFactory.newSet();
			} else {
				Iterator<N> it = neighbours.iterator();
				Set<D> accumulator = FlowMaps.valueOf(source, it.next());
				while (it.hasNext()) {
					accumulator = meet(accumulator, FlowMaps.valueOf(source, it.next()));
				}
				value = setFactory.copyOf(accumulator);
			}
			target.put(node, value);
		}
		return before != FlowMaps.totalSize(target);
	}

	/**
	 * Recomputes the transferred value of every node as
	 * <tt>(propagated \ CUT) &cup; GEN</tt>. All nodes are computed from the
	 * same snapshot, so no update is visible to another node in this phase.
	 *
	 * @return <tt>true</tt> if the total size of the transferred values changed
	 */
	public boolean transfer() {
		Map<N,Set<D>> target = transferredValues();
		int before = FlowMaps.totalSize(target);
		Map<N,Set<D>> result = FlowMaps.setUnion(
				FlowMaps.setMinus(propagatedValues(), cutValues, setFactory), genValues, setFactory);
		target.clear();
		for (N node : nodes) {
			target.put(node, result.get(node));
		}
		return before != FlowMaps.totalSize(target);
	}

	/**
	 * Runs rounds of refresh, propagate and transfer until a round changes
	 * neither the propagated nor the transferred values.
	 *
	 * <p>This terminates if the meet and the gen/cut updates are monotone and the
	 * lattice has finite height. Otherwise it may run forever, unless a round
	 * limit has been set.</p>
	 *
	 * @throws NonConvergenceException if the round limit is reached first
	 */
	public void runToFixpoint() {
		rounds = 0;
		boolean changed;
		do {
			if (maxRounds > 0 && rounds >= maxRounds) {
				throw new NonConvergenceException(rounds, maxRounds);
			}
			rounds++;
			for (N node : nodes) {
				refreshLocal(node);
			}
			boolean propagated = propagate();
			boolean transferred = transfer();
			changed = propagated || transferred;
			if (verbose) {
				logger.info("{} round {}: propagate changed = {}, transfer changed = {}", direction, rounds, propagated, transferred);
			} else {
				logger.debug("{} round {}: propagate changed = {}, transfer changed = {}", direction, rounds, propagated, transferred);
			}
		} while (changed);
		logger.debug("{} analysis of {} nodes converged after {} rounds", direction, nodes.size(), rounds);
	}

	// Null results of the meet are taken as the empty set.
	private Set<D> meet(Set<D> op1, Set<D> op2) {
		Set<D> result = problem.meet(op1, op2);
		if (result == null) {
			return Collections.emptySet();
		}
		return result;
	}

	private Map<N,Set<D>> propagatedValues() {
		return direction == Direction.FORWARD ? inValues : outValues;
	}

	private Map<N,Set<D>> transferredValues() {
		return direction == Direction.FORWARD ? outValues : inValues;
	}

	/**
	 * Returns the data flow value at the entry of a node.
	 *
	 * @return an unmodifiable view of IN, or the empty set for unknown nodes
	 */
	public Set<D> getIn(N node) {
		return Collections.unmodifiableSet(FlowMaps.valueOf(inValues, node));
	}

	/**
	 * Returns the data flow value at the exit of a node.
	 *
	 * @return an unmodifiable view of OUT, or the empty set for unknown nodes
	 */
	public Set<D> getOut(N node) {
		return Collections.unmodifiableSet(FlowMaps.valueOf(outValues, node));
	}

	/** Returns an unmodifiable view of the GEN set of a node. */
	public Set<D> getGen(N node) {
		return Collections.unmodifiableSet(FlowMaps.valueOf(genValues, node));
	}

	/** Returns an unmodifiable view of the CUT set of a node. */
	public Set<D> getCut(N node) {
		return Collections.unmodifiableSet(FlowMaps.valueOf(cutValues, node));
	}

	/** Returns an unmodifiable view of the IN values of all nodes. */
	public Map<N,Set<D>> getInMap() {
		return Collections.unmodifiableMap(inValues);
	}

	/** Returns an unmodifiable view of the OUT values of all nodes. */
	public Map<N,Set<D>> getOutMap() {
		return Collections.unmodifiableMap(outValues);
	}

	/** Returns the distinct nodes of the current run. */
	public List<N> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	public Direction getDirection() {
		return direction;
	}

	public SetFactory<D> getSetFactory() {
		return setFactory;
	}

	/**
	 * Returns the number of rounds of the last run, including the final round
	 * which changed nothing.
	 */
	public int getRounds() {
		return rounds;
	}

	public int getMaxRounds() {
		return maxRounds;
	}

	/**
	 * Limits the number of rounds of a run.
	 *
	 * @param maxRounds the maximum number of rounds, or <tt>0</tt> for no limit
	 */
	public void setMaxRounds(int maxRounds) {
		Preconditions.checkArgument(maxRounds >= 0, "maxRounds must not be negative: %s", maxRounds);
		this.maxRounds = maxRounds;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
