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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * A generic intra-procedural data flow analysis over sets of data items.
 *
 * <p>
 * This class is a base for the forward and backward analysis classes which
 * client analyses extend. The analysis itself is the {@link FlowProblem}
 * (meet, gen and cut); each call to one of the <tt>analyze</tt> methods
 * creates a fresh {@link FixpointEngine} in the direction of this analysis,
 * so no state is carried over from one call to the next.
 * </p>
 *
 * <p>
 * The boundary value is given as the <tt>initialSet</tt> of the
 * <tt>initial</tt> node: its IN for a forward analysis, its OUT for a
 * backward one. It holds for the whole run.
 * </p>
 *
 * @param <N> the type of a node in the CFG
 * @param <D> the type of a data item tracked per node
 *
 * @see ForwardFlowAnalysis
 * @see BackwardFlowAnalysis
 */
public abstract class FlowAnalysis<N,D> implements FlowProblem<N,D> {

	/** The direction of this analysis. */
	protected final Direction direction;

	/**
	 * Whether to log the progress of every round at INFO level.
	 *
	 * <p>The default value for this flag is <tt>false</tt>.</p>
	 */
	protected boolean verbose;

	/**
	 * The maximum number of rounds before a run is abandoned with a
	 * {@link NonConvergenceException}, or <tt>0</tt> for no limit.
	 *
	 * <p>The default value is <tt>0</tt>.</p>
	 */
	protected int maxRounds;

	/**
	 * Creates the per-node sets of data items. Defaults to
	 * {@link SetFactory#hashed() hash sets}.
	 */
	protected SetFactory<D> setFactory;

	/** The engine of the last run, if any. */
	private FixpointEngine<N,D> engine;

	/**
	 * Constructs a new analysis.
	 *
	 * @param direction the direction of analysis
	 */
	protected FlowAnalysis(Direction direction) {
		this.direction = Preconditions.checkNotNull(direction, "direction");
		this.setFactory = SetFactory.hashed();
	}

	/**
	 * Returns the nodes whose values flow into the given node in the
	 * direction of this analysis.
	 */
	protected abstract List<N> flowSources(N node);

	/**
	 * Runs the analysis and returns the result at one node: the OUT of
	 * <tt>end</tt> for a forward analysis, its IN for a backward analysis.
	 *
	 * @param nodes the nodes to analyse
	 * @param initial the node holding the boundary value
	 * @param end the node whose result to return
	 * @param initialSet the boundary value
	 * @return the data items at <tt>end</tt>
	 * @throws IllegalArgumentException if <tt>initial</tt> or <tt>end</tt> is not in <tt>nodes</tt>
	 * @throws NonConvergenceException if a round limit is set and reached
	 */
	public Set<D> analyze(List<N> nodes, N initial, N end, Set<D> initialSet) {
		checkMember(nodes, end, "end");
		FixpointEngine<N,D> engine = solve(nodes, initial, initialSet);
		return Collections.unmodifiableSet(setFactory.copyOf(resultValues(engine).get(end)));
	}

	/**
	 * Runs the analysis and returns the result at every node: the OUT values
	 * for a forward analysis, the IN values for a backward analysis.
	 *
	 * @param nodes the nodes to analyse
	 * @param initial the node holding the boundary value
	 * @param end a node of <tt>nodes</tt>; only checked for membership
	 * @param initialSet the boundary value
	 * @return an unmodifiable map of every node to its result
	 * @throws IllegalArgumentException if <tt>initial</tt> or <tt>end</tt> is not in <tt>nodes</tt>
	 * @throws NonConvergenceException if a round limit is set and reached
	 */
	public Map<N,Set<D>> analyzeFull(List<N> nodes, N initial, N end, Set<D> initialSet) {
		checkMember(nodes, end, "end");
		FixpointEngine<N,D> engine = solve(nodes, initial, initialSet);
		return Collections.unmodifiableMap(snapshot(resultValues(engine)));
	}

	/**
	 * Runs the analysis and returns both the IN and OUT values of every node.
	 *
	 * @param nodes the nodes to analyse
	 * @param initial the node holding the boundary value
	 * @param initialSet the boundary value
	 * @return the data flow solution
	 * @throws IllegalArgumentException if <tt>initial</tt> is not in <tt>nodes</tt>
	 */
	public DataFlowSolution<N,Set<D>> analyzeSolution(List<N> nodes, N initial, Set<D> initialSet) {
		FixpointEngine<N,D> engine = solve(nodes, initial, initialSet);
		return new DataFlowSolution<N,Set<D>>(snapshot(engine.getInMap()), snapshot(engine.getOutMap()));
	}

	/**
	 * Runs the analysis without a boundary value, so that every node without
	 * neighbours in the direction of analysis starts from the empty set, and
	 * returns both the IN and OUT values of every node.
	 *
	 * @param nodes the nodes to analyse
	 * @return the data flow solution
	 */
	public DataFlowSolution<N,Set<D>> analyzeSolution(List<N> nodes) {
		FixpointEngine<N,D> engine = newEngine(nodes);
		engine.runToFixpoint();
		return new DataFlowSolution<N,Set<D>>(snapshot(engine.getInMap()), snapshot(engine.getOutMap()));
	}

	/**
	 * Returns the number of rounds the last run needed to converge, or
	 * <tt>0</tt> if the analysis has not been run.
	 */
	public int getRounds() {
		return engine == null ? 0 : engine.getRounds();
	}

	// Builds a fresh engine, seeds it and runs it to a fixpoint.
	private FixpointEngine<N,D> solve(List<N> nodes, N initial, Set<D> initialSet) {
		checkMember(nodes, initial, "initial");
		Preconditions.checkNotNull(initialSet, "initialSet");
		FixpointEngine<N,D> engine = newEngine(nodes);
		engine.seed(initial, initialSet);
		engine.runToFixpoint();
		return engine;
	}

	private FixpointEngine<N,D> newEngine(List<N> nodes) {
		Preconditions.checkNotNull(nodes, "nodes");
		FixpointEngine<N,D> engine = new FixpointEngine<N,D>(direction, this, new FlowEdges<N>() {
			@Override
			public List<N> sourcesOf(N node) {
				return flowSources(node);
			}
		}, setFactory);
		engine.setMaxRounds(maxRounds);
		engine.setVerbose(verbose);
		engine.initialize(nodes);
		this.engine = engine;
		return engine;
	}

	private Map<N,Set<D>> resultValues(FixpointEngine<N,D> engine) {
		return direction == Direction.FORWARD ? engine.getOutMap() : engine.getInMap();
	}

	// Copies every set so that the result does not share state with the engine.
	private Map<N,Set<D>> snapshot(Map<N,Set<D>> values) {
		Map<N,Set<D>> result = new LinkedHashMap<N,Set<D>>();
		for (Map.Entry<N,Set<D>> entry : values.entrySet()) {
			result.put(entry.getKey(), Collections.unmodifiableSet(setFactory.copyOf(entry.getValue())));
		}
		return result;
	}

	private static <N> void checkMember(List<N> nodes, N node, String role) {
		Preconditions.checkNotNull(nodes, "nodes");
		Preconditions.checkArgument(node != null && nodes.contains(node),
				"The %s node %s is not part of the analysed nodes", role, node);
	}

}
