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
package monoflow.soot;

import java.util.ArrayList;
import java.util.List;

import monoflow.Direction;
import monoflow.FixpointEngine;
import monoflow.FlowEdges;
import monoflow.FlowProblem;
import monoflow.SetFactory;
import soot.toolkits.graph.DirectedGraph;

/**
 * Adapters for running a {@link FixpointEngine} over Soot's directed graphs,
 * such as {@link soot.toolkits.graph.BriefUnitGraph} or
 * {@link soot.toolkits.graph.ExceptionalUnitGraph}.
 *
 */
public final class SootFlowGraphs {

	private SootFlowGraphs() {
	}

	/**
	 * Returns the predecessor relation of a graph, for forward analyses.
	 */
	public static <N> FlowEdges<N> predecessors(final DirectedGraph<N> graph) {
		return new FlowEdges<N>() {
			@Override
			public List<N> sourcesOf(N node) {
				return graph.getPredsOf(node);
			}
		};
	}

	/**
	 * Returns the successor relation of a graph, for backward analyses.
	 */
	public static <N> FlowEdges<N> successors(final DirectedGraph<N> graph) {
		return new FlowEdges<N>() {
			@Override
			public List<N> sourcesOf(N node) {
				return graph.getSuccsOf(node);
			}
		};
	}

	/**
	 * Returns the nodes of a graph in its iteration order.
	 */
	public static <N> List<N> nodes(DirectedGraph<N> graph) {
		List<N> nodes = new ArrayList<N>(graph.size());
		for (N node : graph) {
			nodes.add(node);
		}
		return nodes;
	}

	/**
	 * Returns an engine for a forward analysis of the given graph, initialised
	 * with all nodes of the graph.
	 */
	public static <N,D> FixpointEngine<N,D> forward(DirectedGraph<N> graph, FlowProblem<N,D> problem) {
		return engine(graph, problem, Direction.FORWARD, SetFactory.<D>hashed());
	}

	/**
	 * Returns an engine for a backward analysis of the given graph, initialised
	 * with all nodes of the graph.
	 */
	public static <N,D> FixpointEngine<N,D> backward(DirectedGraph<N> graph, FlowProblem<N,D> problem) {
		return engine(graph, problem, Direction.BACKWARD, SetFactory.<D>hashed());
	}

	/**
	 * Returns an engine for an analysis of the given graph in the given
	 * direction, initialised with all nodes of the graph.
	 */
	public static <N,D> FixpointEngine<N,D> engine(DirectedGraph<N> graph, FlowProblem<N,D> problem,
			Direction direction, SetFactory<D> setFactory) {
		FlowEdges<N> edges = direction.isReverse() ? successors(graph) : predecessors(graph);
		FixpointEngine<N,D> engine = new FixpointEngine<N,D>(direction, problem, edges, setFactory);
		engine.initialize(nodes(graph));
		return engine;
	}

}
