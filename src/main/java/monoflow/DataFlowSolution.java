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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * A mapping of program points to results of data flow analysis.
 *
 * <p>A solution is a snapshot taken once the analysis has converged: it
 * holds the value at the entry and at the exit of every analysed node, and
 * is not affected by later runs of the analysis that produced it.</p>
 *
 * @param <N> the type of a node in the CFG
 * @param <A> the type of a data flow value
 *
 */
public class DataFlowSolution<N,A> {

	/** A map of nodes to data flow values at the entry of the node. */
	private final ImmutableMap<N,A> inValues;

	/** A map of nodes to data flow values at the exit of the node. */
	private final ImmutableMap<N,A> outValues;

	/**
	 * Constructs a data flow solution with the given IN and OUT values.
	 *
	 * @param inValues a map of nodes to data flow values at their entry
	 * @param outValues a map of nodes to data flow values at their exit
	 */
	public DataFlowSolution(Map<N,A> inValues, Map<N,A> outValues) {
		this.inValues = ImmutableMap.copyOf(inValues);
		this.outValues = ImmutableMap.copyOf(outValues);
	}

	/**
	 * Returns the data flow value at the entry of a node.
	 *
	 * @param node a program point
	 * @return the data flow value at the entry of <tt>node</tt>, or
	 *         <tt>null</tt> if the node was not analysed
	 *
	 */
	public A getValueBefore(N node) {
		return inValues.get(node);
	}

	/**
	 * Returns the data flow value at the exit of a node.
	 *
	 * @param node a program point
	 * @return the data flow value at the exit of <tt>node</tt>, or
	 *         <tt>null</tt> if the node was not analysed
	 *
	 */
	public A getValueAfter(N node) {
		return outValues.get(node);
	}

	/**
	 * Returns the analysed nodes, in the order they were analysed.
	 */
	public Set<N> getNodes() {
		return inValues.keySet();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (N node : inValues.keySet()) {
			sb.append(node).append(": IN = ").append(inValues.get(node))
				.append(", OUT = ").append(outValues.get(node)).append('\n');
		}
		return sb.toString();
	}
}
