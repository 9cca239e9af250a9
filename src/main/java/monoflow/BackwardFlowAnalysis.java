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

import java.util.List;

/**
 * A generic backward-flow analysis over sets of data items, such as live
 * variables or very busy expressions.
 *
 * <p>
 * The OUT value of a node is the meet of the IN values of its successors
 * (the empty set if it has none), and its IN value is
 * <tt>(OUT \ CUT) &cup; GEN</tt>. The boundary value given to the
 * <tt>analyze</tt> methods is the OUT of the initial node, and results are
 * read from IN values.
 * </p>
 *
 * <p>
 * This is the class that client analyses will extend in order to perform
 * backward-flow analysis.
 * </p>
 *
 * @param <N> the type of a node in the CFG
 * @param <D> the type of a data item tracked per node
 */
public abstract class BackwardFlowAnalysis<N,D> extends FlowAnalysis<N,D> {

	/** Constructs a new backward-flow analysis. */
	public BackwardFlowAnalysis() {
		super(Direction.BACKWARD);
	}

	/**
	 * Returns the successors of a node in the control-flow graph.
	 *
	 * @param node a node of the analysed graph
	 * @return the nodes with an edge from <tt>node</tt>
	 */
	protected abstract List<N> successors(N node);

	@Override
	protected final List<N> flowSources(N node) {
		return successors(node);
	}

}
