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
 * The graph edges along which data flow values reach a node.
 *
 * <p>For a forward analysis these are the predecessors of a node in the
 * control-flow graph, for a backward analysis its successors. The order of
 * the returned nodes only affects performance, never the result.</p>
 *
 * @param <N> the type of a node in the CFG
 */
public interface FlowEdges<N> {

	/**
	 * Returns the nodes whose values flow into the given node.
	 *
	 * @param node a node of the analysed graph
	 * @return the predecessors (forward) or successors (backward) of <tt>node</tt>;
	 *         <tt>null</tt> is treated as an empty list
	 */
	public List<N> sourcesOf(N node);

}
