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

import java.util.Set;

/**
 * The client side of a monotone data flow problem: the meet operator and
 * the local (per-node) gen and cut sets.
 *
 * <p>The {@link FixpointEngine} calls {@link #updateGen(Object, Set) updateGen}
 * and {@link #updateCut(Object, Set) updateCut} for every node at the start of
 * every round, so both should be cheap or cached by the implementation.</p>
 *
 * <p>Termination of the engine is guaranteed only if the meet and the
 * gen/cut updates are monotone and the lattice of data items is of finite
 * height. This is not checked.</p>
 *
 * @param <N> the type of a node in the CFG
 * @param <D> the type of a data item tracked per node
 */
public interface FlowProblem<N,D> {

	/**
	 * Returns the meet of two sets of data items. The operation must be
	 * commutative, associative and idempotent; typically this is the
	 * {@link Meets#union(Set, Set) union} for may-analyses or the
	 * {@link Meets#intersection(Set, Set) intersection} for must-analyses.
	 *
	 * <p>Implementations must not modify the operands.</p>
	 *
	 * @param op1 the first operand
	 * @param op2 the second operand
	 * @return a set which is the meet of the two operands
	 */
	public Set<D> meet(Set<D> op1, Set<D> op2);

	/**
	 * Updates the data items generated locally by a node.
	 *
	 * @param node the node whose gen set to update
	 * @param gen the mutable gen set of <tt>node</tt>, as left by the previous round
	 */
	public void updateGen(N node, Set<D> gen);

	/**
	 * Updates the data items destroyed locally by a node.
	 *
	 * @param node the node whose cut set to update
	 * @param cut the mutable cut set of <tt>node</tt>, as left by the previous round
	 */
	public void updateCut(N node, Set<D> cut);

}
