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

/**
 * The direction in which data flow values travel along the edges of a
 * control-flow graph.
 *
 * <p>The direction decides which of the two per-node values is
 * <em>propagated</em> (computed as the meet over graph neighbours, and
 * seeded with the boundary value) and which is <em>transferred</em>
 * (computed from the propagated value using the local gen and cut sets).</p>
 *
 */
public enum Direction {

	/** IN is the meet of the predecessors' OUT values; OUT is computed from IN. */
	FORWARD,

	/** OUT is the meet of the successors' IN values; IN is computed from OUT. */
	BACKWARD;

	/**
	 * Returns <tt>true</tt> for the backward direction.
	 *
	 * @return <tt>true</tt> if values flow against the control-flow edges
	 */
	public boolean isReverse() {
		return this == BACKWARD;
	}
}
