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

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.collect.Sets;

/**
 * The two common meet operators over sets of data items.
 *
 * <p>Both return a new set and leave the operands untouched, so they can be
 * used directly as the body of {@link FlowProblem#meet(Set, Set)}.</p>
 *
 */
public final class Meets {

	private Meets() {
	}

	/**
	 * Meet for "may" properties, which hold if they hold along any path
	 * (e.g. reaching definitions, live variables).
	 */
	public static <D> Set<D> union(Set<D> op1, Set<D> op2) {
		return new LinkedHashSet<D>(Sets.union(op1, op2));
	}

	/**
	 * Meet for "must" properties, which hold only if they hold along all paths
	 * (e.g. available expressions, very busy expressions).
	 */
	public static <D> Set<D> intersection(Set<D> op1, Set<D> op2) {
		return new LinkedHashSet<D>(Sets.intersection(op1, op2));
	}

}
