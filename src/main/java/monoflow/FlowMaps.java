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
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Sets;

/**
 * Key-wise set algebra over maps from nodes to sets of data items.
 *
 * <p>Each operation is applied to every key in the union of the key sets of
 * its two operands. A key missing from an operand behaves as if it was
 * mapped to the empty set. The operands are never modified; the result is
 * a new insertion-ordered map with keys of the first operand first.</p>
 *
 */
public final class FlowMaps {

	private FlowMaps() {
	}

	/**
	 * Returns <tt>a[k] \ b[k]</tt> for every key <tt>k</tt>.
	 */
	public static <N,D> Map<N,Set<D>> setMinus(Map<N,Set<D>> a, Map<N,Set<D>> b) {
		return setMinus(a, b, SetFactory.<D>hashed());
	}

	/**
	 * Returns <tt>a[k] \ b[k]</tt> for every key <tt>k</tt>, with result sets
	 * created by the given factory.
	 */
	public static <N,D> Map<N,Set<D>> setMinus(Map<N,Set<D>> a, Map<N,Set<D>> b, SetFactory<D> factory) {
		Map<N,Set<D>> result = new LinkedHashMap<N,Set<D>>();
		for (N key : Sets.union(a.keySet(), b.keySet())) {
			result.put(key, factory.copyOf(Sets.difference(valueOf(a, key), valueOf(b, key))));
		}
		return result;
	}

	/**
	 * Returns <tt>a[k] &cup; b[k]</tt> for every key <tt>k</tt>.
	 */
	public static <N,D> Map<N,Set<D>> setUnion(Map<N,Set<D>> a, Map<N,Set<D>> b) {
		return setUnion(a, b, SetFactory.<D>hashed());
	}

	/**
	 * Returns <tt>a[k] &cup; b[k]</tt> for every key <tt>k</tt>, with result sets
	 * created by the given factory.
	 */
	public static <N,D> Map<N,Set<D>> setUnion(Map<N,Set<D>> a, Map<N,Set<D>> b, SetFactory<D> factory) {
		Map<N,Set<D>> result = new LinkedHashMap<N,Set<D>>();
		for (N key : Sets.union(a.keySet(), b.keySet())) {
			result.put(key, factory.copyOf(Sets.union(valueOf(a, key), valueOf(b, key))));
		}
		return result;
	}

	/**
	 * Returns <tt>a[k] &cap; b[k]</tt> for every key <tt>k</tt>.
	 */
	public static <N,D> Map<N,Set<D>> setIntersect(Map<N,Set<D>> a, Map<N,Set<D>> b) {
		return setIntersect(a, b, SetFactory.<D>hashed());
	}

	/**
	 * Returns <tt>a[k] &cap; b[k]</tt> for every key <tt>k</tt>, with result sets
	 * created by the given factory.
	 */
	public static <N,D> Map<N,Set<D>> setIntersect(Map<N,Set<D>> a, Map<N,Set<D>> b, SetFactory<D> factory) {
		Map<N,Set<D>> result = new LinkedHashMap<N,Set<D>>();
		for (N key : Sets.union(a.keySet(), b.keySet())) {
			result.put(key, factory.copyOf(Sets.intersection(valueOf(a, key), valueOf(b, key))));
		}
		return result;
	}

	/**
	 * Returns the set mapped to a key, or the empty set if there is none.
	 */
	public static <N,D> Set<D> valueOf(Map<N,Set<D>> map, N key) {
		Set<D> value = map.get(key);
		if (value == null) {
			return Collections.emptySet();
		}
		return value;
	}

	/**
	 * Returns the sum of the sizes of all sets in a map.
	 */
	public static int totalSize(Map<?,? extends Set<?>> map) {
		int size = 0;
		for (Set<?> value : map.values()) {
			if (value != null) {
				size += value.size();
			}
		}
		return size;
	}

}
