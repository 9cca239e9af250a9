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

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Preconditions;

/**
 * Creates the per-node sets of data items, and with them fixes the
 * equality contract of the data items.
 *
 * <p>{@link #hashed()} sets compare data items with <tt>equals</tt>/<tt>hashCode</tt>,
 * {@link #ordered(Comparator)} sets with a caller-supplied comparator.</p>
 *
 * @param <D> the type of a data item
 */
public abstract class SetFactory<D> {

	/**
	 * Returns a new, empty and mutable set.
	 *
	 * @return a new empty set
	 */
	public abstract Set<D> newSet();

	/**
	 * Returns a new mutable set holding the given elements.
	 *
	 * @param elements the elements to copy
	 * @return a new set containing <tt>elements</tt>
	 */
	public Set<D> copyOf(Collection<? extends D> elements) {
		Set<D> result = newSet();
		result.addAll(elements);
		return result;
	}

	/**
	 * Returns a factory of insertion-ordered hash sets. This is the default.
	 */
	public static <D> SetFactory<D> hashed() {
		return new SetFactory<D>() {
			@Override
			public Set<D> newSet() {
				return new LinkedHashSet<D>();
			}
		};
	}

	/**
	 * Returns a factory of sorted sets which compare data items with the
	 * given comparator.
	 *
	 * @param comparator the ordering (and equality) of data items
	 */
	public static <D> SetFactory<D> ordered(final Comparator<? super D> comparator) {
		Preconditions.checkNotNull(comparator, "comparator");
		return new SetFactory<D>() {
			@Override
			public Set<D> newSet() {
				return new TreeSet<D>(comparator);
			}
		};
	}

	/**
	 * Returns a factory of sorted sets using the natural ordering of data items.
	 */
	public static <D extends Comparable<? super D>> SetFactory<D> natural() {
		return new SetFactory<D>() {
			@Override
			public Set<D> newSet() {
				return new TreeSet<D>();
			}
		};
	}

}
