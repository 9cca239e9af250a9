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
 * Thrown when a fixpoint computation exceeds its configured maximum number
 * of rounds.
 *
 * <p>For monotone flow problems over a lattice of finite height this can only
 * happen if the limit is set too low; otherwise it usually indicates a
 * non-monotone meet or gen/cut update.</p>
 *
 */
public class NonConvergenceException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** The number of completed rounds. */
	private final int rounds;

	/** The configured limit. */
	private final int maxRounds;

	/**
	 * Constructs a new exception.
	 *
	 * @param rounds the number of rounds completed without reaching a fixpoint
	 * @param maxRounds the configured maximum number of rounds
	 */
	public NonConvergenceException(int rounds, int maxRounds) {
		super("No fixpoint reached after " + rounds + " rounds (limit is " + maxRounds + ")");
		this.rounds = rounds;
		this.maxRounds = maxRounds;
	}

	public int getRounds() {
		return rounds;
	}

	public int getMaxRounds() {
		return maxRounds;
	}
}
