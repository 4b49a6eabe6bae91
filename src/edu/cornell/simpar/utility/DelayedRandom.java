 /*
    This file is part of simpar.

    simpar is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    simpar is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with simpar.  If not, see <http://www.gnu.org/licenses/>.
  */

package edu.cornell.simpar.utility;

import java.util.Random;

import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;

/// a random source that is only usable if a seed was given; children are spawned deterministically for ensemble runs
public class DelayedRandom {

	private final Random myRandom;

	public DelayedRandom (Long seed) {
		if (seed == null) {
			// we do not have a seed, so we cannot use this RNG
			this.myRandom = null;
		}
		else {
			// we have a seed, so initialize the RNG properly
			this.myRandom = new Random (seed.longValue());
		}
	}

	public boolean isProper () {
		return (this.myRandom != null);
	}

	private void checkProper() {
		if (!this.isProper()) {
			throw new IllegalStateException ("The specified analysis involves randomness. Please specify a seed with --seed.");
		}
	}

	public DelayedRandom spawnOffspring() {
		// spawn a delayed random offspring
		// that guy can also be improper
		if (this.isProper()) {
			return new DelayedRandom (Long.valueOf (this.myRandom.nextLong()));
		}
		else {
			return new DelayedRandom (null);
		}
	}

	/// a commons-math generator seeded from this source, for sampling distributions
	public RandomGenerator spawnGenerator() {
		this.checkProper();
		JDKRandomGenerator generator = new JDKRandomGenerator();
		generator.setSeed (this.myRandom.nextLong());
		return generator;
	}
}
