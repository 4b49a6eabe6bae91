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

package edu.cornell.simpar.strategy;

import java.util.Arrays;

import edu.cornell.simpar.utility.ShapeMismatchException;
import edu.cornell.simpar.utility.SumArray;

// Distribution of isolation lengths: isolationProps[i] of the discovered isolate for
// isolationLengths[i] days.
public class IsolationRegime {

	public static final double EPSILON = 1e-9;

	private final double[] isolationLengths;
	private final double[] isolationProps;

	public IsolationRegime (double[] isolationLengths, double[] isolationProps) {
		ShapeMismatchException.checkLength (isolationProps, isolationLengths.length, "Isolation proportions");
		if (isolationLengths.length == 0) throw new IllegalArgumentException ("Need at least one isolation length.");
		for (int i=0; i<isolationLengths.length; i++) {
			if (!(isolationLengths[i] > 0d)) throw new IllegalArgumentException ("Isolation lengths have to be positive.");
			if (!(isolationProps[i] >= 0d)) throw new IllegalArgumentException ("Isolation proportions have to be non-negative.");
		}
		if (Math.abs (SumArray.getSum (isolationProps) - 1d) > EPSILON) throw new IllegalArgumentException ("Isolation proportions have to sum to one.");
		this.isolationLengths = isolationLengths.clone();
		this.isolationProps = isolationProps.clone();
	}

	public double[] getIsolationLengths () {
		return this.isolationLengths.clone();
	}

	public double[] getIsolationProps () {
		return this.isolationProps.clone();
	}

	// Entry i is the fraction of the people discovered i generations ago who are still isolating.
	// E.g. lengths {5,10} days with proportions {0.8,0.2} and 4 day generations give {1, 0.4, 0.1}.
	public double[] isolationFractions (double generationTime) {
		if (!(generationTime > 0d)) throw new IllegalArgumentException ("Generation time has to be positive (not " + generationTime + ").");
		double longest = 0d;
		for (double length : this.isolationLengths) longest = Math.max (longest, length);
		int maxIsolation = (int) Math.ceil (longest / generationTime);

		double[] isolationFrac = new double[maxIsolation];
		isolationFrac[0] = 1d;
		for (int t=1; t<maxIsolation; t++) {
			for (int i=0; i<this.isolationLengths.length; i++) {
				double remaining = (this.isolationLengths[i] - generationTime * t) / generationTime;
				isolationFrac[t] += this.isolationProps[i] * Math.min (Math.max (remaining, 0d), 1d);
			}
		}
		return isolationFrac;
	}

	public String toString () {
		return "isolation " + Arrays.toString (this.isolationLengths) + " days w.p. " + Arrays.toString (this.isolationProps);
	}
}
