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

package edu.cornell.simpar.sim;

import edu.cornell.simpar.population.InitialConditions;
import edu.cornell.simpar.utility.CopyArray;
import edu.cornell.simpar.utility.RateMatrixTools;
import edu.cornell.simpar.utility.ShapeMismatchException;

// Generation-stepped S/I/R epidemic over K flattened groups, with the non-susceptible
// population split into discovered (D) and hidden (H).
// All arrays are indexed [generation][group] and have maxT+1 rows.
// Invariants: S+I+R is constant per group, I+R == D+H, and new infections never exceed
// the susceptibles of the previous generation.
public class EpidemicSimulator {

	public static final double EPSILON = 1e-6;

	private final int maxT;
	private final int numGroups;

	private final double[][] susceptible;
	private final double[][] infected;
	private final double[][] recovered;
	private final double[][] discovered;
	private final double[][] hidden;

	// defaults used when a step does not override them
	private final double[][] infectionRate;
	private final double[] infectionDiscoveryFrac;
	private final double[] recoveredDiscoveryFrac;
	private final double[] outsideRate;

	private int currentGeneration;

	public EpidemicSimulator (int maxT, double[] initSusceptible, double[] initInfected, double[] initRecovered,
			double[][] infectionRate, double infectionDiscoveryFrac, double recoveredDiscoveryFrac) {
		this (maxT, initSusceptible, initInfected, initRecovered, null, null, infectionRate,
				CopyArray.nCopies (initSusceptible.length, infectionDiscoveryFrac),
				CopyArray.nCopies (initSusceptible.length, recoveredDiscoveryFrac), null);
	}

	public EpidemicSimulator (int maxT, InitialConditions init, double[][] infectionRate,
			double[] infectionDiscoveryFrac, double[] recoveredDiscoveryFrac, double[] outsideRate) {
		this (maxT, init.susceptible, init.infected, init.recovered, init.discovered, init.hidden,
				infectionRate, infectionDiscoveryFrac, recoveredDiscoveryFrac, outsideRate);
	}

	// initDiscovered and initHidden may both be null, in which case the initial infected are split
	// by infectionDiscoveryFrac and all the initially recovered count as discovered.
	// outsideRate may be null (no outside infections).
	public EpidemicSimulator (int maxT, double[] initSusceptible, double[] initInfected, double[] initRecovered,
			double[] initDiscovered, double[] initHidden, double[][] infectionRate,
			double[] infectionDiscoveryFrac, double[] recoveredDiscoveryFrac, double[] outsideRate) {
		if (maxT < 0) throw new IllegalArgumentException ("Horizon has to be non-negative (not " + maxT + ").");
		this.maxT = maxT;
		this.numGroups = initSusceptible.length;
		final int K = this.numGroups;

		ShapeMismatchException.checkLength (initInfected, K, "Initial infected");
		ShapeMismatchException.checkLength (initRecovered, K, "Initial recovered");
		ShapeMismatchException.checkSquare (infectionRate, K, "Infection rate");
		if ((initDiscovered == null) != (initHidden == null)) {
			throw new IllegalArgumentException ("Initial discovered and hidden have to be given together.");
		}

		this.infectionRate = CopyArray.deepCopy (infectionRate);
		this.infectionDiscoveryFrac = validateDiscoveryFrac (infectionDiscoveryFrac, K);
		this.recoveredDiscoveryFrac = validateDiscoveryFrac (recoveredDiscoveryFrac, K);
		this.outsideRate = (outsideRate == null ? new double[K] : validateRate (outsideRate, K, "Outside rate"));
		if (!RateMatrixTools.allEntriesNonNegative (this.infectionRate)) {
			throw new IllegalArgumentException ("Infection rates have to be non-negative.");
		}

		if (initDiscovered == null) {
			initDiscovered = new double[K];
			initHidden = new double[K];
			for (int k=0; k<K; k++) {
				initDiscovered[k] = initInfected[k] * this.infectionDiscoveryFrac[k] + initRecovered[k];
				initHidden[k] = initInfected[k] * (1d - this.infectionDiscoveryFrac[k]);
			}
		}
		ShapeMismatchException.checkLength (initDiscovered, K, "Initial discovered");
		ShapeMismatchException.checkLength (initHidden, K, "Initial hidden");

		this.susceptible = new double[maxT+1][];
		this.infected = new double[maxT+1][];
		this.recovered = new double[maxT+1][];
		this.discovered = new double[maxT+1][];
		this.hidden = new double[maxT+1][];

		this.susceptible[0] = checkNonNegative (initSusceptible, "susceptible");
		this.infected[0] = checkNonNegative (initInfected, "infected");
		this.recovered[0] = checkNonNegative (initRecovered, "recovered");
		this.discovered[0] = checkNonNegative (initDiscovered, "discovered");
		this.hidden[0] = checkNonNegative (initHidden, "hidden");
		for (int t=1; t<=maxT; t++) {
			this.susceptible[t] = new double[K];
			this.infected[t] = new double[K];
			this.recovered[t] = new double[K];
			this.discovered[t] = new double[K];
			this.hidden[t] = new double[K];
		}

		this.currentGeneration = 0;
		int mismatch = this.findDiscoveryPartitionMismatch (0);
		if (mismatch >= 0) {
			throw new IllegalArgumentException ("Group " + mismatch + ": initial infected + recovered differ from initial discovered + hidden.");
		}
	}

	public int getMaxT () {
		return this.maxT;
	}

	public int getNumGroups () {
		return this.numGroups;
	}

	public int getCurrentGeneration () {
		return this.currentGeneration;
	}

	public boolean isFinished () {
		return this.currentGeneration >= this.maxT;
	}

	/// a copy of the whole [maxT+1][K] array, rows beyond the current generation are zero
	public double[][] getBucket (Bucket bucket) {
		return CopyArray.deepCopy (this.getArray (bucket));
	}

	public double[] getBucketAt (Bucket bucket, int t) {
		if (t < 0 || t > this.maxT) throw new IllegalArgumentException ("Generation " + t + " out of range [0," + this.maxT + "].");
		return this.getArray (bucket)[t].clone();
	}

	private double[][] getArray (Bucket bucket) {
		switch (bucket) {
			case S: return this.susceptible;
			case I: return this.infected;
			case R: return this.recovered;
			case D: return this.discovered;
			case H: return this.hidden;
			default: throw new IllegalArgumentException ("Unknown bucket: " + bucket);
		}
	}

	public void step () {
		this.step (1);
	}

	public void step (int numSteps) {
		this.step (numSteps, null, null, null, null);
	}

	// Advances numSteps generations with the given parameters. Any of them may be null,
	// then the values given at construction are used.
	public void step (int numSteps, double[][] infectionRate, double[] infectionDiscoveryFrac, double[] recoveredDiscoveryFrac, double[] outsideRate) {
		if (numSteps < 0) throw new IllegalArgumentException ("Number of steps has to be non-negative (not " + numSteps + ").");
		if (this.currentGeneration + numSteps > this.maxT) throw new HorizonExhaustedException (this.maxT);
		final int K = this.numGroups;

		double[][] rate = this.infectionRate;
		if (infectionRate != null) {
			ShapeMismatchException.checkSquare (infectionRate, K, "Infection rate");
			if (!RateMatrixTools.allEntriesNonNegative (infectionRate)) throw new IllegalArgumentException ("Infection rates have to be non-negative.");
			rate = infectionRate;
		}
		double[] infFrac = (infectionDiscoveryFrac == null ? this.infectionDiscoveryFrac : validateDiscoveryFrac (infectionDiscoveryFrac, K));
		double[] recFrac = (recoveredDiscoveryFrac == null ? this.recoveredDiscoveryFrac : validateDiscoveryFrac (recoveredDiscoveryFrac, K));
		double[] outside = (outsideRate == null ? this.outsideRate : validateRate (outsideRate, K, "Outside rate"));

		for (int s=0; s<numSteps; s++) {
			this.singleStep (rate, infFrac, recFrac, outside);
		}
	}

	private void singleStep (double[][] rate, double[] infFrac, double[] recFrac, double[] outside) {
		if (this.currentGeneration >= this.maxT) throw new HorizonExhaustedException (this.maxT);
		final int t = this.currentGeneration;
		final double[] S = this.susceptible[t];
		final double[] I = this.infected[t];
		final double[] R = this.recovered[t];
		final double[] H = this.hidden[t];

		double[] newInfections = RateMatrixTools.leftMultiply (I, rate);
		for (int k=0; k<this.numGroups; k++) {
			double total = S[k] + I[k] + R[k];
			double fracSusceptible = (total > 0d ? S[k] / total : 0d);
			double raw = newInfections[k] * fracSusceptible + fracSusceptible * outside[k];
			newInfections[k] = Math.min (raw, S[k]);
		}

		for (int k=0; k<this.numGroups; k++) {
			this.infected[t+1][k] = newInfections[k];
			this.susceptible[t+1][k] = S[k] - newInfections[k];
			this.recovered[t+1][k] = R[k] + I[k];
			this.discovered[t+1][k] = this.discovered[t][k] + H[k] * recFrac[k] + newInfections[k] * infFrac[k];
			this.hidden[t+1][k] = H[k] * (1d - recFrac[k]) + newInfections[k] * (1d - infFrac[k]);
		}

		this.currentGeneration++;
		int mismatch = this.findDiscoveryPartitionMismatch (this.currentGeneration);
		if (mismatch >= 0) {
			throw new IllegalStateException ("Generation " + this.currentGeneration + ", group " + mismatch + ": infected + recovered diverged from discovered + hidden.");
		}
	}

	/// first group where I+R and D+H differ at generation t, or -1
	private int findDiscoveryPartitionMismatch (int t) {
		for (int k=0; k<this.numGroups; k++) {
			double infectedOrRecovered = this.infected[t][k] + this.recovered[t][k];
			double discoveredOrHidden = this.discovered[t][k] + this.hidden[t][k];
			if (Math.abs (infectedOrRecovered - discoveredOrHidden) > EPSILON * (1d + Math.abs (infectedOrRecovered))) {
				return k;
			}
		}
		return -1;
	}

	/// broadcasts a scalar discovery fraction to all groups
	public static double[] validateDiscoveryFrac (double frac, int numGroups) {
		return validateDiscoveryFrac (CopyArray.nCopies (numGroups, frac), numGroups);
	}

	public static double[] validateDiscoveryFrac (double[] frac, int numGroups) {
		ShapeMismatchException.checkLength (frac, numGroups, "Discovery fraction");
		for (double f : frac) {
			if (!(f >= 0d && f <= 1d)) throw new IllegalArgumentException ("Discovery fractions have to be in [0,1] (not " + f + ").");
		}
		return frac.clone();
	}

	private static double[] validateRate (double[] rate, int numGroups, String what) {
		ShapeMismatchException.checkLength (rate, numGroups, what);
		return checkNonNegative (rate, what);
	}

	private static double[] checkNonNegative (double[] values, String what) {
		for (double v : values) {
			if (!(v >= 0d)) throw new IllegalArgumentException ("Negative or undefined " + what + ": " + v);
		}
		return values.clone();
	}
}
