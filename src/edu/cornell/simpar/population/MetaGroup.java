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

package edu.cornell.simpar.population;

import java.util.Arrays;

import org.apache.commons.math3.distribution.ParetoDistribution;

import edu.cornell.simpar.utility.SumArray;

// A collection of groups that share all parameters except their amount of social contact,
// e.g. undergraduates or faculty/staff. Within a meta-group people are assumed to be well-mixed:
// group i meets group j in proportion to j's population times j's contact units.
// Instances are immutable.
public class MetaGroup {

	private final String name;
	// population in each group
	private final double[] pop;
	// contact units of each group
	private final double[] contactUnits;

	public MetaGroup (String name, double[] pop, double[] contactUnits) {
		if (pop.length != contactUnits.length) {
			throw new IllegalArgumentException ("Meta-group " + name + ": " + pop.length + " population counts but " + contactUnits.length + " contact units.");
		}
		for (int g=0; g<pop.length; g++) {
			if (!(pop[g] >= 0d)) throw new IllegalArgumentException ("Meta-group " + name + ": negative population in group " + g + ".");
			if (!(contactUnits[g] >= 0d)) throw new IllegalArgumentException ("Meta-group " + name + ": negative contact units in group " + g + ".");
		}
		this.name = name;
		this.pop = Arrays.copyOf (pop, pop.length);
		this.contactUnits = Arrays.copyOf (contactUnits, contactUnits.length);
	}

	/// groups with contact units 1..ub, population split according to a Pareto(1, a) density truncated at ub
	public static MetaGroup fromTruncatedPareto (String name, double population, double a, int ub) {
		if (ub < 1) throw new IllegalArgumentException ("Truncation point for the Pareto distribution has to be positive (not " + ub + ").");
		ParetoDistribution pareto = new ParetoDistribution (1d, a);

		double[] popFrac = new double[ub];
		for (int k=1; k<=ub; k++) {
			popFrac[k-1] = pareto.density (k);
		}
		double total = SumArray.getSum (popFrac);

		double[] pop = new double[ub];
		double[] contactUnits = new double[ub];
		for (int k=0; k<ub; k++) {
			pop[k] = population * popFrac[k] / total;
			contactUnits[k] = k + 1;
		}
		return new MetaGroup (name, pop, contactUnits);
	}

	public String getName () {
		return this.name;
	}

	public int getNumGroups () {
		return this.contactUnits.length;
	}

	public double[] getPopulation () {
		return Arrays.copyOf (this.pop, this.pop.length);
	}

	public double[] getContactUnits () {
		return Arrays.copyOf (this.contactUnits, this.contactUnits.length);
	}

	public double getTotalPopulation () {
		return SumArray.getSum (this.pop);
	}

	/// fraction of this meta-group's contact-weighted population in each group
	public double[] getContactWeights () {
		double[] weights = new double[this.pop.length];
		for (int g=0; g<weights.length; g++) weights[g] = this.pop[g] * this.contactUnits[g];
		return normalize (weights);
	}

	/// fraction of this meta-group's population in each group
	public double[] getPopulationWeights () {
		return normalize (Arrays.copyOf (this.pop, this.pop.length));
	}

	public double[] getWeights (WeightPolicy weight) {
		switch (weight) {
			case POPULATION:
				return this.getPopulationWeights();
			case POPULATION_X_CONTACTS:
				return this.getContactWeights();
			case MOST_SOCIAL:
				double[] w = new double[this.pop.length];
				if (w.length > 0) w[this.getMostSocialGroup()] = 1d;
				return w;
			default:
				throw new IllegalArgumentException ("The provided weight is not supported: " + weight);
		}
	}

	/// index of the (last) group with the largest contact units
	public int getMostSocialGroup () {
		int best = 0;
		for (int g=1; g<this.contactUnits.length; g++) {
			if (this.contactUnits[g] >= this.contactUnits[best]) best = g;
		}
		return best;
	}

	/// entry [i][j] is the number of infections in group j caused by one infectious person in group i
	public double[][] infectionMatrix (double infectionsPerContactUnit) {
		double[] marginalContact = this.getContactWeights();
		double[][] result = new double[this.contactUnits.length][this.contactUnits.length];
		for (int i=0; i<result.length; i++) {
			for (int j=0; j<result.length; j++) {
				result[i][j] = infectionsPerContactUnit * this.contactUnits[i] * marginalContact[j];
			}
		}
		return result;
	}

	/// outside infections are spread by population share, not by contact
	public double[] outsideRate (double outsideRate) {
		double[] result = this.getPopulationWeights();
		for (int g=0; g<result.length; g++) result[g] *= outsideRate;
		return result;
	}

	public InitialConditions getInitSIR (double initInfections, double initRecovered, WeightPolicy weight) {
		double[] w = this.getWeights (weight);
		double[] S0 = new double[w.length];
		double[] I0 = new double[w.length];
		double[] R0 = new double[w.length];
		for (int g=0; g<w.length; g++) {
			R0[g] = initRecovered * w[g];
			I0[g] = initInfections * w[g];
			S0[g] = Math.max (this.pop[g] - R0[g] - I0[g], 0d);
		}
		return new InitialConditions (S0, I0, R0);
	}

	// zero weights stay zero instead of becoming NaN
	private static double[] normalize (double[] weights) {
		double total = SumArray.getSum (weights);
		if (total > 0d) {
			for (int g=0; g<weights.length; g++) weights[g] /= total;
		}
		return weights;
	}

	public String toString () {
		return this.name + " " + Arrays.toString (this.pop) + " @ " + Arrays.toString (this.contactUnits);
	}
}
