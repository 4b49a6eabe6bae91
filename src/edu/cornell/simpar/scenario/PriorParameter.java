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

package edu.cornell.simpar.scenario;

import java.util.Arrays;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;

// Normal prior on one scenario parameter, truncated to [lower, upper].
// metaGroups restricts a per-meta-group parameter to some meta-groups, null means all.
public class PriorParameter {

	private final ScenarioParameter target;
	private final int[] metaGroups;
	private final double mu;
	private final double std;
	private final double lower;
	private final double upper;

	public PriorParameter (ScenarioParameter target, int[] metaGroups, double mu, double std) {
		this (target, metaGroups, mu, std, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
	}

	public PriorParameter (ScenarioParameter target, int[] metaGroups, double mu, double std, double lower, double upper) {
		if (!(std >= 0d)) throw new IllegalArgumentException ("Standard deviation has to be non-negative.");
		if (!(lower <= mu && mu <= upper)) throw new IllegalArgumentException ("Prior mean " + mu + " not in [" + lower + "," + upper + "].");
		this.target = target;
		this.metaGroups = (metaGroups == null ? null : metaGroups.clone());
		this.mu = mu;
		this.std = std;
		this.lower = lower;
		this.upper = upper;
	}

	public ScenarioParameter getTarget () {
		return this.target;
	}

	public int[] getMetaGroups () {
		return (this.metaGroups == null ? null : this.metaGroups.clone());
	}

	public double getMu () {
		return this.mu;
	}

	public double getStd () {
		return this.std;
	}

	public double getLower () {
		return this.lower;
	}

	public double getUpper () {
		return this.upper;
	}

	/// inverse transform sampling restricted to the truncation interval
	public double sample (RandomGenerator random) {
		if (this.std == 0d) return this.mu;
		NormalDistribution normal = new NormalDistribution (random, this.mu, this.std);
		double lowerCdf = normal.cumulativeProbability (this.lower);
		double upperCdf = normal.cumulativeProbability (this.upper);
		double u = lowerCdf + random.nextDouble() * (upperCdf - lowerCdf);
		double value = normal.inverseCumulativeProbability (u);
		return Math.min (Math.max (value, this.lower), this.upper);
	}

	public Scenario applyTo (Scenario scenario, double value) {
		return scenario.withParameter (this.target, this.metaGroups, value);
	}

	public String toString () {
		return this.target.getParameterName() + (this.metaGroups == null ? "" : Arrays.toString (this.metaGroups))
				+ " ~ N(" + this.mu + ", " + this.std + ") on [" + this.lower + ", " + this.upper + "]";
	}
}
