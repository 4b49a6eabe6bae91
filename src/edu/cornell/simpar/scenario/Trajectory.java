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

import java.util.List;

import edu.cornell.simpar.population.Population;
import edu.cornell.simpar.sim.Bucket;
import edu.cornell.simpar.sim.EpidemicSimulator;
import edu.cornell.simpar.strategy.Strategy;
import edu.cornell.simpar.utility.SumArray;
import gnu.trove.list.TIntList;

// A finished simulation together with the scenario and strategy that produced it.
// The reductions take a list of meta-group names, null meaning all of them.
public class Trajectory {

	private final Scenario scenario;
	private final Strategy strategy;
	private final EpidemicSimulator sim;
	private final String name;

	public Trajectory (Scenario scenario, Strategy strategy, EpidemicSimulator sim) {
		this (scenario, strategy, sim, strategy.getName());
	}

	public Trajectory (Scenario scenario, Strategy strategy, EpidemicSimulator sim, String name) {
		this.scenario = scenario;
		this.strategy = strategy;
		this.sim = sim;
		this.name = name;
	}

	public Scenario getScenario () {
		return this.scenario;
	}

	public Strategy getStrategy () {
		return this.strategy;
	}

	public EpidemicSimulator getSim () {
		return this.sim;
	}

	public String getName () {
		return this.name;
	}

	/// [generation][selected meta-group], summed over the groups of each meta-group
	public double[][] getBucketByMetaGroup (Bucket bucket, List<String> metaGroups, boolean cumulative, boolean normalize) {
		Population population = this.scenario.getPopulation();
		if (metaGroups == null) metaGroups = population.getMetaGroupNames();

		double[][] values = this.sim.getBucket (bucket);
		double[][] result = new double[values.length][metaGroups.size()];
		for (int j=0; j<metaGroups.size(); j++) {
			TIntList ids = population.metaGroupIds (metaGroups.get(j));
			for (int t=0; t<values.length; t++) {
				for (int i=0; i<ids.size(); i++) {
					result[t][j] += values[t][ids.get(i)];
				}
			}
		}

		if (cumulative) result = SumArray.getCumulativeRows (result);
		if (normalize) this.normalize (result);
		return result;
	}

	/// summed over the selected meta-groups
	public double[] getBucket (Bucket bucket, List<String> metaGroups, boolean cumulative, boolean normalize) {
		return SumArray.getRowSums (this.getBucketByMetaGroup (bucket, metaGroups, cumulative, normalize));
	}

	public double[] getBucket (Bucket bucket) {
		return this.getBucket (bucket, null, false, false);
	}

	/// hospitalization rate times infections, per selected meta-group
	public double[][] getHospitalizationsByMetaGroup (List<String> metaGroups, boolean cumulative, boolean normalize) {
		Population population = this.scenario.getPopulation();
		if (metaGroups == null) metaGroups = population.getMetaGroupNames();
		double[] rates = this.scenario.getHospitalizationRates();

		double[][] hospitalizations = this.getBucketByMetaGroup (Bucket.I, metaGroups, cumulative, normalize);
		for (int j=0; j<metaGroups.size(); j++) {
			double rate = rates[population.metaGroupIndex (metaGroups.get(j))];
			for (int t=0; t<hospitalizations.length; t++) {
				hospitalizations[t][j] *= rate;
			}
		}
		return hospitalizations;
	}

	public double[] getHospitalizations (List<String> metaGroups, boolean cumulative, boolean normalize) {
		return SumArray.getRowSums (this.getHospitalizationsByMetaGroup (metaGroups, cumulative, normalize));
	}

	// relative to the whole population at the start
	private void normalize (double[][] values) {
		double totalPopulation = SumArray.getSum (this.sim.getBucketAt (Bucket.S, 0))
				+ SumArray.getSum (this.sim.getBucketAt (Bucket.I, 0))
				+ SumArray.getSum (this.sim.getBucketAt (Bucket.R, 0));
		if (totalPopulation <= 0d) return;
		for (double[] row : values) {
			for (int j=0; j<row.length; j++) row[j] /= totalPopulation;
		}
	}

	public String toString () {
		return this.name;
	}
}
