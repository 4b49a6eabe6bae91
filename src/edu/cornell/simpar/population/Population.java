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

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.cornell.simpar.utility.CopyArray;
import edu.cornell.simpar.utility.RateMatrixTools;
import edu.cornell.simpar.utility.ShapeMismatchException;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

// An ordered collection of meta-groups together with a meta-group mixing matrix.
// The groups of all meta-groups are flattened into one index space of size K; meta-group m owns
// the index range [getGroupRangeStart(m), getGroupRangeEnd(m)). The ranges are fixed at construction.
// Entry (a,b) of the mixing matrix is the conditional probability that the exposed person is in
// meta-group b, given that the source is in meta-group a.
public class Population {

	public static final double STOCHASTIC_EPSILON = 1e-6;

	private final List<MetaGroup> metaGroupList;
	private final double[][] metaGroupContactMatrix;
	// offsets[m] is the first flattened index of meta-group m, offsets[M] = K
	private final int[] offsets;
	private final Map<String, Integer> nameToMetaGroup;

	public Population (List<MetaGroup> metaGroups, double[][] metaGroupContactMatrix) {
		int numMetaGroups = metaGroups.size();
		ShapeMismatchException.checkSquare (metaGroupContactMatrix, numMetaGroups, "Meta-group contact matrix");
		if (!RateMatrixTools.allEntriesNonNegative (metaGroupContactMatrix)) {
			throw new IllegalArgumentException ("Meta-group contact matrix has negative entries.");
		}
		if (!RateMatrixTools.isRowStochasticMatrix (metaGroupContactMatrix, STOCHASTIC_EPSILON)) {
			System.err.println ("# Warning: rows of the meta-group contact matrix do not sum to one.");
		}

		this.metaGroupList = Collections.unmodifiableList (new ArrayList<MetaGroup> (metaGroups));
		this.metaGroupContactMatrix = CopyArray.deepCopy (metaGroupContactMatrix);

		// record the index ranges once
		this.offsets = new int[numMetaGroups + 1];
		this.nameToMetaGroup = new HashMap<String, Integer>();
		for (int m=0; m<numMetaGroups; m++) {
			MetaGroup metaGroup = this.metaGroupList.get(m);
			this.offsets[m+1] = this.offsets[m] + metaGroup.getNumGroups();
			if (this.nameToMetaGroup.put (metaGroup.getName(), m) != null) {
				throw new IllegalArgumentException ("Duplicate meta-group name: " + metaGroup.getName());
			}
		}
	}

	/// one meta-group per entry, each split by a truncated Pareto distribution
	public static Population fromTruncatedParetos (String[] names, double[] populationCounts, double[] paretoShapes, int[] paretoUbs, double[][] metaGroupContactMatrix) {
		ShapeMismatchException.checkLength (populationCounts, names.length, "Population counts");
		ShapeMismatchException.checkLength (paretoShapes, names.length, "Pareto shapes");
		if (paretoUbs.length != names.length) throw new ShapeMismatchException ("Pareto upper bounds have length " + paretoUbs.length + ", expected " + names.length + ".");

		List<MetaGroup> metaGroups = new ArrayList<MetaGroup>();
		for (int m=0; m<names.length; m++) {
			metaGroups.add (MetaGroup.fromTruncatedPareto (names[m], populationCounts[m], paretoShapes[m], paretoUbs[m]));
		}
		return new Population (metaGroups, metaGroupContactMatrix);
	}

	public int getNumMetaGroups () {
		return this.metaGroupList.size();
	}

	/// the total dimension K of the flattened group space
	public int getNumGroups () {
		return this.offsets[this.offsets.length - 1];
	}

	public MetaGroup getMetaGroup (int metaGroup) {
		return this.metaGroupList.get (metaGroup);
	}

	public List<MetaGroup> getMetaGroups () {
		return this.metaGroupList;
	}

	public List<String> getMetaGroupNames () {
		List<String> names = new ArrayList<String>();
		for (MetaGroup metaGroup : this.metaGroupList) names.add (metaGroup.getName());
		return names;
	}

	public double[][] getMetaGroupContactMatrix () {
		return CopyArray.deepCopy (this.metaGroupContactMatrix);
	}

	public int metaGroupIndex (String name) {
		Integer idx = this.nameToMetaGroup.get (name);
		if (idx == null) throw new IllegalArgumentException ("Unknown meta-group: " + name);
		return idx;
	}

	public int getGroupRangeStart (int metaGroup) {
		return this.offsets[metaGroup];
	}

	public int getGroupRangeEnd (int metaGroup) {
		return this.offsets[metaGroup + 1];
	}

	/// the flattened group ids of the given meta-group
	public TIntList metaGroupIds (String name) {
		int m = this.metaGroupIndex (name);
		TIntList ids = new TIntArrayList (this.getGroupRangeEnd(m) - this.getGroupRangeStart(m));
		for (int k=this.getGroupRangeStart(m); k<this.getGroupRangeEnd(m); k++) ids.add (k);
		return ids;
	}

	/// which meta-group owns flattened group k
	public int metaGroupOf (int group) {
		if (group < 0 || group >= this.getNumGroups()) throw new IndexOutOfBoundsException ("No group " + group);
		int m = 0;
		while (this.offsets[m+1] <= group) m++;
		return m;
	}

	/// e.g. "UG 6": the meta-group name and the contact units of the group
	public String groupName (int group) {
		int m = this.metaGroupOf (group);
		MetaGroup metaGroup = this.metaGroupList.get(m);
		double contacts = metaGroup.getContactUnits()[group - this.offsets[m]];
		// DecimalFormat is not thread-safe
		return metaGroup.getName() + " " + new DecimalFormat ("0.##").format (contacts);
	}

	public int groupIndex (String groupName) {
		for (int k=0; k<this.getNumGroups(); k++) {
			if (this.groupName(k).equals (groupName)) return k;
		}
		throw new IllegalArgumentException ("Unknown group: " + groupName);
	}

	public double getTotalPopulation () {
		double total = 0d;
		for (MetaGroup metaGroup : this.metaGroupList) total += metaGroup.getTotalPopulation();
		return total;
	}

	// Entry [i][j] is the expected number of infections in group j caused by one infectious person in
	// group i during one generation: contact units of i, times the infections per contact unit of i's
	// meta-group a, times the mixing probability (a,b), times j's share of the contact-weighted
	// population of its meta-group b.
	public double[][] infectionMatrix (double[] infectionsPerContactUnit) {
		ShapeMismatchException.checkLength (infectionsPerContactUnit, this.getNumMetaGroups(), "Infections per contact unit");

		int dimTot = this.getNumGroups();
		double[][] res = new double[dimTot][dimTot];

		for (int a=0; a<this.getNumMetaGroups(); a++) {
			double[] sourceContacts = this.metaGroupList.get(a).getContactUnits();
			for (int b=0; b<this.getNumMetaGroups(); b++) {
				double[] q = this.metaGroupList.get(b).getContactWeights();
				double mixing = this.metaGroupContactMatrix[a][b];
				for (int i=0; i<sourceContacts.length; i++) {
					for (int j=0; j<q.length; j++) {
						res[this.offsets[a] + i][this.offsets[b] + j] = sourceContacts[i] * infectionsPerContactUnit[a] * mixing * q[j];
					}
				}
			}
		}

		return res;
	}

	/// broadcast a value per meta-group to all of its groups
	public double[] metaGroupToGroup (double[] perMetaGroup) {
		ShapeMismatchException.checkLength (perMetaGroup, this.getNumMetaGroups(), "Meta-group vector");
		double[] result = new double[this.getNumGroups()];
		for (int m=0; m<this.getNumMetaGroups(); m++) {
			for (int k=this.offsets[m]; k<this.offsets[m+1]; k++) result[k] = perMetaGroup[m];
		}
		return result;
	}

	/// outside infections per generation, spread over each meta-group by population share
	public double[] outsideRate (double[] outsideRates) {
		ShapeMismatchException.checkLength (outsideRates, this.getNumMetaGroups(), "Outside rates");
		double[] result = new double[this.getNumGroups()];
		for (int m=0; m<this.getNumMetaGroups(); m++) {
			double[] local = this.metaGroupList.get(m).outsideRate (outsideRates[m]);
			System.arraycopy (local, 0, result, this.offsets[m], local.length);
		}
		return result;
	}

	public InitialConditions getInitSIR (double[] initInfections, double[] initRecovered, WeightPolicy weight) {
		ShapeMismatchException.checkLength (initInfections, this.getNumMetaGroups(), "Initial infections");
		ShapeMismatchException.checkLength (initRecovered, this.getNumMetaGroups(), "Initial recovered");

		double[] S0 = new double[this.getNumGroups()];
		double[] I0 = new double[this.getNumGroups()];
		double[] R0 = new double[this.getNumGroups()];
		for (int m=0; m<this.getNumMetaGroups(); m++) {
			InitialConditions local = this.metaGroupList.get(m).getInitSIR (initInfections[m], initRecovered[m], weight);
			System.arraycopy (local.susceptible, 0, S0, this.offsets[m], local.getNumGroups());
			System.arraycopy (local.infected, 0, I0, this.offsets[m], local.getNumGroups());
			System.arraycopy (local.recovered, 0, R0, this.offsets[m], local.getNumGroups());
		}
		return new InitialConditions (S0, I0, R0);
	}

	public InitialConditions getInitSIR (double[] initInfections, double[] initRecovered, String weight) {
		return this.getInitSIR (initInfections, initRecovered, WeightPolicy.fromName (weight));
	}

	/// like getInitSIR, but also splits discovered and hidden with the same weights, so D0+H0 = I0+R0 per group
	public InitialConditions getInitSIRAndDH (double[] initInfections, double[] initRecovered, double[] initDiscovered, double[] initHidden, WeightPolicy weight) {
		ShapeMismatchException.checkLength (initDiscovered, this.getNumMetaGroups(), "Initial discovered");
		ShapeMismatchException.checkLength (initHidden, this.getNumMetaGroups(), "Initial hidden");
		InitialConditions sir = this.getInitSIR (initInfections, initRecovered, weight);

		double[] D0 = new double[this.getNumGroups()];
		double[] H0 = new double[this.getNumGroups()];
		for (int m=0; m<this.getNumMetaGroups(); m++) {
			double nonSusceptible = initInfections[m] + initRecovered[m];
			if (Math.abs (initDiscovered[m] + initHidden[m] - nonSusceptible) > STOCHASTIC_EPSILON * Math.max (1d, nonSusceptible)) {
				throw new IllegalArgumentException ("Meta-group " + this.metaGroupList.get(m).getName() + ": discovered plus hidden does not equal infected plus recovered.");
			}
			double[] w = this.metaGroupList.get(m).getWeights (weight);
			for (int g=0; g<w.length; g++) {
				D0[this.offsets[m] + g] = initDiscovered[m] * w[g];
				H0[this.offsets[m] + g] = initHidden[m] * w[g];
			}
		}
		return new InitialConditions (sir.susceptible, sir.infected, sir.recovered, D0, H0);
	}
}
