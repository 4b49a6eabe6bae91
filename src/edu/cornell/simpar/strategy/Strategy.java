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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import edu.cornell.simpar.testing.ArrivalTestingRegime;
import edu.cornell.simpar.testing.TestingRegime;
import edu.cornell.simpar.utility.CopyArray;
import edu.cornell.simpar.utility.ShapeMismatchException;
import edu.cornell.simpar.utility.SumArray;

// A testing strategy: a sequence of periods, each with a testing regime and a transmission
// multiplier, plus optional arrival testing and an optional isolation regime.
// The initial-condition methods take and return vectors indexed by meta-group.
public class Strategy {

	/// what the simulation uses for the generations of one period
	public static class Period {
		public final TestingRegime testingRegime;
		public final double transmissionMultiplier;
		public final int length;

		public Period (TestingRegime testingRegime, double transmissionMultiplier, int length) {
			this.testingRegime = testingRegime;
			this.transmissionMultiplier = transmissionMultiplier;
			this.length = length;
		}
	}

	private final String name;
	private final int[] periodLengths;
	private final List<TestingRegime> testingRegimes;
	private final double[] transmissionMultipliers;
	private final ArrivalTestingRegime arrivalTestingRegime;
	private final IsolationRegime isolationRegime;

	public Strategy (String name, int[] periodLengths, List<TestingRegime> testingRegimes) {
		this (name, periodLengths, testingRegimes, null, null, null);
	}

	public Strategy (String name, int[] periodLengths, List<TestingRegime> testingRegimes, double[] transmissionMultipliers, ArrivalTestingRegime arrivalTestingRegime) {
		this (name, periodLengths, testingRegimes, transmissionMultipliers, arrivalTestingRegime, null);
	}

	/// transmissionMultipliers defaults to all ones, the arrival and isolation regimes may be null
	public Strategy (String name, int[] periodLengths, List<TestingRegime> testingRegimes, double[] transmissionMultipliers, ArrivalTestingRegime arrivalTestingRegime, IsolationRegime isolationRegime) {
		if (periodLengths.length != testingRegimes.size()) {
			throw new ShapeMismatchException ("Strategy " + name + ": " + periodLengths.length + " periods but " + testingRegimes.size() + " testing regimes.");
		}
		if (transmissionMultipliers == null) {
			transmissionMultipliers = CopyArray.nCopies (periodLengths.length, 1d);
		}
		ShapeMismatchException.checkLength (transmissionMultipliers, periodLengths.length, "Transmission multipliers");
		for (int i=0; i<periodLengths.length; i++) {
			if (periodLengths[i] < 0) throw new IllegalArgumentException ("Strategy " + name + ": negative length for period " + i + ".");
			if (!(transmissionMultipliers[i] >= 0d)) throw new IllegalArgumentException ("Strategy " + name + ": negative transmission multiplier for period " + i + ".");
		}

		this.name = name;
		this.periodLengths = periodLengths.clone();
		this.testingRegimes = Collections.unmodifiableList (new ArrayList<TestingRegime> (testingRegimes));
		this.transmissionMultipliers = transmissionMultipliers.clone();
		this.arrivalTestingRegime = arrivalTestingRegime;
		this.isolationRegime = isolationRegime;
	}

	public String getName () {
		return this.name;
	}

	public int getNumPeriods () {
		return this.periodLengths.length;
	}

	public Period getPeriod (int i) {
		return new Period (this.testingRegimes.get(i), this.transmissionMultipliers[i], this.periodLengths[i]);
	}

	public int[] getPeriodLengths () {
		return this.periodLengths.clone();
	}

	public int getTotalLength () {
		return SumArray.getSum (this.periodLengths);
	}

	public ArrivalTestingRegime getArrivalTestingRegime () {
		return this.arrivalTestingRegime;
	}

	public IsolationRegime getIsolationRegime () {
		return this.isolationRegime;
	}

	/// the periods have to cover the simulation horizon exactly
	public void validateHorizon (int maxT) {
		if (this.getTotalLength() != maxT) {
			throw new IllegalArgumentException ("Strategy " + this.name + ": period lengths " + Arrays.toString (this.periodLengths) + " do not add up to the horizon " + maxT + ".");
		}
	}

	public double[] getPctDiscoveredInPreDeparture (int numMetaGroups) {
		if (this.arrivalTestingRegime == null) return new double[numMetaGroups];
		this.checkArrivalMetaGroups (numMetaGroups);
		return this.arrivalTestingRegime.getPctDiscoveredInPreDeparture();
	}

	public double[] getPctDiscoveredInArrivalTest (int numMetaGroups) {
		if (this.arrivalTestingRegime == null) return new double[numMetaGroups];
		this.checkArrivalMetaGroups (numMetaGroups);
		return this.arrivalTestingRegime.getPctDiscoveredInArrivalTest();
	}

	/// pre-departure plus arrival
	public double[] getPctDiscovered (int numMetaGroups) {
		double[] preDeparture = this.getPctDiscoveredInPreDeparture (numMetaGroups);
		double[] arrival = this.getPctDiscoveredInArrivalTest (numMetaGroups);
		double[] pct = new double[numMetaGroups];
		for (int m=0; m<numMetaGroups; m++) {
			pct[m] = preDeparture[m] + arrival[m];
			assert (pct[m] <= 1d + 1e-12);
		}
		return pct;
	}

	/// active infections that escape arrival testing
	public double[] getInitialInfections (double[] activeInfections) {
		double[] pct = this.getPctDiscovered (activeInfections.length);
		double[] result = new double[activeInfections.length];
		for (int m=0; m<result.length; m++) result[m] = (1d - pct[m]) * activeInfections[m];
		return result;
	}

	/// arrival-discovered actives isolate and start out as recovered
	public double[] getInitialRecovered (double[] recovered, double[] activeInfections) {
		ShapeMismatchException.checkLength (recovered, activeInfections.length, "Recovered");
		double[] pct = this.getPctDiscovered (activeInfections.length);
		double[] result = new double[activeInfections.length];
		for (int m=0; m<result.length; m++) result[m] = recovered[m] + pct[m] * activeInfections[m];
		return result;
	}

	/// previously discovered recovered plus the actives found by arrival testing
	public double[] getInitialDiscovered (double[] recovered, double[] pctRecoveredDiscovered, double[] activeInfections) {
		ShapeMismatchException.checkLength (recovered, activeInfections.length, "Recovered");
		ShapeMismatchException.checkLength (pctRecoveredDiscovered, activeInfections.length, "Pct recovered discovered");
		double[] pct = this.getPctDiscovered (activeInfections.length);
		double[] result = new double[activeInfections.length];
		for (int m=0; m<result.length; m++) result[m] = recovered[m] * pctRecoveredDiscovered[m] + pct[m] * activeInfections[m];
		return result;
	}

	/// the complement of getInitialDiscovered among infected plus recovered
	public double[] getInitialHidden (double[] recovered, double[] pctRecoveredDiscovered, double[] activeInfections) {
		ShapeMismatchException.checkLength (recovered, activeInfections.length, "Recovered");
		ShapeMismatchException.checkLength (pctRecoveredDiscovered, activeInfections.length, "Pct recovered discovered");
		double[] pct = this.getPctDiscovered (activeInfections.length);
		double[] result = new double[activeInfections.length];
		for (int m=0; m<result.length; m++) result[m] = recovered[m] * (1d - pctRecoveredDiscovered[m]) + (1d - pct[m]) * activeInfections[m];
		return result;
	}

	/// people found positive by the arrival test, active or recovered
	public double[] getArrivalDiscovered (double[] recovered, double[] activeInfections, double[] pctRecoveredDiscoveredArrival) {
		ShapeMismatchException.checkLength (recovered, activeInfections.length, "Recovered");
		ShapeMismatchException.checkLength (pctRecoveredDiscoveredArrival, activeInfections.length, "Pct recovered discovered on arrival");
		double[] arrival = this.getPctDiscoveredInArrivalTest (activeInfections.length);
		double[] result = new double[activeInfections.length];
		for (int m=0; m<result.length; m++) result[m] = activeInfections[m] * arrival[m] + recovered[m] * pctRecoveredDiscoveredArrival[m];
		return result;
	}

	private void checkArrivalMetaGroups (int numMetaGroups) {
		if (this.arrivalTestingRegime.getNumMetaGroups() != numMetaGroups) {
			throw new ShapeMismatchException ("Arrival testing regime covers " + this.arrivalTestingRegime.getNumMetaGroups() + " meta-groups, expected " + numMetaGroups + ".");
		}
	}

	public String toString () {
		return this.name;
	}
}
