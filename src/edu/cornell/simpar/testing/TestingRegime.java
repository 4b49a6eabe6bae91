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

package edu.cornell.simpar.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import edu.cornell.simpar.utility.ShapeMismatchException;

// A recurring surveillance testing regime: one test type and one frequency (tests per week, zero
// for no surveillance) per meta-group. All derived vectors are indexed by meta-group.
public class TestingRegime {

	private final List<TestDefinition> testType;
	private final double[] testsPerWeek;
	private final NoSurveillanceDiscoveryPolicy discoveryPolicy;
	private final String name;

	public TestingRegime (List<TestDefinition> testType, double[] testsPerWeek) {
		this (testType, testsPerWeek, NoSurveillanceDiscoveryPolicy.SYMPTOMATIC_TIMES_SENSITIVITY);
	}

	public TestingRegime (List<TestDefinition> testType, double[] testsPerWeek, NoSurveillanceDiscoveryPolicy discoveryPolicy) {
		ShapeMismatchException.checkLength (testsPerWeek, testType.size(), "Tests per week");
		for (double f : testsPerWeek) {
			if (!(f >= 0d)) throw new IllegalArgumentException ("Test frequency has to be non-negative (not " + f + ").");
		}
		for (TestDefinition test : testType) {
			if (test == null) throw new IllegalArgumentException ("Every meta-group needs a test type.");
		}
		this.testType = Collections.unmodifiableList (new ArrayList<TestDefinition> (testType));
		this.testsPerWeek = testsPerWeek.clone();
		this.discoveryPolicy = discoveryPolicy;
		this.name = makeName (this.testType, this.testsPerWeek);
	}

	/// same test and frequency for every meta-group
	public static TestingRegime uniform (int numMetaGroups, TestDefinition test, double testsPerWeek) {
		return uniform (numMetaGroups, test, testsPerWeek, NoSurveillanceDiscoveryPolicy.SYMPTOMATIC_TIMES_SENSITIVITY);
	}

	public static TestingRegime uniform (int numMetaGroups, TestDefinition test, double testsPerWeek, NoSurveillanceDiscoveryPolicy discoveryPolicy) {
		List<TestDefinition> testType = new ArrayList<TestDefinition>();
		double[] frequencies = new double[numMetaGroups];
		for (int m=0; m<numMetaGroups; m++) {
			testType.add (test);
			frequencies[m] = testsPerWeek;
		}
		return new TestingRegime (testType, frequencies, discoveryPolicy);
	}

	private static String makeName (List<TestDefinition> testType, double[] testsPerWeek) {
		boolean noSurveillance = true;
		boolean allSame = true;
		for (int m=0; m<testsPerWeek.length; m++) {
			noSurveillance &= (testsPerWeek[m] == 0d);
			allSame &= (testsPerWeek[m] == testsPerWeek[0]) && (testType.get(m).getTestDelay() == testType.get(0).getTestDelay());
		}
		if (noSurveillance) return "No surveillance";
		if (allSame) return String.format (Locale.US, "%sx/wk, %.1fd delay", formatFrequency (testsPerWeek[0]), testType.get(0).getTestDelay());

		StringBuilder sb = new StringBuilder();
		for (int m=0; m<testsPerWeek.length; m++) {
			if (m > 0) sb.append ("; ");
			if (testsPerWeek[m] > 0d) {
				sb.append (String.format (Locale.US, "mg%d: %sx/wk %.1fd delay", m, formatFrequency (testsPerWeek[m]), testType.get(m).getTestDelay()));
			}
			else {
				sb.append ("mg" + m + ": no surveillance");
			}
		}
		return sb.toString();
	}

	private static String formatFrequency (double f) {
		return (f == Math.rint (f)) ? Long.toString ((long) f) : Double.toString (f);
	}

	public String getName () {
		return this.name;
	}

	public int getNumMetaGroups () {
		return this.testsPerWeek.length;
	}

	public List<TestDefinition> getTestType () {
		return this.testType;
	}

	public double[] getTestsPerWeek () {
		return this.testsPerWeek.clone();
	}

	public NoSurveillanceDiscoveryPolicy getDiscoveryPolicy () {
		return this.discoveryPolicy;
	}

	/// expected days infectious and free, per meta-group
	public double[] getDaysInfectious (double maxInfectiousDays) {
		double[] ret = new double[this.testsPerWeek.length];
		for (int m=0; m<ret.length; m++) {
			TestDefinition t = this.testType.get(m);
			ret[m] = InfectiousDuration.daysInfectious (InfectiousDuration.daysBetweenTests (this.testsPerWeek[m]), t.getTestDelay(), t.getSensitivity(), maxInfectiousDays);
		}
		return ret;
	}

	/// fraction of new infections discovered in the generation they occur, per meta-group
	public double[] getInfectionDiscoveryFrac (double symptomaticRate) {
		if (!(symptomaticRate >= 0d && symptomaticRate <= 1d)) throw new IllegalArgumentException ("Symptomatic rate has to be in [0,1] (not " + symptomaticRate + ").");
		double[] infectionDiscoveryFrac = new double[this.testsPerWeek.length];
		for (int m=0; m<infectionDiscoveryFrac.length; m++) {
			TestDefinition t = this.testType.get(m);
			if (this.testsPerWeek[m] == 0d) {
				infectionDiscoveryFrac[m] = this.discoveryPolicy.infectionDiscoveryFrac (symptomaticRate, t);
			}
			else {
				infectionDiscoveryFrac[m] = t.getTrueSensitivity();
			}
		}
		return infectionDiscoveryFrac;
	}

	/// fraction of hidden recovered discovered per generation, per meta-group
	public double[] getRecoveredDiscoveryFrac (double[] noSurveillanceTestRate) {
		ShapeMismatchException.checkLength (noSurveillanceTestRate, this.testsPerWeek.length, "No-surveillance test rate");
		double[] recoveredDiscoveryFrac = new double[this.testsPerWeek.length];
		for (int m=0; m<recoveredDiscoveryFrac.length; m++) {
			if (this.testsPerWeek[m] == 0d) {
				// cautious people testing on their own
				recoveredDiscoveryFrac[m] = noSurveillanceTestRate[m];
			}
			else {
				recoveredDiscoveryFrac[m] = this.testType.get(m).getTrueSensitivity();
			}
		}
		return recoveredDiscoveryFrac;
	}

	public String toString () {
		return this.name;
	}
}
