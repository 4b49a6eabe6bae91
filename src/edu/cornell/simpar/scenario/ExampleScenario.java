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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.cornell.simpar.population.Population;
import edu.cornell.simpar.strategy.IsolationRegime;
import edu.cornell.simpar.strategy.Strategy;
import edu.cornell.simpar.testing.ArrivalTestingRegime;
import edu.cornell.simpar.testing.TestDefinition;
import edu.cornell.simpar.testing.TestingRegime;

/// a built-in campus scenario with undergraduates and staff, used by the command line driver
public class ExampleScenario {

	public static final String[] META_GROUPS = {"UG", "staff"};

	public static final TestDefinition PCR = new TestDefinition ("pcr", 0.8, 1.5, 0.9);
	public static final TestDefinition ANTIGEN = new TestDefinition ("antigen", 0.6, 0d, 0.5);

	public static final int MAX_T = 16;
	public static final int ARRIVAL_PERIOD = 3;

	public static Map<String,TestDefinition> getTests () {
		Map<String,TestDefinition> tests = new LinkedHashMap<String,TestDefinition>();
		tests.put (PCR.getName(), PCR);
		tests.put (ANTIGEN.getName(), ANTIGEN);
		return tests;
	}

	public static TestDefinition getTest (String name) {
		TestDefinition test = getTests().get (name);
		if (test == null) throw new IllegalArgumentException ("Unknown test: " + name + ", use one of " + getTests().keySet());
		return test;
	}

	public static Population getPopulation () {
		double[][] mixing = {{0.9, 0.1}, {0.2, 0.8}};
		return Population.fromTruncatedParetos (META_GROUPS, new double[] {20000, 10000}, new double[] {2d, 3d}, new int[] {10, 8}, mixing);
	}

	public static Scenario getNominalScenario () {
		return new Scenario (getPopulation(), MAX_T, 4d,
				new double[] {0.05, 0.05},		// infections per day per contact unit
				new double[] {20, 5},			// initial infections
				new double[] {1000, 300},		// initial recovered
				new double[] {2, 1},			// outside rate
				6d, 0.3,
				new double[] {0.1, 0.1},		// no surveillance test rate
				new double[] {0.5, 0.5},		// pct recovered discovered
				new double[] {0.0005, 0.01},	// hospitalization rates
				ARRIVAL_PERIOD, getTests());
	}

	public static List<PriorParameter> getDefaultPriors () {
		List<PriorParameter> priors = new ArrayList<PriorParameter>();
		priors.add (new PriorParameter (ScenarioParameter.INFECTIONS_PER_DAY_PER_CONTACT_UNIT, new int[] {0}, 0.05, 0.01, 0.01, 0.1));
		priors.add (new PriorParameter (ScenarioParameter.INIT_INFECTIONS, new int[] {0}, 20, 5, 0, 60));
		priors.add (new PriorParameter (ScenarioParameter.SYMPTOMATIC_RATE, null, 0.3, 0.05, 0, 1));
		priors.add (new PriorParameter (ScenarioParameter.MAX_INFECTIOUS_DAYS, null, 6, 1, 3, 9));
		return priors;
	}

	public static ScenarioFamily getScenarioFamily () {
		return new ScenarioFamily (getNominalScenario(), getDefaultPriors());
	}

	// Surveillance with the given test during the arrival period and afterwards,
	// transmission reduced by a quarter after the arrival period.
	public static Strategy getStrategy (TestDefinition test, double testsPerWeek) {
		TestingRegime regime = TestingRegime.uniform (META_GROUPS.length, test, testsPerWeek);
		ArrivalTestingRegime arrival = new ArrivalTestingRegime (Arrays.asList (ANTIGEN, ANTIGEN), Arrays.asList (PCR, PCR));
		IsolationRegime isolation = new IsolationRegime (new double[] {5, 10}, new double[] {0.8, 0.2});
		return new Strategy (regime.getName(), new int[] {ARRIVAL_PERIOD, MAX_T - ARRIVAL_PERIOD}, Arrays.asList (regime, regime),
				new double[] {1d, 0.75}, arrival, isolation);
	}
}
