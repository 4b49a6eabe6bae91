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

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import edu.cornell.simpar.population.InitialConditions;
import edu.cornell.simpar.population.Population;
import edu.cornell.simpar.population.WeightPolicy;
import edu.cornell.simpar.sim.EpidemicSimulator;
import edu.cornell.simpar.strategy.Strategy;
import edu.cornell.simpar.testing.TestDefinition;
import edu.cornell.simpar.testing.TestingRegime;
import edu.cornell.simpar.utility.RateMatrixTools;
import edu.cornell.simpar.utility.ShapeMismatchException;

// The population, the disease and the environment a strategy is applied to.
// Vectors are indexed by meta-group. Immutable, the with* methods return modified copies.
public class Scenario {

	public static final WeightPolicy INIT_WEIGHT_POLICY = WeightPolicy.POPULATION_X_CONTACTS;

	private final Population population;
	private final int maxT;
	private final double generationTime;
	private final double[] infectionsPerDayPerContactUnit;
	private final double[] initInfections;
	private final double[] initRecovered;
	private final double[] outsideRate;
	private final double maxInfectiousDays;
	private final double symptomaticRate;
	private final double[] noSurveillanceTestRate;
	private final double[] pctRecoveredDiscovered;
	private final double[] hospitalizationRates;
	// fraction of each meta-group boostered, and the factor boostering applies to its infection rates
	private final double[] boosterRate;
	private final double boosterMultiplier;
	// null if there is no arrival period
	private final Integer arrivalPeriod;
	private final Map<String,TestDefinition> tests;

	public Scenario (Population population, int maxT, double generationTime, double[] infectionsPerDayPerContactUnit,
			double[] initInfections, double[] initRecovered, double[] outsideRate, double maxInfectiousDays, double symptomaticRate,
			double[] noSurveillanceTestRate, double[] pctRecoveredDiscovered, double[] hospitalizationRates, Integer arrivalPeriod,
			Map<String,TestDefinition> tests) {
		this (population, maxT, generationTime, infectionsPerDayPerContactUnit, initInfections, initRecovered, outsideRate, maxInfectiousDays,
				symptomaticRate, noSurveillanceTestRate, pctRecoveredDiscovered, hospitalizationRates, arrivalPeriod, tests,
				new double[population.getNumMetaGroups()], 1d);
	}

	public Scenario (Population population, int maxT, double generationTime, double[] infectionsPerDayPerContactUnit,
			double[] initInfections, double[] initRecovered, double[] outsideRate, double maxInfectiousDays, double symptomaticRate,
			double[] noSurveillanceTestRate, double[] pctRecoveredDiscovered, double[] hospitalizationRates, Integer arrivalPeriod,
			Map<String,TestDefinition> tests, double[] boosterRate, double boosterMultiplier) {
		final int numMetaGroups = population.getNumMetaGroups();
		ShapeMismatchException.checkLength (infectionsPerDayPerContactUnit, numMetaGroups, "Infections per day per contact unit");
		ShapeMismatchException.checkLength (initInfections, numMetaGroups, "Initial infections");
		ShapeMismatchException.checkLength (initRecovered, numMetaGroups, "Initial recovered");
		ShapeMismatchException.checkLength (outsideRate, numMetaGroups, "Outside rate");
		ShapeMismatchException.checkLength (noSurveillanceTestRate, numMetaGroups, "No surveillance test rate");
		ShapeMismatchException.checkLength (pctRecoveredDiscovered, numMetaGroups, "Pct recovered discovered");
		ShapeMismatchException.checkLength (hospitalizationRates, numMetaGroups, "Hospitalization rates");
		ShapeMismatchException.checkLength (boosterRate, numMetaGroups, "Booster rate");
		if (maxT < 0) throw new IllegalArgumentException ("Horizon has to be non-negative.");
		if (!(generationTime > 0d)) throw new IllegalArgumentException ("Generation time has to be positive.");
		if (!(maxInfectiousDays >= 0d)) throw new IllegalArgumentException ("Max infectious days have to be non-negative.");
		if (!(symptomaticRate >= 0d && symptomaticRate <= 1d)) throw new IllegalArgumentException ("Symptomatic rate has to be in [0,1].");
		for (int m=0; m<numMetaGroups; m++) {
			if (!(pctRecoveredDiscovered[m] >= 0d && pctRecoveredDiscovered[m] <= 1d)) {
				throw new IllegalArgumentException ("Pct recovered discovered has to be in [0,1] for meta-group " + m + ".");
			}
			if (!(boosterRate[m] >= 0d && boosterRate[m] <= 1d)) {
				throw new IllegalArgumentException ("Booster rate has to be in [0,1] for meta-group " + m + ".");
			}
		}
		if (!(boosterMultiplier >= 0d)) throw new IllegalArgumentException ("Booster multiplier has to be non-negative.");

		this.population = population;
		this.maxT = maxT;
		this.generationTime = generationTime;
		this.infectionsPerDayPerContactUnit = infectionsPerDayPerContactUnit.clone();
		this.initInfections = initInfections.clone();
		this.initRecovered = initRecovered.clone();
		this.outsideRate = outsideRate.clone();
		this.maxInfectiousDays = maxInfectiousDays;
		this.symptomaticRate = symptomaticRate;
		this.noSurveillanceTestRate = noSurveillanceTestRate.clone();
		this.pctRecoveredDiscovered = pctRecoveredDiscovered.clone();
		this.hospitalizationRates = hospitalizationRates.clone();
		this.boosterRate = boosterRate.clone();
		this.boosterMultiplier = boosterMultiplier;
		this.arrivalPeriod = arrivalPeriod;
		this.tests = Collections.unmodifiableMap (new LinkedHashMap<String,TestDefinition> (tests));
	}

	public Population getPopulation () {
		return this.population;
	}

	public int getMaxT () {
		return this.maxT;
	}

	public double getGenerationTime () {
		return this.generationTime;
	}

	public double[] getInfectionsPerDayPerContactUnit () {
		return this.infectionsPerDayPerContactUnit.clone();
	}

	public double[] getInitInfections () {
		return this.initInfections.clone();
	}

	public double[] getInitRecovered () {
		return this.initRecovered.clone();
	}

	public double[] getOutsideRate () {
		return this.outsideRate.clone();
	}

	public double getMaxInfectiousDays () {
		return this.maxInfectiousDays;
	}

	public double getSymptomaticRate () {
		return this.symptomaticRate;
	}

	public double[] getNoSurveillanceTestRate () {
		return this.noSurveillanceTestRate.clone();
	}

	public double[] getPctRecoveredDiscovered () {
		return this.pctRecoveredDiscovered.clone();
	}

	public double[] getHospitalizationRates () {
		return this.hospitalizationRates.clone();
	}

	public double[] getBoosterRate () {
		return this.boosterRate.clone();
	}

	public double getBoosterMultiplier () {
		return this.boosterMultiplier;
	}

	public Integer getArrivalPeriod () {
		return this.arrivalPeriod;
	}

	public Map<String,TestDefinition> getTests () {
		return this.tests;
	}

	public TestDefinition getTest (String name) {
		TestDefinition test = this.tests.get (name);
		if (test == null) throw new IllegalArgumentException ("Unknown test: " + name);
		return test;
	}

	// A copy with the given parameter set to value. For parameters with one value per meta-group,
	// only the listed meta-groups are changed (all of them if metaGroups is null).
	public Scenario withParameter (ScenarioParameter parameter, int[] metaGroups, double value) {
		if (!parameter.isPerMetaGroup() && metaGroups != null) {
			throw new IllegalArgumentException ("Parameter " + parameter.getParameterName() + " is not given per meta-group.");
		}
		double[] perDay = this.infectionsPerDayPerContactUnit;
		double[] infections = this.initInfections;
		double[] recovered = this.initRecovered;
		double[] outside = this.outsideRate;
		double[] hospitalization = this.hospitalizationRates;
		double maxDays = this.maxInfectiousDays;
		double symptomatic = this.symptomaticRate;

		switch (parameter) {
			case INFECTIONS_PER_DAY_PER_CONTACT_UNIT: perDay = this.setEntries (perDay, metaGroups, value); break;
			case INIT_INFECTIONS: infections = this.setEntries (infections, metaGroups, value); break;
			case INIT_RECOVERED: recovered = this.setEntries (recovered, metaGroups, value); break;
			case OUTSIDE_RATE: outside = this.setEntries (outside, metaGroups, value); break;
			case HOSPITALIZATION_RATES: hospitalization = this.setEntries (hospitalization, metaGroups, value); break;
			case MAX_INFECTIOUS_DAYS: maxDays = value; break;
			case SYMPTOMATIC_RATE: symptomatic = value; break;
			default: throw new IllegalArgumentException ("Unknown parameter: " + parameter);
		}

		return new Scenario (this.population, this.maxT, this.generationTime, perDay, infections, recovered, outside, maxDays, symptomatic,
				this.noSurveillanceTestRate, this.pctRecoveredDiscovered, hospitalization, this.arrivalPeriod, this.tests,
				this.boosterRate, this.boosterMultiplier);
	}

	/// a copy where boosterRate of each meta-group has its infection rates scaled by boosterMultiplier
	public Scenario withBooster (double[] boosterRate, double boosterMultiplier) {
		return new Scenario (this.population, this.maxT, this.generationTime, this.infectionsPerDayPerContactUnit, this.initInfections,
				this.initRecovered, this.outsideRate, this.maxInfectiousDays, this.symptomaticRate, this.noSurveillanceTestRate,
				this.pctRecoveredDiscovered, this.hospitalizationRates, this.arrivalPeriod, this.tests, boosterRate, boosterMultiplier);
	}

	private double[] setEntries (double[] values, int[] metaGroups, double value) {
		double[] result = values.clone();
		if (metaGroups == null) {
			for (int m=0; m<result.length; m++) result[m] = value;
		}
		else {
			for (int m : metaGroups) {
				if (m < 0 || m >= result.length) throw new IllegalArgumentException ("Meta-group index " + m + " out of range.");
				result[m] = value;
			}
		}
		return result;
	}

	/// rates scaled by boosterMultiplier for the boostered fraction of each meta-group
	public static double[] boosterAdjusted (double[] rates, double[] boosterRate, double boosterMultiplier) {
		ShapeMismatchException.checkLength (boosterRate, rates.length, "Booster rate");
		double[] result = new double[rates.length];
		for (int m=0; m<rates.length; m++) {
			result[m] = boosterMultiplier * boosterRate[m] * rates[m] + (1d - boosterRate[m]) * rates[m];
		}
		return result;
	}

	public Trajectory simulateStrategy (Strategy strategy) {
		return this.simulateStrategy (strategy, null);
	}

	// Runs the strategy period by period on this scenario.
	// Progress is written to log, if not null.
	public Trajectory simulateStrategy (Strategy strategy, PrintStream log) {
		strategy.validateHorizon (this.maxT);
		if (this.arrivalPeriod == null && strategy.getArrivalTestingRegime() != null) {
			throw new IllegalArgumentException ("Strategy " + strategy.getName() + " has arrival testing, but the scenario has no arrival period.");
		}
		final int K = this.population.getNumGroups();
		double[] perDay = boosterAdjusted (this.infectionsPerDayPerContactUnit, this.boosterRate, this.boosterMultiplier);
		double[] outsidePerMetaGroup = boosterAdjusted (this.outsideRate, this.boosterRate, this.boosterMultiplier);

		// arrival testing decides who starts out discovered
		double[] infections = strategy.getInitialInfections (this.initInfections);
		double[] recovered = strategy.getInitialRecovered (this.initRecovered, this.initInfections);
		double[] discovered = strategy.getInitialDiscovered (this.initRecovered, this.pctRecoveredDiscovered, this.initInfections);
		double[] hidden = strategy.getInitialHidden (this.initRecovered, this.pctRecoveredDiscovered, this.initInfections);
		InitialConditions init = this.population.getInitSIRAndDH (infections, recovered, discovered, hidden, INIT_WEIGHT_POLICY);

		EpidemicSimulator sim = null;
		for (int i=0; i<strategy.getNumPeriods(); i++) {
			Strategy.Period period = strategy.getPeriod(i);
			TestingRegime regime = period.testingRegime;
			double multiplier = period.transmissionMultiplier;

			double[] daysInfectious = regime.getDaysInfectious (this.maxInfectiousDays);
			double[] infectionsPerContactUnit = new double[daysInfectious.length];
			for (int m=0; m<daysInfectious.length; m++) {
				infectionsPerContactUnit[m] = perDay[m] * daysInfectious[m];
			}
			double[][] infectionRate = RateMatrixTools.scale (this.population.infectionMatrix (infectionsPerContactUnit), multiplier);
			double[] infectionDiscoveryFrac = this.population.metaGroupToGroup (regime.getInfectionDiscoveryFrac (this.symptomaticRate));
			double[] recoveredDiscoveryFrac = this.population.metaGroupToGroup (regime.getRecoveredDiscoveryFrac (this.noSurveillanceTestRate));
			double[] outside = this.population.outsideRate (outsidePerMetaGroup);
			for (int k=0; k<K; k++) outside[k] *= multiplier;

			if (sim == null) {
				sim = new EpidemicSimulator (this.maxT, init, infectionRate, infectionDiscoveryFrac, recoveredDiscoveryFrac, outside);
			}
			if (log != null) {
				log.println ("# [PERIOD] " + i + "\t" + regime.getName() + "\tmultiplier " + multiplier + "\t" + period.length + " generations");
			}
			sim.step (period.length, infectionRate, infectionDiscoveryFrac, recoveredDiscoveryFrac, outside);
		}

		if (sim == null) {
			// no periods, nothing happens
			sim = new EpidemicSimulator (this.maxT, init, new double[K][K], new double[K], new double[K], null);
		}
		assert (sim.isFinished());
		return new Trajectory (this, strategy, sim);
	}
}
