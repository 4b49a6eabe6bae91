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
import java.text.DecimalFormat;
import java.util.List;
import java.util.concurrent.ExecutionException;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.SimpleJSAP;
import com.martiansoftware.jsap.Switch;

import edu.cornell.simpar.sim.Bucket;
import edu.cornell.simpar.strategy.Strategy;
import edu.cornell.simpar.utility.CollectionFormat;
import edu.cornell.simpar.utility.DelayedRandom;
import edu.cornell.simpar.utility.RateMatrixTools;

public class SimParMain {

	public static final double[] BAND_PERCENTILES = {5d, 50d, 95d};

	public static void main (String[] args) throws JSAPException {

		SimpleJSAP jsap = new SimpleJSAP (
				"SimParMain",
				"Simulates a testing strategy on the example scenario",
				new Parameter[] {
					new FlaggedOption ("seed", JSAP.LONG_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "seed",
							"Seed for the random number generator. Needed to sample scenarios."),
					new FlaggedOption ("numSamples", JSAP.INTEGER_PARSER, "0", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "numSamples",
							"Number of scenarios sampled from the prior. If zero, only the nominal scenario is simulated."),
					new FlaggedOption ("parallel", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "parallel",
							"Number of threads for the sampled runs. Runs sequentially if not given."),
					new FlaggedOption ("testsPerWeek", JSAP.DOUBLE_PARSER, "2", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "testsPerWeek",
							"Surveillance tests per week, 0 means no surveillance."),
					new FlaggedOption ("testType", JSAP.STRING_PARSER, "pcr", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "testType",
							"The surveillance test: pcr or antigen."),
					new Switch ("verbose", JSAP.NO_SHORTFLAG, "verbose", "Print the periods of the strategy while simulating.")
				});

		JSAPResult jsapParams = jsap.parse (args);
		if (jsap.messagePrinted()) { System.exit(1); }

		PrintStream outStream = System.out;
		Long seed = jsapParams.contains ("seed") ? jsapParams.getLong ("seed") : null;
		int numSamples = jsapParams.getInt ("numSamples");
		Integer parallelThreads = jsapParams.contains ("parallel") ? jsapParams.getInt ("parallel") : null;
		boolean verbose = jsapParams.getBoolean ("verbose");

		Strategy strategy = null;
		try {
			strategy = ExampleScenario.getStrategy (ExampleScenario.getTest (jsapParams.getString ("testType")), jsapParams.getDouble ("testsPerWeek"));
		}
		catch (IllegalArgumentException e) {
			System.err.println ("# " + e.getMessage());
			System.exit(1);
		}

		outStream.println ("# Strategy: " + strategy.getName());
		Scenario nominal = ExampleScenario.getNominalScenario();
		if (verbose) {
			outStream.println ("# meta-groups: " + nominal.getPopulation().getMetaGroupNames());
			outStream.println ("# meta-group contact matrix:");
			RateMatrixTools.dump (nominal.getPopulation().getMetaGroupContactMatrix(), outStream);
		}
		Trajectory trajectory = nominal.simulateStrategy (strategy, verbose ? outStream : null);
		printTrajectory (trajectory, outStream);
		if (strategy.getIsolationRegime() != null) {
			double[] isolating = strategy.getIsolationRegime().isolationFractions (nominal.getGenerationTime());
			outStream.println ("# still isolating, by generations since discovery: " + CollectionFormat.formatArray (isolating, ",", "[", "]", new DecimalFormat ("0.00")));
		}

		if (numSamples > 0) {
			DelayedRandom masterRandom = new DelayedRandom (seed);
			if (!masterRandom.isProper()) {
				System.err.println ("# Sampling scenarios involves randomness. Please specify a seed with --seed.");
				System.exit(1);
			}

			EnsembleRunner runner = new EnsembleRunner (ExampleScenario.getScenarioFamily(), strategy, parallelThreads);
			List<Trajectory> trajectories = null;
			try {
				trajectories = runner.run (numSamples, masterRandom);
			} catch (InterruptedException e) {
				System.err.println ("Interrupted exception in ensemble run:");
				e.printStackTrace (System.err);
				System.exit(-1);
			} catch (ExecutionException e) {
				System.err.println ("Execution exception in ensemble run:");
				e.getCause().printStackTrace (System.err);
				System.exit(-1);
			}

			outStream.println ("# [ENSEMBLE] " + numSamples + " samples, infections at percentiles " + CollectionFormat.formatArray (BAND_PERCENTILES, ",", "[", "]"));
			double[][] bands = EnsembleRunner.percentileBands (trajectories, Bucket.I, false, BAND_PERCENTILES);
			DecimalFormat format = new DecimalFormat ("0.00");
			for (int t=0; t<bands[0].length; t++) {
				double[] column = new double[bands.length];
				for (int p=0; p<bands.length; p++) column[p] = bands[p][t];
				outStream.println (t + "\t" + CollectionFormat.formatArray (column, "\t", "", "", format));
			}
		}
	}

	public static void printTrajectory (Trajectory trajectory, PrintStream outStream) {
		double[] infected = trajectory.getBucket (Bucket.I);
		double[] discovered = trajectory.getBucket (Bucket.D);
		double[] hospitalizations = trajectory.getHospitalizations (null, true, false);
		DecimalFormat format = new DecimalFormat ("0.00");

		outStream.println ("# generation\tinfected\tdiscovered\tcumulative hospitalizations");
		for (int t=0; t<infected.length; t++) {
			outStream.println (t + "\t" + CollectionFormat.formatArray (new double[] {infected[t], discovered[t], hospitalizations[t]}, "\t", "", "", format));
		}
	}
}
