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
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import edu.cornell.simpar.sim.Bucket;
import edu.cornell.simpar.strategy.Strategy;
import edu.cornell.simpar.utility.DelayedRandom;

// Runs a strategy on scenarios sampled from a family, either one after another or on a pool
// of parallelThreads workers. Each run gets its own random source, spawned from the master
// source before any run starts, so the results only depend on the seed.
public class EnsembleRunner {

	public static class SampleThread implements Callable<Trajectory> {

		private final ScenarioFamily family;
		private final Strategy strategy;
		private final DelayedRandom random;

		public SampleThread (ScenarioFamily family, Strategy strategy, DelayedRandom random) {
			this.family = family;
			this.strategy = strategy;
			this.random = random;
		}

		public Trajectory call () throws Exception {
			Scenario scenario = this.family.getSampledScenario (this.random.spawnGenerator());
			return scenario.simulateStrategy (this.strategy);
		}
	}

	private final ScenarioFamily family;
	private final Strategy strategy;
	// null runs sequentially
	private final Integer parallelThreads;

	public EnsembleRunner (ScenarioFamily family, Strategy strategy, Integer parallelThreads) {
		if (parallelThreads != null && parallelThreads < 1) throw new IllegalArgumentException ("Need at least one thread.");
		this.family = family;
		this.strategy = strategy;
		this.parallelThreads = parallelThreads;
	}

	/// trajectories in the order the samples were drawn
	public List<Trajectory> run (int numSamples, DelayedRandom masterRandom) throws InterruptedException, ExecutionException {
		if (numSamples < 0) throw new IllegalArgumentException ("Number of samples has to be non-negative.");

		ExecutorService taskExecutor = null;
		if (this.parallelThreads != null) {
			taskExecutor = new ForkJoinPool (this.parallelThreads);
		}

		try {
			List<Future<Trajectory>> futures = new ArrayList<Future<Trajectory>>();
			for (int i=0; i<numSamples; i++) {
				SampleThread thread = new SampleThread (this.family, this.strategy, masterRandom.spawnOffspring());

				Future<Trajectory> theFuture = null;
				if (taskExecutor != null) {
					theFuture = taskExecutor.submit (thread);
				}
				else {
					FutureTask<Trajectory> futureTask = new FutureTask<Trajectory> (thread);
					futureTask.run();
					theFuture = futureTask;
				}
				assert (theFuture != null);
				futures.add (theFuture);
			}

			List<Trajectory> results = new ArrayList<Trajectory>();
			for (Future<Trajectory> f : futures) {
				results.add (f.get());
			}
			return results;
		}
		finally {
			if (taskExecutor != null) taskExecutor.shutdown();
		}
	}

	// result[p][t] is the percentiles[p] percentile (in (0,100]) over the trajectories of the
	// aggregated bucket at generation t.
	public static double[][] percentileBands (List<Trajectory> trajectories, Bucket bucket, boolean cumulative, double[] percentiles) {
		if (trajectories.isEmpty()) throw new IllegalArgumentException ("No trajectories.");
		List<double[]> values = new ArrayList<double[]>();
		for (Trajectory trajectory : trajectories) {
			values.add (trajectory.getBucket (bucket, null, cumulative, false));
		}
		int numGenerations = values.get(0).length;

		double[][] bands = new double[percentiles.length][numGenerations];
		for (int t=0; t<numGenerations; t++) {
			DescriptiveStatistics stats = new DescriptiveStatistics();
			for (double[] trajectoryValues : values) stats.addValue (trajectoryValues[t]);
			for (int p=0; p<percentiles.length; p++) {
				bands[p][t] = stats.getPercentile (percentiles[p]);
			}
		}
		return bands;
	}
}
