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

import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.*;

import static org.junit.Assert.*;

public class TestScenarioFamily {

	ScenarioFamily family;

	@Before
	public void setUp () {
		family = ExampleScenario.getScenarioFamily();
	}

	static RandomGenerator generator (long seed) {
		JDKRandomGenerator random = new JDKRandomGenerator();
		random.setSeed (seed);
		return random;
	}

	@Test
	public void nominalUsesPriorMeans () {
		Scenario nominal = family.getNominalScenario();
		assertArrayEquals (new double[] {0.05, 0.05}, nominal.getInfectionsPerDayPerContactUnit(), 0d);
		assertArrayEquals (new double[] {20, 5}, nominal.getInitInfections(), 0d);
		assertEquals (0.3, nominal.getSymptomaticRate(), 0d);
		assertEquals (6d, nominal.getMaxInfectiousDays(), 0d);
	}

	@Test
	public void samplingIsReproducible () {
		Scenario first = family.getSampledScenario (generator (11L));
		Scenario second = family.getSampledScenario (generator (11L));
		assertArrayEquals (first.getInfectionsPerDayPerContactUnit(), second.getInfectionsPerDayPerContactUnit(), 0d);
		assertArrayEquals (first.getInitInfections(), second.getInitInfections(), 0d);
		assertEquals (first.getMaxInfectiousDays(), second.getMaxInfectiousDays(), 0d);
		// only the first meta-group has a prior
		assertEquals (0.05, first.getInfectionsPerDayPerContactUnit()[1], 0d);
		assertEquals (5d, first.getInitInfections()[1], 0d);
	}

	@Test
	public void samplesStayInBounds () {
		PriorParameter prior = new PriorParameter (ScenarioParameter.INFECTIONS_PER_DAY_PER_CONTACT_UNIT, null, 0.05, 0.05, 0.04, 0.1);
		RandomGenerator random = generator (5L);
		double sum = 0d;
		for (int i=0; i<500; i++) {
			double value = prior.sample (random);
			assertTrue (value >= 0.04 && value <= 0.1);
			sum += value;
		}
		// truncated on the left, so the mean moves up
		assertTrue (sum / 500 > 0.05);
	}

	@Test
	public void degeneratePrior () {
		PriorParameter prior = new PriorParameter (ScenarioParameter.SYMPTOMATIC_RATE, null, 0.3, 0d);
		assertEquals (0.3, prior.sample (generator (1L)), 0d);
	}

	@Test (expected = IllegalArgumentException.class)
	public void meanOutsideBounds () {
		new PriorParameter (ScenarioParameter.SYMPTOMATIC_RATE, null, 0.3, 0.1, 0.5, 1d);
	}

	@Test
	public void restrictedToMetaGroups () {
		PriorParameter prior = new PriorParameter (ScenarioParameter.OUTSIDE_RATE, new int[] {1}, 4d, 0d);
		Scenario scenario = new ScenarioFamily (ExampleScenario.getNominalScenario(), Arrays.asList (prior)).getNominalScenario();
		assertArrayEquals (new double[] {2, 4}, scenario.getOutsideRate(), 0d);
	}
}
