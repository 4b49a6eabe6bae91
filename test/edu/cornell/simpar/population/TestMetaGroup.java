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

import org.junit.*;

import static org.junit.Assert.*;

public class TestMetaGroup {

	MetaGroup metaGroup;

	@Before
	public void setUp () {
		metaGroup = new MetaGroup ("mg", new double[] {10, 20, 30}, new double[] {1, 2, 3});
	}

	@Test
	public void contactWeights () {
		assertArrayEquals (new double[] {10d/140, 40d/140, 90d/140}, metaGroup.getContactWeights(), 1e-12);
		assertArrayEquals (new double[] {1d/6, 2d/6, 3d/6}, metaGroup.getPopulationWeights(), 1e-12);
	}

	@Test
	public void infectionMatrixIsContactWeighted () {
		double[][] matrix = metaGroup.infectionMatrix (2d);
		double[] q = metaGroup.getContactWeights();
		for (int i=0; i<3; i++) {
			for (int j=0; j<3; j++) {
				assertEquals (2d * (i+1) * q[j], matrix[i][j], 1e-12);
			}
		}
		// one infectious person with c contact units causes 2c infections in total
		double rowSum = 0d;
		for (double v : matrix[2]) rowSum += v;
		assertEquals (6d, rowSum, 1e-12);
	}

	@Test
	public void outsideRateByPopulationShare () {
		assertArrayEquals (new double[] {1, 2, 3}, metaGroup.outsideRate (6d), 1e-12);
	}

	@Test
	public void initSIRPopulation () {
		InitialConditions init = metaGroup.getInitSIR (6d, 12d, WeightPolicy.POPULATION);
		assertArrayEquals (new double[] {1, 2, 3}, init.infected, 1e-12);
		assertArrayEquals (new double[] {2, 4, 6}, init.recovered, 1e-12);
		assertArrayEquals (new double[] {7, 14, 21}, init.susceptible, 1e-12);
		assertFalse (init.hasDiscoveredAndHidden());
	}

	@Test
	public void initSIRPopulationTimesContacts () {
		InitialConditions init = metaGroup.getInitSIR (14d, 0d, WeightPolicy.POPULATION_X_CONTACTS);
		assertArrayEquals (new double[] {1, 4, 9}, init.infected, 1e-12);
		assertArrayEquals (new double[] {9, 16, 21}, init.susceptible, 1e-12);
	}

	@Test
	public void initSIRMostSocial () {
		InitialConditions init = metaGroup.getInitSIR (6d, 12d, WeightPolicy.MOST_SOCIAL);
		assertArrayEquals (new double[] {0, 0, 6}, init.infected, 1e-12);
		assertArrayEquals (new double[] {0, 0, 12}, init.recovered, 1e-12);
		assertArrayEquals (new double[] {10, 20, 12}, init.susceptible, 1e-12);
	}

	@Test
	public void susceptibleClampedAtZero () {
		InitialConditions init = metaGroup.getInitSIR (30d, 40d, WeightPolicy.MOST_SOCIAL);
		assertEquals (0d, init.susceptible[2], 0d);
	}

	@Test
	public void truncatedPareto () {
		MetaGroup pareto = MetaGroup.fromTruncatedPareto ("x", 100d, 2d, 3);
		assertEquals (3, pareto.getNumGroups());
		assertArrayEquals (new double[] {1, 2, 3}, pareto.getContactUnits(), 0d);
		assertEquals (100d, pareto.getTotalPopulation(), 1e-9);
		// density 2/k^3
		double[] pop = pareto.getPopulation();
		assertEquals (8d, pop[0] / pop[1], 1e-9);
		assertEquals (27d, pop[0] / pop[2], 1e-9);
		assertEquals (2, pareto.getMostSocialGroup());
	}

	@Test
	public void mostSocialTakesLastOfEqual () {
		MetaGroup flat = new MetaGroup ("flat", new double[] {1, 1, 1}, new double[] {1, 1, 1});
		assertEquals (2, flat.getMostSocialGroup());
	}

	@Test (expected = IllegalArgumentException.class)
	public void negativePopulation () {
		new MetaGroup ("bad", new double[] {1, -1}, new double[] {1, 2});
	}

	@Test (expected = IllegalArgumentException.class)
	public void mismatchedLengths () {
		new MetaGroup ("bad", new double[] {1, 1}, new double[] {1, 2, 3});
	}
}
