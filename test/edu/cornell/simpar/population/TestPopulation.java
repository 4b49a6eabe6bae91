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

import java.util.Arrays;

import org.junit.*;

import static org.junit.Assert.*;

import edu.cornell.simpar.utility.ShapeMismatchException;
import gnu.trove.list.TIntList;

public class TestPopulation {

	MetaGroup ug;
	MetaGroup staff;
	Population population;

	@Before
	public void setUp () {
		ug = new MetaGroup ("UG", new double[] {10, 20, 30}, new double[] {1, 2, 3});
		staff = new MetaGroup ("staff", new double[] {40, 60}, new double[] {1, 4});
		population = new Population (Arrays.asList (ug, staff), new double[][] {{0.75, 0.25}, {0.5, 0.5}});
	}

	@Test
	public void indexRanges () {
		assertEquals (2, population.getNumMetaGroups());
		assertEquals (5, population.getNumGroups());
		assertEquals (0, population.getGroupRangeStart(0));
		assertEquals (3, population.getGroupRangeEnd(0));
		assertEquals (3, population.getGroupRangeStart(1));
		assertEquals (5, population.getGroupRangeEnd(1));
		TIntList ids = population.metaGroupIds ("staff");
		assertEquals (2, ids.size());
		assertEquals (3, ids.get(0));
		assertEquals (4, ids.get(1));
		assertEquals (1, population.metaGroupOf (4));
		assertEquals (160d, population.getTotalPopulation(), 1e-12);
	}

	@Test
	public void groupNames () {
		assertEquals ("UG 2", population.groupName (1));
		assertEquals ("staff 4", population.groupName (4));
		assertEquals (3, population.groupIndex ("staff 1"));
		assertEquals (Arrays.asList ("UG", "staff"), population.getMetaGroupNames());
	}

	@Test
	public void infectionMatrixFactorization () {
		double[] perContactUnit = {2d, 3d};
		double[][] matrix = population.infectionMatrix (perContactUnit);
		double[] qStaff = staff.getContactWeights();
		double[] qUg = ug.getContactWeights();

		// UG group with 3 contact units into staff group with 4 contact units
		assertEquals (3d * 2d * 0.25 * qStaff[1], matrix[2][4], 1e-12);
		// staff group with 1 contact unit into UG group with 2 contact units
		assertEquals (1d * 3d * 0.5 * qUg[1], matrix[3][1], 1e-12);

		// row sums are contact units times infections per contact unit
		for (int k=0; k<5; k++) {
			double rowSum = 0d;
			for (double v : matrix[k]) rowSum += v;
			int m = population.metaGroupOf (k);
			double contacts = population.getMetaGroup(m).getContactUnits()[k - population.getGroupRangeStart(m)];
			assertEquals (contacts * perContactUnit[m], rowSum, 1e-12);
		}
	}

	@Test
	public void identityMixingReproducesMetaGroups () {
		Population separate = new Population (Arrays.asList (ug, staff), new double[][] {{1, 0}, {0, 1}});
		double[][] matrix = separate.infectionMatrix (new double[] {2d, 3d});
		double[][] ugMatrix = ug.infectionMatrix (2d);
		double[][] staffMatrix = staff.infectionMatrix (3d);
		for (int i=0; i<3; i++) {
			for (int j=0; j<3; j++) assertEquals (ugMatrix[i][j], matrix[i][j], 1e-12);
			for (int j=3; j<5; j++) assertEquals (0d, matrix[i][j], 0d);
		}
		for (int i=0; i<2; i++) {
			for (int j=0; j<2; j++) assertEquals (staffMatrix[i][j], matrix[3+i][3+j], 1e-12);
		}
	}

	@Test
	public void singleMetaGroupIsWellMixed () {
		Population single = new Population (Arrays.asList (ug), new double[][] {{1}});
		double[][] matrix = single.infectionMatrix (new double[] {1.5});
		double[][] expected = ug.infectionMatrix (1.5);
		for (int i=0; i<3; i++) assertArrayEquals (expected[i], matrix[i], 1e-12);
	}

	@Test
	public void outsideRate () {
		assertArrayEquals (new double[] {1, 2, 3, 4, 6}, population.outsideRate (new double[] {6, 10}), 1e-12);
	}

	@Test
	public void metaGroupToGroup () {
		assertArrayEquals (new double[] {0.1, 0.1, 0.1, 0.7, 0.7}, population.metaGroupToGroup (new double[] {0.1, 0.7}), 0d);
	}

	@Test
	public void initSIRByName () {
		InitialConditions init = population.getInitSIR (new double[] {6, 0}, new double[] {12, 10}, "population");
		assertArrayEquals (new double[] {1, 2, 3, 0, 0}, init.infected, 1e-12);
		assertArrayEquals (new double[] {2, 4, 6, 4, 6}, init.recovered, 1e-12);
		assertArrayEquals (new double[] {7, 14, 21, 36, 54}, init.susceptible, 1e-12);

		InitialConditions social = population.getInitSIR (new double[] {6, 5}, new double[] {0, 0}, "most_social");
		assertArrayEquals (new double[] {0, 0, 6, 0, 5}, social.infected, 1e-12);
	}

	@Test
	public void initSIRAndDH () {
		InitialConditions init = population.getInitSIRAndDH (new double[] {6, 0}, new double[] {12, 10},
				new double[] {9, 4}, new double[] {9, 6}, WeightPolicy.POPULATION);
		assertTrue (init.hasDiscoveredAndHidden());
		for (int k=0; k<5; k++) {
			assertEquals (init.infected[k] + init.recovered[k], init.discovered[k] + init.hidden[k], 1e-12);
		}
		assertArrayEquals (new double[] {1.5, 3, 4.5, 1.6, 2.4}, init.discovered, 1e-12);
	}

	@Test (expected = IllegalArgumentException.class)
	public void inconsistentDiscoveredAndHidden () {
		population.getInitSIRAndDH (new double[] {6, 0}, new double[] {12, 10},
				new double[] {9, 4}, new double[] {1, 6}, WeightPolicy.POPULATION);
	}

	@Test (expected = IllegalArgumentException.class)
	public void unknownWeightPolicy () {
		population.getInitSIR (new double[] {6, 0}, new double[] {12, 10}, "by_age");
	}

	@Test (expected = ShapeMismatchException.class)
	public void wrongNumberOfRates () {
		population.infectionMatrix (new double[] {1, 2, 3});
	}

	@Test (expected = ShapeMismatchException.class)
	public void nonSquareMixing () {
		new Population (Arrays.asList (ug, staff), new double[][] {{1, 0}});
	}

	@Test
	public void truncatedParetos () {
		Population pareto = Population.fromTruncatedParetos (new String[] {"g1", "g2", "g3"}, new double[] {100, 50, 50},
				new double[] {2, 3, 1}, new int[] {9, 11, 8}, new double[][] {{0, 0, 0}, {0.3, 0.3, 0.3}, {0.6, 0.6, 0.6}});
		assertEquals (28, pareto.getNumGroups());
		assertEquals (200d, pareto.getTotalPopulation(), 1e-9);
		assertEquals (9, pareto.getGroupRangeStart (1));
		assertEquals ("g3 8", pareto.groupName (27));
	}
}
