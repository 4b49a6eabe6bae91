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

// Initial per-group counts handed to the simulator.
// The discovered and hidden vectors may be null, in which case the simulator derives them.
public class InitialConditions {

	public final double[] susceptible;
	public final double[] infected;
	public final double[] recovered;
	public final double[] discovered;
	public final double[] hidden;

	public InitialConditions (double[] susceptible, double[] infected, double[] recovered) {
		this (susceptible, infected, recovered, null, null);
	}

	public InitialConditions (double[] susceptible, double[] infected, double[] recovered, double[] discovered, double[] hidden) {
		assert (susceptible.length == infected.length);
		assert (susceptible.length == recovered.length);
		assert ((discovered == null) == (hidden == null));
		this.susceptible = susceptible;
		this.infected = infected;
		this.recovered = recovered;
		this.discovered = discovered;
		this.hidden = hidden;
	}

	public boolean hasDiscoveredAndHidden () {
		return this.discovered != null;
	}

	public int getNumGroups () {
		return this.susceptible.length;
	}

	// just for debug
	public String toString () {
		return "S0=" + Arrays.toString (this.susceptible) + " I0=" + Arrays.toString (this.infected) + " R0=" + Arrays.toString (this.recovered)
				+ (this.hasDiscoveredAndHidden() ? " D0=" + Arrays.toString (this.discovered) + " H0=" + Arrays.toString (this.hidden) : "");
	}
}
