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

package edu.cornell.simpar.sim;

/// the compartments tracked by the simulator
public enum Bucket {
	S ("susceptible"),
	I ("infected"),
	R ("recovered"),
	D ("discovered"),
	H ("hidden");

	private final String description;

	private Bucket (String description) {
		this.description = description;
	}

	public String getDescription () {
		return this.description;
	}
}
