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

/// how meta-group level initial counts are spread over the groups of that meta-group
public enum WeightPolicy {
	// each person equally likely
	POPULATION ("population"),
	// proportional to the amount of contact
	POPULATION_X_CONTACTS ("population x contacts"),
	// everything in the most social group
	MOST_SOCIAL ("most_social");

	private final String policyName;

	private WeightPolicy (String policyName) {
		this.policyName = policyName;
	}

	public String getPolicyName () {
		return this.policyName;
	}

	public static WeightPolicy fromName (String name) {
		for (WeightPolicy policy : values()) {
			if (policy.policyName.equals (name)) return policy;
		}
		throw new IllegalArgumentException ("The provided weight is not supported: " + name);
	}
}
