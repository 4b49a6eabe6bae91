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

/// scalar scenario parameters that a prior can be put on
public enum ScenarioParameter {
	INFECTIONS_PER_DAY_PER_CONTACT_UNIT ("infections_per_day_per_contact_unit", true),
	INIT_INFECTIONS ("init_infections", true),
	INIT_RECOVERED ("init_recovered", true),
	OUTSIDE_RATE ("outside_rate", true),
	HOSPITALIZATION_RATES ("hospitalization_rates", true),
	MAX_INFECTIOUS_DAYS ("max_infectious_days", false),
	SYMPTOMATIC_RATE ("symptomatic_rate", false);

	private final String parameterName;
	private final boolean perMetaGroup;

	private ScenarioParameter (String parameterName, boolean perMetaGroup) {
		this.parameterName = parameterName;
		this.perMetaGroup = perMetaGroup;
	}

	public String getParameterName () {
		return this.parameterName;
	}

	/// whether the parameter has one value per meta-group, otherwise it is a single value
	public boolean isPerMetaGroup () {
		return this.perMetaGroup;
	}

	public static ScenarioParameter fromName (String name) {
		for (ScenarioParameter parameter : ScenarioParameter.values()) {
			if (parameter.parameterName.equals (name)) return parameter;
		}
		throw new IllegalArgumentException ("Unknown scenario parameter: " + name);
	}
}
