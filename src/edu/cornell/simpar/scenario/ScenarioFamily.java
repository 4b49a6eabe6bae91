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
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.random.RandomGenerator;

/// a nominal scenario together with priors on some of its parameters
public class ScenarioFamily {

	private final Scenario baseScenario;
	private final List<PriorParameter> priors;

	public ScenarioFamily (Scenario baseScenario, List<PriorParameter> priors) {
		this.baseScenario = baseScenario;
		this.priors = Collections.unmodifiableList (new ArrayList<PriorParameter> (priors));
	}

	public List<PriorParameter> getPriors () {
		return this.priors;
	}

	/// every prior set to its mean
	public Scenario getNominalScenario () {
		Scenario scenario = this.baseScenario;
		for (PriorParameter prior : this.priors) {
			scenario = prior.applyTo (scenario, prior.getMu());
		}
		return scenario;
	}

	/// the priors are sampled in order, so a given generator state gives the same scenario
	public Scenario getSampledScenario (RandomGenerator random) {
		Scenario scenario = this.baseScenario;
		for (PriorParameter prior : this.priors) {
			scenario = prior.applyTo (scenario, prior.sample (random));
		}
		return scenario;
	}
}
