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

package edu.cornell.simpar.utility;

import java.util.Arrays;

public class CopyArray {
	public static double[] nCopies(int numCopies, double d) {
		double[] nCopyArray = new double[numCopies];
		Arrays.fill(nCopyArray, d);

		return nCopyArray;
	}

	public static double[][] deepCopy(double[][] matrix) {
		if (matrix == null) return null;
		double[][] copy = new double[matrix.length][];
		for (int i = 0; i < matrix.length; i++) {
			copy[i] = Arrays.copyOf(matrix[i], matrix[i].length);
		}
		return copy;
	}
}
