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

public class SumArray {

	public static double getSum(double[] array) {
		double total = 0d;
		for (double d : array) total += d;
		return total;
	}

	public static int getSum(int[] array) {
		int total = 0;
		for (int i : array) total += i;
		return total;
	}

	/// running sum over the rows of a matrix
	public static double[][] getCumulativeRows(double[][] matrix) {
		double[][] result = new double[matrix.length][];
		for (int t = 0; t < matrix.length; t++) {
			result[t] = matrix[t].clone();
			if (t > 0) {
				for (int j = 0; j < result[t].length; j++) result[t][j] += result[t-1][j];
			}
		}
		return result;
	}

	public static double[] getRowSums(double[][] matrix) {
		double[] result = new double[matrix.length];
		for (int t = 0; t < matrix.length; t++) result[t] = getSum(matrix[t]);
		return result;
	}
}
