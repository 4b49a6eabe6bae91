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

import java.io.PrintStream;

import Jama.Matrix;

public class RateMatrixTools {

	public static boolean isSquare (double[][] matrix) {
		int numRows = matrix.length;
		for (int i=0; i<numRows; i++) {
			if (matrix[i].length != numRows) return false;
		}
		// we made it through, so everything fine
		return true;
	}

	/// check whether matrix is square, has non-negative entries, and every row sums to one
	public static boolean isRowStochasticMatrix (double[][] matrix, double EPSILON) {
		if (!isSquare (matrix)) return false;
		for (double[] row : matrix) {
			double sum = 0d;
			for (double value : row) {
				// negative probability?
				if (value < -EPSILON) return false;
				sum += value;
			}
			if (Math.abs (sum - 1d) > EPSILON) return false;
		}
		return true;
	}

	/// check whether all entries are non-negative
	public static boolean allEntriesNonNegative (double[][] matrix) {
		for (double[] values : matrix) {
			for (double value : values) {
				if (!(value >= 0d)) return false;
			}
		}
		return true;
	}

	/// a scaled deep copy
	public static double[][] scale (double[][] matrix, double factor) {
		// Jama copies for us
		return new Matrix (matrix).times (factor).getArray();
	}

	/// the row vector times the matrix, i.e. result[j] = sum_i vector[i] * matrix[i][j]
	public static double[] leftMultiply (double[] vector, double[][] matrix) {
		assert (vector.length == matrix.length);
		// a 1 x n matrix, packed by columns
		Matrix rowVector = new Matrix (vector, 1);
		return rowVector.times (new Matrix (matrix)).getRowPackedCopy();
	}

	/// dump matrix
	public static void dump (double[][] matrix, PrintStream outStream) {
		for (double[] values : matrix) {
			for (double value : values) {
				outStream.print (value + "\t");
			}
			outStream.println();
		}
	}
}
