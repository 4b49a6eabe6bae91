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

/// thrown whenever a vector or matrix does not have the dimension of the groups (or meta-groups) it is indexed by
public class ShapeMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public ShapeMismatchException (String message) {
		super (message);
	}

	public static void checkLength (double[] vector, int expected, String what) {
		if (vector == null) throw new ShapeMismatchException (what + " is missing (expected length " + expected + ").");
		if (vector.length != expected) {
			throw new ShapeMismatchException (what + " has length " + vector.length + ", expected " + expected + ".");
		}
	}

	public static void checkSquare (double[][] matrix, int expected, String what) {
		if (matrix == null) throw new ShapeMismatchException (what + " is missing (expected " + expected + "x" + expected + ").");
		if (matrix.length != expected || !RateMatrixTools.isSquare (matrix)) {
			throw new ShapeMismatchException (what + " is not a " + expected + "x" + expected + " matrix.");
		}
	}
}
