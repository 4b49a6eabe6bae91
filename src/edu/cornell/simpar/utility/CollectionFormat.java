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

import java.text.DecimalFormat;

public class CollectionFormat {

	public static String formatArray(double[] array, String sep, String start, String end) {
		StringBuffer sb = new StringBuffer(start);

		for (double item : array) {
			sb.append(item + sep);
		}

		if (array.length > 0) {
			sb.replace(sb.length() - sep.length(), sb.length(), end);
		} else {
			sb.append(end);
		}

		return sb.toString();
	}

	public static String formatArray(double[] array, String sep, String start, String end, DecimalFormat format) {
		StringBuffer sb = new StringBuffer(start);

		for (double item : array) {
			sb.append(format.format(item) + sep);
		}

		if (array.length > 0) {
			sb.replace(sb.length() - sep.length(), sb.length(), end);
		} else {
			sb.append(end);
		}

		return sb.toString();
	}
}
