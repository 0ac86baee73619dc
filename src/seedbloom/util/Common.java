/* 
 * Copyright (C) 2018-present BC Cancer Genome Sciences Centre
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package seedbloom.util;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Number formatting shared by the command-line output.
 */
public class Common {
    public static double convertToRoundedPercent(double d) {
        return roundToSigFigs(d * 100, 3);
    }
    
    public static double roundToSigFigs(double d, int sigFigs) {
        BigDecimal bd = new BigDecimal(d);
        bd = bd.round(new MathContext(sigFigs));
        return bd.doubleValue();
    }
}
