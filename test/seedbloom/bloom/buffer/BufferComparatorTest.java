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
package seedbloom.bloom.buffer;

import org.junit.Test;

import static org.junit.Assert.*;

public class BufferComparatorTest {

    @Test
    public void subsets() {
        LargeBitBuffer a = new LargeBitBuffer(30);
        LargeBitBuffer b = new LargeBitBuffer(30);
        assertTrue(BufferComparator.isSubset(a, b));

        a.set(2);
        assertFalse(BufferComparator.isSubset(a, b));

        b.set(2);
        b.set(25);
        assertTrue(BufferComparator.isSubset(a, b));
        assertFalse(BufferComparator.isSubset(b, a));
        assertFalse(BufferComparator.isSubset(a, new LargeBitBuffer(31)));
    }

    @Test
    public void equivalence() {
        LargeBitBuffer a = new LargeBitBuffer(16);
        LargeBitBuffer b = new LargeBitBuffer(16);
        a.set(1);
        b.set(1);
        assertTrue(BufferComparator.equivalentBitBuffers(a, b));

        b.set(9);
        b.set(15);
        assertFalse(BufferComparator.equivalentBitBuffers(a, b));
        assertFalse(BufferComparator.equivalentBitBuffers(a, new LargeBitBuffer(8)));
    }
}
