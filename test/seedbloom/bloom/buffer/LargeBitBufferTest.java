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

public class LargeBitBufferTest {

    @Test
    public void setAndGet() {
        LargeBitBuffer bits = new LargeBitBuffer(13);
        assertEquals(13, bits.size());
        assertEquals(2, bits.getBackingByteBuffer().size());

        bits.set(0);
        bits.set(7);
        bits.set(8);
        bits.set(12);

        for (long i = 0; i < 13; i++) {
            assertEquals(i == 0 || i == 7 || i == 8 || i == 12, bits.get(i));
        }
        assertEquals(4, bits.popCount());
    }

    @Test
    public void neighbouringBitsAreIndependent() {
        LargeBitBuffer bits = new LargeBitBuffer(64);
        for (long i = 0; i < 64; i += 2) {
            bits.set(i);
        }
        for (long i = 0; i < 64; i++) {
            assertEquals(i % 2 == 0, bits.get(i));
        }
        assertEquals(32, bits.popCount());
    }

    @Test
    public void getAndSetReturnsPreviousState() {
        LargeBitBuffer bits = new LargeBitBuffer(10);
        assertFalse(bits.getAndSet(9));
        assertTrue(bits.getAndSet(9));
        assertTrue(bits.get(9));
        assertEquals(1, bits.popCount());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsIndexPastEnd() {
        new LargeBitBuffer(13).set(13);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsNegativeIndex() {
        new LargeBitBuffer(13).get(-1);
    }

    @Test
    public void copyIsIndependent() {
        LargeBitBuffer bits = new LargeBitBuffer(20);
        bits.set(3);
        LargeBitBuffer copy = bits.copy();
        copy.set(4);
        bits.set(5);

        assertTrue(copy.get(3));
        assertTrue(copy.get(4));
        assertFalse(copy.get(5));
        assertFalse(bits.get(4));
        assertEquals(2, bits.popCount());
        assertEquals(2, copy.popCount());
    }

    @Test
    public void byteBufferSpansPartitions() {
        LargeByteBuffer bytes = new LargeByteBuffer(10, 4);
        for (long i = 0; i < 10; i++) {
            bytes.set(i, (byte) (i + 1));
        }
        for (long i = 0; i < 10; i++) {
            assertEquals((byte) (i + 1), bytes.get(i));
        }

        LargeByteBuffer copy = bytes.copy();
        copy.set(9, (byte) 0);
        assertEquals((byte) 10, bytes.get(9));
        assertEquals((byte) 0, copy.get(9));
        assertEquals(10, copy.size());
    }

    @Test
    public void bitPopCountCoversEveryByte() {
        LargeByteBuffer bytes = new LargeByteBuffer(11, 4);
        bytes.set(0, (byte) 0xFF);
        bytes.set(10, (byte) 0x81);
        assertEquals(10, bytes.bitPopCount());
    }
}
