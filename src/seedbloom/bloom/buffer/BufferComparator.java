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

/**
 * Comparisons between bit buffers of the same size.
 */
public class BufferComparator {
    public static boolean equivalentByteBuffers(AbstractLargeByteBuffer a, AbstractLargeByteBuffer b) {
        final long size = a.size();
        
        if (size != b.size()) {
            return false;
        }
        
        for (long i=0; i<size; ++i) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        
        return true;
    }
    
    public static boolean equivalentBitBuffers(AbstractLargeBitBuffer a, AbstractLargeBitBuffer b) {        
        if (a.size() != b.size()) {
            return false;
        }
        
        return equivalentByteBuffers(a.getBackingByteBuffer(), b.getBackingByteBuffer());
    }
    
    /**
     * @return true if every bit set in {@code a} is also set in {@code b}
     */
    public static boolean isSubset(AbstractLargeBitBuffer a, AbstractLargeBitBuffer b) {
        if (a.size() != b.size()) {
            return false;
        }
        
        AbstractLargeByteBuffer aBytes = a.getBackingByteBuffer();
        AbstractLargeByteBuffer bBytes = b.getBackingByteBuffer();
        
        final long size = aBytes.size();
        for (long i=0; i<size; ++i) {
            byte ab = aBytes.get(i);
            if ((ab & bBytes.get(i)) != ab) {
                return false;
            }
        }
        
        return true;
    }
}
