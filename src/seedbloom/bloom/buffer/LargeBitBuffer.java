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
 * Bit array backed by a {@link LargeByteBuffer}, eight bits per byte.
 */
public class LargeBitBuffer extends AbstractLargeBitBuffer {
    private final long size;
    private final AbstractLargeByteBuffer backingByteBuffer;
    
    public LargeBitBuffer(long size) {
        this(size, new LargeByteBuffer(numBytes(size)));
    }
    
    private LargeBitBuffer(long size, AbstractLargeByteBuffer backingByteBuffer) {
        this.size = size;
        this.backingByteBuffer = backingByteBuffer;
    }
    
    static long numBytes(long numBits) {
        long numBytes = numBits / Byte.SIZE;
        if (numBits % (long) Byte.SIZE > 0) {
            ++numBytes;
        }
        return numBytes;
    }
    
    private void checkIndex(long index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("bit index " + index + " out of range [0, " + size + ")");
        }
    }
    
    @Override
    public void set(long index) {
        checkIndex(index);
        long byteIndex = index / Byte.SIZE;
        byte b = backingByteBuffer.get(byteIndex);
        b |= (1 << (int) (index % Byte.SIZE));
        backingByteBuffer.set(byteIndex, b);
    }
    
    @Override
    public boolean get(long index) {
        checkIndex(index);
        long byteIndex = index / Byte.SIZE;
        return (backingByteBuffer.get(byteIndex) & (1 << (int) (index % Byte.SIZE))) != 0;
    }
    
    @Override
    public boolean getAndSet(long index) {
        checkIndex(index);
        long byteIndex = index / Byte.SIZE;
        byte b = backingByteBuffer.get(byteIndex);
        byte mask = (byte) (1 << (int) (index % Byte.SIZE));
        boolean isSet = (b & mask) != 0;
        
        if (!isSet) {
            b |= mask;
            backingByteBuffer.set(byteIndex, b);
        }
        
        return isSet;
    }
    
    @Override
    public long size() {
        return size;
    }
    
    @Override
    public long popCount() {
        return backingByteBuffer.bitPopCount();
    }
    
    @Override
    public LargeBitBuffer copy() {
        return new LargeBitBuffer(size, backingByteBuffer.copy());
    }

    @Override
    public AbstractLargeByteBuffer getBackingByteBuffer() {
        return backingByteBuffer;
    }
}
