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

import java.nio.ByteBuffer;

/**
 * Heap byte storage split into partitions of at most 1 GiB,
 * so the total size is not limited by a single array.
 */
public class LargeByteBuffer extends AbstractLargeByteBuffer {
    private final static int MAX_PARTITION_SIZE = 1 << 30;
    
    private final long size;
    private final int partitionSize;
    private final ByteBuffer[] buffers;
    
    public LargeByteBuffer(long size) {
        this(size, MAX_PARTITION_SIZE);
    }
    
    LargeByteBuffer(long size, int partitionSize) {
        this.size = size;
        this.partitionSize = partitionSize;
        int numPartitions = (int) (size / partitionSize);
        int remainder = (int) (size % partitionSize);
        
        if (remainder > 0) {
            ++numPartitions;
        }
        
        buffers = new ByteBuffer[numPartitions];
        
        int lastIndex = numPartitions-1;
        for (int i=0; i<numPartitions; ++i) {
            if (i == lastIndex && remainder > 0) {
                buffers[i] = ByteBuffer.allocate(remainder);
            }
            else {
                buffers[i] = ByteBuffer.allocate(partitionSize);
            }
        }
    }
    
    private LargeByteBuffer(long size, int partitionSize, ByteBuffer[] buffers) {
        this.size = size;
        this.partitionSize = partitionSize;
        this.buffers = buffers;
    }
    
    @Override
    public void set(long index, byte value) {
        buffers[(int) (index / partitionSize)].put((int) (index % partitionSize), value);
    }
    
    @Override
    public byte get(long index) {
        return buffers[(int) (index / partitionSize)].get((int) (index % partitionSize));
    }
    
    @Override
    public long size() {
        return size;
    }
    
    @Override
    public long bitPopCount() {
        long count = 0;
        int cap;
        for (ByteBuffer bb : buffers) {
            cap = bb.capacity();
            for (int i=0; i<cap; ++i) {
                count += Integer.bitCount(bb.get(i) & 0xFF);
            }
        }
        return count;
    }
    
    @Override
    public LargeByteBuffer copy() {
        ByteBuffer[] copies = new ByteBuffer[buffers.length];
        for (int i=0; i<buffers.length; ++i) {
            copies[i] = ByteBuffer.wrap(buffers[i].array().clone());
        }
        return new LargeByteBuffer(size, partitionSize, copies);
    }
}
