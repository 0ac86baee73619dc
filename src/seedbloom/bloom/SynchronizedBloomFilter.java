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
package seedbloom.bloom;

import seedbloom.bloom.buffer.AbstractLargeBitBuffer;

/**
 * Serializes every operation on a wrapped {@link BloomFilter} through a single monitor.
 */
public class SynchronizedBloomFilter implements BloomFilterInterface {
    private final BloomFilter bf;
    private final Object lock = new Object();
    
    public SynchronizedBloomFilter(BloomFilter bf) {
        if (bf == null) {
            throw new InvalidConfigurationException("wrapped filter must not be null");
        }
        this.bf = bf;
    }

    @Override
    public void add(byte[] key) {
        synchronized (lock) {
            bf.add(key);
        }
    }

    @Override
    public void add(String key) {
        synchronized (lock) {
            bf.add(key);
        }
    }

    @Override
    public boolean lookup(byte[] key) {
        synchronized (lock) {
            return bf.lookup(key);
        }
    }

    @Override
    public boolean lookup(String key) {
        synchronized (lock) {
            return bf.lookup(key);
        }
    }

    @Override
    public boolean lookupThenAdd(byte[] key) {
        synchronized (lock) {
            return bf.lookupThenAdd(key);
        }
    }

    @Override
    public boolean lookupThenAdd(String key) {
        synchronized (lock) {
            return bf.lookupThenAdd(key);
        }
    }

    @Override
    public double getFPR(long numElements) {
        // size and numHash never change
        return bf.getFPR(numElements);
    }
    
    public long getPopCount() {
        synchronized (lock) {
            return bf.getPopCount();
        }
    }
    
    public AbstractLargeBitBuffer getBitmap() {
        synchronized (lock) {
            return bf.getBitmap();
        }
    }
    
    public long[] getSeeds() {
        return bf.getSeeds();
    }
}
