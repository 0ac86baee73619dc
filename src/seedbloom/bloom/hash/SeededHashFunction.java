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
package seedbloom.bloom.hash;

import com.sangupta.murmur.Murmur3;
import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * A family of MurmurHash3 (x86, 32-bit) functions, one per seed.
 *
 * <p>Seeds are fixed at construction. For the same seeds and the same key,
 * {@link #getHashValues(byte[], long[])} always returns the same values.
 */
public class SeededHashFunction {
    private static final long UNSIGNED_INT_MASK = 0xFFFFFFFFL;
    
    private final long[] seeds;
    
    public SeededHashFunction(long[] seeds) {
        this.seeds = seeds.clone();
    }
    
    /**
     * Draws {@code numHash} seeds independently and uniformly from {@code [0, maxSeed]}.
     * Repeated seeds are possible and are kept.
     */
    public static long[] generateSeeds(Random random, int numHash, long maxSeed) {
        long[] seeds = new long[numHash];
        for (int i=0; i<numHash; ++i) {
            seeds[i] = random.nextLong(0, maxSeed + 1);
        }
        return seeds;
    }
    
    public int getNumHash() {
        return seeds.length;
    }
    
    public long[] getSeeds() {
        return seeds.clone();
    }
    
    /**
     * @param key - the bytes to hash
     * @param out - receives one unsigned 32-bit hash value per seed
     */
    public void getHashValues(final byte[] key, final long[] out) {
        for (int h=0; h<seeds.length; ++h) {
            out[h] = Murmur3.hash_x86_32(key, key.length, seeds[h]) & UNSIGNED_INT_MASK;
        }
    }
    
    public long[] getHashValues(final byte[] key) {
        long[] hVals = new long[seeds.length];
        getHashValues(key, hVals);
        return hVals;
    }
    
    public static byte[] stringToBytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }
}
