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

import java.util.Random;
import static java.lang.Math.exp;
import static java.lang.Math.log;
import static java.lang.Math.pow;
import seedbloom.bloom.buffer.AbstractLargeBitBuffer;
import seedbloom.bloom.buffer.BufferComparator;
import seedbloom.bloom.buffer.LargeBitBuffer;
import seedbloom.bloom.hash.SeededHashFunction;
import static seedbloom.bloom.hash.SeededHashFunction.stringToBytes;

/**
 * A Bloom filter over a fixed array of {@code size} bits, probed by {@code numHash}
 * seeded MurmurHash3 functions.
 *
 * <p>Elements can only be added. A lookup never reports an added element as absent,
 * but may report an element that was never added as present.
 *
 * <p>Instances are not thread-safe. Callers that share a filter between threads must
 * serialize access themselves, e.g. with {@link SynchronizedBloomFilter}.
 */
public class BloomFilter implements BloomFilterInterface {
    public static final int DEFAULT_NUM_HASH = 10;
    
    /** Each probe is a 32-bit hash value, so larger arrays would leave bits unreachable. */
    public static final long MAX_SIZE = 1L << 32;
    
    protected final AbstractLargeBitBuffer bitArray;
    protected final int numHash;
    protected final long size;
    protected final SeededHashFunction hashFunction;
    
    public BloomFilter(long size) {
        this(size, DEFAULT_NUM_HASH);
    }
    
    public BloomFilter(long size, int numHash) {
        this(size, numHash, new Random());
    }
    
    /**
     * @param size - number of bits, must be positive
     * @param numHash - number of hash functions, must be positive
     * @param random - source of the hash seeds; pass a seeded generator for reproducible indices
     */
    public BloomFilter(long size, int numHash, Random random) {
        if (size <= 0) {
            throw new InvalidConfigurationException("size must be positive: " + size);
        }
        if (size > MAX_SIZE) {
            throw new InvalidConfigurationException("size must not exceed " + MAX_SIZE + ": " + size);
        }
        if (numHash <= 0) {
            throw new InvalidConfigurationException("number of hash functions must be positive: " + numHash);
        }
        if (random == null) {
            throw new InvalidConfigurationException("random source must not be null");
        }
        
        // below Long.MAX_VALUE since size <= 2^32 and numHash < 2^31
        final long maxSeed = size * numHash;
        
        this.size = size;
        this.numHash = numHash;
        this.bitArray = new LargeBitBuffer(size);
        this.hashFunction = new SeededHashFunction(SeededHashFunction.generateSeeds(random, numHash, maxSeed));
    }
    
    private static byte[] checkKey(byte[] key) {
        if (key == null) {
            throw new InvalidInputException("key must not be null");
        }
        return key;
    }
    
    private static byte[] checkKey(String key) {
        if (key == null) {
            throw new InvalidInputException("key must not be null");
        }
        return stringToBytes(key);
    }
    
    protected long getIndex(long hashVal) {
        return hashVal % size;
    }
    
    /**
     * @return the {@code numHash} bit positions probed for {@code key}, in seed order
     */
    public long[] getIndices(byte[] key) {
        final long[] hashVals = hashFunction.getHashValues(checkKey(key));
        for (int h=0; h<numHash; ++h) {
            hashVals[h] = getIndex(hashVals[h]);
        }
        return hashVals;
    }
    
    public long[] getIndices(String key) {
        return getIndices(checkKey(key));
    }
    
    @Override
    public void add(byte[] key) {
        final long[] hashVals = new long[numHash];
        hashFunction.getHashValues(checkKey(key), hashVals);
        add(hashVals);
    }
    
    @Override
    public void add(String key) {
        add(checkKey(key));
    }
    
    private void add(final long[] hashVals) {
        for (int h=0; h<numHash; ++h) {
            bitArray.set(getIndex(hashVals[h]));
        }
    }
    
    @Override
    public boolean lookup(byte[] key) {
        final long[] hashVals = new long[numHash];
        hashFunction.getHashValues(checkKey(key), hashVals);
        return lookup(hashVals);
    }
    
    @Override
    public boolean lookup(String key) {
        return lookup(checkKey(key));
    }
    
    private boolean lookup(final long[] hashVals) {
        for (int h=0; h<numHash; ++h) {
            if (!bitArray.get(getIndex(hashVals[h]))) {
                return false;
            }
        }
        
        return true;
    }
    
    /**
     * Adds {@code key} and reports whether it was possibly present beforehand.
     */
    @Override
    public boolean lookupThenAdd(byte[] key) {
        final long[] hashVals = new long[numHash];
        hashFunction.getHashValues(checkKey(key), hashVals);
        
        boolean found = true;
        for (int h=0; h<numHash; ++h) {
            found = bitArray.getAndSet(getIndex(hashVals[h])) && found;
        }
        
        return found;
    }
    
    @Override
    public boolean lookupThenAdd(String key) {
        return lookupThenAdd(checkKey(key));
    }
    
    /**
     * Theoretical false positive probability after {@code numElements} distinct insertions.
     * <pre>
     * (1 - e(-kn/m))^k
     * k = num hash
     * m = size
     * n = numElements
     * </pre>
     * The filter does not count insertions, so the result is only as accurate as {@code numElements}.
     * 
     * @param numElements - number of distinct elements added, must not be negative
     * @return probability in [0, 1]
     */
    @Override
    public double getFPR(long numElements) {
        if (numElements < 0) {
            throw new InvalidInputException("number of elements must not be negative: " + numElements);
        }
        
        double knm = (double) numHash * (double) numElements / (double) size;
        return pow(1 - exp(-knm), numHash);
    }
    
    public double getFPRPercent(long numElements) {
        return getFPR(numElements) * 100;
    }
    
    public String describeFPR(long numElements) {
        return "False positivity rate is " + getFPRPercent(numElements) + "%";
    }
    
    /**
     * False positive probability estimated from the fraction of bits currently set.
     */
    public double getOccupancyFPR() {
        return pow((double) getPopCount() / (double) size, numHash);
    }
    
    public long getPopCount() {
        return bitArray.popCount();
    }
    
    /**
     * Number of bits needed to hold {@code expNumElements} at the given false positive rate.
     */
    public static long getExpectedSize(long expNumElements, double fpr, int numHash) {
        if (expNumElements <= 0) {
            throw new InvalidInputException("expected number of elements must be positive: " + expNumElements);
        }
        if (!(fpr > 0 && fpr < 1)) {
            throw new InvalidInputException("false positive rate must be in (0, 1): " + fpr);
        }
        if (numHash <= 0) {
            throw new InvalidInputException("number of hash functions must be positive: " + numHash);
        }
        
        double r = (double) (-numHash) / log(1 - exp(log(fpr) / (double) numHash));
        return (long) Math.ceil(expNumElements * r);
    }
    
    /**
     * Number of hash functions minimizing the false positive rate for
     * {@code expNumElements} elements in {@code size} bits.
     */
    public static int getOptimalNumHash(long expNumElements, long size) {
        if (expNumElements <= 0) {
            throw new InvalidInputException("expected number of elements must be positive: " + expNumElements);
        }
        if (size <= 0) {
            throw new InvalidInputException("size must be positive: " + size);
        }
        
        // (m / n) * log(2), but avoid truncation due to division!
        long numHash = Math.round((double) size / expNumElements * log(2));
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, numHash));
    }
    
    /**
     * @return a copy of the bit array; changes to it do not affect this filter
     */
    public AbstractLargeBitBuffer getBitmap() {
        return bitArray.copy();
    }
    
    public long[] getSeeds() {
        return hashFunction.getSeeds();
    }
    
    public long getSize() {
        return size;
    }
    
    public int getNumHash() {
        return numHash;
    }
    
    public boolean equivalent(BloomFilter bf) {
        return this.size == bf.size && 
                this.numHash == bf.numHash &&
                BufferComparator.equivalentBitBuffers(bitArray, bf.bitArray);
    }
}
