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
 * Byte storage addressed by a {@code long} index.
 */
public abstract class AbstractLargeByteBuffer {
    public abstract void set(long index, byte value);
    public abstract byte get(long index);
    public abstract long size();
    public abstract long bitPopCount();
    public abstract AbstractLargeByteBuffer copy();
}
