// Protocol Buffers - Google's data interchange format
// Copyright 2008 Google Inc.  All rights reserved.
// https://developers.google.com/protocol-buffers/
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are
// met:
//
//     * Redistributions of source code must retain the above copyright
// notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above
// copyright notice, this list of conditions and the following disclaimer
// in the documentation and/or other materials provided with the
// distribution.
//     * Neither the name of Google Inc. nor the names of its
// contributors may be used to endorse or promote products derived from
// this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
// "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
// LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
// A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
// OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
// SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
// LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
// DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
// THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
// OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.


package com.hellblazer.lithos.common;

import java.util.Arrays;

/**
 * Growable float buffer used to assemble flat geometry arrays without boxing
 */
public final class FloatArrayList {

    private static final int DEFAULT_CAPACITY = 16;

    /** The backing store for the list. */
    private float[] array;
    private int     size;

    public FloatArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public FloatArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        array = new float[Math.max(1, initialCapacity)];
    }

    public void addFloat(float element) {
        ensureCapacity(size + 1);
        array[size++] = element;
    }

    public int size() {
        return size;
    }

    /**
     * @return a trimmed copy of the live elements
     */
    public float[] toArray() {
        return Arrays.copyOf(array, size);
    }

    private void ensureCapacity(int required) {
        if (required <= array.length) {
            return;
        }
        // Resize to 1.5x the size
        int length = Math.max(required, ((array.length * 3) / 2) + 1);
        array = Arrays.copyOf(array, length);
    }
}
