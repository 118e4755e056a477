/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.OutputSlice;

import java.util.ArrayList;
import java.util.List;

/**
 * Splitting and truncation arithmetic for task output.
 *
 * <p>
 * Pure functions, independent of any channel: the first slice is at most
 * {@code firstLimit} characters, every following slice at most
 * {@code chunkSize}. For text of length {@code L > firstLimit} the slice count
 * is {@code 1 + ceil((L - firstLimit) / chunkSize)}. Concatenating the slices
 * reproduces the input exactly. Lengths are counted in UTF-16 characters; a
 * boundary that would separate a surrogate pair moves one character earlier.
 */
public final class OutputChunker {

    private OutputChunker() {
    }

    /**
     * Splits {@code text} into ordered, labelled slices.
     *
     * @return a single slice when the text fits in {@code firstLimit}, an empty
     *         list for empty text
     */
    public static List<OutputSlice> split(String text, int firstLimit, int chunkSize) {
        if (firstLimit <= 0 || chunkSize <= 0) {
            throw new IllegalArgumentException("Limits must be positive: " + firstLimit + ", " + chunkSize);
        }
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> pieces = new ArrayList<>();
        int start = 0;
        int limit = firstLimit;
        while (start < text.length()) {
            int end = boundary(text, start, limit);
            pieces.add(text.substring(start, end));
            start = end;
            limit = chunkSize;
        }

        int total = pieces.size();
        List<OutputSlice> slices = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            slices.add(new OutputSlice(i + 1, total, pieces.get(i)));
        }
        return slices;
    }

    /**
     * Expected number of slices for text of the given length.
     */
    public static int sliceCount(int length, int firstLimit, int chunkSize) {
        if (length <= 0) {
            return 0;
        }
        if (length <= firstLimit) {
            return 1;
        }
        int remaining = length - firstLimit;
        return 1 + (remaining + chunkSize - 1) / chunkSize;
    }

    /**
     * Cuts {@code text} to at most {@code cap} characters.
     *
     * @return the text unchanged when it fits
     */
    public static String truncate(String text, int cap) {
        if (text == null || text.length() <= cap) {
            return text;
        }
        return text.substring(0, boundary(text, 0, cap));
    }

    private static int boundary(String text, int start, int limit) {
        int end = Math.min(text.length(), start + limit);
        if (end < text.length() && end > start + 1
                && Character.isHighSurrogate(text.charAt(end - 1))
                && Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return end;
    }
}
