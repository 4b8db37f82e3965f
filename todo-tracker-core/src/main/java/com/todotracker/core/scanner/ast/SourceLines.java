package com.todotracker.core.scanner.ast;

import java.util.Arrays;

/**
 * Line and offset arithmetic over decoded source text.
 */
public final class SourceLines {

    private SourceLines() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the character offset at which each line starts; index 0 is line 1.
     */
    public static int[] lineStarts(String text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    /**
     * Converts a (1-based line, 0-based byte column) position into a character offset.
     *
     * @return character offset, or -1 if the line does not exist
     */
    public static int charOffset(String text, int[] lineStarts, int line, int byteColumn) {
        if (line < 1 || line > lineStarts.length) {
            return -1;
        }
        int index = lineStarts[line - 1];
        int bytes = 0;
        while (index < text.length() && bytes < byteColumn) {
            int codePoint = text.codePointAt(index);
            bytes += utf8Width(codePoint);
            index += Character.charCount(codePoint);
        }
        return index;
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }

    /**
     * Maps code point indices to character indices, or returns null when they coincide.
     */
    public static int[] codePointToCharIndex(String text) {
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints == text.length()) {
            return null;
        }
        int[] mapping = new int[codePoints + 1];
        int charIndex = 0;
        for (int cp = 0; cp < codePoints; cp++) {
            mapping[cp] = charIndex;
            charIndex += Character.charCount(text.codePointAt(charIndex));
        }
        mapping[codePoints] = text.length();
        return mapping;
    }
}
