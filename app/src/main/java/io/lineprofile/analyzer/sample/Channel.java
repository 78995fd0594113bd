package io.lineprofile.analyzer.sample;

import java.util.Locale;

/**
 * Colour channels of a pixel, declared in the native blue-first order of the decoded image data.
 */
public enum Channel {
    BLUE(0, 0),
    GREEN(1, 8),
    RED(2, 16);

    private final int nativeIndex;
    private final int argbShift;

    Channel(int nativeIndex, int argbShift) {
        this.nativeIndex = nativeIndex;
        this.argbShift = argbShift;
    }

    /**
     * Position of this channel in a (blue, green, red) triple.
     */
    public int nativeIndex() {
        return nativeIndex;
    }

    /**
     * Extracts this channel from a packed {@code 0xAARRGGBB} value.
     */
    public int fromArgb(int argb) {
        return (argb >>> argbShift) & 0xFF;
    }

    public int toArgb(int value) {
        return (value & 0xFF) << argbShift;
    }

    public String displayName() {
        String name = name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
