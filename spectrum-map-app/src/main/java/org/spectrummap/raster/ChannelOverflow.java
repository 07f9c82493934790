package org.spectrummap.raster;

/**
 * How a color channel value outside of [0, 255] is reduced to a single byte.
 */
public enum ChannelOverflow {

    /** Keep the low eight bits of the truncated value (an unchecked 8-bit cast). */
    WRAP {
        @Override
        public int toByte(final double channelValue) {
            return ((int) channelValue) & 0xff;
        }
    },

    /** Saturate at 0 and 255. */
    CLAMP {
        @Override
        public int toByte(final double channelValue) {
            final int truncated = (int) channelValue;
            return Math.max(0, Math.min(255, truncated));
        }
    };

    /**
     * @param  channelValue  unscaled channel value, truncated toward zero before it is reduced.
     *
     * @return channel value in [0, 255].
     */
    public abstract int toByte(final double channelValue);
}
