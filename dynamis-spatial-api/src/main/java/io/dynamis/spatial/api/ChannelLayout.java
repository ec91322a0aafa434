package io.dynamis.spatial.api;

/**
 * Named multi-channel layout conventions checked by channel interleaving.
 *
 * SSR: fixed 360-channel surround layout, one channel per degree of azimuth.
 *      Interleaving left/right matrices for this layout yields 720 output channels.
 */
public enum ChannelLayout {
    SSR(360);

    private final int channelCount;

    ChannelLayout(int channelCount) {
        this.channelCount = channelCount;
    }

    /** Number of channels (rows) each input matrix must have for this layout. */
    public int channelCount() {
        return channelCount;
    }
}
