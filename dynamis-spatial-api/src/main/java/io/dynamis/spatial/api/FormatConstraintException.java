package io.dynamis.spatial.api;

/**
 * Thrown when a channel matrix violates a named layout convention,
 * e.g. an SSR interleave over anything but 360 channels.
 */
public final class FormatConstraintException extends SpatialShapeException {

    private final ChannelLayout layout;
    private final int actualChannels;

    public FormatConstraintException(ChannelLayout layout, int actualChannels) {
        super(layout + " layout requires " + layout.channelCount()
            + " channels (Nchannel x Nsamples); actual = " + actualChannels);
        this.layout = layout;
        this.actualChannels = actualChannels;
    }

    /** The layout whose constraint was violated. */
    public ChannelLayout layout() { return layout; }

    /** Channel count actually supplied. */
    public int actualChannels() { return actualChannels; }
}
