package com.github.stormino.hlsdl.model;

import lombok.Value;

/**
 * One media segment to fetch. {@code index} is the playback position and the merge order.
 */
@Value
public class SegmentDescriptor {

    int index;
    String uri;
    String resolvedUrl;
}
