package com.linlay.chatrunner.frame;

public sealed interface FrameDecodeResult permits
        FrameDecodeResult.Decoded,
        FrameDecodeResult.DecodeError,
        FrameDecodeResult.EndOfStream,
        FrameDecodeResult.Blank {

    record Decoded(Frame frame) implements FrameDecodeResult {
        public Decoded {
            if (frame == null) {
                throw new IllegalArgumentException("frame must not be null");
            }
        }
    }

    /**
     * A line that could not be turned into a frame. The consumer drops it and keeps reading.
     */
    record DecodeError(String line, String reason) implements FrameDecodeResult {
    }

    record EndOfStream() implements FrameDecodeResult {
    }

    record Blank() implements FrameDecodeResult {
    }
}
