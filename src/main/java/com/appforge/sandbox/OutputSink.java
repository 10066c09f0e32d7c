package com.appforge.sandbox;

/**
 * Receives command output incrementally while it is produced.
 */
@FunctionalInterface
public interface OutputSink {

    enum Channel { STDOUT, STDERR }

    OutputSink NONE = (channel, chunk) -> { };

    void accept(Channel channel, String chunk);
}
