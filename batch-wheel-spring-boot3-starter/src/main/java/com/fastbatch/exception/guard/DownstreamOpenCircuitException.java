package com.fastbatch.exception.guard;

public class DownstreamOpenCircuitException extends RuntimeException {
    public DownstreamOpenCircuitException(Throwable cause) { super("downstream circuit open", cause); }
}
