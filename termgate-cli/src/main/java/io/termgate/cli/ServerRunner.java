package io.termgate.cli;

@FunctionalInterface
public interface ServerRunner {
    int run(TransportMode transport, String host, int port) throws Exception;
}
