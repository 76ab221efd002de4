package io.github.drompincen.devgateway.runtime.process;

public interface ProcessDriver {

    TerminalProcess spawn(SpawnRequest request, ProcessListener listener) throws ProcessSpawnException;
}
