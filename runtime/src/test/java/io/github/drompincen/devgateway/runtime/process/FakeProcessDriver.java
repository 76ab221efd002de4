package io.github.drompincen.devgateway.runtime.process;

import java.util.ArrayList;
import java.util.List;

public class FakeProcessDriver implements ProcessDriver {

    private final List<FakeProcess> spawned = new ArrayList<>();
    private ProcessSpawnException failure;

    public void failWith(ProcessSpawnException failure) {
        this.failure = failure;
    }

    public List<FakeProcess> spawned() {
        return spawned;
    }

    public FakeProcess last() {
        return spawned.get(spawned.size() - 1);
    }

    @Override
    public TerminalProcess spawn(SpawnRequest request, ProcessListener listener) throws ProcessSpawnException {
        if (failure != null) throw failure;
        FakeProcess process = new FakeProcess(spawned.size() + 1000, request, listener);
        spawned.add(process);
        return process;
    }

    public static class FakeProcess implements TerminalProcess {

        private final long pid;
        private final SpawnRequest request;
        private final ProcessListener listener;
        private final StringBuilder written = new StringBuilder();
        private int cols;
        private int rows;
        private boolean alive = true;

        FakeProcess(long pid, SpawnRequest request, ProcessListener listener) {
            this.pid = pid;
            this.request = request;
            this.listener = listener;
            this.cols = request.cols();
            this.rows = request.rows();
        }

        /** Simulates the shell echoing what it was sent. */
        public void output(String data) {
            listener.onOutput(data);
        }

        public void exit(int code) {
            alive = false;
            listener.onExit(code);
        }

        public SpawnRequest request() { return request; }
        public String written() { return written.toString(); }
        public int cols() { return cols; }
        public int rows() { return rows; }

        @Override
        public long pid() { return pid; }

        @Override
        public void write(String data) {
            written.append(data);
        }

        @Override
        public void resize(int cols, int rows) {
            this.cols = cols;
            this.rows = rows;
        }

        @Override
        public void kill() {
            alive = false;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
